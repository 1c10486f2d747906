package com.couchapp.couch.controller;

import com.couchapp.couch.domain.planning.DayCapacity;
import com.couchapp.couch.dto.days.request.BestDayRequest;
import com.couchapp.couch.dto.days.request.DayCapacityRequest;
import com.couchapp.couch.dto.days.response.BestDayResponse;
import com.couchapp.couch.dto.days.response.DayCapacityResponse;
import com.couchapp.couch.service.DayAssignmentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/days")
public class DayController {

    private final DayAssignmentService dayAssignmentService;

    @PostMapping("/capacity")
    public List<DayCapacityResponse> capacity() {
        return dayAssignmentService.capacityReport();
    }

    @PostMapping("/get")
    public DayCapacityResponse get(@Valid @RequestBody DayCapacityRequest request) {
        int weekday = request.getWeekday();
        DayCapacity cap = dayAssignmentService.dayCapacity(weekday);

        return DayCapacityResponse.builder()
                .weekday(weekday)
                .totalMinutes(cap.totalMinutes())
                .usedMinutes(cap.usedMinutes())
                .availableMinutes(cap.availableMinutes())
                .genres(dayAssignmentService.genresOnDay(weekday))
                .build();
    }

    @PostMapping("/best-day")
    public BestDayResponse bestDay(@Valid @RequestBody BestDayRequest request) {
        int weekday = dayAssignmentService.bestDayForShow(request.getRuntime(),
                request.getGenres() == null ? List.of() : request.getGenres());
        return BestDayResponse.builder().weekday(weekday).build();
    }
}
