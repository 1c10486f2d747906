package com.couchapp.couch.dto.schedule.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.LocalDate;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class GenerateScheduleRequest {

    @NotNull
    private LocalDate startDate;

    @NotNull
    @Min(1)
    @Max(60)
    private Integer days;
}
