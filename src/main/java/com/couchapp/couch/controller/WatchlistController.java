package com.couchapp.couch.controller;

import com.couchapp.couch.dto.common.ApiResponse;
import com.couchapp.couch.dto.watchlist.request.*;
import com.couchapp.couch.dto.watchlist.response.FinishEntryResponse;
import com.couchapp.couch.dto.watchlist.response.QueueAvailabilityResponse;
import com.couchapp.couch.dto.watchlist.response.WatchlistEntryResponse;
import com.couchapp.couch.service.WatchlistService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/watchlist")
public class WatchlistController {

    private final WatchlistService watchlistService;

    @PostMapping("/list")
    public List<WatchlistEntryResponse> list() {
        return watchlistService.list();
    }

    @PostMapping("/get")
    public WatchlistEntryResponse get(@Valid @RequestBody WatchlistEntryRequest request) {
        return watchlistService.get(request.getEntryId());
    }

    @PostMapping("/follow")
    public ApiResponse<WatchlistEntryResponse> follow(@Valid @RequestBody FollowShowRequest request) {
        return ApiResponse.ok("Show added to queue", watchlistService.follow(request));
    }

    @PostMapping("/unfollow")
    public ApiResponse<Long> unfollow(@Valid @RequestBody WatchlistEntryRequest request) {
        return ApiResponse.ok("Show removed from watchlist", watchlistService.unfollow(request.getEntryId()));
    }

    @PostMapping("/reorder")
    public List<WatchlistEntryResponse> reorder(@Valid @RequestBody ReorderWatchlistRequest request) {
        return watchlistService.reorder(request.getOrderedIds());
    }

    @PostMapping("/promote")
    public ApiResponse<WatchlistEntryResponse> promote(@Valid @RequestBody WatchlistEntryRequest request) {
        return ApiResponse.ok("Show promoted to watching", watchlistService.promote(request.getEntryId()));
    }

    @PostMapping("/demote")
    public ApiResponse<WatchlistEntryResponse> demote(@Valid @RequestBody WatchlistEntryRequest request) {
        return ApiResponse.ok("Show moved back to queue", watchlistService.demote(request.getEntryId()));
    }

    @PostMapping("/finish")
    public ApiResponse<FinishEntryResponse> finish(@Valid @RequestBody FinishEntryRequest request) {
        FinishEntryResponse result = watchlistService.finish(request.getEntryId(), request.isAutoPromote());
        String message = result.isMovedToQueue()
                ? "Caught up; show moved back to queue until new episodes air"
                : "Show finished";
        return ApiResponse.ok(message, result);
    }

    @PostMapping("/set-days")
    public ApiResponse<WatchlistEntryResponse> setDays(@Valid @RequestBody SetWeekdaysRequest request) {
        return ApiResponse.ok("Weekdays updated", watchlistService.setWeekdays(request.getEntryId(), request.getWeekdays()));
    }

    @PostMapping("/progress")
    public ApiResponse<WatchlistEntryResponse> progress(@Valid @RequestBody UpdateProgressRequest request) {
        return ApiResponse.ok("Progress updated", watchlistService.updateProgress(request));
    }

    @PostMapping("/status")
    public ApiResponse<WatchlistEntryResponse> status(@Valid @RequestBody UpdateStatusRequest request) {
        return ApiResponse.ok("Status updated", watchlistService.updateStatus(request));
    }

    @PostMapping("/queue-availability")
    public List<QueueAvailabilityResponse> queueAvailability() {
        return watchlistService.queueAvailability();
    }
}
