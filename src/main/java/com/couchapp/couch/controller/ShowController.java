package com.couchapp.couch.controller;

import com.couchapp.couch.catalog.ShowCatalogService;
import com.couchapp.couch.catalog.model.ShowSearchResult;
import com.couchapp.couch.domain.show.Show;
import com.couchapp.couch.dto.show.request.GetShowRequest;
import com.couchapp.couch.dto.show.request.SearchShowsRequest;
import com.couchapp.couch.dto.show.response.ShowResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/shows")
public class ShowController {

    private final ShowCatalogService showCatalogService;

    @PostMapping("/search")
    public List<ShowSearchResult> search(@Valid @RequestBody SearchShowsRequest request) {
        return showCatalogService.search(request.getQuery());
    }

    @PostMapping("/get")
    public ShowResponse get(@Valid @RequestBody GetShowRequest request) {
        Show show = request.isRefresh()
                ? showCatalogService.cacheShow(request.getCatalogId())
                : showCatalogService.getShow(request.getCatalogId());
        return ShowResponse.of(show);
    }
}
