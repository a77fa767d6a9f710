package com.example.comicshelf.api.controller;

import com.example.comicshelf.api.response.ApiResponse;
import com.example.comicshelf.api.response.SeriesSearchItemResponse;
import com.example.comicshelf.application.service.SeriesSearchService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/search")
public class SearchController {

    private final SeriesSearchService seriesSearchService;

    public SearchController(SeriesSearchService seriesSearchService) {
        this.seriesSearchService = seriesSearchService;
    }

    @GetMapping("/series")
    public ApiResponse<List<SeriesSearchItemResponse>> searchSeries(@RequestParam("q") String keyword) {
        return ApiResponse.success(seriesSearchService.search(keyword));
    }

    @PostMapping("/rebuild")
    public ApiResponse<Integer> rebuild() {
        return ApiResponse.success(seriesSearchService.rebuild());
    }
}
