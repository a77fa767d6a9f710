package com.example.comicshelf.api.controller;

import com.example.comicshelf.api.request.RenameSeriesRequest;
import com.example.comicshelf.api.response.ApiResponse;
import com.example.comicshelf.api.response.SeriesRenameResponse;
import com.example.comicshelf.application.service.SeriesService;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/series")
public class SeriesController {

    private final SeriesService seriesService;

    public SeriesController(SeriesService seriesService) {
        this.seriesService = seriesService;
    }

    @PutMapping("/{id}/name")
    public ApiResponse<SeriesRenameResponse> rename(@PathVariable("id") Long id,
                                                    @Valid @RequestBody RenameSeriesRequest request) {
        return ApiResponse.success(seriesService.rename(id, request.getName()));
    }
}
