package com.example.comicshelf.api.controller;

import com.example.comicshelf.api.request.NsfwOverrideRequest;
import com.example.comicshelf.api.response.ApiResponse;
import com.example.comicshelf.api.response.NsfwRecomputeResponse;
import com.example.comicshelf.application.service.NsfwRecomputeService;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/nsfw")
public class NsfwController {

    private final NsfwRecomputeService nsfwRecomputeService;

    public NsfwController(NsfwRecomputeService nsfwRecomputeService) {
        this.nsfwRecomputeService = nsfwRecomputeService;
    }

    @PostMapping("/recompute")
    public ApiResponse<NsfwRecomputeResponse> recompute() {
        return ApiResponse.success(nsfwRecomputeService.recomputeAll());
    }

    /**
     * Returns the resulting NSFW flag of the series.
     */
    @PutMapping("/series/{id}/override")
    public ApiResponse<Boolean> setOverride(@PathVariable("id") Long id, @RequestBody NsfwOverrideRequest request) {
        return ApiResponse.success(nsfwRecomputeService.setOverride(id, request.getOverride()));
    }
}
