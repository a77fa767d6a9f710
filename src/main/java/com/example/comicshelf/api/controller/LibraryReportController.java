package com.example.comicshelf.api.controller;

import com.example.comicshelf.api.response.ApiResponse;
import com.example.comicshelf.api.response.DuplicateGroupResponse;
import com.example.comicshelf.api.response.GapReportResponse;
import com.example.comicshelf.api.response.HashBackfillResponse;
import com.example.comicshelf.application.service.LibraryReportService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/reports")
public class LibraryReportController {

    private final LibraryReportService libraryReportService;

    public LibraryReportController(LibraryReportService libraryReportService) {
        this.libraryReportService = libraryReportService;
    }

    @GetMapping("/duplicates")
    public ApiResponse<List<DuplicateGroupResponse>> duplicates() {
        return ApiResponse.success(libraryReportService.duplicates());
    }

    @PostMapping("/duplicates/hashes")
    public ApiResponse<HashBackfillResponse> computeHashes(
            @RequestParam(value = "limit", defaultValue = "200") int limit) {
        return ApiResponse.success(libraryReportService.computeMissingHashes(limit));
    }

    @GetMapping("/gaps")
    public ApiResponse<List<GapReportResponse>> gaps() {
        return ApiResponse.success(libraryReportService.gaps());
    }
}
