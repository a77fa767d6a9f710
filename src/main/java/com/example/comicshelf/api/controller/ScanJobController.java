package com.example.comicshelf.api.controller;

import com.example.comicshelf.api.request.CreateScanJobRequest;
import com.example.comicshelf.api.response.ApiResponse;
import com.example.comicshelf.api.response.ScanJobDetailResponse;
import com.example.comicshelf.application.service.ScanJobService;
import com.example.comicshelf.common.exception.BusinessException;
import com.example.comicshelf.domain.enumtype.ScanType;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/scan-jobs")
public class ScanJobController {

    private final ScanJobService scanJobService;

    public ScanJobController(ScanJobService scanJobService) {
        this.scanJobService = scanJobService;
    }

    @PostMapping
    public ApiResponse<ScanJobDetailResponse> startScan(@Valid @RequestBody CreateScanJobRequest request) {
        if (ScanType.INCREMENTAL == request.getScanType()) {
            throw new BusinessException("400", "增量扫描仅由定时任务触发，请使用 FULL 或 RESCAN");
        }
        return ApiResponse.success(scanJobService.startScan(request.getScanType()));
    }

    @GetMapping("/latest")
    public ApiResponse<ScanJobDetailResponse> latest() {
        ScanJobDetailResponse response = scanJobService.getLatestJob();
        if (response == null) {
            return ApiResponse.fail("404", "暂无扫描任务");
        }
        return ApiResponse.success(response);
    }

    @GetMapping("/{id}")
    public ApiResponse<ScanJobDetailResponse> getJob(@PathVariable("id") Long id) {
        ScanJobDetailResponse response = scanJobService.getJob(id);
        if (response == null) {
            return ApiResponse.fail("404", "任务不存在");
        }
        return ApiResponse.success(response);
    }

    @PostMapping("/cancel")
    public ApiResponse<String> cancel() {
        if (!scanJobService.cancelRunningJob()) {
            return ApiResponse.fail("404", "当前没有运行中的扫描任务");
        }
        return ApiResponse.success("CANCEL_REQUESTED");
    }
}
