package com.example.comicshelf.application.job;

import com.example.comicshelf.api.response.ScanJobDetailResponse;
import com.example.comicshelf.application.service.ScanJobService;
import com.example.comicshelf.common.config.AppScanProperties;
import com.example.comicshelf.common.exception.BusinessException;
import com.example.comicshelf.domain.enumtype.ScanType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class IncrementalScanJob {

    private static final Logger log = LoggerFactory.getLogger(IncrementalScanJob.class);

    private final AppScanProperties appScanProperties;
    private final ScanJobService scanJobService;

    public IncrementalScanJob(AppScanProperties appScanProperties, ScanJobService scanJobService) {
        this.appScanProperties = appScanProperties;
        this.scanJobService = scanJobService;
    }

    @Scheduled(cron = "${app.scan.incremental-cron:0 0 3 * * ?}")
    public void run() {
        if (!appScanProperties.isIncrementalEnabled()) {
            log.debug("Incremental scan skipped: app.scan.incremental-enabled=false");
            return;
        }
        log.info("Incremental scan schedule triggered, cron={}", appScanProperties.getIncrementalCron());
        try {
            ScanJobDetailResponse job = scanJobService.startScan(ScanType.INCREMENTAL);
            log.info("Incremental scan job created, jobId={}", job == null ? null : job.getJobId());
        } catch (BusinessException e) {
            if ("409".equals(e.getCode())) {
                log.info("Incremental scan skipped due to active scan job");
            } else {
                log.warn("Incremental scan job create failed, code={}, msg={}", e.getCode(), e.getMessage());
            }
        } catch (Exception e) {
            log.warn("Incremental scan job create failed unexpectedly", e);
        }
    }
}
