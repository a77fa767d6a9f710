package com.example.comicshelf.application.job;

import com.example.comicshelf.application.service.ScanJobService;
import com.example.comicshelf.application.service.SeriesSearchService;
import com.example.comicshelf.application.service.TagMetadataCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Cleans up after an unclean shutdown and warms derived data once the application is ready.
 */
@Service
public class StartupRecoveryJob {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryJob.class);

    private final ScanJobService scanJobService;
    private final SeriesSearchService seriesSearchService;
    private final TagMetadataCache tagMetadataCache;

    public StartupRecoveryJob(ScanJobService scanJobService,
                              SeriesSearchService seriesSearchService,
                              TagMetadataCache tagMetadataCache) {
        this.scanJobService = scanJobService;
        this.seriesSearchService = seriesSearchService;
        this.tagMetadataCache = tagMetadataCache;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        int recovered = scanJobService.recoverInterruptedJobs();
        log.info("STARTUP_RECOVERY interruptedJobs={}", recovered);
        try {
            seriesSearchService.rebuild();
        } catch (RuntimeException e) {
            log.warn("STARTUP_SEARCH_REBUILD_FAILED msg={}", e.getMessage(), e);
        }
        try {
            tagMetadataCache.getOrBuild();
        } catch (RuntimeException e) {
            log.warn("STARTUP_TAG_CACHE_WARMUP_FAILED msg={}", e.getMessage(), e);
        }
    }
}
