package com.example.comicshelf.application.service;

import com.example.comicshelf.api.response.ScanJobDetailResponse;
import com.example.comicshelf.common.config.AppScanProperties;
import com.example.comicshelf.common.exception.BusinessException;
import com.example.comicshelf.common.util.FileSizeFormatter;
import com.example.comicshelf.domain.enumtype.ScanJobStatus;
import com.example.comicshelf.domain.enumtype.ScanType;
import com.example.comicshelf.infrastructure.persistence.entity.ScanJobEntity;
import com.example.comicshelf.infrastructure.persistence.mapper.ComicMapper;
import com.example.comicshelf.infrastructure.persistence.mapper.ScanJobMapper;
import com.example.comicshelf.infrastructure.persistence.mapper.SeriesMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Creates scan jobs, enforces the one-running-job rule and drives Phase 1 and Phase 2 on the scan
 * executor.
 */
@Service
public class ScanJobService {

    private static final Logger log = LoggerFactory.getLogger(ScanJobService.class);

    public static final String INTERRUPTED_SUMMARY = "Scan interrupted (server restart or crash)";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<List<String>>() {
    };

    private final ScanJobMapper scanJobMapper;
    private final ComicMapper comicMapper;
    private final SeriesMapper seriesMapper;
    private final LibrarySyncService librarySyncService;
    private final ComicProcessingService comicProcessingService;
    private final SeriesSearchService seriesSearchService;
    private final TagMetadataCache tagMetadataCache;
    private final ExecutorService scanJobExecutor;
    private final AppScanProperties appScanProperties;
    private final ObjectMapper objectMapper;

    public ScanJobService(ScanJobMapper scanJobMapper,
                          ComicMapper comicMapper,
                          SeriesMapper seriesMapper,
                          LibrarySyncService librarySyncService,
                          ComicProcessingService comicProcessingService,
                          SeriesSearchService seriesSearchService,
                          TagMetadataCache tagMetadataCache,
                          @Qualifier("scanJobExecutor") ExecutorService scanJobExecutor,
                          AppScanProperties appScanProperties,
                          ObjectMapper objectMapper) {
        this.scanJobMapper = scanJobMapper;
        this.comicMapper = comicMapper;
        this.seriesMapper = seriesMapper;
        this.librarySyncService = librarySyncService;
        this.comicProcessingService = comicProcessingService;
        this.seriesSearchService = seriesSearchService;
        this.tagMetadataCache = tagMetadataCache;
        this.scanJobExecutor = scanJobExecutor;
        this.appScanProperties = appScanProperties;
        this.objectMapper = objectMapper;
    }

    /**
     * Starts a scan in the background.
     *
     * @throws BusinessException code 409 when a scan is already running, TASK_EXECUTOR_REJECTED when
     *                           the scan executor refuses the job
     */
    public ScanJobDetailResponse startScan(ScanType scanType) {
        if (scanJobMapper.countRunning() > 0) {
            throw activeScanConflict();
        }
        ScanJobEntity entity = new ScanJobEntity();
        entity.setScanType(scanType.name());
        entity.setPhase(ScanJobProgress.PHASE_QUEUED);
        try {
            scanJobMapper.insertRunning(entity);
        } catch (DuplicateKeyException e) {
            // lost the race against a concurrent start
            throw activeScanConflict();
        }
        Long jobId = entity.getId();
        log.info("SCAN_JOB_CREATED jobId={} type={}", jobId, scanType);

        try {
            scanJobExecutor.submit(() -> runJob(jobId, scanType));
        } catch (RejectedExecutionException e) {
            scanJobMapper.markFinished(jobId, ScanJobStatus.FAILED.value(),
                    "任务调度失败: " + truncate(e.getMessage(), 400));
            throw new BusinessException("TASK_EXECUTOR_REJECTED", "任务调度失败，请稍后重试");
        }
        return getJob(jobId);
    }

    public ScanJobDetailResponse getJob(Long jobId) {
        ScanJobEntity entity = scanJobMapper.selectById(jobId);
        return entity == null ? null : toDetailResponse(entity);
    }

    public ScanJobDetailResponse getLatestJob() {
        ScanJobEntity entity = scanJobMapper.selectLatest();
        return entity == null ? null : toDetailResponse(entity);
    }

    /**
     * Flags the running job for cooperative cancellation.
     *
     * @return false when no job is running
     */
    public boolean cancelRunningJob() {
        int affected = scanJobMapper.requestCancel();
        if (affected > 0) {
            log.info("SCAN_JOB_CANCEL_REQUESTED jobs={}", affected);
            return true;
        }
        log.info("SCAN_JOB_CANCEL_IGNORED reason=no_running_job");
        return false;
    }

    /**
     * Marks every job left in {@code running} by a previous process as failed.
     */
    public int recoverInterruptedJobs() {
        int recovered = scanJobMapper.markAllRunningFailed(INTERRUPTED_SUMMARY);
        if (recovered > 0) {
            log.warn("SCAN_JOB_RECOVERED interruptedJobs={}", recovered);
        }
        return recovered;
    }

    void runJob(Long jobId, ScanType scanType) {
        ScanJobProgress progress = new ScanJobProgress(appScanProperties.getMaxErrors(),
                appScanProperties.getMaxErrorLength());
        BooleanSupplier cancelSignal = () -> isCancelRequested(jobId);
        Runnable progressListener = () -> persistProgress(jobId, progress);
        log.info("SCAN_JOB_RUNNING jobId={} type={}", jobId, scanType);
        try {
            if (ScanType.RESCAN == scanType) {
                progress.setPhase(ScanJobProgress.PHASE_RESETTING);
                progressListener.run();
                wipeLibrary();
            }

            progress.setPhase(ScanJobProgress.PHASE_SYNC);
            progressListener.run();
            LibrarySyncService.SyncStats syncStats = librarySyncService.sync(progress, cancelSignal, progressListener);
            if (syncStats.isCancelled()) {
                finish(jobId, progress, ScanJobStatus.CANCELLED, "任务被取消");
                return;
            }

            if (ScanType.INCREMENTAL != scanType) {
                int requeued = comicMapper.resetEmptyProcessed();
                if (requeued > 0) {
                    log.info("SCAN_JOB_REQUEUED jobId={} emptyComics={}", jobId, requeued);
                }
            }

            ComicProcessingService.ProcessingStats processingStats =
                    comicProcessingService.process(progress, cancelSignal, progressListener);
            if (processingStats.isCancelled()) {
                finish(jobId, progress, ScanJobStatus.CANCELLED, "任务被取消");
                return;
            }
            progress.setPhase(ScanJobProgress.PHASE_DONE);
            progress.setCurrentFile(null);
            finish(jobId, progress, ScanJobStatus.COMPLETED, null);
        } catch (Exception e) {
            log.error("Scan job failed, jobId={}", jobId, e);
            try {
                persistProgress(jobId, progress);
            } catch (RuntimeException persistError) {
                log.warn("SCAN_JOB_PROGRESS_PERSIST_FAILED jobId={} msg={}", jobId, persistError.getMessage());
            }
            scanJobMapper.markFinished(jobId, ScanJobStatus.FAILED.value(), truncate(describe(e), 1000));
        }
    }

    /**
     * Rescan preparation: drops every comic and series (dependents cascade) and the search index.
     */
    void wipeLibrary() {
        int comics = comicMapper.deleteAll();
        int series = seriesMapper.deleteAll();
        seriesSearchService.clear();
        tagMetadataCache.invalidate();
        log.info("SCAN_JOB_LIBRARY_WIPED comics={} series={}", comics, series);
    }

    private void finish(Long jobId, ScanJobProgress progress, ScanJobStatus status, String summary) {
        persistProgress(jobId, progress);
        int rows = scanJobMapper.markFinished(jobId, status.value(), summary);
        if (rows == 0) {
            log.warn("SCAN_JOB_FINISH_REJECTED jobId={} expectStatus=running", jobId);
            return;
        }
        log.info("SCAN_JOB_RESULT jobId={} status={} new={} changed={} deleted={} processed={} pageErrors={} "
                        + "thumbnails={} thumbnailErrors={} thumbBytes={} savedBytes={}",
                jobId, status.value(), progress.getNewComics(), progress.getChangedComics(),
                progress.getDeletedComics(), progress.getProcessedComics(), progress.getPageErrors(),
                progress.getProcessedThumbnails(), progress.getThumbnailErrors(),
                FileSizeFormatter.format(progress.getThumbBytesWritten()),
                FileSizeFormatter.format(progress.getThumbBytesSaved()));
    }

    private void persistProgress(Long jobId, ScanJobProgress progress) {
        scanJobMapper.updateProgress(progress.toEntity(jobId, errorsToJson(progress.getErrors())));
    }

    private boolean isCancelRequested(Long jobId) {
        Integer flag = scanJobMapper.selectCancelRequested(jobId);
        return flag != null && flag == 1;
    }

    private BusinessException activeScanConflict() {
        return new BusinessException("409", "已有扫描任务正在运行", "请等待当前任务完成或先取消");
    }

    private String errorsToJson(List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(errors);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize scan errors", e);
        }
    }

    private List<String> errorsFromJson(String json) {
        if (json == null || json.isEmpty()) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("SCAN_JOB_ERRORS_UNREADABLE msg={}", e.getMessage());
            return Collections.singletonList(json);
        }
    }

    private String describe(Exception e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : message;
    }

    private String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private ScanJobDetailResponse toDetailResponse(ScanJobEntity entity) {
        long written = nullSafeLong(entity.getThumbBytesWritten());
        long saved = nullSafeLong(entity.getThumbBytesSaved());
        return new ScanJobDetailResponse(
                entity.getId(),
                entity.getScanType(),
                entity.getStatus(),
                entity.getPhase(),
                entity.getCurrentFile(),
                nullSafeInt(entity.getTotalComics()),
                nullSafeInt(entity.getProcessedComics()),
                nullSafeInt(entity.getNewComics()),
                nullSafeInt(entity.getChangedComics()),
                nullSafeInt(entity.getDeletedComics()),
                nullSafeInt(entity.getProcessedPages()),
                nullSafeInt(entity.getPageErrors()),
                nullSafeInt(entity.getProcessedThumbnails()),
                nullSafeInt(entity.getThumbnailErrors()),
                written,
                saved,
                FileSizeFormatter.format(written),
                FileSizeFormatter.format(saved),
                errorsFromJson(entity.getErrors()),
                entity.getErrorSummary(),
                nullSafeInt(entity.getCancelRequested()) == 1,
                entity.getStartedAt(),
                entity.getCompletedAt()
        );
    }

    private int nullSafeInt(Integer value) {
        return value == null ? 0 : value;
    }

    private long nullSafeLong(Long value) {
        return value == null ? 0L : value;
    }
}
