package com.example.comicshelf.application.service;

import com.example.comicshelf.common.config.AppScanProperties;
import com.example.comicshelf.domain.model.InspectionResult;
import com.example.comicshelf.infrastructure.archive.ArchiveInspector;
import com.example.comicshelf.infrastructure.persistence.entity.ComicEntity;
import com.example.comicshelf.infrastructure.persistence.mapper.ComicMapper;
import com.example.comicshelf.infrastructure.persistence.model.ComicProcessingUpdate;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Phase 2 of a scan: drains pending comics in rounds, inspecting each round on the worker pool and
 * writing the round back with one statement.
 */
@Service
public class ComicProcessingService {

    private static final Logger log = LoggerFactory.getLogger(ComicProcessingService.class);

    private final ComicMapper comicMapper;
    private final ArchiveInspector archiveInspector;
    private final ExecutorService comicProcessingExecutor;
    private final AppScanProperties appScanProperties;
    private final MeterRegistry meterRegistry;

    public ComicProcessingService(ComicMapper comicMapper,
                                  ArchiveInspector archiveInspector,
                                  @Qualifier("comicProcessingExecutor") ExecutorService comicProcessingExecutor,
                                  AppScanProperties appScanProperties,
                                  ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.comicMapper = comicMapper;
        this.archiveInspector = archiveInspector;
        this.comicProcessingExecutor = comicProcessingExecutor;
        this.appScanProperties = appScanProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public ProcessingStats process(ScanJobProgress progress, BooleanSupplier cancelSignal, Runnable progressListener) {
        ProcessingStats stats = new ProcessingStats();
        int batchSize = Math.max(1, appScanProperties.getProcessBatchSize());
        int pending = comicMapper.countPending();
        progress.setPhase(ScanJobProgress.PHASE_PROCESS);
        progress.setTotalComics(pending);
        progressListener.run();
        log.info("COMIC_PROCESS_START pending={} batchSize={}", pending, batchSize);

        while (true) {
            if (cancelSignal != null && cancelSignal.getAsBoolean()) {
                stats.setCancelled(true);
                log.info("COMIC_PROCESS_CANCELED processed={} total={}", stats.getItems(), pending);
                break;
            }
            List<ComicEntity> batch = comicMapper.selectPending(batchSize);
            if (batch == null || batch.isEmpty()) {
                break;
            }
            long startNanos = System.nanoTime();
            List<InspectionResult> results = inspectBatch(batch);

            List<ComicProcessingUpdate> updates = new ArrayList<>(results.size());
            for (InspectionResult result : results) {
                updates.add(apply(result, progress, stats));
            }
            comicMapper.batchUpdateProcessing(updates);

            stats.setBatches(stats.getBatches() + 1);
            progress.addProcessedComics(results.size());
            progress.setCurrentFile(batch.get(batch.size() - 1).getFilename());
            progressListener.run();
            recordDuration("comicshelf.scan.process.batch", System.nanoTime() - startNanos);
            log.debug("COMIC_PROCESS_BATCH batch={} size={} processed={}/{}",
                    stats.getBatches(), batch.size(), progress.getProcessedComics(), pending);
        }

        log.info("COMIC_PROCESS_FINISH items={} batches={} pageErrors={} thumbnailErrors={} cancelled={}",
                stats.getItems(), stats.getBatches(), progress.getPageErrors(), progress.getThumbnailErrors(),
                stats.isCancelled());
        return stats;
    }

    /**
     * Fans one round out to the pool and collects every result. A task that throws is turned into a
     * failed result for its comic only.
     */
    List<InspectionResult> inspectBatch(List<ComicEntity> batch) {
        CompletionService<InspectionResult> completionService =
                new ExecutorCompletionService<>(comicProcessingExecutor);
        Map<Future<InspectionResult>, ComicEntity> submitted = new HashMap<>();
        for (ComicEntity comic : batch) {
            Future<InspectionResult> future = completionService.submit(
                    () -> archiveInspector.inspect(comic.getId(), Paths.get(comic.getPath())));
            submitted.put(future, comic);
        }

        List<InspectionResult> results = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            Future<InspectionResult> future;
            try {
                future = completionService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Comic processing interrupted", e);
            }
            ComicEntity comic = submitted.get(future);
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Comic processing interrupted", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("COMIC_PROCESS_WORKER_FAILED comicId={} path={}", comic.getId(), comic.getPath(), cause);
                results.add(InspectionResult.failed(comic.getId(), comic.getPath(),
                        comic.getFilename() + ": worker failed: " + cause));
            }
        }
        return results;
    }

    private ComicProcessingUpdate apply(InspectionResult result, ScanJobProgress progress, ProcessingStats stats) {
        stats.setItems(stats.getItems() + 1);
        for (String error : result.getErrors()) {
            progress.addError(error);
        }

        if (result.isFileMissing() || (result.hasErrors() && result.getPages() <= 0)) {
            progress.addPageErrors(1);
            progress.addThumbnailErrors(1);
            incrementCounter("comicshelf.scan.items", 1, "result", result.isFileMissing() ? "missing" : "failed");
            return new ComicProcessingUpdate(result.getComicId(), 0, 0, null);
        }

        if (result.getPages() > 0) {
            progress.addProcessedPages(1);
        } else {
            progress.addPageErrors(1);
        }
        if (result.isHasThumbnail()) {
            progress.addProcessedThumbnails(1);
        } else {
            progress.addThumbnailErrors(1);
        }
        progress.addThumbBytesWritten(result.getBytesWritten());
        progress.addThumbBytesSaved(result.getBytesSaved());
        incrementCounter("comicshelf.scan.items", 1, "result", result.isHasThumbnail() ? "ok" : "no_thumbnail");
        return new ComicProcessingUpdate(
                result.getComicId(),
                Math.max(0, result.getPages()),
                result.isHasThumbnail() ? 1 : 0,
                result.isHasThumbnail() ? result.getThumbnailFormat() : null);
    }

    private void incrementCounter(String name, double value, String... tags) {
        if (meterRegistry == null || value <= 0) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment(value);
        } catch (Exception e) {
            log.debug("Metric counter update failed, name={}", name, e);
        }
    }

    private void recordDuration(String name, long nanos, String... tags) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name, tags).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.debug("Metric timer update failed, name={}", name, e);
        }
    }

    @Data
    public static class ProcessingStats {

        private int items;
        private int batches;
        private boolean cancelled;
    }
}
