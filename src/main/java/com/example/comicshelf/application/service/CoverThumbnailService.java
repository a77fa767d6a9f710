package com.example.comicshelf.application.service;

import com.example.comicshelf.common.config.AppThumbnailProperties;
import com.example.comicshelf.common.exception.BusinessException;
import com.example.comicshelf.common.util.ComicFilenameParser;
import com.example.comicshelf.domain.enumtype.ThumbnailFormat;
import com.example.comicshelf.domain.model.CoverImage;
import com.example.comicshelf.domain.model.InspectionResult;
import com.example.comicshelf.infrastructure.archive.ArchiveInspector;
import com.example.comicshelf.infrastructure.persistence.entity.ComicEntity;
import com.example.comicshelf.infrastructure.persistence.mapper.ComicMapper;
import com.example.comicshelf.infrastructure.thumbnail.ThumbnailEncoder;
import com.example.comicshelf.infrastructure.thumbnail.ThumbnailStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Serves a comic's cover thumbnail, extracting it on demand when the scan has not produced one yet.
 * Slow extractions are answered with a placeholder while the extraction finishes in the background.
 */
@Service
public class CoverThumbnailService {

    private static final Logger log = LoggerFactory.getLogger(CoverThumbnailService.class);

    private static final String PLACEHOLDER_CONTENT_TYPE = "image/png";

    private final ComicMapper comicMapper;
    private final ArchiveInspector archiveInspector;
    private final ThumbnailStore thumbnailStore;
    private final ThumbnailEncoder thumbnailEncoder;
    private final ExecutorService coverThumbnailExecutor;
    private final AppThumbnailProperties appThumbnailProperties;
    private final MeterRegistry meterRegistry;

    private volatile byte[] placeholder;

    public CoverThumbnailService(ComicMapper comicMapper,
                                 ArchiveInspector archiveInspector,
                                 ThumbnailStore thumbnailStore,
                                 ThumbnailEncoder thumbnailEncoder,
                                 @Qualifier("coverThumbnailExecutor") ExecutorService coverThumbnailExecutor,
                                 AppThumbnailProperties appThumbnailProperties,
                                 ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.comicMapper = comicMapper;
        this.archiveInspector = archiveInspector;
        this.thumbnailStore = thumbnailStore;
        this.thumbnailEncoder = thumbnailEncoder;
        this.coverThumbnailExecutor = coverThumbnailExecutor;
        this.appThumbnailProperties = appThumbnailProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public CoverImage getCover(String comicId) {
        ComicEntity comic = comicMapper.selectById(comicId);
        if (comic == null) {
            throw new BusinessException("404", "漫画不存在");
        }
        Path existing = thumbnailStore.find(comicId);
        if (existing != null) {
            incrementCounter("cached");
            return readCover(existing);
        }

        Future<Path> future;
        try {
            future = coverThumbnailExecutor.submit(() -> generate(comic));
        } catch (RejectedExecutionException e) {
            log.warn("COVER_ONDEMAND_REJECTED comicId={} msg={}", comicId, e.getMessage());
            incrementCounter("rejected");
            return placeholder();
        }

        long timeoutMs = Math.max(1L, appThumbnailProperties.getOnDemandTimeoutMs());
        try {
            Path generated = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (generated == null) {
                incrementCounter("failed");
                return placeholder();
            }
            incrementCounter("generated");
            return readCover(generated);
        } catch (TimeoutException e) {
            // the extraction keeps running and installs its result when done
            log.info("COVER_ONDEMAND_TIMEOUT comicId={} timeoutMs={}", comicId, timeoutMs);
            incrementCounter("timeout");
            return placeholder();
        } catch (ExecutionException e) {
            log.warn("COVER_ONDEMAND_FAILED comicId={}", comicId, e.getCause());
            incrementCounter("failed");
            return placeholder();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            incrementCounter("interrupted");
            return placeholder();
        }
    }

    /**
     * Extracts into a temp file and installs it unless another writer already produced the cover.
     *
     * @return the installed thumbnail, or null when the archive yields no cover
     */
    Path generate(ComicEntity comic) {
        String comicId = comic.getId();
        String tempId = ThumbnailStore.tempId(comicId);
        InspectionResult result = archiveInspector.inspect(comicId, Paths.get(comic.getPath()), tempId);
        if (!result.isHasThumbnail()) {
            log.info("COVER_ONDEMAND_NO_COVER comicId={} errors={}", comicId, result.getErrors());
            return null;
        }
        ThumbnailFormat format = ThumbnailFormat.fromExtension(result.getThumbnailFormat());
        Path temp = thumbnailStore.pathFor(tempId, format);
        boolean installed = thumbnailStore.installIfAbsent(temp, comicId, format);
        Path finalPath = thumbnailStore.find(comicId);
        if (finalPath == null) {
            return null;
        }
        String storedFormat = ComicFilenameParser.extension(finalPath.getFileName().toString());
        comicMapper.markThumbnail(comicId, storedFormat);
        log.debug("COVER_ONDEMAND_DONE comicId={} installed={} format={}", comicId, installed, storedFormat);
        return finalPath;
    }

    private CoverImage readCover(Path file) {
        try {
            return new CoverImage(Files.readAllBytes(file), contentType(file), false);
        } catch (IOException e) {
            log.warn("COVER_READ_FAILED file={} msg={}", file, e.getMessage());
            return placeholder();
        }
    }

    private CoverImage placeholder() {
        byte[] bytes = placeholder;
        if (bytes == null) {
            bytes = thumbnailEncoder.placeholderPng();
            placeholder = bytes;
        }
        return new CoverImage(bytes, PLACEHOLDER_CONTENT_TYPE, true);
    }

    static String contentType(Path file) {
        String ext = ComicFilenameParser.extension(file.getFileName().toString()).toLowerCase(Locale.ROOT);
        switch (ext) {
            case "jpg":
            case "jpeg":
                return "image/jpeg";
            case "png":
                return "image/png";
            case "webp":
                return "image/webp";
            default:
                return "application/octet-stream";
        }
    }

    private void incrementCounter(String outcome) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter("comicshelf.cover.ondemand", "outcome", outcome).increment();
        } catch (Exception e) {
            log.debug("Metric counter update failed, outcome={}", outcome, e);
        }
    }
}
