package com.example.comicshelf.application.service;

import com.example.comicshelf.common.config.AppLibraryProperties;
import com.example.comicshelf.common.config.AppScanProperties;
import com.example.comicshelf.common.exception.LibraryAccessException;
import com.example.comicshelf.common.util.ComicFilenameParser;
import com.example.comicshelf.common.util.HashUtil;
import com.example.comicshelf.common.util.NaturalSortComparator;
import com.example.comicshelf.domain.model.ComicNumbering;
import com.example.comicshelf.domain.model.SidecarMetadata;
import com.example.comicshelf.infrastructure.metadata.SidecarMetadataReader;
import com.example.comicshelf.infrastructure.persistence.entity.ComicEntity;
import com.example.comicshelf.infrastructure.persistence.entity.SeriesEntity;
import com.example.comicshelf.infrastructure.persistence.mapper.ComicMapper;
import com.example.comicshelf.infrastructure.persistence.mapper.SeriesMapper;
import com.example.comicshelf.infrastructure.persistence.model.ComicFingerprint;
import com.example.comicshelf.infrastructure.thumbnail.ThumbnailStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Phase 1 of a scan: walks the library roots, diffs them against the stored comic snapshot and
 * writes the new, changed and missing comics. Single threaded.
 */
@Service
public class LibrarySyncService {

    private static final Logger log = LoggerFactory.getLogger(LibrarySyncService.class);

    private static final double MTIME_TOLERANCE_SEC = 0.001d;

    private static final Comparator<Path> BY_FILE_NAME = new Comparator<Path>() {
        @Override
        public int compare(Path a, Path b) {
            return NaturalSortComparator.INSTANCE.compare(a.getFileName().toString(), b.getFileName().toString());
        }
    };

    enum ChangeKind {
        NEW, CHANGED, UNCHANGED
    }

    private final AppLibraryProperties appLibraryProperties;
    private final AppScanProperties appScanProperties;
    private final ComicMapper comicMapper;
    private final SeriesMapper seriesMapper;
    private final SidecarMetadataReader sidecarMetadataReader;
    private final SeriesSearchService seriesSearchService;
    private final TagMetadataCache tagMetadataCache;
    private final ThumbnailStore thumbnailStore;
    private final MeterRegistry meterRegistry;

    public LibrarySyncService(AppLibraryProperties appLibraryProperties,
                              AppScanProperties appScanProperties,
                              ComicMapper comicMapper,
                              SeriesMapper seriesMapper,
                              SidecarMetadataReader sidecarMetadataReader,
                              SeriesSearchService seriesSearchService,
                              TagMetadataCache tagMetadataCache,
                              ThumbnailStore thumbnailStore,
                              ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.appLibraryProperties = appLibraryProperties;
        this.appScanProperties = appScanProperties;
        this.comicMapper = comicMapper;
        this.seriesMapper = seriesMapper;
        this.sidecarMetadataReader = sidecarMetadataReader;
        this.seriesSearchService = seriesSearchService;
        this.tagMetadataCache = tagMetadataCache;
        this.thumbnailStore = thumbnailStore;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    /**
     * @param progress         job counters, updated in place
     * @param cancelSignal     polled every progress interval; a cancelled walk deletes nothing
     * @param progressListener called every progress interval to persist {@code progress}
     * @throws LibraryAccessException when a root is missing or unreadable
     */
    public SyncStats sync(ScanJobProgress progress, BooleanSupplier cancelSignal, Runnable progressListener) {
        long startNanos = System.nanoTime();
        List<Path> roots = resolveRoots();

        Map<String, ComicFingerprint> snapshot = new HashMap<>();
        for (ComicFingerprint fingerprint : comicMapper.selectFingerprints()) {
            snapshot.put(fingerprint.getId(), fingerprint);
        }
        log.info("LIBRARY_SYNC_START roots={} known={}", roots, snapshot.size());

        WalkState state = new WalkState(snapshot, progress, cancelSignal, progressListener);
        for (Path root : roots) {
            if (state.cancelled) {
                break;
            }
            walkDirectory(root, root, null, state);
        }
        flushInserts(state);

        for (ComicEntity changed : state.changed) {
            comicMapper.updateChanged(changed);
            thumbnailStore.delete(changed.getId());
        }
        for (SeriesEntity series : state.series.values()) {
            seriesMapper.upsert(series);
        }
        if (!state.series.isEmpty() || state.stats.getNewCount() > 0 || state.stats.getChangedCount() > 0) {
            comicMapper.linkSeriesIds();
        }
        seriesSearchService.refreshSeriesByNames(state.series.keySet());

        SyncStats stats = state.stats;
        stats.setSeriesCount(state.series.size());
        stats.setCancelled(state.cancelled);
        if (state.cancelled) {
            log.info("LIBRARY_SYNC_CANCELED files={} new={} changed={}",
                    stats.getFileCount(), stats.getNewCount(), stats.getChangedCount());
        } else {
            List<String> missing = missingIds(snapshot.keySet(), state.seenIds);
            stats.setDeletedCount(deleteComics(missing));
        }
        tagMetadataCache.invalidate();

        progress.setNewComics(stats.getNewCount());
        progress.setChangedComics(stats.getChangedCount());
        progress.setDeletedComics(stats.getDeletedCount());
        progressListener.run();

        long elapsedNanos = System.nanoTime() - startNanos;
        recordDuration("comicshelf.scan.sync", elapsedNanos);
        log.info("LIBRARY_SYNC_FINISH files={} new={} changed={} deleted={} series={} elapsedMs={}",
                stats.getFileCount(), stats.getNewCount(), stats.getChangedCount(), stats.getDeletedCount(),
                stats.getSeriesCount(), TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
        return stats;
    }

    List<Path> resolveRoots() {
        List<String> configured = appLibraryProperties.getRoots();
        if (configured == null || configured.isEmpty()) {
            throw new LibraryAccessException("", "No library roots configured (app.library.roots)");
        }
        List<Path> roots = new ArrayList<>();
        for (String value : configured) {
            if (value == null || value.trim().isEmpty()) {
                continue;
            }
            Path root = Paths.get(value.trim()).toAbsolutePath().normalize();
            if (!Files.isDirectory(root)) {
                throw new LibraryAccessException(root.toString(), "Library root does not exist: " + root);
            }
            if (!Files.isReadable(root)) {
                throw new LibraryAccessException(root.toString(), "Library root is not readable: " + root);
            }
            if (!roots.contains(root)) {
                roots.add(root);
            }
        }
        if (roots.isEmpty()) {
            throw new LibraryAccessException("", "No library roots configured (app.library.roots)");
        }
        return roots;
    }

    private void walkDirectory(Path root, Path dir, SidecarMetadata inherited, WalkState state) {
        SidecarMetadata own = sidecarFor(dir, state);
        SidecarMetadata effective = own != null ? own : inherited;

        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                children.add(child);
            }
        } catch (IOException e) {
            if (dir.equals(root)) {
                throw new LibraryAccessException(root.toString(), "Cannot list library root: " + e.getMessage(), e);
            }
            log.warn("LIBRARY_SYNC_DIR_FAILED dir={} msg={}", dir, e.getMessage());
            state.progress.addError("Cannot list " + dir + ": " + e.getMessage());
            return;
        }
        children.sort(BY_FILE_NAME);

        for (Path child : children) {
            if (state.cancelled) {
                return;
            }
            if (Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS)) {
                walkDirectory(root, child, effective, state);
            } else if (isArchive(child)) {
                visitArchive(root, child, effective, state);
            }
        }
    }

    private SidecarMetadata sidecarFor(Path dir, WalkState state) {
        if (state.sidecars.containsKey(dir)) {
            return state.sidecars.get(dir);
        }
        Path file = dir.resolve(appLibraryProperties.getSidecarFileName());
        SidecarMetadata metadata = Files.isRegularFile(file) ? sidecarMetadataReader.read(file) : null;
        state.sidecars.put(dir, metadata);
        return metadata;
    }

    private void visitArchive(Path root, Path file, SidecarMetadata metadata, WalkState state) {
        SyncStats stats = state.stats;
        stats.setFileCount(stats.getFileCount() + 1);
        String absolute = file.toAbsolutePath().normalize().toString();
        String id = HashUtil.md5Hex(absolute);
        // marked seen before stat so a transient read error never turns into a delete
        if (state.seenIds.add(id)) {
            try {
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                double mtime = attrs.lastModifiedTime().toMillis() / 1000.0d;
                long size = attrs.size();
                ComicEntity comic = describeComic(root, file, metadata, appLibraryProperties.getDefaultCategory());
                comic.setId(id);
                comic.setPath(absolute);
                comic.setSizeBytes(size);
                comic.setMtime(mtime);
                registerSeries(comic, metadata, state);

                switch (classify(state.snapshot.get(id), mtime, size)) {
                    case NEW:
                        state.pendingInserts.add(comic);
                        stats.setNewCount(stats.getNewCount() + 1);
                        if (state.pendingInserts.size() >= Math.max(1, appScanProperties.getInsertBatchSize())) {
                            flushInserts(state);
                        }
                        break;
                    case CHANGED:
                        state.changed.add(comic);
                        stats.setChangedCount(stats.getChangedCount() + 1);
                        break;
                    default:
                        break;
                }
            } catch (IOException | RuntimeException e) {
                log.warn("LIBRARY_SYNC_FILE_FAILED path={} msg={}", file, e.getMessage());
                state.progress.addError(file.getFileName() + ": " + e.getMessage());
            }
        }

        int interval = Math.max(1, appScanProperties.getProgressInterval());
        if (stats.getFileCount() % interval == 0) {
            state.progress.setPhase(ScanJobProgress.PHASE_SYNC);
            state.progress.setCurrentFile(file.getFileName().toString());
            state.progress.setNewComics(stats.getNewCount());
            state.progress.setChangedComics(stats.getChangedCount());
            state.progressListener.run();
            if (state.cancelSignal != null && state.cancelSignal.getAsBoolean()) {
                state.cancelled = true;
            }
        }
    }

    private void registerSeries(ComicEntity comic, SidecarMetadata metadata, WalkState state) {
        if (state.series.containsKey(comic.getSeries())) {
            return;
        }
        SeriesEntity series = new SeriesEntity();
        series.setName(comic.getSeries());
        series.setCategory(comic.getCategory());
        series.setSubcategory(comic.getSubcategory());
        series.setCoverComicId(comic.getId());
        if (metadata != null) {
            series.setTitle(metadata.getTitle());
            series.setTitleEnglish(metadata.getTitleEnglish());
            series.setTitleJapanese(metadata.getTitleJapanese());
            series.setSynonyms(metadata.getSynonyms());
            series.setAuthors(metadata.getAuthors());
            series.setSynopsis(metadata.getSynopsis());
            series.setGenres(metadata.getGenres());
            series.setTags(metadata.getTags());
            series.setDemographics(metadata.getDemographics());
            series.setStatus(metadata.getStatus());
            series.setTotalVolumes(metadata.getTotalVolumes());
            series.setTotalChapters(metadata.getTotalChapters());
            series.setReleaseYear(metadata.getReleaseYear());
            series.setMalId(metadata.getMalId());
            series.setAnilistId(metadata.getAnilistId());
            if (metadata.getAdult() != null) {
                series.setIsAdult(metadata.getAdult() ? 1 : 0);
            }
        }
        state.series.put(series.getName(), series);
    }

    private void flushInserts(WalkState state) {
        if (state.pendingInserts.isEmpty()) {
            return;
        }
        comicMapper.batchInsert(new ArrayList<>(state.pendingInserts));
        incrementCounter("comicshelf.scan.sync.inserted", state.pendingInserts.size());
        state.pendingInserts.clear();
    }

    private int deleteComics(List<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        int batch = Math.max(1, appScanProperties.getInsertBatchSize());
        int deleted = 0;
        for (int i = 0; i < ids.size(); i += batch) {
            List<String> chunk = ids.subList(i, Math.min(ids.size(), i + batch));
            deleted += comicMapper.deleteByIds(chunk);
            for (String id : chunk) {
                thumbnailStore.delete(id);
            }
        }
        log.info("LIBRARY_SYNC_DELETED missing={} deleted={}", ids.size(), deleted);
        return deleted;
    }

    private boolean isArchive(Path file) {
        String ext = ComicFilenameParser.extension(file.getFileName().toString()).toLowerCase(Locale.ROOT);
        return appLibraryProperties.normalizedArchiveExtensions().contains(ext);
    }

    /**
     * Path-derived fields of a comic: category and subcategory from the first two directories below
     * the root, series from the sidecar, the third directory or the file name, in that order.
     */
    static ComicEntity describeComic(Path root, Path file, SidecarMetadata metadata, String defaultCategory) {
        List<String> parts = new ArrayList<>();
        Path relativeDir = root.relativize(file.getParent());
        for (Path part : relativeDir) {
            String name = part.toString();
            if (!name.isEmpty()) {
                parts.add(name);
            }
        }
        String filename = file.getFileName().toString();

        String series = metadata == null ? null : metadata.preferredSeriesName();
        if (series == null) {
            series = parts.size() >= 3 ? parts.get(2) : ComicFilenameParser.seriesFromFilename(filename);
        }
        ComicNumbering numbering = ComicFilenameParser.parseNumbering(filename);

        ComicEntity comic = new ComicEntity();
        comic.setFilename(filename);
        comic.setCategory(parts.isEmpty() ? defaultCategory : parts.get(0));
        comic.setSubcategory(parts.size() > 1 ? parts.get(1) : null);
        comic.setSeries(series);
        comic.setVolume(numbering.getVolume());
        comic.setChapter(numbering.getChapter());
        return comic;
    }

    static ChangeKind classify(ComicFingerprint existing, double mtime, long size) {
        if (existing == null) {
            return ChangeKind.NEW;
        }
        boolean sameSize = existing.getSizeBytes() != null && existing.getSizeBytes() == size;
        boolean sameTime = existing.getMtime() != null && Math.abs(existing.getMtime() - mtime) < MTIME_TOLERANCE_SEC;
        return sameSize && sameTime ? ChangeKind.UNCHANGED : ChangeKind.CHANGED;
    }

    static List<String> missingIds(Collection<String> knownIds, Set<String> seenIds) {
        List<String> missing = new ArrayList<>();
        for (String id : knownIds) {
            if (!seenIds.contains(id)) {
                missing.add(id);
            }
        }
        return missing;
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

    private static final class WalkState {

        private final Map<String, ComicFingerprint> snapshot;
        private final ScanJobProgress progress;
        private final BooleanSupplier cancelSignal;
        private final Runnable progressListener;
        private final Set<String> seenIds = new HashSet<>();
        private final Map<Path, SidecarMetadata> sidecars = new HashMap<>();
        private final Map<String, SeriesEntity> series = new LinkedHashMap<>();
        private final List<ComicEntity> pendingInserts = new ArrayList<>();
        private final List<ComicEntity> changed = new ArrayList<>();
        private final SyncStats stats = new SyncStats();
        private boolean cancelled;

        private WalkState(Map<String, ComicFingerprint> snapshot,
                          ScanJobProgress progress,
                          BooleanSupplier cancelSignal,
                          Runnable progressListener) {
            this.snapshot = snapshot;
            this.progress = progress;
            this.cancelSignal = cancelSignal;
            this.progressListener = progressListener;
        }
    }

    @Data
    public static class SyncStats {

        private int fileCount;
        private int newCount;
        private int changedCount;
        private int deletedCount;
        private int seriesCount;
        private boolean cancelled;
    }
}
