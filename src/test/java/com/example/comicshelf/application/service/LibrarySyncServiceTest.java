package com.example.comicshelf.application.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.comicshelf.common.config.AppLibraryProperties;
import com.example.comicshelf.common.config.AppScanProperties;
import com.example.comicshelf.common.config.AppThumbnailProperties;
import com.example.comicshelf.common.exception.LibraryAccessException;
import com.example.comicshelf.common.util.HashUtil;
import com.example.comicshelf.domain.enumtype.ThumbnailFormat;
import com.example.comicshelf.domain.model.EncodedThumbnail;
import com.example.comicshelf.domain.model.SidecarMetadata;
import com.example.comicshelf.infrastructure.metadata.SidecarMetadataReader;
import com.example.comicshelf.infrastructure.persistence.entity.ComicEntity;
import com.example.comicshelf.infrastructure.persistence.entity.SeriesEntity;
import com.example.comicshelf.infrastructure.persistence.mapper.ComicMapper;
import com.example.comicshelf.infrastructure.persistence.mapper.SeriesMapper;
import com.example.comicshelf.infrastructure.persistence.model.ComicFingerprint;
import com.example.comicshelf.infrastructure.thumbnail.ThumbnailStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class LibrarySyncServiceTest {

    @TempDir
    Path tempDir;

    private Path library;
    private Path berserkOne;
    private Path berserkTwo;
    private Path loose;

    private AppLibraryProperties libraryProperties;
    private AppScanProperties scanProperties;
    private ComicMapper comicMapper;
    private SeriesMapper seriesMapper;
    private SeriesSearchService seriesSearchService;
    private TagMetadataCache tagMetadataCache;
    private ThumbnailStore thumbnailStore;
    private LibrarySyncService service;

    @BeforeEach
    void setUp() throws IOException {
        library = Files.createDirectories(tempDir.resolve("library"));
        Path berserkDir = Files.createDirectories(library.resolve("Manga/Seinen/Berserk"));
        Files.write(berserkDir.resolve("series.json"),
                "{\"genres\": [\"Action\", \"Dark Fantasy\"], \"is_adult\": false}".getBytes(StandardCharsets.UTF_8));
        berserkOne = write(berserkDir.resolve("Berserk v01.cbz"), "one");
        berserkTwo = write(berserkDir.resolve("Berserk v02.cbz"), "two-two");
        loose = write(library.resolve("Loose c05.cbr"), "three");
        write(library.resolve("notes.txt"), "not a comic");

        libraryProperties = new AppLibraryProperties();
        libraryProperties.setRoots(Collections.singletonList(library.toString()));
        scanProperties = new AppScanProperties();
        comicMapper = mock(ComicMapper.class);
        seriesMapper = mock(SeriesMapper.class);
        seriesSearchService = mock(SeriesSearchService.class);
        tagMetadataCache = mock(TagMetadataCache.class);
        AppThumbnailProperties thumbnailProperties = new AppThumbnailProperties();
        thumbnailProperties.setDir(tempDir.resolve("thumbs").toString());
        thumbnailStore = new ThumbnailStore(thumbnailProperties);
        service = new LibrarySyncService(libraryProperties, scanProperties, comicMapper, seriesMapper,
                new SidecarMetadataReader(), seriesSearchService, tagMetadataCache, thumbnailStore,
                beanProvider(new SimpleMeterRegistry()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldInsertEveryArchiveOnFirstSync() {
        AtomicInteger progressCalls = new AtomicInteger();
        ScanJobProgress progress = new ScanJobProgress(50, 500);

        LibrarySyncService.SyncStats stats = service.sync(progress, () -> false, progressCalls::incrementAndGet);

        Assertions.assertEquals(3, stats.getFileCount());
        Assertions.assertEquals(3, stats.getNewCount());
        Assertions.assertEquals(0, stats.getDeletedCount());
        Assertions.assertEquals(2, stats.getSeriesCount());
        Assertions.assertFalse(stats.isCancelled());
        Assertions.assertEquals(Integer.valueOf(3), progress.toEntity(1L, "[]").getNewComics());
        Assertions.assertTrue(progressCalls.get() >= 1);

        ArgumentCaptor<List<ComicEntity>> inserted = ArgumentCaptor.forClass(List.class);
        verify(comicMapper).batchInsert(inserted.capture());
        Assertions.assertEquals(3, inserted.getValue().size());
        ComicEntity first = byFilename(inserted.getValue(), "Berserk v01.cbz");
        Assertions.assertEquals(HashUtil.md5Hex(berserkOne.toAbsolutePath().normalize().toString()), first.getId());
        Assertions.assertEquals("Berserk", first.getSeries());
        Assertions.assertEquals("Manga", first.getCategory());
        Assertions.assertEquals("Seinen", first.getSubcategory());
        Assertions.assertEquals(1.0D, first.getVolume());
        ComicEntity looseComic = byFilename(inserted.getValue(), "Loose c05.cbr");
        Assertions.assertEquals("Loose", looseComic.getSeries());
        Assertions.assertEquals("Uncategorized", looseComic.getCategory());
        Assertions.assertEquals(5.0D, looseComic.getChapter());

        ArgumentCaptor<SeriesEntity> series = ArgumentCaptor.forClass(SeriesEntity.class);
        verify(seriesMapper, times(2)).upsert(series.capture());
        SeriesEntity berserk = series.getAllValues().get(1);
        Assertions.assertEquals("Berserk", berserk.getName());
        Assertions.assertNull(series.getAllValues().get(0).getGenres());
        Assertions.assertEquals("[\"Action\",\"Dark Fantasy\"]", berserk.getGenres());
        Assertions.assertEquals(Integer.valueOf(0), berserk.getIsAdult());
        Assertions.assertEquals(first.getId(), berserk.getCoverComicId());

        verify(comicMapper).linkSeriesIds();
        verify(comicMapper, never()).deleteByIds(anyCollection());
        verify(seriesSearchService).refreshSeriesByNames(new HashSet<>(Arrays.asList("Berserk", "Loose")));
        verify(tagMetadataCache).invalidate();
    }

    @Test
    void shouldChangeNothingWhenLibraryIsUnchanged() throws IOException {
        when(comicMapper.selectFingerprints()).thenReturn(fingerprintsOf(berserkOne, berserkTwo, loose));

        LibrarySyncService.SyncStats stats = service.sync(new ScanJobProgress(50, 500), () -> false, () -> { });

        Assertions.assertEquals(0, stats.getNewCount());
        Assertions.assertEquals(0, stats.getChangedCount());
        Assertions.assertEquals(0, stats.getDeletedCount());
        verify(comicMapper, never()).batchInsert(anyList());
        verify(comicMapper, never()).updateChanged(any(ComicEntity.class));
        verify(comicMapper, never()).deleteByIds(anyCollection());
    }

    @Test
    void shouldDeleteMissingComicsExactlyOnce() throws IOException {
        List<ComicFingerprint> known = fingerprintsOf(berserkOne, berserkTwo, loose);
        known.add(new ComicFingerprint("gone", 1.0D, 10L));
        when(comicMapper.selectFingerprints()).thenReturn(known);
        when(comicMapper.deleteByIds(anyCollection())).thenReturn(1);
        thumbnailStore.write("gone", new EncodedThumbnail(new byte[]{1}, ThumbnailFormat.JPEG, 0L));

        LibrarySyncService.SyncStats stats = service.sync(new ScanJobProgress(50, 500), () -> false, () -> { });

        Assertions.assertEquals(1, stats.getDeletedCount());
        verify(comicMapper, times(1)).deleteByIds(Collections.singletonList("gone"));
        Assertions.assertNull(thumbnailStore.find("gone"));
    }

    @Test
    void shouldResetChangedComicsAndDropTheirThumbnail() throws IOException {
        List<ComicFingerprint> known = fingerprintsOf(berserkOne, berserkTwo, loose);
        known.get(1).setSizeBytes(known.get(1).getSizeBytes() + 100);
        when(comicMapper.selectFingerprints()).thenReturn(known);
        String changedId = known.get(1).getId();
        thumbnailStore.write(changedId, new EncodedThumbnail(new byte[]{1}, ThumbnailFormat.JPEG, 0L));

        LibrarySyncService.SyncStats stats = service.sync(new ScanJobProgress(50, 500), () -> false, () -> { });

        Assertions.assertEquals(1, stats.getChangedCount());
        ArgumentCaptor<ComicEntity> captor = ArgumentCaptor.forClass(ComicEntity.class);
        verify(comicMapper).updateChanged(captor.capture());
        Assertions.assertEquals(changedId, captor.getValue().getId());
        Assertions.assertEquals(Long.valueOf(Files.size(berserkTwo)), captor.getValue().getSizeBytes());
        Assertions.assertNull(thumbnailStore.find(changedId));
    }

    @Test
    void shouldNotDeleteAnythingWhenCancelled() throws IOException {
        scanProperties.setProgressInterval(1);
        List<ComicFingerprint> known = new ArrayList<>();
        known.add(new ComicFingerprint("gone", 1.0D, 10L));
        when(comicMapper.selectFingerprints()).thenReturn(known);

        LibrarySyncService.SyncStats stats = service.sync(new ScanJobProgress(50, 500), () -> true, () -> { });

        Assertions.assertTrue(stats.isCancelled());
        Assertions.assertEquals(1, stats.getFileCount());
        verify(comicMapper, never()).deleteByIds(anyCollection());
        verify(comicMapper).batchInsert(anyList());
    }

    @Test
    void shouldFailWhenRootIsMissingOrUnset() {
        libraryProperties.setRoots(Collections.singletonList(tempDir.resolve("nope").toString()));
        LibraryAccessException missing = Assertions.assertThrows(LibraryAccessException.class,
                () -> service.sync(new ScanJobProgress(50, 500), () -> false, () -> { }));
        Assertions.assertTrue(missing.getMessage().contains("does not exist"));

        libraryProperties.setRoots(Collections.<String>emptyList());
        Assertions.assertThrows(LibraryAccessException.class,
                () -> service.sync(new ScanJobProgress(50, 500), () -> false, () -> { }));
        verify(comicMapper, never()).selectFingerprints();
    }

    @Test
    void shouldPreferSidecarSeriesName() {
        SidecarMetadata metadata = new SidecarMetadata();
        metadata.setSeries("Berserk (Deluxe)");

        ComicEntity comic = LibrarySyncService.describeComic(library, berserkOne, metadata, "Uncategorized");

        Assertions.assertEquals("Berserk (Deluxe)", comic.getSeries());
        Assertions.assertEquals("Berserk v01.cbz", comic.getFilename());
    }

    @Test
    void shouldClassifyByMtimeAndSize() {
        ComicFingerprint known = new ComicFingerprint("a", 100.0D, 50L);

        Assertions.assertEquals(LibrarySyncService.ChangeKind.NEW, LibrarySyncService.classify(null, 100.0D, 50L));
        Assertions.assertEquals(LibrarySyncService.ChangeKind.UNCHANGED,
                LibrarySyncService.classify(known, 100.0004D, 50L));
        Assertions.assertEquals(LibrarySyncService.ChangeKind.CHANGED, LibrarySyncService.classify(known, 101.0D, 50L));
        Assertions.assertEquals(LibrarySyncService.ChangeKind.CHANGED, LibrarySyncService.classify(known, 100.0D, 51L));
    }

    private static ComicEntity byFilename(List<ComicEntity> comics, String filename) {
        for (ComicEntity comic : comics) {
            if (filename.equals(comic.getFilename())) {
                return comic;
            }
        }
        throw new AssertionError("not inserted: " + filename);
    }

    private List<ComicFingerprint> fingerprintsOf(Path... files) throws IOException {
        List<ComicFingerprint> result = new ArrayList<>();
        for (Path file : files) {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            result.add(new ComicFingerprint(HashUtil.md5Hex(file.toAbsolutePath().normalize().toString()),
                    attrs.lastModifiedTime().toMillis() / 1000.0d, attrs.size()));
        }
        return result;
    }

    private static Path write(Path file, String content) throws IOException {
        return Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry meterRegistry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
