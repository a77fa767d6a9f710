package com.example.comicshelf.application.service;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.comicshelf.api.response.DuplicateGroupResponse;
import com.example.comicshelf.api.response.GapReportResponse;
import com.example.comicshelf.api.response.HashBackfillResponse;
import com.example.comicshelf.common.util.FileSizeFormatter;
import com.example.comicshelf.common.util.HashUtil;
import com.example.comicshelf.infrastructure.persistence.entity.ComicEntity;
import com.example.comicshelf.infrastructure.persistence.mapper.ComicMapper;
import com.example.comicshelf.infrastructure.persistence.model.ComicNumberingRow;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LibraryReportServiceTest {

    @TempDir
    Path tempDir;

    private ComicMapper comicMapper;
    private LibraryReportService service;

    @BeforeEach
    void setUp() {
        comicMapper = mock(ComicMapper.class);
        service = new LibraryReportService(comicMapper);
    }

    @Test
    void shouldFindWholeNumberGapsOnly() {
        Assertions.assertEquals(Arrays.asList(3, 4), LibraryReportService.integerGaps(Arrays.asList(1.0, 2.0, 5.0, 6.5, 8.0)));
        Assertions.assertTrue(LibraryReportService.integerGaps(Arrays.asList(10.0, 10.5, 12.0)).isEmpty());
        Assertions.assertTrue(LibraryReportService.integerGaps(Collections.singletonList(7.0)).isEmpty());
    }

    @Test
    void shouldIgnoreImplausiblyWideJumps() {
        List<Integer> gaps = LibraryReportService.integerGaps(Arrays.asList(1.0, 3.0, 20240115.0));

        Assertions.assertEquals(Collections.singletonList(2), gaps);
        Assertions.assertTrue(LibraryReportService.integerGaps(Arrays.asList(1.0, 98765432101.0)).isEmpty());
        Assertions.assertEquals(LibraryReportService.MAX_GAP_RUN,
                LibraryReportService.integerGaps(Arrays.asList(0.0, LibraryReportService.MAX_GAP_RUN + 1.0)).size());
    }

    @Test
    void shouldReportChapterAndVolumeGapsPerSeries() {
        when(comicMapper.selectNumbering()).thenReturn(Arrays.asList(
                row("Akira", 1.0, 1.0),
                row("Akira", 1.0, 2.0),
                row("Akira", 3.0, 4.0),
                row("Monster", null, 1.0),
                row("Monster", null, 2.0)));

        List<GapReportResponse> report = service.gaps();

        Assertions.assertEquals(2, report.size());
        Assertions.assertEquals(new GapReportResponse("Akira", "chapter", Collections.singletonList(3), 1), report.get(0));
        Assertions.assertEquals(new GapReportResponse("Akira", "volume", Collections.singletonList(2), 1), report.get(1));
    }

    @Test
    void shouldGroupDuplicatesAndComputeReclaimableSize() {
        when(comicMapper.selectDuplicateHashMembers()).thenReturn(Arrays.asList(
                comic("a", "h1", 300L),
                comic("b", "h1", 100L),
                comic("c", "h2", 50L)));

        List<DuplicateGroupResponse> groups = service.duplicates();

        Assertions.assertEquals(1, groups.size());
        Assertions.assertEquals("h1", groups.get(0).getFileHash());
        Assertions.assertEquals(2, groups.get(0).getCount());
        Assertions.assertEquals(FileSizeFormatter.format(100L), groups.get(0).getReclaimableSize());
    }

    @Test
    void shouldHashExistingFilesAndSkipMissingOnes() throws IOException {
        Path present = Files.write(tempDir.resolve("a.cbz"), "payload".getBytes(StandardCharsets.UTF_8));
        ComicEntity stored = comic("a", null, 7L);
        stored.setPath(present.toString());
        ComicEntity gone = comic("b", null, 7L);
        gone.setPath(tempDir.resolve("b.cbz").toString());
        when(comicMapper.selectWithoutHash(1000)).thenReturn(Arrays.asList(stored, gone));

        HashBackfillResponse response = service.computeMissingHashes(5000);

        Assertions.assertEquals(1, response.getHashed());
        Assertions.assertEquals(1, response.getSkipped());
        verify(comicMapper).updateFileHash("a", HashUtil.md5Hex(present));
        verify(comicMapper, never()).updateFileHash(eq("b"), anyString());
        verify(comicMapper).markHashFailed("b");
    }

    @Test
    void shouldMoveOnWhenFirstPageIsUnreadable() throws IOException {
        ComicEntity goneOne = comic("a1", null, 7L);
        goneOne.setPath(tempDir.resolve("a1.cbz").toString());
        ComicEntity goneTwo = comic("a2", null, 7L);
        goneTwo.setPath(tempDir.resolve("a2.cbz").toString());
        Path present = Files.write(tempDir.resolve("b1.cbz"), "later".getBytes(StandardCharsets.UTF_8));
        ComicEntity later = comic("b1", null, 5L);
        later.setPath(present.toString());
        when(comicMapper.selectWithoutHash(2))
                .thenReturn(Arrays.asList(goneOne, goneTwo))
                .thenReturn(Collections.singletonList(later));

        HashBackfillResponse first = service.computeMissingHashes(2);
        HashBackfillResponse second = service.computeMissingHashes(2);

        Assertions.assertEquals(0, first.getHashed());
        Assertions.assertEquals(2, first.getSkipped());
        verify(comicMapper).markHashFailed("a1");
        verify(comicMapper).markHashFailed("a2");
        Assertions.assertEquals(1, second.getHashed());
        verify(comicMapper).updateFileHash("b1", HashUtil.md5Hex(present));
    }

    private static ComicNumberingRow row(String series, Double volume, Double chapter) {
        ComicNumberingRow row = new ComicNumberingRow();
        row.setSeries(series);
        row.setVolume(volume);
        row.setChapter(chapter);
        return row;
    }

    private static ComicEntity comic(String id, String hash, Long size) {
        ComicEntity comic = new ComicEntity();
        comic.setId(id);
        comic.setPath("/library/" + id + ".cbz");
        comic.setFileHash(hash);
        comic.setSizeBytes(size);
        return comic;
    }
}
