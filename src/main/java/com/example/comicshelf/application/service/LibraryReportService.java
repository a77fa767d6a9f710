package com.example.comicshelf.application.service;

import com.example.comicshelf.api.response.DuplicateComicResponse;
import com.example.comicshelf.api.response.DuplicateGroupResponse;
import com.example.comicshelf.api.response.GapReportResponse;
import com.example.comicshelf.api.response.HashBackfillResponse;
import com.example.comicshelf.common.util.FileSizeFormatter;
import com.example.comicshelf.common.util.HashUtil;
import com.example.comicshelf.infrastructure.persistence.entity.ComicEntity;
import com.example.comicshelf.infrastructure.persistence.mapper.ComicMapper;
import com.example.comicshelf.infrastructure.persistence.model.ComicNumberingRow;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LibraryReportService {

    private static final Logger log = LoggerFactory.getLogger(LibraryReportService.class);

    static final String TYPE_CHAPTER = "chapter";
    static final String TYPE_VOLUME = "volume";

    private static final int MAX_HASH_BATCH = 1000;
    static final int MAX_GAP_RUN = 1000;

    private final ComicMapper comicMapper;

    public LibraryReportService(ComicMapper comicMapper) {
        this.comicMapper = comicMapper;
    }

    /**
     * Comics sharing one content hash. Only comics hashed by {@link #computeMissingHashes(int)} take part.
     */
    public List<DuplicateGroupResponse> duplicates() {
        Map<String, List<ComicEntity>> groups = new LinkedHashMap<>();
        for (ComicEntity comic : comicMapper.selectDuplicateHashMembers()) {
            groups.computeIfAbsent(comic.getFileHash(), k -> new ArrayList<>()).add(comic);
        }
        List<DuplicateGroupResponse> result = new ArrayList<>();
        for (Map.Entry<String, List<ComicEntity>> entry : groups.entrySet()) {
            List<ComicEntity> members = entry.getValue();
            if (members.size() < 2) {
                continue;
            }
            List<DuplicateComicResponse> comics = new ArrayList<>();
            long total = 0L;
            long largest = 0L;
            for (ComicEntity comic : members) {
                long size = comic.getSizeBytes() == null ? 0L : comic.getSizeBytes();
                total += size;
                largest = Math.max(largest, size);
                comics.add(new DuplicateComicResponse(comic.getId(), comic.getPath(), comic.getSeries(), size));
            }
            result.add(new DuplicateGroupResponse(entry.getKey(), members.size(),
                    FileSizeFormatter.format(total - largest), comics));
        }
        return result;
    }

    public List<GapReportResponse> gaps() {
        Map<String, List<ComicNumberingRow>> bySeries = new LinkedHashMap<>();
        for (ComicNumberingRow row : comicMapper.selectNumbering()) {
            bySeries.computeIfAbsent(row.getSeries(), k -> new ArrayList<>()).add(row);
        }
        List<GapReportResponse> report = new ArrayList<>();
        for (Map.Entry<String, List<ComicNumberingRow>> entry : bySeries.entrySet()) {
            List<Double> chapters = new ArrayList<>();
            TreeSet<Double> volumes = new TreeSet<>();
            for (ComicNumberingRow row : entry.getValue()) {
                if (row.getChapter() != null) {
                    chapters.add(row.getChapter());
                }
                if (row.getVolume() != null) {
                    volumes.add(row.getVolume());
                }
            }
            Collections.sort(chapters);
            List<Integer> chapterGaps = integerGaps(chapters);
            if (!chapterGaps.isEmpty()) {
                report.add(new GapReportResponse(entry.getKey(), TYPE_CHAPTER, chapterGaps, chapterGaps.size()));
            }
            List<Integer> volumeGaps = integerGaps(new ArrayList<>(volumes));
            if (!volumeGaps.isEmpty()) {
                report.add(new GapReportResponse(entry.getKey(), TYPE_VOLUME, volumeGaps, volumeGaps.size()));
            }
        }
        return report;
    }

    /**
     * Whole numbers missing between consecutive whole numbers of a sorted sequence. Fractional
     * entries (e.g. 10.5) never open or close a gap. A jump wider than {@value #MAX_GAP_RUN} is taken
     * for a misparsed number (a date or an id in the filename) and not reported.
     */
    static List<Integer> integerGaps(List<Double> sorted) {
        List<Integer> gaps = new ArrayList<>();
        for (int i = 0; i + 1 < sorted.size(); i++) {
            double current = sorted.get(i);
            double next = sorted.get(i + 1);
            if (next - current - 1 > MAX_GAP_RUN || next > Integer.MAX_VALUE) {
                continue;
            }
            if (next - current > 1 && isWhole(current) && isWhole(next)) {
                for (int g = (int) current + 1; g < (int) next; g++) {
                    gaps.add(g);
                }
            }
        }
        return gaps;
    }

    /**
     * Hashes up to {@code limit} comics that have no content hash yet. Files that vanished or cannot
     * be read are marked so the next call moves on to later rows.
     */
    public HashBackfillResponse computeMissingHashes(int limit) {
        int safeLimit = Math.max(1, Math.min(MAX_HASH_BATCH, limit));
        int hashed = 0;
        int skipped = 0;
        for (ComicEntity comic : comicMapper.selectWithoutHash(safeLimit)) {
            Path path = Paths.get(comic.getPath());
            if (!Files.isRegularFile(path)) {
                comicMapper.markHashFailed(comic.getId());
                skipped++;
                continue;
            }
            try {
                comicMapper.updateFileHash(comic.getId(), HashUtil.md5Hex(path));
                hashed++;
            } catch (IOException e) {
                log.warn("COMIC_HASH_FAILED comicId={} path={} msg={}", comic.getId(), path, e.getMessage());
                comicMapper.markHashFailed(comic.getId());
                skipped++;
            }
        }
        log.info("COMIC_HASH_BACKFILL hashed={} skipped={} limit={}", hashed, skipped, safeLimit);
        return new HashBackfillResponse(hashed, skipped);
    }

    private static boolean isWhole(double value) {
        return value == Math.rint(value);
    }
}
