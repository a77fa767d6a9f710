package com.example.comicshelf.application.service;

import com.example.comicshelf.api.response.SeriesSearchItemResponse;
import com.example.comicshelf.infrastructure.persistence.entity.SeriesEntity;
import com.example.comicshelf.infrastructure.persistence.mapper.SeriesSearchMapper;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Full-text series search over the series_search table, plus the upkeep of that table.
 */
@Service
public class SeriesSearchService {

    private static final Logger log = LoggerFactory.getLogger(SeriesSearchService.class);

    static final int RESULT_LIMIT = 50;
    private static final int INDEX_CHUNK = 500;

    private final SeriesSearchMapper seriesSearchMapper;

    public SeriesSearchService(SeriesSearchMapper seriesSearchMapper) {
        this.seriesSearchMapper = seriesSearchMapper;
    }

    public List<SeriesSearchItemResponse> search(String keyword) {
        if (!StringUtils.hasText(keyword)) {
            return Collections.emptyList();
        }
        String safeKeyword = keyword.trim();
        List<SeriesEntity> rows = Collections.emptyList();
        String booleanQuery = toBooleanQuery(safeKeyword);
        if (booleanQuery != null && seriesSearchMapper.countDocuments() > 0) {
            try {
                rows = seriesSearchMapper.searchFullText(booleanQuery, RESULT_LIMIT);
            } catch (DataAccessException e) {
                log.warn("SERIES_SEARCH_FTS_FAILED query={} msg={}", booleanQuery, e.getMessage());
                rows = Collections.emptyList();
            }
        }
        if (rows == null || rows.isEmpty()) {
            rows = seriesSearchMapper.searchLike(likePattern(safeKeyword), RESULT_LIMIT);
            log.debug("SERIES_SEARCH_FALLBACK keyword={} hits={}", safeKeyword, rows.size());
        }
        return rows.stream().map(this::toResponse).collect(Collectors.toList());
    }

    public int rebuild() {
        int removed = seriesSearchMapper.deleteAll();
        seriesSearchMapper.rebuildAll();
        long documents = seriesSearchMapper.countDocuments();
        log.info("SERIES_SEARCH_REBUILT removed={} documents={}", removed, documents);
        return (int) documents;
    }

    public void refreshSeries(Collection<Long> seriesIds) {
        if (seriesIds == null || seriesIds.isEmpty()) {
            return;
        }
        for (List<Long> chunk : chunks(new ArrayList<>(seriesIds))) {
            seriesSearchMapper.upsertDocuments(chunk);
        }
    }

    public void refreshSeriesByNames(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return;
        }
        for (List<String> chunk : chunks(new ArrayList<>(names))) {
            seriesSearchMapper.upsertDocumentsByNames(chunk);
        }
    }

    public void removeSeries(Long seriesId) {
        seriesSearchMapper.deleteDocument(seriesId);
    }

    public void clear() {
        seriesSearchMapper.deleteAll();
    }

    /**
     * Every word becomes a required prefix term, e.g. {@code one piece} to {@code +one* +piece*}.
     * Returns null when nothing searchable is left.
     */
    static String toBooleanQuery(String keyword) {
        String cleaned = keyword.replaceAll("[^\\p{L}\\p{N}_]+", " ").trim();
        if (cleaned.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (String word : cleaned.split("\\s+")) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append('+').append(word).append('*');
        }
        return sb.toString();
    }

    static String likePattern(String keyword) {
        String escaped = keyword.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private <T> List<List<T>> chunks(List<T> values) {
        List<List<T>> result = new ArrayList<>();
        for (int i = 0; i < values.size(); i += INDEX_CHUNK) {
            result.add(values.subList(i, Math.min(values.size(), i + INDEX_CHUNK)));
        }
        return result;
    }

    private SeriesSearchItemResponse toResponse(SeriesEntity entity) {
        return new SeriesSearchItemResponse(
                entity.getId(),
                entity.getName(),
                entity.getTitle(),
                entity.getTitleEnglish(),
                entity.getCategory(),
                entity.getSubcategory(),
                entity.getCoverComicId(),
                entity.getIsNsfw() != null && entity.getIsNsfw() == 1
        );
    }
}
