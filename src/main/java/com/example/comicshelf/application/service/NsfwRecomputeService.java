package com.example.comicshelf.application.service;

import com.example.comicshelf.api.response.NsfwRecomputeResponse;
import com.example.comicshelf.common.exception.BusinessException;
import com.example.comicshelf.domain.model.NsfwRules;
import com.example.comicshelf.infrastructure.persistence.entity.SeriesEntity;
import com.example.comicshelf.infrastructure.persistence.mapper.SeriesMapper;
import com.example.comicshelf.infrastructure.persistence.model.NsfwFlagUpdate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class NsfwRecomputeService {

    private static final Logger log = LoggerFactory.getLogger(NsfwRecomputeService.class);

    private final SeriesMapper seriesMapper;
    private final NsfwClassifier nsfwClassifier;

    public NsfwRecomputeService(SeriesMapper seriesMapper, NsfwClassifier nsfwClassifier) {
        this.seriesMapper = seriesMapper;
        this.nsfwClassifier = nsfwClassifier;
    }

    /**
     * Re-evaluates every series against the current rules and writes the flags that changed in
     * one statement. Safe to repeat.
     */
    public NsfwRecomputeResponse recomputeAll() {
        NsfwRules rules = nsfwClassifier.currentRules();
        List<SeriesEntity> rows = seriesMapper.selectNsfwSources();
        if (rows == null) {
            rows = Collections.emptyList();
        }
        List<NsfwFlagUpdate> updates = new ArrayList<>();
        int flagged = 0;
        for (SeriesEntity row : rows) {
            boolean nsfw = nsfwClassifier.classify(row, rules);
            if (nsfw) {
                flagged++;
            }
            int value = nsfw ? 1 : 0;
            int current = row.getIsNsfw() == null ? 0 : row.getIsNsfw();
            if (current != value) {
                updates.add(new NsfwFlagUpdate(row.getId(), value));
            }
        }
        if (!updates.isEmpty()) {
            seriesMapper.batchUpdateNsfw(updates);
        }
        log.info("NSFW_RECOMPUTED total={} changed={} flagged={}", rows.size(), updates.size(), flagged);
        return new NsfwRecomputeResponse(rows.size(), updates.size(), flagged);
    }

    public boolean setOverride(Long seriesId, Boolean override) {
        SeriesEntity series = seriesMapper.selectById(seriesId);
        if (series == null) {
            throw new BusinessException("404", "系列不存在");
        }
        Integer value = override == null ? null : (override ? 1 : 0);
        seriesMapper.updateNsfwOverride(seriesId, value);
        series.setNsfwOverride(value);
        boolean nsfw = nsfwClassifier.classify(series, nsfwClassifier.currentRules());
        seriesMapper.batchUpdateNsfw(Collections.singletonList(new NsfwFlagUpdate(seriesId, nsfw ? 1 : 0)));
        log.info("NSFW_OVERRIDE_SET seriesId={} override={} isNsfw={}", seriesId, value, nsfw);
        return nsfw;
    }
}
