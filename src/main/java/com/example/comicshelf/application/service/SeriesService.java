package com.example.comicshelf.application.service;

import com.example.comicshelf.api.response.SeriesRenameResponse;
import com.example.comicshelf.common.exception.BusinessException;
import com.example.comicshelf.infrastructure.persistence.entity.SeriesEntity;
import com.example.comicshelf.infrastructure.persistence.mapper.ComicMapper;
import com.example.comicshelf.infrastructure.persistence.mapper.SeriesMapper;
import java.util.Collections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class SeriesService {

    private static final Logger log = LoggerFactory.getLogger(SeriesService.class);

    private final SeriesMapper seriesMapper;
    private final ComicMapper comicMapper;
    private final SeriesSearchService seriesSearchService;
    private final TagMetadataCache tagMetadataCache;

    public SeriesService(SeriesMapper seriesMapper,
                         ComicMapper comicMapper,
                         SeriesSearchService seriesSearchService,
                         TagMetadataCache tagMetadataCache) {
        this.seriesMapper = seriesMapper;
        this.comicMapper = comicMapper;
        this.seriesSearchService = seriesSearchService;
        this.tagMetadataCache = tagMetadataCache;
    }

    /**
     * Renames a series. When another series already has the new name the two are merged into that
     * one: its empty fields are filled from the renamed series, the comics are moved over and the
     * renamed series is deleted.
     */
    @Transactional(rollbackFor = Exception.class)
    public SeriesRenameResponse rename(Long seriesId, String newName) {
        if (!StringUtils.hasText(newName)) {
            throw new BusinessException("400", "系列名称不能为空");
        }
        String name = newName.trim();
        SeriesEntity source = seriesMapper.selectById(seriesId);
        if (source == null) {
            throw new BusinessException("404", "系列不存在");
        }
        if (name.equals(source.getName())) {
            return new SeriesRenameResponse(source.getId(), source.getName(), false);
        }

        SeriesEntity target = seriesMapper.selectByName(name);
        if (target == null || target.getId().equals(source.getId())) {
            seriesMapper.updateName(source.getId(), name);
            int moved = comicMapper.repointSeries(source.getId(), source.getName(), source.getId(), name);
            seriesSearchService.refreshSeries(Collections.singletonList(source.getId()));
            tagMetadataCache.invalidate();
            log.info("SERIES_RENAMED seriesId={} from={} to={} comics={}", source.getId(), source.getName(), name, moved);
            return new SeriesRenameResponse(source.getId(), name, false);
        }

        seriesMapper.mergeInto(source.getId(), target.getId());
        int moved = comicMapper.repointSeries(source.getId(), source.getName(), target.getId(), target.getName());
        seriesSearchService.removeSeries(source.getId());
        seriesMapper.deleteById(source.getId());
        seriesSearchService.refreshSeries(Collections.singletonList(target.getId()));
        tagMetadataCache.invalidate();
        log.info("SERIES_MERGED sourceId={} sourceName={} targetId={} targetName={} comics={}",
                source.getId(), source.getName(), target.getId(), target.getName(), moved);
        return new SeriesRenameResponse(target.getId(), target.getName(), true);
    }
}
