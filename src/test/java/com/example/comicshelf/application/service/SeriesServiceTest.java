package com.example.comicshelf.application.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.comicshelf.api.response.SeriesRenameResponse;
import com.example.comicshelf.common.exception.BusinessException;
import com.example.comicshelf.infrastructure.persistence.entity.SeriesEntity;
import com.example.comicshelf.infrastructure.persistence.mapper.ComicMapper;
import com.example.comicshelf.infrastructure.persistence.mapper.SeriesMapper;
import java.util.Collections;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class SeriesServiceTest {

    private SeriesMapper seriesMapper;
    private ComicMapper comicMapper;
    private SeriesSearchService seriesSearchService;
    private TagMetadataCache tagMetadataCache;
    private SeriesService service;

    @BeforeEach
    void setUp() {
        seriesMapper = mock(SeriesMapper.class);
        comicMapper = mock(ComicMapper.class);
        seriesSearchService = mock(SeriesSearchService.class);
        tagMetadataCache = mock(TagMetadataCache.class);
        service = new SeriesService(seriesMapper, comicMapper, seriesSearchService, tagMetadataCache);
        when(seriesMapper.selectById(1L)).thenReturn(series(1L, "Shingeki no Kyojin"));
    }

    @Test
    void shouldRenameInPlaceWhenNameIsFree() {
        SeriesRenameResponse response = service.rename(1L, "  Attack on Titan ");

        Assertions.assertEquals(Long.valueOf(1L), response.getSeriesId());
        Assertions.assertEquals("Attack on Titan", response.getName());
        Assertions.assertFalse(response.isMerged());
        verify(seriesMapper).updateName(1L, "Attack on Titan");
        verify(comicMapper).repointSeries(1L, "Shingeki no Kyojin", 1L, "Attack on Titan");
        verify(seriesSearchService).refreshSeries(Collections.singletonList(1L));
        verify(tagMetadataCache).invalidate();
        verify(seriesMapper, never()).deleteById(anyLong());
    }

    @Test
    void shouldMergeIntoSeriesThatAlreadyHasTheName() {
        when(seriesMapper.selectByName("Attack on Titan")).thenReturn(series(2L, "Attack on Titan"));

        SeriesRenameResponse response = service.rename(1L, "Attack on Titan");

        Assertions.assertEquals(Long.valueOf(2L), response.getSeriesId());
        Assertions.assertTrue(response.isMerged());
        InOrder order = inOrder(seriesMapper, comicMapper, seriesSearchService, tagMetadataCache);
        order.verify(seriesMapper).mergeInto(1L, 2L);
        order.verify(comicMapper).repointSeries(1L, "Shingeki no Kyojin", 2L, "Attack on Titan");
        order.verify(seriesSearchService).removeSeries(1L);
        order.verify(seriesMapper).deleteById(1L);
        order.verify(seriesSearchService).refreshSeries(Collections.singletonList(2L));
        order.verify(tagMetadataCache).invalidate();
        verify(seriesMapper, never()).updateName(anyLong(), anyString());
    }

    @Test
    void shouldDoNothingForSameName() {
        SeriesRenameResponse response = service.rename(1L, "Shingeki no Kyojin");

        Assertions.assertFalse(response.isMerged());
        verifyNoInteractions(comicMapper, seriesSearchService, tagMetadataCache);
    }

    @Test
    void shouldRejectBlankNameAndUnknownSeries() {
        BusinessException blank = Assertions.assertThrows(BusinessException.class, () -> service.rename(1L, " "));
        BusinessException missing = Assertions.assertThrows(BusinessException.class,
                () -> service.rename(77L, "Anything"));

        Assertions.assertEquals("400", blank.getCode());
        Assertions.assertEquals("404", missing.getCode());
        verify(seriesMapper, never()).mergeInto(any(), any());
    }

    private static SeriesEntity series(Long id, String name) {
        SeriesEntity entity = new SeriesEntity();
        entity.setId(id);
        entity.setName(name);
        return entity;
    }
}
