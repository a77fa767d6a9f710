package com.example.comicshelf.application.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.comicshelf.api.request.TagModificationRequest;
import com.example.comicshelf.api.response.TagModificationResponse;
import com.example.comicshelf.common.exception.BusinessException;
import com.example.comicshelf.domain.model.TagModification;
import com.example.comicshelf.infrastructure.persistence.entity.TagModificationEntity;
import com.example.comicshelf.infrastructure.persistence.mapper.TagModificationMapper;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class TagModificationServiceTest {

    private TagModificationMapper tagModificationMapper;
    private TagMetadataCache tagMetadataCache;
    private TagModificationService service;

    @BeforeEach
    void setUp() {
        tagModificationMapper = mock(TagModificationMapper.class);
        tagMetadataCache = mock(TagMetadataCache.class);
        when(tagMetadataCache.getOrBuild()).thenReturn(TagMetadataCache.build(Arrays.asList(
                TagMetadataCacheTest.series(1L, "Alpha", "[\"Shounen\",\"Sci-Fi\"]", null)),
                Collections.<TagModification>emptyList()));
        service = new TagModificationService(tagModificationMapper, tagMetadataCache);
    }

    @Test
    void shouldStoreNormalizedBlacklistAndInvalidateCache() {
        TagModificationResponse response = service.blacklist("  Gore!! ");

        Assertions.assertEquals("gore", response.getSourceNorm());
        Assertions.assertEquals("blacklist", response.getAction());
        verify(tagModificationMapper).upsert(any(TagModificationEntity.class));
        verify(tagMetadataCache).invalidate();
    }

    @Test
    void shouldUpgradeWhitelistToMergeWhenDisplayIsAnotherKnownTag() {
        TagModificationResponse response = service.whitelist("Shonen", "Shounen");

        Assertions.assertEquals("merge", response.getAction());
        Assertions.assertEquals("shonen", response.getSourceNorm());
        Assertions.assertEquals("shounen", response.getTargetNorm());
    }

    @Test
    void shouldKeepWhitelistWhenDisplayOnlyChangesCasing() {
        ArgumentCaptor<TagModificationEntity> captor = ArgumentCaptor.forClass(TagModificationEntity.class);

        TagModificationResponse response = service.whitelist("sci fi", "  SCI-FI ");

        Assertions.assertEquals("whitelist", response.getAction());
        verify(tagModificationMapper).upsert(captor.capture());
        Assertions.assertEquals("SCI-FI", captor.getValue().getDisplayName());
    }

    @Test
    void shouldRejectSelfMergeAndBlankTags() {
        BusinessException self = Assertions.assertThrows(BusinessException.class,
                () -> service.merge("Video Games", "video game"));
        BusinessException blank = Assertions.assertThrows(BusinessException.class,
                () -> service.blacklist(" - "));

        Assertions.assertEquals("400", self.getCode());
        Assertions.assertEquals("400", blank.getCode());
        verify(tagModificationMapper, never()).upsert(any(TagModificationEntity.class));
    }

    @Test
    void shouldDispatchRequestByAction() {
        TagModificationRequest request = new TagModificationRequest();
        request.setTag("Shonen");
        request.setAction("MERGE");
        request.setTarget("Battle");

        TagModificationResponse response = service.apply(request);

        Assertions.assertEquals("battle", response.getTargetNorm());
    }

    @Test
    void shouldInvalidateOnlyWhenRemovalDeletedARow() {
        when(tagModificationMapper.deleteBySource("gore")).thenReturn(0);
        Assertions.assertFalse(service.remove("Gore"));
        verify(tagMetadataCache, never()).invalidate();

        when(tagModificationMapper.deleteBySource("gore")).thenReturn(1);
        Assertions.assertTrue(service.remove("Gore"));
        verify(tagMetadataCache).invalidate();
    }
}
