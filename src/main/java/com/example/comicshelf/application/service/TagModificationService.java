package com.example.comicshelf.application.service;

import com.example.comicshelf.api.request.TagModificationRequest;
import com.example.comicshelf.api.response.TagModificationResponse;
import com.example.comicshelf.common.exception.BusinessException;
import com.example.comicshelf.common.util.TagNormalizer;
import com.example.comicshelf.domain.enumtype.TagModificationAction;
import com.example.comicshelf.domain.model.TagMetadataSnapshot;
import com.example.comicshelf.infrastructure.persistence.entity.TagModificationEntity;
import com.example.comicshelf.infrastructure.persistence.mapper.TagModificationMapper;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TagModificationService {

    private static final Logger log = LoggerFactory.getLogger(TagModificationService.class);

    private final TagModificationMapper tagModificationMapper;
    private final TagMetadataCache tagMetadataCache;

    public TagModificationService(TagModificationMapper tagModificationMapper, TagMetadataCache tagMetadataCache) {
        this.tagModificationMapper = tagModificationMapper;
        this.tagMetadataCache = tagMetadataCache;
    }

    public List<TagModificationResponse> list() {
        List<TagModificationEntity> rows = tagModificationMapper.selectAll();
        List<TagModificationResponse> result = new ArrayList<>();
        if (rows == null) {
            return result;
        }
        for (TagModificationEntity row : rows) {
            result.add(toResponse(row));
        }
        return result;
    }

    public TagModificationResponse apply(TagModificationRequest request) {
        TagModificationAction action = TagModificationAction.fromValue(request.getAction());
        if (action == null) {
            throw new BusinessException("400", "不支持的标签操作: " + request.getAction());
        }
        switch (action) {
            case BLACKLIST:
                return blacklist(request.getTag());
            case WHITELIST:
                return whitelist(request.getTag(), request.getDisplay());
            case MERGE:
                return merge(request.getTag(), request.getTarget());
            default:
                throw new BusinessException("400", "不支持的标签操作: " + request.getAction());
        }
    }

    public TagModificationResponse blacklist(String tag) {
        String source = requireNorm(tag);
        TagModificationEntity entity = newEntity(source, TagModificationAction.BLACKLIST, null, null);
        return save(entity);
    }

    /**
     * Sets the display string for a tag. When the new display normalizes to a different tag that
     * already exists, the rule is stored as a merge into that tag instead.
     */
    public TagModificationResponse whitelist(String tag, String display) {
        String source = requireNorm(tag);
        String cleanDisplay = TagNormalizer.display(display);
        if (cleanDisplay.isEmpty()) {
            throw new BusinessException("400", "白名单需要提供显示名称");
        }
        String displayNorm = TagNormalizer.normalize(cleanDisplay);
        if (!displayNorm.isEmpty() && !displayNorm.equals(source)) {
            TagMetadataSnapshot snapshot = tagMetadataCache.getOrBuild();
            if (snapshot.getVocabulary().containsKey(displayNorm)) {
                log.info("TAG_WHITELIST_UPGRADED_TO_MERGE source={} target={}", source, displayNorm);
                return save(newEntity(source, TagModificationAction.MERGE, displayNorm, null));
            }
        }
        return save(newEntity(source, TagModificationAction.WHITELIST, null, cleanDisplay));
    }

    public TagModificationResponse merge(String tag, String target) {
        String source = requireNorm(tag);
        String targetNorm = requireNorm(target);
        if (source.equals(targetNorm)) {
            throw new BusinessException("400", "合并的源标签与目标标签相同");
        }
        return save(newEntity(source, TagModificationAction.MERGE, targetNorm, null));
    }

    public boolean remove(String tag) {
        String source = requireNorm(tag);
        int affected = tagModificationMapper.deleteBySource(source);
        if (affected > 0) {
            tagMetadataCache.invalidate();
            log.info("TAG_MODIFICATION_REMOVED source={}", source);
        }
        return affected > 0;
    }

    private TagModificationResponse save(TagModificationEntity entity) {
        tagModificationMapper.upsert(entity);
        tagMetadataCache.invalidate();
        log.info("TAG_MODIFICATION_SAVED source={} action={} target={} display={}",
                entity.getSourceNorm(), entity.getAction(), entity.getTargetNorm(), entity.getDisplayName());
        return toResponse(entity);
    }

    private String requireNorm(String tag) {
        String norm = TagNormalizer.normalize(tag);
        if (norm.isEmpty()) {
            throw new BusinessException("400", "标签不能为空");
        }
        return norm;
    }

    private TagModificationEntity newEntity(String source, TagModificationAction action, String target, String display) {
        TagModificationEntity entity = new TagModificationEntity();
        entity.setSourceNorm(source);
        entity.setAction(action.value());
        entity.setTargetNorm(target);
        entity.setDisplayName(display);
        return entity;
    }

    private TagModificationResponse toResponse(TagModificationEntity entity) {
        return new TagModificationResponse(entity.getSourceNorm(), entity.getAction(), entity.getTargetNorm(),
                entity.getDisplayName());
    }
}
