package com.example.comicshelf.application.service;

import com.example.comicshelf.api.response.FanComicResponse;
import com.example.comicshelf.api.response.RelatedTagResponse;
import com.example.comicshelf.api.response.TagCountResponse;
import com.example.comicshelf.api.response.TagFacetResponse;
import com.example.comicshelf.api.response.TagFacetSeriesResponse;
import com.example.comicshelf.common.util.TagNormalizer;
import com.example.comicshelf.domain.model.SeriesTagProfile;
import com.example.comicshelf.domain.model.TagMetadataSnapshot;
import com.example.comicshelf.infrastructure.persistence.mapper.ComicMapper;
import com.example.comicshelf.infrastructure.persistence.model.FanComicRow;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TagTaxonomyService {

    private static final Logger log = LoggerFactory.getLogger(TagTaxonomyService.class);

    private static final int SAMPLE_LIMIT = 3;

    private static final Comparator<RelatedTagResponse> BY_COUNT_THEN_NAME = new Comparator<RelatedTagResponse>() {
        @Override
        public int compare(RelatedTagResponse a, RelatedTagResponse b) {
            int cmp = Integer.compare(b.getCount(), a.getCount());
            return cmp != 0 ? cmp : a.getName().compareTo(b.getName());
        }
    };

    private final TagMetadataCache tagMetadataCache;
    private final ComicMapper comicMapper;

    public TagTaxonomyService(TagMetadataCache tagMetadataCache, ComicMapper comicMapper) {
        this.tagMetadataCache = tagMetadataCache;
        this.comicMapper = comicMapper;
    }

    /**
     * Series whose expanded tag set holds every selected tag, plus facets over the other tags of
     * those series.
     */
    public TagFacetResponse findSeriesByTags(List<String> selectedTags) {
        TagMetadataSnapshot snapshot = tagMetadataCache.getOrBuild();
        Set<String> selected = resolveSelection(selectedTags, snapshot);

        List<SeriesTagProfile> matching = new ArrayList<>();
        Map<String, RelatedTagResponse> related = new HashMap<>();
        for (SeriesTagProfile profile : snapshot.getProfiles()) {
            if (!profile.getExpandedNorms().containsAll(selected)) {
                continue;
            }
            matching.add(profile);
            for (String norm : profile.getExpandedNorms()) {
                if (selected.contains(norm)) {
                    continue;
                }
                RelatedTagResponse tag = related.get(norm);
                if (tag == null) {
                    tag = new RelatedTagResponse();
                    tag.setName(snapshot.displayOf(norm));
                    tag.setNorm(norm);
                    related.put(norm, tag);
                }
                tag.setCount(tag.getCount() + 1);
                if (tag.getCovers().size() < SAMPLE_LIMIT && profile.getCoverComicId() != null) {
                    tag.getCovers().add(profile.getCoverComicId());
                }
                if (tag.getSeriesNames().size() < SAMPLE_LIMIT) {
                    tag.getSeriesNames().add(profile.displayName());
                }
            }
        }

        List<RelatedTagResponse> relatedTags = new ArrayList<>(related.values());
        Collections.sort(relatedTags, BY_COUNT_THEN_NAME);

        Map<Long, List<FanComicResponse>> fans = loadFanComics(matching);
        List<TagFacetSeriesResponse> series = new ArrayList<>(matching.size());
        for (SeriesTagProfile profile : matching) {
            List<FanComicResponse> comics = fans.get(profile.getId());
            series.add(new TagFacetSeriesResponse(profile.getId(), profile.getName(), profile.getTitle(),
                    profile.getCoverComicId(), profile.getTotalChapters() == null ? 0 : profile.getTotalChapters(),
                    comics == null ? Collections.<FanComicResponse>emptyList() : comics));
        }
        log.debug("TAG_FACET_QUERY selected={} matching={} related={}", selected, matching.size(), relatedTags.size());
        return new TagFacetResponse(matching.size(), relatedTags, series);
    }

    /**
     * Every resolved tag with the number of series carrying it, most used first.
     */
    public List<TagCountResponse> listTags() {
        TagMetadataSnapshot snapshot = tagMetadataCache.getOrBuild();
        Map<String, Integer> counts = new HashMap<>();
        for (SeriesTagProfile profile : snapshot.getProfiles()) {
            for (String norm : profile.getExpandedNorms()) {
                Integer count = counts.get(norm);
                counts.put(norm, count == null ? 1 : count + 1);
            }
        }
        List<TagCountResponse> result = new ArrayList<>();
        for (Map.Entry<String, String> entry : snapshot.getVocabulary().entrySet()) {
            Integer count = counts.get(entry.getKey());
            result.add(new TagCountResponse(entry.getValue(), entry.getKey(), count == null ? 0 : count));
        }
        Collections.sort(result, new Comparator<TagCountResponse>() {
            @Override
            public int compare(TagCountResponse a, TagCountResponse b) {
                int cmp = Integer.compare(b.getCount(), a.getCount());
                return cmp != 0 ? cmp : a.getName().compareTo(b.getName());
            }
        });
        return result;
    }

    private Set<String> resolveSelection(List<String> selectedTags, TagMetadataSnapshot snapshot) {
        Set<String> selected = new LinkedHashSet<>();
        if (selectedTags == null) {
            return selected;
        }
        for (String tag : selectedTags) {
            String norm = TagNormalizer.normalize(tag);
            if (norm.isEmpty()) {
                continue;
            }
            String resolved = snapshot.getResolver().resolve(norm);
            // a blacklisted selection can never match; keep the raw norm so the filter stays restrictive
            selected.add(resolved == null ? norm : resolved);
        }
        return selected;
    }

    private Map<Long, List<FanComicResponse>> loadFanComics(List<SeriesTagProfile> matching) {
        Map<Long, List<FanComicResponse>> result = new LinkedHashMap<>();
        if (matching.isEmpty()) {
            return result;
        }
        List<Long> ids = new ArrayList<>(matching.size());
        for (SeriesTagProfile profile : matching) {
            if (profile.getId() != null) {
                ids.add(profile.getId());
            }
        }
        if (ids.isEmpty()) {
            return result;
        }
        List<FanComicRow> rows = comicMapper.selectFanComics(ids, SAMPLE_LIMIT);
        if (rows == null) {
            return result;
        }
        for (FanComicRow row : rows) {
            List<FanComicResponse> bucket = result.get(row.getSeriesId());
            if (bucket == null) {
                bucket = new ArrayList<>();
                result.put(row.getSeriesId(), bucket);
            }
            if (bucket.size() < SAMPLE_LIMIT) {
                bucket.add(new FanComicResponse(row.getId(), row.getVolume(), row.getChapter(), row.getFilename()));
            }
        }
        return result;
    }
}
