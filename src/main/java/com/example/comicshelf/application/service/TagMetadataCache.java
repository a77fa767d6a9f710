package com.example.comicshelf.application.service;

import com.example.comicshelf.common.util.TagNormalizer;
import com.example.comicshelf.domain.model.SeriesTagProfile;
import com.example.comicshelf.domain.model.TagMetadataSnapshot;
import com.example.comicshelf.domain.model.TagModification;
import com.example.comicshelf.domain.model.TagModificationResolver;
import com.example.comicshelf.infrastructure.persistence.entity.SeriesEntity;
import com.example.comicshelf.infrastructure.persistence.entity.TagModificationEntity;
import com.example.comicshelf.infrastructure.persistence.mapper.SeriesMapper;
import com.example.comicshelf.infrastructure.persistence.mapper.TagModificationMapper;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-wide tag metadata, built lazily on first access and dropped by {@link #invalidate()}.
 * There is no expiry: every write that changes series tags or tag modifications must invalidate.
 */
@Component
public class TagMetadataCache {

    private static final Logger log = LoggerFactory.getLogger(TagMetadataCache.class);

    private static final int MIN_INDEXED_LENGTH = 3;

    private final SeriesMapper seriesMapper;
    private final TagModificationMapper tagModificationMapper;

    private final Object buildLock = new Object();
    private final AtomicLong generation = new AtomicLong();
    private volatile TagMetadataSnapshot snapshot;

    public TagMetadataCache(SeriesMapper seriesMapper, TagModificationMapper tagModificationMapper) {
        this.seriesMapper = seriesMapper;
        this.tagModificationMapper = tagModificationMapper;
    }

    public TagMetadataSnapshot getOrBuild() {
        TagMetadataSnapshot current = snapshot;
        if (current != null) {
            return current;
        }
        synchronized (buildLock) {
            current = snapshot;
            if (current != null) {
                return current;
            }
            long startGeneration = generation.get();
            long start = System.currentTimeMillis();
            TagMetadataSnapshot built = build(seriesMapper.selectTagSources(), loadModifications());
            // an invalidate during the build means the data read may already be stale
            if (generation.get() == startGeneration) {
                snapshot = built;
            }
            log.info("TAG_CACHE_BUILT series={} vocabulary={} containment={} costMs={}",
                    built.getProfiles().size(), built.getVocabulary().size(), built.getContainment().size(),
                    System.currentTimeMillis() - start);
            return built;
        }
    }

    public void invalidate() {
        generation.incrementAndGet();
        snapshot = null;
        log.debug("TAG_CACHE_INVALIDATED");
    }

    public boolean isBuilt() {
        return snapshot != null;
    }

    private List<TagModification> loadModifications() {
        List<TagModificationEntity> rows = tagModificationMapper.selectAll();
        List<TagModification> result = new ArrayList<>();
        if (rows == null) {
            return result;
        }
        for (TagModificationEntity row : rows) {
            TagModification modification = TagModification.of(
                    row.getSourceNorm(), row.getAction(), row.getTargetNorm(), row.getDisplayName());
            if (modification == null) {
                log.warn("TAG_MODIFICATION_IGNORED source={} action={}", row.getSourceNorm(), row.getAction());
                continue;
            }
            result.add(modification);
        }
        return result;
    }

    static TagMetadataSnapshot build(List<SeriesEntity> seriesRows, List<TagModification> modifications) {
        TagModificationResolver resolver = new TagModificationResolver(modifications);
        List<SeriesEntity> rows = seriesRows == null ? Collections.<SeriesEntity>emptyList() : seriesRows;

        Map<String, String> vocabulary = new TreeMap<>();
        // norms as written, merge sources included; text hits are resolved afterwards
        Set<String> textTerms = new TreeSet<>();
        List<Set<String>> explicitBySeries = new ArrayList<>(rows.size());
        for (SeriesEntity row : rows) {
            Set<String> explicit = new LinkedHashSet<>();
            for (String raw : rawTags(row)) {
                String norm = TagNormalizer.normalize(raw);
                String resolved = resolver.resolve(norm);
                if (resolved == null) {
                    continue;
                }
                textTerms.add(norm);
                textTerms.add(resolved);
                explicit.add(resolved);
                offerDisplay(vocabulary, resolved, TagNormalizer.display(raw));
            }
            explicitBySeries.add(explicit);
        }
        for (TagModification modification : resolver.all()) {
            if (modification instanceof TagModification.Whitelist
                    && vocabulary.containsKey(modification.getSourceNorm())) {
                vocabulary.put(modification.getSourceNorm(), ((TagModification.Whitelist) modification).getDisplay());
            }
        }

        Map<String, Set<String>> containment = computeContainment(vocabulary.keySet());
        Map<String, List<String>> firstWordIndex = buildFirstWordIndex(textTerms);

        List<SeriesTagProfile> profiles = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            SeriesEntity row = rows.get(i);
            Set<String> expanded = new TreeSet<>();
            for (String norm : explicitBySeries.get(i)) {
                addWithParents(expanded, norm, containment);
            }
            String text = join(row.getTitle(), row.getName(), row.getSynopsis());
            for (String match : findTextMatches(text, firstWordIndex)) {
                String resolved = resolver.resolve(match);
                if (resolved != null) {
                    addWithParents(expanded, resolved, containment);
                }
            }
            profiles.add(new SeriesTagProfile(row.getId(), row.getName(), row.getTitle(), row.getCoverComicId(),
                    row.getTotalChapters(), Collections.unmodifiableSet(expanded)));
        }
        return new TagMetadataSnapshot(vocabulary, containment, firstWordIndex, profiles, resolver,
                System.currentTimeMillis());
    }

    /**
     * Parent norms for every multi-word norm: strictly shorter norms occurring in it as whole words.
     */
    static Map<String, Set<String>> computeContainment(Collection<String> norms) {
        List<String> sorted = new ArrayList<>(new TreeSet<>(norms));
        Map<String, Set<String>> containment = new HashMap<>();
        for (String child : sorted) {
            if (child.indexOf(' ') < 0) {
                continue;
            }
            String paddedChild = " " + child + " ";
            for (String parent : sorted) {
                if (parent.length() >= child.length()) {
                    continue;
                }
                if (paddedChild.contains(" " + parent + " ")) {
                    Set<String> parents = containment.get(child);
                    if (parents == null) {
                        parents = new TreeSet<>();
                        containment.put(child, parents);
                    }
                    parents.add(parent);
                }
            }
        }
        for (Map.Entry<String, Set<String>> entry : containment.entrySet()) {
            entry.setValue(Collections.unmodifiableSet(entry.getValue()));
        }
        return containment;
    }

    static Map<String, List<String>> buildFirstWordIndex(Collection<String> norms) {
        Map<String, List<String>> index = new HashMap<>();
        for (String norm : new TreeSet<>(norms)) {
            if (norm.length() < MIN_INDEXED_LENGTH) {
                continue;
            }
            int space = norm.indexOf(' ');
            String firstWord = space < 0 ? norm : norm.substring(0, space);
            List<String> bucket = index.get(firstWord);
            if (bucket == null) {
                bucket = new ArrayList<>();
                index.put(firstWord, bucket);
            }
            bucket.add(norm);
        }
        return index;
    }

    /**
     * Known tags occurring in free text on word boundaries. The last word of a tag also matches its plural.
     */
    static Set<String> findTextMatches(String text, Map<String, List<String>> firstWordIndex) {
        Set<String> matches = new LinkedHashSet<>();
        List<String> tokens = TagNormalizer.tokenize(text);
        if (tokens.isEmpty() || firstWordIndex.isEmpty()) {
            return matches;
        }
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            List<String> candidates = new ArrayList<>();
            List<String> direct = firstWordIndex.get(token);
            if (direct != null) {
                candidates.addAll(direct);
            }
            String singular = TagNormalizer.singularize(token);
            if (!singular.equals(token)) {
                List<String> plural = firstWordIndex.get(singular);
                if (plural != null) {
                    candidates.addAll(plural);
                }
            }
            for (String candidate : candidates) {
                if (!matches.contains(candidate) && tokensMatch(tokens, i, candidate)) {
                    matches.add(candidate);
                }
            }
        }
        return matches;
    }

    private static boolean tokensMatch(List<String> tokens, int offset, String norm) {
        List<String> expected = Arrays.asList(norm.split(" "));
        if (offset + expected.size() > tokens.size()) {
            return false;
        }
        int last = expected.size() - 1;
        for (int j = 0; j < expected.size(); j++) {
            String actual = tokens.get(offset + j);
            String want = expected.get(j);
            if (actual.equals(want)) {
                continue;
            }
            if (j == last && TagNormalizer.singularize(actual).equals(want)) {
                continue;
            }
            return false;
        }
        return true;
    }

    private static void addWithParents(Set<String> target, String norm, Map<String, Set<String>> containment) {
        target.add(norm);
        Set<String> parents = containment.get(norm);
        if (parents != null) {
            target.addAll(parents);
        }
    }

    private static void offerDisplay(Map<String, String> vocabulary, String norm, String display) {
        if (display.isEmpty()) {
            return;
        }
        String existing = vocabulary.get(norm);
        if (existing == null) {
            vocabulary.put(norm, display);
        } else if (Character.isUpperCase(display.charAt(0)) && !Character.isUpperCase(existing.charAt(0))) {
            vocabulary.put(norm, display);
        }
    }

    private static List<String> rawTags(SeriesEntity row) {
        List<String> tags = new ArrayList<>();
        tags.addAll(TagNormalizer.extractTags(row.getGenres()));
        tags.addAll(TagNormalizer.extractTags(row.getTags()));
        tags.addAll(TagNormalizer.extractTags(row.getDemographics()));
        return tags;
    }

    private static String join(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part != null) {
                sb.append(part).append(' ');
            }
        }
        return sb.toString();
    }
}
