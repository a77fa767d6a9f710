package com.example.comicshelf.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable result of one tag metadata build.
 */
public final class TagMetadataSnapshot {

    private final Map<String, String> vocabulary;
    private final Map<String, Set<String>> containment;
    private final Map<String, List<String>> firstWordIndex;
    private final List<SeriesTagProfile> profiles;
    private final TagModificationResolver resolver;
    private final long builtAt;

    public TagMetadataSnapshot(Map<String, String> vocabulary,
                               Map<String, Set<String>> containment,
                               Map<String, List<String>> firstWordIndex,
                               List<SeriesTagProfile> profiles,
                               TagModificationResolver resolver,
                               long builtAt) {
        this.vocabulary = Collections.unmodifiableMap(vocabulary);
        this.containment = Collections.unmodifiableMap(containment);
        this.firstWordIndex = Collections.unmodifiableMap(firstWordIndex);
        this.profiles = Collections.unmodifiableList(profiles);
        this.resolver = resolver;
        this.builtAt = builtAt;
    }

    /**
     * norm -> display string.
     */
    public Map<String, String> getVocabulary() {
        return vocabulary;
    }

    /**
     * child norm -> parent norms that occur in it as whole words.
     */
    public Map<String, Set<String>> getContainment() {
        return containment;
    }

    public Set<String> parentsOf(String norm) {
        Set<String> parents = containment.get(norm);
        return parents == null ? Collections.<String>emptySet() : parents;
    }

    public Map<String, List<String>> getFirstWordIndex() {
        return firstWordIndex;
    }

    public List<SeriesTagProfile> getProfiles() {
        return profiles;
    }

    public TagModificationResolver getResolver() {
        return resolver;
    }

    public long getBuiltAt() {
        return builtAt;
    }

    public String displayOf(String norm) {
        String display = vocabulary.get(norm);
        return display == null ? norm : display;
    }
}
