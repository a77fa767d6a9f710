package com.example.comicshelf.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies tag modifications to normalized tags. Immutable once built.
 */
public class TagModificationResolver {

    private static final TagModificationResolver EMPTY = new TagModificationResolver(Collections.<TagModification>emptyList());

    private final Map<String, TagModification> bySource;

    public TagModificationResolver(Collection<TagModification> modifications) {
        Map<String, TagModification> map = new HashMap<>();
        for (TagModification modification : modifications) {
            if (modification != null) {
                map.put(modification.getSourceNorm(), modification);
            }
        }
        this.bySource = Collections.unmodifiableMap(map);
    }

    public static TagModificationResolver empty() {
        return EMPTY;
    }

    /**
     * Canonical norm after following merges, or {@code null} when the chain reaches a blacklisted
     * tag. A cycle resolves to its smallest member so every member agrees on one value.
     */
    public String resolve(String norm) {
        if (norm == null || norm.isEmpty()) {
            return null;
        }
        List<String> path = new ArrayList<>();
        Set<String> visited = new LinkedHashSet<>();
        String current = norm;
        while (true) {
            TagModification modification = bySource.get(current);
            if (modification instanceof TagModification.Blacklist) {
                return null;
            }
            if (!visited.add(current)) {
                int start = path.indexOf(current);
                String smallest = current;
                for (int i = start; i < path.size(); i++) {
                    if (path.get(i).compareTo(smallest) < 0) {
                        smallest = path.get(i);
                    }
                }
                return smallest;
            }
            path.add(current);
            if (!(modification instanceof TagModification.Merge)) {
                return current;
            }
            current = ((TagModification.Merge) modification).getTargetNorm();
        }
    }

    public boolean isBlacklisted(String norm) {
        return bySource.get(norm) instanceof TagModification.Blacklist;
    }

    /**
     * Whitelisted display for a canonical norm, if any.
     */
    public String displayOverride(String norm) {
        TagModification modification = bySource.get(norm);
        if (modification instanceof TagModification.Whitelist) {
            return ((TagModification.Whitelist) modification).getDisplay();
        }
        return null;
    }

    public Collection<TagModification> all() {
        return bySource.values();
    }
}
