package com.example.comicshelf.domain.model;

import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Compiled NSFW rule lists. Categories and subcategories are lowercase.
 */
@Getter
@AllArgsConstructor
public class NsfwRules {

    private final List<String> categories;
    private final List<String> subcategories;
    private final List<Pattern> tagPatterns;

    public static NsfwRules none() {
        return new NsfwRules(Collections.<String>emptyList(), Collections.<String>emptyList(),
                Collections.<Pattern>emptyList());
    }
}
