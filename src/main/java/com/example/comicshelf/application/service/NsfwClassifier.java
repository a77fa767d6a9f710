package com.example.comicshelf.application.service;

import com.example.comicshelf.common.config.AppNsfwProperties;
import com.example.comicshelf.common.exception.BusinessException;
import com.example.comicshelf.common.util.GlobPattern;
import com.example.comicshelf.common.util.TagNormalizer;
import com.example.comicshelf.domain.model.NsfwRules;
import com.example.comicshelf.infrastructure.persistence.entity.SeriesEntity;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Decides is_nsfw for one series. Precedence: manual override, adult flag, category substring,
 * exact subcategory, then tag patterns.
 */
@Component
public class NsfwClassifier {

    private final AppNsfwProperties appNsfwProperties;

    public NsfwClassifier(AppNsfwProperties appNsfwProperties) {
        this.appNsfwProperties = appNsfwProperties;
    }

    public NsfwRules currentRules() {
        return compile(appNsfwProperties.getCategories(), appNsfwProperties.getSubcategories(),
                appNsfwProperties.getTagPatterns());
    }

    public static NsfwRules compile(List<String> categories, List<String> subcategories, List<String> tagPatterns) {
        List<Pattern> patterns = new ArrayList<>();
        for (String glob : cleanLower(tagPatterns)) {
            try {
                patterns.add(GlobPattern.compile(singularizeTrailingWord(glob)));
            } catch (IllegalArgumentException e) {
                throw new BusinessException("400", "NSFW 标签规则不合法: " + glob, "请检查 app.nsfw.tag-patterns 配置");
            }
        }
        return new NsfwRules(cleanLower(categories), cleanLower(subcategories), patterns);
    }

    public boolean classify(SeriesEntity series, NsfwRules rules) {
        if (series == null) {
            return false;
        }
        if (series.getNsfwOverride() != null) {
            return series.getNsfwOverride() != 0;
        }
        if (series.getIsAdult() != null && series.getIsAdult() != 0) {
            return true;
        }
        String category = lower(series.getCategory());
        if (!category.isEmpty()) {
            for (String entry : rules.getCategories()) {
                if (category.contains(entry)) {
                    return true;
                }
            }
        }
        String subcategory = lower(series.getSubcategory());
        if (!subcategory.isEmpty() && rules.getSubcategories().contains(subcategory)) {
            return true;
        }
        if (rules.getTagPatterns().isEmpty()) {
            return false;
        }
        List<String> rawTags = new ArrayList<>();
        rawTags.addAll(TagNormalizer.extractTags(series.getGenres()));
        rawTags.addAll(TagNormalizer.extractTags(series.getTags()));
        rawTags.addAll(TagNormalizer.extractTags(series.getDemographics()));
        for (String raw : rawTags) {
            String norm = TagNormalizer.normalize(raw);
            if (norm.isEmpty()) {
                continue;
            }
            for (Pattern pattern : rules.getTagPatterns()) {
                if (pattern.matcher(norm).matches()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Tags are matched in normalized form, whose last word is singular, so a pattern ending in a
     * plural word ({@code * breasts}) is rewritten to its singular ({@code * breast}).
     */
    static String singularizeTrailingWord(String glob) {
        int end = glob.length();
        int start = end;
        while (start > 0 && Character.isLetterOrDigit(glob.charAt(start - 1))) {
            start--;
        }
        if (start == end) {
            return glob;
        }
        return glob.substring(0, start) + TagNormalizer.singularize(glob.substring(start));
    }

    private static List<String> cleanLower(List<String> values) {
        List<String> result = new ArrayList<>();
        if (values == null) {
            return result;
        }
        for (String value : values) {
            String cleaned = lower(value);
            if (!cleaned.isEmpty()) {
                result.add(cleaned);
            }
        }
        return result;
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
