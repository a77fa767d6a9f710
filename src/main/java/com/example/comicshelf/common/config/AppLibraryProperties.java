package com.example.comicshelf.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.library")
public class AppLibraryProperties {

    /**
     * Library root directories. Each one is walked independently during sync.
     */
    private List<String> roots = new ArrayList<>();

    /**
     * Per-directory metadata document name, inherited by all subdirectories.
     */
    private String sidecarFileName = "series.json";

    private List<String> archiveExtensions = new ArrayList<>(Arrays.asList("cbz", "cbr"));

    private List<String> imageExtensions = new ArrayList<>(Arrays.asList("jpg", "jpeg", "png", "gif", "bmp", "webp"));

    /**
     * Category assigned to archives placed directly under a root.
     */
    private String defaultCategory = "Uncategorized";

    public Set<String> normalizedArchiveExtensions() {
        return normalize(archiveExtensions);
    }

    public Set<String> normalizedImageExtensions() {
        return normalize(imageExtensions);
    }

    private Set<String> normalize(List<String> extensions) {
        Set<String> result = new LinkedHashSet<>();
        if (extensions == null) {
            return result;
        }
        for (String ext : extensions) {
            if (ext == null || ext.trim().isEmpty()) {
                continue;
            }
            String value = ext.trim().toLowerCase(Locale.ROOT);
            if (value.startsWith(".")) {
                value = value.substring(1);
            }
            result.add(value);
        }
        return result;
    }
}
