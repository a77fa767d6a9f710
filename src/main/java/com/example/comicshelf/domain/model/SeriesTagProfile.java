package com.example.comicshelf.domain.model;

import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A series with its expanded, resolved tag norms.
 */
@Data
@AllArgsConstructor
public class SeriesTagProfile {

    private Long id;
    private String name;
    private String title;
    private String coverComicId;
    private Integer totalChapters;
    private Set<String> expandedNorms;

    public String displayName() {
        return title != null && !title.trim().isEmpty() ? title : name;
    }
}
