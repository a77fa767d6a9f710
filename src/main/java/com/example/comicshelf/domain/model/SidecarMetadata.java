package com.example.comicshelf.domain.model;

import lombok.Data;

/**
 * Series metadata read from a per-directory sidecar document. List-valued fields are kept as
 * JSON array text, ready for the series columns. Absent keys stay null so that an upsert
 * leaves the stored value untouched.
 */
@Data
public class SidecarMetadata {

    private String series;
    private String title;
    private String titleEnglish;
    private String titleJapanese;
    private String synonyms;
    private String authors;
    private String synopsis;
    private String genres;
    private String tags;
    private String demographics;
    private String status;
    private Integer totalVolumes;
    private Integer totalChapters;
    private Integer releaseYear;
    private Long malId;
    private Long anilistId;
    private Boolean adult;

    /**
     * Name that overrides the path-derived series name, if any.
     */
    public String preferredSeriesName() {
        if (series != null && !series.trim().isEmpty()) {
            return series.trim();
        }
        if (title != null && !title.trim().isEmpty()) {
            return title.trim();
        }
        return null;
    }
}
