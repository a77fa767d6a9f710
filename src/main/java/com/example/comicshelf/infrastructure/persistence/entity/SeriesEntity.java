package com.example.comicshelf.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

/**
 * List-valued columns (synonyms, authors, genres, tags, demographics) hold JSON arrays.
 */
@Data
public class SeriesEntity {

    private Long id;

    private String name;

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

    private String coverComicId;

    private String category;

    private String subcategory;

    private Integer isAdult;

    private Integer isNsfw;

    private Integer nsfwOverride;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
