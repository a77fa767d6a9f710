package com.example.comicshelf.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ComicEntity {

    /**
     * md5 of the absolute path.
     */
    private String id;

    private String path;

    private String filename;

    private String series;

    private Long seriesId;

    private String category;

    private String subcategory;

    private Long sizeBytes;

    private Double mtime;

    private Integer pages;

    private Integer processed;

    private Integer hasThumbnail;

    private String thumbnailFormat;

    private String fileHash;

    private Double volume;

    private Double chapter;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
