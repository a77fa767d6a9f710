package com.example.comicshelf.infrastructure.persistence.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ComicProcessingUpdate {

    private String id;
    private int pages;
    private int hasThumbnail;
    private String thumbnailFormat;
}
