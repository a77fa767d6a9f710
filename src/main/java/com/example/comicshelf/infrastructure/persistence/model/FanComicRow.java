package com.example.comicshelf.infrastructure.persistence.model;

import lombok.Data;

@Data
public class FanComicRow {

    private Long seriesId;
    private String id;
    private Double volume;
    private Double chapter;
    private String filename;
}
