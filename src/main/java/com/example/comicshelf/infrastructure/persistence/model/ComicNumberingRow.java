package com.example.comicshelf.infrastructure.persistence.model;

import lombok.Data;

@Data
public class ComicNumberingRow {

    private String series;
    private Double volume;
    private Double chapter;
}
