package com.example.comicshelf.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ComicNumbering {

    private Double volume;
    private Double chapter;
}
