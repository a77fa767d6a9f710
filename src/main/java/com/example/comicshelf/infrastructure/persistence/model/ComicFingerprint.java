package com.example.comicshelf.infrastructure.persistence.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ComicFingerprint {

    private String id;
    private Double mtime;
    private Long sizeBytes;
}
