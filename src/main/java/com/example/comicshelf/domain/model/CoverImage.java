package com.example.comicshelf.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CoverImage {

    private byte[] bytes;
    private String contentType;

    /**
     * True when the bytes are the "Generating..." card rather than the comic's cover.
     */
    private boolean placeholder;
}
