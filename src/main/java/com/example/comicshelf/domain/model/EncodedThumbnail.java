package com.example.comicshelf.domain.model;

import com.example.comicshelf.domain.enumtype.ThumbnailFormat;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class EncodedThumbnail {

    private byte[] bytes;

    /**
     * Format actually written, after any fallback.
     */
    private ThumbnailFormat format;

    /**
     * Bytes saved against the larger candidate in best mode, otherwise 0.
     */
    private long bytesSaved;
}
