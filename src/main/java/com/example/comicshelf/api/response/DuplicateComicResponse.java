package com.example.comicshelf.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateComicResponse {

    private String id;
    private String path;
    private String series;
    private long sizeBytes;
}
