package com.example.comicshelf.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeriesSearchItemResponse {

    private Long id;
    private String name;
    private String title;
    private String titleEnglish;
    private String category;
    private String subcategory;
    private String coverComicId;
    private boolean nsfw;
}
