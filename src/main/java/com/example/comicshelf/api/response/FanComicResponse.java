package com.example.comicshelf.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FanComicResponse {

    private String id;
    private Double volume;
    private Double chapter;
    private String filename;
}
