package com.example.comicshelf.api.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TagFacetSeriesResponse {

    private Long id;
    private String name;
    private String title;
    private String coverComicId;
    private Integer count;
    private List<FanComicResponse> comics;
}
