package com.example.comicshelf.api.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TagFacetResponse {

    private int matchingCount;
    private List<RelatedTagResponse> relatedTags;
    private List<TagFacetSeriesResponse> series;
}
