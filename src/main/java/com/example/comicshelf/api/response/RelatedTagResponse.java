package com.example.comicshelf.api.response;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RelatedTagResponse {

    private String name;
    private String norm;
    private int count;
    private List<String> covers = new ArrayList<>();
    private List<String> seriesNames = new ArrayList<>();
}
