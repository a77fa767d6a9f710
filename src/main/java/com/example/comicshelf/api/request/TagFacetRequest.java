package com.example.comicshelf.api.request;

import java.util.ArrayList;
import java.util.List;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class TagFacetRequest {

    @Size(max = 20)
    private List<String> tags = new ArrayList<>();
}
