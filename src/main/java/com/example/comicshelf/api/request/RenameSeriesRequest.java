package com.example.comicshelf.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class RenameSeriesRequest {

    @NotBlank
    @Size(max = 255)
    private String name;
}
