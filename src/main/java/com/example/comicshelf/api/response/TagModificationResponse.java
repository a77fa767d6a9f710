package com.example.comicshelf.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TagModificationResponse {

    private String sourceNorm;
    private String action;
    private String targetNorm;
    private String displayName;
}
