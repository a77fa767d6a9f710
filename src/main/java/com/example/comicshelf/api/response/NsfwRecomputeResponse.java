package com.example.comicshelf.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NsfwRecomputeResponse {

    private int total;
    private int changed;
    private int flagged;
}
