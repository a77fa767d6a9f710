package com.example.comicshelf.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class HashBackfillResponse {

    private int hashed;
    private int skipped;
}
