package com.example.comicshelf.api.request;

import lombok.Data;

@Data
public class NsfwOverrideRequest {

    /**
     * true or false forces the flag; null clears the override.
     */
    private Boolean override;
}
