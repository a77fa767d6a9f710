package com.example.comicshelf.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class TagModificationRequest {

    @NotBlank
    @Size(max = 255)
    private String tag;

    @NotBlank
    @Pattern(regexp = "(?i)blacklist|whitelist|merge")
    private String action;

    /**
     * Merge target, required for merge.
     */
    @Size(max = 255)
    private String target;

    /**
     * Display override, required for whitelist.
     */
    @Size(max = 255)
    private String display;
}
