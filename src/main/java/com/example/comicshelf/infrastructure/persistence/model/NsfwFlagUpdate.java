package com.example.comicshelf.infrastructure.persistence.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NsfwFlagUpdate {

    private Long id;
    private int isNsfw;
}
