package com.example.comicshelf.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class TagModificationEntity {

    private String sourceNorm;

    private String action;

    private String targetNorm;

    private String displayName;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
