package com.example.comicshelf.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ScanJobEntity {

    private Long id;

    private String scanType;

    private String status;

    private String phase;

    private String currentFile;

    private Integer totalComics;

    private Integer processedComics;

    private Integer newComics;

    private Integer changedComics;

    private Integer deletedComics;

    private Integer processedPages;

    private Integer pageErrors;

    private Integer processedThumbnails;

    private Integer thumbnailErrors;

    private Long thumbBytesWritten;

    private Long thumbBytesSaved;

    /**
     * JSON array of per-item error messages, bounded.
     */
    private String errors;

    private String errorSummary;

    private Integer cancelRequested;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;
}
