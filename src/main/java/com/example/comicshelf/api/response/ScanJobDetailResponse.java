package com.example.comicshelf.api.response;

import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanJobDetailResponse {

    private Long jobId;
    private String scanType;
    private String status;
    private String phase;
    private String currentFile;
    private int totalComics;
    private int processedComics;
    private int newComics;
    private int changedComics;
    private int deletedComics;
    private int processedPages;
    private int pageErrors;
    private int processedThumbnails;
    private int thumbnailErrors;
    private long thumbBytesWritten;
    private long thumbBytesSaved;
    private String thumbBytesWrittenText;
    private String thumbBytesSavedText;
    private List<String> errors;
    private String errorSummary;
    private boolean cancelRequested;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
}
