package com.example.comicshelf.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Outcome of inspecting one archive. Failures are carried in {@link #errors}, never thrown.
 */
@Data
public class InspectionResult {

    private String comicId;
    private String path;
    private int pages;
    private boolean hasThumbnail;
    private String thumbnailFormat;
    private long bytesWritten;
    private long bytesSaved;
    private boolean fileMissing;
    private List<String> errors = new ArrayList<>();

    public InspectionResult() {
    }

    public InspectionResult(String comicId, String path) {
        this.comicId = comicId;
        this.path = path;
    }

    public void addError(String error) {
        errors.add(error);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public static InspectionResult failed(String comicId, String path, String error) {
        InspectionResult result = new InspectionResult(comicId, path);
        result.addError(error);
        return result;
    }
}
