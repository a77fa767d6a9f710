package com.example.comicshelf.application.service;

import com.example.comicshelf.infrastructure.persistence.entity.ScanJobEntity;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Live counters of one scan job. Mutated only by the thread running the job and flushed to the
 * scan_job row at progress boundaries.
 */
public class ScanJobProgress {

    public static final String PHASE_QUEUED = "Queued";
    public static final String PHASE_RESETTING = "Resetting library";
    public static final String PHASE_SYNC = "Phase 1: Syncing";
    public static final String PHASE_PROCESS = "Phase 2: Processing";
    public static final String PHASE_DONE = "Completed";

    private final int maxErrors;
    private final int maxErrorLength;

    private String phase = PHASE_QUEUED;
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
    private final List<String> errors = new ArrayList<>();
    private int droppedErrors;

    public ScanJobProgress(int maxErrors, int maxErrorLength) {
        this.maxErrors = Math.max(1, maxErrors);
        this.maxErrorLength = Math.max(16, maxErrorLength);
    }

    /**
     * Keeps the first {@code maxErrors} messages, each cut to {@code maxErrorLength}.
     */
    public void addError(String error) {
        if (error == null || error.isEmpty()) {
            return;
        }
        if (errors.size() >= maxErrors) {
            droppedErrors++;
            return;
        }
        errors.add(error.length() <= maxErrorLength ? error : error.substring(0, maxErrorLength));
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public int getDroppedErrors() {
        return droppedErrors;
    }

    public ScanJobEntity toEntity(Long jobId, String errorsJson) {
        ScanJobEntity entity = new ScanJobEntity();
        entity.setId(jobId);
        entity.setPhase(phase);
        entity.setCurrentFile(currentFile);
        entity.setTotalComics(totalComics);
        entity.setProcessedComics(processedComics);
        entity.setNewComics(newComics);
        entity.setChangedComics(changedComics);
        entity.setDeletedComics(deletedComics);
        entity.setProcessedPages(processedPages);
        entity.setPageErrors(pageErrors);
        entity.setProcessedThumbnails(processedThumbnails);
        entity.setThumbnailErrors(thumbnailErrors);
        entity.setThumbBytesWritten(thumbBytesWritten);
        entity.setThumbBytesSaved(thumbBytesSaved);
        entity.setErrors(errorsJson);
        return entity;
    }

    public String getPhase() {
        return phase;
    }

    public void setPhase(String phase) {
        this.phase = phase;
    }

    public String getCurrentFile() {
        return currentFile;
    }

    public void setCurrentFile(String currentFile) {
        this.currentFile = currentFile;
    }

    public int getTotalComics() {
        return totalComics;
    }

    public void setTotalComics(int totalComics) {
        this.totalComics = totalComics;
    }

    public int getProcessedComics() {
        return processedComics;
    }

    public void addProcessedComics(int delta) {
        processedComics += delta;
    }

    public int getNewComics() {
        return newComics;
    }

    public void setNewComics(int newComics) {
        this.newComics = newComics;
    }

    public int getChangedComics() {
        return changedComics;
    }

    public void setChangedComics(int changedComics) {
        this.changedComics = changedComics;
    }

    public int getDeletedComics() {
        return deletedComics;
    }

    public void setDeletedComics(int deletedComics) {
        this.deletedComics = deletedComics;
    }

    public int getProcessedPages() {
        return processedPages;
    }

    public void addProcessedPages(int delta) {
        processedPages += delta;
    }

    public int getPageErrors() {
        return pageErrors;
    }

    public void addPageErrors(int delta) {
        pageErrors += delta;
    }

    public int getProcessedThumbnails() {
        return processedThumbnails;
    }

    public void addProcessedThumbnails(int delta) {
        processedThumbnails += delta;
    }

    public int getThumbnailErrors() {
        return thumbnailErrors;
    }

    public void addThumbnailErrors(int delta) {
        thumbnailErrors += delta;
    }

    public long getThumbBytesWritten() {
        return thumbBytesWritten;
    }

    public void addThumbBytesWritten(long delta) {
        thumbBytesWritten += delta;
    }

    public long getThumbBytesSaved() {
        return thumbBytesSaved;
    }

    public void addThumbBytesSaved(long delta) {
        thumbBytesSaved += delta;
    }
}
