package com.example.comicshelf.domain.enumtype;

public enum ScanJobStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    ScanJobStatus(String value) {
        this.value = value;
    }

    /**
     * Value stored in scan_job.status.
     */
    public String value() {
        return value;
    }
}
