package com.example.comicshelf.domain.enumtype;

public enum ScanType {
    FULL,
    INCREMENTAL,
    RESCAN
}
