package com.example.comicshelf.common.util;

import java.util.Locale;

public final class FileSizeFormatter {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private FileSizeFormatter() {
    }

    public static String format(long bytes) {
        double size = Math.max(0L, bytes);
        int unit = 0;
        while (size >= 1024.0 && unit < UNITS.length - 1) {
            size /= 1024.0;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", size, UNITS[unit]);
    }
}
