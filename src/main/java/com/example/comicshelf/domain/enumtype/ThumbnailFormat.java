package com.example.comicshelf.domain.enumtype;

import java.util.Locale;

public enum ThumbnailFormat {
    JPEG("jpeg", "jpg"),
    PNG("png", "png"),
    WEBP("webp", "webp"),
    /**
     * Encode jpeg and png, keep the smaller.
     */
    BEST(null, null);

    private final String writerName;
    private final String extension;

    ThumbnailFormat(String writerName, String extension) {
        this.writerName = writerName;
        this.extension = extension;
    }

    public String getWriterName() {
        return writerName;
    }

    public String getExtension() {
        return extension;
    }

    public static ThumbnailFormat fromSetting(String value) {
        if (value == null || value.trim().isEmpty()) {
            return WEBP;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("JPG".equals(normalized)) {
            return JPEG;
        }
        try {
            return ThumbnailFormat.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported thumbnail format: " + value, e);
        }
    }

    public static ThumbnailFormat fromExtension(String extension) {
        for (ThumbnailFormat format : values()) {
            if (format.extension != null && format.extension.equalsIgnoreCase(extension)) {
                return format;
            }
        }
        return null;
    }
}
