package com.example.comicshelf.common.util;

import com.example.comicshelf.domain.model.ComicNumbering;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ComicFilenameParser {

    private static final Pattern VOLUME = Pattern.compile("\\bv(?:ol)?\\.?\\s*(\\d+(?:\\.\\d+)?)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CHAPTER = Pattern.compile("\\b(?:c|ch|chapter|unit)\\.?\\s*(\\d+(?:\\.\\d+)?)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_NUMBER = Pattern.compile("\\s(\\d+(?:\\.\\d+)?)$");
    private static final Pattern NUMBERING_SUFFIX = Pattern.compile("\\s*(v|c|vol|chapter|ch)\\s*\\.?\\s*\\d+.*$",
            Pattern.CASE_INSENSITIVE);

    private ComicFilenameParser() {
    }

    public static String stripExtension(String filename) {
        if (filename == null) {
            return null;
        }
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    public static String extension(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return dot >= 0 && dot < filename.length() - 1 ? filename.substring(dot + 1) : "";
    }

    /**
     * Volume and chapter numbers. A bare trailing number counts as the chapter when neither marker is present.
     */
    public static ComicNumbering parseNumbering(String filename) {
        String name = stripExtension(filename);
        if (name == null) {
            return new ComicNumbering(null, null);
        }
        Double volume = null;
        Double chapter = null;
        Matcher v = VOLUME.matcher(name);
        if (v.find()) {
            volume = Double.valueOf(v.group(1));
        }
        Matcher c = CHAPTER.matcher(name);
        if (c.find()) {
            chapter = Double.valueOf(c.group(1));
        }
        if (volume == null && chapter == null) {
            Matcher end = TRAILING_NUMBER.matcher(name);
            if (end.find()) {
                chapter = Double.valueOf(end.group(1));
            }
        }
        return new ComicNumbering(volume, chapter);
    }

    /**
     * Series name guessed from a file that sits too shallow for a series directory.
     */
    public static String seriesFromFilename(String filename) {
        String stem = stripExtension(filename);
        String stripped = NUMBERING_SUFFIX.matcher(stem).replaceFirst("").trim();
        return stripped.isEmpty() ? stem.trim() : stripped;
    }
}
