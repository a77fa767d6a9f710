package com.example.comicshelf.infrastructure.archive;

import com.example.comicshelf.common.util.ComicFilenameParser;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

public final class ComicArchives {

    private ComicArchives() {
    }

    /**
     * Opens a container by file extension: cbz/zip through commons-compress, cbr/rar through junrar.
     */
    public static ComicArchive open(Path path) throws IOException {
        String ext = ComicFilenameParser.extension(path.getFileName().toString()).toLowerCase(Locale.ROOT);
        if ("cbz".equals(ext) || "zip".equals(ext)) {
            return new ZipComicArchive(path.toFile());
        }
        if ("cbr".equals(ext) || "rar".equals(ext)) {
            return new RarComicArchive(path.toFile());
        }
        throw new IOException("Unsupported archive type: " + ext);
    }
}
