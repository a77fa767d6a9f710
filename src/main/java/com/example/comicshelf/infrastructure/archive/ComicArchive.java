package com.example.comicshelf.infrastructure.archive;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Read-only view of a comic container.
 */
public interface ComicArchive extends Closeable {

    /**
     * Names of all file entries, in archive order. Directories are skipped.
     */
    List<String> entryNames();

    InputStream openEntry(String name) throws IOException;
}
