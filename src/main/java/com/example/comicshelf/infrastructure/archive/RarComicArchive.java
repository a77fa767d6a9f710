package com.example.comicshelf.infrastructure.archive;

import com.github.junrar.Archive;
import com.github.junrar.exception.RarException;
import com.github.junrar.rarfile.FileHeader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CBR reader. junrar extracts into a stream, so entries are buffered in memory one at a time.
 */
public class RarComicArchive implements ComicArchive {

    private final Archive archive;
    private final Map<String, FileHeader> headers = new LinkedHashMap<>();

    public RarComicArchive(File file) throws IOException {
        try {
            this.archive = new Archive(file);
        } catch (RarException e) {
            throw new IOException("Unreadable RAR archive: " + e.getMessage(), e);
        }
        for (FileHeader header : archive.getFileHeaders()) {
            if (!header.isDirectory()) {
                headers.put(header.getFileName().replace('\\', '/'), header);
            }
        }
    }

    @Override
    public List<String> entryNames() {
        return new ArrayList<>(headers.keySet());
    }

    @Override
    public InputStream openEntry(String name) throws IOException {
        FileHeader header = headers.get(name);
        if (header == null) {
            throw new FileNotFoundException("Entry not found in archive: " + name);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            archive.extractFile(header, out);
        } catch (RarException e) {
            throw new IOException("Failed to extract " + name + ": " + e.getMessage(), e);
        }
        return new ByteArrayInputStream(out.toByteArray());
    }

    @Override
    public void close() throws IOException {
        archive.close();
    }
}
