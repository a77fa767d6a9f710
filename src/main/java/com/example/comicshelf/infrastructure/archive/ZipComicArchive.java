package com.example.comicshelf.infrastructure.archive;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;

/**
 * CBZ reader backed by the zip central directory.
 */
public class ZipComicArchive implements ComicArchive {

    private final ZipFile zipFile;

    public ZipComicArchive(File file) throws IOException {
        this.zipFile = ZipFile.builder()
                .setFile(file)
                .setUseUnicodeExtraFields(true)
                .get();
    }

    @Override
    public List<String> entryNames() {
        List<String> names = new ArrayList<>();
        Enumeration<ZipArchiveEntry> entries = zipFile.getEntries();
        while (entries.hasMoreElements()) {
            ZipArchiveEntry entry = entries.nextElement();
            if (!entry.isDirectory()) {
                names.add(entry.getName());
            }
        }
        return names;
    }

    @Override
    public InputStream openEntry(String name) throws IOException {
        ZipArchiveEntry entry = zipFile.getEntry(name);
        if (entry == null) {
            throw new FileNotFoundException("Entry not found in archive: " + name);
        }
        return zipFile.getInputStream(entry);
    }

    @Override
    public void close() throws IOException {
        zipFile.close();
    }
}
