package com.example.comicshelf.infrastructure.archive;

import com.example.comicshelf.common.config.AppLibraryProperties;
import com.example.comicshelf.common.util.ComicFilenameParser;
import com.example.comicshelf.common.util.NaturalSortComparator;
import com.example.comicshelf.domain.model.EncodedThumbnail;
import com.example.comicshelf.domain.model.InspectionResult;
import com.example.comicshelf.infrastructure.thumbnail.ThumbnailEncoder;
import com.example.comicshelf.infrastructure.thumbnail.ThumbnailStore;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Counts pages and extracts the cover of one archive. Every failure is reported inside the
 * returned {@link InspectionResult}; nothing is thrown to the caller.
 */
@Component
public class ArchiveInspector {

    private static final Logger log = LoggerFactory.getLogger(ArchiveInspector.class);

    private final Set<String> imageExtensions;
    private final ThumbnailEncoder thumbnailEncoder;
    private final ThumbnailStore thumbnailStore;

    public ArchiveInspector(AppLibraryProperties appLibraryProperties,
                            ThumbnailEncoder thumbnailEncoder,
                            ThumbnailStore thumbnailStore) {
        this.imageExtensions = appLibraryProperties.normalizedImageExtensions();
        this.thumbnailEncoder = thumbnailEncoder;
        this.thumbnailStore = thumbnailStore;
    }

    public InspectionResult inspect(String comicId, Path path) {
        return inspect(comicId, path, comicId);
    }

    /**
     * @param outputId file name stem for the thumbnail, the comic id or a temp id for on-demand runs
     */
    public InspectionResult inspect(String comicId, Path path, String outputId) {
        InspectionResult result = new InspectionResult(comicId, path.toString());
        if (!Files.isRegularFile(path)) {
            result.setFileMissing(true);
            result.addError("File not found: " + path);
            return result;
        }

        List<String> pages;
        try (ComicArchive archive = ComicArchives.open(path)) {
            pages = imageEntries(archive.entryNames());
            result.setPages(pages.size());
            if (pages.isEmpty()) {
                result.addError("No images in archive: " + path.getFileName());
                return result;
            }
            EncodedThumbnail thumbnail;
            try (InputStream in = archive.openEntry(pages.get(0))) {
                thumbnail = thumbnailEncoder.encode(in);
            }
            thumbnailStore.write(outputId, thumbnail);
            result.setHasThumbnail(true);
            result.setThumbnailFormat(thumbnail.getFormat().getExtension());
            result.setBytesWritten(thumbnail.getBytes().length);
            result.setBytesSaved(thumbnail.getBytesSaved());
        } catch (IOException | RuntimeException e) {
            log.debug("ARCHIVE_INSPECT_FAILED comicId={} path={} error={}", comicId, path, e.getMessage());
            result.addError(path.getFileName() + ": " + describe(e));
        }
        return result;
    }

    /**
     * Image entry names of an archive in reading order.
     */
    List<String> imageEntries(List<String> names) {
        List<String> images = new ArrayList<>();
        for (String name : names) {
            String ext = ComicFilenameParser.extension(name).toLowerCase(Locale.ROOT);
            if (imageExtensions.contains(ext)) {
                images.add(name);
            }
        }
        Collections.sort(images, NaturalSortComparator.INSTANCE);
        return images;
    }

    private String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isEmpty() ? e.getClass().getSimpleName() : message;
    }
}
