package com.example.comicshelf.infrastructure.thumbnail;

import com.example.comicshelf.common.config.AppThumbnailProperties;
import com.example.comicshelf.domain.enumtype.ThumbnailFormat;
import com.example.comicshelf.domain.model.EncodedThumbnail;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Thumbnail files live flat in one directory as {@code <comicId>.<ext>}.
 */
@Component
public class ThumbnailStore {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailStore.class);

    private static final ThumbnailFormat[] LOOKUP_ORDER = {
            ThumbnailFormat.WEBP, ThumbnailFormat.JPEG, ThumbnailFormat.PNG
    };

    private static final String PART_SUFFIX = ".part";

    private final Path dir;

    public ThumbnailStore(AppThumbnailProperties appThumbnailProperties) {
        this(Paths.get(appThumbnailProperties.getDir()));
    }

    ThumbnailStore(Path dir) {
        this.dir = dir.toAbsolutePath().normalize();
    }

    public Path getDir() {
        return dir;
    }

    public Path pathFor(String id, ThumbnailFormat format) {
        return dir.resolve(id + "." + format.getExtension());
    }

    /**
     * Existing thumbnail of a comic in any known format, or null.
     */
    public Path find(String comicId) {
        for (ThumbnailFormat format : LOOKUP_ORDER) {
            Path candidate = pathFor(comicId, format);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    public static String tempId(String comicId) {
        return comicId + "_" + UUID.randomUUID().toString().replace("-", "") + "_tmp";
    }

    /**
     * Writes to a {@code .part} sibling first and renames it over the target, so readers never see a
     * partially written thumbnail.
     */
    public Path write(String id, EncodedThumbnail thumbnail) {
        Path target = pathFor(id, thumbnail.getFormat());
        Path part = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID().toString().replace("-", "")
                + PART_SUFFIX);
        try {
            Files.createDirectories(dir);
            Files.write(part, thumbnail.getBytes());
            try {
                Files.move(part, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(part);
            throw new ThumbnailWriteException("Failed to write thumbnail " + target.getFileName(), e);
        }
        return target;
    }

    /**
     * Moves a temp thumbnail onto the comic's final name unless some other writer got there first.
     *
     * @return true when this call installed the file; false when the temp file was discarded
     */
    public boolean installIfAbsent(Path tempFile, String comicId, ThumbnailFormat format) {
        Path target = pathFor(comicId, format);
        try {
            if (find(comicId) != null) {
                Files.deleteIfExists(tempFile);
                return false;
            }
            try {
                Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, target);
            }
            return true;
        } catch (FileAlreadyExistsException e) {
            deleteQuietly(tempFile);
            return false;
        } catch (IOException e) {
            deleteQuietly(tempFile);
            throw new ThumbnailWriteException("Failed to install thumbnail for " + comicId, e);
        }
    }

    public void delete(String comicId) {
        for (ThumbnailFormat format : LOOKUP_ORDER) {
            deleteQuietly(pathFor(comicId, format));
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("THUMBNAIL_DELETE_FAILED path={} error={}", path, e.getMessage());
        }
    }
}
