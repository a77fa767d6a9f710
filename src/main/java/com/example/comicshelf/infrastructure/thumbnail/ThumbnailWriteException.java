package com.example.comicshelf.infrastructure.thumbnail;

public class ThumbnailWriteException extends RuntimeException {

    public ThumbnailWriteException(String message) {
        super(message);
    }

    public ThumbnailWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
