package com.example.comicshelf.common.exception;

/**
 * A library root could not be walked. Fatal to the running scan job.
 */
public class LibraryAccessException extends RuntimeException {

    private final String root;

    public LibraryAccessException(String root, String message) {
        super(message);
        this.root = root;
    }

    public LibraryAccessException(String root, String message, Throwable cause) {
        super(message, cause);
        this.root = root;
    }

    public String getRoot() {
        return root;
    }
}
