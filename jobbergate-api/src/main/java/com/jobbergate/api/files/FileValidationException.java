package com.jobbergate.api.files;

import java.util.List;

/**
 * Thrown when an uploaded archive is unreadable, incomplete, or contains
 * files that fail their syntax check. Mapped to HTTP 422.
 */
public class FileValidationException extends RuntimeException {

    private final List<String> invalidFiles;

    public FileValidationException(String message) {
        this(message, List.of(), null);
    }

    public FileValidationException(String message, Throwable cause) {
        this(message, List.of(), cause);
    }

    public FileValidationException(String message, List<String> invalidFiles) {
        this(message, invalidFiles, null);
    }

    private FileValidationException(String message, List<String> invalidFiles, Throwable cause) {
        super(message, cause);
        this.invalidFiles = List.copyOf(invalidFiles);
    }

    public List<String> getInvalidFiles() { return invalidFiles; }
}
