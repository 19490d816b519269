package org.permafrost.archive.session;

/**
 * Thrown while reading fields whose stored value does not have the expected shape.
 * Callers treat it like a corrupt archive.
 */
public class ArchiveFormatException extends RuntimeException {

    public ArchiveFormatException(String message) {
        super(message);
    }

    public ArchiveFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
