package org.permafrost.archive.session;

/**
 * Checked exception for archive I/O and format failures: missing or unreadable files,
 * malformed documents and unsupported format versions.
 */
public class ArchiveException extends Exception {

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
