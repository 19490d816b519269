package org.permafrost.utils.compression;

/**
 * Codec configuration or environment failure.
 */
public class CompressionException extends Exception {

    public CompressionException(String message) {
        super(message);
    }

    public CompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
