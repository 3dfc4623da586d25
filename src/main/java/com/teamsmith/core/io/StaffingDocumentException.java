package com.teamsmith.core.io;

/**
 * Thrown when an input document cannot be read or does not have the expected shape.
 */
public class StaffingDocumentException extends RuntimeException {
    public StaffingDocumentException(String message) {
        super(message);
    }

    public StaffingDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
