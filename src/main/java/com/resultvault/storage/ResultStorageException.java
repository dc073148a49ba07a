package com.resultvault.storage;

/**
 * Raised when a result store operation cannot be completed.
 * Covers rejected blob writes and reads as well as the more specific
 * reference and configuration failures below it.
 */
public class ResultStorageException extends RuntimeException {

    public ResultStorageException(String message) {
        super(message);
    }

    public ResultStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
