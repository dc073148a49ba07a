package com.resultvault.storage;

/**
 * Fatal construction-time error: a backend is missing a required parameter
 * or cannot reach its storage location. Not retryable.
 */
public class StorageConfigurationException extends ResultStorageException {

    public StorageConfigurationException(String message) {
        super(message);
    }

    public StorageConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
