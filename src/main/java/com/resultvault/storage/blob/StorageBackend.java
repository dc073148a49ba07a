package com.resultvault.storage.blob;

import com.resultvault.storage.StorageConfigurationException;

import java.util.Locale;

/**
 * Blob storage backends, resolved once at startup from {@code app.storage.mode}.
 */
public enum StorageBackend {

    LOCAL("local"),
    GCS("gcs");

    private final String mode;

    StorageBackend(String mode) {
        this.mode = mode;
    }

    public String mode() {
        return mode;
    }

    /**
     * Resolves a configured mode. A missing or blank value selects {@link #LOCAL}.
     *
     * @throws StorageConfigurationException for any unknown mode
     */
    public static StorageBackend fromMode(String value) {
        if (value == null || value.isBlank()) {
            return LOCAL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (StorageBackend backend : values()) {
            if (backend.mode.equals(normalized)) {
                return backend;
            }
        }
        throw new StorageConfigurationException("Unsupported storage backend: " + value);
    }
}
