package com.resultvault.storage.blob;

import com.resultvault.storage.StorageConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StorageBackendTest {

    @Test
    void missingModeDefaultsToLocal() {
        assertThat(StorageBackend.fromMode(null)).isEqualTo(StorageBackend.LOCAL);
        assertThat(StorageBackend.fromMode("  ")).isEqualTo(StorageBackend.LOCAL);
    }

    @Test
    void modesAreCaseInsensitive() {
        assertThat(StorageBackend.fromMode("GCS")).isEqualTo(StorageBackend.GCS);
        assertThat(StorageBackend.fromMode(" local ")).isEqualTo(StorageBackend.LOCAL);
    }

    @Test
    void unknownModeIsAConfigurationError() {
        assertThatThrownBy(() -> StorageBackend.fromMode("ftp"))
                .isInstanceOf(StorageConfigurationException.class)
                .hasMessageContaining("ftp");
    }
}
