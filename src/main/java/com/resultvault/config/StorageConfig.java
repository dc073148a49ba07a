package com.resultvault.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import com.resultvault.catalog.ResultCatalog;
import com.resultvault.retention.RetentionEngine;
import com.resultvault.retention.RetentionPolicy;
import com.resultvault.storage.CatalogResultStorage;
import com.resultvault.storage.ResultStorage;
import com.resultvault.storage.blob.BlobStore;
import com.resultvault.storage.blob.GcsBlobStore;
import com.resultvault.storage.blob.LocalBlobStore;
import com.resultvault.storage.blob.StorageBackend;
import com.resultvault.util.ConfigHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;

/**
 * Wires the result store from configuration read once at startup.
 * The backend is resolved here and nowhere else.
 */
@Configuration
public class StorageConfig {

    private static final Logger logger = LoggerFactory.getLogger(StorageConfig.class);

    static final String STORAGE_MODE = "app.storage.mode";
    static final String LOCAL_DIR = "app.storage.local-dir";
    static final String GCS_BUCKET = "app.storage.gcs.bucket";
    static final String GCS_PREFIX = "app.storage.gcs.prefix";
    static final String MAX_RESULTS = "app.retention.max-results";
    static final String MAX_AGE_DAYS = "app.retention.max-age-days";
    static final String MAX_STORAGE_MB = "app.retention.max-storage-mb";

    @Bean
    @ConditionalOnMissingBean
    public Clock storageClock() {
        return Clock.systemUTC();
    }

    @Bean
    public StorageBackend storageBackend(Environment env) {
        StorageBackend backend = StorageBackend.fromMode(env.getProperty(STORAGE_MODE));
        logger.info("Storage backend = {}", backend.mode());
        return backend;
    }

    @Bean
    @ConditionalOnMissingBean
    public BlobStore blobStore(StorageBackend backend, Environment env) {
        switch (backend) {
            case GCS:
                String bucket = ConfigHelper.optionalProperty(env, GCS_BUCKET, "");
                String prefix = ConfigHelper.optionalProperty(env, GCS_PREFIX, "");
                // Validate before building a client so a missing bucket fails without credentials lookups.
                Storage storage = bucket.isEmpty() ? null : StorageOptions.getDefaultInstance().getService();
                return new GcsBlobStore(storage, bucket, prefix);
            case LOCAL:
            default:
                return new LocalBlobStore(ConfigHelper.optionalProperty(env, LOCAL_DIR, "storage"));
        }
    }

    @Bean
    public RetentionPolicy retentionPolicy(Environment env) {
        return RetentionPolicy.of(
                ConfigHelper.optionalPositiveInt(env, MAX_RESULTS),
                ConfigHelper.optionalPositiveInt(env, MAX_AGE_DAYS),
                ConfigHelper.optionalPositiveInt(env, MAX_STORAGE_MB));
    }

    @Bean
    public RetentionEngine retentionEngine(ResultCatalog catalog, Clock storageClock) {
        return new RetentionEngine(catalog, storageClock);
    }

    @Bean
    public ResultStorage resultStorage(ResultCatalog catalog,
                                       BlobStore blobStore,
                                       RetentionEngine retentionEngine,
                                       RetentionPolicy retentionPolicy,
                                       ObjectMapper objectMapper,
                                       Clock storageClock) {
        return new CatalogResultStorage(catalog, blobStore, retentionEngine, retentionPolicy, objectMapper, storageClock);
    }
}
