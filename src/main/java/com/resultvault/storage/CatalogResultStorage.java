package com.resultvault.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.resultvault.catalog.ResultCatalog;
import com.resultvault.retention.Eviction;
import com.resultvault.retention.RetentionEngine;
import com.resultvault.retention.RetentionPolicy;
import com.resultvault.retention.RetentionReport;
import com.resultvault.shared.model.AnalysisResult;
import com.resultvault.shared.model.ResultArtifact;
import com.resultvault.storage.blob.BlobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result storage over a {@link BlobStore} and the relational catalog.
 * <p>
 * Writes go blob first, then catalog row, so the catalog never references a blob
 * that was not written. Deletes go catalog first, then blobs; a failed blob delete
 * leaves an orphan that no listing can surface.
 */
public class CatalogResultStorage implements ResultStorage {

    private static final Logger logger = LoggerFactory.getLogger(CatalogResultStorage.class);
    static final String JSON_CONTENT_TYPE = "application/json";

    private final ResultCatalog catalog;
    private final BlobStore blobStore;
    private final RetentionEngine retentionEngine;
    private final RetentionPolicy retentionPolicy;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public CatalogResultStorage(ResultCatalog catalog,
                                BlobStore blobStore,
                                RetentionEngine retentionEngine,
                                RetentionPolicy retentionPolicy,
                                ObjectMapper objectMapper,
                                Clock clock) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.blobStore = Objects.requireNonNull(blobStore, "blobStore");
        this.retentionEngine = Objects.requireNonNull(retentionEngine, "retentionEngine");
        this.retentionPolicy = Objects.requireNonNull(retentionPolicy, "retentionPolicy");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        logger.info("Result storage initialized: backend={}, retention={}", blobStore.backend().mode(), retentionPolicy);
    }

    @Override
    public String startResult(String userId, Map<String, Object> metadata) {
        requireText(userId, "userId");
        String resultId = ResultIds.next(clock);
        catalog.createResult(resultId, userId, clock.instant(), metadata != null ? metadata : Map.of());
        try {
            blobStore.prepareResult(userId, resultId);
        } catch (IOException e) {
            throw new ResultStorageException("Failed to prepare storage for result " + resultId, e);
        }
        logger.info("Started result {} for user {}", resultId, userId);
        return resultId;
    }

    @Override
    public String saveArtifact(String userId, String resultId, String name, byte[] content,
                               String contentType, Map<String, Object> metadata) {
        requireText(name, "name");
        requireText(contentType, "contentType");
        Objects.requireNonNull(content, "content");
        catalog.requireResult(userId, resultId);

        String uri;
        try {
            uri = blobStore.put(userId, resultId, name, content, contentType);
        } catch (IOException e) {
            throw new ResultStorageException("Failed to write artifact '" + name + "' of result " + resultId, e);
        }

        catalog.recordArtifact(resultId, name, uri, contentType, content.length,
                metadata != null ? metadata : Map.of());
        logger.debug("Saved artifact {} ({} bytes, {}) for result {}", uri, content.length, contentType, resultId);
        return uri;
    }

    @Override
    public String saveJson(String userId, String resultId, String name, Object payload, Map<String, Object> metadata) {
        byte[] content;
        try {
            content = objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload for artifact '" + name + "' is not serializable as JSON", e);
        }
        return saveArtifact(userId, resultId, name, content, JSON_CONTENT_TYPE, metadata);
    }

    @Override
    public void finalizeResult(String resultId, Map<String, Object> summary) {
        if (summary == null || summary.isEmpty()) {
            return;
        }
        catalog.attachSummary(resultId, summary);
        logger.info("Finalized result {}", resultId);
    }

    @Override
    public RetentionReport enforceRetention(String userId) {
        return enforceRetention(userId, retentionPolicy);
    }

    @Override
    public RetentionReport enforceRetention(String userId, RetentionPolicy policy) {
        return retentionEngine.enforce(userId, policy, this::evict);
    }

    @Override
    public byte[] readArtifact(String uri) {
        try {
            return blobStore.get(uri);
        } catch (IOException e) {
            throw new ResultStorageException("Failed to read artifact " + uri, e);
        }
    }

    @Override
    public List<AnalysisResult> listResults(String userId) {
        return catalog.listResults(userId);
    }

    @Override
    public Optional<AnalysisResult> findResult(String userId, String resultId) {
        return catalog.findResult(userId, resultId);
    }

    @Override
    public List<ResultArtifact> listArtifacts(String userId, String resultId) {
        catalog.requireResult(userId, resultId);
        return catalog.listArtifacts(resultId);
    }

    @Override
    public boolean deleteResult(String userId, String resultId) {
        if (catalog.findResult(userId, resultId).isEmpty()) {
            return false;
        }
        return evict(userId, resultId).isRemoved();
    }

    /**
     * Removes the catalog row (cascading to artifact rows), then every blob it referenced.
     */
    Eviction evict(String userId, String resultId) {
        Optional<List<String>> deletedUris = catalog.deleteResult(resultId);
        if (deletedUris.isEmpty()) {
            return Eviction.absent();
        }
        List<String> uris = deletedUris.get();
        int failures = 0;
        for (String uri : uris) {
            try {
                blobStore.delete(uri);
            } catch (IOException | RuntimeException e) {
                failures++;
                logger.warn("Orphaned blob {} of deleted result {}: delete failed", uri, resultId, e);
            }
        }
        try {
            blobStore.releaseResult(userId, resultId);
        } catch (IOException e) {
            logger.warn("Failed to release storage of deleted result {}", resultId, e);
        }
        logger.info("Deleted result {} of user {} ({} blob(s), {} orphaned)", resultId, userId, uris.size(), failures);
        return Eviction.removed(failures);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}
