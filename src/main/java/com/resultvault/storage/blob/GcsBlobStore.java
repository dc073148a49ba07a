package com.resultvault.storage.blob;

import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import com.resultvault.storage.StorageConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores artifacts as objects in a Google Cloud Storage bucket.
 * Object names are {prefix}/{userId}/{resultId}/{name} (empty parts skipped),
 * and URIs take the form gs://{bucket}/{objectName}.
 */
public class GcsBlobStore implements BlobStore {

    private static final Logger logger = LoggerFactory.getLogger(GcsBlobStore.class);
    private static final String SCHEME = "gs://";

    private final Storage storage;
    private final String bucketName;
    private final String prefix;

    public GcsBlobStore(Storage storage, String bucketName, String prefix) {
        if (bucketName == null || bucketName.isBlank()) {
            throw new StorageConfigurationException("GCS backend requires a bucket name (app.storage.gcs.bucket)");
        }
        if (storage == null) {
            throw new StorageConfigurationException("GCS backend requires a storage client");
        }
        this.storage = storage;
        this.bucketName = bucketName.trim();
        this.prefix = stripSlashes(prefix);
        logger.info("GCS blob store initialized with bucket: {} prefix: '{}'", this.bucketName, this.prefix);
    }

    private static String stripSlashes(String value) {
        if (value == null) {
            return "";
        }
        String stripped = value.trim();
        while (stripped.startsWith("/")) {
            stripped = stripped.substring(1);
        }
        while (stripped.endsWith("/")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        return stripped;
    }

    String objectName(String userId, String resultId, String name) {
        List<String> parts = new ArrayList<>(4);
        for (String part : new String[] {prefix, userId, resultId, name}) {
            if (part != null && !part.isEmpty()) {
                parts.add(part);
            }
        }
        return String.join("/", parts);
    }

    @Override
    public String put(String userId, String resultId, String name, byte[] content, String contentType) throws IOException {
        String objectName = objectName(userId, resultId, name);
        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucketName, objectName))
                .setContentType(contentType)
                .build();

        logger.debug("Uploading artifact to GCS: gs://{}/{}", bucketName, objectName);
        try {
            storage.create(blobInfo, content);
        } catch (StorageException e) {
            logger.error("Failed to upload artifact to GCS: gs://{}/{}", bucketName, objectName, e);
            throw new IOException("Failed to upload artifact to GCS", e);
        }
        return SCHEME + bucketName + "/" + objectName;
    }

    @Override
    public byte[] get(String uri) throws IOException {
        BlobId blobId = parse(uri);
        try {
            return storage.readAllBytes(blobId);
        } catch (StorageException e) {
            throw new IOException("Failed to download artifact from GCS: " + uri, e);
        }
    }

    @Override
    public void delete(String uri) throws IOException {
        BlobId blobId = parse(uri);
        try {
            if (!storage.delete(blobId)) {
                logger.debug("GCS object already absent: {}", uri);
            }
        } catch (StorageException e) {
            throw new IOException("Failed to delete artifact from GCS: " + uri, e);
        }
    }

    @Override
    public StorageBackend backend() {
        return StorageBackend.GCS;
    }

    public String getBucketName() {
        return bucketName;
    }

    /**
     * Parses gs://bucket/object into a BlobId, rejecting URIs for other buckets.
     */
    private BlobId parse(String uri) {
        if (uri == null || !uri.startsWith(SCHEME)) {
            throw new IllegalArgumentException("Invalid GCS uri: " + uri);
        }
        String withoutScheme = uri.substring(SCHEME.length());
        int slash = withoutScheme.indexOf('/');
        if (slash <= 0 || slash == withoutScheme.length() - 1) {
            throw new IllegalArgumentException("Invalid GCS uri format: " + uri);
        }
        String bucket = withoutScheme.substring(0, slash);
        if (!bucket.equals(bucketName)) {
            throw new IllegalArgumentException("GCS uri " + uri + " does not belong to bucket " + bucketName);
        }
        return BlobId.of(bucket, withoutScheme.substring(slash + 1));
    }
}
