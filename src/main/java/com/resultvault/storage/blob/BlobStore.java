package com.resultvault.storage.blob;

import java.io.IOException;

/**
 * Minimal blob I/O capability a result store backend has to provide
 * (local filesystem or object store). Catalog bookkeeping lives elsewhere.
 */
public interface BlobStore {

    /**
     * Writes a blob under the location derived from {@code (userId, resultId, name)},
     * replacing any earlier blob at that location.
     *
     * @param userId      Owning user
     * @param resultId    Owning result
     * @param name        Logical artifact filename
     * @param content     Bytes to write
     * @param contentType MIME type (e.g., "image/png")
     * @return Backend-specific URI, the only handle needed to fetch or delete the blob later
     * @throws IOException if the write is rejected
     */
    String put(String userId, String resultId, String name, byte[] content, String contentType) throws IOException;

    /**
     * Reads a blob by the URI returned from {@link #put}.
     *
     * @throws IOException if the blob is missing or cannot be read
     */
    byte[] get(String uri) throws IOException;

    /**
     * Deletes a blob by its URI. Deleting a blob that is already gone is not an error.
     *
     * @throws IOException if the backend rejects the delete
     */
    void delete(String uri) throws IOException;

    /**
     * Called when a result is started. Backends that need a container per result create it here.
     */
    default void prepareResult(String userId, String resultId) throws IOException {
    }

    /**
     * Called after every blob of a deleted result has been removed.
     */
    default void releaseResult(String userId, String resultId) throws IOException {
    }

    /**
     * The backend this store implements.
     */
    StorageBackend backend();
}
