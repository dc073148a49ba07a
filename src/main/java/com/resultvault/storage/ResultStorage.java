package com.resultvault.storage;

import com.resultvault.retention.RetentionPolicy;
import com.resultvault.retention.RetentionReport;
import com.resultvault.shared.model.AnalysisResult;
import com.resultvault.shared.model.ResultArtifact;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persists the output of an analysis run as a result made of named artifacts,
 * and reclaims space according to retention rules. Callers never see which
 * backend holds the bytes.
 */
public interface ResultStorage {

    /**
     * Creates a new result for {@code userId}.
     *
     * @param metadata opaque caller document, may be null
     * @return the new result id
     */
    String startResult(String userId, Map<String, Object> metadata);

    /**
     * Writes an artifact blob and records it in the catalog. Every call appends a
     * catalog row, even when the same name is written twice.
     *
     * @return backend-specific URI of the blob
     * @throws ResultNotFoundException if the result does not exist for this user
     * @throws ResultStorageException  if the blob write fails; no catalog row is created then
     */
    String saveArtifact(String userId, String resultId, String name, byte[] content,
                        String contentType, Map<String, Object> metadata);

    /**
     * Serializes {@code payload} as JSON and saves it with content type application/json.
     */
    String saveJson(String userId, String resultId, String name, Object payload, Map<String, Object> metadata);

    /**
     * Attaches the summary to a result. Does nothing when the summary is null or empty.
     *
     * @throws ResultNotFoundException if a summary is given and the result does not exist
     */
    void finalizeResult(String resultId, Map<String, Object> summary);

    /**
     * Applies the configured retention policy to the user's results.
     */
    RetentionReport enforceRetention(String userId);

    /**
     * Applies an explicit retention policy to the user's results.
     */
    RetentionReport enforceRetention(String userId, RetentionPolicy policy);

    /**
     * Reads back the bytes of an artifact by the URI returned from {@link #saveArtifact}.
     */
    byte[] readArtifact(String uri);

    List<AnalysisResult> listResults(String userId);

    Optional<AnalysisResult> findResult(String userId, String resultId);

    /**
     * @throws ResultNotFoundException if the result does not exist for this user
     */
    List<ResultArtifact> listArtifacts(String userId, String resultId);

    /**
     * Deletes a result with all its artifact rows and blobs.
     *
     * @return false if the result did not exist for this user
     */
    boolean deleteResult(String userId, String resultId);
}
