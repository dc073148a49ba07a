package com.resultvault.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Collects the URIs of the artifacts written for one result, keyed by logical name
 * (chart or dataset name), and persists them as a JSON document next to them.
 * This is a caller convention on top of {@link ResultStorage}; the store does not
 * require or validate it.
 */
public class ResultManifest {

    public static final String DEFAULT_NAME = "manifest.json";

    private final ResultStorage storage;
    private final String userId;
    private final String resultId;
    private final Map<String, String> entries = new LinkedHashMap<>();

    public ResultManifest(ResultStorage storage, String userId, String resultId) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.resultId = Objects.requireNonNull(resultId, "resultId");
    }

    /**
     * Saves an artifact and records its URI under {@code logicalName}.
     */
    public String add(String logicalName, String fileName, byte[] content, String contentType) {
        String uri = storage.saveArtifact(userId, resultId, fileName, content, contentType, Map.of("logical_name", logicalName));
        entries.put(logicalName, uri);
        return uri;
    }

    /**
     * Records a URI written by other means.
     */
    public void record(String logicalName, String uri) {
        entries.put(logicalName, uri);
    }

    public Map<String, String> entries() {
        return Collections.unmodifiableMap(entries);
    }

    /**
     * Persists the manifest as {@value #DEFAULT_NAME}.
     *
     * @return URI of the manifest artifact
     */
    public String save() {
        return storage.saveJson(userId, resultId, DEFAULT_NAME, entries, Map.of("kind", "manifest"));
    }
}
