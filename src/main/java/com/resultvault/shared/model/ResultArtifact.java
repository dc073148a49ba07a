package com.resultvault.shared.model;

import com.resultvault.shared.JsonDocumentConverter;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Entity representing one named blob attached to a result.
 * Maps to the artifacts table. The uri is the only handle needed to fetch
 * or delete the blob; size is captured at write time and never recomputed.
 */
@Entity
@Table(name = "artifacts", indexes = {
    @Index(name = "idx_artifacts_result_id", columnList = "result_id")
})
public class ResultArtifact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "result_id", length = 64, nullable = false, updatable = false)
    @NotNull
    private String resultId;

    @Column(name = "name", nullable = false, updatable = false)
    @NotNull
    @Size(max = 255)
    private String name;

    @Column(name = "uri", length = 1024, nullable = false, updatable = false)
    @NotNull
    private String uri;

    @Column(name = "content_type", nullable = false, updatable = false)
    @NotNull
    private String contentType;

    @Column(name = "size_bytes", nullable = false, updatable = false)
    private long sizeBytes;

    @Convert(converter = JsonDocumentConverter.class)
    @Column(name = "metadata_json", columnDefinition = "TEXT")
    private Map<String, Object> metadata;

    // Constructors
    protected ResultArtifact() {
    }

    public ResultArtifact(String resultId, String name, String uri, String contentType,
                          long sizeBytes, Map<String, Object> metadata) {
        this.resultId = resultId;
        this.name = name;
        this.uri = uri;
        this.contentType = contentType;
        this.sizeBytes = sizeBytes;
        this.metadata = metadata;
    }

    // Getters
    public Long getId() {
        return id;
    }

    public String getResultId() {
        return resultId;
    }

    public String getName() {
        return name;
    }

    public String getUri() {
        return uri;
    }

    public String getContentType() {
        return contentType;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
