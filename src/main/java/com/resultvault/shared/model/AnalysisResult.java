package com.resultvault.shared.model;

import com.resultvault.shared.JsonDocumentConverter;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.Map;

/**
 * Entity representing one stored analysis result owned by a single user.
 * Maps to the results table. Artifact rows reference it with ON DELETE CASCADE.
 */
@Entity
@Table(name = "results", indexes = {
    @Index(name = "idx_results_user_created", columnList = "user_id, created_at")
})
public class AnalysisResult {

    @Id
    @Column(name = "result_id", length = 64, nullable = false, updatable = false)
    @Size(max = 64)
    private String resultId;

    @Column(name = "user_id", nullable = false, updatable = false)
    @NotNull
    private String userId;

    @Column(name = "created_at", nullable = false, updatable = false)
    @NotNull
    private Instant createdAt;

    @Convert(converter = JsonDocumentConverter.class)
    @Column(name = "metadata_json", columnDefinition = "TEXT")
    private Map<String, Object> metadata;

    @Convert(converter = JsonDocumentConverter.class)
    @Column(name = "summary_json", columnDefinition = "TEXT")
    private Map<String, Object> summary;

    // Constructors
    protected AnalysisResult() {
    }

    public AnalysisResult(String resultId, String userId, Instant createdAt, Map<String, Object> metadata) {
        this.resultId = resultId;
        this.userId = userId;
        this.createdAt = createdAt;
        this.metadata = metadata;
    }

    // Getters and Setters
    public String getResultId() {
        return resultId;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Map<String, Object> getSummary() {
        return summary;
    }

    public void setSummary(Map<String, Object> summary) {
        this.summary = summary;
    }

    public boolean isFinalized() {
        return summary != null;
    }
}
