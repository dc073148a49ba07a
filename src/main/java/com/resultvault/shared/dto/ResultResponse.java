package com.resultvault.shared.dto;

import com.resultvault.shared.model.AnalysisResult;

import java.time.Instant;
import java.util.Map;

/**
 * DTO for a stored result.
 */
public class ResultResponse {

    private String resultId;
    private String userId;
    private Instant createdAt;
    private Map<String, Object> metadata;
    private Map<String, Object> summary;
    private boolean finalized;

    public ResultResponse() {
    }

    public static ResultResponse from(AnalysisResult result) {
        ResultResponse response = new ResultResponse();
        response.setResultId(result.getResultId());
        response.setUserId(result.getUserId());
        response.setCreatedAt(result.getCreatedAt());
        response.setMetadata(result.getMetadata());
        response.setSummary(result.getSummary());
        response.setFinalized(result.isFinalized());
        return response;
    }

    public String getResultId() {
        return resultId;
    }

    public void setResultId(String resultId) {
        this.resultId = resultId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    public Map<String, Object> getSummary() {
        return summary;
    }

    public void setSummary(Map<String, Object> summary) {
        this.summary = summary;
    }

    public boolean isFinalized() {
        return finalized;
    }

    public void setFinalized(boolean finalized) {
        this.finalized = finalized;
    }
}
