package com.resultvault.shared.dto;

import com.resultvault.shared.model.ResultArtifact;

import java.util.Map;

/**
 * DTO for one artifact record of a result.
 */
public class ArtifactResponse {

    private Long id;
    private String resultId;
    private String name;
    private String uri;
    private String contentType;
    private long size;
    private Map<String, Object> metadata;

    public ArtifactResponse() {
    }

    public static ArtifactResponse from(ResultArtifact artifact) {
        ArtifactResponse response = new ArtifactResponse();
        response.setId(artifact.getId());
        response.setResultId(artifact.getResultId());
        response.setName(artifact.getName());
        response.setUri(artifact.getUri());
        response.setContentType(artifact.getContentType());
        response.setSize(artifact.getSizeBytes());
        response.setMetadata(artifact.getMetadata());
        return response;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getResultId() {
        return resultId;
    }

    public void setResultId(String resultId) {
        this.resultId = resultId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getUri() {
        return uri;
    }

    public void setUri(String uri) {
        this.uri = uri;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    public long getSize() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }
}
