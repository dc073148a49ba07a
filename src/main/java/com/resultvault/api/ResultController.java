package com.resultvault.api;

import com.resultvault.retention.RetentionReport;
import com.resultvault.shared.dto.ArtifactResponse;
import com.resultvault.shared.dto.ResultResponse;
import com.resultvault.shared.model.ResultArtifact;
import com.resultvault.storage.ResultNotFoundException;
import com.resultvault.storage.ResultStorage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Controller exposing a user's stored results and their artifacts.
 */
@RestController
@RequestMapping("/api/users/{userId}/results")
@Tag(name = "Results", description = "Stored analysis results and artifacts")
public class ResultController {

    private static final Logger logger = LoggerFactory.getLogger(ResultController.class);

    private final ResultStorage resultStorage;

    public ResultController(ResultStorage resultStorage) {
        this.resultStorage = resultStorage;
    }

    @GetMapping
    @Operation(summary = "List results", description = "Lists a user's results, oldest first")
    public List<ResultResponse> listResults(@PathVariable("userId") String userId) {
        return resultStorage.listResults(userId).stream()
                .map(ResultResponse::from)
                .collect(Collectors.toList());
    }

    @GetMapping("/{resultId}")
    @Operation(summary = "Get result")
    public ResultResponse getResult(@PathVariable("userId") String userId,
                                    @PathVariable("resultId") String resultId) {
        return resultStorage.findResult(userId, resultId)
                .map(ResultResponse::from)
                .orElseThrow(() -> new ResultNotFoundException(resultId));
    }

    @GetMapping("/{resultId}/artifacts")
    @Operation(summary = "List artifacts", description = "Lists every artifact record of a result in write order")
    public List<ArtifactResponse> listArtifacts(@PathVariable("userId") String userId,
                                                @PathVariable("resultId") String resultId) {
        return resultStorage.listArtifacts(userId, resultId).stream()
                .map(ArtifactResponse::from)
                .collect(Collectors.toList());
    }

    @GetMapping("/{resultId}/artifacts/{artifactId}")
    @Operation(summary = "Download artifact")
    public ResponseEntity<byte[]> downloadArtifact(
            @PathVariable("userId") String userId,
            @PathVariable("resultId") String resultId,
            @Parameter(description = "Catalog id of the artifact record")
            @PathVariable("artifactId") long artifactId) {

        ResultArtifact artifact = resultStorage.listArtifacts(userId, resultId).stream()
                .filter(candidate -> candidate.getId() == artifactId)
                .findFirst()
                .orElse(null);
        if (artifact == null) {
            logger.warn("Artifact {} not found in result {}", artifactId, resultId);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }

        byte[] content = resultStorage.readArtifact(artifact.getUri());
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(artifact.getContentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.inline()
                        .filename(artifact.getName(), StandardCharsets.UTF_8)
                        .build()
                        .toString())
                .body(content);
    }

    @DeleteMapping("/{resultId}")
    @Operation(summary = "Delete result", description = "Deletes the result, its artifact records and blobs")
    public ResponseEntity<Void> deleteResult(@PathVariable("userId") String userId,
                                             @PathVariable("resultId") String resultId) {
        if (!resultStorage.deleteResult(userId, resultId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/retention")
    @Operation(summary = "Enforce retention", description = "Applies the configured retention policy to the user's results")
    public RetentionReport enforceRetention(@PathVariable("userId") String userId) {
        return resultStorage.enforceRetention(userId);
    }
}
