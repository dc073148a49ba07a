package com.resultvault.catalog;

import com.resultvault.shared.JsonDocumentConverter;
import com.resultvault.shared.model.AnalysisResult;
import com.resultvault.shared.model.ResultArtifact;
import com.resultvault.shared.repository.AnalysisResultRepository;
import com.resultvault.shared.repository.ResultArtifactRepository;
import com.resultvault.storage.ResultNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Relational metadata for results and their artifacts.
 * Every method runs in its own short transaction; no transaction ever spans a blob write.
 */
@Service
public class ResultCatalog {

    private static final Logger logger = LoggerFactory.getLogger(ResultCatalog.class);

    private final AnalysisResultRepository resultRepository;
    private final ResultArtifactRepository artifactRepository;
    private final JsonDocumentConverter documentConverter = new JsonDocumentConverter();

    public ResultCatalog(AnalysisResultRepository resultRepository,
                         ResultArtifactRepository artifactRepository) {
        this.resultRepository = resultRepository;
        this.artifactRepository = artifactRepository;
    }

    @Transactional
    public AnalysisResult createResult(String resultId, String userId, Instant createdAt,
                                       Map<String, Object> metadata) {
        AnalysisResult result = new AnalysisResult(resultId, userId, createdAt, metadata);
        return resultRepository.save(result);
    }

    @Transactional(readOnly = true)
    public Optional<AnalysisResult> findResult(String userId, String resultId) {
        return resultRepository.findByResultIdAndUserId(resultId, userId);
    }

    /**
     * Returns the result if it exists and is owned by {@code userId}.
     *
     * @throws ResultNotFoundException otherwise
     */
    @Transactional(readOnly = true)
    public AnalysisResult requireResult(String userId, String resultId) {
        return resultRepository.findByResultIdAndUserId(resultId, userId)
                .orElseThrow(() -> new ResultNotFoundException(resultId));
    }

    @Transactional
    public ResultArtifact recordArtifact(String resultId, String name, String uri, String contentType,
                                         long sizeBytes, Map<String, Object> metadata) {
        ResultArtifact artifact = new ResultArtifact(resultId, name, uri, contentType, sizeBytes, metadata);
        return artifactRepository.save(artifact);
    }

    /**
     * Attaches the summary document to a result.
     *
     * @throws ResultNotFoundException if no result has this id
     */
    @Transactional
    public void attachSummary(String resultId, Map<String, Object> summary) {
        int updated = resultRepository.updateSummary(resultId, documentConverter.convertToDatabaseColumn(summary));
        if (updated == 0) {
            throw new ResultNotFoundException(resultId);
        }
    }

    @Transactional(readOnly = true)
    public List<AnalysisResult> listResults(String userId) {
        return resultRepository.findByUserIdOrderByCreatedAtAscResultIdAsc(userId);
    }

    @Transactional(readOnly = true)
    public List<ResultArtifact> listArtifacts(String resultId) {
        return artifactRepository.findByResultIdOrderByIdAsc(resultId);
    }

    @Transactional(readOnly = true)
    public long totalBytes(String userId) {
        return artifactRepository.sumSizeBytesByUserId(userId);
    }

    @Transactional(readOnly = true)
    public List<String> listUserIds() {
        return resultRepository.findDistinctUserIds();
    }

    /**
     * Removes a result row (cascading to its artifact rows) and returns the distinct
     * blob URIs it referenced, so the caller can delete them afterwards.
     *
     * @return empty if no row was removed because the result was already gone
     */
    @Transactional
    public Optional<List<String>> deleteResult(String resultId) {
        Set<String> uris = new LinkedHashSet<>();
        for (ResultArtifact artifact : artifactRepository.findByResultIdOrderByIdAsc(resultId)) {
            uris.add(artifact.getUri());
        }
        int deleted = resultRepository.deleteByResultIdCascading(resultId);
        if (deleted == 0) {
            logger.debug("Result {} was already absent from the catalog", resultId);
            return Optional.empty();
        }
        return Optional.of(new ArrayList<>(uris));
    }
}
