package com.resultvault.shared.repository;

import com.resultvault.shared.model.ResultArtifact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for ResultArtifact entities.
 */
@Repository
public interface ResultArtifactRepository extends JpaRepository<ResultArtifact, Long> {

    /**
     * Artifacts of one result in insertion order.
     * @param resultId the owning result id
     * @return list of artifacts
     */
    List<ResultArtifact> findByResultIdOrderByIdAsc(String resultId);

    /**
     * Total recorded artifact bytes across every result of a user.
     * @param userId the owning user
     * @return byte total, 0 when the user has no artifacts
     */
    @Query("SELECT COALESCE(SUM(a.sizeBytes), 0L) FROM ResultArtifact a, AnalysisResult r "
            + "WHERE r.resultId = a.resultId AND r.userId = :userId")
    long sumSizeBytesByUserId(@Param("userId") String userId);
}
