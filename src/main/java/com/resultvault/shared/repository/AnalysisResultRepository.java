package com.resultvault.shared.repository;

import com.resultvault.shared.model.AnalysisResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for AnalysisResult entities.
 */
@Repository
public interface AnalysisResultRepository extends JpaRepository<AnalysisResult, String> {

    /**
     * Find a result only if it belongs to the given user.
     * @param resultId the result id
     * @param userId the owning user
     * @return Optional containing the result if found
     */
    Optional<AnalysisResult> findByResultIdAndUserId(String resultId, String userId);

    /**
     * All results of a user, oldest first. Ties on created_at fall back to the
     * result id, which is itself creation-ordered.
     * @param userId the owning user
     * @return list of results
     */
    List<AnalysisResult> findByUserIdOrderByCreatedAtAscResultIdAsc(String userId);

    /**
     * Distinct users that own at least one result.
     * @return list of user ids
     */
    @Query("SELECT DISTINCT r.userId FROM AnalysisResult r ORDER BY r.userId")
    List<String> findDistinctUserIds();

    /**
     * Attach a summary document to an existing result.
     * @param resultId the result id
     * @param summaryJson serialized summary
     * @return number of rows updated (0 when the result is missing)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "UPDATE results SET summary_json = :summaryJson WHERE result_id = :resultId", nativeQuery = true)
    int updateSummary(@Param("resultId") String resultId, @Param("summaryJson") String summaryJson);

    /**
     * Delete a result row. Artifact rows go with it through the foreign key cascade.
     * @param resultId the result id
     * @return number of rows deleted
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = "DELETE FROM results WHERE result_id = :resultId", nativeQuery = true)
    int deleteByResultIdCascading(@Param("resultId") String resultId);
}
