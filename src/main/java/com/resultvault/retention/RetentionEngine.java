package com.resultvault.retention;

import com.resultvault.catalog.ResultCatalog;
import com.resultvault.shared.model.AnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decides which of a user's results to evict and evicts them.
 * <p>
 * Policies are applied to a snapshot of the user's results, oldest first:
 * <ol>
 *   <li>age: every result created before {@code now - maxAge} is marked;</li>
 *   <li>count: the oldest {@code count - maxResults} results are marked;</li>
 *   <li>the marked results are evicted, each exactly once;</li>
 *   <li>size: while the catalog byte total is over budget, the oldest surviving
 *       result is evicted and the total re-measured.</li>
 * </ol>
 * Results created after the snapshot are left for the next pass. A result another
 * pass removed first is skipped and not reported as deleted.
 */
public class RetentionEngine {

    private static final Logger logger = LoggerFactory.getLogger(RetentionEngine.class);

    private final ResultCatalog catalog;
    private final Clock clock;

    public RetentionEngine(ResultCatalog catalog, Clock clock) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RetentionReport enforce(String userId, RetentionPolicy policy, ResultEvictor evictor) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(evictor, "evictor");

        if (!policy.isEnforced()) {
            return RetentionReport.skipped(userId);
        }

        List<AnalysisResult> snapshot = catalog.listResults(userId);
        Set<String> marked = new LinkedHashSet<>();

        if (policy.getMaxAge() != null) {
            Instant cutoff = clock.instant().minus(policy.getMaxAge());
            for (AnalysisResult result : snapshot) {
                if (result.getCreatedAt().isBefore(cutoff)) {
                    marked.add(result.getResultId());
                }
            }
        }

        if (policy.getMaxResults() != null && snapshot.size() > policy.getMaxResults()) {
            int overflow = snapshot.size() - policy.getMaxResults();
            for (AnalysisResult result : snapshot.subList(0, overflow)) {
                marked.add(result.getResultId());
            }
        }

        List<String> deleted = new ArrayList<>();
        int blobFailures = 0;

        // Evict in snapshot order so the log reads oldest first.
        for (AnalysisResult result : snapshot) {
            if (marked.contains(result.getResultId())) {
                Eviction eviction = evictor.evict(userId, result.getResultId());
                blobFailures += eviction.getBlobDeleteFailures();
                if (eviction.isRemoved()) {
                    deleted.add(result.getResultId());
                }
            }
        }

        long currentBytes = catalog.totalBytes(userId);
        if (policy.getMaxTotalBytes() != null && currentBytes > policy.getMaxTotalBytes()) {
            long limit = policy.getMaxTotalBytes();
            for (AnalysisResult result : snapshot) {
                if (currentBytes <= limit) {
                    break;
                }
                if (marked.contains(result.getResultId())) {
                    continue;
                }
                Eviction eviction = evictor.evict(userId, result.getResultId());
                blobFailures += eviction.getBlobDeleteFailures();
                if (eviction.isRemoved()) {
                    deleted.add(result.getResultId());
                }
                currentBytes = catalog.totalBytes(userId);
            }
            if (currentBytes > limit) {
                logger.warn("User {} still holds {} bytes over a budget of {} after evicting every scanned result",
                        userId, currentBytes, limit);
            }
        }

        if (!deleted.isEmpty()) {
            logger.info("Retention for user {} evicted {} of {} result(s) (policy {}), {} bytes remain",
                    userId, deleted.size(), snapshot.size(), policy, currentBytes);
        }
        return new RetentionReport(userId, snapshot.size(), deleted, blobFailures, currentBytes);
    }
}
