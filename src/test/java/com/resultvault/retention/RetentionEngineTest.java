package com.resultvault.retention;

import com.resultvault.catalog.ResultCatalog;
import com.resultvault.shared.model.AnalysisResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the eviction decisions, against an in-memory view of the catalog.
 */
@ExtendWith(MockitoExtension.class)
class RetentionEngineTest {

    private static final Instant NOW = Instant.parse("2026-01-11T02:00:00Z");
    private static final String USER = "alice";

    @Mock
    private ResultCatalog catalog;

    private RetentionEngine engine;

    /** result id -> bytes, in creation order; evictions remove entries. */
    private final Map<String, Long> live = new LinkedHashMap<>();
    private final List<String> evicted = new ArrayList<>();
    private final ResultEvictor evictor = (userId, resultId) -> {
        evicted.add(resultId);
        live.remove(resultId);
        return Eviction.removed(0);
    };

    @BeforeEach
    void setUp() {
        engine = new RetentionEngine(catalog, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void givenResults(Object... idAgeBytes) {
        List<AnalysisResult> results = new ArrayList<>();
        for (int i = 0; i < idAgeBytes.length; i += 3) {
            String id = (String) idAgeBytes[i];
            Duration age = (Duration) idAgeBytes[i + 1];
            long bytes = (Long) idAgeBytes[i + 2];
            results.add(new AnalysisResult(id, USER, NOW.minus(age), Map.of()));
            live.put(id, bytes);
        }
        when(catalog.listResults(USER)).thenReturn(results);
        when(catalog.totalBytes(USER)).thenAnswer(invocation ->
                live.values().stream().mapToLong(Long::longValue).sum());
    }

    @Test
    void unconfiguredPolicyTouchesNothing() {
        RetentionReport report = engine.enforce(USER, RetentionPolicy.unlimited(), evictor);

        assertThat(report.getDeleted()).isZero();
        verifyNoInteractions(catalog);
    }

    @Test
    void ageOnlyEvictsResultsOlderThanCutoff() {
        givenResults(
                "r1", Duration.ofDays(10), 10L,
                "r2", Duration.ofDays(5), 10L,
                "r3", Duration.ofDays(1), 10L);

        RetentionReport report = engine.enforce(USER, RetentionPolicy.of(null, 7, null), evictor);

        assertThat(evicted).containsExactly("r1");
        assertThat(report.getScanned()).isEqualTo(3);
        assertThat(report.getRemainingBytes()).isEqualTo(20L);
    }

    @Test
    void countOnlyKeepsTheNewest() {
        givenResults(
                "r1", Duration.ofHours(5), 1L,
                "r2", Duration.ofHours(4), 1L,
                "r3", Duration.ofHours(3), 1L,
                "r4", Duration.ofHours(2), 1L,
                "r5", Duration.ofHours(1), 1L);

        engine.enforce(USER, RetentionPolicy.of(2, null, null), evictor);

        assertThat(evicted).containsExactly("r1", "r2", "r3");
        assertThat(live).containsOnlyKeys("r4", "r5");
    }

    @Test
    void ageAndCountMarksAreUnionedAndEvictedOnce() {
        givenResults(
                "r1", Duration.ofDays(20), 1L,
                "r2", Duration.ofDays(10), 1L,
                "r3", Duration.ofDays(2), 1L,
                "r4", Duration.ofDays(1), 1L);

        engine.enforce(USER, RetentionPolicy.of(3, 7, null), evictor);

        // r1 is marked by both policies and still evicted exactly once
        assertThat(evicted).containsExactly("r1", "r2");
    }

    @Test
    void sizeOnlyEvictsMinimalOldestPrefix() {
        givenResults(
                "r1", Duration.ofHours(3), 400L,
                "r2", Duration.ofHours(2), 400L,
                "r3", Duration.ofHours(1), 400L);

        RetentionReport report = engine.enforce(USER, RetentionPolicy.ofLimits(null, null, 900L), evictor);

        assertThat(evicted).containsExactly("r1");
        assertThat(report.getRemainingBytes()).isEqualTo(800L);
    }

    @Test
    void sizeUnderBudgetEvictsNothing() {
        givenResults(
                "r1", Duration.ofHours(2), 100L,
                "r2", Duration.ofHours(1), 100L);

        RetentionReport report = engine.enforce(USER, RetentionPolicy.ofLimits(null, null, 200L), evictor);

        assertThat(report.getDeleted()).isZero();
    }

    @Test
    void sizePolicyRunsAfterAgeAndCountEvictionsInsteadOfDiscardingThem() {
        givenResults(
                "r1", Duration.ofDays(30), 100L,
                "r2", Duration.ofDays(2), 500L,
                "r3", Duration.ofDays(1), 500L);

        RetentionReport report = engine.enforce(USER, RetentionPolicy.ofLimits(null, Duration.ofDays(7), 600L), evictor);

        // r1 goes by age even though the size policy also fires; size then takes r2.
        assertThat(evicted).containsExactly("r1", "r2");
        assertThat(report.getRemainingBytes()).isEqualTo(500L);
    }

    @Test
    void sizePolicyStopsWhenEverythingIsGone() {
        givenResults("r1", Duration.ofHours(1), 5_000L);

        RetentionReport report = engine.enforce(USER, RetentionPolicy.ofLimits(null, null, 10L), evictor);

        assertThat(evicted).containsExactly("r1");
        assertThat(report.getRemainingBytes()).isZero();
    }

    @Test
    void blobDeleteFailuresAreCounted() {
        givenResults(
                "r1", Duration.ofHours(2), 1L,
                "r2", Duration.ofHours(1), 1L);

        RetentionReport report = engine.enforce(USER, RetentionPolicy.of(1, null, null), (userId, resultId) -> {
            live.remove(resultId);
            return Eviction.removed(2);
        });

        assertThat(report.getDeletedResultIds()).containsExactly("r1");
        assertThat(report.getBlobDeleteFailures()).isEqualTo(2);
    }

    @Test
    void resultRemovedByAnotherPassIsNotReportedAsDeleted() {
        givenResults(
                "r1", Duration.ofDays(10), 100L,
                "r2", Duration.ofDays(9), 100L,
                "r3", Duration.ofHours(1), 100L);

        RetentionReport report = engine.enforce(USER, RetentionPolicy.of(null, 7, null), (userId, resultId) -> {
            live.remove(resultId);
            return "r1".equals(resultId) ? Eviction.absent() : Eviction.removed(0);
        });

        assertThat(report.getDeletedResultIds()).containsExactly("r2");
        assertThat(report.getDeleted()).isEqualTo(1);
        assertThat(report.getRemainingBytes()).isEqualTo(100L);
    }
}
