package com.geoinsight.mcp.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoinsight.mcp.exception.InternalInvariantException;
import com.geoinsight.mcp.exception.UpstreamUnavailableException;
import com.geoinsight.mcp.model.InsightCandidate;
import com.geoinsight.mcp.model.Metric;
import com.geoinsight.mcp.model.SpatialLevel;
import com.geoinsight.mcp.support.InMemoryFactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Optional;

import static com.geoinsight.mcp.support.Facts.activity;
import static com.geoinsight.mcp.support.Facts.aggregator;
import static com.geoinsight.mcp.support.Facts.demographic;
import static com.geoinsight.mcp.support.Facts.dimension;
import static com.geoinsight.mcp.support.Facts.district;
import static com.geoinsight.mcp.support.Facts.footTraffic;
import static com.geoinsight.mcp.support.Facts.month;
import static com.geoinsight.mcp.support.Facts.snapshotService;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("InsightCandidateAggregator")
class InsightCandidateAggregatorTest {

    private InMemoryFactStore store;
    private InsightCandidateAggregator aggregator;

    @BeforeEach
    void setUp() {
        store = new InMemoryFactStore()
                .dimensions(
                        dimension("1168010100", "역삼동", "1168010100"),
                        dimension("1168010300", "개포동", "1168010300"),
                        dimension("1165010100", "서초동", "1165010100"))
                .districts(
                        district("11680", "강남구", "서울특별시"),
                        district("11650", "서초구", "서울특별시"));
        aggregator = aggregator();
    }

    private List<InsightCandidate> aggregate() {
        return aggregator.aggregate(snapshotService(store).load());
    }

    private static Optional<InsightCandidate> find(List<InsightCandidate> candidates, SpatialLevel level, String label) {
        return candidates.stream()
                .filter(c -> c.getLevel() == level && c.getSpatialLabel().equals(label))
                .findFirst();
    }

    @Test
    @DisplayName("Each level sums its own units before windowing")
    void levelsAggregateIndependently() {
        store.activity(
                footTraffic("1168010100", month(2024, 1), 100),
                footTraffic("1168010300", month(2024, 1), 50),
                footTraffic("1165010100", month(2024, 1), 70));

        List<InsightCandidate> candidates = aggregate();

        assertThat(candidates).filteredOn(c -> c.getLevel() == SpatialLevel.FINEST).hasSize(3);
        InsightCandidate gangnam = find(candidates, SpatialLevel.INTERMEDIATE, "강남구").orElseThrow();
        assertThat(gangnam.value(Metric.FOOT_TRAFFIC)).isEqualTo(150.0);
        assertThat(gangnam.window(Metric.FOOT_TRAFFIC).getRank()).isEqualTo(1);
        assertThat(find(candidates, SpatialLevel.INTERMEDIATE, "서초구").orElseThrow()
                .window(Metric.FOOT_TRAFFIC).getRank()).isEqualTo(2);

        InsightCandidate seoul = find(candidates, SpatialLevel.COARSEST, "서울특별시").orElseThrow();
        assertThat(seoul.value(Metric.FOOT_TRAFFIC)).isEqualTo(220.0);
        assertThat(candidates).filteredOn(c -> c.getLevel() == SpatialLevel.COARSEST).hasSize(1);
    }

    @Test
    @DisplayName("Exactly one row per (level, label, date), ordered finest first")
    void oneRowPerLevelLabelDate() {
        store.activity(
                footTraffic("1168010100", month(2024, 2), 1),
                footTraffic("1168010100", month(2024, 1), 1),
                footTraffic("1168010300", month(2024, 1), 1));

        List<InsightCandidate> candidates = aggregate();

        assertThat(candidates)
                .extracting(c -> c.getLevel() + "|" + c.getSpatialLabel() + "|" + c.getDate())
                .containsExactly(
                        "FINEST|개포동|2024-01-01",
                        "FINEST|역삼동|2024-01-01",
                        "FINEST|역삼동|2024-02-01",
                        "INTERMEDIATE|강남구|2024-01-01",
                        "INTERMEDIATE|강남구|2024-02-01",
                        "COARSEST|서울특별시|2024-01-01",
                        "COARSEST|서울특별시|2024-02-01");
    }

    @Test
    @DisplayName("Sources colliding on one key and date are summed and flagged")
    void overlappingSourcesSummedWithWarning() {
        store.activity(
                activity("1168010100", month(2024, 1), "telco", 100.0, null),
                activity("1168010100", month(2024, 1), "card", 30.0, 500.0));

        FactSnapshot snapshot = snapshotService(store).load();
        List<InsightCandidate> candidates = aggregator.aggregate(snapshot);

        InsightCandidate cell = find(candidates, SpatialLevel.FINEST, "역삼동").orElseThrow();
        assertThat(cell.value(Metric.FOOT_TRAFFIC)).isEqualTo(130.0);
        assertThat(cell.value(Metric.SALES)).isEqualTo(500.0);
        assertThat(cell.getSources()).containsExactly("card", "telco");
        assertThat(snapshot.getWarnings()).singleElement().asString()
                .contains("1168010100").contains("[card, telco]");
        assertThat(snapshot.getSources()).containsExactly("card", "telco");
    }

    @Test
    @DisplayName("Demographic dominance is attached at the finest level only")
    void demographicsOnlyAtFinest() {
        store.activity(footTraffic("1168010100", month(2024, 1), 100))
                .demographics(
                        demographic("1168010100", month(2024, 1), "F", "30s", 60.0),
                        demographic("1168010100", month(2024, 1), "M", "30s", 40.0));

        List<InsightCandidate> candidates = aggregate();

        InsightCandidate finest = find(candidates, SpatialLevel.FINEST, "역삼동").orElseThrow();
        assertThat(finest.getDominantGroup()).isEqualTo("F_30s");
        assertThat(finest.getDominantShare()).isCloseTo(0.6, within(1e-12));
        InsightCandidate district = find(candidates, SpatialLevel.INTERMEDIATE, "강남구").orElseThrow();
        assertThat(district.getDominantGroup()).isNull();
        assertThat(district.getDominantShare()).isNull();
    }

    @Test
    @DisplayName("Unresolvable keys keep their raw key as label at every level")
    void unresolvedKeysAreNotDropped() {
        store.activity(footTraffic("grid-7", month(2024, 1), 9));

        List<InsightCandidate> candidates = aggregate();

        for (SpatialLevel level : SpatialLevel.values()) {
            assertThat(find(candidates, level, "grid-7")).isPresent();
        }
    }

    @Test
    @DisplayName("Recomputing on an unchanged snapshot is byte-identical")
    void recomputationIsIdempotent() throws Exception {
        for (int m = 1; m <= 14; m++) {
            store.activity(
                    activity("1168010100", month(2023, 1).plusMonths(m), "telco", 100.0 + m, 1000.0 + 3 * m),
                    activity("1165010100", month(2023, 1).plusMonths(m), "telco", 90.0 + (m % 4), 800.0));
        }
        store.demographics(demographic("1168010100", month(2023, 2), "F", "20s", 5.0));
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

        String first = mapper.writeValueAsString(aggregate());
        String second = mapper.writeValueAsString(aggregate());

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Duplicate primary keys fail the snapshot")
    void duplicatePrimaryKeyIsInternalError() {
        store.activity(
                activity("1168010100", month(2024, 1), "telco", 1.0, null),
                activity("1168010100", month(2024, 1), "telco", 2.0, null));

        assertThatThrownBy(() -> snapshotService(store).load())
                .isInstanceOf(InternalInvariantException.class)
                .hasMessageContaining("duplicate activity fact");
    }

    @Test
    @DisplayName("An unreachable fact store is a retryable upstream failure")
    void storeFailureIsRetryable() {
        FactStore failing = mock(FactStore.class);
        when(failing.findActivityFacts("month")).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> snapshotService(failing).load())
                .isInstanceOfSatisfying(UpstreamUnavailableException.class, e -> assertThat(e.isRetryable()).isTrue());
    }
}
