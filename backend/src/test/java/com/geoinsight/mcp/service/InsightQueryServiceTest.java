package com.geoinsight.mcp.service;

import com.geoinsight.mcp.exception.InvalidArgumentException;
import com.geoinsight.mcp.model.ActivityFact;
import com.geoinsight.mcp.model.AdvancedInsightResult;
import com.geoinsight.mcp.model.AnomalyResult;
import com.geoinsight.mcp.model.CompareDomainsResult;
import com.geoinsight.mcp.model.Domain;
import com.geoinsight.mcp.model.DomainComparison;
import com.geoinsight.mcp.model.Metric;
import com.geoinsight.mcp.model.RankingsResult;
import com.geoinsight.mcp.model.SpatialLevel;
import com.geoinsight.mcp.model.ToolResponse;
import com.geoinsight.mcp.support.InMemoryFactStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mockito;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.geoinsight.mcp.support.Facts.activity;
import static com.geoinsight.mcp.support.Facts.aggregator;
import static com.geoinsight.mcp.support.Facts.dimension;
import static com.geoinsight.mcp.support.Facts.district;
import static com.geoinsight.mcp.support.Facts.month;
import static com.geoinsight.mcp.support.Facts.monthlyFootTraffic;
import static com.geoinsight.mcp.support.Facts.snapshotService;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("InsightQueryService")
class InsightQueryServiceTest {

    private InMemoryFactStore store;
    private AdvancedInsightService advanced;
    private InsightQueryService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryFactStore()
                // A: 100, 200, ..., 1200 over 2024
                .activity(monthlyFootTraffic("A", month(2024, 1),
                        100, 200, 300, 400, 500, 600, 700, 800, 900, 1000, 1100, 1200))
                .activity(monthlyFootTraffic("B", month(2024, 1),
                        50, 100, 150, 200, 250, 300, 350, 400, 450, 500, 550, 600));
        FactSnapshotService snapshots = snapshotService(store);
        advanced = new AdvancedInsightService(snapshots, aggregator(), 5000);
        service = new InsightQueryService(snapshots, aggregator(), new SpatialResolverService(), advanced);
    }

    @AfterEach
    void tearDown() {
        advanced.shutdown();
    }

    @Nested
    @DisplayName("getRankings")
    class Rankings {

        @Test
        @DisplayName("Returns the top unit of the requested month with its value and rank")
        void topUnitOfMonth() {
            ToolResponse<RankingsResult> response = service.getRankings("foot_traffic", "2024-12", 1, null);

            RankingsResult result = response.getData();
            assertThat(result.getMetric()).isEqualTo(Metric.FOOT_TRAFFIC);
            assertThat(result.getDate()).isEqualTo(month(2024, 12));
            assertThat(result.getRankings()).singleElement().satisfies(entry -> {
                assertThat(entry.getSpatialLabel()).isEqualTo("A");
                assertThat(entry.getValue()).isEqualTo(1200.0);
                assertThat(entry.getRank()).isEqualTo(1);
            });
            assertThat(response.getMetadata().getSources()).containsExactly("telco");
            assertThat(response.getMetadata().getPeriodFrom()).isEqualTo(month(2024, 12));
            assertThat(response.getMetadata().getPeriodTo()).isEqualTo(month(2024, 12).withDayOfMonth(31));
            assertThat(response.getMetadata().getLevel()).isEqualTo(SpatialLevel.INTERMEDIATE);
        }

        @Test
        @DisplayName("Without a period the latest date is ranked and echoed in the metadata")
        void latestDateWhenNoPeriod() {
            ToolResponse<RankingsResult> response = service.getRankings("activity_volume", null, null, "sig");

            assertThat(response.getData().getRankings())
                    .extracting(entry -> entry.getSpatialLabel() + "#" + entry.getRank())
                    .containsExactly("A#1", "B#2");
            assertThat(response.getMetadata().getPeriodFrom()).isEqualTo(month(2024, 12));
            assertThat(response.getMetadata().getPeriodTo()).isEqualTo(month(2024, 12));
        }

        @Test
        @DisplayName("A period without data gives an empty ranking and a warning")
        void periodWithoutData() {
            ToolResponse<RankingsResult> response = service.getRankings("sales", "2023", 5, null);

            assertThat(response.getData().getRankings()).isEmpty();
            assertThat(response.getData().getDate()).isNull();
            assertThat(response.getMetadata().getWarnings()).contains("no data in the requested period");
        }

        @Test
        @DisplayName("Units with no value for the metric sort after ranked units")
        void nullValuesSortLast() {
            store.activity(activity("C", month(2024, 12), "card", null, 10.0));

            ToolResponse<RankingsResult> response = service.getRankings("foot_traffic", "2024-12", 10, null);

            assertThat(response.getData().getRankings())
                    .extracting(entry -> entry.getSpatialLabel())
                    .containsExactly("A", "B", "C");
            assertThat(response.getData().getRankings().get(2).getRank()).isNull();
        }
    }

    @Nested
    @DisplayName("detectAnomaly")
    class Anomaly {

        @BeforeEach
        void spikeSeries() {
            double[] values = new double[11];
            Arrays.fill(values, 100.0);
            values[10] = 200.0;
            store.activity(monthlyFootTraffic("S", month(2024, 1), values));
        }

        @Test
        @DisplayName("A spike far from the unit's own history is flagged")
        void spikeIsAnomaly() {
            ToolResponse<AnomalyResult> response = service.detectAnomaly("S", "population", null, null, null);

            AnomalyResult result = response.getData();
            assertThat(result.getPeriod()).isEqualTo(month(2024, 11));
            assertThat(result.getValue()).isEqualTo(200.0);
            // mean 1200/11, sample std sqrt(110000)/11
            assertThat(result.getZscore()).isCloseTo(1000 / Math.sqrt(110000), within(1e-9));
            assertThat(result.getThreshold()).isEqualTo(2.0);
            assertThat(result.isAnomaly()).isTrue();
        }

        @Test
        @DisplayName("An ordinary month is not flagged")
        void ordinaryMonth() {
            AnomalyResult result = service.detectAnomaly("S", null, "2024-10", null, null).getData();

            assertThat(result.getValue()).isEqualTo(100.0);
            assertThat(result.getZscore()).isNegative();
            assertThat(result.isAnomaly()).isFalse();
        }

        @Test
        @DisplayName("A stricter threshold than the deviation is not flagged")
        void stricterThreshold() {
            AnomalyResult result = service.detectAnomaly("S", "foot_traffic", null, 3.5, null).getData();

            assertThat(result.getThreshold()).isEqualTo(3.5);
            assertThat(result.isAnomaly()).isFalse();
        }

        @Test
        @DisplayName("An unknown region yields no result and a warning instead of an error")
        void unknownRegion() {
            ToolResponse<AnomalyResult> response = service.detectAnomaly("nowhere", null, null, null, null);

            assertThat(response.getData().getZscore()).isNull();
            assertThat(response.getData().isAnomaly()).isFalse();
            assertThat(response.getMetadata().getWarnings())
                    .contains("no data for region 'nowhere' in the requested period");
        }

        @Test
        @DisplayName("A single observation has no z-score")
        void singleObservation() {
            store.activity(activity("D", month(2024, 3), "telco", 42.0, null));

            ToolResponse<AnomalyResult> response = service.detectAnomaly("D", null, null, null, null);

            assertThat(response.getData().getZscore()).isNull();
            assertThat(response.getData().isAnomaly()).isFalse();
            assertThat(response.getMetadata().getWarnings())
                    .anyMatch(w -> w.startsWith("z-score undefined"));
        }
    }

    @Nested
    @DisplayName("compareDomains")
    class CompareDomains {

        @Test
        @DisplayName("Reports the region's latest values with month-over-month trend per domain")
        void regionLatest() {
            ToolResponse<CompareDomainsResult> response =
                    service.compareDomains("A", null, null, List.of("population", "sales"), null);

            CompareDomainsResult result = response.getData();
            assertThat(result.getRegion()).isEqualTo("A");
            assertThat(result.getDate()).isEqualTo(month(2024, 12));
            assertThat(result.getComparisons()).hasSize(2);

            DomainComparison population = result.getComparisons().get(0);
            assertThat(population.getDomain()).isEqualTo(Domain.POPULATION);
            assertThat(population.getValue()).isEqualTo(1200.0);
            assertThat(population.getChangeRate()).isCloseTo(100.0 / 1100, within(1e-12));
            assertThat(population.getYoyRate()).isNull();
            assertThat(population.getTrend()).isEqualTo("up");
            assertThat(population.getSignal()).isEqualTo("moderate_change");

            DomainComparison sales = result.getComparisons().get(1);
            assertThat(sales.getValue()).isNull();
            assertThat(sales.getTrend()).isEqualTo("flat");
            assertThat(sales.getSignal()).isEqualTo("insufficient_data");
        }

        @Test
        @DisplayName("The upper bound of the period selects the compared month")
        void boundedPeriod() {
            CompareDomainsResult result =
                    service.compareDomains("A", "2024-01", "2024-06", List.of("population"), null).getData();

            assertThat(result.getDate()).isEqualTo(month(2024, 6));
            assertThat(result.getComparisons().get(0).getChangeRate()).isCloseTo(0.2, within(1e-12));
            assertThat(result.getComparisons().get(0).getSignal()).isEqualTo("strong_change");
        }

        @Test
        @DisplayName("Without a region the cross-sectional mean of all units is compared")
        void crossSectionalMean() {
            CompareDomainsResult result =
                    service.compareDomains(null, null, null, List.of("population"), null).getData();

            assertThat(result.getRegion()).isNull();
            assertThat(result.getDate()).isEqualTo(month(2024, 12));
            DomainComparison population = result.getComparisons().get(0);
            assertThat(population.getValue()).isEqualTo(900.0);
            assertThat(population.getChangeRate()).isCloseTo(75.0 / 825, within(1e-12));
        }

        @Test
        @DisplayName("An absent domain list compares every domain")
        void allDomainsByDefault() {
            CompareDomainsResult result = service.compareDomains("B", null, null, null, null).getData();

            assertThat(result.getComparisons())
                    .extracting(DomainComparison::getDomain)
                    .containsExactly(Domain.POPULATION, Domain.SALES);
        }
    }

    @Nested
    @DisplayName("getAdvancedInsight")
    class Advanced {

        @BeforeEach
        void salesHistory() {
            List<ActivityFact> facts = new ArrayList<>();
            for (int m = 1; m <= 6; m++) {
                facts.add(activity("P", month(2024, m), "card", null, 10.0 * m + 3));
            }
            store.activity(facts);
            for (int m = 1; m <= 6; m++) {
                store.activity(activity("P", month(2024, m), "telco", 5.0 * m, null));
            }
        }

        @Test
        @DisplayName("Before any refresh the result is empty with a warning")
        void beforeRefresh() {
            ToolResponse<AdvancedInsightResult> response = service.getAdvancedInsight("P", null, null, null);

            assertThat(response.getData().getInsight()).isNull();
            assertThat(response.getMetadata().getLastRefreshedAt()).isNull();
            assertThat(response.getMetadata().getWarnings()).contains("advanced insights have not been computed yet");
        }

        @Test
        @DisplayName("After a refresh the region's correlation and slope are served with the refresh time")
        void afterRefresh() {
            advanced.refresh();

            ToolResponse<AdvancedInsightResult> response =
                    service.getAdvancedInsight(" P ", "2024", List.of("sales"), "intermediate");

            AdvancedInsightResult result = response.getData();
            assertThat(result.getRegion()).isEqualTo("P");
            assertThat(result.getDomains()).containsExactly(Domain.SALES);
            assertThat(result.getInsight().getPairCount()).isEqualTo(6);
            assertThat(result.getInsight().getCorrelation()).isCloseTo(1.0, within(1e-9));
            assertThat(result.getInsight().getSalesImpactSlope()).isCloseTo(2.0, within(1e-9));
            assertThat(response.getMetadata().getLastRefreshedAt()).isEqualTo(advanced.current().getRefreshedAt());
            assertThat(response.getMetadata().getSources()).containsExactly("card", "telco");
            assertThat(response.getMetadata().getPeriodFrom()).isEqualTo(month(2024, 1));
        }

        @Test
        @DisplayName("A region absent from the refreshed set is reported in the warnings")
        void regionNotInSet() {
            advanced.refresh();

            ToolResponse<AdvancedInsightResult> response = service.getAdvancedInsight("Z", null, null, "coarsest");

            assertThat(response.getData().getInsight()).isNull();
            assertThat(response.getMetadata().getWarnings())
                    .contains("no advanced insight for region 'Z' at coarsest level");
        }

        @Test
        @DisplayName("A raw spatial key is looked up under its label from the refreshed directory")
        void rawKeyCanonicalized() {
            store.dimensions(dimension("1168010100", "역삼동", "1168010100"))
                    .districts(district("11680", "강남구", "서울특별시"));
            for (int m = 1; m <= 6; m++) {
                store.activity(activity("1168010100", month(2024, m), "telco", 5.0 * m, 10.0 * m + 3));
            }
            advanced.refresh();

            ToolResponse<AdvancedInsightResult> response =
                    service.getAdvancedInsight("1168010100", null, null, "intermediate");

            assertThat(response.getData().getRegion()).isEqualTo("강남구");
            assertThat(response.getData().getInsight()).isNotNull();
            assertThat(response.getData().getInsight().getPairCount()).isEqualTo(6);
            assertThat(response.getMetadata().getWarnings())
                    .noneMatch(w -> w.startsWith("no advanced insight"));
        }
    }

    @Nested
    @DisplayName("Argument validation")
    class Validation {

        private FactSnapshotService snapshots;
        private AdvancedInsightService advancedMock;
        private InsightQueryService guarded;

        @BeforeEach
        void mockedStore() {
            snapshots = Mockito.mock(FactSnapshotService.class);
            advancedMock = Mockito.mock(AdvancedInsightService.class);
            guarded = new InsightQueryService(snapshots, aggregator(), new SpatialResolverService(), advancedMock);
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -1, 101})
        @DisplayName("top_k outside 1..100 is rejected before reading facts")
        void topKRange(int topK) {
            assertThatThrownBy(() -> guarded.getRankings("sales", null, topK, null))
                    .isInstanceOf(InvalidArgumentException.class)
                    .hasMessageContaining("top_k");
            verifyNoInteractions(snapshots);
        }

        @ParameterizedTest
        @ValueSource(doubles = {0.0, -2.0, Double.NaN, Double.POSITIVE_INFINITY})
        @DisplayName("A non-positive or non-finite z threshold is rejected")
        void zThreshold(double threshold) {
            assertThatThrownBy(() -> guarded.detectAnomaly("A", null, null, threshold, null))
                    .isInstanceOf(InvalidArgumentException.class)
                    .hasMessageContaining("z_threshold");
            verifyNoInteractions(snapshots);
        }

        @Test
        @DisplayName("Malformed periods, metrics, domains and levels are rejected")
        void malformedArguments() {
            assertThatThrownBy(() -> guarded.getRankings("sales", "2024-13", 5, null))
                    .isInstanceOf(InvalidArgumentException.class);
            assertThatThrownBy(() -> guarded.getRankings("sales", "Dec 2024", 5, null))
                    .isInstanceOf(InvalidArgumentException.class);
            assertThatThrownBy(() -> guarded.getRankings("revenue", null, 5, null))
                    .isInstanceOf(InvalidArgumentException.class)
                    .hasMessageContaining("metric");
            assertThatThrownBy(() -> guarded.compareDomains("A", null, null, List.of("weather"), null))
                    .isInstanceOf(InvalidArgumentException.class)
                    .hasMessageContaining("domain");
            assertThatThrownBy(() -> guarded.detectAnomaly("A", "weather", null, null, null))
                    .isInstanceOf(InvalidArgumentException.class)
                    .hasMessageContaining("domain");
            assertThatThrownBy(() -> guarded.getRankings("sales", null, 5, "block"))
                    .isInstanceOf(InvalidArgumentException.class)
                    .hasMessageContaining("level");
            verifyNoInteractions(snapshots);
        }

        @Test
        @DisplayName("Region is required for anomaly detection and advanced insight")
        void regionRequired() {
            assertThatThrownBy(() -> guarded.detectAnomaly(" ", null, null, null, null))
                    .isInstanceOf(InvalidArgumentException.class);
            assertThatThrownBy(() -> guarded.getAdvancedInsight(null, null, null, null))
                    .isInstanceOf(InvalidArgumentException.class);
            verifyNoInteractions(snapshots, advancedMock);
        }
    }
}
