package com.geoinsight.mcp.service;

import com.geoinsight.mcp.model.DemographicDominance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Function;

import static com.geoinsight.mcp.support.Facts.demographic;
import static com.geoinsight.mcp.support.Facts.month;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("DemographicDominanceCalculator")
class DemographicDominanceCalculatorTest {

    private final DemographicDominanceCalculator calculator = new DemographicDominanceCalculator();

    @Test
    @DisplayName("Largest summed group wins and its share is taken of the cell total")
    void largestGroupAndShare() {
        List<DemographicDominance> result = calculator.compute(List.of(
                demographic("k1", month(2024, 1), "F", "30s", 30.0),
                demographic("k2", month(2024, 1), "F", "30s", 20.0),
                demographic("k1", month(2024, 1), "M", "20s", 40.0),
                demographic("k1", month(2024, 1), "M", "60s", 10.0)), key -> "역삼동");

        assertThat(result).hasSize(1);
        DemographicDominance dominance = result.get(0);
        assertThat(dominance.getSpatialLabel()).isEqualTo("역삼동");
        assertThat(dominance.getDominantGroup()).isEqualTo("F_30s");
        assertThat(dominance.getDominantValue()).isEqualTo(50.0);
        assertThat(dominance.getTotal()).isEqualTo(100.0);
        assertThat(dominance.getDominantShare()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    @DisplayName("Ties go to the lexicographically smallest group key")
    void tieBrokenLexicographically() {
        List<DemographicDominance> result = calculator.compute(List.of(
                demographic("k", month(2024, 1), "M", "20s", 10.0),
                demographic("k", month(2024, 1), "F", "40s", 10.0),
                demographic("k", month(2024, 1), "F", "20s", 10.0)), Function.identity());

        assertThat(result.get(0).getDominantGroup()).isEqualTo("F_20s");
    }

    @Test
    @DisplayName("Zero total leaves the share empty; empty values are ignored")
    void zeroTotalHasNoShare() {
        List<DemographicDominance> result = calculator.compute(List.of(
                demographic("k", month(2024, 1), "F", "20s", 0.0),
                demographic("k", month(2024, 1), "M", "20s", null)), Function.identity());

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getDominantGroup()).isEqualTo("F_20s");
        assertThat(result.get(0).getDominantShare()).isNull();
    }

    @Test
    @DisplayName("Output is one row per (label, date), ordered by label then date")
    void oneRowPerCellInOrder() {
        List<DemographicDominance> result = calculator.compute(List.of(
                demographic("b", month(2024, 2), "F", "20s", 1.0),
                demographic("a", month(2024, 2), "F", "20s", 1.0),
                demographic("a", month(2024, 1), "F", "20s", 1.0)), Function.identity());

        assertThat(result).extracting(DemographicDominance::getSpatialLabel).containsExactly("a", "a", "b");
        assertThat(result.get(0).getDate()).isEqualTo(month(2024, 1));
    }
}
