package com.geoinsight.mcp.service;

import com.geoinsight.mcp.model.DemographicDominance;
import com.geoinsight.mcp.model.DemographicFact;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Largest (sex, age group) segment per (spatial label, date) and its share of the total.
 * Equal values go to the lexicographically smallest group key so repeated runs agree.
 */
@Component
public class DemographicDominanceCalculator {

    public List<DemographicDominance> compute(List<DemographicFact> facts, Function<String, String> labelOfKey) {
        // label -> date -> group -> summed value; sorted maps keep output order stable
        Map<String, Map<LocalDate, Map<String, Double>>> cells = new TreeMap<>();
        for (DemographicFact fact : facts) {
            if (fact.getValue() == null) {
                continue;
            }
            DemographicFact.Id id = fact.getId();
            String label = labelOfKey.apply(id.getSpatialKey());
            cells.computeIfAbsent(label, k -> new TreeMap<>())
                    .computeIfAbsent(id.getDate(), k -> new TreeMap<>())
                    .merge(groupKey(id.getSex(), id.getAgeGroup()), fact.getValue(), Double::sum);
        }

        List<DemographicDominance> result = new ArrayList<>();
        cells.forEach((label, byDate) -> byDate.forEach((date, groups) ->
                result.add(dominance(label, date, groups))));
        return result;
    }

    static String groupKey(String sex, String ageGroup) {
        return sex + "_" + ageGroup;
    }

    private DemographicDominance dominance(String label, LocalDate date, Map<String, Double> groups) {
        double total = 0.0;
        for (Double value : groups.values()) {
            total += value;
        }
        // on equal values the smaller key compares greater
        Map.Entry<String, Double> dominant = groups.entrySet().stream()
                .max(Comparator.<Map.Entry<String, Double>>comparingDouble(Map.Entry::getValue)
                        .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
                .orElseThrow();

        return DemographicDominance.builder()
                .spatialLabel(label)
                .date(date)
                .dominantGroup(dominant.getKey())
                .dominantValue(dominant.getValue())
                .total(total)
                .dominantShare(total == 0.0 ? null : dominant.getValue() / total)
                .build();
    }
}
