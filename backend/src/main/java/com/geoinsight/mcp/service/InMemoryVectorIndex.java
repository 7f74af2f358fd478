package com.geoinsight.mcp.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exhaustive cosine search held in memory; rebuilt from the cache table at startup.
 * Equal distances are ordered by id.
 */
public class InMemoryVectorIndex implements VectorIndex {

    private final Map<String, double[]> vectors = new ConcurrentHashMap<>();

    @Override
    public void insert(String id, double[] vector) {
        vectors.put(id, vector.clone());
    }

    @Override
    public List<VectorMatch> query(double[] vector, int k) {
        if (k <= 0) {
            return List.of();
        }
        List<VectorMatch> matches = new ArrayList<>(vectors.size());
        vectors.forEach((id, stored) -> {
            if (stored.length == vector.length) {
                matches.add(new VectorMatch(id, cosineDistance(vector, stored)));
            }
        });
        matches.sort(Comparator.comparingDouble(VectorMatch::getDistance).thenComparing(VectorMatch::getId));
        return matches.size() > k ? new ArrayList<>(matches.subList(0, k)) : matches;
    }

    @Override
    public int size() {
        return vectors.size();
    }

    static double cosineDistance(double[] a, double[] b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 1.0;
        }
        return 1.0 - dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
