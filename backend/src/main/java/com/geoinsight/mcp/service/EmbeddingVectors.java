package com.geoinsight.mcp.service;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Conversions between embedding vectors and the pgvector text literal "[0.1,0.2,...]".
 */
public final class EmbeddingVectors {

    private EmbeddingVectors() {
    }

    public static double[] toArray(List<Double> embedding) {
        double[] vector = new double[embedding.size()];
        for (int i = 0; i < vector.length; i++) {
            Double value = embedding.get(i);
            vector[i] = value != null ? value : 0.0;
        }
        return vector;
    }

    public static String format(double[] vector) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(String.format(Locale.ROOT, "%.6f", vector[i]));
        }
        return sb.append(']').toString();
    }

    public static String format(List<Double> embedding) {
        return "[" + embedding.stream()
                .map(d -> String.format(Locale.ROOT, "%.6f", d))
                .collect(Collectors.joining(",")) + "]";
    }

    /**
     * Parse a pgvector literal; null or blank yields null.
     */
    public static double[] parse(String literal) {
        if (literal == null || literal.isBlank()) {
            return null;
        }
        String body = literal.trim();
        if (body.startsWith("[")) {
            body = body.substring(1);
        }
        if (body.endsWith("]")) {
            body = body.substring(0, body.length() - 1);
        }
        if (body.isBlank()) {
            return new double[0];
        }
        String[] parts = body.split(",");
        double[] vector = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Double.parseDouble(parts[i].trim());
        }
        return vector;
    }
}
