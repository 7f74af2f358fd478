package com.geoinsight.mcp.service;

import java.util.List;

/**
 * Nearest-neighbour search over request embeddings, by cosine distance.
 */
public interface VectorIndex {

    /** Add or replace the vector stored under {@code id}. */
    void insert(String id, double[] vector);

    /** Up to {@code k} ids ordered by ascending distance. */
    List<VectorMatch> query(double[] vector, int k);

    int size();
}
