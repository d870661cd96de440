package com.assessrec.recommendation.service;

import com.assessrec.recommendation.corpus.RecommendationContext;

public class SimilarityScorer {

    /**
     * Cosine similarity of {@code queryVector} with every corpus vector. Both sides are unit
     * length, so this is a plain dot product.
     *
     * @throws IllegalArgumentException if the query vector dimension differs from the corpus
     */
    public double[] score(float[] queryVector, RecommendationContext context) {
        if (queryVector == null || queryVector.length != context.dimension()) {
            int actual = queryVector == null ? 0 : queryVector.length;
            throw new IllegalArgumentException(
                    "query vector dimension " + actual + " does not match corpus dimension " + context.dimension());
        }
        double[] scores = new double[context.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = context.dot(i, queryVector);
        }
        return scores;
    }
}
