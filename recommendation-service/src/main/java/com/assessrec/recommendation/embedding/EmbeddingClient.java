package com.assessrec.recommendation.embedding;

import java.util.List;

/**
 * Maps text to a fixed-dimension, L2-normalized vector. Implementations must be safe to call
 * from several request threads at once.
 */
public interface EmbeddingClient {

    float[] embed(String text);

    List<float[]> embedBatch(List<String> texts);

    String modelName();
}
