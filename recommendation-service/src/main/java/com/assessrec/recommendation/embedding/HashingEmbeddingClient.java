package com.assessrec.recommendation.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Offline embedder that hashes word tokens into a fixed number of signed buckets. Texts that
 * share words end up close to each other, which is enough for local runs without a model server.
 */
public class HashingEmbeddingClient implements EmbeddingClient {

    public static final String MODEL_NAME = "hashing-bow";

    private final int dimension;

    public HashingEmbeddingClient(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (String token : normalized.split("[^a-z0-9+#.]+")) {
            if (token.isEmpty()) {
                continue;
            }
            long seed = token.hashCode();
            seed = (seed * 6364136223846793005L) + 1442695040888963407L;
            int bucket = (int) ((seed >>> 33) % dimension);
            float sign = ((seed >>> 17) & 1L) == 0 ? 1.0f : -1.0f;
            vector[bucket] += sign;
        }
        return Vectors.normalize(vector);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (String text : texts) {
            out.add(embed(text));
        }
        return out;
    }

    @Override
    public String modelName() {
        return MODEL_NAME + "-" + dimension;
    }
}
