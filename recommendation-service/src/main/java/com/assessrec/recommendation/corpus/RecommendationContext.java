package com.assessrec.recommendation.corpus;

import com.assessrec.recommendation.embedding.Vectors;
import com.assessrec.recommendation.model.AssessmentRecord;

import java.util.List;

/**
 * Immutable pairing of the assessment corpus with its embedding matrix. Rows are normalized on
 * construction, so {@link #dot} is the cosine similarity whatever the vector source. Built once at
 * startup and shared read-only by every request.
 */
public final class RecommendationContext {

    private final List<AssessmentRecord> records;
    private final float[][] vectors;
    private final String modelName;
    private final int dimension;

    public RecommendationContext(List<AssessmentRecord> records, List<float[]> vectors, String modelName) {
        if (records.size() != vectors.size()) {
            throw new CorpusConfigurationException(
                    "corpus has " + records.size() + " records but " + vectors.size() + " vectors");
        }
        if (records.isEmpty()) {
            throw new CorpusConfigurationException("corpus is empty");
        }
        int dim = vectors.get(0).length;
        if (dim == 0) {
            throw new CorpusConfigurationException("embedding dimension is zero");
        }
        float[][] copy = new float[vectors.size()][];
        for (int i = 0; i < vectors.size(); i++) {
            float[] row = vectors.get(i);
            if (row.length != dim) {
                throw new CorpusConfigurationException(
                        "vector " + i + " has dimension " + row.length + ", expected " + dim);
            }
            copy[i] = Vectors.normalize(row);
        }
        this.records = List.copyOf(records);
        this.vectors = copy;
        this.modelName = modelName == null ? "" : modelName;
        this.dimension = dim;
    }

    public int size() {
        return records.size();
    }

    public int dimension() {
        return dimension;
    }

    public String modelName() {
        return modelName;
    }

    public AssessmentRecord record(int position) {
        return records.get(position);
    }

    public double dot(int position, float[] query) {
        float[] row = vectors[position];
        double sum = 0.0;
        for (int i = 0; i < row.length; i++) {
            sum += (double) row[i] * query[i];
        }
        return sum;
    }
}
