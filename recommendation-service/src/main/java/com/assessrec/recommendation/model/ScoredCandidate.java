package com.assessrec.recommendation.model;

/**
 * A corpus record with its similarity to the current query. {@code position} is the record's
 * index in the corpus and breaks score ties.
 */
public final class ScoredCandidate {
    private final AssessmentRecord record;
    private final int position;
    private final double similarity;
    private final double boost;

    public ScoredCandidate(AssessmentRecord record, int position, double similarity) {
        this(record, position, similarity, 0.0);
    }

    public ScoredCandidate(AssessmentRecord record, int position, double similarity, double boost) {
        this.record = record;
        this.position = position;
        this.similarity = similarity;
        this.boost = boost;
    }

    public ScoredCandidate withBoost(double extra) {
        return new ScoredCandidate(record, position, similarity, boost + extra);
    }

    public AssessmentRecord getRecord() { return record; }
    public int getPosition() { return position; }
    public double getSimilarity() { return similarity; }
    public double getBoost() { return boost; }

    public double score() {
        return similarity + boost;
    }
}
