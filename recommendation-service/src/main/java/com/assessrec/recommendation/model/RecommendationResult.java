package com.assessrec.recommendation.model;

import java.util.List;

public final class RecommendationResult {
    private final QueryRequirements requirements;
    private final List<ScoredCandidate> items;

    public RecommendationResult(QueryRequirements requirements, List<ScoredCandidate> items) {
        this.requirements = requirements;
        this.items = List.copyOf(items);
    }

    public QueryRequirements getRequirements() {
        return requirements;
    }

    public List<ScoredCandidate> getItems() {
        return items;
    }

    public int size() {
        return items.size();
    }
}
