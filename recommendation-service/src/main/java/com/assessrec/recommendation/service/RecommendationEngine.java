package com.assessrec.recommendation.service;

import com.assessrec.recommendation.corpus.RecommendationContext;
import com.assessrec.recommendation.model.QueryRequirements;
import com.assessrec.recommendation.model.RecommendationResult;
import com.assessrec.recommendation.model.ScoredCandidate;

import java.util.List;

/**
 * Runs the ranking pipeline for one query: analyze, score, filter, balance. Holds no per-request
 * state, so a single instance serves concurrent requests.
 */
public class RecommendationEngine {

    private final QueryAnalyzer queryAnalyzer;
    private final SimilarityScorer similarityScorer;
    private final ConstraintFilter constraintFilter;
    private final BalanceRankEngine balanceRankEngine;

    public RecommendationEngine() {
        this(RankingPolicy.DEFAULT);
    }

    public RecommendationEngine(RankingPolicy policy) {
        this(new QueryAnalyzer(), new SimilarityScorer(), new ConstraintFilter(policy), new BalanceRankEngine(policy));
    }

    public RecommendationEngine(
            QueryAnalyzer queryAnalyzer,
            SimilarityScorer similarityScorer,
            ConstraintFilter constraintFilter,
            BalanceRankEngine balanceRankEngine
    ) {
        this.queryAnalyzer = queryAnalyzer;
        this.similarityScorer = similarityScorer;
        this.constraintFilter = constraintFilter;
        this.balanceRankEngine = balanceRankEngine;
    }

    public RecommendationResult recommend(RecommendationContext context, String query, float[] queryVector) {
        QueryRequirements requirements = queryAnalyzer.analyze(query);
        double[] similarities = similarityScorer.score(queryVector, context);
        List<ScoredCandidate> filtered = constraintFilter.apply(context, similarities, requirements);
        List<ScoredCandidate> ranked = balanceRankEngine.rank(
                filtered,
                requirements.isNeedsBalanced(),
                requirements.isNeedsCognitive()
        );
        return new RecommendationResult(requirements, ranked);
    }

    public QueryRequirements analyze(String query) {
        return queryAnalyzer.analyze(query);
    }
}
