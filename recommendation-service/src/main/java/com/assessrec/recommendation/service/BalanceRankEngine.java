package com.assessrec.recommendation.service;

import com.assessrec.recommendation.model.ScoredCandidate;
import com.assessrec.recommendation.model.TestType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the filtered ranking into the final result: per-category quotas for mixed-intent
 * queries, url dedup, and the size clamp.
 */
public class BalanceRankEngine {

    private final RankingPolicy policy;

    public BalanceRankEngine(RankingPolicy policy) {
        this.policy = policy;
    }

    /**
     * @param sorted         candidates already sorted by score descending
     * @param needsBalanced  take per-category quotas instead of the global top
     * @param needsCognitive also take the ability quota when balancing
     * @return at most {@code maxResults} candidates with distinct urls; fewer than
     *         {@code minResults} only when fewer were supplied
     */
    public List<ScoredCandidate> rank(List<ScoredCandidate> sorted, boolean needsBalanced, boolean needsCognitive) {
        List<ScoredCandidate> ranked;
        if (needsBalanced) {
            List<ScoredCandidate> union = new ArrayList<>();
            union.addAll(topOfType(sorted, TestType.K, policy.knowledgeQuota()));
            union.addAll(topOfType(sorted, TestType.P, policy.personalityQuota()));
            if (needsCognitive) {
                union.addAll(topOfType(sorted, TestType.A, policy.abilityQuota()));
            }
            ranked = distinctByUrl(union);
            ranked.sort(ConstraintFilter.BY_SCORE_DESC);
        } else {
            ranked = distinctByUrl(sorted);
        }

        if (ranked.size() <= policy.maxResults()) {
            return ranked;
        }
        return new ArrayList<>(ranked.subList(0, policy.maxResults()));
    }

    private static List<ScoredCandidate> topOfType(List<ScoredCandidate> sorted, TestType type, int limit) {
        List<ScoredCandidate> out = new ArrayList<>();
        for (ScoredCandidate candidate : sorted) {
            if (out.size() >= limit) {
                break;
            }
            if (candidate.getRecord().getTestType() == type) {
                out.add(candidate);
            }
        }
        return out;
    }

    private static List<ScoredCandidate> distinctByUrl(List<ScoredCandidate> candidates) {
        Set<String> seen = new HashSet<>();
        List<ScoredCandidate> out = new ArrayList<>(candidates.size());
        for (ScoredCandidate candidate : candidates) {
            if (seen.add(candidate.getRecord().getUrl())) {
                out.add(candidate);
            }
        }
        return out;
    }
}
