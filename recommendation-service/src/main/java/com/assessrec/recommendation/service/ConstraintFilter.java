package com.assessrec.recommendation.service;

import com.assessrec.recommendation.corpus.RecommendationContext;
import com.assessrec.recommendation.model.QueryRequirements;
import com.assessrec.recommendation.model.ScoredCandidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class ConstraintFilter {

    static final Comparator<ScoredCandidate> BY_SCORE_DESC =
            Comparator.comparingDouble(ScoredCandidate::score).reversed()
                    .thenComparingInt(ScoredCandidate::getPosition);

    private static final Pattern ENTRY_LEVEL_NAME = Pattern.compile("entry|graduate|junior");

    private final RankingPolicy policy;

    public ConstraintFilter(RankingPolicy policy) {
        this.policy = policy;
    }

    /**
     * Applies the duration cap (with a single relaxation step), the entry-level boost, and sorts
     * by boosted score descending with corpus order as tie-break.
     */
    public List<ScoredCandidate> apply(RecommendationContext context, double[] similarities, QueryRequirements requirements) {
        List<ScoredCandidate> candidates = new ArrayList<>(context.size());
        for (int i = 0; i < context.size(); i++) {
            candidates.add(new ScoredCandidate(context.record(i), i, similarities[i]));
        }

        if (requirements.hasDurationCap()) {
            int cap = requirements.getMaxDuration();
            List<ScoredCandidate> strict = withinDuration(candidates, cap);
            if (strict.size() >= policy.minResults()) {
                candidates = strict;
            } else {
                candidates = withinDuration(candidates, (long) cap + policy.relaxationMinutes());
            }
        }

        if (requirements.isEntryLevel()) {
            List<ScoredCandidate> boosted = new ArrayList<>(candidates.size());
            for (ScoredCandidate candidate : candidates) {
                boosted.add(isEntryLevelName(candidate.getRecord().getName())
                        ? candidate.withBoost(policy.entryLevelBoost())
                        : candidate);
            }
            candidates = boosted;
        }

        candidates.sort(BY_SCORE_DESC);
        return candidates;
    }

    static boolean isEntryLevelName(String name) {
        return name != null && ENTRY_LEVEL_NAME.matcher(name.toLowerCase(Locale.ROOT)).find();
    }

    private static List<ScoredCandidate> withinDuration(List<ScoredCandidate> candidates, long maxMinutes) {
        List<ScoredCandidate> kept = new ArrayList<>();
        for (ScoredCandidate candidate : candidates) {
            if (candidate.getRecord().getDurationMins() <= maxMinutes) {
                kept.add(candidate);
            }
        }
        return kept;
    }
}
