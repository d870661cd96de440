package com.assessrec.recommendation;

import com.assessrec.recommendation.corpus.RecommendationContext;
import com.assessrec.recommendation.model.QueryRequirements;
import com.assessrec.recommendation.model.ScoredCandidate;
import com.assessrec.recommendation.model.TestType;
import com.assessrec.recommendation.service.ConstraintFilter;
import com.assessrec.recommendation.service.RankingPolicy;
import com.assessrec.recommendation.service.SimilarityScorer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ConstraintFilterTest {

    private final ConstraintFilter filter = new ConstraintFilter(RankingPolicy.DEFAULT);
    private final SimilarityScorer scorer = new SimilarityScorer();

    @Test
    void keepsStrictSubsetWhenEnoughItemsFit() {
        RecommendationContext context = new TestCorpus()
                .add("A1", TestType.K, 20, 0.9)
                .add("A2", TestType.K, 25, 0.8)
                .add("A3", TestType.K, 30, 0.7)
                .add("A4", TestType.K, 35, 0.6)
                .add("A5", TestType.K, 40, 0.5)
                .add("A6", TestType.K, 45, 0.95)
                .build();

        List<ScoredCandidate> out = apply(context, new QueryRequirements(40, true, false, false, false));

        assertThat(out).hasSize(5);
        assertThat(out).allSatisfy(c -> assertThat(c.getRecord().getDurationMins()).isLessThanOrEqualTo(40));
    }

    @Test
    void relaxesOnceByTenMinutesWhenTooFewFit() {
        RecommendationContext context = new TestCorpus()
                .add("Short", TestType.K, 30, 0.9)
                .add("Medium", TestType.K, 45, 0.8)
                .add("Borderline", TestType.K, 50, 0.7)
                .add("Long", TestType.K, 51, 0.99)
                .build();

        List<ScoredCandidate> out = apply(context, new QueryRequirements(40, false, false, false, false));

        assertThat(out).extracting(c -> c.getRecord().getName())
                .containsExactly("Short", "Medium", "Borderline");
    }

    @Test
    void noFurtherRelaxationWhenStillEmpty() {
        RecommendationContext context = new TestCorpus()
                .add("Marathon", TestType.K, 120, 0.9)
                .build();

        assertThat(apply(context, new QueryRequirements(30, false, false, false, false))).isEmpty();
    }

    @Test
    void boostsEntryLevelNamesForEntryLevelQueries() {
        RecommendationContext context = new TestCorpus()
                .add("Sales Representative Solution", TestType.B, 30, 0.55)
                .add("Graduate Sales Scenarios", TestType.B, 30, 0.50)
                .add("Junior Support Desk", TestType.B, 30, 0.30)
                .build();

        List<ScoredCandidate> out = apply(context, new QueryRequirements(null, false, false, false, true));

        assertThat(out.get(0).getRecord().getName()).isEqualTo("Graduate Sales Scenarios");
        assertThat(out.get(0).getBoost()).isCloseTo(0.1, within(1e-9));
        assertThat(out.get(0).score()).isCloseTo(0.60, within(1e-6));
        assertThat(out.get(1).getBoost()).isZero();
        assertThat(out.get(2).getBoost()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void noBoostWithoutEntryLevelIntent() {
        RecommendationContext context = new TestCorpus()
                .add("Sales Representative Solution", TestType.B, 30, 0.55)
                .add("Graduate Sales Scenarios", TestType.B, 30, 0.50)
                .build();

        List<ScoredCandidate> out = apply(context, QueryRequirements.none());

        assertThat(out.get(0).getRecord().getName()).isEqualTo("Sales Representative Solution");
        assertThat(out).allSatisfy(c -> assertThat(c.getBoost()).isZero());
    }

    @Test
    void tiesKeepCorpusOrder() {
        RecommendationContext context = new TestCorpus()
                .add("First", TestType.K, 30, 0.5)
                .add("Second", TestType.P, 30, 0.5)
                .add("Top", TestType.A, 30, 0.7)
                .add("Third", TestType.B, 30, 0.5)
                .build();

        List<ScoredCandidate> out = apply(context, QueryRequirements.none());

        assertThat(out).extracting(c -> c.getRecord().getName())
                .containsExactly("Top", "First", "Second", "Third");
    }

    private List<ScoredCandidate> apply(RecommendationContext context, QueryRequirements requirements) {
        return filter.apply(context, scorer.score(TestCorpus.QUERY, context), requirements);
    }
}
