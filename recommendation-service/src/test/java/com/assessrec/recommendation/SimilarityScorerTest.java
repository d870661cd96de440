package com.assessrec.recommendation;

import com.assessrec.recommendation.corpus.RecommendationContext;
import com.assessrec.recommendation.model.TestType;
import com.assessrec.recommendation.service.SimilarityScorer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SimilarityScorerTest {

    private final SimilarityScorer scorer = new SimilarityScorer();

    @Test
    void scoresEveryRecordInCorpusOrder() {
        RecommendationContext context = new TestCorpus()
                .add("Alpha", TestType.K, 30, 0.9)
                .add("Beta", TestType.P, 30, -0.4)
                .add("Gamma", TestType.A, 30, 0.0)
                .build();

        double[] scores = scorer.score(TestCorpus.QUERY, context);

        assertThat(scores).hasSize(3);
        assertThat(scores[0]).isCloseTo(0.9, within(1e-6));
        assertThat(scores[1]).isCloseTo(-0.4, within(1e-6));
        assertThat(scores[2]).isCloseTo(0.0, within(1e-6));
    }

    @Test
    void storedVectorsAreNormalizedBeforeScoring() {
        RecommendationContext context = new TestCorpus()
                .addVector("Scaled", TestType.K, new float[]{3f, 4f})
                .addVector("Opposite", TestType.P, new float[]{-0.5f, 0f})
                .build();

        double[] scores = scorer.score(TestCorpus.QUERY, context);

        assertThat(scores[0]).isCloseTo(0.6, within(1e-6));
        assertThat(scores[1]).isCloseTo(-1.0, within(1e-6));
    }

    @Test
    void rejectsQueryVectorOfWrongDimension() {
        RecommendationContext context = new TestCorpus().add("Alpha", TestType.K, 30, 0.9).build();

        assertThatThrownBy(() -> scorer.score(new float[]{1f, 0f, 0f}, context))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dimension");
    }
}
