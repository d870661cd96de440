package com.assessrec.recommendation;

import com.assessrec.recommendation.model.AssessmentRecord;
import com.assessrec.recommendation.model.ScoredCandidate;
import com.assessrec.recommendation.model.TestType;
import com.assessrec.recommendation.service.BalanceRankEngine;
import com.assessrec.recommendation.service.RankingPolicy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BalanceRankEngineTest {

    private final BalanceRankEngine engine = new BalanceRankEngine(RankingPolicy.DEFAULT);

    @Test
    void balancedQueryTakesKnowledgeAndPersonalityQuotas() {
        List<ScoredCandidate> sorted = new ArrayList<>();
        int position = 0;
        for (int i = 0; i < 7; i++) {
            sorted.add(candidate("k" + i, TestType.K, position++, 0.9 - i * 0.01));
        }
        for (int i = 0; i < 7; i++) {
            sorted.add(candidate("p" + i, TestType.P, position++, 0.5 - i * 0.01));
        }

        List<ScoredCandidate> out = engine.rank(sorted, true, false);

        assertThat(out).hasSize(10);
        assertThat(out).filteredOn(c -> c.getRecord().getTestType() == TestType.K).hasSize(5);
        assertThat(out).filteredOn(c -> c.getRecord().getTestType() == TestType.P).hasSize(5);
        assertThat(out).isSortedAccordingTo((a, b) -> Double.compare(b.score(), a.score()));
    }

    @Test
    void cognitiveBalancedQueryAddsAbilityQuotaThenClamps() {
        List<ScoredCandidate> sorted = new ArrayList<>();
        int position = 0;
        for (int i = 0; i < 5; i++) {
            sorted.add(candidate("a" + i, TestType.A, position++, 0.95 - i * 0.01));
        }
        for (int i = 0; i < 6; i++) {
            sorted.add(candidate("k" + i, TestType.K, position++, 0.8 - i * 0.01));
        }
        for (int i = 0; i < 6; i++) {
            sorted.add(candidate("p" + i, TestType.P, position++, 0.6 - i * 0.01));
        }

        List<ScoredCandidate> out = engine.rank(sorted, true, true);

        assertThat(out).hasSize(10);
        assertThat(out).filteredOn(c -> c.getRecord().getTestType() == TestType.A).hasSize(3);
        assertThat(out).filteredOn(c -> c.getRecord().getTestType() == TestType.K).hasSize(5);
        assertThat(out).filteredOn(c -> c.getRecord().getTestType() == TestType.P).hasSize(2);
        assertThat(out.get(0).getRecord().getName()).isEqualTo("a0");
    }

    @Test
    void balancingWithoutCognitiveIgnoresAbilityItems() {
        List<ScoredCandidate> sorted = List.of(
                candidate("a0", TestType.A, 0, 0.99),
                candidate("k0", TestType.K, 1, 0.8),
                candidate("p0", TestType.P, 2, 0.7),
                candidate("b0", TestType.B, 3, 0.6)
        );

        List<ScoredCandidate> out = engine.rank(sorted, true, false);

        assertThat(out).extracting(c -> c.getRecord().getName()).containsExactly("k0", "p0");
    }

    @Test
    void unbalancedQueryKeepsGlobalOrderAndClampsToTen() {
        List<ScoredCandidate> sorted = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            sorted.add(candidate("item" + i, i % 2 == 0 ? TestType.K : TestType.B, i, 0.9 - i * 0.01));
        }

        List<ScoredCandidate> out = engine.rank(sorted, false, false);

        assertThat(out).hasSize(10);
        assertThat(out).containsExactlyElementsOf(sorted.subList(0, 10));
    }

    @Test
    void fewerThanFiveAreReturnedAsIs() {
        List<ScoredCandidate> sorted = List.of(
                candidate("x", TestType.K, 0, 0.9),
                candidate("y", TestType.K, 1, 0.8),
                candidate("z", TestType.P, 2, 0.7)
        );

        assertThat(engine.rank(sorted, false, false)).hasSize(3);
    }

    @Test
    void repeatedUrlsAreDroppedKeepingFirst() {
        ScoredCandidate first = candidate("dup", TestType.K, 0, 0.9);
        ScoredCandidate again = new ScoredCandidate(first.getRecord(), 1, 0.4);
        List<ScoredCandidate> sorted = List.of(first, candidate("other", TestType.K, 2, 0.8), again);

        List<ScoredCandidate> out = engine.rank(sorted, false, false);

        assertThat(out).hasSize(2);
        assertThat(out.get(0)).isSameAs(first);
    }

    @Test
    void quotasAreConfigurable() {
        BalanceRankEngine narrow = new BalanceRankEngine(new RankingPolicy(1, 10, 10, 0.1, 2, 1, 0));
        List<ScoredCandidate> sorted = List.of(
                candidate("k0", TestType.K, 0, 0.9),
                candidate("k1", TestType.K, 1, 0.8),
                candidate("k2", TestType.K, 2, 0.7),
                candidate("p0", TestType.P, 3, 0.6),
                candidate("p1", TestType.P, 4, 0.5),
                candidate("a0", TestType.A, 5, 0.4)
        );

        List<ScoredCandidate> out = narrow.rank(sorted, true, true);

        assertThat(out).extracting(c -> c.getRecord().getName()).containsExactly("k0", "k1", "p0");
    }

    private static ScoredCandidate candidate(String name, TestType type, int position, double similarity) {
        AssessmentRecord record = new AssessmentRecord(
                String.valueOf(position), name, "https://catalog.example.test/view/" + name + "/",
                type, 30, List.of(), "", false, false);
        return new ScoredCandidate(record, position, similarity);
    }
}
