package com.assessrec.recommendation;

import com.assessrec.recommendation.config.RecommendationWarmupRunner;
import com.assessrec.recommendation.embedding.EmbeddingComputationException;
import com.assessrec.recommendation.model.RecommendResponse;
import com.assessrec.recommendation.service.RecommendationService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RecommendationWarmupRunnerTest {

    private final RecommendationService service = mock(RecommendationService.class);

    @Test
    void skipsWhenDisabled() {
        new RecommendationWarmupRunner(service, false, "Java developer", 2, 0).run(new DefaultApplicationArguments());

        verifyNoInteractions(service);
    }

    @Test
    void stopsAfterFirstSuccess() {
        when(service.recommend(eq("Java developer"), anyString())).thenReturn(new RecommendResponse(List.of()));

        new RecommendationWarmupRunner(service, true, "Java developer", 3, 0).run(new DefaultApplicationArguments());

        verify(service, times(1)).recommend("Java developer", "startup-warmup-1");
    }

    @Test
    void retriesFailedAttemptsWithoutFailingStartup() {
        when(service.recommend(eq("Java developer"), anyString()))
                .thenThrow(new EmbeddingComputationException("model server unavailable"));

        new RecommendationWarmupRunner(service, true, "Java developer", 2, 0).run(new DefaultApplicationArguments());

        verify(service).recommend("Java developer", "startup-warmup-1");
        verify(service).recommend("Java developer", "startup-warmup-2");
    }
}
