package com.assessrec.recommendation.config;

import com.assessrec.recommendation.service.RecommendationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Sends a probe query once the context is up so the first real request does not pay for
 * model loading on the embedding provider.
 */
@Component
public class RecommendationWarmupRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(RecommendationWarmupRunner.class);

    private final RecommendationService recommendationService;
    private final boolean warmupEnabled;
    private final String warmupQuery;
    private final int warmupAttempts;
    private final long warmupDelayMs;

    public RecommendationWarmupRunner(
            RecommendationService recommendationService,
            @Value("${recommendation.warmup.enabled:false}") boolean warmupEnabled,
            @Value("${recommendation.warmup.query:Java developer with communication skills}") String warmupQuery,
            @Value("${recommendation.warmup.attempts:2}") int warmupAttempts,
            @Value("${recommendation.warmup.delay-ms:2000}") long warmupDelayMs
    ) {
        this.recommendationService = recommendationService;
        this.warmupEnabled = warmupEnabled;
        this.warmupQuery = warmupQuery;
        this.warmupAttempts = Math.max(1, warmupAttempts);
        this.warmupDelayMs = Math.max(0L, warmupDelayMs);
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!warmupEnabled) {
            return;
        }

        for (int attempt = 1; attempt <= warmupAttempts; attempt++) {
            try {
                int results = recommendationService.recommend(warmupQuery, "startup-warmup-" + attempt)
                        .getRecommendedAssessments()
                        .size();
                log.info("recommendation warmup completed attempt={} results={}", attempt, results);
                return;
            } catch (RuntimeException ex) {
                log.warn("recommendation warmup attempt={} failed: {}", attempt, ex.getMessage());
            }
            if (attempt < warmupAttempts && warmupDelayMs > 0) {
                try {
                    Thread.sleep(warmupDelayMs);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }
}
