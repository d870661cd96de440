package com.assessrec.recommendation.config;

import com.assessrec.recommendation.corpus.CorpusConfigurationException;
import com.assessrec.recommendation.corpus.CorpusLoader;
import com.assessrec.recommendation.corpus.EmbeddingIndexStore;
import com.assessrec.recommendation.corpus.RecommendationContext;
import com.assessrec.recommendation.corpus.RecommendationContextFactory;
import com.assessrec.recommendation.embedding.EmbeddingClient;
import com.assessrec.recommendation.embedding.HashingEmbeddingClient;
import com.assessrec.recommendation.embedding.OllamaEmbeddingClient;
import com.assessrec.recommendation.service.RankingPolicy;
import com.assessrec.recommendation.service.RecommendationEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.FileSystemResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class RecommendationConfig {

    private static final Logger log = LoggerFactory.getLogger(RecommendationConfig.class);
    private static final int DEFAULT_HASHING_DIMENSION = 384;

    @Bean
    public RankingPolicy rankingPolicy(
            @Value("${recommendation.ranking.min-results:5}") int minResults,
            @Value("${recommendation.ranking.max-results:10}") int maxResults,
            @Value("${recommendation.ranking.relaxation-minutes:10}") int relaxationMinutes,
            @Value("${recommendation.ranking.entry-level-boost:0.1}") double entryLevelBoost,
            @Value("${recommendation.ranking.knowledge-quota:5}") int knowledgeQuota,
            @Value("${recommendation.ranking.personality-quota:5}") int personalityQuota,
            @Value("${recommendation.ranking.ability-quota:3}") int abilityQuota
    ) {
        return new RankingPolicy(minResults, maxResults, relaxationMinutes, entryLevelBoost,
                knowledgeQuota, personalityQuota, abilityQuota);
    }

    @Bean
    public RecommendationEngine recommendationEngine(RankingPolicy rankingPolicy) {
        return new RecommendationEngine(rankingPolicy);
    }

    @Bean
    public EmbeddingClient embeddingClient(
            @Value("${recommendation.embedding.provider:ollama}") String provider,
            @Value("${recommendation.embedding.base-url:http://localhost:11434}") String baseUrl,
            @Value("${recommendation.embedding.model:all-minilm}") String model,
            @Value("${recommendation.embedding.dimension:0}") int dimension,
            @Value("${recommendation.embedding.batch-size:32}") int batchSize,
            @Value("${recommendation.embedding.connect-timeout-ms:2000}") long connectTimeoutMs,
            @Value("${recommendation.embedding.read-timeout-ms:60000}") long readTimeoutMs,
            RestTemplateBuilder restTemplateBuilder,
            ObjectMapper objectMapper
    ) {
        String resolved = provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);
        switch (resolved) {
            case "hashing":
                int hashingDimension = dimension > 0 ? dimension : DEFAULT_HASHING_DIMENSION;
                log.info("embedding provider=hashing dimension={}", hashingDimension);
                return new HashingEmbeddingClient(hashingDimension);
            case "ollama":
                RestTemplate restTemplate = restTemplateBuilder
                        .setConnectTimeout(Duration.ofMillis(Math.max(1L, connectTimeoutMs)))
                        .setReadTimeout(Duration.ofMillis(Math.max(1L, readTimeoutMs)))
                        .build();
                log.info("embedding provider=ollama base_url={} model={}", baseUrl, model);
                return new OllamaEmbeddingClient(restTemplate, objectMapper, baseUrl, model, batchSize);
            default:
                throw new CorpusConfigurationException("unknown embedding provider '" + provider + "'");
        }
    }

    @Bean
    public RecommendationContext recommendationContext(
            EmbeddingClient embeddingClient,
            @Value("${recommendation.corpus.path:classpath:data/assessments.csv}") String corpusPath,
            @Value("${recommendation.index.path:./models/assessment_embeddings.bin}") String indexPath,
            @Value("${recommendation.embedding.dimension:0}") int dimension
    ) {
        Resource corpus = new FileSystemResourceLoader().getResource(corpusPath);
        Path index = (indexPath == null || indexPath.isBlank()) ? null : Path.of(indexPath);
        RecommendationContextFactory factory = new RecommendationContextFactory(
                new CorpusLoader(),
                new EmbeddingIndexStore(),
                embeddingClient
        );
        return factory.create(corpus, index, dimension);
    }

    @Bean(name = "embeddingExecutor", destroyMethod = "shutdownNow")
    public ExecutorService embeddingExecutor(
            @Value("${recommendation.embedding.worker-threads:4}") int workerThreads
    ) {
        return Executors.newFixedThreadPool(Math.max(1, workerThreads), new CustomizableThreadFactory("query-embedding-"));
    }
}
