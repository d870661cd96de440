package com.assessrec.recommendation.service;

import com.assessrec.recommendation.corpus.RecommendationContext;
import com.assessrec.recommendation.embedding.EmbeddingClient;
import com.assessrec.recommendation.embedding.EmbeddingComputationException;
import com.assessrec.recommendation.model.RecommendResponse;
import com.assessrec.recommendation.model.RecommendationResult;
import com.assessrec.recommendation.model.RecommendedAssessment;
import com.assessrec.recommendation.model.ScoredCandidate;
import com.assessrec.recommendation.model.ServiceHealth;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    public static final String SERVICE_NAME = "Assessment Recommender";
    private static final long DEFAULT_EMBEDDING_TIMEOUT_MS = 5_000L;
    private static final long MIN_EMBEDDING_TIMEOUT_MS = 50L;

    private final RecommendationEngine engine;
    private final RecommendationContext context;
    private final EmbeddingClient embeddingClient;
    private final ExecutorService embeddingExecutor;
    private final RecommendationCacheService cacheService;
    private final MeterRegistry meterRegistry;
    private final long embeddingTimeoutMs;

    public RecommendationService(
            RecommendationEngine engine,
            RecommendationContext context,
            EmbeddingClient embeddingClient
    ) {
        this(engine, context, embeddingClient, ForkJoinPool.commonPool(), null, null, DEFAULT_EMBEDDING_TIMEOUT_MS);
    }

    @Autowired
    public RecommendationService(
            RecommendationEngine engine,
            RecommendationContext context,
            EmbeddingClient embeddingClient,
            @Qualifier("embeddingExecutor") ExecutorService embeddingExecutor,
            RecommendationCacheService cacheService,
            @Nullable MeterRegistry meterRegistry,
            @Value("${recommendation.embedding.request-timeout-ms:5000}") long embeddingTimeoutMs
    ) {
        this.engine = engine;
        this.context = context;
        this.embeddingClient = embeddingClient;
        this.embeddingExecutor = embeddingExecutor;
        this.cacheService = cacheService;
        this.meterRegistry = meterRegistry;
        this.embeddingTimeoutMs = Math.max(MIN_EMBEDDING_TIMEOUT_MS, embeddingTimeoutMs);
        if (meterRegistry != null && cacheService != null) {
            meterRegistry.gauge("recommendation_cache_entries", cacheService, RecommendationCacheService::size);
        }
    }

    public RecommendResponse recommend(String query) {
        return recommend(query, UUID.randomUUID().toString());
    }

    /**
     * @throws InvalidQueryException          if the query is null, empty or whitespace only
     * @throws EmbeddingComputationException if the query cannot be embedded in time
     */
    public RecommendResponse recommend(String query, String traceId) {
        String effectiveTraceId = (traceId == null || traceId.isBlank()) ? UUID.randomUUID().toString() : traceId;
        if (query == null || query.isBlank()) {
            incrementCounter("recommendation_query_count_total", "invalid");
            log.info("trace_id={} event=recommend_rejected reason=empty_query", effectiveTraceId);
            throw new InvalidQueryException("Query cannot be empty");
        }

        long totalStart = System.nanoTime();
        log.info("trace_id={} event=recommend_start query=\"{}\"", effectiveTraceId, sanitizeForLog(query));

        RecommendationResult cached = cacheService == null ? null : cacheService.get(query);
        if (cached != null) {
            incrementCounter("recommendation_cache_hit_total");
            incrementCounter("recommendation_query_count_total", "cache_hit");
            log.info("trace_id={} event=recommend_cache_hit results={} total_ms={}",
                    effectiveTraceId, cached.size(), elapsedMillis(totalStart));
            return toResponse(cached);
        }
        incrementCounter("recommendation_cache_miss_total");

        float[] queryVector;
        try {
            queryVector = embedQuery(query, effectiveTraceId);
        } catch (EmbeddingComputationException ex) {
            incrementCounter("recommendation_query_count_total", "error");
            log.warn("trace_id={} event=recommend_failed stage=embedding cause={}", effectiveTraceId, ex.getMessage());
            throw ex;
        }

        long rankStart = System.nanoTime();
        RecommendationResult result = engine.recommend(context, query, queryVector);
        recordTimer("recommendation_rank_latency_ms", rankStart);
        log.info("trace_id={} stage=rank duration_ms={} requirements=[{}] results={}",
                effectiveTraceId, elapsedMillis(rankStart), result.getRequirements(), result.size());

        if (cacheService != null) {
            cacheService.put(query, result);
        }
        incrementCounter("recommendation_query_count_total", "success");
        log.info("trace_id={} event=recommend_complete total_ms={} results={}",
                effectiveTraceId, elapsedMillis(totalStart), result.size());
        return toResponse(result);
    }

    public ServiceHealth health() {
        return new ServiceHealth("healthy", SERVICE_NAME, context.size(), context.modelName(), context.dimension());
    }

    private float[] embedQuery(String query, String traceId) {
        long start = System.nanoTime();
        Future<float[]> future = embeddingExecutor.submit(() -> embeddingClient.embed(query));
        float[] vector;
        try {
            vector = future.get(embeddingTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new EmbeddingComputationException("query embedding timed out after " + embeddingTimeoutMs + " ms", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof EmbeddingComputationException computationException) {
                throw computationException;
            }
            throw new EmbeddingComputationException("query embedding failed: " + cause.getMessage(), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new EmbeddingComputationException("query embedding interrupted", ex);
        } finally {
            recordTimer("recommendation_embedding_latency_ms", start);
        }

        if (vector == null || vector.length != context.dimension()) {
            int actual = vector == null ? 0 : vector.length;
            throw new EmbeddingComputationException("query embedding has dimension " + actual
                    + ", corpus index uses " + context.dimension());
        }
        log.debug("trace_id={} stage=embedding duration_ms={}", traceId, elapsedMillis(start));
        return vector;
    }

    private static RecommendResponse toResponse(RecommendationResult result) {
        List<RecommendedAssessment> assessments = new ArrayList<>(result.size());
        for (ScoredCandidate candidate : result.getItems()) {
            assessments.add(RecommendedAssessment.from(candidate.getRecord()));
        }
        return new RecommendResponse(assessments);
    }

    private void recordTimer(String metricName, long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer(metricName).record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void incrementCounter(String metricName) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName).increment();
    }

    private void incrementCounter(String metricName, String status) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName, "status", status).increment();
    }

    private static String sanitizeForLog(String query) {
        if (query == null) {
            return "";
        }
        String trimmed = query.trim().replaceAll("\\s+", " ");
        return trimmed.length() > 120 ? trimmed.substring(0, 120) + "..." : trimmed;
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
