package com.assessrec.recommendation.corpus;

import com.assessrec.recommendation.embedding.EmbeddingClient;
import com.assessrec.recommendation.model.AssessmentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Loads the corpus and pairs it with embeddings, reusing the persisted index when it still
 * matches the corpus and the provider.
 */
public class RecommendationContextFactory {

    private static final Logger log = LoggerFactory.getLogger(RecommendationContextFactory.class);
    static final String DIMENSION_PROBE = "assessment dimension probe";

    private final CorpusLoader corpusLoader;
    private final EmbeddingIndexStore indexStore;
    private final EmbeddingClient embeddingClient;

    public RecommendationContextFactory(
            CorpusLoader corpusLoader,
            EmbeddingIndexStore indexStore,
            EmbeddingClient embeddingClient
    ) {
        this.corpusLoader = corpusLoader;
        this.indexStore = indexStore;
        this.embeddingClient = embeddingClient;
    }

    /**
     * @param expectedDimension configured embedding size, or 0 to accept whatever the provider returns
     * @throws CorpusConfigurationException if the corpus is unusable, the provider cannot be reached,
     *                                      or dimensions disagree
     */
    public RecommendationContext create(Resource corpus, Path indexPath, int expectedDimension) {
        long start = System.nanoTime();
        List<AssessmentRecord> records = corpusLoader.load(corpus);
        String model = embeddingClient.modelName();
        int providerDimension = probeDimension();

        if (expectedDimension > 0 && expectedDimension != providerDimension) {
            throw new CorpusConfigurationException("configured embedding dimension " + expectedDimension
                    + " does not match provider dimension " + providerDimension + " (model " + model + ")");
        }

        String fingerprint = fingerprint(records);
        List<float[]> vectors = null;
        Optional<EmbeddingIndexStore.StoredIndex> stored = indexStore.load(indexPath);
        if (stored.isPresent()) {
            EmbeddingIndexStore.StoredIndex index = stored.get();
            if (index.dimension() != providerDimension) {
                throw new CorpusConfigurationException("cached embedding index " + indexPath + " has dimension "
                        + index.dimension() + " but provider " + model + " produces " + providerDimension);
            }
            if (index.rows() != records.size() || !model.equals(index.model())
                    || !fingerprint.equals(index.fingerprint())) {
                log.warn("embedding index is stale rows={} corpus={} index_model={} model={} fingerprint_match={}, rebuilding",
                        index.rows(), records.size(), index.model(), model, fingerprint.equals(index.fingerprint()));
            } else {
                vectors = index.vectors();
            }
        }

        if (vectors == null) {
            vectors = buildVectors(records, providerDimension);
            persist(indexPath, model, fingerprint, vectors);
        }

        RecommendationContext context = new RecommendationContext(records, vectors, model);
        log.info("recommendation context ready records={} dimension={} model={} duration_ms={}",
                context.size(), context.dimension(), model, (System.nanoTime() - start) / 1_000_000L);
        return context;
    }

    /**
     * SHA-256 over the ordered url and search text of every record. Changes with any edit, reorder
     * or rename in the catalog.
     */
    static String fingerprint(List<AssessmentRecord> records) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
        for (AssessmentRecord record : records) {
            digest.update(record.getUrl().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(record.searchText().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '\n');
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private int probeDimension() {
        try {
            return embeddingClient.embed(DIMENSION_PROBE).length;
        } catch (RuntimeException ex) {
            throw new CorpusConfigurationException(
                    "embedding provider " + embeddingClient.modelName() + " is unavailable: " + ex.getMessage(), ex);
        }
    }

    private List<float[]> buildVectors(List<AssessmentRecord> records, int providerDimension) {
        log.info("building embedding index records={} model={}", records.size(), embeddingClient.modelName());
        List<String> texts = records.stream().map(AssessmentRecord::searchText).toList();
        List<float[]> vectors;
        try {
            vectors = embeddingClient.embedBatch(texts);
        } catch (RuntimeException ex) {
            throw new CorpusConfigurationException("failed to embed corpus: " + ex.getMessage(), ex);
        }
        for (float[] vector : vectors) {
            if (vector.length != providerDimension) {
                throw new CorpusConfigurationException("provider returned a corpus vector of dimension "
                        + vector.length + ", expected " + providerDimension);
            }
        }
        return vectors;
    }

    private void persist(Path indexPath, String model, String fingerprint, List<float[]> vectors) {
        if (indexPath == null) {
            return;
        }
        try {
            indexStore.save(indexPath, model, fingerprint, vectors);
        } catch (IOException ex) {
            log.warn("could not persist embedding index to {}, continuing in memory: {}", indexPath, ex.toString());
        }
    }
}
