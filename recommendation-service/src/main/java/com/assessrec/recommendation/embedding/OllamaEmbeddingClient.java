package com.assessrec.recommendation.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class OllamaEmbeddingClient implements EmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingClient.class);
    private static final int DEFAULT_BATCH_SIZE = 32;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String model;
    private final int batchSize;

    public OllamaEmbeddingClient(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl, String model) {
        this(restTemplate, objectMapper, baseUrl, model, DEFAULT_BATCH_SIZE);
    }

    public OllamaEmbeddingClient(
            RestTemplate restTemplate,
            ObjectMapper objectMapper,
            String baseUrl,
            String model,
            int batchSize
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.model = model;
        this.batchSize = Math.max(1, batchSize);
    }

    @Override
    public float[] embed(String text) {
        List<float[]> vectors = request(List.of(text == null ? "" : text));
        if (vectors.size() != 1) {
            throw new EmbeddingComputationException("expected 1 embedding, got " + vectors.size());
        }
        return vectors.get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        List<float[]> out = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += batchSize) {
            List<String> slice = texts.subList(start, Math.min(texts.size(), start + batchSize));
            List<float[]> vectors = request(slice);
            if (vectors.size() != slice.size()) {
                throw new EmbeddingComputationException(
                        "expected " + slice.size() + " embeddings, got " + vectors.size());
            }
            out.addAll(vectors);
            log.debug("embedded batch start={} size={} model={}", start, slice.size(), model);
        }
        return out;
    }

    @Override
    public String modelName() {
        return model;
    }

    private List<float[]> request(List<String> inputs) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", model);
        payload.put("input", inputs);

        String response;
        try {
            response = restTemplate.postForObject(baseUrl + "/api/embed", payload, String.class);
        } catch (RestClientException ex) {
            throw new EmbeddingComputationException("embedding request failed: " + ex.getMessage(), ex);
        }
        if (response == null || response.isBlank()) {
            throw new EmbeddingComputationException("embedding provider returned an empty body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (IOException ex) {
            throw new EmbeddingComputationException("embedding response is not valid JSON", ex);
        }

        List<float[]> vectors = new ArrayList<>();
        JsonNode embeddings = root.path("embeddings");
        if (embeddings.isArray() && !embeddings.isEmpty()) {
            for (JsonNode node : embeddings) {
                vectors.add(toVector(node));
            }
            return vectors;
        }
        // Legacy /api/embeddings shape: { "embedding": [...] }
        JsonNode single = root.path("embedding");
        if (single.isArray() && !single.isEmpty()) {
            vectors.add(toVector(single));
            return vectors;
        }
        throw new EmbeddingComputationException("embedding response has no vectors");
    }

    private static float[] toVector(JsonNode node) {
        if (!node.isArray() || node.isEmpty()) {
            throw new EmbeddingComputationException("embedding vector is empty");
        }
        float[] vector = new float[node.size()];
        for (int i = 0; i < node.size(); i++) {
            JsonNode value = node.get(i);
            if (!value.isNumber()) {
                throw new EmbeddingComputationException("embedding vector holds a non-numeric value");
            }
            vector[i] = (float) value.asDouble();
        }
        return Vectors.normalize(vector);
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
