package com.assessrec.recommendation.controller;

import com.assessrec.recommendation.model.RecommendRequest;
import com.assessrec.recommendation.model.RecommendResponse;
import com.assessrec.recommendation.model.ServiceHealth;
import com.assessrec.recommendation.service.RecommendationService;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@CrossOrigin(origins = "*")
public class RecommendationController {

    static final String VERSION = "1.0.0";

    private final RecommendationService recommendationService;

    public RecommendationController(RecommendationService recommendationService) {
        this.recommendationService = recommendationService;
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "/health");
        endpoints.put("recommend", "/recommend (POST)");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", RecommendationService.SERVICE_NAME + " API");
        body.put("status", "active");
        body.put("version", VERSION);
        body.put("endpoints", endpoints);
        return body;
    }

    @GetMapping("/health")
    public ServiceHealth health() {
        return recommendationService.health();
    }

    @PostMapping("/recommend")
    public RecommendResponse recommend(
            @RequestBody(required = false) RecommendRequest request,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId
    ) {
        String query = request == null ? null : request.getQuery();
        return recommendationService.recommend(query, traceId);
    }
}
