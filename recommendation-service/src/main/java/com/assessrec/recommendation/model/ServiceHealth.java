package com.assessrec.recommendation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ServiceHealth {
    private final String status;
    private final String service;
    private final int assessmentsLoaded;
    private final String model;
    private final int embeddingDimension;

    public ServiceHealth(String status, String service, int assessmentsLoaded, String model, int embeddingDimension) {
        this.status = status;
        this.service = service;
        this.assessmentsLoaded = assessmentsLoaded;
        this.model = model;
        this.embeddingDimension = embeddingDimension;
    }

    public String getStatus() { return status; }
    public String getService() { return service; }

    @JsonProperty("assessments_loaded")
    public int getAssessmentsLoaded() { return assessmentsLoaded; }

    public String getModel() { return model; }

    @JsonProperty("embedding_dimension")
    public int getEmbeddingDimension() { return embeddingDimension; }
}
