package com.assessrec.recommendation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

public class RecommendResponse {
    private List<RecommendedAssessment> recommendedAssessments = new ArrayList<>();

    public RecommendResponse() {
    }

    public RecommendResponse(List<RecommendedAssessment> recommendedAssessments) {
        this.recommendedAssessments = recommendedAssessments;
    }

    @JsonProperty("recommended_assessments")
    public List<RecommendedAssessment> getRecommendedAssessments() {
        return recommendedAssessments;
    }

    @JsonProperty("recommended_assessments")
    public void setRecommendedAssessments(List<RecommendedAssessment> recommendedAssessments) {
        this.recommendedAssessments = recommendedAssessments;
    }
}
