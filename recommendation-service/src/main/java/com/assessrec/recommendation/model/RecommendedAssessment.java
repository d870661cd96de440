package com.assessrec.recommendation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class RecommendedAssessment {
    private String url;
    private String name;
    private String adaptiveSupport;
    private String description;
    private int duration;
    private String remoteSupport;
    private List<String> testType;

    public RecommendedAssessment() {
    }

    public RecommendedAssessment(
            String url,
            String name,
            String adaptiveSupport,
            String description,
            int duration,
            String remoteSupport,
            List<String> testType
    ) {
        this.url = url;
        this.name = name;
        this.adaptiveSupport = adaptiveSupport;
        this.description = description;
        this.duration = duration;
        this.remoteSupport = remoteSupport;
        this.testType = testType;
    }

    public static RecommendedAssessment from(AssessmentRecord record) {
        return new RecommendedAssessment(
                record.getUrl(),
                record.getName(),
                yesNo(record.isAdaptiveSupport()),
                record.getDescription(),
                record.getDurationMins(),
                yesNo(record.isRemoteSupport()),
                List.of(record.getTestType().label())
        );
    }

    private static String yesNo(boolean value) {
        return value ? "Yes" : "No";
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @JsonProperty("adaptive_support")
    public String getAdaptiveSupport() {
        return adaptiveSupport;
    }

    @JsonProperty("adaptive_support")
    public void setAdaptiveSupport(String adaptiveSupport) {
        this.adaptiveSupport = adaptiveSupport;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public int getDuration() {
        return duration;
    }

    public void setDuration(int duration) {
        this.duration = duration;
    }

    @JsonProperty("remote_support")
    public String getRemoteSupport() {
        return remoteSupport;
    }

    @JsonProperty("remote_support")
    public void setRemoteSupport(String remoteSupport) {
        this.remoteSupport = remoteSupport;
    }

    @JsonProperty("test_type")
    public List<String> getTestType() {
        return testType;
    }

    @JsonProperty("test_type")
    public void setTestType(List<String> testType) {
        this.testType = testType;
    }
}
