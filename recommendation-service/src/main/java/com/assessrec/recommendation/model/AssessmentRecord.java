package com.assessrec.recommendation.model;

import java.util.List;

public final class AssessmentRecord {
    private final String id;
    private final String name;
    private final String url;
    private final TestType testType;
    private final int durationMins;
    private final List<String> skills;
    private final String description;
    private final boolean adaptiveSupport;
    private final boolean remoteSupport;

    public AssessmentRecord(
            String id,
            String name,
            String url,
            TestType testType,
            int durationMins,
            List<String> skills,
            String description,
            boolean adaptiveSupport,
            boolean remoteSupport
    ) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("assessment url must not be blank");
        }
        if (durationMins < 0) {
            throw new IllegalArgumentException("duration must be >= 0 for " + url);
        }
        this.id = id == null ? "" : id;
        this.name = name == null ? "" : name;
        this.url = url;
        this.testType = testType == null ? TestType.OTHER : testType;
        this.durationMins = durationMins;
        this.skills = skills == null ? List.of() : List.copyOf(skills);
        this.description = description == null ? "" : description;
        this.adaptiveSupport = adaptiveSupport;
        this.remoteSupport = remoteSupport;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getUrl() { return url; }
    public TestType getTestType() { return testType; }
    public int getDurationMins() { return durationMins; }
    public List<String> getSkills() { return skills; }
    public String getDescription() { return description; }
    public boolean isAdaptiveSupport() { return adaptiveSupport; }
    public boolean isRemoteSupport() { return remoteSupport; }

    /**
     * Text fed to the embedding provider when the corpus index is built. Name and skills are
     * repeated so they weigh more than the description.
     */
    public String searchText() {
        String joinedSkills = String.join(", ", skills);
        return name + " " + name + " " + joinedSkills + " " + joinedSkills + " " + description
                + " test type " + testType.code();
    }

    @Override
    public String toString() {
        return "AssessmentRecord{id=" + id + ", name=" + name + ", type=" + testType
                + ", duration=" + durationMins + "}";
    }
}
