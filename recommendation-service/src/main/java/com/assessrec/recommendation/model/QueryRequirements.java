package com.assessrec.recommendation.model;

public class QueryRequirements {
    private final Integer maxDuration;
    private final boolean needsTech;
    private final boolean needsSoft;
    private final boolean needsCognitive;
    private final boolean entryLevel;

    public QueryRequirements(
            Integer maxDuration,
            boolean needsTech,
            boolean needsSoft,
            boolean needsCognitive,
            boolean entryLevel
    ) {
        this.maxDuration = maxDuration;
        this.needsTech = needsTech;
        this.needsSoft = needsSoft;
        this.needsCognitive = needsCognitive;
        this.entryLevel = entryLevel;
    }

    public static QueryRequirements none() {
        return new QueryRequirements(null, false, false, false, false);
    }

    public Integer getMaxDuration() {
        return maxDuration;
    }

    public boolean hasDurationCap() {
        return maxDuration != null;
    }

    public boolean isNeedsTech() {
        return needsTech;
    }

    public boolean isNeedsSoft() {
        return needsSoft;
    }

    public boolean isNeedsCognitive() {
        return needsCognitive;
    }

    public boolean isNeedsBalanced() {
        return (needsTech && needsSoft) || (needsTech && needsCognitive);
    }

    public boolean isEntryLevel() {
        return entryLevel;
    }

    @Override
    public String toString() {
        return "max_duration=" + maxDuration
                + " tech=" + needsTech
                + " soft=" + needsSoft
                + " cognitive=" + needsCognitive
                + " balanced=" + isNeedsBalanced()
                + " entry_level=" + entryLevel;
    }
}
