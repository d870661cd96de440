package com.assessrec.recommendation.model;

import java.util.Locale;

public enum TestType {
    K("Knowledge & Skills"),
    P("Personality & Behaviour"),
    A("Ability & Aptitude"),
    B("Biodata & SJT"),
    OTHER("Other");

    private final String label;

    TestType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public String code() {
        return this == OTHER ? "" : name();
    }

    public static TestType fromCode(String code) {
        if (code == null) {
            return OTHER;
        }
        switch (code.trim().toUpperCase(Locale.ROOT)) {
            case "K":
                return K;
            case "P":
                return P;
            case "A":
                return A;
            case "B":
                return B;
            default:
                return OTHER;
        }
    }
}
