package com.examgrader.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Verdict {
    PASS("Pass"),
    FAIL("Fail");

    private final String label;

    Verdict(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Verdict fromLabel(String label) {
        for (Verdict verdict : values()) {
            if (verdict.label.equalsIgnoreCase(label) || verdict.name().equalsIgnoreCase(label)) {
                return verdict;
            }
        }
        throw new IllegalArgumentException("Unknown verdict: " + label);
    }
}
