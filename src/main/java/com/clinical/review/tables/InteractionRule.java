package com.clinical.review.tables;

import com.clinical.review.model.Severity;

import java.util.Objects;

/**
 * A known interaction between two drug codes. Matching is symmetric: (A, B) also matches (B, A).
 */
public final class InteractionRule {
    private final String codeA;
    private final String codeB;
    private final Severity severity;
    private final String description;
    private final String action;

    public InteractionRule(String codeA, String codeB, Severity severity, String description, String action) {
        this.codeA = Objects.requireNonNull(codeA, "codeA");
        this.codeB = Objects.requireNonNull(codeB, "codeB");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.description = description;
        this.action = action;
    }

    /**
     * @return true if the two codes form this rule's pair, in either order
     */
    public boolean matches(String first, String second) {
        if (first == null || second == null) {
            return false;
        }
        return (codeA.equals(first) && codeB.equals(second))
                || (codeA.equals(second) && codeB.equals(first));
    }

    public String getCodeA() {
        return codeA;
    }

    public String getCodeB() {
        return codeB;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public String getAction() {
        return action;
    }
}
