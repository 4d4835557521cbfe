package com.e2eq.graphol.core;

import java.util.Arrays;
import java.util.Locale;

/**
 * Graphol edge kinds.
 */
public enum EdgeKind {
    INPUT("input"),
    INCLUSION("inclusion"),
    EQUIVALENCE("equivalence"),
    MEMBERSHIP("membership");

    private final String label;

    EdgeKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static EdgeKind fromLabel(String label) {
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        // older diagrams call membership edges "instance-of"
        if (normalized.equals("instance-of")) {
            return MEMBERSHIP;
        }
        for (EdgeKind kind : values()) {
            if (kind.label.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown edge kind '" + label + "'. Expected one of: "
                + Arrays.toString(Arrays.stream(values()).map(EdgeKind::label).toArray()));
    }
}
