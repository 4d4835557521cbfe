package com.e2eq.graphol.core;

import java.util.Arrays;
import java.util.Locale;

/**
 * Controls which nodes an identification pass collects and how they are split into strong and weak.
 */
public enum TraversalPolicy {
    /**
     * Collect neutral-capable nodes only; nodes already holding a concrete identity are strong.
     */
    NEUTRAL_ONLY("neutral-only"),
    /**
     * Also collect the concrete-only nodes met at the traversal frontier. Those are strong, every
     * neutral-capable node is weak and gets recomputed whatever it currently holds.
     */
    INCLUDE_FRONTIER("include-frontier");

    private final String label;

    TraversalPolicy(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static TraversalPolicy fromLabel(String label) {
        String normalized = label.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (TraversalPolicy policy : values()) {
            if (policy.label.equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown traversal policy '" + label + "'. Expected one of: "
                + Arrays.toString(Arrays.stream(values()).map(TraversalPolicy::label).toArray()));
    }
}
