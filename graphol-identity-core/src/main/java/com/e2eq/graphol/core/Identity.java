package com.e2eq.graphol.core;

import java.util.Arrays;
import java.util.Locale;

/**
 * Semantic classification of a Graphol diagram node.
 * <p>
 * {@link #NEUTRAL} means the identity depends on the graph context and is not determined yet,
 * {@link #UNKNOWN} means the context was inspected and turned out to be ambiguous.
 * </p>
 */
public enum Identity {
    NEUTRAL("neutral"),
    CONCEPT("concept"),
    ROLE("role"),
    ATTRIBUTE("attribute"),
    VALUE_DOMAIN("value-domain"),
    INDIVIDUAL("individual"),
    VALUE("value"),
    ROLE_INSTANCE("role-instance"),
    ATTRIBUTE_INSTANCE("attribute-instance"),
    FACET("facet"),
    UNKNOWN("unknown");

    private final String label;

    Identity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Identity fromLabel(String label) {
        String normalized = label.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (Identity identity : values()) {
            if (identity.label.equals(normalized)) {
                return identity;
            }
        }
        throw new IllegalArgumentException("Unknown identity '" + label + "'. Expected one of: "
                + Arrays.toString(Arrays.stream(values()).map(Identity::label).toArray()));
    }
}
