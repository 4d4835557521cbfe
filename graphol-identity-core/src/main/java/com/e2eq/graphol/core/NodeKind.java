package com.e2eq.graphol.core;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Graphol node kinds together with the identities each kind is able to hold.
 */
public enum NodeKind {
    CONCEPT("concept", Identity.CONCEPT),
    ROLE("role", Identity.ROLE),
    ATTRIBUTE("attribute", Identity.ATTRIBUTE),
    VALUE_DOMAIN("value-domain", Identity.VALUE_DOMAIN),
    INDIVIDUAL("individual", Identity.INDIVIDUAL, Identity.VALUE),
    FACET("facet", Identity.FACET),
    DOMAIN_RESTRICTION("domain-restriction", Identity.CONCEPT),
    RANGE_RESTRICTION("range-restriction", Identity.NEUTRAL, Identity.CONCEPT, Identity.VALUE_DOMAIN),
    DATATYPE_RESTRICTION("datatype-restriction", Identity.VALUE_DOMAIN),
    ENUMERATION("enumeration", Identity.NEUTRAL, Identity.CONCEPT, Identity.VALUE_DOMAIN),
    INTERSECTION("intersection", Identity.NEUTRAL, Identity.CONCEPT, Identity.VALUE_DOMAIN),
    UNION("union", Identity.NEUTRAL, Identity.CONCEPT, Identity.VALUE_DOMAIN),
    DISJOINT_UNION("disjoint-union", Identity.NEUTRAL, Identity.CONCEPT, Identity.VALUE_DOMAIN),
    COMPLEMENT("complement", Identity.NEUTRAL, Identity.CONCEPT, Identity.VALUE_DOMAIN,
            Identity.ROLE, Identity.ATTRIBUTE),
    PROPERTY_ASSERTION("property-assertion", Identity.NEUTRAL, Identity.ROLE_INSTANCE,
            Identity.ATTRIBUTE_INSTANCE),
    ROLE_CHAIN("role-chain", Identity.ROLE),
    ROLE_INVERSE("role-inverse", Identity.ROLE);

    private final String label;
    private final Set<Identity> identities;

    NodeKind(String label, Identity first, Identity... rest) {
        this.label = label;
        this.identities = Collections.unmodifiableSet(EnumSet.of(first, rest));
    }

    public String label() {
        return label;
    }

    /**
     * Identities a node of this kind may hold ({@link Identity#UNKNOWN} is always allowed on top).
     */
    public Set<Identity> identities() {
        return identities;
    }

    public boolean canBeNeutral() {
        return identities.contains(Identity.NEUTRAL);
    }

    /**
     * Kinds whose Input operands are positional and tracked in {@link DiagramNode#inputs()}.
     */
    public boolean hasOrderedInputs() {
        return this == ENUMERATION || this == ROLE_CHAIN || this == PROPERTY_ASSERTION;
    }

    /**
     * Identity a freshly created node of this kind starts with.
     */
    public Identity defaultIdentity() {
        if (canBeNeutral()) {
            return Identity.NEUTRAL;
        }
        if (this == INDIVIDUAL) {
            return Identity.INDIVIDUAL;
        }
        return identities.iterator().next();
    }

    public static NodeKind fromLabel(String label) {
        String normalized = label.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (NodeKind kind : values()) {
            if (kind.label.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node kind '" + label + "'. Expected one of: "
                + Arrays.toString(Arrays.stream(values()).map(NodeKind::label).toArray()));
    }
}
