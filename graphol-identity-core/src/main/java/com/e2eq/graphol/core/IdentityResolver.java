package com.e2eq.graphol.core;

import java.util.*;

public interface IdentityResolver {

    /**
     * Recomputes the identity of the neutral-capable nodes connected to {@code start}.
     * Called synchronously by the diagram for both endpoints of an added or removed edge.
     */
    Resolution resolve(Diagram diagram, DiagramNode start);

    /**
     * Outcome of one identification pass. {@code collected} is in discovery order, {@code strong} and
     * {@code excluded} are the working sets after the kind-specific rules ran.
     */
    record Resolution(boolean performed,
                      List<DiagramNode> collected,
                      Set<DiagramNode> strong,
                      Set<DiagramNode> excluded,
                      Identity aggregate) {
        public static Resolution skipped() {
            return new Resolution(false, List.of(), Set.of(), Set.of(), Identity.NEUTRAL);
        }
    }
}
