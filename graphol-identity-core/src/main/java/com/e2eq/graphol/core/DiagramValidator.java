package com.e2eq.graphol.core;

import com.e2eq.graphol.exceptions.DiagramMalformedException;

import java.util.*;

/**
 * Structural consistency checks: edge endpoints, identity capabilities and ordered inputs.
 */
public final class DiagramValidator {
    private DiagramValidator() {}

    public static void validate(Diagram diagram) {
        if (diagram == null) return;

        Set<DiagramNode> members = Collections.newSetFromMap(new IdentityHashMap<>());
        members.addAll(diagram.nodes());

        for (DiagramEdge e : diagram.edges()) {
            require(members.contains(e.source()), e.id(), "Edge '" + e.id() + "' has source '" + e.source().id() + "' outside the diagram");
            require(members.contains(e.target()), e.id(), "Edge '" + e.id() + "' has target '" + e.target().id() + "' outside the diagram");
            require(e.source() != e.target(), e.id(), "Edge '" + e.id() + "' is a self-loop on '" + e.source().id() + "'");
            require(e.source().edges().contains(e) && e.target().edges().contains(e), e.id(),
                    "Edge '" + e.id() + "' is not attached to both of its endpoints");
        }

        for (DiagramNode n : diagram.nodes()) {
            require(n.identity() == Identity.UNKNOWN || n.identities().contains(n.identity()), n.id(),
                    "Node '" + n.id() + "' holds identity " + n.identity() + " which a " + n.kind().label() + " node cannot have");
            for (DiagramEdge e : n.edges()) {
                require(diagram.edge(e.id()).orElse(null) == e, n.id(),
                        "Node '" + n.id() + "' references edge '" + e.id() + "' unknown to the diagram");
            }
            for (String input : n.inputs()) {
                Optional<DiagramEdge> edge = diagram.edge(input);
                require(edge.isPresent(), n.id(), "Node '" + n.id() + "' lists unknown input edge '" + input + "'");
                require(edge.get().kind() == EdgeKind.INPUT && edge.get().target() == n, n.id(),
                        "Edge '" + input + "' is not an input edge targeting node '" + n.id() + "'");
            }
        }
    }

    private static void require(boolean cond, String itemId, String msg) {
        if (!cond) throw new DiagramMalformedException(itemId, msg);
    }
}
