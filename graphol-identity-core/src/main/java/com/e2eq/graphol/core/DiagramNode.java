package com.e2eq.graphol.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * A vertex of a Graphol diagram. Only the owning {@link Diagram} mutates the identity, the
 * incident edge set and the ordered inputs of a node.
 */
public final class DiagramNode {

    private final String id;
    private final NodeKind kind;
    private Identity identity;
    private final Set<DiagramEdge> edges = new LinkedHashSet<>();
    private final List<String> inputs = new ArrayList<>();

    DiagramNode(String id, NodeKind kind, Identity identity) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.identity = admissible(kind, identity == null ? kind.defaultIdentity() : identity);
    }

    public String id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    public Identity identity() {
        return identity;
    }

    public Set<Identity> identities() {
        return kind.identities();
    }

    public Set<DiagramEdge> edges() {
        return Collections.unmodifiableSet(edges);
    }

    /**
     * Ids of the Input edges feeding this node, in operand order. Empty for kinds without ordered operands.
     */
    public List<String> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    public Set<DiagramNode> incomingNodes(Predicate<DiagramEdge> edgeFilter, Predicate<DiagramNode> nodeFilter) {
        Set<DiagramNode> result = new LinkedHashSet<>();
        for (DiagramEdge e : edges) {
            if (e.target() == this && edgeFilter.test(e) && nodeFilter.test(e.source())) {
                result.add(e.source());
            }
        }
        return result;
    }

    public Set<DiagramNode> outgoingNodes(Predicate<DiagramEdge> edgeFilter, Predicate<DiagramNode> nodeFilter) {
        Set<DiagramNode> result = new LinkedHashSet<>();
        for (DiagramEdge e : edges) {
            if (e.source() == this && edgeFilter.test(e) && nodeFilter.test(e.target())) {
                result.add(e.target());
            }
        }
        return result;
    }

    /**
     * Neighbours over edges in either direction.
     */
    public Set<DiagramNode> adjacentNodes() {
        Set<DiagramNode> result = new LinkedHashSet<>();
        for (DiagramEdge e : edges) {
            result.add(e.other(this));
        }
        return result;
    }

    Identity setIdentity(Identity newIdentity) {
        Identity previous = this.identity;
        this.identity = admissible(kind, newIdentity);
        return previous;
    }

    void attach(DiagramEdge edge) {
        edges.add(edge);
        if (edge.target() == this && edge.kind() == EdgeKind.INPUT && kind.hasOrderedInputs()
                && !inputs.contains(edge.id())) {
            inputs.add(edge.id());
        }
    }

    void detach(DiagramEdge edge) {
        edges.remove(edge);
        inputs.remove(edge.id());
    }

    // identities outside the capability set collapse to UNKNOWN
    static Identity admissible(NodeKind kind, Identity identity) {
        if (identity == Identity.UNKNOWN || kind.identities().contains(identity)) {
            return identity;
        }
        return Identity.UNKNOWN;
    }

    @Override
    public String toString() {
        return kind.label() + ":" + id + "[" + identity.label() + "]";
    }
}
