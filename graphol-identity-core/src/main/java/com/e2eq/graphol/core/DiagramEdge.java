package com.e2eq.graphol.core;

import java.util.Objects;

/**
 * Directed edge between two diagram nodes. Edges are owned by the {@link Diagram};
 * the endpoints only keep a back-reference for traversal.
 */
public final class DiagramEdge {

    private final String id;
    private final EdgeKind kind;
    private final DiagramNode source;
    private final DiagramNode target;

    DiagramEdge(String id, EdgeKind kind, DiagramNode source, DiagramNode target) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
    }

    public String id() {
        return id;
    }

    public EdgeKind kind() {
        return kind;
    }

    public DiagramNode source() {
        return source;
    }

    public DiagramNode target() {
        return target;
    }

    /**
     * Returns the endpoint opposite to the given node.
     */
    public DiagramNode other(DiagramNode node) {
        return node == source ? target : source;
    }

    @Override
    public String toString() {
        return kind.label() + ":" + id + "(" + source.id() + " -> " + target.id() + ")";
    }
}
