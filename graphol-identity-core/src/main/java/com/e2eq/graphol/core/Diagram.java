package com.e2eq.graphol.core;

import com.e2eq.graphol.exceptions.DiagramMalformedException;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * A Graphol diagram graph: nodes and edges keyed by id, in insertion order.
 * <p>
 * Adding or removing an edge re-runs identification for its source and then its target, on the
 * calling thread. Instances are not thread-safe.
 * </p>
 */
public final class Diagram {

    private static final Logger LOG = Logger.getLogger(Diagram.class);

    private final String name;
    private final IdentityResolver resolver;
    private final Map<String, DiagramNode> nodes = new LinkedHashMap<>();
    private final Map<String, DiagramEdge> edges = new LinkedHashMap<>();
    private final List<IdentityChangeListener> listeners = new ArrayList<>();
    private boolean autoIdentify = true;

    public Diagram(String name) {
        this(name, new BreadthFirstIdentityResolver());
    }

    public Diagram(String name, IdentityResolver resolver) {
        this.name = Objects.requireNonNull(name, "name");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public String name() {
        return name;
    }

    public IdentityResolver resolver() {
        return resolver;
    }

    // ---- nodes

    public DiagramNode addNode(String id, NodeKind kind) {
        return addNode(id, kind, null);
    }

    /**
     * Adds a node with an explicit initial identity; {@code null} means the kind's default.
     */
    public DiagramNode addNode(String id, NodeKind kind, Identity identity) {
        requireFreeId(id);
        DiagramNode node = new DiagramNode(id, kind, identity);
        nodes.put(id, node);
        return node;
    }

    /**
     * Removes the node after detaching its edges, so former neighbours get re-identified.
     */
    public void removeNode(String id) {
        DiagramNode node = nodes.get(id);
        if (node == null) return;
        for (DiagramEdge e : new ArrayList<>(node.edges())) {
            removeEdge(e.id());
        }
        nodes.remove(id);
    }

    public Optional<DiagramNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public Collection<DiagramNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    // ---- edges

    public DiagramEdge addEdge(String id, EdgeKind kind, String sourceId, String targetId) {
        DiagramNode source = nodes.get(sourceId);
        if (source == null) {
            throw new DiagramMalformedException(id, "Edge '" + id + "' references unknown source node '" + sourceId + "'");
        }
        DiagramNode target = nodes.get(targetId);
        if (target == null) {
            throw new DiagramMalformedException(id, "Edge '" + id + "' references unknown target node '" + targetId + "'");
        }
        return addEdge(id, kind, source, target);
    }

    public DiagramEdge addEdge(String id, EdgeKind kind, DiagramNode source, DiagramNode target) {
        requireFreeId(id);
        requireMember(id, source);
        requireMember(id, target);
        if (source == target) {
            throw new DiagramMalformedException(id, "Edge '" + id + "' connects node '" + source.id() + "' to itself");
        }
        DiagramEdge edge = new DiagramEdge(id, kind, source, target);
        edges.put(id, edge);
        source.attach(edge);
        target.attach(edge);
        onConnectionChanged(edge);
        return edge;
    }

    public void removeEdge(String id) {
        DiagramEdge edge = edges.remove(id);
        if (edge == null) return;
        edge.source().detach(edge);
        edge.target().detach(edge);
        onConnectionChanged(edge);
    }

    public Optional<DiagramEdge> edge(String id) {
        return Optional.ofNullable(edges.get(id));
    }

    public Collection<DiagramEdge> edges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty();
    }

    // ---- identities

    /**
     * Stores {@code identity} on {@code node}, or {@link Identity#UNKNOWN} when the node kind cannot
     * hold it, and notifies listeners if the stored value changed.
     */
    public void setIdentity(DiagramNode node, Identity identity) {
        requireMember(node.id(), node);
        Identity previous = node.setIdentity(Objects.requireNonNull(identity, "identity"));
        Identity current = node.identity();
        if (previous != current) {
            for (IdentityChangeListener listener : List.copyOf(listeners)) {
                listener.identityChanged(node, previous, current);
            }
        }
    }

    /**
     * Runs identification for every neutral-capable node, as done after building a diagram in bulk.
     */
    public void identifyAll() {
        List<DiagramNode> candidates = nodes.values().stream()
                .filter(n -> n.kind().canBeNeutral())
                .toList();
        if (candidates.isEmpty()) return;
        LOG.debugf("Running identification on diagram %s for %d nodes", name, candidates.size());
        for (DiagramNode node : candidates) {
            resolver.resolve(this, node);
        }
    }

    /**
     * When disabled, edge changes no longer trigger identification. Used while loading a diagram.
     */
    public void setAutoIdentify(boolean autoIdentify) {
        this.autoIdentify = autoIdentify;
    }

    public boolean isAutoIdentify() {
        return autoIdentify;
    }

    public void addIdentityChangeListener(IdentityChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeIdentityChangeListener(IdentityChangeListener listener) {
        listeners.remove(listener);
    }

    private void onConnectionChanged(DiagramEdge edge) {
        if (!autoIdentify) return;
        resolver.resolve(this, edge.source());
        resolver.resolve(this, edge.target());
    }

    private void requireFreeId(String id) {
        Objects.requireNonNull(id, "id");
        if (nodes.containsKey(id) || edges.containsKey(id)) {
            throw new DiagramMalformedException(id, "Duplicate item id '" + id + "' in diagram " + name);
        }
    }

    private void requireMember(String itemId, DiagramNode node) {
        if (nodes.get(node.id()) != node) {
            throw new DiagramMalformedException(itemId, "Node '" + node.id() + "' does not belong to diagram " + name);
        }
    }
}
