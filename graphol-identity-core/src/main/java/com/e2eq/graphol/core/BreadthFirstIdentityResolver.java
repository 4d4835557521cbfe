package com.e2eq.graphol.core;

import org.jboss.logging.Logger;

import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Identity resolver propagating identities through neutral nodes.
 * <p>
 * The connected neutral-capable component of the start node is split into strong nodes (holding a
 * concrete identity) and weak nodes (still neutral). Enumeration, range restriction and property
 * assertion nodes are first identified from their own operands, then every remaining weak node
 * receives the single identity shared by the strong nodes, {@link Identity#NEUTRAL} when there is
 * none and {@link Identity#UNKNOWN} when they disagree.
 * </p>
 */
public final class BreadthFirstIdentityResolver implements IdentityResolver {

    private static final Logger LOG = Logger.getLogger(BreadthFirstIdentityResolver.class);

    public static final int DEFAULT_MAX_VISITS = 10_000;

    private static final Predicate<DiagramEdge> INPUT = e -> e.kind() == EdgeKind.INPUT;
    private static final Predicate<DiagramEdge> MEMBERSHIP = e -> e.kind() == EdgeKind.MEMBERSHIP;
    private static final Predicate<DiagramNode> INDIVIDUAL = n -> n.kind() == NodeKind.INDIVIDUAL;
    private static final Predicate<DiagramNode> PREDICATE_NODE = n ->
            n.kind() == NodeKind.ROLE || n.kind() == NodeKind.ROLE_INVERSE || n.kind() == NodeKind.ATTRIBUTE;
    private static final Predicate<DiagramNode> RESTRICTED_OPERAND = n ->
            EnumSet.of(Identity.ROLE, Identity.ATTRIBUTE, Identity.CONCEPT).contains(n.identity())
                    && !n.kind().canBeNeutral();
    private static final Predicate<DiagramNode> NEUTRAL_CAPABLE = n -> n.kind().canBeNeutral();

    private final TraversalPolicy policy;
    private final int maxVisits;

    public BreadthFirstIdentityResolver() {
        this(TraversalPolicy.NEUTRAL_ONLY, DEFAULT_MAX_VISITS);
    }

    public BreadthFirstIdentityResolver(TraversalPolicy policy, int maxVisits) {
        if (maxVisits <= 0) {
            throw new IllegalArgumentException("maxVisits must be positive, got " + maxVisits);
        }
        this.policy = Objects.requireNonNull(policy, "policy");
        this.maxVisits = maxVisits;
    }

    public TraversalPolicy policy() {
        return policy;
    }

    public int maxVisits() {
        return maxVisits;
    }

    @Override
    public Resolution resolve(Diagram diagram, DiagramNode start) {
        if (!start.kind().canBeNeutral()) {
            return Resolution.skipped();
        }

        boolean frontier = policy == TraversalPolicy.INCLUDE_FRONTIER;
        List<DiagramNode> collection = new ArrayList<>(GraphTraversals.bfs(start, NEUTRAL_CAPABLE, frontier, maxVisits));
        GraphTraversals.Partition<DiagramNode> parts = frontier
                ? GraphTraversals.partition(NEUTRAL_CAPABLE, collection)
                : GraphTraversals.partition(n -> n.identity() == Identity.NEUTRAL, collection);

        Set<DiagramNode> weak = new LinkedHashSet<>(parts.matching());
        Set<DiagramNode> strong = new LinkedHashSet<>(parts.rest());
        Set<DiagramNode> excluded = new LinkedHashSet<>();

        for (DiagramNode node : collection) {
            switch (node.kind()) {
                case ENUMERATION -> {
                    if (weak.contains(node)) {
                        identifyFromOperands(diagram, node, INDIVIDUAL,
                                n -> n.identity() == Identity.INDIVIDUAL ? Identity.CONCEPT : Identity.VALUE_DOMAIN, strong);
                    }
                }
                // a lone Attribute operand falls through to VALUE_DOMAIN
                case RANGE_RESTRICTION -> {
                    if (weak.contains(node)) {
                        identifyFromOperands(diagram, node, RESTRICTED_OPERAND,
                                n -> n.identity() == Identity.ROLE || n.identity() == Identity.CONCEPT
                                        ? Identity.CONCEPT : Identity.VALUE_DOMAIN, strong);
                    }
                }
                // assertions identified on an earlier pass sit in strong and must still stay out of the vote
                case PROPERTY_ASSERTION -> identifyPropertyAssertion(diagram, node, strong, excluded);
                default -> { }
            }
        }

        Set<Identity> votes = new LinkedHashSet<>();
        for (DiagramNode node : strong) {
            votes.add(node.identity());
        }
        Identity aggregate = collapse(votes);

        for (DiagramNode node : weak) {
            if (!strong.contains(node) && !excluded.contains(node)) {
                diagram.setIdentity(node, aggregate);
            }
        }

        LOG.debugf("Identified from %s (%s): collected=%d strong=%d weak=%d excluded=%d aggregate=%s",
                start.id(), policy.label(), collection.size(), strong.size(), weak.size(), excluded.size(), aggregate);
        return new Resolution(true, List.copyOf(collection), Collections.unmodifiableSet(strong),
                Collections.unmodifiableSet(excluded), aggregate);
    }

    /**
     * Enumeration and range restriction: the node takes the identity implied by its Input operands and
     * replaces them as a voter.
     */
    private static void identifyFromOperands(Diagram diagram,
                                             DiagramNode node,
                                             Predicate<DiagramNode> operandFilter,
                                             Function<DiagramNode, Identity> converter,
                                             Set<DiagramNode> strong) {
        Set<DiagramNode> operands = node.incomingNodes(INPUT, operandFilter);
        Set<Identity> identities = new LinkedHashSet<>();
        for (DiagramNode operand : operands) {
            identities.add(converter.apply(operand));
        }

        diagram.setIdentity(node, collapse(identities));
        if (node.identity() != Identity.NEUTRAL) {
            strong.add(node);
        }
        strong.removeAll(operands);
    }

    /**
     * Property assertions live at instance level: they are identified locally and never take part in
     * the aggregate, in either direction.
     */
    private static void identifyPropertyAssertion(Diagram diagram,
                                                  DiagramNode node,
                                                  Set<DiagramNode> strong,
                                                  Set<DiagramNode> excluded) {
        Set<DiagramNode> outgoing = node.outgoingNodes(MEMBERSHIP, PREDICATE_NODE);
        Set<DiagramNode> incoming = node.incomingNodes(INPUT, INDIVIDUAL);

        Set<Identity> identities = new LinkedHashSet<>();
        for (DiagramNode target : outgoing) {
            identities.add(target.identity() == Identity.ROLE ? Identity.ROLE_INSTANCE : Identity.ATTRIBUTE_INSTANCE);
        }
        Identity computed = collapse(identities);

        if (computed == Identity.NEUTRAL && incoming.size() >= 2) {
            computed = Identity.ROLE_INSTANCE;
            for (DiagramNode operand : incoming) {
                if (operand.identity() == Identity.VALUE) {
                    computed = Identity.ATTRIBUTE_INSTANCE;
                    break;
                }
            }
        }

        diagram.setIdentity(node, computed);
        excluded.add(node);
        strong.remove(node);
        strong.removeAll(incoming);
    }

    private static Identity collapse(Set<Identity> identities) {
        if (identities.isEmpty()) {
            return Identity.NEUTRAL;
        }
        if (identities.size() > 1) {
            return Identity.UNKNOWN;
        }
        return identities.iterator().next();
    }
}
