package com.e2eq.graphol.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class BreadthFirstIdentityResolverTest {

    private BreadthFirstIdentityResolver resolver;
    private Diagram diagram;

    @BeforeEach
    void setUp() {
        resolver = new BreadthFirstIdentityResolver();
        diagram = new Diagram("test", resolver);
        // build graphs without side effects, each test drives the resolver itself
        diagram.setAutoIdentify(false);
    }

    private DiagramNode node(String id, NodeKind kind) {
        return diagram.addNode(id, kind);
    }

    private DiagramNode node(String id, NodeKind kind, Identity identity) {
        return diagram.addNode(id, kind, identity);
    }

    private void input(String id, DiagramNode source, DiagramNode target) {
        diagram.addEdge(id, EdgeKind.INPUT, source, target);
    }

    @Test
    void testNonNeutralStartIsSkipped() {
        DiagramNode concept = node("c", NodeKind.CONCEPT);
        DiagramNode union = node("u", NodeKind.UNION);
        input("e", concept, union);

        IdentityResolver.Resolution res = resolver.resolve(diagram, concept);

        assertFalse(res.performed());
        assertTrue(res.collected().isEmpty());
        assertEquals(Identity.NEUTRAL, union.identity());
    }

    @Test
    void testIsolatedNeutralNodeStaysNeutral() {
        DiagramNode union = node("u", NodeKind.UNION);

        IdentityResolver.Resolution res = resolver.resolve(diagram, union);

        assertTrue(res.performed());
        assertEquals(List.of(union), res.collected());
        assertEquals(Identity.NEUTRAL, res.aggregate());
        assertEquals(Identity.NEUTRAL, union.identity());
    }

    @Test
    void testConcreteNeighbourIsTraversalBoundary() {
        DiagramNode concept = node("c", NodeKind.CONCEPT);
        DiagramNode union = node("u", NodeKind.UNION);
        DiagramNode behind = node("x", NodeKind.INTERSECTION);
        input("e1", concept, union);
        input("e2", behind, concept);

        IdentityResolver.Resolution res = resolver.resolve(diagram, union);

        assertEquals(List.of(union), res.collected(), "concept node must not be collected nor crossed");
        assertEquals(Identity.CONCEPT, concept.identity());
        assertEquals(Identity.NEUTRAL, union.identity());
        assertEquals(Identity.NEUTRAL, behind.identity());
    }

    @Test
    void testSingleStrongIdentityPropagates() {
        DiagramNode resolved = node("u", NodeKind.UNION, Identity.CONCEPT);
        DiagramNode x = node("x", NodeKind.INTERSECTION);
        DiagramNode y = node("y", NodeKind.COMPLEMENT);
        input("e1", resolved, x);
        input("e2", x, y);

        IdentityResolver.Resolution res = resolver.resolve(diagram, y);

        assertEquals(List.of(y, x, resolved), res.collected(), "discovery order");
        assertEquals(Set.of(resolved), res.strong());
        assertEquals(Identity.CONCEPT, res.aggregate());
        assertEquals(Identity.CONCEPT, x.identity());
        assertEquals(Identity.CONCEPT, y.identity());
        assertEquals(Identity.CONCEPT, resolved.identity());
    }

    @Test
    void testConflictingStrongIdentitiesGiveUnknown() {
        DiagramNode a = node("a", NodeKind.UNION, Identity.CONCEPT);
        DiagramNode b = node("b", NodeKind.UNION, Identity.VALUE_DOMAIN);
        DiagramNode x = node("x", NodeKind.INTERSECTION);
        input("e1", a, x);
        input("e2", b, x);

        IdentityResolver.Resolution res = resolver.resolve(diagram, x);

        assertEquals(Identity.UNKNOWN, res.aggregate());
        assertEquals(Identity.UNKNOWN, x.identity());
        assertEquals(Identity.CONCEPT, a.identity(), "strong nodes keep their identity");
        assertEquals(Identity.VALUE_DOMAIN, b.identity());
    }

    @Test
    void testAggregateOutsideCapabilitySetBecomesUnknown() {
        DiagramNode complement = node("c", NodeKind.COMPLEMENT, Identity.ROLE);
        DiagramNode union = node("u", NodeKind.UNION);
        input("e", complement, union);

        resolver.resolve(diagram, union);

        assertEquals(Identity.UNKNOWN, union.identity(), "a union cannot be a role");
    }

    @Test
    void testEnumerationWithMixedOperandsIsUnknown() {
        DiagramNode enumeration = node("e", NodeKind.ENUMERATION);
        input("i1", node("a", NodeKind.INDIVIDUAL), enumeration);
        input("i2", node("b", NodeKind.INDIVIDUAL), enumeration);
        input("i3", node("v", NodeKind.INDIVIDUAL, Identity.VALUE), enumeration);

        IdentityResolver.Resolution res = resolver.resolve(diagram, enumeration);

        assertEquals(Identity.UNKNOWN, enumeration.identity());
        assertTrue(res.strong().contains(enumeration));
    }

    @Test
    void testEnumerationOfIndividualsIsConceptAndVotes() {
        DiagramNode enumeration = node("e", NodeKind.ENUMERATION);
        DiagramNode union = node("u", NodeKind.UNION);
        input("i1", node("a", NodeKind.INDIVIDUAL), enumeration);
        input("i2", enumeration, union);

        IdentityResolver.Resolution res = resolver.resolve(diagram, union);

        assertEquals(Identity.CONCEPT, enumeration.identity());
        assertEquals(Set.of(enumeration), res.strong());
        assertEquals(Identity.CONCEPT, union.identity());
    }

    @Test
    void testEnumerationOfValuesIsValueDomain() {
        DiagramNode enumeration = node("e", NodeKind.ENUMERATION);
        input("i1", node("v1", NodeKind.INDIVIDUAL, Identity.VALUE), enumeration);
        input("i2", node("v2", NodeKind.INDIVIDUAL, Identity.VALUE), enumeration);

        resolver.resolve(diagram, enumeration);

        assertEquals(Identity.VALUE_DOMAIN, enumeration.identity());
    }

    @Test
    void testEnumerationIgnoresNonInputEdges() {
        DiagramNode enumeration = node("e", NodeKind.ENUMERATION);
        diagram.addEdge("m", EdgeKind.MEMBERSHIP, node("a", NodeKind.INDIVIDUAL), enumeration);

        IdentityResolver.Resolution res = resolver.resolve(diagram, enumeration);

        assertEquals(Identity.NEUTRAL, enumeration.identity());
        assertTrue(res.strong().isEmpty());
    }

    @Test
    void testRangeRestrictionOnRoleIsConcept() {
        DiagramNode range = node("r", NodeKind.RANGE_RESTRICTION);
        input("e", node("role", NodeKind.ROLE), range);

        resolver.resolve(diagram, range);

        assertEquals(Identity.CONCEPT, range.identity());
    }

    @Test
    void testRangeRestrictionOnAttributeIsValueDomain() {
        DiagramNode range = node("r", NodeKind.RANGE_RESTRICTION);
        DiagramNode union = node("u", NodeKind.UNION);
        input("e1", node("att", NodeKind.ATTRIBUTE), range);
        input("e2", range, union);

        resolver.resolve(diagram, union);

        assertEquals(Identity.VALUE_DOMAIN, range.identity());
        assertEquals(Identity.VALUE_DOMAIN, union.identity());
    }

    @Test
    void testRangeRestrictionOnRoleAndAttributeIsUnknown() {
        DiagramNode range = node("r", NodeKind.RANGE_RESTRICTION);
        input("e1", node("role", NodeKind.ROLE), range);
        input("e2", node("att", NodeKind.ATTRIBUTE), range);

        resolver.resolve(diagram, range);

        assertEquals(Identity.UNKNOWN, range.identity());
    }

    @Test
    void testRangeRestrictionSkipsNeutralCapableOperands() {
        DiagramNode range = node("r", NodeKind.RANGE_RESTRICTION);
        DiagramNode union = node("u", NodeKind.UNION, Identity.CONCEPT);
        input("e", union, range);

        IdentityResolver.Resolution res = resolver.resolve(diagram, range);

        // the union is not an operand for the rule, it votes like any strong node instead
        assertTrue(res.strong().contains(union));
        assertEquals(Identity.CONCEPT, range.identity());
    }

    @Test
    void testPropertyAssertionBetweenIndividualsIsRoleInstanceAndExcluded() {
        DiagramNode assertion = node("pa", NodeKind.PROPERTY_ASSERTION);
        DiagramNode union = node("u", NodeKind.UNION);
        DiagramNode enumeration = node("en", NodeKind.ENUMERATION);
        input("e1", node("a", NodeKind.INDIVIDUAL), assertion);
        input("e2", node("b", NodeKind.INDIVIDUAL), assertion);
        diagram.addEdge("e3", EdgeKind.INCLUSION, assertion, union);
        input("e4", node("v", NodeKind.INDIVIDUAL, Identity.VALUE), enumeration);
        input("e5", enumeration, union);

        IdentityResolver.Resolution res = resolver.resolve(diagram, union);

        assertEquals(Identity.ROLE_INSTANCE, assertion.identity(), "assertion must not receive the aggregate");
        assertEquals(Set.of(assertion), res.excluded());
        assertEquals(Identity.VALUE_DOMAIN, res.aggregate(), "assertion must not vote");
        assertEquals(Identity.VALUE_DOMAIN, union.identity());
    }

    @Test
    void testPropertyAssertionWithValueOperandIsAttributeInstance() {
        DiagramNode assertion = node("pa", NodeKind.PROPERTY_ASSERTION);
        input("e1", node("a", NodeKind.INDIVIDUAL), assertion);
        input("e2", node("v", NodeKind.INDIVIDUAL, Identity.VALUE), assertion);

        resolver.resolve(diagram, assertion);

        assertEquals(Identity.ATTRIBUTE_INSTANCE, assertion.identity());
    }

    @Test
    void testPropertyAssertionWithSingleOperandStaysNeutral() {
        DiagramNode assertion = node("pa", NodeKind.PROPERTY_ASSERTION);
        input("e1", node("a", NodeKind.INDIVIDUAL), assertion);

        IdentityResolver.Resolution res = resolver.resolve(diagram, assertion);

        assertEquals(Identity.NEUTRAL, assertion.identity());
        assertTrue(res.excluded().contains(assertion));
    }

    @Test
    void testMembershipTakesPriorityOverOperands() {
        DiagramNode assertion = node("pa", NodeKind.PROPERTY_ASSERTION);
        input("e1", node("a", NodeKind.INDIVIDUAL), assertion);
        input("e2", node("v", NodeKind.INDIVIDUAL, Identity.VALUE), assertion);
        diagram.addEdge("m", EdgeKind.MEMBERSHIP, assertion, node("r", NodeKind.ROLE));

        resolver.resolve(diagram, assertion);

        assertEquals(Identity.ROLE_INSTANCE, assertion.identity());
    }

    @Test
    void testMembershipToRoleInverseAndAttribute() {
        DiagramNode toInverse = node("pa1", NodeKind.PROPERTY_ASSERTION);
        diagram.addEdge("m1", EdgeKind.MEMBERSHIP, toInverse, node("inv", NodeKind.ROLE_INVERSE));
        DiagramNode toAttribute = node("pa2", NodeKind.PROPERTY_ASSERTION);
        diagram.addEdge("m2", EdgeKind.MEMBERSHIP, toAttribute, node("att", NodeKind.ATTRIBUTE));
        DiagramNode toBoth = node("pa3", NodeKind.PROPERTY_ASSERTION);
        diagram.addEdge("m3", EdgeKind.MEMBERSHIP, toBoth, node("role", NodeKind.ROLE));
        diagram.addEdge("m4", EdgeKind.MEMBERSHIP, toBoth, node("att2", NodeKind.ATTRIBUTE));

        resolver.resolve(diagram, toInverse);
        resolver.resolve(diagram, toAttribute);
        resolver.resolve(diagram, toBoth);

        assertEquals(Identity.ROLE_INSTANCE, toInverse.identity());
        assertEquals(Identity.ATTRIBUTE_INSTANCE, toAttribute.identity());
        assertEquals(Identity.UNKNOWN, toBoth.identity());
    }

    @Test
    void testResolveIsIdempotent() {
        DiagramNode enumeration = node("e", NodeKind.ENUMERATION);
        DiagramNode union = node("u", NodeKind.UNION);
        DiagramNode complement = node("c", NodeKind.COMPLEMENT);
        input("e1", node("a", NodeKind.INDIVIDUAL), enumeration);
        input("e2", enumeration, union);
        input("e3", union, complement);

        resolver.resolve(diagram, complement);
        Map<String, Identity> first = snapshot(diagram);
        resolver.resolve(diagram, complement);

        assertEquals(first, snapshot(diagram));
        assertEquals(Identity.CONCEPT, first.get("c"));
    }

    @Test
    void testIdentifiedPropertyAssertionStaysExcludedOnLaterPasses() {
        DiagramNode assertion = node("pa", NodeKind.PROPERTY_ASSERTION);
        DiagramNode union = node("u", NodeKind.UNION);
        DiagramNode enumeration = node("en", NodeKind.ENUMERATION);
        input("e1", node("a", NodeKind.INDIVIDUAL), assertion);
        input("e2", node("b", NodeKind.INDIVIDUAL), assertion);
        diagram.addEdge("e3", EdgeKind.INCLUSION, assertion, union);
        input("e4", node("v", NodeKind.INDIVIDUAL, Identity.VALUE), enumeration);
        input("e5", enumeration, union);

        IdentityResolver.Resolution first = resolver.resolve(diagram, union);
        Map<String, Identity> before = snapshot(diagram);
        IdentityResolver.Resolution second = resolver.resolve(diagram, union);

        assertEquals(before, snapshot(diagram));
        assertEquals(Set.of(assertion), first.excluded());
        assertEquals(Set.of(assertion), second.excluded());
        assertFalse(second.strong().contains(assertion));
        assertEquals(Identity.VALUE_DOMAIN, second.aggregate());
        assertEquals(Identity.ROLE_INSTANCE, assertion.identity());
    }

    @Test
    void testNegativeRoleAssertionKeepsComplementNeutral() {
        Diagram d = new Diagram("negative", resolver);
        DiagramNode complement = d.addNode("not", NodeKind.COMPLEMENT);
        DiagramNode assertion = d.addNode("pa", NodeKind.PROPERTY_ASSERTION);
        d.addNode("r", NodeKind.ROLE);
        d.addNode("a", NodeKind.INDIVIDUAL);
        d.addNode("b", NodeKind.INDIVIDUAL);
        d.addEdge("e1", EdgeKind.INPUT, "r", "not");
        d.addEdge("m", EdgeKind.MEMBERSHIP, "pa", "not");
        d.addEdge("e2", EdgeKind.INPUT, "a", "pa");
        d.addEdge("e3", EdgeKind.INPUT, "b", "pa");

        assertEquals(Identity.ROLE_INSTANCE, assertion.identity());
        assertEquals(Identity.NEUTRAL, complement.identity());

        d.identifyAll();
        resolver.resolve(d, complement);
        IdentityResolver.Resolution res = resolver.resolve(d, complement);

        assertEquals(Identity.NEUTRAL, complement.identity());
        assertEquals(Identity.ROLE_INSTANCE, assertion.identity());
        assertTrue(res.excluded().contains(assertion));
        assertEquals(Identity.NEUTRAL, res.aggregate());
    }

    @Test
    void testIdentitiesAlwaysWithinCapabilities() {
        DiagramNode a = node("a", NodeKind.UNION, Identity.CONCEPT);
        DiagramNode range = node("r", NodeKind.RANGE_RESTRICTION);
        DiagramNode assertion = node("pa", NodeKind.PROPERTY_ASSERTION);
        DiagramNode complement = node("c", NodeKind.COMPLEMENT, Identity.ATTRIBUTE);
        input("e1", a, range);
        input("e2", node("role", NodeKind.ROLE), range);
        input("e3", complement, range);
        diagram.addEdge("e4", EdgeKind.INCLUSION, range, assertion);

        IdentityResolver.Resolution res = resolver.resolve(diagram, range);

        for (DiagramNode n : res.collected()) {
            assertTrue(n.identity() == Identity.UNKNOWN || n.identities().contains(n.identity()),
                    n + " holds an identity outside its capabilities");
        }
    }

    @Test
    void testSameGraphGivesSameAssignment() {
        Map<String, Identity> first = buildMixedGraphAndResolve();
        Map<String, Identity> second = buildMixedGraphAndResolve();
        assertEquals(first, second);
    }

    private Map<String, Identity> buildMixedGraphAndResolve() {
        Diagram d = new Diagram("mixed", new BreadthFirstIdentityResolver());
        d.addNode("a", NodeKind.INDIVIDUAL);
        d.addNode("v", NodeKind.INDIVIDUAL, Identity.VALUE);
        d.addNode("en", NodeKind.ENUMERATION);
        d.addNode("r", NodeKind.RANGE_RESTRICTION);
        d.addNode("att", NodeKind.ATTRIBUTE);
        d.addNode("u", NodeKind.UNION);
        d.addNode("pa", NodeKind.PROPERTY_ASSERTION);
        d.addEdge("e1", EdgeKind.INPUT, "a", "en");
        d.addEdge("e2", EdgeKind.INPUT, "att", "r");
        d.addEdge("e3", EdgeKind.INPUT, "en", "u");
        d.addEdge("e4", EdgeKind.INPUT, "r", "u");
        d.addEdge("e5", EdgeKind.INPUT, "a", "pa");
        d.addEdge("e6", EdgeKind.INPUT, "v", "pa");
        return snapshot(d);
    }

    private static Map<String, Identity> snapshot(Diagram d) {
        Map<String, Identity> out = new LinkedHashMap<>();
        for (DiagramNode n : d.nodes()) {
            out.put(n.id(), n.identity());
        }
        return out;
    }
}
