package com.e2eq.graphol.core;

import org.jboss.logging.Logger;

import java.util.*;
import java.util.function.Predicate;

/**
 * Breadth-first exploration and partition helpers over diagram graphs.
 */
public final class GraphTraversals {
    private static final Logger LOG = Logger.getLogger(GraphTraversals.class);

    private GraphTraversals() {}

    public record Partition<T>(List<T> matching, List<T> rest) {}

    /**
     * Undirected breadth-first traversal from {@code source}, in discovery order.
     * <p>
     * Only nodes accepted by {@code filterOnVisit} are expanded. Rejected neighbours are dropped, or
     * collected without being expanded when {@code collectRejected} is set. The source is always
     * collected. At most {@code maxVisits} nodes are expanded.
     * </p>
     */
    public static Set<DiagramNode> bfs(DiagramNode source,
                                       Predicate<DiagramNode> filterOnVisit,
                                       boolean collectRejected,
                                       int maxVisits) {
        Set<DiagramNode> collected = new LinkedHashSet<>();
        Deque<DiagramNode> queue = new ArrayDeque<>();
        collected.add(source);
        if (filterOnVisit.test(source)) {
            queue.add(source);
        }

        int visits = 0;
        while (!queue.isEmpty()) {
            if (visits >= maxVisits) {
                LOG.warnf("Traversal from %s stopped after %d visits, %d nodes left unexpanded",
                        source.id(), visits, queue.size());
                break;
            }
            DiagramNode current = queue.removeFirst();
            visits++;
            for (DiagramNode next : current.adjacentNodes()) {
                if (collected.contains(next)) continue;
                if (filterOnVisit.test(next)) {
                    collected.add(next);
                    queue.addLast(next);
                } else if (collectRejected) {
                    collected.add(next);
                }
            }
        }
        return collected;
    }

    /**
     * Stable split of {@code items} by {@code predicate}; each list keeps the input order.
     */
    public static <T> Partition<T> partition(Predicate<? super T> predicate, Collection<T> items) {
        List<T> matching = new ArrayList<>();
        List<T> rest = new ArrayList<>();
        for (T item : items) {
            if (predicate.test(item)) {
                matching.add(item);
            } else {
                rest.add(item);
            }
        }
        return new Partition<>(matching, rest);
    }
}
