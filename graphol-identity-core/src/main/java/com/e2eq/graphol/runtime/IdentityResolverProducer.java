package com.e2eq.graphol.runtime;

import com.e2eq.graphol.core.BreadthFirstIdentityResolver;
import com.e2eq.graphol.core.IdentityResolver;
import com.e2eq.graphol.core.TraversalPolicy;
import com.e2eq.graphol.core.YamlDiagramLoader;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Builds the {@link IdentityResolver} from configuration and exposes it, together with a
 * {@link YamlDiagramLoader} bound to it, for injection. Applications only gain these beans when they
 * depend on this module.
 */
@ApplicationScoped
public class IdentityResolverProducer {

    private static final Logger LOG = Logger.getLogger(IdentityResolverProducer.class);

    private final String traversalPolicy;
    private final int maxVisits;

    private IdentityResolver resolver;

    @Inject
    public IdentityResolverProducer(@ConfigProperty(name = "graphol.identity.traversal-policy", defaultValue = "neutral-only")
                                    String traversalPolicy,
                                    @ConfigProperty(name = "graphol.identity.max-visits", defaultValue = "10000")
                                    int maxVisits) {
        this.traversalPolicy = traversalPolicy;
        this.maxVisits = maxVisits;
    }

    @PostConstruct
    void init() {
        TraversalPolicy policy;
        try {
            policy = TraversalPolicy.fromLabel(traversalPolicy);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid graphol.identity.traversal-policy: " + traversalPolicy, e);
        }
        if (maxVisits <= 0) {
            throw new IllegalStateException("graphol.identity.max-visits must be positive, got " + maxVisits);
        }
        this.resolver = new BreadthFirstIdentityResolver(policy, maxVisits);
        LOG.infof("Identity resolver configured: policy=%s, maxVisits=%d", policy.label(), maxVisits);
    }

    @Produces
    public IdentityResolver resolver() {
        return resolver;
    }

    @Produces
    public YamlDiagramLoader diagramLoader() {
        return new YamlDiagramLoader(resolver);
    }
}
