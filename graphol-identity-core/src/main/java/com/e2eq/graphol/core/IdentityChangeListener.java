package com.e2eq.graphol.core;

/**
 * Observer notified whenever the stored identity of a diagram node actually changes.
 */
@FunctionalInterface
public interface IdentityChangeListener {
    void identityChanged(DiagramNode node, Identity previous, Identity current);
}
