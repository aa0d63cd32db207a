package org.acme.extender.policy;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;

/**
 * Named filter deciding whether a pod may run on a node.
 * <p>
 * Implementations must not mutate shared state. A policy-driven rejection is {@code false};
 * {@link PolicyEvaluationException} is reserved for pairs the policy cannot evaluate at all.
 */
public interface NodePredicate {

    String name();

    boolean test(Pod pod, Node node);
}
