package org.acme.extender.policy;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import jakarta.enterprise.context.ApplicationScoped;

@ApplicationScoped
public class AlwaysTruePredicate implements NodePredicate {

    public static final String NAME = "always_true";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean test(Pod pod, Node node) {
        return true;
    }
}
