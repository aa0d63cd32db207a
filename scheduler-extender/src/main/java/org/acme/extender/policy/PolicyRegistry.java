package org.acme.extender.policy;

import io.quarkus.arc.All;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Name lookup for the predicates and priorities deployed in this extender, built once from the
 * policy beans.
 */
@ApplicationScoped
public class PolicyRegistry {

    private final Map<String, NodePredicate> predicates;
    private final Map<String, NodePriority> priorities;
    private final BindPolicy bindPolicy;

    @Inject
    public PolicyRegistry(@All List<NodePredicate> predicates, @All List<NodePriority> priorities, BindPolicy bindPolicy) {
        this.predicates = index("predicate", predicates, NodePredicate::name);
        this.priorities = index("priority", priorities, NodePriority::name);
        this.bindPolicy = bindPolicy;
        Log.infof("Registered predicates %s and priorities %s", this.predicates.keySet(), this.priorities.keySet());
    }

    public NodePredicate predicate(String name) {
        return Optional.ofNullable(predicates.get(name))
                .orElseThrow(() -> new UnknownPolicyException("predicate", name));
    }

    public NodePriority priority(String name) {
        return Optional.ofNullable(priorities.get(name))
                .orElseThrow(() -> new UnknownPolicyException("priority", name));
    }

    public BindPolicy bindPolicy() {
        return bindPolicy;
    }

    private static <T> Map<String, T> index(String kind, List<T> policies, Function<T, String> name) {
        Map<String, T> byName = new TreeMap<>();
        for (T policy : policies) {
            T previous = byName.put(name.apply(policy), policy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate " + kind + " name '" + name.apply(policy) + "'");
            }
        }
        return Collections.unmodifiableMap(byName);
    }
}
