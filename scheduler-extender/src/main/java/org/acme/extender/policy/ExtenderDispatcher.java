package org.acme.extender.policy;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeBuilder;
import io.fabric8.kubernetes.api.model.NodeList;
import io.fabric8.kubernetes.api.model.NodeListBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.acme.extender.dto.ExtenderArgs;
import org.acme.extender.dto.ExtenderBindingArgs;
import org.acme.extender.dto.ExtenderBindingResult;
import org.acme.extender.dto.ExtenderFilterResult;
import org.acme.extender.dto.HostPriority;

/**
 * Runs the named policy against a decoded extender request and builds the protocol result.
 * Policy failures end up in the result, never as exceptions, except for unknown policy names.
 */
@ApplicationScoped
public class ExtenderDispatcher {

    private final PolicyRegistry registry;

    @Inject
    public ExtenderDispatcher(PolicyRegistry registry) {
        this.registry = registry;
    }

    public ExtenderFilterResult filter(String name, ExtenderArgs args) {
        NodePredicate predicate = registry.predicate(name);
        if (args == null || args.pod() == null) {
            return ExtenderFilterResult.error("Filter request carries no pod");
        }
        List<Node> accepted = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        try {
            for (Node node : candidates(args)) {
                try {
                    if (predicate.test(args.pod(), node)) {
                        accepted.add(node);
                    }
                } catch (PolicyEvaluationException e) {
                    failed.put(Objects.toString(nodeName(node), ""), e.getMessage());
                }
            }
        } catch (RuntimeException e) {
            Log.warnf(e, "Predicate %s failed for pod %s", name, podName(args.pod()));
            return ExtenderFilterResult.error(String.valueOf(e.getMessage()));
        }

        List<String> acceptedNames = accepted.stream().map(ExtenderDispatcher::nodeName).toList();
        Log.debugf("Predicate %s for pod %s accepted %s, failed %s", name, podName(args.pod()), acceptedNames, failed.keySet());
        NodeList nodes = args.hasNodeObjects() ? new NodeListBuilder().withItems(accepted).build() : null;
        return new ExtenderFilterResult(nodes, acceptedNames, failed, Map.of(), "");
    }

    public List<HostPriority> prioritize(String name, ExtenderArgs args) {
        NodePriority priority = registry.priority(name);
        List<HostPriority> result = priority.prioritize(args.pod(), candidates(args));
        Log.debugf("Priority %s for pod %s: %s", name, podName(args.pod()), result);
        return result;
    }

    public ExtenderBindingResult bind(ExtenderBindingArgs args) {
        try {
            registry.bindPolicy().bind(args);
        } catch (BindingNotSupportedException e) {
            return new ExtenderBindingResult(e.getMessage());
        }
        return new ExtenderBindingResult("");
    }

    /**
     * Full node objects when the scheduler sent them, otherwise name-only nodes.
     */
    private static List<Node> candidates(ExtenderArgs args) {
        if (args.hasNodeObjects()) {
            return args.nodeItems();
        }
        if (args.nodeNames() == null) {
            return List.of();
        }
        return args.nodeNames().stream()
                .map(nodeName -> new NodeBuilder().withNewMetadata().withName(nodeName).endMetadata().build())
                .toList();
    }

    private static String nodeName(Node node) {
        return node == null || node.getMetadata() == null ? null : node.getMetadata().getName();
    }

    private static String podName(Pod pod) {
        if (pod == null || pod.getMetadata() == null) {
            return "<none>";
        }
        return pod.getMetadata().getNamespace() + "/" + pod.getMetadata().getName();
    }
}
