package org.acme.extender.policy;

import static org.acme.extender.ClusterFixtures.plainNode;
import static org.acme.extender.ClusterFixtures.runningPod;
import static org.acme.extender.ClusterFixtures.scaleNode;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeListBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.acme.extender.config.ExtenderConfig;
import org.acme.extender.dto.ExtenderArgs;
import org.acme.extender.dto.ExtenderBindingArgs;
import org.acme.extender.dto.ExtenderBindingResult;
import org.acme.extender.dto.ExtenderFilterResult;
import org.acme.extender.dto.HostPriority;
import org.acme.extender.index.PodNodeIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ExtenderDispatcher")
class ExtenderDispatcherTest {

    private record Settings(String labelKey, String labelValue, int maxScore) implements ExtenderConfig.GroupScore {
    }

    /**
     * Accepts nodes whose name starts with "ok", cannot evaluate nodes starting with "err".
     */
    private static final NodePredicate BY_NAME = new NodePredicate() {
        @Override
        public String name() {
            return "by_name";
        }

        @Override
        public boolean test(Pod pod, Node node) {
            String name = node.getMetadata().getName();
            if (name.startsWith("err")) {
                throw new PolicyEvaluationException("cannot evaluate " + name);
            }
            return name.startsWith("ok");
        }
    };

    private static final NodePredicate EXPLODING = new NodePredicate() {
        @Override
        public String name() {
            return "exploding";
        }

        @Override
        public boolean test(Pod pod, Node node) {
            throw new IllegalStateException("predicate is broken");
        }
    };

    private final PodNodeIndex index = new PodNodeIndex();
    private final ExtenderDispatcher dispatcher = new ExtenderDispatcher(new PolicyRegistry(
            List.of(new AlwaysTruePredicate(), BY_NAME, EXPLODING),
            List.of(new GroupScorePriority(index, new Settings("group", "Scale", 1000))),
            new DeclineBindPolicy()));

    private static ExtenderArgs withNodes(Node... nodes) {
        return new ExtenderArgs(runningPod("incoming", ""), new NodeListBuilder().withItems(nodes).build(), null);
    }

    @Test
    @DisplayName("always_true keeps every candidate")
    void testAlwaysTrueFilter() {
        ExtenderFilterResult result = dispatcher.filter("always_true", withNodes(plainNode("a"), scaleNode("b", "4", "8Gi")));

        assertEquals(List.of("a", "b"), result.nodeNames());
        assertEquals(2, result.nodes().getItems().size());
        assertTrue(result.failedNodes().isEmpty());
        assertEquals("", result.error());
    }

    @Test
    @DisplayName("Rejections are dropped, evaluation errors are reported per node")
    void testFilterAggregation() {
        ExtenderFilterResult result = dispatcher.filter("by_name",
                withNodes(plainNode("ok-1"), plainNode("no-1"), plainNode("err-1"), plainNode("ok-2")));

        assertEquals(List.of("ok-1", "ok-2"), result.nodeNames());
        assertEquals(Map.of("err-1", "cannot evaluate err-1"), result.failedNodes());
        assertEquals("", result.error());
    }

    @Test
    @DisplayName("Unexpected predicate failures become the top-level error")
    void testPredicateFailure() {
        ExtenderFilterResult result = dispatcher.filter("exploding", withNodes(plainNode("a")));

        assertEquals("predicate is broken", result.error());
        assertNull(result.nodeNames());
    }

    @Test
    @DisplayName("Node-name-only requests are answered with names")
    void testNodeNamesOnly() {
        ExtenderArgs args = new ExtenderArgs(runningPod("incoming", ""), null, List.of("ok-a", "no-b"));

        ExtenderFilterResult result = dispatcher.filter("by_name", args);

        assertNull(result.nodes());
        assertEquals(List.of("ok-a"), result.nodeNames());
    }

    @Test
    @DisplayName("A request without pod is answered with an error")
    void testMissingPod() {
        ExtenderFilterResult result = dispatcher.filter("always_true", new ExtenderArgs(null, null, List.of("a")));

        assertFalse(result.error().isEmpty());
    }

    @Test
    @DisplayName("A request without arguments is answered with an error")
    void testMissingArguments() {
        ExtenderFilterResult result = dispatcher.filter("always_true", null);

        assertFalse(result.error().isEmpty());
        assertEquals(DeclineBindPolicy.MESSAGE, dispatcher.bind(null).error());
    }

    @Test
    @DisplayName("Nodes without metadata are filtered without failing the request")
    void testNodeWithoutMetadata() {
        ExtenderFilterResult accepted = dispatcher.filter("always_true", withNodes(new Node(), plainNode("a")));
        ExtenderFilterResult failed = dispatcher.filter("by_name", withNodes(new Node(), plainNode("ok-1")));

        assertEquals(Arrays.asList(null, "a"), accepted.nodeNames());
        assertEquals("", accepted.error());
        assertEquals(2, accepted.nodes().getItems().size());
        assertFalse(failed.error().isEmpty());
    }

    @Test
    @DisplayName("Unknown policy names are rejected")
    void testUnknownPolicy() {
        assertThrows(UnknownPolicyException.class, () -> dispatcher.filter("nope", withNodes(plainNode("a"))));
        assertThrows(UnknownPolicyException.class, () -> dispatcher.prioritize("nope", withNodes(plainNode("a"))));
    }

    @Test
    @DisplayName("group_score is dispatched with the request's nodes in order")
    void testPrioritize() {
        index.upsert(runningPod("p1", "g", "1", "1Gi"));
        index.upsert(runningPod("p2", "g", "1", "1Gi"));

        List<HostPriority> result = dispatcher.prioritize("group_score",
                withNodes(plainNode("plain"), scaleNode("g", "4", "8Gi")));

        assertEquals(List.of(new HostPriority("plain", 1000), new HostPriority("g", 75)), result);
    }

    @Test
    @DisplayName("Prioritize with node names only scores them as unlabeled nodes")
    void testPrioritizeNodeNames() {
        List<HostPriority> result = dispatcher.prioritize("group_score",
                new ExtenderArgs(runningPod("incoming", ""), null, List.of("x", "y")));

        assertEquals(List.of(new HostPriority("x", 1000), new HostPriority("y", 1000)), result);
    }

    @Test
    @DisplayName("Bind is always answered with an error")
    void testBind() {
        ExtenderBindingResult result = dispatcher.bind(new ExtenderBindingArgs("web", "default", "uid", "n1"));

        assertEquals(DeclineBindPolicy.MESSAGE, result.error());
    }
}
