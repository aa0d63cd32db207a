package org.acme.extender.policy;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Quantity;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.acme.extender.config.ExtenderConfig;
import org.acme.extender.dto.HostPriority;
import org.acme.extender.index.IndexLookupException;
import org.acme.extender.index.NodePodSource;

/**
 * Scores nodes of the configured group by how much of their capacity is already requested.
 * <p>
 * Nodes outside the group keep the maximum score. For a group node the score is
 * {@code (cpuRequested / cpuCapacity + memoryRequested / memoryCapacity) * 100}, truncated. The
 * sum is not averaged. A node whose pods cannot be read scores 0 without affecting
 * the other nodes of the request.
 */
@ApplicationScoped
public class GroupScorePriority implements NodePriority {

    public static final String NAME = "group_score";

    private static final BigDecimal MULTIPLIER = BigDecimal.valueOf(100);

    private final NodePodSource pods;
    private final ExtenderConfig.GroupScore settings;

    @Inject
    public GroupScorePriority(NodePodSource pods, ExtenderConfig config) {
        this(pods, config.groupScore());
    }

    GroupScorePriority(NodePodSource pods, ExtenderConfig.GroupScore settings) {
        this.pods = pods;
        this.settings = settings;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<HostPriority> prioritize(Pod pod, List<Node> nodes) {
        List<HostPriority> priorities = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            String nodeName = node.getMetadata() == null ? null : node.getMetadata().getName();
            long score = inGroup(node) ? utilizationScore(nodeName, node) : settings.maxScore();
            Log.debugf("score for %s %d", nodeName, score);
            priorities.add(new HostPriority(nodeName, score));
        }
        return priorities;
    }

    private boolean inGroup(Node node) {
        Map<String, String> labels = node.getMetadata() == null ? null : node.getMetadata().getLabels();
        return labels != null && settings.labelValue().equals(labels.get(settings.labelKey()));
    }

    private long utilizationScore(String nodeName, Node node) {
        ResourceTotals requested;
        try {
            requested = ResourceAggregator.sumRequests(pods.podsOnNode(nodeName));
        } catch (IndexLookupException | ResourceAggregationException e) {
            Log.warnf("Scoring node %s as 0: %s", nodeName, e.getMessage());
            return 0;
        }
        Map<String, Quantity> capacity = Optional.ofNullable(node.getStatus())
                .map(status -> status.getCapacity())
                .orElse(Map.of());

        BigDecimal utilization;
        try {
            utilization = ratio(requested.cpu(), capacity.get(ResourceAggregator.CPU))
                    .add(ratio(requested.memory(), capacity.get(ResourceAggregator.MEMORY)));
        } catch (ResourceAggregationException e) {
            Log.warnf("Scoring node %s as 0: capacity %s", nodeName, e.getMessage());
            return 0;
        }
        long score = utilization.multiply(MULTIPLIER).setScale(0, RoundingMode.DOWN).longValueExact();
        return Math.max(0, Math.min(settings.maxScore(), score));
    }

    /**
     * A resource without a positive capacity contributes nothing.
     */
    private static BigDecimal ratio(BigDecimal requested, Quantity capacity) {
        BigDecimal total = ResourceAggregator.amount(capacity);
        if (total.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return requested.divide(total, MathContext.DECIMAL64);
    }
}
