package org.acme.extender.policy;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Quantity;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sums explicit container requests. Limits are ignored and nothing is defaulted, in line with
 * the scheduler's own request-based accounting.
 */
public final class ResourceAggregator {

    static final String CPU = "cpu";
    static final String MEMORY = "memory";

    private ResourceAggregator() {
    }

    public static ResourceTotals sumRequests(Collection<Pod> pods) {
        ResourceTotals totals = ResourceTotals.ZERO;
        for (Pod pod : pods) {
            for (Container container : containers(pod)) {
                Map<String, Quantity> requests = requests(container);
                totals = totals.plus(amount(requests.get(CPU)), amount(requests.get(MEMORY)));
            }
        }
        return totals;
    }

    /**
     * Converts a quantity to base units (cores, bytes) without rounding. Absent means zero.
     */
    public static BigDecimal amount(Quantity quantity) {
        if (quantity == null || quantity.getAmount() == null || quantity.getAmount().isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return quantity.getNumericalAmount();
        } catch (ArithmeticException | IllegalArgumentException e) {
            throw new ResourceAggregationException(
                    "Unreadable quantity '" + quantity.getAmount() + Optional.ofNullable(quantity.getFormat()).orElse("") + "'", e);
        }
    }

    private static List<Container> containers(Pod pod) {
        if (pod.getSpec() == null || pod.getSpec().getContainers() == null) {
            return List.of();
        }
        return pod.getSpec().getContainers();
    }

    private static Map<String, Quantity> requests(Container container) {
        return Optional.ofNullable(container.getResources())
                .map(resources -> resources.getRequests())
                .orElse(Map.of());
    }
}
