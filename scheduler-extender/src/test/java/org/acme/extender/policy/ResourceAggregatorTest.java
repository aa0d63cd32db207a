package org.acme.extender.policy;

import static org.acme.extender.ClusterFixtures.runningPod;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Quantity;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ResourceAggregator")
class ResourceAggregatorTest {

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), () -> "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("Sums requests of every container of every pod")
    void testSumsAllContainers() {
        Pod multi = runningPod("multi", "n1", "1", "1Gi");
        multi.getSpec().getContainers().add(new ContainerBuilder()
                .withName("sidecar")
                .withNewResources()
                    .addToRequests("cpu", new Quantity("250m"))
                    .addToRequests("memory", new Quantity("512Mi"))
                    .addToLimits("cpu", new Quantity("4"))
                .endResources()
                .build());

        ResourceTotals totals = ResourceAggregator.sumRequests(List.of(multi, runningPod("single", "n1", "1", "1Gi")));

        assertAmount("2.25", totals.cpu());
        assertAmount(String.valueOf(2L * 1024 * 1024 * 1024 + 512L * 1024 * 1024), totals.memory());
    }

    @Test
    @DisplayName("Pods without requests contribute nothing")
    void testNoRequests() {
        Pod bare = runningPod("bare", "n1");
        Pod noSpec = runningPod("no-spec", "n1");
        noSpec.setSpec(null);

        ResourceTotals totals = ResourceAggregator.sumRequests(List.of(bare, noSpec));

        assertAmount("0", totals.cpu());
        assertAmount("0", totals.memory());
        assertEquals(ResourceTotals.ZERO, ResourceAggregator.sumRequests(List.of()));
    }

    @Test
    @DisplayName("Limits are never used as a fallback")
    void testLimitsIgnored() {
        Pod limitsOnly = new io.fabric8.kubernetes.api.model.PodBuilder(runningPod("limits", "n1"))
                .editSpec()
                    .editFirstContainer()
                        .withNewResources()
                            .addToLimits("cpu", new Quantity("2"))
                            .addToLimits("memory", new Quantity("2Gi"))
                        .endResources()
                    .endContainer()
                .endSpec()
                .build();

        ResourceTotals totals = ResourceAggregator.sumRequests(List.of(limitsOnly));

        assertAmount("0", totals.cpu());
        assertAmount("0", totals.memory());
    }

    @Test
    @DisplayName("Decimal and binary suffixes convert to base units")
    void testQuantityConversion() {
        assertAmount("0.1", ResourceAggregator.amount(new Quantity("100m")));
        assertAmount("3", ResourceAggregator.amount(new Quantity("3")));
        assertAmount("1000000000", ResourceAggregator.amount(new Quantity("1G")));
        assertAmount("1073741824", ResourceAggregator.amount(new Quantity("1Gi")));
        assertAmount("0", ResourceAggregator.amount(null));
    }

    @Test
    @DisplayName("Unreadable quantities are reported")
    void testUnreadableQuantity() {
        assertThrows(ResourceAggregationException.class, () -> ResourceAggregator.amount(new Quantity("lots", null)));
    }
}
