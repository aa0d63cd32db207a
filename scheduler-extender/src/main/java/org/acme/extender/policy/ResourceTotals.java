package org.acme.extender.policy;

import java.math.BigDecimal;

/**
 * Requested CPU in cores and memory in bytes.
 */
public record ResourceTotals(BigDecimal cpu, BigDecimal memory) {

    public static final ResourceTotals ZERO = new ResourceTotals(BigDecimal.ZERO, BigDecimal.ZERO);

    public ResourceTotals plus(BigDecimal extraCpu, BigDecimal extraMemory) {
        return new ResourceTotals(cpu.add(extraCpu), memory.add(extraMemory));
    }
}
