package org.acme.extender.policy;

import org.acme.extender.dto.ExtenderBindingArgs;

public interface BindPolicy {

    /**
     * @throws BindingNotSupportedException if this policy does not bind pods
     */
    void bind(ExtenderBindingArgs args);
}
