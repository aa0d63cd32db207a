package org.acme.extender.policy;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.Pod;
import java.util.List;
import org.acme.extender.dto.HostPriority;

/**
 * Named scoring function. The result holds exactly one entry per input node, in input order.
 */
public interface NodePriority {

    String name();

    List<HostPriority> prioritize(Pod pod, List<Node> nodes);
}
