package org.acme.extender.index;

import io.fabric8.kubernetes.api.model.Pod;
import java.util.List;

/**
 * Read side of the pod index, as consumed by scoring policies.
 */
@FunctionalInterface
public interface NodePodSource {

    /**
     * @param nodeName node to look up
     * @return immutable snapshot of the active pods currently indexed under the node
     * @throws IndexLookupException if the index cannot answer for this node
     */
    List<Pod> podsOnNode(String nodeName);
}
