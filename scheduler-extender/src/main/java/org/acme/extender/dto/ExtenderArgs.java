package org.acme.extender.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeList;
import io.fabric8.kubernetes.api.model.Pod;
import java.util.List;

/**
 * Filter and prioritize request. The scheduler sends full {@code Nodes} unless it is configured
 * as node-cache capable, in which case only {@code NodeNames} is populated.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtenderArgs(
        @JsonProperty("Pod") @JsonAlias("pod") Pod pod,
        @JsonProperty("Nodes") @JsonAlias("nodes") NodeList nodes,
        @JsonProperty("NodeNames") @JsonAlias("nodenames") List<String> nodeNames) {

    public boolean hasNodeObjects() {
        return nodes != null && nodes.getItems() != null;
    }

    public List<Node> nodeItems() {
        return hasNodeObjects() ? nodes.getItems() : List.of();
    }
}
