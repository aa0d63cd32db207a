package org.acme.extender.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtenderBindingArgs(
        @JsonProperty("PodName") @JsonAlias("podName") String podName,
        @JsonProperty("PodNamespace") @JsonAlias("podNamespace") String podNamespace,
        @JsonProperty("PodUID") @JsonAlias("podUID") String podUid,
        @JsonProperty("Node") @JsonAlias("node") String node) {
}
