package org.acme.extender.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HostPriority(
        @JsonProperty("Host") String host,
        @JsonProperty("Score") long score) {
}
