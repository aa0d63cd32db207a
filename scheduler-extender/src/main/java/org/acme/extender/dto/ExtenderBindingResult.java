package org.acme.extender.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExtenderBindingResult(
        @JsonProperty("Error") String error) {
}
