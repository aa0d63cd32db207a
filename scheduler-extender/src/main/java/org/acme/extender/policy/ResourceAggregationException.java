package org.acme.extender.policy;

public class ResourceAggregationException extends RuntimeException {

    public ResourceAggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
