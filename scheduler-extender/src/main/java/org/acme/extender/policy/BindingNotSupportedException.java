package org.acme.extender.policy;

public class BindingNotSupportedException extends RuntimeException {

    public BindingNotSupportedException(String message) {
        super(message);
    }
}
