package org.acme.extender.policy;

public class UnknownPolicyException extends RuntimeException {

    public UnknownPolicyException(String kind, String name) {
        super("No " + kind + " registered under '" + name + "'");
    }
}
