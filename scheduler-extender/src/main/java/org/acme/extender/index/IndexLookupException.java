package org.acme.extender.index;

public class IndexLookupException extends RuntimeException {

    public IndexLookupException(String message) {
        super(message);
    }
}
