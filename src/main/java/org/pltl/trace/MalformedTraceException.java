package org.pltl.trace;

/**
 * Traccia o file di campioni non conforme al formato atteso.
 */
public class MalformedTraceException extends IllegalArgumentException {

    public MalformedTraceException(String message) {
        super(message);
    }

    public MalformedTraceException(String message, Throwable cause) {
        super(message, cause);
    }
}
