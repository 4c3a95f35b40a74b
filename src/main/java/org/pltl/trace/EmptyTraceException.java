package org.pltl.trace;

/**
 * Traccia senza stati: una traccia deve avere almeno un istante.
 */
public class EmptyTraceException extends MalformedTraceException {

    public EmptyTraceException(String traceId) {
        super("Traccia '" + traceId + "' senza stati");
    }
}
