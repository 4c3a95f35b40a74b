package org.pltl.eval;

/**
 * Criterio con cui una traccia soddisfa una formula durante la classificazione.
 */
public enum ClassificationMode {

    /** La formula vale all'istante 0 ({@link TraceEvaluator#holdsAtStart}) */
    AT_START,

    /** La formula vale in ogni istante ({@link TraceEvaluator#holdsThroughout}) */
    THROUGHOUT
}
