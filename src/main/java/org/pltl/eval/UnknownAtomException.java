package org.pltl.eval;

import org.pltl.formula.Formula;

import java.util.List;

/**
 * Proposizione atomica non dichiarata tra i letterali della traccia valutata.
 */
public class UnknownAtomException extends EvaluationException {

    private final String traceId;

    public UnknownAtomException(Formula atom, int index, String traceId, List<String> literals) {
        super("Proposizione atomica '" + atom.getLabel() + "' non dichiarata nella traccia '" + traceId
                + "' (letterali " + literals + "), istante " + index, atom, index);
        this.traceId = traceId;
    }

    public String getAtom() {
        return getFormula().getLabel();
    }

    public String getTraceId() {
        return traceId;
    }
}
