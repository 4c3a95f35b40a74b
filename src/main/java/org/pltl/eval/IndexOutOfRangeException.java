package org.pltl.eval;

import org.pltl.formula.Formula;

/**
 * Istante di valutazione fuori da [0, length).
 */
public class IndexOutOfRangeException extends EvaluationException {

    private final int length;

    public IndexOutOfRangeException(Formula formula, int index, int length) {
        super("Istante " + index + " fuori da [0, " + length + ") valutando " + formula, formula, index);
        this.length = length;
    }

    public int getLength() {
        return length;
    }
}
