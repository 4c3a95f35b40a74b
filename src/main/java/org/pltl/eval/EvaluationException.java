package org.pltl.eval;

import org.pltl.formula.Formula;

/**
 * Fallimento di una valutazione: porta la sottoformula e l'istante che l'hanno causato.
 */
public class EvaluationException extends RuntimeException {

    private final Formula formula;
    private final int index;

    public EvaluationException(String message, Formula formula, int index) {
        super(message);
        this.formula = formula;
        this.index = index;
    }

    public Formula getFormula() {
        return formula;
    }

    public int getIndex() {
        return index;
    }
}
