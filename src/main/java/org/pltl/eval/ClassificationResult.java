package org.pltl.eval;

import org.pltl.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ESITO CLASSIFICAZIONE - Tracce positive rifiutate e negative accettate da una formula
 *
 * La formula è coerente con il campione quando entrambe le liste sono vuote.
 */
public final class ClassificationResult {

    private final Formula formula;
    private final ClassificationMode mode;
    private final int positiveCount;
    private final int negativeCount;

    /** Id delle tracce positive su cui la formula è falsa */
    private final List<String> rejectedPositives;

    /** Id delle tracce negative su cui la formula è vera */
    private final List<String> acceptedNegatives;

    public ClassificationResult(Formula formula, ClassificationMode mode, int positiveCount, int negativeCount,
                                List<String> rejectedPositives, List<String> acceptedNegatives) {
        this.formula = formula;
        this.mode = mode;
        this.positiveCount = positiveCount;
        this.negativeCount = negativeCount;
        this.rejectedPositives = Collections.unmodifiableList(new ArrayList<>(rejectedPositives));
        this.acceptedNegatives = Collections.unmodifiableList(new ArrayList<>(acceptedNegatives));
    }

    public Formula getFormula() {
        return formula;
    }

    public ClassificationMode getMode() {
        return mode;
    }

    public int getPositiveCount() {
        return positiveCount;
    }

    public int getNegativeCount() {
        return negativeCount;
    }

    public List<String> getRejectedPositives() {
        return rejectedPositives;
    }

    public List<String> getAcceptedNegatives() {
        return acceptedNegatives;
    }

    public boolean isConsistent() {
        return rejectedPositives.isEmpty() && acceptedNegatives.isEmpty();
    }

    /** Numero di tracce classificate correttamente */
    public int correctCount() {
        return positiveCount + negativeCount - rejectedPositives.size() - acceptedNegatives.size();
    }

    @Override
    public String toString() {
        return String.format("%s [%s]: %d/%d corrette, positive rifiutate=%s, negative accettate=%s",
                formula, mode, correctCount(), positiveCount + negativeCount, rejectedPositives, acceptedNegatives);
    }
}
