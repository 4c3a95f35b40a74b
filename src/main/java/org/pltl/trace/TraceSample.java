package org.pltl.trace;

import org.pltl.formula.Formula;
import org.pltl.formula.Operator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * CAMPIONE DI TRACCE - Contenuto di un file di tracce positive e negative
 *
 * Raccoglie l'alfabeto dei letterali, le tracce che una formula deve accettare
 * (positive) e quelle che deve rifiutare (negative), più le sezioni facoltative
 * del formato: operatori ammessi, dimensione e formula obiettivo.
 */
public final class TraceSample {

    private final List<String> literals;
    private final List<Trace> positiveTraces;
    private final List<Trace> negativeTraces;
    private final List<Operator> unaryOperators;
    private final List<Operator> binaryOperators;

    /** Dimensione formula dichiarata, null se assente */
    private final Integer formulaSize;

    /** Formula obiettivo, null se assente */
    private final Formula targetFormula;

    public TraceSample(List<String> literals, List<Trace> positiveTraces, List<Trace> negativeTraces,
                       List<Operator> unaryOperators, List<Operator> binaryOperators,
                       Integer formulaSize, Formula targetFormula) {
        if (literals == null || literals.isEmpty()) {
            throw new MalformedTraceException("Campione di tracce senza letterali");
        }
        this.literals = copyOf(literals);
        this.positiveTraces = copyOf(positiveTraces);
        this.negativeTraces = copyOf(negativeTraces);
        this.unaryOperators = copyOf(unaryOperators);
        this.binaryOperators = copyOf(binaryOperators);
        this.formulaSize = formulaSize;
        this.targetFormula = targetFormula;
    }

    private static <T> List<T> copyOf(List<T> source) {
        return source != null ? Collections.unmodifiableList(new ArrayList<>(source)) : Collections.emptyList();
    }

    public List<String> getLiterals() {
        return literals;
    }

    public List<Trace> getPositiveTraces() {
        return positiveTraces;
    }

    public List<Trace> getNegativeTraces() {
        return negativeTraces;
    }

    public List<Operator> getUnaryOperators() {
        return unaryOperators;
    }

    public List<Operator> getBinaryOperators() {
        return binaryOperators;
    }

    public Integer getFormulaSize() {
        return formulaSize;
    }

    public Formula getTargetFormula() {
        return targetFormula;
    }

    public boolean hasTargetFormula() {
        return targetFormula != null;
    }

    /** Lunghezza massima tra tutte le tracce del campione, 0 se vuoto */
    public int maxTraceLength() {
        int max = 0;
        for (Trace trace : positiveTraces) max = Math.max(max, trace.length());
        for (Trace trace : negativeTraces) max = Math.max(max, trace.length());
        return max;
    }

    @Override
    public String toString() {
        return "TraceSample[literals=" + literals
                + ", positive=" + positiveTraces.size()
                + ", negative=" + negativeTraces.size()
                + (targetFormula != null ? ", target=" + targetFormula : "") + "]";
    }
}
