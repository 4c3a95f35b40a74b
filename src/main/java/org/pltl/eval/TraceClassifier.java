package org.pltl.eval;

import org.pltl.formula.Formula;
import org.pltl.trace.Trace;
import org.pltl.trace.TraceSample;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * CLASSIFICATORE DI TRACCE - Verifica una formula contro tracce positive e negative
 *
 * Una formula separa correttamente il campione quando vale su ogni traccia
 * positiva e non vale su nessuna traccia negativa, secondo il criterio scelto
 * ({@link ClassificationMode}).
 */
public class TraceClassifier {

    private static final Logger LOGGER = Logger.getLogger(TraceClassifier.class.getName());

    private final ClassificationMode mode;

    public TraceClassifier() {
        this(ClassificationMode.AT_START);
    }

    public TraceClassifier(ClassificationMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("Modalità di classificazione non può essere null");
        }
        this.mode = mode;
    }

    public ClassificationMode getMode() {
        return mode;
    }

    /**
     * Classifica le tracce di un campione.
     *
     * @param formula formula candidata
     * @param sample campione con tracce positive e negative
     * @return esito con le tracce classificate male
     * @throws UnknownAtomException se la formula usa un atomo non dichiarato nel campione
     */
    public ClassificationResult classify(Formula formula, TraceSample sample) {
        return classify(formula, sample.getPositiveTraces(), sample.getNegativeTraces());
    }

    public ClassificationResult classify(Formula formula, List<Trace> positives, List<Trace> negatives) {
        List<String> rejectedPositives = new ArrayList<>();
        List<String> acceptedNegatives = new ArrayList<>();

        for (Trace trace : positives) {
            if (satisfies(formula, trace)) {
                LOGGER.fine(formula + " traccia positiva " + trace.getId() + " SAT");
            } else {
                LOGGER.warning(formula + " traccia positiva " + trace.getId() + " UNSAT");
                rejectedPositives.add(trace.getId());
            }
        }

        for (Trace trace : negatives) {
            if (satisfies(formula, trace)) {
                LOGGER.warning(formula + " traccia negativa " + trace.getId() + " SAT");
                acceptedNegatives.add(trace.getId());
            } else {
                LOGGER.fine(formula + " traccia negativa " + trace.getId() + " UNSAT");
            }
        }

        ClassificationResult result = new ClassificationResult(formula, mode, positives.size(), negatives.size(),
                rejectedPositives, acceptedNegatives);
        LOGGER.info("Classificazione completata: " + result);
        return result;
    }

    private boolean satisfies(Formula formula, Trace trace) {
        TraceEvaluator evaluator = new TraceEvaluator(trace);
        return switch (mode) {
            case AT_START -> evaluator.holdsAtStart(formula);
            case THROUGHOUT -> evaluator.holdsThroughout(formula);
        };
    }
}
