package org.pltl.eval;

import org.pltl.formula.Formula;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * TABELLA DI VERITÀ - Valore di ogni sottoformula distinta a ogni istante
 *
 * Vista derivata per reporting e debugging: ogni cella è una interrogazione
 * indipendente {@link TraceEvaluator#holds(Formula, int)}. Le righe seguono
 * il post-ordine di {@link Formula#collectAllNodes()}, quindi ogni sottoformula
 * precede le formule che la contengono.
 */
public final class TruthTable {

    private static final Logger LOGGER = Logger.getLogger(TruthTable.class.getName());

    private final Formula formula;
    private final int length;
    private final Map<Formula, boolean[]> rows;

    private TruthTable(Formula formula, int length, Map<Formula, boolean[]> rows) {
        this.formula = formula;
        this.length = length;
        this.rows = rows;
    }

    /**
     * Calcola la tabella per tutte le sottoformule della formula data.
     *
     * @param evaluator valutatore legato alla traccia
     * @param formula formula radice
     * @return tabella completa
     * @throws UnknownAtomException se la formula usa un atomo non dichiarato
     */
    public static TruthTable compute(TraceEvaluator evaluator, Formula formula) {
        int length = evaluator.getTrace().length();
        Map<Formula, boolean[]> rows = new LinkedHashMap<>();

        for (Formula node : formula.collectAllNodes()) {
            boolean[] row = new boolean[length];
            for (int index = 0; index < length; index++) {
                row[index] = evaluator.holds(node, index);
            }
            rows.put(node, row);
        }

        LOGGER.fine("Tabella di verità: " + rows.size() + " sottoformule x " + length + " istanti");
        return new TruthTable(formula, length, rows);
    }

    public Formula getFormula() {
        return formula;
    }

    public int length() {
        return length;
    }

    public List<Formula> nodes() {
        return Collections.unmodifiableList(new ArrayList<>(rows.keySet()));
    }

    /**
     * Valori di una sottoformula a tutti gli istanti (copia).
     *
     * @throws IllegalArgumentException se il nodo non appartiene alla formula
     */
    public boolean[] row(Formula node) {
        boolean[] row = rows.get(node);
        if (row == null) {
            throw new IllegalArgumentException("Sottoformula non presente nella tabella: " + node);
        }
        return Arrays.copyOf(row, row.length);
    }

    public boolean valueAt(Formula node, int index) {
        return row(node)[index];
    }

    /**
     * Griglia testuale: una riga per sottoformula, una colonna per istante.
     */
    public String render() {
        int width = 0;
        for (Formula node : rows.keySet()) {
            width = Math.max(width, node.toString().length());
        }

        StringBuilder result = new StringBuilder();
        result.append(pad("", width)).append(" |");
        for (int index = 0; index < length; index++) {
            result.append(' ').append(index);
        }
        result.append(System.lineSeparator());

        for (Map.Entry<Formula, boolean[]> entry : rows.entrySet()) {
            result.append(pad(entry.getKey().toString(), width)).append(" |");
            for (int index = 0; index < length; index++) {
                String cell = entry.getValue()[index] ? "1" : "0";
                result.append(' ').append(pad(cell, String.valueOf(index).length()));
            }
            result.append(System.lineSeparator());
        }
        return result.toString();
    }

    private static String pad(String text, int width) {
        StringBuilder padded = new StringBuilder(text);
        while (padded.length() < width) {
            padded.append(' ');
        }
        return padded.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
