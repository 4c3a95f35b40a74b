package org.pltl.eval;

import org.pltl.trace.Trace;

/**
 * CURSORE DI VALUTAZIONE - Istante corrente più stato di attraversamento del lasso
 *
 * Il flag loopTaken segue il cammino di ricorsione: ogni sottoformula riceve
 * il cursore del padre, e solo lo spostamento oltre l'ultimo stato lo imposta.
 * Immutabile, quindi condivisibile tra valutazioni concorrenti.
 *
 * SUCCESSORE (politica unica per tutti gli operatori futuri):
 * • i &lt; N-1: i+1
 * • i = N-1, lasso non ancora attraversato: indice di lasso, loopTaken impostato
 * • i = N-1, lasso già attraversato: nessun successore (null)
 */
public final class TracePosition {

    private final int index;
    private final boolean loopTaken;

    private TracePosition(int index, boolean loopTaken) {
        this.index = index;
        this.loopTaken = loopTaken;
    }

    /**
     * Cursore iniziale di una nuova interrogazione: lasso non attraversato.
     */
    public static TracePosition start(int index) {
        return new TracePosition(index, false);
    }

    /**
     * Cursore con stato del lasso esplicito.
     */
    public static TracePosition of(int index, boolean loopTaken) {
        return new TracePosition(index, loopTaken);
    }

    public int getIndex() {
        return index;
    }

    public boolean isLoopTaken() {
        return loopTaken;
    }

    /**
     * Predecessore: null all'istante 0.
     */
    public TracePosition previous() {
        return index > 0 ? new TracePosition(index - 1, loopTaken) : null;
    }

    /**
     * Successore secondo la politica a passaggio singolo sul lasso.
     *
     * @param trace traccia su cui ci si muove
     * @return nuovo cursore, null se il lasso è già stato attraversato
     */
    public TracePosition next(Trace trace) {
        if (index < trace.length() - 1) {
            return new TracePosition(index + 1, loopTaken);
        }
        if (!loopTaken) {
            return new TracePosition(trace.getLassoIndex(), true);
        }
        return null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TracePosition)) return false;
        TracePosition other = (TracePosition) obj;
        return index == other.index && loopTaken == other.loopTaken;
    }

    @Override
    public int hashCode() {
        return 31 * index + (loopTaken ? 1 : 0);
    }

    @Override
    public String toString() {
        return index + (loopTaken ? "'" : "");
    }
}
