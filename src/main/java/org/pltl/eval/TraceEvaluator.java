package org.pltl.eval;

import org.pltl.formula.Formula;
import org.pltl.trace.Trace;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * VALUTATORE DI TRACCE - Verità di una formula PLTL su una traccia lasso
 *
 * Discesa ricorsiva sull'albero della formula e, per gli operatori temporali,
 * sugli istanti della traccia.
 *
 * SEMANTICA (istante i, lunghezza N):
 * • TRUE, FALSE: costanti; atomi: valore nella tabella della traccia
 * • !, &amp;, |, =&gt;: connettivi booleani sullo stesso istante
 * • Y, O, H, S: ricorsione all'indietro fino all'istante 0 (sempre terminante)
 * • X, U: ricorsione in avanti tramite {@link TracePosition#next(Trace)},
 *   che attraversa il lasso al massimo una volta per cammino
 * • F, G: riscritti in U e ! da {@link Formula#expandDerived()}
 *
 * Ogni interrogazione pubblica parte da un cursore con lasso non attraversato
 * e usa una propria tabella di memoizzazione su (sottoformula, cursore).
 * Il valutatore non ha stato mutabile condiviso.
 */
public class TraceEvaluator {

    private static final Logger LOGGER = Logger.getLogger(TraceEvaluator.class.getName());

    private final Trace trace;

    public TraceEvaluator(Trace trace) {
        this.trace = Objects.requireNonNull(trace, "Traccia non può essere null");
    }

    public Trace getTrace() {
        return trace;
    }

    //region INTERROGAZIONI PUBBLICHE

    /**
     * Verità della formula all'istante indicato, con lasso non ancora attraversato.
     *
     * @param formula formula da valutare
     * @param index istante in [0, length)
     * @return valore di verità
     * @throws IndexOutOfRangeException se l'istante non appartiene alla traccia
     * @throws UnknownAtomException se la formula usa un atomo non dichiarato
     */
    public boolean holds(Formula formula, int index) {
        return holds(formula, TracePosition.start(index));
    }

    /**
     * Verità della formula su un cursore esplicito (istante e stato del lasso).
     *
     * @param formula formula da valutare
     * @param position cursore di partenza
     * @return valore di verità
     * @throws IndexOutOfRangeException se l'istante non appartiene alla traccia
     * @throws UnknownAtomException se la formula usa un atomo non dichiarato
     */
    public boolean holds(Formula formula, TracePosition position) {
        Objects.requireNonNull(formula, "Formula non può essere null");
        Objects.requireNonNull(position, "Posizione non può essere null");

        int index = position.getIndex();
        if (index < 0 || index >= trace.length()) {
            throw new IndexOutOfRangeException(formula, index, trace.length());
        }
        checkAtomsDeclared(formula, index);

        boolean result = new Query().evaluate(formula, position);

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("%s @ %s su traccia %s -> %s", formula, position, trace.getId(), result));
        }
        return result;
    }

    /**
     * Verità della formula da ogni istante della traccia.
     * Ogni istante è un'interrogazione indipendente con lasso non attraversato.
     *
     * @param formula formula da valutare
     * @return true se la formula vale in tutti gli istanti
     */
    public boolean holdsThroughout(Formula formula) {
        for (int index = 0; index < trace.length(); index++) {
            if (!holds(formula, index)) {
                LOGGER.finer(() -> formula + " fallisce sulla traccia " + trace.getId());
                return false;
            }
        }
        return true;
    }

    /**
     * Verità della formula letta dall'inizio della traccia: criterio usato
     * per classificare tracce positive e negative.
     */
    public boolean holdsAtStart(Formula formula) {
        return holds(formula, TracePosition.start(0));
    }

    //endregion

    //region VALIDAZIONE

    /**
     * Gli atomi vengono verificati prima di valutare, così nessun cortocircuito
     * booleano nasconde un letterale mancante.
     */
    private void checkAtomsDeclared(Formula formula, int index) {
        for (Formula node : formula.collectAllNodes()) {
            if (node.isAtom() && !trace.hasLiteral(node.getLabel())) {
                throw new UnknownAtomException(node, index, trace.getId(), trace.getLiterals());
            }
        }
    }

    //endregion

    //region VALUTAZIONE RICORSIVA

    /**
     * Singola interrogazione: tabella di memoizzazione valida solo al suo interno.
     */
    private final class Query {

        private final Map<Formula, Map<TracePosition, Boolean>> memo = new HashMap<>();

        boolean evaluate(Formula formula, TracePosition position) {
            Map<TracePosition, Boolean> values = memo.get(formula);
            if (values != null) {
                Boolean cached = values.get(position);
                if (cached != null) {
                    return cached;
                }
            }

            boolean result = evaluateOperator(formula, position);

            // put dopo la ricorsione: le chiamate annidate modificano la mappa
            memo.computeIfAbsent(formula, key -> new HashMap<>()).put(position, result);
            return result;
        }

        private boolean evaluateOperator(Formula formula, TracePosition position) {
            Formula left = formula.getLeft();
            Formula right = formula.getRight();

            return switch (formula.getOperator()) {
                case TRUE -> true;
                case FALSE -> false;
                case ATOM -> lookup(formula, position.getIndex());

                case NOT -> !evaluate(left, position);
                case AND -> evaluate(left, position) && evaluate(right, position);
                case OR -> evaluate(left, position) || evaluate(right, position);
                case IMPLIES -> !evaluate(left, position) || evaluate(right, position);

                case YESTERDAY -> {
                    TracePosition previous = position.previous();
                    yield previous != null && evaluate(left, previous);
                }
                case ONCE -> {
                    TracePosition previous = position.previous();
                    yield evaluate(left, position) || (previous != null && evaluate(formula, previous));
                }
                case HISTORICALLY -> {
                    TracePosition previous = position.previous();
                    yield evaluate(left, position) && (previous == null || evaluate(formula, previous));
                }
                case SINCE -> {
                    TracePosition previous = position.previous();
                    yield evaluate(right, position)
                            || (previous != null && evaluate(left, position) && evaluate(formula, previous));
                }

                case NEXT -> {
                    TracePosition next = position.next(trace);
                    yield next != null && evaluate(left, next);
                }
                case UNTIL -> {
                    if (evaluate(right, position)) {
                        yield true;
                    }
                    if (!evaluate(left, position)) {
                        yield false;
                    }
                    TracePosition next = position.next(trace);
                    yield next != null && evaluate(formula, next);
                }
                case EVENTUALLY, GLOBALLY -> evaluate(formula.expandDerived(), position);
            };
        }

        private boolean lookup(Formula atom, int index) {
            if (!trace.hasLiteral(atom.getLabel())) {
                throw new UnknownAtomException(atom, index, trace.getId(), trace.getLiterals());
            }
            return trace.valueOf(atom.getLabel(), index);
        }
    }

    //endregion
}
