package org.pltl.formula;

/**
 * OPERATORI PLTL - Insieme chiuso delle etichette dei nodi formula
 *
 * Ogni operatore ha un simbolo testuale e un'arietà fissa. Qualsiasi etichetta
 * che non corrisponde a un simbolo è una proposizione atomica (ATOM, arietà 0).
 *
 * CATEGORIE:
 * • Costanti: TRUE, FALSE
 * • Booleani: ! (unario), &, |, => (binari)
 * • Passato: Y, O, H (unari), S (binario)
 * • Futuro: X, F, G (unari), U (binario)
 */
public enum Operator {

    TRUE("TRUE", "Top", 0),
    FALSE("FALSE", "Bottom", 0),
    ATOM(null, 0),

    NOT("!", 1),
    AND("&", 2),
    OR("|", 2),
    IMPLIES("=>", 2),

    YESTERDAY("Y", 1),
    ONCE("O", 1),
    HISTORICALLY("H", 1),
    SINCE("S", 2),

    NEXT("X", 1),
    EVENTUALLY("F", 1),
    GLOBALLY("G", 1),
    UNTIL("U", 2);

    /** Simbolo testuale (null per ATOM, la cui etichetta è il nome della variabile) */
    private final String symbol;

    /** Grafia alternativa accettata in ingresso (Top, Bottom) */
    private final String alias;

    /** Numero di figli richiesti */
    private final int arity;

    Operator(String symbol, int arity) {
        this(symbol, null, arity);
    }

    Operator(String symbol, String alias, int arity) {
        this.symbol = symbol;
        this.alias = alias;
        this.arity = arity;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getArity() {
        return arity;
    }

    /**
     * Risolve un'etichetta nell'operatore corrispondente.
     *
     * @param label etichetta del nodo (simbolo operatore o nome atomo)
     * @return operatore con quel simbolo o alias, ATOM se nessuno corrisponde
     */
    public static Operator fromLabel(String label) {
        for (Operator operator : values()) {
            if (operator.symbol != null && (operator.symbol.equals(label) || label.equals(operator.alias))) {
                return operator;
            }
        }
        return ATOM;
    }
}
