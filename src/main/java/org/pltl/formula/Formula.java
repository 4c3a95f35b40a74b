package org.pltl.formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * FORMULA PLTL - Albero binario immutabile di una formula temporale
 *
 * Ogni nodo porta un'etichetta (simbolo operatore o nome di proposizione atomica)
 * e fino a due figli. Gli operatori unari usano solo il figlio sinistro.
 *
 * INVARIANTI:
 * • L'arietà del nodo (figli non null) coincide con quella dell'operatore
 * • Le foglie atomiche hanno etichetta arbitraria diversa dai simboli operatore
 * • Nessuna condivisione mutabile: i nodi non cambiano dopo la costruzione
 * • Uguaglianza strutturale su etichetta e figli
 *
 * Gli operatori derivati (F, G) vengono riscritti in U e ! da {@link #expandDerived()}
 * costruendo nodi nuovi, senza toccare l'albero originale.
 */
public final class Formula {

    private static final Logger LOGGER = Logger.getLogger(Formula.class.getName());

    //region COSTANTI CONDIVISE

    public static final Formula TRUE = new Formula(Operator.TRUE.getSymbol(), null, null);
    public static final Formula FALSE = new Formula(Operator.FALSE.getSymbol(), null, null);

    //endregion

    //region STRUTTURA DATI

    /** Operatore risolto dall'etichetta */
    private final Operator operator;

    /** Simbolo dell'operatore o nome della variabile atomica */
    private final String label;

    /** Primo operando (unari e binari) */
    private final Formula left;

    /** Secondo operando (solo binari) */
    private final Formula right;

    /** Hash strutturale calcolato una volta sola */
    private final int hash;

    //endregion

    //region COSTRUZIONE E VALIDAZIONE

    /**
     * Costruisce un nodo a partire dall'etichetta e dai figli.
     *
     * L'operatore viene risolto dall'etichetta: un simbolo noto produce il relativo
     * operatore, qualunque altra stringa una proposizione atomica.
     *
     * @param label etichetta del nodo (non null, non vuota)
     * @param left primo figlio o null
     * @param right secondo figlio o null
     * @throws MalformedFormulaException se i figli non rispettano l'arietà dell'etichetta
     */
    public Formula(String label, Formula left, Formula right) {
        if (label == null || label.trim().isEmpty()) {
            throw new MalformedFormulaException("Etichetta formula non può essere null o vuota");
        }

        String trimmed = label.trim();
        this.operator = Operator.fromLabel(trimmed);
        // gli alias (Top, Bottom) si riducono al simbolo canonico
        this.label = operator == Operator.ATOM ? trimmed : operator.getSymbol();
        this.left = left;
        this.right = right;

        validateArity();
        this.hash = Objects.hash(this.label, left, right);
    }

    private void validateArity() {
        int arity = operator.getArity();

        boolean consistent = switch (arity) {
            case 0 -> left == null && right == null;
            case 1 -> left != null && right == null;
            default -> left != null && right != null;
        };

        if (!consistent) {
            int children = (left != null ? 1 : 0) + (right != null ? 1 : 0);
            String subject = operator == Operator.ATOM ? "proposizione atomica '" + label + "'" : "operatore '" + label + "'";
            throw new MalformedFormulaException("Arietà non valida per " + subject
                    + ": attesi " + arity + " figli, ricevuti " + children);
        }
    }

    //endregion

    //region FACTORY METHODS

    public static Formula atom(String name) {
        Formula formula = new Formula(name, null, null);
        if (formula.operator != Operator.ATOM) {
            throw new MalformedFormulaException("Nome riservato a un operatore: " + name);
        }
        return formula;
    }

    public static Formula constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Costruisce un nodo con operatore esplicito.
     *
     * @throws MalformedFormulaException se operator è ATOM o l'arietà non coincide
     */
    public static Formula of(Operator operator, Formula left, Formula right) {
        if (operator == Operator.ATOM) {
            throw new MalformedFormulaException("ATOM richiede un nome: usare Formula.atom(name)");
        }
        return new Formula(operator.getSymbol(), left, right);
    }

    public static Formula not(Formula operand) {
        return of(Operator.NOT, operand, null);
    }

    public static Formula and(Formula left, Formula right) {
        return of(Operator.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return of(Operator.OR, left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return of(Operator.IMPLIES, left, right);
    }

    public static Formula yesterday(Formula operand) {
        return of(Operator.YESTERDAY, operand, null);
    }

    public static Formula once(Formula operand) {
        return of(Operator.ONCE, operand, null);
    }

    public static Formula historically(Formula operand) {
        return of(Operator.HISTORICALLY, operand, null);
    }

    public static Formula since(Formula left, Formula right) {
        return of(Operator.SINCE, left, right);
    }

    public static Formula next(Formula operand) {
        return of(Operator.NEXT, operand, null);
    }

    public static Formula eventually(Formula operand) {
        return of(Operator.EVENTUALLY, operand, null);
    }

    public static Formula globally(Formula operand) {
        return of(Operator.GLOBALLY, operand, null);
    }

    public static Formula until(Formula left, Formula right) {
        return of(Operator.UNTIL, left, right);
    }

    //endregion

    //region ACCESSO

    public Operator getOperator() {
        return operator;
    }

    public String getLabel() {
        return label;
    }

    public Formula getLeft() {
        return left;
    }

    public Formula getRight() {
        return right;
    }

    public boolean isLeaf() {
        return left == null && right == null;
    }

    public boolean isAtom() {
        return operator == Operator.ATOM;
    }

    //endregion

    //region RISCRITTURA OPERATORI DERIVATI

    /**
     * Espande di un livello gli operatori derivati.
     *
     * RISCRITTURE:
     * • F(f) -> U(TRUE, f)
     * • G(f) -> !(F(!(f)))
     * • qualsiasi altro nodo -> se stesso
     *
     * @return formula equivalente con operatore radice non derivato (G passa per F)
     */
    public Formula expandDerived() {
        return switch (operator) {
            case EVENTUALLY -> until(TRUE, left);
            case GLOBALLY -> not(eventually(not(left)));
            default -> this;
        };
    }

    //endregion

    //region ATTRAVERSAMENTO

    /**
     * Raccoglie tutti i nodi distinti della formula in post-ordine.
     * Sottoformule strutturalmente identiche compaiono una sola volta.
     *
     * @return insieme ordinato (figli prima dei padri) non modificabile
     */
    public Set<Formula> collectAllNodes() {
        Set<Formula> nodes = new LinkedHashSet<>();
        collectPostOrder(nodes);
        LOGGER.finest("Nodi distinti raccolti per " + this + ": " + nodes.size());
        return Collections.unmodifiableSet(nodes);
    }

    private void collectPostOrder(Set<Formula> nodes) {
        if (left != null) left.collectPostOrder(nodes);
        if (right != null) right.collectPostOrder(nodes);
        nodes.add(this);
    }

    /**
     * Nomi delle proposizioni atomiche nell'ordine di prima occorrenza.
     */
    public List<String> atoms() {
        List<String> names = new ArrayList<>();
        for (Formula node : collectAllNodes()) {
            if (node.isAtom() && !names.contains(node.label)) {
                names.add(node.label);
            }
        }
        return names;
    }

    /** Numero di nodi dell'albero, duplicati inclusi */
    public int size() {
        int count = 1;
        if (left != null) count += left.size();
        if (right != null) count += right.size();
        return count;
    }

    /** Profondità dell'albero: 0 per le foglie */
    public int depth() {
        int leftDepth = left != null ? left.depth() : -1;
        int rightDepth = right != null ? right.depth() : -1;
        return 1 + Math.max(leftDepth, rightDepth);
    }

    //endregion

    //region UGUAGLIANZA E HASH

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Formula)) return false;

        Formula other = (Formula) obj;
        return hash == other.hash
                && label.equals(other.label)
                && Objects.equals(left, other.left)
                && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Rappresentazione in sintassi prefissa, rileggibile da {@link FormulaParser}.
     *
     * FORMATO:
     * • Foglie: nome atomo, TRUE, FALSE
     * • Unari: op(f) es. G(p), !(q)
     * • Binari: op(f,g) es. U(p,q)
     */
    @Override
    public String toString() {
        return switch (operator.getArity()) {
            case 0 -> label;
            case 1 -> label + "(" + left + ")";
            default -> label + "(" + left + "," + right + ")";
        };
    }

    //endregion
}
