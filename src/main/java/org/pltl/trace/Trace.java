package org.pltl.trace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * TRACCIA LASSO - Sequenza finita di stati con arco di ritorno
 *
 * Ogni istante assegna un valore booleano a ciascuna proposizione atomica dichiarata.
 * Oltre l'ultimo stato la traccia prosegue dall'indice di lasso, rappresentando
 * in forma compatta un comportamento infinito.
 *
 * FORMATO TESTUALE:
 * • Istanti separati da ';', valori separati da ','
 * • Suffisso opzionale "::L" per l'indice di lasso (default 0)
 * • Valori veri: yes, true, t, 1 (case-insensitive); qualsiasi altro token è falso
 * • Esempio: "1,0;0,1;1,1::1"
 *
 * La traccia è immutabile: lo stato di attraversamento del lasso appartiene
 * alla singola valutazione, non alla traccia.
 */
public final class Trace {

    private static final Logger LOGGER = Logger.getLogger(Trace.class.getName());

    private static final String LASSO_SEPARATOR = "::";
    private static final String STEP_SEPARATOR = ";";
    private static final String VALUE_SEPARATOR = ",";
    private static final String DEFAULT_LITERAL_PREFIX = "p";
    private static final List<String> TRUE_TOKENS = List.of("yes", "true", "t", "1");

    //region STRUTTURA DATI

    /** Identificativo libero (es. riga del file di provenienza) */
    private final String id;

    /** Nomi delle proposizioni nell'ordine delle colonne */
    private final List<String> literals;

    /** Posizione di ciascun letterale nelle righe di states */
    private final Map<String, Integer> literalIndex;

    /** states[t][v] = valore del letterale v all'istante t */
    private final boolean[][] states;

    /** Indice a cui l'ultimo stato ritorna */
    private final int lassoIndex;

    //endregion

    //region COSTRUZIONE E VALIDAZIONE

    /**
     * Costruisce una traccia da stati già decodificati.
     *
     * @param id identificativo della traccia
     * @param literals nomi delle proposizioni, uno per colonna
     * @param states matrice istanti x letterali (copiata)
     * @param lassoIndex indice di ritorno in [0, length-1]
     * @throws EmptyTraceException se non ci sono stati
     * @throws MalformedTraceException se righe, letterali o lasso sono incoerenti
     */
    public Trace(String id, List<String> literals, boolean[][] states, int lassoIndex) {
        this.id = id != null ? id : "";

        if (states == null || states.length == 0) {
            throw new EmptyTraceException(this.id);
        }
        if (literals == null) {
            throw new MalformedTraceException("Traccia '" + this.id + "': lista letterali null");
        }

        int width = literals.size();
        this.states = new boolean[states.length][];
        for (int t = 0; t < states.length; t++) {
            if (states[t] == null || states[t].length != width) {
                int found = states[t] == null ? 0 : states[t].length;
                throw new MalformedTraceException("Traccia '" + this.id + "': istante " + t
                        + " ha " + found + " valori, attesi " + width);
            }
            this.states[t] = Arrays.copyOf(states[t], width);
        }

        if (lassoIndex < 0 || lassoIndex >= states.length) {
            throw new MalformedTraceException("Traccia '" + this.id + "': indice di lasso " + lassoIndex
                    + " fuori da [0, " + (states.length - 1) + "]");
        }

        this.literals = Collections.unmodifiableList(new ArrayList<>(literals));
        this.literalIndex = buildLiteralIndex(this.id, this.literals);
        this.lassoIndex = lassoIndex;
    }

    private static Map<String, Integer> buildLiteralIndex(String id, List<String> literals) {
        Map<String, Integer> index = new HashMap<>();
        for (int v = 0; v < literals.size(); v++) {
            String name = literals.get(v);
            if (name == null || name.trim().isEmpty()) {
                throw new MalformedTraceException("Traccia '" + id + "': letterale vuoto in posizione " + v);
            }
            if (index.put(name, v) != null) {
                throw new MalformedTraceException("Traccia '" + id + "': letterale duplicato " + name);
            }
        }
        return index;
    }

    //endregion

    //region PARSING FORMATO TESTUALE

    /**
     * Decodifica una traccia con letterali di default p0, p1, ...
     */
    public static Trace parse(String data, String id) {
        return parse(data, id, null);
    }

    /**
     * Decodifica una traccia dal formato "v,v;v,v::L".
     *
     * @param data testo della traccia
     * @param id identificativo della traccia
     * @param literals nomi delle colonne, null per p0, p1, ...
     * @return traccia decodificata
     * @throws EmptyTraceException se il testo non contiene istanti
     * @throws MalformedTraceException se il formato non è valido
     */
    public static Trace parse(String data, String id, List<String> literals) {
        if (data == null || data.trim().isEmpty()) {
            throw new EmptyTraceException(id);
        }

        String body = data.trim();
        int lassoIndex = 0;

        int separator = body.indexOf(LASSO_SEPARATOR);
        if (separator != -1) {
            lassoIndex = parseLassoIndex(body.substring(separator + LASSO_SEPARATOR.length()), id);
            body = body.substring(0, separator).trim();
        } else if (body.indexOf(':') != -1) {
            throw new MalformedTraceException("Traccia '" + id + "': separatore di lasso atteso '::'");
        }

        if (body.isEmpty()) {
            throw new EmptyTraceException(id);
        }

        String[] steps = body.split(STEP_SEPARATOR, -1);
        boolean[][] states = new boolean[steps.length][];
        for (int t = 0; t < steps.length; t++) {
            if (steps[t].trim().isEmpty()) {
                throw new MalformedTraceException("Traccia '" + id + "': istante " + t + " vuoto");
            }
            String[] tokens = steps[t].split(VALUE_SEPARATOR, -1);
            states[t] = new boolean[tokens.length];
            for (int v = 0; v < tokens.length; v++) {
                states[t][v] = toBoolean(tokens[v]);
            }
        }

        List<String> names = literals != null ? literals : defaultLiterals(states[0].length);
        Trace trace = new Trace(id, names, states, lassoIndex);

        LOGGER.finest(() -> "Traccia decodificata: " + trace);
        return trace;
    }

    private static int parseLassoIndex(String text, String id) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new MalformedTraceException("Traccia '" + id + "': indice di lasso non valido '" + text.trim() + "'", e);
        }
    }

    /**
     * Converte un token in booleano secondo la convenzione yes/true/t/1.
     */
    public static boolean toBoolean(String token) {
        return TRUE_TOKENS.contains(token.trim().toLowerCase());
    }

    /**
     * Nomi p0, p1, ... per tracce senza letterali espliciti.
     */
    public static List<String> defaultLiterals(int count) {
        List<String> names = new ArrayList<>(count);
        for (int v = 0; v < count; v++) {
            names.add(DEFAULT_LITERAL_PREFIX + v);
        }
        return names;
    }

    //endregion

    //region ACCESSO

    public String getId() {
        return id;
    }

    public List<String> getLiterals() {
        return literals;
    }

    public int length() {
        return states.length;
    }

    public int getLassoIndex() {
        return lassoIndex;
    }

    public boolean hasLiteral(String name) {
        return literalIndex.containsKey(name);
    }

    /**
     * Valore di un letterale a un istante.
     *
     * @param literal nome della proposizione
     * @param index istante in [0, length)
     * @return valore assegnato
     * @throws IllegalArgumentException se il letterale non è dichiarato
     * @throws IndexOutOfBoundsException se l'istante non esiste
     */
    public boolean valueOf(String literal, int index) {
        Integer column = literalIndex.get(literal);
        if (column == null) {
            throw new IllegalArgumentException("Letterale non dichiarato nella traccia '" + id + "': " + literal);
        }
        if (index < 0 || index >= states.length) {
            throw new IndexOutOfBoundsException("Istante " + index + " fuori dalla traccia '" + id
                    + "' di lunghezza " + states.length);
        }
        return states[index][column];
    }

    /**
     * Copia dei valori di un istante, nell'ordine dei letterali.
     */
    public boolean[] stateAt(int index) {
        if (index < 0 || index >= states.length) {
            throw new IndexOutOfBoundsException("Istante " + index + " fuori dalla traccia '" + id
                    + "' di lunghezza " + states.length);
        }
        return Arrays.copyOf(states[index], states[index].length);
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Riproduce il formato di ingresso, con indice di lasso esplicito.
     */
    public String toTraceString() {
        return encodeStates() + LASSO_SEPARATOR + lassoIndex;
    }

    private String encodeStates() {
        StringBuilder result = new StringBuilder();
        for (int t = 0; t < states.length; t++) {
            if (t > 0) result.append(STEP_SEPARATOR);
            for (int v = 0; v < states[t].length; v++) {
                if (v > 0) result.append(VALUE_SEPARATOR);
                result.append(states[t][v] ? '1' : '0');
            }
        }
        return result.toString();
    }

    @Override
    public String toString() {
        return "Trace Id(" + id + ") Lasso(" + lassoIndex + ") : " + encodeStates();
    }

    //endregion
}
