package org.pltl.trace;

import org.pltl.formula.Formula;
import org.pltl.formula.FormulaParser;
import org.pltl.formula.MalformedFormulaException;
import org.pltl.formula.Operator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * LETTORE FILE DI TRACCE - Decodifica il formato a sezioni separate da "---"
 *
 * SEZIONI (nell'ordine):
 * 1. Letterali separati da virgola (obbligatoria)
 * 2. Tracce positive, una per riga
 * 3. Tracce negative, una per riga
 * 4. Operatori unari ammessi (facoltativa)
 * 5. Operatori binari ammessi (facoltativa)
 * 6. Dimensione della formula (facoltativa)
 * 7. Formula obiettivo in sintassi prefissa (facoltativa)
 *
 * Una sezione facoltativa assente può mancare insieme al suo separatore,
 * quindi dalla quarta in poi le sezioni si riconoscono dal contenuto:
 * • solo simboli di operatori unari: operatori unari
 * • solo simboli di operatori binari: operatori binari
 * • un intero: dimensione della formula
 * • qualsiasi altro testo: formula obiettivo
 * Le sezioni vuote vengono ignorate.
 *
 * Le tracce ricevono come identificativo il numero di riga (da 1) nel file.
 */
public final class TraceSampleReader {

    private static final Logger LOGGER = Logger.getLogger(TraceSampleReader.class.getName());

    private static final String SECTION_SEPARATOR = "---";

    private static final Pattern INTEGER = Pattern.compile("\\d+");

    private static final int LITERALS = 0;
    private static final int POSITIVE = 1;
    private static final int NEGATIVE = 2;
    private static final int FIRST_OPTIONAL = 3;

    /** Sezioni facoltative, nell'ordine in cui possono comparire */
    private enum OptionalSection {
        UNARY("operatori unari"),
        BINARY("operatori binari"),
        SIZE("dimensione formula"),
        TARGET("formula obiettivo");

        private final String description;

        OptionalSection(String description) {
            this.description = description;
        }
    }

    private TraceSampleReader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region PUNTI DI INGRESSO

    /**
     * Legge un file di tracce dal disco.
     *
     * @param path percorso del file
     * @return campione decodificato
     * @throws IOException se il file non è leggibile
     * @throws MalformedTraceException se il contenuto non rispetta il formato
     */
    public static TraceSample read(Path path) throws IOException {
        LOGGER.fine("Lettura file di tracce: " + path);
        return parse(Files.readString(path));
    }

    /**
     * Decodifica il contenuto testuale di un file di tracce.
     *
     * @param content contenuto completo del file
     * @return campione decodificato
     * @throws MalformedTraceException se il contenuto non rispetta il formato
     */
    public static TraceSample parse(String content) {
        List<List<NumberedLine>> sections = splitSections(content != null ? content : "");

        List<NumberedLine> literalLines = section(sections, LITERALS);
        if (literalLines.isEmpty()) {
            throw new MalformedTraceException("Sezione letterali mancante");
        }
        NumberedLine literalLine = literalLines.get(0);
        List<String> literals = splitList(literalLine.text);
        if (literals.isEmpty()) {
            throw new MalformedTraceException("Riga " + literalLine.number + ": nessun letterale dichiarato");
        }

        List<Trace> positives = readTraces(section(sections, POSITIVE), literals);
        List<Trace> negatives = readTraces(section(sections, NEGATIVE), literals);

        List<Operator> unary = new ArrayList<>();
        List<Operator> binary = new ArrayList<>();
        Integer size = null;
        Formula target = null;

        OptionalSection last = null;
        for (int position = FIRST_OPTIONAL; position < sections.size(); position++) {
            List<NumberedLine> lines = sections.get(position);
            if (lines.isEmpty()) {
                continue;
            }
            OptionalSection kind = classify(lines);
            if (last != null && kind.ordinal() <= last.ordinal()) {
                throw new MalformedTraceException("Riga " + lines.get(0).number + ": sezione " + kind.description
                        + " fuori ordine o duplicata");
            }
            last = kind;

            switch (kind) {
                case UNARY -> unary = readOperators(lines, 1);
                case BINARY -> binary = readOperators(lines, 2);
                case SIZE -> size = readSize(lines);
                case TARGET -> target = readTarget(lines);
            }
        }

        TraceSample sample = new TraceSample(literals, positives, negatives, unary, binary, size, target);
        LOGGER.info("Campione letto: " + sample);
        return sample;
    }

    //endregion

    //region SEZIONI

    private static List<List<NumberedLine>> splitSections(String content) {
        List<List<NumberedLine>> sections = new ArrayList<>();
        List<NumberedLine> current = new ArrayList<>();

        String[] lines = content.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            String text = lines[i].trim();
            if (text.equals(SECTION_SEPARATOR)) {
                sections.add(current);
                current = new ArrayList<>();
            } else if (!text.isEmpty()) {
                current.add(new NumberedLine(i + 1, text));
            }
        }
        sections.add(current);
        return sections;
    }

    private static List<NumberedLine> section(List<List<NumberedLine>> sections, int position) {
        return position < sections.size() ? sections.get(position) : List.of();
    }

    /**
     * Riconosce una sezione facoltativa dal contenuto. Un elenco di soli operatori
     * con arietà miste viene rifiutato: non è né una formula né un elenco valido.
     */
    private static OptionalSection classify(List<NumberedLine> lines) {
        NumberedLine first = lines.get(0);
        if (INTEGER.matcher(first.text).matches()) {
            return OptionalSection.SIZE;
        }

        boolean allUnary = true;
        boolean allBinary = true;
        for (NumberedLine line : lines) {
            for (String symbol : splitList(line.text)) {
                int arity = Operator.fromLabel(symbol).getArity();
                allUnary &= arity == 1;
                allBinary &= arity == 2;
                if (arity == 0) {
                    return OptionalSection.TARGET;
                }
            }
        }

        if (allUnary) {
            return OptionalSection.UNARY;
        }
        if (allBinary) {
            return OptionalSection.BINARY;
        }
        throw new MalformedTraceException("Riga " + first.number
                + ": operatori unari e binari nella stessa sezione '" + first.text + "'");
    }

    private static List<Trace> readTraces(List<NumberedLine> lines, List<String> literals) {
        List<Trace> traces = new ArrayList<>();
        for (NumberedLine line : lines) {
            traces.add(Trace.parse(line.text, String.valueOf(line.number), literals));
        }
        return traces;
    }

    private static List<Operator> readOperators(List<NumberedLine> lines, int arity) {
        List<Operator> operators = new ArrayList<>();
        for (NumberedLine line : lines) {
            for (String symbol : splitList(line.text)) {
                Operator operator = Operator.fromLabel(symbol);
                if (operator == Operator.ATOM || operator.getArity() != arity) {
                    throw new MalformedTraceException("Riga " + line.number + ": operatore "
                            + (arity == 1 ? "unario" : "binario") + " non valido '" + symbol + "'");
                }
                operators.add(operator);
            }
        }
        return operators;
    }

    private static Integer readSize(List<NumberedLine> lines) {
        if (lines.isEmpty()) {
            return null;
        }
        NumberedLine line = lines.get(0);
        try {
            return Integer.parseInt(line.text);
        } catch (NumberFormatException e) {
            throw new MalformedTraceException("Riga " + line.number + ": dimensione formula non valida '" + line.text + "'", e);
        }
    }

    private static Formula readTarget(List<NumberedLine> lines) {
        if (lines.isEmpty()) {
            return null;
        }
        NumberedLine line = lines.get(0);
        try {
            return FormulaParser.parse(line.text);
        } catch (MalformedFormulaException e) {
            throw new MalformedFormulaException("Riga " + line.number + ": " + e.getMessage(), e);
        }
    }

    private static List<String> splitList(String text) {
        List<String> items = new ArrayList<>();
        for (String item : text.split(",")) {
            if (!item.trim().isEmpty()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    //endregion

    /**
     * Riga non vuota con il suo numero (da 1) nel file.
     */
    private static final class NumberedLine {
        final int number;
        final String text;

        NumberedLine(int number, String text) {
            this.number = number;
            this.text = text;
        }
    }
}
