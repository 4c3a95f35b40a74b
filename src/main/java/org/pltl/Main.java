package org.pltl;

import org.pltl.eval.ClassificationMode;
import org.pltl.eval.ClassificationResult;
import org.pltl.eval.EvaluationException;
import org.pltl.eval.TraceClassifier;
import org.pltl.eval.TraceEvaluator;
import org.pltl.eval.TruthTable;
import org.pltl.formula.Formula;
import org.pltl.formula.FormulaParser;
import org.pltl.trace.Trace;
import org.pltl.trace.TraceSample;
import org.pltl.trace.TraceSampleReader;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * VALUTATORE PLTL SU TRACCE LASSO
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: file di tracce positive/negative (-f) oppure traccia singola (-t)
 * 2. PARSING: formula in sintassi prefissa (-e) o formula obiettivo del file
 * 3. VALUTAZIONE: verità all'inizio, in ogni istante, o in un istante scelto (-i)
 * 4. OUTPUT: esito della valutazione o della classificazione, tabella di verità (-table)
 *
 * ESEMPI:
 * - -t "0,1;1,1;1,1" -l p,q -e "G(q)"
 * - -f samples.trace -mode=throughout -table
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String TRACE_PARAM = "-t";
    private static final String LITERALS_PARAM = "-l";
    private static final String FORMULA_PARAM = "-e";
    private static final String INDEX_PARAM = "-i";
    private static final String MODE_PARAM = "-mode=";
    private static final String TABLE_PARAM = "-table";

    /**
     * Valori ammessi per -mode
     * */
    private static final String MODE_START = "start";
    private static final String MODE_THROUGHOUT = "throughout";

    /**
     * Identificativo della traccia passata da linea di comando
     * */
    private static final String CLI_TRACE_ID = "cli";

    private static final int EXIT_OK = 0;
    private static final int EXIT_ERROR = 1;

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        int exitCode = run(args, System.out);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue il valutatore scrivendo i risultati sullo stream indicato.
     *
     * @param args parametri linea di comando
     * @param out destinazione dei messaggi
     * @return codice di uscita: 0 successo, 1 errore
     */
    static int run(String[] args, PrintStream out) {
        out.println("---> AVVIO VALUTATORE PLTL <---");

        try {
            if (args.length == 0) {
                out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return EXIT_ERROR;
            }

            EvaluatorConfiguration config = new ArgumentParser().parse(args);
            if (config == null) {
                printApplicationHelp(out);
                return EXIT_OK;
            }

            if (config.samplePath != null) {
                processSampleFile(config, out);
            } else {
                processSingleTrace(config, out);
            }
            return EXIT_OK;

        } catch (IllegalArgumentException | EvaluationException e) {
            out.println("[E] " + e.getMessage());
            LOGGER.log(Level.FINE, "Dettaglio errore", e);
            return EXIT_ERROR;
        } catch (IOException e) {
            out.println("[E] Errore di lettura: " + e.getMessage());
            LOGGER.log(Level.SEVERE, "Lettura file di tracce fallita", e);
            return EXIT_ERROR;
        } finally {
            out.println("---> FINE ESECUZIONE VALUTATORE PLTL <---");
        }
    }

    //endregion

    //region ELABORAZIONE

    /**
     * Classifica le tracce di un file rispetto alla formula scelta.
     */
    private static void processSampleFile(EvaluatorConfiguration config, PrintStream out) throws IOException {
        TraceSample sample = TraceSampleReader.read(Path.of(config.samplePath));
        out.println("[I] Campione letto: " + sample);

        Formula formula;
        if (config.formulaText != null) {
            formula = FormulaParser.parse(config.formulaText);
        } else if (sample.hasTargetFormula()) {
            formula = sample.getTargetFormula();
        } else {
            throw new IllegalArgumentException("Nessuna formula: usare -e o una formula obiettivo nel file");
        }
        out.println("[I] Formula: " + formula);

        ClassificationResult result = new TraceClassifier(config.mode).classify(formula, sample);
        out.println("[I] Tracce corrette: " + result.correctCount() + "/"
                + (result.getPositiveCount() + result.getNegativeCount()));
        if (result.isConsistent()) {
            out.println("[I] La formula separa il campione");
        } else {
            out.println("[W] Positive rifiutate: " + result.getRejectedPositives());
            out.println("[W] Negative accettate: " + result.getAcceptedNegatives());
        }

        if (config.printTable) {
            List<Trace> traces = new ArrayList<>(sample.getPositiveTraces());
            traces.addAll(sample.getNegativeTraces());
            for (Trace trace : traces) {
                out.println(trace);
                out.print(TruthTable.compute(new TraceEvaluator(trace), formula).render());
            }
        }
    }

    /**
     * Valuta la formula su una traccia passata da linea di comando.
     */
    private static void processSingleTrace(EvaluatorConfiguration config, PrintStream out) {
        if (config.formulaText == null) {
            throw new IllegalArgumentException("Specificare la formula con -e");
        }

        Trace trace = Trace.parse(config.traceText, CLI_TRACE_ID, config.literals);
        Formula formula = FormulaParser.parse(config.formulaText);
        TraceEvaluator evaluator = new TraceEvaluator(trace);

        out.println("[I] " + trace);
        out.println("[I] Formula: " + formula);

        boolean result;
        String where;
        if (config.index != null) {
            result = evaluator.holds(formula, config.index);
            where = "istante " + config.index;
        } else if (config.mode == ClassificationMode.THROUGHOUT) {
            result = evaluator.holdsThroughout(formula);
            where = "ogni istante";
        } else {
            result = evaluator.holdsAtStart(formula);
            where = "inizio traccia";
        }
        out.println("[I] Esito (" + where + "): " + (result ? "SAT" : "UNSAT"));

        if (config.printTable) {
            out.print(TruthTable.compute(evaluator, formula).render());
        }
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp(PrintStream out) {
        out.println("Uso: java -jar pltl-trace-evaluator.jar [opzioni]");
        out.println();
        out.println("INPUT (uno dei due):");
        out.println("  -f <file>          File di tracce (letterali --- positive --- negative --- ...)");
        out.println("  -t <traccia>       Traccia singola, es. \"1,0;0,1::1\"");
        out.println();
        out.println("OPZIONI:");
        out.println("  -l <p,q,...>       Letterali della traccia singola (default p0, p1, ...)");
        out.println("  -e <formula>       Formula in sintassi prefissa, es. \"U(p,q)\", \"G(!(p))\"");
        out.println("  -i <istante>       Valuta in un solo istante (solo con -t, non con -mode=throughout)");
        out.println("  -mode=start        Verità all'istante 0 (default)");
        out.println("  -mode=throughout   Verità in ogni istante");
        out.println("  -table             Stampa la tabella di verità delle sottoformule");
        out.println("  -h                 Mostra questo help");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    private static class EvaluatorConfiguration {
        final String samplePath;
        final String traceText;
        final List<String> literals;
        final String formulaText;
        final Integer index;
        final ClassificationMode mode;
        final boolean printTable;

        EvaluatorConfiguration(String samplePath, String traceText, List<String> literals, String formulaText,
                               Integer index, ClassificationMode mode, boolean printTable) {
            this.samplePath = samplePath;
            this.traceText = traceText;
            this.literals = literals;
            this.formulaText = formulaText;
            this.index = index;
            this.mode = mode;
            this.printTable = printTable;
        }
    }

    /**
     * Parser dei parametri linea di comando.
     */
    private static class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri sono invalidi
         */
        EvaluatorConfiguration parse(String[] args) {
            String samplePath = null;
            String traceText = null;
            List<String> literals = null;
            String formulaText = null;
            Integer index = null;
            ClassificationMode mode = ClassificationMode.AT_START;
            boolean printTable = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        return null;
                    }
                    case FILE_PARAM -> {
                        samplePath = getNextArgument(args, ++i, "file");
                        validateFileExists(samplePath);
                    }
                    case TRACE_PARAM -> traceText = getNextArgument(args, ++i, "traccia");
                    case LITERALS_PARAM -> literals = parseLiterals(getNextArgument(args, ++i, "letterali"));
                    case FORMULA_PARAM -> formulaText = getNextArgument(args, ++i, "formula");
                    case INDEX_PARAM -> index = parseIndex(getNextArgument(args, ++i, "istante"));
                    case TABLE_PARAM -> printTable = true;
                    default -> {
                        if (args[i].startsWith(MODE_PARAM)) {
                            mode = parseMode(args[i].substring(MODE_PARAM.length()));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if ((samplePath == null) == (traceText == null)) {
                throw new IllegalArgumentException("Specificare esattamente uno tra -f (file) e -t (traccia)");
            }
            if (samplePath != null && (index != null || literals != null)) {
                throw new IllegalArgumentException("-i e -l sono ammessi solo con -t");
            }
            if (index != null && mode == ClassificationMode.THROUGHOUT) {
                throw new IllegalArgumentException("-i non è compatibile con -mode=throughout");
            }

            return new EvaluatorConfiguration(samplePath, traceText, literals, formulaText, index, mode, printTable);
        }

        private String getNextArgument(String[] args, int currentIndex, String paramName) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1]
                        + " richiede valore " + paramName);
            }
            return args[currentIndex];
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
        }

        private List<String> parseLiterals(String text) {
            List<String> literals = new ArrayList<>();
            for (String literal : Arrays.asList(text.split(","))) {
                if (!literal.trim().isEmpty()) {
                    literals.add(literal.trim());
                }
            }
            if (literals.isEmpty()) {
                throw new IllegalArgumentException("Lista letterali vuota");
            }
            return literals;
        }

        private Integer parseIndex(String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Istante non valido: " + text);
            }
        }

        private ClassificationMode parseMode(String value) {
            return switch (value) {
                case MODE_START -> ClassificationMode.AT_START;
                case MODE_THROUGHOUT -> ClassificationMode.THROUGHOUT;
                default -> throw new IllegalArgumentException("Modalità non supportata: " + value
                        + " (ammesse: " + MODE_START + ", " + MODE_THROUGHOUT + ")");
            };
        }
    }

    //endregion
}
