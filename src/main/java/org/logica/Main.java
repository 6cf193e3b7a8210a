package org.logica;

import org.logica.exception.LogicException;
import org.logica.format.ConnectiveFormat;
import org.logica.parser.PropositionParser;
import org.logica.proposition.AtomicProposition;
import org.logica.proposition.Proposition;
import org.logica.qbf.PQBF;
import org.logica.solver.LimbooleConfiguration;
import org.logica.solver.LimbooleSolver;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * MOTORE DI LOGICA PROPOSIZIONALE - Interfaccia a riga di comando
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: formula da file (-f) o da riga di comando (-e)
 * 2. PARSING: sintassi limboole o Unicode, tramite grammatica ANTLR
 * 3. TRASFORMAZIONI: sequenza di operazioni (-op=reduce,expand,nnf) applicate in ordine
 * 4. OUTPUT: formula risultante nel formato scelto (-fmt=pretty|limboole|latex)
 * 5. VERIFICA FACOLTATIVA: validità, soddisfacibilità o modello tramite limboole,
 *    oppure albero degli assegnamenti per le formule prenesse (-check=valid|sat|model|tree)
 *
 * CONFIGURAZIONE DEL SOLUTORE:
 * • -t secondi: timeout di ogni invocazione di limboole
 * • -x comando: comando alternativo per limboole (separato da spazi)
 * In assenza dei parametri valgono le proprietà di sistema lette da {@link LimbooleConfiguration}.
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String EXPRESSION_PARAM = "-e";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String COMMAND_PARAM = "-x";
    private static final String OP_PARAM = "-op=";
    private static final String FMT_PARAM = "-fmt=";
    private static final String CHECK_PARAM = "-check=";

    /**
     * Operazioni e verifiche disponibili
     * */
    private static final List<String> OPERATIONS = List.of("reduce", "expand", "nnf");
    private static final List<String> CHECKS = List.of("valid", "sat", "model", "tree");

    /**
     * Codici di uscita
     * */
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    /**
     * Previene istanziazione - classe utility
     * */
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
     * Esegue l'intero flusso scrivendo su {@code out}.
     *
     * @param args parametri linea di comando
     * @param out destinazione dell'output
     * @return {@link #EXIT_OK} in caso di successo, {@link #EXIT_ERROR} per errori di input o del solutore
     */
    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            return EXIT_ERROR;
        }

        try {
            CliConfiguration config = new ArgumentParser().parse(args);
            if (config == null) {
                printHelp(out);
                return EXIT_OK;
            }

            PropositionParser parser = new PropositionParser();
            Proposition formula = parser.parse(config.formulaText);
            out.println("[I] Formula letta: " + formula.format(config.format));

            for (String operation : config.operations) {
                formula = applyOperation(formula, operation);
                out.println("[I] Dopo " + operation + ": " + formula.format(config.format));
            }

            out.println(formatResult(formula, config.format));

            if (config.check != null) {
                runCheck(formula, config, out);
            }
            return EXIT_OK;

        } catch (IllegalArgumentException | LogicException e) {
            out.println("[E] " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    //endregion

    //region ELABORAZIONE

    private static Proposition applyOperation(Proposition formula, String operation) {
        return switch (operation) {
            case "reduce" -> formula.reduce();
            case "expand" -> formula.expand();
            case "nnf" -> formula.simplifyNegations();
            default -> throw new IllegalArgumentException("Operazione sconosciuta: " + operation);
        };
    }

    private static String formatResult(Proposition formula, ConnectiveFormat format) {
        if (format == ConnectiveFormat.LATEX) {
            return formula.toLatex();
        }
        return formula.format(format);
    }

    private static void runCheck(Proposition formula, CliConfiguration config, PrintStream out) {
        LimbooleSolver solver = new LimbooleSolver(config.solverConfiguration);

        switch (config.check) {
            case "valid" -> {
                boolean valid = formula.isQuantified()
                        ? PQBF.fromFormula(formula).valid(solver)
                        : formula.valid(solver);
                out.println("[I] Validità: " + (valid ? "VALIDA" : "NON VALIDA"));
            }
            case "sat" -> {
                boolean sat = formula.isQuantified()
                        ? PQBF.fromFormula(formula).sat(solver)
                        : formula.sat(solver);
                out.println("[I] Soddisfacibilità: " + (sat ? "SODDISFACIBILE" : "INSODDISFACIBILE"));
            }
            case "model" -> {
                Map<AtomicProposition, Boolean> model = formula.model(solver);
                if (model.isEmpty()) {
                    out.println("[I] Nessun modello: formula insoddisfacibile");
                } else {
                    out.println("[I] Modello:");
                    model.forEach((atom, value) -> out.println("    " + atom + " = " + value));
                }
            }
            case "tree" -> {
                PQBF pqbf = PQBF.fromFormula(formula);
                PQBF.Node root = pqbf.assignmentTree();
                boolean value = root.evalNode();
                out.println("[I] Prefisso: " + pqbf.getPrefix() + ", matrice: " + pqbf.getMatrix());
                out.println("[I] Albero degli assegnamenti: profondità " + root.depth()
                        + ", foglie " + root.countLeaves());
                out.println("[I] Valore: " + (value ? "VERO" : "FALSO"));
            }
            default -> throw new IllegalArgumentException("Verifica sconosciuta: " + config.check);
        }
    }

    private static void printHelp(PrintStream out) {
        out.println("Uso: java -jar logica.jar (-f <file> | -e <formula>) [opzioni]");
        out.println();
        out.println("  -f <file>         legge la formula da file (righe che iniziano con % ignorate)");
        out.println("  -e <formula>      formula passata direttamente");
        out.println("  -op=<lista>       operazioni in ordine, separate da virgola: " + String.join(", ", OPERATIONS));
        out.println("  -fmt=<formato>    formato di output: pretty, limboole, latex (default pretty)");
        out.println("  -check=<tipo>     verifica: " + String.join(", ", CHECKS));
        out.println("  -t <secondi>      timeout di limboole");
        out.println("  -x <comando>      comando di limboole");
        out.println("  -h                mostra questo messaggio");
    }

    //endregion

    //region PARSING ARGOMENTI

    /**
     * Configurazione risultante dalla riga di comando.
     */
    static final class CliConfiguration {
        final String formulaText;
        final List<String> operations;
        final ConnectiveFormat format;
        final String check;
        final LimbooleConfiguration solverConfiguration;

        CliConfiguration(String formulaText, List<String> operations, ConnectiveFormat format,
                         String check, LimbooleConfiguration solverConfiguration) {
            this.formulaText = formulaText;
            this.operations = operations;
            this.format = format;
            this.check = check;
            this.solverConfiguration = solverConfiguration;
        }
    }

    /**
     * Analizza e valida i parametri; ogni errore è segnalato con IllegalArgumentException.
     */
    static final class ArgumentParser {

        /**
         * @return la configurazione, o null se è stato richiesto l'help
         */
        CliConfiguration parse(String[] args) {
            String formulaText = null;
            List<String> operations = List.of();
            ConnectiveFormat format = ConnectiveFormat.PRETTY_PRINT;
            String check = null;
            LimbooleConfiguration solverConfiguration = LimbooleConfiguration.fromSystemProperties();

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        return null;
                    }

                    case FILE_PARAM -> {
                        validateSingleInput(formulaText);
                        formulaText = readFormulaFile(getNextArgument(args, ++i, "percorso file"));
                    }

                    case EXPRESSION_PARAM -> {
                        validateSingleInput(formulaText);
                        formulaText = getNextArgument(args, ++i, "formula");
                    }

                    case TIMEOUT_PARAM -> {
                        solverConfiguration = solverConfiguration.withTimeout(parseAndValidateTimeout(args, ++i));
                    }

                    case COMMAND_PARAM -> {
                        String command = getNextArgument(args, ++i, "comando");
                        solverConfiguration = solverConfiguration.withCommand(Arrays.asList(command.trim().split("\\s+")));
                    }

                    default -> {
                        if (args[i].startsWith(OP_PARAM)) {
                            operations = parseList(args[i].substring(OP_PARAM.length()), OPERATIONS, "Operazione");
                        } else if (args[i].startsWith(FMT_PARAM)) {
                            format = parseFormat(args[i].substring(FMT_PARAM.length()));
                        } else if (args[i].startsWith(CHECK_PARAM)) {
                            check = parseList(args[i].substring(CHECK_PARAM.length()), CHECKS, "Verifica").get(0);
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (formulaText == null || formulaText.isBlank()) {
                throw new IllegalArgumentException("Specificare la formula con -f (file) o -e (espressione)");
            }
            return new CliConfiguration(formulaText, operations, format, check, solverConfiguration);
        }

        private void validateSingleInput(String formulaText) {
            if (formulaText != null) {
                throw new IllegalArgumentException("I parametri -f e -e sono mutualmente esclusivi");
            }
        }

        /**
         * Verifica che esista un argomento successivo prima di restituirlo.
         */
        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private Duration parseAndValidateTimeout(String[] args, int currentIndex) {
            String timeoutStr = getNextArgument(args, currentIndex, "numero secondi");

            try {
                int timeout = Integer.parseInt(timeoutStr);
                if (timeout <= 0) {
                    throw new IllegalArgumentException("Il timeout deve essere positivo, ricevuto: " + timeout);
                }
                return Duration.ofSeconds(timeout);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore timeout non valido: " + timeoutStr);
            }
        }

        private List<String> parseList(String value, List<String> allowed, String kind) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException(kind + ": valore vuoto");
            }
            List<String> items = new ArrayList<>();
            for (String item : value.split(",")) {
                String trimmed = item.trim();
                if (!allowed.contains(trimmed)) {
                    throw new IllegalArgumentException(kind + " non supportata: " + trimmed +
                            ". Supportate: " + String.join(", ", allowed));
                }
                items.add(trimmed);
            }
            return items;
        }

        private ConnectiveFormat parseFormat(String value) {
            return switch (value) {
                case "pretty" -> ConnectiveFormat.PRETTY_PRINT;
                case "limboole" -> ConnectiveFormat.LIMBOOLE;
                case "latex" -> ConnectiveFormat.LATEX;
                default -> throw new IllegalArgumentException("Formato non supportato: " + value +
                        ". Supportati: pretty, limboole, latex");
            };
        }

        /**
         * Legge il file ignorando le righe di commento e unendo le restanti.
         */
        private String readFormulaFile(String filePath) {
            File file = new File(filePath);
            if (!file.isFile() || !file.canRead()) {
                throw new IllegalArgumentException("File non esistente o non leggibile: " + filePath);
            }
            try {
                return Files.readAllLines(Path.of(filePath), StandardCharsets.UTF_8).stream()
                        .filter(line -> !line.trim().startsWith("%"))
                        .collect(Collectors.joining("\n"))
                        .trim();
            } catch (IOException e) {
                throw new IllegalArgumentException("Errore durante la lettura di " + filePath + ": " + e.getMessage(), e);
            }
        }
    }

    //endregion
}
