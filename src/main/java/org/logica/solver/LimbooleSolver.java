package org.logica.solver;

import org.logica.exception.SolverException;
import org.logica.proposition.AtomicProposition;
import org.logica.proposition.Proposition;
import org.logica.proposition.TruthConstant;
import org.logica.qbf.PQBF;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * PONTE VERSO LIMBOOLE - Validità, soddisfacibilità e modelli tramite solutore esterno
 *
 * La formula viene resa in sintassi limboole e passata sullo standard input del
 * processo; il verdetto si ricava dai marcatori presenti nell'output:
 * • "% VALID formula" per il controllo di validità (nessuna opzione)
 * • "% SATISFIABLE formula" per il controllo di soddisfacibilità (opzione -s)
 *
 * Per le formule quantificate in forma prenessa si aggiunge l'opzione --depqbf.
 *
 * FORMATO DEL MODELLO:
 * Con -s, dopo la riga del marcatore, limboole stampa una riga "nome = 0|1" per ogni
 * variabile. I nomi sono confrontati con la resa limboole delle proposizioni atomiche
 * della formula; "top" e "bottom" vengono ignorati.
 */
public class LimbooleSolver {

    private static final Logger LOGGER = Logger.getLogger(LimbooleSolver.class.getName());

    public static final String VALID_MARKER = "% VALID formula";
    public static final String SATISFIABLE_MARKER = "% SATISFIABLE formula";
    public static final String SATISFIABILITY_OPTION = "-s";
    public static final String QBF_OPTION = "--depqbf";

    private static volatile LimbooleSolver defaultSolver;

    private final LimbooleConfiguration configuration;
    private final CommandRunner runner;

    public LimbooleSolver(LimbooleConfiguration configuration) {
        this(configuration, new SubprocessRunner());
    }

    public LimbooleSolver(LimbooleConfiguration configuration, CommandRunner runner) {
        this.configuration = Objects.requireNonNull(configuration);
        this.runner = Objects.requireNonNull(runner);
    }

    /**
     * Solutore condiviso, configurato dalle proprietà di sistema al primo utilizzo.
     *
     * @see LimbooleConfiguration#fromSystemProperties()
     */
    public static LimbooleSolver defaultSolver() {
        LimbooleSolver solver = defaultSolver;
        if (solver == null) {
            synchronized (LimbooleSolver.class) {
                solver = defaultSolver;
                if (solver == null) {
                    solver = new LimbooleSolver(LimbooleConfiguration.fromSystemProperties());
                    defaultSolver = solver;
                }
            }
        }
        return solver;
    }

    /**
     * Sostituisce il solutore condiviso; con null viene ricreato al prossimo utilizzo.
     */
    public static void setDefaultSolver(LimbooleSolver solver) {
        defaultSolver = solver;
    }

    //region PROPOSIZIONI

    /**
     * @throws org.logica.exception.LogicException se la formula è quantificata
     * @throws SolverException se l'invocazione di limboole fallisce
     */
    public boolean valid(Proposition proposition) {
        proposition.requireUnquantified("verificare la validità di");
        return evaluate(proposition.toLimboole()).contains(VALID_MARKER);
    }

    /**
     * @throws org.logica.exception.LogicException se la formula è quantificata
     * @throws SolverException se l'invocazione di limboole fallisce
     */
    public boolean sat(Proposition proposition) {
        proposition.requireUnquantified("verificare la soddisfacibilità di");
        return evaluate(proposition.toLimboole(), SATISFIABILITY_OPTION).contains(SATISFIABLE_MARKER);
    }

    /**
     * Cerca un modello della formula.
     *
     * @return assegnamento soddisfacente delle proposizioni atomiche nominate da limboole,
     *         mappa vuota se la formula è insoddisfacibile
     * @throws SolverException se l'invocazione fallisce o il modello non è interpretabile
     */
    public Map<AtomicProposition, Boolean> model(Proposition proposition) {
        proposition.requireUnquantified("cercare un modello di");
        String formula = proposition.toLimboole();
        return parseModel(evaluate(formula, SATISFIABILITY_OPTION), proposition, formula);
    }

    //endregion

    //region FORMULE PRENESSE

    public boolean valid(PQBF pqbf) {
        return evaluate(pqbf.toLimboole(), QBF_OPTION).contains(VALID_MARKER);
    }

    public boolean sat(PQBF pqbf) {
        return evaluate(pqbf.toLimboole(), QBF_OPTION, SATISFIABILITY_OPTION).contains(SATISFIABLE_MARKER);
    }

    //endregion

    /**
     * Invoca limboole con le opzioni date sulla formula già in sintassi limboole.
     *
     * @return lo standard output di limboole
     */
    public String evaluate(String formula, String... options) {
        List<String> command = new ArrayList<>(configuration.getCommand());
        Collections.addAll(command, options);
        LOGGER.fine(() -> "Invocazione " + command + " su: " + formula);
        return runner.run(command, formula, configuration.getTimeout());
    }

    private static Map<AtomicProposition, Boolean> parseModel(String output, Proposition proposition, String formula) {
        Map<AtomicProposition, Boolean> model = new LinkedHashMap<>();
        if (!output.contains(SATISFIABLE_MARKER)) {
            return model;
        }

        Map<String, AtomicProposition> byName = new HashMap<>();
        for (AtomicProposition atom : proposition.getSeenAtomicPropositions()) {
            if (!(atom instanceof TruthConstant)) {
                byName.put(atom.toLimboole(), atom);
            }
        }

        String[] lines = output.split("\\R");
        // La prima riga contiene il marcatore
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }

            int separator = line.indexOf('=');
            if (separator < 0) {
                throw SolverException.malformedModel(line, formula, null);
            }
            String name = line.substring(0, separator).trim();
            String value = line.substring(separator + 1).trim();
            if (name.equals("top") || name.equals("bottom")) {
                continue;
            }

            AtomicProposition atom = byName.get(name);
            if (atom != null) {
                model.put(atom, parseBit(value, formula));
            } else {
                LOGGER.finest(() -> "Variabile '" + name + "' del modello non presente nella formula");
            }
        }
        return model;
    }

    private static boolean parseBit(String value, String formula) {
        int bit;
        try {
            bit = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw SolverException.malformedModel(value, formula, e);
        }
        if (bit != 0 && bit != 1) {
            throw SolverException.malformedModel(value, formula, null);
        }
        return bit == 1;
    }

    public LimbooleConfiguration getConfiguration() {
        return configuration;
    }
}
