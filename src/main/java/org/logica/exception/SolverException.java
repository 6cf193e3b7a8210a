package org.logica.exception;

import java.time.Duration;

/**
 * ECCEZIONE SOLUTORE ESTERNO - Fallimento nell'invocazione di limboole
 *
 * Traduce in un'unica eccezione i modi di fallimento del processo esterno:
 * • Uscita con codice diverso da zero (stderr catturato nel messaggio)
 * • Superamento del timeout (durata trascorsa nel messaggio)
 * • Output del modello non interpretabile (valore incriminato nel messaggio)
 * • Errori di I/O durante la comunicazione con il processo
 *
 * Nessuna invocazione viene ripetuta automaticamente: il chiamante decide.
 */
public class SolverException extends LogicException {

    public SolverException(String message, String proposition) {
        super(message, proposition);
    }

    public SolverException(String message, String proposition, Throwable cause) {
        super(message, proposition, cause);
    }

    /**
     * Crea l'eccezione per un processo terminato con codice di uscita non nullo.
     */
    public static SolverException processFailure(int exitCode, String stderr, String formula) {
        return new SolverException("Errore durante il passaggio della formula a limboole (codice di uscita "
                + exitCode + "):\n" + stderr, formula);
    }

    /**
     * Crea l'eccezione per un processo interrotto allo scadere del timeout.
     */
    public static SolverException timeout(Duration elapsed, String formula) {
        return new SolverException("Processo interrotto dopo " + elapsed.toMillis()
                + " ms durante il passaggio della formula a limboole", formula);
    }

    /**
     * Crea l'eccezione per una riga del modello che non contiene un valore booleano valido.
     */
    public static SolverException malformedModel(String value, String formula, Throwable cause) {
        return new SolverException("Errore durante l'interpretazione del modello di limboole, impossibile "
                + "convertire '" + value + "' in un valore booleano", formula, cause);
    }
}
