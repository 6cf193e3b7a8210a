package org.logica.exception;

/**
 * ECCEZIONE LOGICA - Errore sollevato dal motore proposizionale
 *
 * Radice della gerarchia di errori del progetto. Oltre al messaggio conserva la
 * rappresentazione testuale della proposizione coinvolta, così che il chiamante
 * possa diagnosticare l'errore senza dover ricostruire la formula.
 *
 * CASI TIPICI:
 * • Valutazione di una proposizione vuota o quantificata
 * • Assegnamento privo di una variabile richiesta
 * • Eliminazione di un quantificatore da un prefisso vuoto
 *
 * @see LogicSyntaxException
 * @see SolverException
 */
public class LogicException extends RuntimeException {

    /** Rappresentazione testuale della proposizione che ha causato l'errore */
    private final String proposition;

    /**
     * @param message descrizione dell'errore
     * @param proposition rappresentazione testuale della proposizione coinvolta
     */
    public LogicException(String message, String proposition) {
        super(message);
        this.proposition = proposition;
    }

    /**
     * @param message descrizione dell'errore
     * @param proposition rappresentazione testuale della proposizione coinvolta
     * @param cause eccezione originale
     */
    public LogicException(String message, String proposition, Throwable cause) {
        super(message, cause);
        this.proposition = proposition;
    }

    /**
     * @return la proposizione coinvolta nell'errore, come stringa
     */
    public String getProposition() {
        return proposition;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " (sollevata per '" + proposition + "')";
    }
}
