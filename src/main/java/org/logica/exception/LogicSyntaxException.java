package org.logica.exception;

/**
 * Errore di sintassi su una formula: variabile quantificata non atomica, matrice non
 * in forma prenessa, testo non riconosciuto dal parser.
 *
 * L'offset indica la posizione (in caratteri) del punto problematico all'interno
 * della rappresentazione testuale della formula, oppure -1 se non determinabile.
 */
public class LogicSyntaxException extends LogicException {

    private final int offset;

    public LogicSyntaxException(String message, String proposition, int offset) {
        super(message, proposition);
        this.offset = offset;
    }

    public LogicSyntaxException(String message, String proposition, int offset, Throwable cause) {
        super(message, proposition, cause);
        this.offset = offset;
    }

    /**
     * @return posizione del "cursore" di errore, -1 se sconosciuta
     */
    public int getOffset() {
        return offset;
    }

    @Override
    public String getMessage() {
        if (offset < 0) {
            return super.getMessage();
        }
        return super.getMessage() + " alla posizione " + offset;
    }
}
