package org.logica.proposition;

import java.util.function.IntPredicate;

/**
 * Arità di un {@link Connective}: associa a ogni classe un predicato sul numero di
 * operandi, usato per validare la costruzione delle proposizioni, e una breve
 * descrizione per i messaggi di errore.
 */
public enum ConnectiveArity {

    NILARY(count -> count == 0, "esattamente 0 operandi"),
    UNARY(count -> count == 1, "esattamente 1 operando"),
    BINARY(count -> count == 2, "esattamente 2 operandi"),
    NARY(count -> count >= 2, "2 o più operandi");

    private final IntPredicate operandCheck;
    private final String description;

    ConnectiveArity(IntPredicate operandCheck, String description) {
        this.operandCheck = operandCheck;
        this.description = description;
    }

    /**
     * @param operandCount numero di operandi forniti
     * @return true se il numero di operandi è compatibile con questa arità
     */
    public boolean accepts(int operandCount) {
        return operandCheck.test(operandCount);
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return description;
    }
}
