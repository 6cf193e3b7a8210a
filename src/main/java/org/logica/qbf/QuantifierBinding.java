package org.logica.qbf;

import org.logica.proposition.AtomicProposition;
import org.logica.proposition.Connective;
import org.logica.proposition.TruthConstant;

import java.util.Objects;

/**
 * Elemento del prefisso di una formula prenessa: quantificatore e variabile legata.
 */
public final class QuantifierBinding {

    private final Connective quantifier;
    private final AtomicProposition variable;

    /**
     * @throws IllegalArgumentException se il connettivo non è un quantificatore
     *                                  o la variabile è una costante di verità
     */
    public QuantifierBinding(Connective quantifier, AtomicProposition variable) {
        Objects.requireNonNull(quantifier, "Il quantificatore non può essere null");
        Objects.requireNonNull(variable, "La variabile non può essere null");
        if (!quantifier.isQuantifier()) {
            throw new IllegalArgumentException("Il connettivo " + quantifier.name() + " non è un quantificatore");
        }
        if (variable instanceof TruthConstant) {
            throw new IllegalArgumentException("Impossibile quantificare la costante " + variable);
        }
        this.quantifier = quantifier;
        this.variable = variable;
    }

    public static QuantifierBinding exists(AtomicProposition variable) {
        return new QuantifierBinding(Connective.EXIST, variable);
    }

    public static QuantifierBinding forAll(AtomicProposition variable) {
        return new QuantifierBinding(Connective.UNIV, variable);
    }

    public Connective getQuantifier() {
        return quantifier;
    }

    public AtomicProposition getVariable() {
        return variable;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        QuantifierBinding other = (QuantifierBinding) obj;
        return quantifier == other.quantifier && variable.equals(other.variable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(quantifier, variable);
    }

    @Override
    public String toString() {
        return (quantifier == Connective.EXIST ? "∃" : "∀") + variable;
    }
}
