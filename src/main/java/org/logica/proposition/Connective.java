package org.logica.proposition;

/**
 * CONNETTIVI LOGICI - Operatori che combinano proposizioni
 *
 * Ogni connettivo possiede un'arità (vedi {@link ConnectiveArity}) e una "forza"
 * di legame relativa agli altri connettivi (ad esempio la negazione lega più
 * dell'implicazione materiale). La forza serve solo alla stampa.
 *
 * CONNETTIVI DISPONIBILI:
 * • EMPTY: nessun operatore, proposizione vuota (nullaria)
 * • NONE: nessun operatore, identità (unaria)
 * • NEG: negazione (unaria)
 * • EXIST / UNIV: quantificazione esistenziale / universale (variabile atomica + corpo)
 * • AND / OR: congiunzione / disgiunzione (n-arie)
 * • R_IMPL / L_IMPL: implicazione "sinistra implica destra" e viceversa (binarie)
 * • IFF: bicondizionale (binaria)
 */
public enum Connective {

    EMPTY(ConnectiveArity.NILARY, 100),
    NONE(ConnectiveArity.UNARY, 100),
    NEG(ConnectiveArity.UNARY, 80),
    EXIST(ConnectiveArity.BINARY, 80),
    UNIV(ConnectiveArity.BINARY, 80),
    AND(ConnectiveArity.NARY, 50),
    OR(ConnectiveArity.NARY, 40),
    R_IMPL(ConnectiveArity.BINARY, 30),
    L_IMPL(ConnectiveArity.BINARY, 30),
    IFF(ConnectiveArity.BINARY, 20);

    private final ConnectiveArity arity;
    private final int strength;

    Connective(ConnectiveArity arity, int strength) {
        this.arity = arity;
        this.strength = strength;
    }

    public ConnectiveArity getArity() {
        return arity;
    }

    public int getStrength() {
        return strength;
    }

    /**
     * @return true se questo connettivo lega più strettamente di {@code other}
     */
    public boolean bindsTighterThan(Connective other) {
        return strength > other.strength;
    }

    /**
     * @return true per AND e OR
     */
    public boolean isJunction() {
        return this == AND || this == OR;
    }

    /**
     * @return true per EXIST e UNIV
     */
    public boolean isQuantifier() {
        return this == EXIST || this == UNIV;
    }

    /**
     * @return true per R_IMPL e L_IMPL
     */
    public boolean isImplication() {
        return this == R_IMPL || this == L_IMPL;
    }

    /**
     * Connettivo duale rispetto a De Morgan: AND ↔ OR, EXIST ↔ UNIV.
     *
     * @throws IllegalStateException se il connettivo non ha un duale
     */
    public Connective dual() {
        return switch (this) {
            case AND -> OR;
            case OR -> AND;
            case EXIST -> UNIV;
            case UNIV -> EXIST;
            default -> throw new IllegalStateException("Il connettivo " + name() + " non ha un duale");
        };
    }
}
