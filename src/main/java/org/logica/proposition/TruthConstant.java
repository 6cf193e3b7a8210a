package org.logica.proposition;

import org.logica.format.ConnectiveFormat;

import java.util.Map;

/**
 * Costanti di verità ⊤ e ⊥. Sono proposizioni atomiche con id riservati
 * (1 e 0) che valutano sempre al proprio valore e non possono essere assegnate.
 */
public final class TruthConstant extends AtomicProposition {

    public static final TruthConstant BOTTOM = new TruthConstant(AtomicRegistry.BOTTOM_ID, "bottom", false);
    public static final TruthConstant TOP = new TruthConstant(AtomicRegistry.TOP_ID, "top", true);

    private final boolean value;

    private TruthConstant(long id, String name, boolean value) {
        super(id, name);
        this.value = value;
    }

    public static TruthConstant valueOf(boolean value) {
        return value ? TOP : BOTTOM;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    protected boolean evaluate(Map<AtomicProposition, Boolean> assignment) {
        return value;
    }

    @Override
    protected Proposition substitute(Map<AtomicProposition, Boolean> assignment) {
        return this;
    }

    @Override
    protected String format(ConnectiveFormat format, Proposition parent) {
        return value ? format.getTopSymbol() : format.getBottomSymbol();
    }

    @Override
    public Proposition copy() {
        return this;
    }
}
