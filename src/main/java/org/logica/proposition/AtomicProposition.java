package org.logica.proposition;

import org.logica.exception.LogicException;
import org.logica.format.ConnectiveFormat;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * PROPOSIZIONE ATOMICA - Foglia dell'albero, identificata da un id univoco
 *
 * L'identità è data esclusivamente dall'id: due atomi con lo stesso nome visualizzato
 * ma creati separatamente sono proposizioni diverse. Il nome volatile serve solo alla
 * stampa; se non fornito viene generato in sequenza (a, b, ..., z, a′, ...).
 */
public class AtomicProposition extends Proposition {

    private final long id;
    private final String volatileName;

    /**
     * Nuova proposizione atomica con nome generato.
     */
    public AtomicProposition() {
        this.id = AtomicRegistry.nextId();
        this.volatileName = AtomicRegistry.nextVolatileName(getClass());
    }

    /**
     * Nuova proposizione atomica con nome visualizzato esplicito.
     */
    protected AtomicProposition(String volatileName) {
        this.id = AtomicRegistry.nextId();
        this.volatileName = requireName(volatileName);
    }

    /**
     * Proposizione atomica con id riservato, per le costanti di verità.
     */
    AtomicProposition(long reservedId, String volatileName) {
        this.id = AtomicRegistry.claimId(reservedId);
        this.volatileName = requireName(volatileName);
    }

    /**
     * Crea una proposizione atomica con il nome dato, ad esempio una variabile letta dal parser.
     *
     * @throws IllegalArgumentException se il nome è vuoto
     */
    public static AtomicProposition named(String name) {
        return new AtomicProposition(name);
    }

    private static String requireName(String name) {
        Objects.requireNonNull(name, "Il nome non può essere null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Il nome di una proposizione atomica non può essere vuoto");
        }
        return name;
    }

    public long getId() {
        return id;
    }

    public String getVolatileName() {
        return volatileName;
    }

    @Override
    protected boolean evaluate(Map<AtomicProposition, Boolean> assignment) {
        Boolean value = assignment.get(this);
        if (value == null) {
            throw new LogicException("Nessun valore di verità per la proposizione nell'assegnamento "
                    + assignmentToString(assignment), toString());
        }
        return value;
    }

    @Override
    protected Proposition substitute(Map<AtomicProposition, Boolean> assignment) {
        Boolean value = assignment.get(this);
        if (value == null) {
            return this;
        }
        return TruthConstant.valueOf(value);
    }

    @Override
    protected String format(ConnectiveFormat format, Proposition parent) {
        return format.format(Connective.NONE, List.of(format.formatName(volatileName)));
    }

    /**
     * @return una nuova proposizione atomica con nome generato
     */
    @Override
    public Proposition copy() {
        return new AtomicProposition();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AtomicProposition)) return false;
        return id == ((AtomicProposition) obj).id;
    }

    @Override
    public int hashCode() {
        return 31 * Connective.NONE.ordinal() + Long.hashCode(id);
    }
}
