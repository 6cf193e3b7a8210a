package org.logica.proposition;

import org.logica.exception.LogicException;
import org.logica.exception.LogicSyntaxException;
import org.logica.format.ConnectiveFormat;
import org.logica.solver.LimbooleSolver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * PROPOSIZIONE - Albero immutabile di connettivi su proposizioni atomiche
 *
 * Una proposizione è formata da una lista ordinata di proposizioni figlie unite da un
 * {@link Connective}. Il numero di figli è vincolato dall'arità del connettivo e viene
 * verificato a ogni costruzione.
 *
 * FORMA CANONICA:
 * Tutte le proposizioni nascono dal metodo factory {@link #of(Connective, Collection)},
 * che applica le regole di canonicalizzazione prima di creare il nodo:
 * • ¬⊤ → ⊥, ¬⊥ → ⊤, ¬¬a → a
 * • (a) → a (il connettivo identità NONE non sopravvive mai)
 * • P ∧ (a ∧ ...) → P ∧ a ∧ ..., analogamente per ∨ (appiattimento)
 * • duplicati rimossi nei nodi n-ari preservando l'ordine di prima apparizione
 * Poiché i figli sono già canonici, una sola passata basta e la canonicalizzazione
 * è idempotente.
 *
 * UGUAGLIANZA:
 * Strutturale e con hash calcolato una sola volta in costruzione. AND e OR hanno
 * semantica di insieme, quindi l'ordine dei figli non conta; per gli altri connettivi
 * i figli sono confrontati in ordine. Due proposizioni uguali hanno la stessa forma
 * canonica, non semplicemente lo stesso valore di verità.
 *
 * Oltre a figli e connettivo, ogni nodo memorizza l'insieme delle proposizioni atomiche
 * e dei connettivi raggiungibili, calcolati una volta sola (i nodi sono immutabili).
 */
public class Proposition {

    private static final Logger LOGGER = Logger.getLogger(Proposition.class.getName());

    /** Proposizione vuota, elemento neutro delle combinazioni */
    private static final Proposition EMPTY_PROPOSITION = new Proposition(Connective.EMPTY, List.of());

    //region STRUTTURA DATI

    private final Connective connective;
    private final List<Proposition> propositions;
    private final Set<AtomicProposition> seenAtomicPropositions;
    private final Set<Connective> seenConnectives;
    private final int hash;

    //endregion

    //region COSTRUZIONE E CANONICALIZZAZIONE

    /**
     * Costruisce un nodo composto già canonico. Usato solo dalla factory.
     */
    private Proposition(Connective connective, List<Proposition> propositions) {
        this.connective = connective;
        this.propositions = List.copyOf(propositions);

        Set<AtomicProposition> atoms = new LinkedHashSet<>();
        Set<Connective> connectives = EnumSet.of(connective);
        for (Proposition p : this.propositions) {
            atoms.addAll(p.seenAtomicPropositions);
            connectives.addAll(p.seenConnectives);
        }
        this.seenAtomicPropositions = Collections.unmodifiableSet(atoms);
        this.seenConnectives = Collections.unmodifiableSet(connectives);
        this.hash = computeHash(connective, this.propositions);
    }

    /**
     * Costruisce una foglia atomica: connettivo NONE, nessun figlio, vede solo se stessa.
     * Uguaglianza e hash sono ridefiniti da {@link AtomicProposition}.
     */
    Proposition() {
        this.connective = Connective.NONE;
        this.propositions = List.of();
        this.seenAtomicPropositions = Collections.singleton((AtomicProposition) this);
        this.seenConnectives = Collections.unmodifiableSet(EnumSet.of(Connective.NONE));
        this.hash = 0;
    }

    /**
     * @see #of(Connective, Collection)
     */
    public static Proposition of(Connective connective, Proposition... propositions) {
        return of(connective, Arrays.asList(propositions));
    }

    /**
     * METODO FACTORY PRINCIPALE - Costruisce la forma canonica di (connettivo, operandi).
     *
     * Per i connettivi n-ari la proposizione vuota è elemento neutro e viene scartata;
     * con 0 operandi si ottiene la proposizione vuota, con 1 operando l'operando stesso.
     *
     * @param connective connettivo che unisce gli operandi
     * @param propositions operandi, tutti non null
     * @return proposizione canonica, eventualmente un'istanza già esistente
     * @throws IllegalArgumentException se il numero di operandi non rispetta l'arità
     * @throws LogicSyntaxException se un quantificatore lega una proposizione non atomica
     */
    public static Proposition of(Connective connective, Collection<? extends Proposition> propositions) {
        Objects.requireNonNull(connective, "Il connettivo non può essere null");
        List<Proposition> operands = new ArrayList<>(propositions.size());
        for (Proposition p : propositions) {
            operands.add(Objects.requireNonNull(p, "Gli operandi non possono contenere null"));
        }

        if (connective.getArity() == ConnectiveArity.NARY) {
            operands.removeIf(Proposition::isEmpty);
            if (operands.isEmpty()) {
                return EMPTY_PROPOSITION;
            } else if (operands.size() == 1) {
                return operands.get(0);
            }
        }

        if (!connective.getArity().accepts(operands.size())) {
            throw new IllegalArgumentException("Numero di operandi incompatibile con il connettivo "
                    + connective.name() + ", ricevuti " + operands.size() + " ma attesi "
                    + connective.getArity().getDescription());
        }

        return canonicalize(operands, connective);
    }

    /**
     * Applica le regole di canonicalizzazione alla coppia (operandi, connettivo).
     * Gli operandi sono già canonici per invariante.
     */
    private static Proposition canonicalize(List<Proposition> operands, Connective connective) {
        return switch (connective) {
            case EMPTY -> EMPTY_PROPOSITION;
            case NONE -> operands.get(0);
            case NEG -> canonicalNegation(operands.get(0));
            case AND, OR -> canonicalJunction(operands, connective);
            case EXIST, UNIV -> canonicalQuantifier(operands, connective);
            case R_IMPL, L_IMPL, IFF -> new Proposition(connective, operands);
        };
    }

    private static Proposition canonicalNegation(Proposition operand) {
        if (operand == TruthConstant.TOP) {
            return TruthConstant.BOTTOM;
        } else if (operand == TruthConstant.BOTTOM) {
            return TruthConstant.TOP;
        } else if (operand.connective == Connective.NEG) {
            // ¬¬a → a
            return operand.propositions.get(0);
        }
        return new Proposition(Connective.NEG, List.of(operand));
    }

    private static Proposition canonicalJunction(List<Proposition> operands, Connective connective) {
        // Appiattimento: P ∧ (a ∧ b) → P ∧ a ∧ b, in posizione
        List<Proposition> flattened = new ArrayList<>();
        for (Proposition p : operands) {
            if (p.connective == connective) {
                flattened.addAll(p.propositions);
            } else {
                flattened.add(p);
            }
        }

        // Eliminazione duplicati preservando ordine
        List<Proposition> unique = new ArrayList<>(new LinkedHashSet<>(flattened));
        if (unique.size() == 1) {
            return unique.get(0);
        }
        return new Proposition(connective, unique);
    }

    private static Proposition canonicalQuantifier(List<Proposition> operands, Connective connective) {
        Proposition variable = operands.get(0);
        if (!variable.isAtomic() || variable instanceof TruthConstant) {
            throw new LogicSyntaxException("La proposizione quantificata deve essere atomica",
                    variable.toString(), 1);
        }
        return new Proposition(connective, operands);
    }

    /**
     * Riapplica la canonicalizzazione a questo nodo. Su una proposizione esistente
     * il risultato è sempre uguale a {@code this}.
     */
    public Proposition canonicalize() {
        if (isAtomic()) {
            return this;
        }
        return of(connective, propositions);
    }

    /**
     * @return la proposizione vuota (connettivo EMPTY)
     */
    public static Proposition empty() {
        return EMPTY_PROPOSITION;
    }

    /**
     * Congiunzione n-aria degli operandi.
     */
    public static Proposition conjunction(Proposition... propositions) {
        return of(Connective.AND, propositions);
    }

    /**
     * Congiunzione n-aria degli operandi.
     */
    public static Proposition conjunction(Collection<? extends Proposition> propositions) {
        return of(Connective.AND, propositions);
    }

    /**
     * Disgiunzione n-aria degli operandi.
     */
    public static Proposition disjunction(Proposition... propositions) {
        return of(Connective.OR, propositions);
    }

    /**
     * Disgiunzione n-aria degli operandi.
     */
    public static Proposition disjunction(Collection<? extends Proposition> propositions) {
        return of(Connective.OR, propositions);
    }

    //endregion

    //region COMBINATORI

    public Proposition not() {
        return of(Connective.NEG, this);
    }

    public Proposition and(Proposition other) {
        return binaryOperator(other, Connective.AND);
    }

    public Proposition and(boolean other) {
        return and(TruthConstant.valueOf(other));
    }

    public Proposition or(Proposition other) {
        return binaryOperator(other, Connective.OR);
    }

    public Proposition or(boolean other) {
        return or(TruthConstant.valueOf(other));
    }

    /**
     * @return this → other
     */
    public Proposition implies(Proposition other) {
        return binaryOperator(other, Connective.R_IMPL);
    }

    public Proposition implies(boolean other) {
        return implies(TruthConstant.valueOf(other));
    }

    /**
     * @return this ← other
     */
    public Proposition impliedBy(Proposition other) {
        return binaryOperator(other, Connective.L_IMPL);
    }

    public Proposition impliedBy(boolean other) {
        return impliedBy(TruthConstant.valueOf(other));
    }

    /**
     * @return this ↔ other
     */
    public Proposition iff(Proposition other) {
        return binaryOperator(other, Connective.IFF);
    }

    public Proposition iff(boolean other) {
        return iff(TruthConstant.valueOf(other));
    }

    /**
     * Quantifica esistenzialmente {@code body} su questa proposizione, che deve essere atomica.
     *
     * @return ∃this. body
     * @throws LogicSyntaxException se questa proposizione non è atomica
     */
    public Proposition exists(Proposition body) {
        return of(Connective.EXIST, this, body);
    }

    /**
     * Quantifica universalmente {@code body} su questa proposizione, che deve essere atomica.
     *
     * @return ∀this. body
     * @throws LogicSyntaxException se questa proposizione non è atomica
     */
    public Proposition forAll(Proposition body) {
        return of(Connective.UNIV, this, body);
    }

    /**
     * Quantifica esistenzialmente {@code body} su tutte le variabili, la prima più esterna.
     */
    public static Proposition exists(List<? extends Proposition> variables, Proposition body) {
        return quantifyAll(variables, body, Connective.EXIST);
    }

    /**
     * Quantifica universalmente {@code body} su tutte le variabili, la prima più esterna.
     */
    public static Proposition forAll(List<? extends Proposition> variables, Proposition body) {
        return quantifyAll(variables, body, Connective.UNIV);
    }

    private static Proposition quantifyAll(List<? extends Proposition> variables, Proposition body,
                                           Connective quantifier) {
        Proposition result = body;
        for (int i = variables.size() - 1; i >= 0; i--) {
            result = of(quantifier, variables.get(i), result);
        }
        return result;
    }

    /**
     * Unisce due proposizioni; la proposizione vuota fa da elemento neutro.
     */
    private Proposition binaryOperator(Proposition other, Connective connective) {
        Objects.requireNonNull(other, "Impossibile combinare con null");
        if (isEmpty()) {
            return other;
        }
        if (other.isEmpty()) {
            return this;
        }
        return of(connective, this, other);
    }

    //endregion

    //region ACCESSORS E PROPRIETÀ STRUTTURALI

    public Connective getConnective() {
        return connective;
    }

    /**
     * @return le proposizioni figlie, lista immutabile
     */
    public List<Proposition> getPropositions() {
        return propositions;
    }

    public Proposition getProposition(int index) {
        return propositions.get(index);
    }

    public int size() {
        return propositions.size();
    }

    /**
     * @return insieme immutabile delle proposizioni atomiche raggiungibili da questo nodo
     */
    public Set<AtomicProposition> getSeenAtomicPropositions() {
        return seenAtomicPropositions;
    }

    /**
     * @return insieme immutabile dei connettivi raggiungibili da questo nodo
     */
    public Set<Connective> getSeenConnectives() {
        return seenConnectives;
    }

    public boolean isEmpty() {
        return connective == Connective.EMPTY;
    }

    public boolean isAtomic() {
        return this instanceof AtomicProposition;
    }

    /**
     * @return true se atomica o negazione di una proposizione atomica
     */
    public boolean isLiteral() {
        return isAtomic() || (connective == Connective.NEG && propositions.get(0).isAtomic());
    }

    /**
     * @return true se è un quantificatore su variabile atomica, eventualmente negato
     */
    public boolean isQuantifier() {
        if (connective.isQuantifier()) {
            return propositions.get(0).isAtomic();
        }
        return connective == Connective.NEG && propositions.get(0).isQuantifier();
    }

    /**
     * @return true se un qualsiasi sotto-nodo è un quantificatore
     */
    public boolean isQuantified() {
        return seenConnectives.contains(Connective.EXIST) || seenConnectives.contains(Connective.UNIV);
    }

    /**
     * @return true se uno dei figli diretti è uguale a {@code item}
     */
    public boolean contains(Proposition item) {
        for (Proposition p : propositions) {
            if (p.equals(item)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Forma normale congiuntiva: AND di letterali o di OR di letterali.
     */
    public boolean isCnf() {
        return isNormalForm(Connective.AND);
    }

    /**
     * Forma normale disgiuntiva: OR di letterali o di AND di letterali.
     */
    public boolean isDnf() {
        return isNormalForm(Connective.OR);
    }

    private boolean isNormalForm(Connective outer) {
        if (connective != outer) {
            return false;
        }
        Connective inner = outer.dual();
        for (Proposition p : propositions) {
            boolean clause = p.connective == inner && p.propositions.stream().allMatch(Proposition::isLiteral);
            if (!p.isLiteral() && !clause) {
                return false;
            }
        }
        return true;
    }

    /**
     * Verifica se questa proposizione compare come sotto-proposizione di {@code other}.
     * Un nodo n-ario è sotto-proposizione di un nodo con lo stesso connettivo che ne
     * contiene tutti i figli.
     */
    public boolean isSubProposition(Proposition other) {
        if (equals(other)) {
            return true;
        }
        if (connective.getArity() == ConnectiveArity.NARY && connective == other.connective
                && propositions.stream().allMatch(other::contains)) {
            return true;
        }
        for (Proposition p : other.propositions) {
            if (equals(p) || (!p.isAtomic() && isSubProposition(p))) {
                return true;
            }
        }
        return false;
    }

    //endregion

    //region VALUTAZIONE

    /**
     * Valuta la proposizione sotto l'assegnamento dato.
     *
     * @param assignment mappa proposizione atomica → valore di verità
     * @return il valore di verità della proposizione
     * @throws IllegalArgumentException se l'assegnamento contiene ⊤ o ⊥
     * @throws LogicException se la proposizione è quantificata o vuota, o se manca un valore
     */
    public boolean eval(Map<AtomicProposition, Boolean> assignment) {
        checkAssignment(assignment);
        requireUnquantified("valutare");
        return evaluate(assignment);
    }

    /**
     * Valutazione ricorsiva, senza i controlli già eseguiti da {@link #eval(Map)}.
     */
    protected boolean evaluate(Map<AtomicProposition, Boolean> assignment) {
        return switch (connective) {
            case EMPTY -> throw new LogicException(
                    "Impossibile determinare il valore di verità di una proposizione vuota senza contesto", toString());
            case NEG -> !propositions.get(0).evaluate(assignment);
            case R_IMPL -> !propositions.get(0).evaluate(assignment) || propositions.get(1).evaluate(assignment);
            case L_IMPL -> propositions.get(0).evaluate(assignment) || !propositions.get(1).evaluate(assignment);
            case IFF -> propositions.get(0).evaluate(assignment) == propositions.get(1).evaluate(assignment);
            case AND -> propositions.stream().allMatch(p -> p.evaluate(assignment));
            case OR -> propositions.stream().anyMatch(p -> p.evaluate(assignment));
            case NONE, EXIST, UNIV -> throw new IllegalStateException(
                    "Nessun caso di valutazione per il connettivo " + connective.name());
        };
    }

    /**
     * @see #partialEval(Map, boolean)
     */
    public Proposition partialEval(Map<AtomicProposition, Boolean> assignment) {
        return partialEval(assignment, false);
    }

    /**
     * Valutazione parziale: sostituisce le proposizioni atomiche assegnate con ⊤ o ⊥,
     * lasciando intatto il resto dell'albero (ricanonicalizzato).
     *
     * @param assignment assegnamento, anche parziale
     * @param simplify se true applica {@code expand().reduce()} al risultato
     * @return la proposizione parzialmente valutata
     * @throws LogicException se la proposizione è quantificata
     */
    public Proposition partialEval(Map<AtomicProposition, Boolean> assignment, boolean simplify) {
        checkAssignment(assignment);
        requireUnquantified("valutare parzialmente");

        Proposition result = substitute(assignment);
        LOGGER.finest(() -> "Valutazione parziale: " + this + " -> " + result);
        return simplify ? result.expand().reduce() : result;
    }

    /**
     * Sostituzione ricorsiva delle proposizioni atomiche assegnate.
     */
    protected Proposition substitute(Map<AtomicProposition, Boolean> assignment) {
        if (propositions.isEmpty()) {
            return this;
        }
        List<Proposition> substituted = new ArrayList<>(propositions.size());
        for (Proposition p : propositions) {
            substituted.add(p.substitute(assignment));
        }
        return of(connective, substituted);
    }

    /**
     * @throws IllegalArgumentException se l'assegnamento contiene ⊤ o ⊥
     */
    static void checkAssignment(Map<AtomicProposition, Boolean> assignment) {
        Objects.requireNonNull(assignment, "L'assegnamento non può essere null");
        if (assignment.containsKey(TruthConstant.TOP) || assignment.containsKey(TruthConstant.BOTTOM)) {
            throw new IllegalArgumentException("Impossibile assegnare Top o Bottom nell'assegnamento: "
                    + assignmentToString(assignment));
        }
    }

    /**
     * @throws LogicException se la proposizione contiene quantificatori
     */
    public void requireUnquantified(String actionName) {
        if (isQuantified()) {
            throw new LogicException("Impossibile " + actionName
                    + " una formula quantificata, usare PQBF al suo posto", toString());
        }
    }

    static String assignmentToString(Map<AtomicProposition, Boolean> assignment) {
        return assignment.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    //endregion

    //region TRASFORMAZIONI

    /**
     * Riduce la proposizione a una rappresentazione sintattica più compatta,
     * logicamente equivalente.
     *
     * @see PropositionReducer
     */
    public Proposition reduce() {
        return PropositionReducer.reduce(this);
    }

    /**
     * Espande la proposizione eliminando implicazioni e bicondizionali e
     * distribuendo i letterali sui nodi del connettivo opposto.
     *
     * @see PropositionExpander
     */
    public Proposition expand() {
        return PropositionExpander.expand(this);
    }

    /**
     * Porta le negazioni sulle foglie (forma normale negata).
     *
     * @see NegationSimplifier
     */
    public Proposition simplifyNegations() {
        return NegationSimplifier.simplify(this);
    }

    /**
     * Copia profonda con nuove proposizioni atomiche al posto delle originali.
     * Le costanti di verità sono conservate.
     */
    public Proposition copy() {
        Map<AtomicProposition, Proposition> fresh = new HashMap<>();
        for (AtomicProposition atom : seenAtomicPropositions) {
            fresh.put(atom, atom.copy());
        }
        return copyWith(fresh);
    }

    private Proposition copyWith(Map<AtomicProposition, Proposition> fresh) {
        if (isAtomic()) {
            return fresh.get((AtomicProposition) this);
        }
        List<Proposition> copied = new ArrayList<>(propositions.size());
        for (Proposition p : propositions) {
            copied.add(p.copyWith(fresh));
        }
        return of(connective, copied);
    }

    //endregion

    //region SOLUTORE ESTERNO

    /**
     * @return true se la formula è valida secondo limboole
     * @see LimbooleSolver#valid(Proposition)
     */
    public boolean valid() {
        return valid(LimbooleSolver.defaultSolver());
    }

    public boolean valid(LimbooleSolver solver) {
        return solver.valid(this);
    }

    /**
     * @return true se la formula è soddisfacibile secondo limboole
     * @see LimbooleSolver#sat(Proposition)
     */
    public boolean sat() {
        return sat(LimbooleSolver.defaultSolver());
    }

    public boolean sat(LimbooleSolver solver) {
        return solver.sat(this);
    }

    /**
     * @return un modello della formula, mappa vuota se insoddisfacibile
     * @see LimbooleSolver#model(Proposition)
     */
    public Map<AtomicProposition, Boolean> model() {
        return model(LimbooleSolver.defaultSolver());
    }

    public Map<AtomicProposition, Boolean> model(LimbooleSolver solver) {
        return solver.model(this);
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Formatta la proposizione secondo la tabella data.
     */
    public String format(ConnectiveFormat format) {
        return format(format, null);
    }

    /**
     * Formattazione ricorsiva in profondità. Un figlio viene racchiuso tra parentesi
     * a meno che sia la radice, sia unario o sia il corpo di un quantificatore.
     */
    protected String format(ConnectiveFormat format, Proposition parent) {
        List<String> operands = new ArrayList<>(propositions.size());
        for (Proposition p : propositions) {
            operands.add(p.format(format, this));
        }
        String out = format.format(connective, operands);

        boolean ignoreParentheses = parent == null
                || connective.getArity() == ConnectiveArity.UNARY
                || (parent.connective.isQuantifier() && parent.propositions.get(1) == this);
        return ignoreParentheses ? out : "(" + out + ")";
    }

    public String toPrettyPrint() {
        return format(ConnectiveFormat.PRETTY_PRINT);
    }

    public String toLimboole() {
        return format(ConnectiveFormat.LIMBOOLE);
    }

    /**
     * @return la formula in sintassi LaTeX, racchiusa tra delimitatori {@code $...$}
     */
    public String toLatex() {
        return "$" + format(ConnectiveFormat.LATEX) + "$";
    }

    @Override
    public String toString() {
        return toPrettyPrint();
    }

    //endregion

    //region UGUAGLIANZA E HASH

    private static int computeHash(Connective connective, List<Proposition> propositions) {
        int result = connective.ordinal();
        if (connective.isJunction()) {
            // Somma commutativa: AND e OR hanno semantica di insieme
            int operandsHash = 0;
            for (Proposition p : propositions) {
                operandsHash += p.hashCode();
            }
            return 31 * result + operandsHash;
        }
        for (Proposition p : propositions) {
            result = 31 * result + p.hashCode();
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Proposition) || obj instanceof AtomicProposition) return false;

        Proposition other = (Proposition) obj;
        if (hash != other.hash || connective != other.connective
                || propositions.size() != other.propositions.size()) {
            return false;
        }
        if (connective.isJunction()) {
            return new HashSet<>(propositions).equals(new HashSet<>(other.propositions));
        }
        return propositions.equals(other.propositions);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    //endregion
}
