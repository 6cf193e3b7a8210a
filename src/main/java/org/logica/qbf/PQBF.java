package org.logica.qbf;

import org.logica.exception.LogicException;
import org.logica.exception.LogicSyntaxException;
import org.logica.format.ConnectiveFormat;
import org.logica.proposition.AtomicProposition;
import org.logica.proposition.Connective;
import org.logica.proposition.Proposition;
import org.logica.proposition.TruthConstant;
import org.logica.solver.LimbooleSolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * FORMULA BOOLEANA QUANTIFICATA IN FORMA PRENESSA
 *
 * Composta da un prefisso ordinato di {@link QuantifierBinding} e da una matrice priva
 * di quantificatori. La formula completa si ottiene riavvolgendo il prefisso attorno
 * alla matrice, dal quantificatore più interno al più esterno.
 *
 * ELIMINAZIONE DEI QUANTIFICATORI:
 * {@link #partialEvalOutermost()} rimuove la prima variabile del prefisso sostituendola
 * con ⊤ in un ramo e con ⊥ nell'altro; {@link #assignmentTree()} ripete il procedimento
 * fino a svuotare il prefisso, producendo un albero binario di profondità |prefisso|
 * le cui foglie contengono matrici ground.
 */
public class PQBF {

    private static final Logger LOGGER = Logger.getLogger(PQBF.class.getName());

    private final List<QuantifierBinding> prefix;
    private final Proposition matrix;
    private final Proposition formula;
    private final Set<AtomicProposition> quantifiedVars;
    private final Set<AtomicProposition> freeVars;

    /**
     * @param prefix quantificatori dal più esterno al più interno. Se una variabile è legata
     *               più volte resta solo il legame più interno, che nasconde gli altri
     * @param matrix matrice priva di quantificatori
     * @throws LogicSyntaxException se la matrice contiene quantificatori
     */
    public PQBF(List<QuantifierBinding> prefix, Proposition matrix) {
        if (matrix.isQuantified()) {
            throw new LogicSyntaxException("La matrice non è in forma prenessa", matrix.toString(), -1);
        }

        this.prefix = innermostBindings(prefix);
        this.matrix = matrix;

        Proposition wrapped = matrix;
        for (int i = this.prefix.size() - 1; i >= 0; i--) {
            QuantifierBinding binding = this.prefix.get(i);
            wrapped = Proposition.of(binding.getQuantifier(), binding.getVariable(), wrapped);
        }
        this.formula = wrapped;

        Set<AtomicProposition> quantified = new LinkedHashSet<>();
        for (QuantifierBinding binding : this.prefix) {
            quantified.add(binding.getVariable());
        }
        this.quantifiedVars = Collections.unmodifiableSet(quantified);

        Set<AtomicProposition> free = new LinkedHashSet<>();
        for (AtomicProposition atom : matrix.getSeenAtomicPropositions()) {
            if (!(atom instanceof TruthConstant) && !quantified.contains(atom)) {
                free.add(atom);
            }
        }
        this.freeVars = Collections.unmodifiableSet(free);
    }

    private static List<QuantifierBinding> innermostBindings(List<QuantifierBinding> prefix) {
        Set<AtomicProposition> bound = new HashSet<>();
        List<QuantifierBinding> kept = new ArrayList<>(prefix.size());
        for (int i = prefix.size() - 1; i >= 0; i--) {
            QuantifierBinding binding = prefix.get(i);
            if (bound.add(binding.getVariable())) {
                kept.add(binding);
            } else {
                LOGGER.fine(() -> "Legame " + binding + " nascosto da uno più interno, rimosso");
            }
        }
        Collections.reverse(kept);
        return List.copyOf(kept);
    }

    /**
     * Separa una formula in prefisso e matrice.
     *
     * @throws LogicSyntaxException se un quantificatore lega più di una proposizione atomica
     *                              o se la formula non è in forma prenessa
     */
    public static PQBF fromFormula(Proposition formula) {
        List<QuantifierBinding> prefix = new ArrayList<>();
        Proposition current = formula;
        while (current.getConnective().isQuantifier()) {
            Set<AtomicProposition> atoms = current.getProposition(0).getSeenAtomicPropositions();
            if (atoms.size() != 1) {
                throw new LogicSyntaxException("Il quantificatore deve legare esattamente una proposizione "
                        + "atomica, trovate: " + atoms, current.toString(), -1);
            }
            prefix.add(new QuantifierBinding(current.getConnective(), atoms.iterator().next()));
            current = current.getProposition(1);
        }

        if (current.isQuantified()) {
            String formulaText = formula.toString();
            String currentText = current.toString();
            throw new LogicSyntaxException("La formula non è in forma prenessa, nessun quantificatore atteso in '"
                    + currentText + "'", formulaText, formulaText.indexOf(currentText));
        }

        LOGGER.fine(() -> "Forma prenessa: prefisso " + prefix + ", matrice " + formula);
        return new PQBF(prefix, current);
    }

    //region ACCESSORS

    public List<QuantifierBinding> getPrefix() {
        return prefix;
    }

    public Proposition getMatrix() {
        return matrix;
    }

    public Proposition getFormula() {
        return formula;
    }

    public Set<AtomicProposition> getQuantifiedVars() {
        return quantifiedVars;
    }

    public Set<AtomicProposition> getFreeVars() {
        return freeVars;
    }

    /**
     * @return il quantificatore della prima variabile del prefisso, null se il prefisso è vuoto
     */
    public Connective getOutermostQuantifier() {
        return prefix.isEmpty() ? null : prefix.get(0).getQuantifier();
    }

    //endregion

    //region ELIMINAZIONE DEI QUANTIFICATORI

    /**
     * Elimina la variabile più esterna del prefisso.
     *
     * @return i due rami, con la variabile posta rispettivamente a vero e a falso
     * @throws LogicException se il prefisso è vuoto
     */
    public Branches partialEvalOutermost() {
        if (prefix.isEmpty()) {
            throw new LogicException("Il prefisso contiene 0 variabili", toString());
        }

        AtomicProposition variable = prefix.get(0).getVariable();
        List<QuantifierBinding> remaining = prefix.subList(1, prefix.size());
        PQBF whenTrue = new PQBF(remaining, matrix.partialEval(Map.of(variable, true), true));
        PQBF whenFalse = new PQBF(remaining, matrix.partialEval(Map.of(variable, false), true));
        return new Branches(whenTrue, whenFalse);
    }

    /**
     * @return la radice dell'albero degli assegnamenti, i cui nodi sono costruiti su richiesta
     */
    public Node assignmentTree() {
        return new Node(this, null);
    }

    //endregion

    //region SOLUTORE ESTERNO

    public boolean valid() {
        return valid(LimbooleSolver.defaultSolver());
    }

    public boolean valid(LimbooleSolver solver) {
        return solver.valid(this);
    }

    public boolean sat() {
        return sat(LimbooleSolver.defaultSolver());
    }

    public boolean sat(LimbooleSolver solver) {
        return solver.sat(this);
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    public String format(ConnectiveFormat format) {
        return formula.format(format);
    }

    public String toPrettyPrint() {
        return formula.toPrettyPrint();
    }

    public String toLimboole() {
        return formula.toLimboole();
    }

    public String toLatex() {
        return formula.toLatex();
    }

    @Override
    public String toString() {
        return toPrettyPrint();
    }

    //endregion

    /**
     * Coppia di formule ottenuta eliminando la variabile più esterna.
     */
    public static final class Branches {

        private final PQBF whenTrue;
        private final PQBF whenFalse;

        Branches(PQBF whenTrue, PQBF whenFalse) {
            this.whenTrue = whenTrue;
            this.whenFalse = whenFalse;
        }

        public PQBF getWhenTrue() {
            return whenTrue;
        }

        public PQBF getWhenFalse() {
            return whenFalse;
        }
    }

    /**
     * NODO DELL'ALBERO DEGLI ASSEGNAMENTI
     *
     * Ogni nodo conserva la formula residua del proprio ramo. Il figlio sinistro assegna
     * vero alla variabile più esterna, il destro falso. I figli vengono calcolati alla
     * prima richiesta e poi conservati; la classe non è thread-safe.
     */
    public static final class Node {

        private final PQBF pqbf;
        private final Boolean assignmentValue;
        private Node left;
        private Node right;

        private Node(PQBF pqbf, Boolean assignmentValue) {
            this.pqbf = pqbf;
            this.assignmentValue = assignmentValue;
        }

        public PQBF getPqbf() {
            return pqbf;
        }

        /**
         * @return il quantificatore eliminato in questo nodo, null per le foglie
         */
        public Connective getQuantifier() {
            return pqbf.getOutermostQuantifier();
        }

        /**
         * @return il valore assegnato dal ramo che porta a questo nodo, null per la radice
         */
        public Boolean getAssignmentValue() {
            return assignmentValue;
        }

        public boolean isRoot() {
            return assignmentValue == null;
        }

        public boolean isLeaf() {
            return pqbf.getPrefix().isEmpty();
        }

        public int getNumChildren() {
            return isLeaf() ? 0 : 2;
        }

        /**
         * @return il ramo con la variabile più esterna a vero, null per le foglie
         */
        public Node getLeft() {
            expand();
            return left;
        }

        /**
         * @return il ramo con la variabile più esterna a falso, null per le foglie
         */
        public Node getRight() {
            expand();
            return right;
        }

        private void expand() {
            if (left == null && !isLeaf()) {
                Branches branches = pqbf.partialEvalOutermost();
                left = new Node(branches.getWhenTrue(), Boolean.TRUE);
                right = new Node(branches.getWhenFalse(), Boolean.FALSE);
            }
        }

        /**
         * Valore di verità del sottoalbero: per le foglie quello della matrice ground,
         * per i nodi interni la disgiunzione (∃) o la congiunzione (∀) dei due rami.
         */
        public boolean evalNode() {
            if (isLeaf()) {
                return leafValue();
            }
            return switch (getQuantifier()) {
                case EXIST -> getLeft().evalNode() || getRight().evalNode();
                case UNIV -> getLeft().evalNode() && getRight().evalNode();
                default -> throw new IllegalStateException("Quantificatore non valido: " + getQuantifier());
            };
        }

        private boolean leafValue() {
            // La radice senza prefisso non è passata da partialEvalOutermost
            Proposition matrix = isRoot() ? pqbf.getMatrix().expand().reduce() : pqbf.getMatrix();
            if (matrix.equals(TruthConstant.TOP)) {
                return true;
            }
            boolean ground = matrix.getSeenAtomicPropositions().stream().allMatch(a -> a instanceof TruthConstant);
            return ground && matrix.eval(Map.of());
        }

        /**
         * @return numero di foglie del sottoalbero, costruendolo per intero
         */
        public long countLeaves() {
            if (isLeaf()) {
                return 1;
            }
            return getLeft().countLeaves() + getRight().countLeaves();
        }

        /**
         * @return profondità del sottoalbero, pari alla lunghezza del prefisso
         */
        public int depth() {
            return pqbf.getPrefix().size();
        }

        @Override
        public String toString() {
            return pqbf.toString();
        }
    }
}
