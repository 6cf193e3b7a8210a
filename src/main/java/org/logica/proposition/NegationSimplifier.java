package org.logica.proposition;

import java.util.ArrayList;
import java.util.List;

/**
 * Porta le negazioni verso le foglie:
 * • ¬(a → b) ⇒ a ∧ ¬b
 * • ¬(a ← b) ⇒ ¬a ∧ b
 * • ¬(a ↔ b) ⇒ (a ∨ b) ∧ (¬a ∨ ¬b)
 * • ¬∃a. P ⇒ ∀a. ¬P, ¬∀a. P ⇒ ∃a. ¬P
 * • ¬(a ∧ b ∧ ...) ⇒ ¬a ∨ ¬b ∨ ..., e duale
 * La doppia negazione è già eliminata dalla forma canonica.
 */
final class NegationSimplifier {

    private NegationSimplifier() {
    }

    static Proposition simplify(Proposition proposition) {
        if (proposition.isAtomic()) {
            return proposition;
        }

        if (proposition.getConnective() == Connective.NEG && !proposition.isLiteral()) {
            Proposition negated = proposition.getProposition(0);
            switch (negated.getConnective()) {
                case R_IMPL -> {
                    Proposition u = negated.getProposition(0);
                    Proposition v = negated.getProposition(1);
                    return simplify(u).and(simplify(v.not()));
                }
                case L_IMPL -> {
                    Proposition u = negated.getProposition(0);
                    Proposition v = negated.getProposition(1);
                    return simplify(u.not()).and(simplify(v));
                }
                case IFF -> {
                    Proposition u = negated.getProposition(0);
                    Proposition v = negated.getProposition(1);
                    return simplify(u).or(simplify(v)).and(simplify(u.not()).or(simplify(v.not())));
                }
                case EXIST, UNIV -> {
                    Proposition variable = negated.getProposition(0);
                    Proposition body = simplify(negated.getProposition(1).not());
                    return Proposition.of(negated.getConnective().dual(), variable, body);
                }
                case AND, OR -> {
                    List<Proposition> operands = new ArrayList<>(negated.size());
                    for (Proposition p : negated.getPropositions()) {
                        operands.add(simplify(p.not()));
                    }
                    return Proposition.of(negated.getConnective().dual(), operands);
                }
                default -> {
                    // EMPTY non ha figli da negare
                }
            }
        }

        List<Proposition> operands = new ArrayList<>(proposition.size());
        for (Proposition p : proposition.getPropositions()) {
            operands.add(simplify(p));
        }
        return Proposition.of(proposition.getConnective(), operands);
    }
}
