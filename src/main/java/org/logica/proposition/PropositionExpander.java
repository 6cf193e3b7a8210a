package org.logica.proposition;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.logging.Logger;

/**
 * ESPANSORE DI PROPOSIZIONI - Riscrittura verso una forma sintatticamente meno compatta
 *
 * Elimina implicazioni e bicondizionali e distribuisce i letterali sui nodi del
 * connettivo opposto:
 * • a → b ⇒ ¬a ∨ b
 * • a ← b ⇒ a ∨ ¬b
 * • a ↔ b ⇒ (a ∧ b) ∨ (¬a ∧ ¬b)
 * • a ∧ (b ∨ c ∨ ...) ∧ P ⇒ ((a ∧ b) ∨ (a ∧ c) ∨ ...) ∧ P
 * • a ∨ (b ∧ c ∧ ...) ∨ P ⇒ ((a ∨ b) ∧ (a ∨ c) ∧ ...) ∨ P
 *
 * Se il figlio duale contiene già il letterale si applica invece l'assorbimento:
 * • a ∧ (a ∨ ...) ∧ P ⇒ a ∧ P
 * • a ∨ (a ∧ ...) ∨ P ⇒ a ∨ P
 *
 * I quantificatori restano al loro posto, il loro corpo viene espanso.
 */
final class PropositionExpander {

    private static final Logger LOGGER = Logger.getLogger(PropositionExpander.class.getName());

    private PropositionExpander() {
    }

    static Proposition expand(Proposition proposition) {
        Proposition expanded = expandRecursive(proposition);
        LOGGER.finest(() -> "Espansione: " + proposition + " -> " + expanded);
        return expanded;
    }

    private static Proposition expandRecursive(Proposition proposition) {
        if (proposition.isLiteral()) {
            return proposition;
        }

        Connective connective = proposition.getConnective();
        switch (connective) {
            case R_IMPL, L_IMPL, IFF -> {
                Proposition p = expandRecursive(proposition.getProposition(0));
                Proposition q = expandRecursive(proposition.getProposition(1));
                Proposition rewritten = switch (connective) {
                    case R_IMPL -> p.not().or(q);
                    case L_IMPL -> p.or(q.not());
                    default -> p.and(q).or(p.not().and(q.not()));
                };
                return expandRecursive(rewritten);
            }
            case AND, OR -> {
                List<Proposition> children = new ArrayList<>(new LinkedHashSet<>(expandAll(proposition)));
                Proposition distributed = distribute(connective, children);
                if (distributed != null) {
                    return expandRecursive(distributed);
                }
                return Proposition.of(connective, children);
            }
            default -> {
                return Proposition.of(connective, expandAll(proposition));
            }
        }
    }

    /**
     * Cerca un letterale e un figlio del connettivo duale, scorrendo i figli nell'ordine
     * canonico, e distribuisce il primo sul secondo, oppure elimina il secondo per
     * assorbimento se contiene il primo.
     *
     * @return il nodo distribuito, o null se nessuna coppia è applicabile
     */
    private static Proposition distribute(Connective connective, List<Proposition> children) {
        Connective dual = connective.dual();
        List<Proposition> candidates = CanonicalOrder.sorted(children);
        for (Proposition literal : candidates) {
            if (!literal.isLiteral()) {
                continue;
            }
            for (Proposition compound : candidates) {
                if (compound.isLiteral() || compound.getConnective() != dual) {
                    continue;
                }
                if (compound.contains(literal)) {
                    List<Proposition> remaining = new ArrayList<>(children);
                    remaining.remove(compound);
                    return Proposition.of(connective, remaining);
                }

                List<Proposition> distributedOperands = new ArrayList<>(compound.size());
                for (Proposition r : compound.getPropositions()) {
                    distributedOperands.add(Proposition.of(connective, literal, r));
                }

                List<Proposition> operands = new ArrayList<>();
                operands.add(Proposition.of(dual, distributedOperands));
                for (Proposition other : children) {
                    if (other != literal && other != compound) {
                        operands.add(other);
                    }
                }
                return Proposition.of(connective, operands);
            }
        }
        return null;
    }

    private static List<Proposition> expandAll(Proposition proposition) {
        List<Proposition> expanded = new ArrayList<>(proposition.size());
        for (Proposition p : proposition.getPropositions()) {
            expanded.add(expandRecursive(p));
        }
        return expanded;
    }
}
