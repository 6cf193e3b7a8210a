package org.logica.proposition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * RIDUTTORE DI PROPOSIZIONI - Riscrittura verso una forma sintatticamente più compatta
 *
 * Tutte le regole preservano l'equivalenza logica. La riduzione procede dall'alto: se
 * una regola si applica al nodo corrente il risultato viene a sua volta ridotto,
 * altrimenti si riducono i figli e si ricostruisce il nodo, con un'ulteriore passata
 * di assestamento (profondità massima 1) per cogliere i pattern appena esposti.
 *
 * I figli di congiunzioni e disgiunzioni sono esaminati nell'{@link CanonicalOrder}.
 * Se l'ingresso non contiene implicazioni né bicondizionali, il risultato viene poi
 * ri-espanso e ri-ridotto fino a un punto fisso, quindi expand().reduce() applicato al
 * proprio risultato lo restituisce invariato. Se la sequenza entra in un ciclo si sceglie
 * il membro più piccolo del ciclo.
 *
 * IMPLICAZIONE (a ← b è trattata come b → a):
 * • ⊥ → a, a → ⊤, a → a, a ∧ ... → a, a → a ∨ ...   ⇒ ⊤
 * • a → ⊥, a → ¬a ∧ ...                             ⇒ ¬a
 * • ⊤ → b, ¬b ∨ ... → b                            ⇒ b
 *
 * BICONDIZIONALE:
 * • a ↔ ⊤ ⇒ a, a ↔ ⊥ ⇒ ¬a, a ↔ a ⇒ ⊤, a ↔ ¬a ⇒ ⊥
 *
 * CONGIUNZIONE / DISGIUNZIONE (per ogni coppia ordinata di figli, prima le semplificazioni
 * poi il riconoscimento delle ultime tre regole):
 * • ⊤ ∧ P ⇒ P, ⊥ ∧ ... ⇒ ⊥, ⊤ ∨ ... ⇒ ⊤, ⊥ ∨ P ⇒ P
 * • a ∧ ¬a ∧ ... ⇒ ⊥, a ∨ ¬a ∨ ... ⇒ ⊤
 * • a ∧ (a ∨ ...) ∧ P ⇒ a ∧ P (assorbimento, e duale)
 * • (P ∧ Q) ∨ (P ∧ R) ∨ S ⇒ (P ∧ (Q ∨ R)) ∨ S (raccoglimento, e duale)
 * • ¬P ∨ Q ∨ R ⇒ (P → Q) ∨ R
 * • (P → Q) ∧ (Q → P) ∧ R ⇒ (P ↔ Q) ∧ R
 * • (P ∧ Q) ∨ (¬P ∧ ¬Q) ∨ R ⇒ (P ↔ Q) ∨ R
 */
final class PropositionReducer {

    private static final Logger LOGGER = Logger.getLogger(PropositionReducer.class.getName());

    /** Numero di passate di assestamento dopo la ricostruzione di un nodo */
    private static final int SETTLE_DEPTH = 1;

    /** Limite ai giri di espansione e riduzione nella ricerca del punto fisso */
    private static final int MAX_FIXPOINT_ROUNDS = 32;

    private static final Set<Connective> EXPANDED_CONNECTIVES =
            EnumSet.of(Connective.R_IMPL, Connective.L_IMPL, Connective.IFF);

    private PropositionReducer() {
    }

    static Proposition reduce(Proposition proposition) {
        Proposition reduced = reduce(proposition, 0);
        if (Collections.disjoint(proposition.getSeenConnectives(), EXPANDED_CONNECTIVES)) {
            reduced = fixpoint(reduced);
        }
        Proposition result = reduced;
        LOGGER.finest(() -> "Riduzione: " + proposition + " -> " + result);
        return result;
    }

    private static Proposition reduce(Proposition proposition, int depth) {
        if (proposition.isLiteral()) {
            return proposition;
        }

        Connective connective = proposition.getConnective();
        Proposition rewritten = null;
        if (connective.isImplication()) {
            rewritten = reduceImplication(proposition);
        } else if (connective == Connective.IFF) {
            rewritten = reduceBiconditional(proposition);
        } else if (connective.isJunction()) {
            rewritten = reduceJunction(proposition);
        }
        if (rewritten != null) {
            return rewritten;
        }

        // Nessuna regola applicabile: riduzione dei figli e passata di assestamento
        List<Proposition> children = new ArrayList<>(proposition.size());
        for (Proposition p : proposition.getPropositions()) {
            children.add(reduce(p, 0));
        }
        Proposition rebuilt = Proposition.of(connective, children);
        return depth < SETTLE_DEPTH ? reduce(rebuilt, depth + 1) : rebuilt;
    }

    /**
     * Alterna espansione e riduzione finché il risultato non cambia più.
     *
     * @return il punto fisso raggiunto, o il membro minimo del ciclo in cui la sequenza ricade
     */
    private static Proposition fixpoint(Proposition reduced) {
        List<Proposition> visited = new ArrayList<>();
        visited.add(reduced);
        Proposition current = reduced;
        for (int round = 0; round < MAX_FIXPOINT_ROUNDS; round++) {
            Proposition next = reduce(PropositionExpander.expand(current), 0);
            if (next.equals(current)) {
                return current;
            }
            int cycleStart = visited.indexOf(next);
            if (cycleStart >= 0) {
                return Collections.min(visited.subList(cycleStart, visited.size()), CanonicalOrder.SMALLEST_FIRST);
            }
            visited.add(next);
            current = next;
        }
        LOGGER.fine(() -> "Punto fisso non raggiunto in " + MAX_FIXPOINT_ROUNDS + " giri per " + reduced);
        return current;
    }

    //region IMPLICAZIONE E BICONDIZIONALE

    private static Proposition reduceImplication(Proposition proposition) {
        Proposition p = proposition.getProposition(0);
        Proposition q = proposition.getProposition(1);
        if (proposition.getConnective() == Connective.L_IMPL) {
            Proposition swap = p;
            p = q;
            q = swap;
        }

        if (p == TruthConstant.BOTTOM || q == TruthConstant.TOP || p.equals(q)
                || (p.getConnective() == Connective.AND && p.contains(q))
                || (q.getConnective() == Connective.OR && q.contains(p))) {
            return TruthConstant.TOP;
        } else if (q == TruthConstant.BOTTOM
                || (q.getConnective() == Connective.AND && q.contains(p.not()))) {
            return reduce(p.not(), 0);
        } else if (p == TruthConstant.TOP
                || (p.getConnective() == Connective.OR && p.contains(q.not()))) {
            return reduce(q, 0);
        }
        return null;
    }

    private static Proposition reduceBiconditional(Proposition proposition) {
        Proposition p = proposition.getProposition(0);
        Proposition q = proposition.getProposition(1);

        if (p == TruthConstant.TOP) {
            return reduce(q, 0);
        } else if (q == TruthConstant.TOP) {
            return reduce(p, 0);
        } else if (p == TruthConstant.BOTTOM) {
            return reduce(q.not(), 0);
        } else if (q == TruthConstant.BOTTOM) {
            return reduce(p.not(), 0);
        } else if (p.equals(q)) {
            return TruthConstant.TOP;
        } else if (p.equals(q.not())) {
            return TruthConstant.BOTTOM;
        }
        return null;
    }

    //endregion

    //region CONGIUNZIONE E DISGIUNZIONE

    private static Proposition reduceJunction(Proposition proposition) {
        Connective connective = proposition.getConnective();
        Set<Proposition> children = new LinkedHashSet<>(proposition.getPropositions());

        // Elemento neutro ed elemento assorbente
        TruthConstant neutral = connective == Connective.AND ? TruthConstant.TOP : TruthConstant.BOTTOM;
        TruthConstant absorbing = connective == Connective.AND ? TruthConstant.BOTTOM : TruthConstant.TOP;
        if (children.contains(absorbing)) {
            return absorbing;
        } else if (children.contains(neutral)) {
            return rebuildWithout(connective, children, List.of(neutral));
        }

        List<Proposition> ordered = CanonicalOrder.sorted(new ArrayList<>(children));
        children = new LinkedHashSet<>(ordered);

        // Prima le regole di semplificazione su tutte le coppie, poi il riconoscimento
        for (Proposition p : ordered) {
            for (Proposition q : ordered) {
                if (p == q) {
                    continue;
                }
                Proposition rewritten = simplifyPair(connective, children, p, q);
                if (rewritten != null) {
                    return rewritten;
                }
            }
        }
        for (Proposition p : ordered) {
            for (Proposition q : ordered) {
                if (p == q) {
                    continue;
                }
                Proposition rewritten = detectPair(connective, children, p, q);
                if (rewritten != null) {
                    return rewritten;
                }
            }
        }
        return null;
    }

    /**
     * Applica le regole di semplificazione sulla coppia ordinata (p, q) di figli distinti del nodo.
     *
     * @return il nodo riscritto e ridotto, o null se nessuna regola si applica
     */
    private static Proposition simplifyPair(Connective connective, Set<Proposition> children,
                                            Proposition p, Proposition q) {
        Connective dual = connective.dual();

        if (p.equals(q.not())) {
            // Coppia complementare
            return connective == Connective.AND ? TruthConstant.BOTTOM : TruthConstant.TOP;
        } else if (p.isLiteral() ^ q.isLiteral()) {
            // Assorbimento
            Proposition compound = q.isLiteral() ? p : q;
            Proposition literal = q.isLiteral() ? q : p;
            if (compound.getConnective() == dual && compound.contains(literal)) {
                return rebuildWithout(connective, children, List.of(compound));
            }
        } else if (!p.isLiteral() && !q.isLiteral()
                && p.getConnective() == dual && q.getConnective() == dual) {
            return factor(connective, children, p, q);
        }
        return null;
    }

    /**
     * Riconosce implicazioni e bicondizionali nella coppia ordinata (p, q).
     *
     * @return il nodo riscritto e ridotto, o null se la coppia non forma alcun pattern
     */
    private static Proposition detectPair(Connective connective, Set<Proposition> children,
                                          Proposition p, Proposition q) {
        if (connective == Connective.OR
                && (p.getConnective() == Connective.NEG ^ q.getConnective() == Connective.NEG)) {
            // ¬P ∨ Q ⇒ P → Q
            Proposition negated = p.getConnective() == Connective.NEG ? p : q;
            Proposition other = negated == p ? q : p;
            return rebuildReplacing(connective, children, p, q, negated.getProposition(0).implies(other));
        } else if (connective == Connective.AND && p.getConnective().isImplication()
                && q.getConnective().isImplication()) {
            // (P → Q) ∧ (Q → P) ⇒ P ↔ Q
            Proposition[] first = rightImplicationView(p);
            Proposition[] second = rightImplicationView(q);
            if (first[0].equals(second[1]) && first[1].equals(second[0])) {
                return rebuildReplacing(connective, children, p, q, first[0].iff(first[1]));
            }
        } else if (connective == Connective.OR && isBinaryConjunction(p) && isBinaryConjunction(q)) {
            // (P ∧ Q) ∨ (¬P ∧ ¬Q) ⇒ P ↔ Q
            List<Proposition> operands = CanonicalOrder.sorted(p.getPropositions());
            Proposition u = operands.get(0);
            Proposition v = operands.get(1);
            if (new HashSet<>(q.getPropositions()).equals(Set.of(u.not(), v.not()))) {
                return rebuildReplacing(connective, children, p, q, u.iff(v));
            }
        }
        return null;
    }

    /**
     * Raccoglimento del fattore comune di due figli del connettivo duale. Se gli operandi di
     * un figlio sono tutti contenuti nell'altro, l'altro viene eliminato per assorbimento.
     */
    private static Proposition factor(Connective connective, Set<Proposition> children,
                                      Proposition p, Proposition q) {
        Set<Proposition> common = new LinkedHashSet<>(p.getPropositions());
        common.retainAll(q.getPropositions());
        if (common.isEmpty()) {
            return null;
        }

        List<Proposition> pRest = new ArrayList<>(p.getPropositions());
        pRest.removeAll(common);
        List<Proposition> qRest = new ArrayList<>(q.getPropositions());
        qRest.removeAll(common);

        if (pRest.isEmpty()) {
            return rebuildWithout(connective, children, List.of(q));
        } else if (qRest.isEmpty()) {
            return rebuildWithout(connective, children, List.of(p));
        }

        Connective dual = p.getConnective();
        List<Proposition> operands = new ArrayList<>(common);
        operands.add(Proposition.of(connective, Proposition.of(dual, pRest), Proposition.of(dual, qRest)));
        return rebuildReplacing(connective, children, p, q, Proposition.of(dual, operands));
    }

    /**
     * @return [premessa, conseguenza] dell'implicazione letta come "premessa → conseguenza"
     */
    private static Proposition[] rightImplicationView(Proposition implication) {
        Proposition a = implication.getProposition(0);
        Proposition b = implication.getProposition(1);
        return implication.getConnective() == Connective.L_IMPL
                ? new Proposition[]{b, a}
                : new Proposition[]{a, b};
    }

    private static boolean isBinaryConjunction(Proposition proposition) {
        return proposition.getConnective() == Connective.AND && proposition.size() == 2;
    }

    private static Proposition rebuildWithout(Connective connective, Set<Proposition> children,
                                              List<Proposition> removed) {
        List<Proposition> remaining = new ArrayList<>(children);
        remaining.removeAll(removed);
        return reduce(Proposition.of(connective, remaining), 0);
    }

    private static Proposition rebuildReplacing(Connective connective, Set<Proposition> children,
                                                Proposition p, Proposition q, Proposition replacement) {
        List<Proposition> operands = new ArrayList<>();
        operands.add(replacement);
        for (Proposition child : children) {
            if (!child.equals(p) && !child.equals(q)) {
                operands.add(child);
            }
        }
        return reduce(Proposition.of(connective, operands), 0);
    }

    //endregion
}
