package org.logica.proposition;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Espansione delle proposizioni")
class PropositionExpanderTest {

    private AtomicProposition a;
    private AtomicProposition b;
    private AtomicProposition c;

    @BeforeEach
    void setUp() {
        a = AtomicProposition.named("a");
        b = AtomicProposition.named("b");
        c = AtomicProposition.named("c");
    }

    @Test
    @DisplayName("Eliminazione di implicazioni e bicondizionale")
    void shouldEliminateImplications() {
        assertEquals(a.not().or(b), a.implies(b).expand());
        assertEquals(a.or(b.not()), a.impliedBy(b).expand());
        assertEquals(a.and(b).or(a.not().and(b.not())), a.iff(b).expand());
    }

    @Test
    @DisplayName("Distribuzione di un letterale sul connettivo opposto")
    void shouldDistributeLiteral() {
        assertEquals(a.and(b).or(a.and(c)), a.and(b.or(c)).expand());
        assertEquals(a.or(b).and(a.or(c)), a.or(b.and(c)).expand());
    }

    @Test
    @DisplayName("Assorbimento al posto della distribuzione")
    void shouldAbsorbInsteadOfDistributing() {
        assertEquals(a, a.and(a.or(b)).expand());
        assertEquals(a, a.or(a.and(b)).expand());
        assertEquals(a.not(), a.not().or(a.not().and(b)).expand());
        assertEquals(a.and(c), Proposition.conjunction(a, a.or(b), c).expand());
        assertSame(TruthConstant.TOP, TruthConstant.TOP.and(TruthConstant.TOP.or(c)).expand());
    }

    @Test
    @DisplayName("Valutazione parziale semplificata di una formula con assorbimento")
    void partialEvalShouldSimplifyAbsorbedFormulas() {
        Proposition p = Proposition.conjunction(a, a.or(b), c);

        assertEquals(a, p.partialEval(Map.of(c, true), true));
        assertSame(TruthConstant.TOP, a.and(a.or(b)).partialEval(Map.of(a, true), true));
        assertSame(TruthConstant.BOTTOM, a.and(a.or(b)).partialEval(Map.of(a, false), true));
    }

    @Test
    @DisplayName("L'espansione termina su tutte le formule di profondità 2")
    void shouldTerminateOnAllSmallFormulas() {
        List<AtomicProposition> atoms = List.of(a, b);
        List<Map<AtomicProposition, Boolean>> assignments = PropositionReducerTest.allAssignments(atoms);

        for (Proposition p : PropositionReducerTest.formulasUpToDepth(atoms, 2)) {
            Proposition expanded = p.expand();
            for (Map<AtomicProposition, Boolean> assignment : assignments) {
                assertEquals(p.eval(assignment), expanded.eval(assignment), () -> p + " espansa a " + expanded);
            }
        }
    }

    @Test
    @DisplayName("I letterali restano invariati")
    void literalsShouldBeUnchanged() {
        assertSame(a, a.expand());
        Proposition negated = a.not();
        assertSame(negated, negated.expand());
        assertSame(TruthConstant.TOP, TruthConstant.TOP.expand());
    }

    @Test
    @DisplayName("Il corpo dei quantificatori viene espanso")
    void shouldExpandQuantifierBody() {
        assertEquals(a.exists(a.not().or(b)), a.exists(a.implies(b)).expand());
    }

    @Test
    @DisplayName("Dopo l'espansione restano solo negazioni, congiunzioni e disgiunzioni")
    void shouldLeaveOnlyBasicConnectives() {
        List<Proposition> samples = List.of(
                a.implies(b.iff(c)),
                a.iff(b).and(c.impliedBy(a)),
                a.implies(b).implies(c).not(),
                a.or(b.and(c.implies(a))));

        for (Proposition p : samples) {
            Proposition expanded = p.expand();
            assertFalse(expanded.getSeenConnectives().contains(Connective.R_IMPL), expanded::toString);
            assertFalse(expanded.getSeenConnectives().contains(Connective.L_IMPL), expanded::toString);
            assertFalse(expanded.getSeenConnectives().contains(Connective.IFF), expanded::toString);

            for (Map<AtomicProposition, Boolean> assignment : PropositionReducerTest.allAssignments(List.of(a, b, c))) {
                assertEquals(p.eval(assignment), expanded.eval(assignment),
                        () -> p + " espansa a " + expanded + " con " + assignment);
            }
        }
    }
}
