package org.logica.solver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.logica.exception.LogicException;
import org.logica.exception.SolverException;
import org.logica.proposition.AtomicProposition;
import org.logica.proposition.Proposition;
import org.logica.proposition.TruthConstant;
import org.logica.qbf.PQBF;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Ponte verso limboole")
class LimbooleSolverTest {

    private static final Duration TIMEOUT = Duration.ofMillis(500);

    @Mock
    private CommandRunner runner;

    private LimbooleSolver solver;
    private AtomicProposition a;
    private AtomicProposition b;

    @BeforeEach
    void setUp() {
        solver = new LimbooleSolver(new LimbooleConfiguration(List.of("limboole"), TIMEOUT), runner);
        a = AtomicProposition.named("a");
        b = AtomicProposition.named("b");
    }

    @SuppressWarnings("unchecked")
    private List<String> capturedCommand() {
        ArgumentCaptor<List<String>> command = ArgumentCaptor.forClass(List.class);
        verify(runner).run(command.capture(), anyString(), eq(TIMEOUT));
        return command.getValue();
    }

    @Test
    @DisplayName("Validità senza opzioni")
    void shouldCheckValidity() {
        when(runner.run(anyList(), anyString(), any(Duration.class))).thenReturn("% VALID formula\n");

        assertTrue(solver.valid(a.or(a.not())));
        assertEquals(List.of("limboole"), capturedCommand());
        verify(runner).run(anyList(), eq("a | !a"), any(Duration.class));
    }

    @Test
    @DisplayName("Formula non valida")
    void shouldReportInvalid() {
        when(runner.run(anyList(), anyString(), any(Duration.class)))
                .thenReturn("% INVALID formula\na = 0\n");

        assertFalse(solver.valid(a));
    }

    @Test
    @DisplayName("Soddisfacibilità con l'opzione -s")
    void shouldCheckSatisfiability() {
        when(runner.run(anyList(), anyString(), any(Duration.class)))
                .thenReturn("% SATISFIABLE formula (satisfying assignment follows)\na = 1\n");

        assertTrue(solver.sat(a));
        assertEquals(List.of("limboole", "-s"), capturedCommand());
    }

    @Test
    @DisplayName("Lettura del modello")
    void shouldParseModel() {
        when(runner.run(anyList(), anyString(), any(Duration.class)))
                .thenReturn("% SATISFIABLE formula (satisfying assignment follows)\na = 1\nb = 0\n\n");

        Map<AtomicProposition, Boolean> model = solver.model(a.and(b.not()));

        assertEquals(Map.of(a, true, b, false), model);
    }

    @Test
    @DisplayName("Le costanti di verità vengono ignorate nel modello")
    void shouldIgnoreTruthConstantsInModel() {
        when(runner.run(anyList(), anyString(), any(Duration.class)))
                .thenReturn("% SATISFIABLE formula\ntop = 1\na = 1\nbottom = 0\nsconosciuta = 1\n");

        Map<AtomicProposition, Boolean> model = solver.model(a.or(TruthConstant.BOTTOM));

        assertEquals(Map.of(a, true), model);
    }

    @Test
    @DisplayName("Formula insoddisfacibile: modello vuoto")
    void shouldReturnEmptyModelWhenUnsatisfiable() {
        when(runner.run(anyList(), anyString(), any(Duration.class)))
                .thenReturn("% UNSATISFIABLE formula\n");

        assertTrue(solver.model(a.and(a.not())).isEmpty());
    }

    @Test
    @DisplayName("Valore del modello non booleano")
    void shouldRejectMalformedModelValue() {
        when(runner.run(anyList(), anyString(), any(Duration.class)))
                .thenReturn("% SATISFIABLE formula\na = forse\n");

        SolverException e = assertThrows(SolverException.class, () -> solver.model(a));
        assertTrue(e.getMessage().contains("forse"));
    }

    @Test
    @DisplayName("Riga del modello senza assegnamento")
    void shouldRejectMalformedModelLine() {
        when(runner.run(anyList(), anyString(), any(Duration.class)))
                .thenReturn("% SATISFIABLE formula\na 1\n");

        assertThrows(SolverException.class, () -> solver.model(a));
    }

    @Test
    @DisplayName("Valore numerico diverso da 0 e 1")
    void shouldRejectNonBinaryValue() {
        when(runner.run(anyList(), anyString(), any(Duration.class)))
                .thenReturn("% SATISFIABLE formula\na = 2\n");

        assertThrows(SolverException.class, () -> solver.model(a));
    }

    @Test
    @DisplayName("Le formule quantificate non vengono inviate al solutore proposizionale")
    void shouldRejectQuantifiedProposition() {
        Proposition quantified = a.exists(a.or(b));

        assertThrows(LogicException.class, () -> solver.valid(quantified));
        assertThrows(LogicException.class, () -> solver.sat(quantified));
        assertThrows(LogicException.class, () -> solver.model(quantified));
        verifyNoInteractions(runner);
    }

    @Test
    @DisplayName("Gli errori del processo vengono propagati")
    void shouldPropagateRunnerFailure() {
        when(runner.run(anyList(), anyString(), any(Duration.class)))
                .thenThrow(SolverException.processFailure(2, "errore", "a"));

        SolverException e = assertThrows(SolverException.class, () -> solver.sat(a));
        assertTrue(e.getMessage().contains("errore"));
    }

    @Test
    @DisplayName("Formule prenesse: validità con --depqbf")
    void shouldCheckPqbfValidity() {
        when(runner.run(anyList(), anyString(), any(Duration.class))).thenReturn("% VALID formula\n");

        assertTrue(solver.valid(PQBF.fromFormula(a.exists(a.or(a.not())))));
        assertEquals(List.of("limboole", "--depqbf"), capturedCommand());
        verify(runner).run(anyList(), eq("?a a | !a"), any(Duration.class));
    }

    @Test
    @DisplayName("Formule prenesse: soddisfacibilità con --depqbf e -s")
    void shouldCheckPqbfSatisfiability() {
        when(runner.run(anyList(), anyString(), any(Duration.class))).thenReturn("% UNSATISFIABLE formula\n");

        assertFalse(solver.sat(PQBF.fromFormula(a.forAll(a))));
        assertEquals(List.of("limboole", "--depqbf", "-s"), capturedCommand());
    }

    @Test
    @DisplayName("I metodi di Proposition delegano al solutore dato")
    void shouldDelegateFromProposition() {
        when(runner.run(anyList(), anyString(), any(Duration.class))).thenReturn("% VALID formula\n");

        assertTrue(a.implies(a).valid(solver));
    }
}
