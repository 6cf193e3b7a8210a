package org.logica.solver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.logica.exception.SolverException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@DisplayName("Esecuzione di processi esterni")
class SubprocessRunnerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private SubprocessRunner runner;

    @BeforeEach
    void setUp() {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "Shell POSIX non disponibile");
        runner = new SubprocessRunner();
    }

    private static List<String> shell(String script) {
        return List.of("/bin/sh", "-c", script);
    }

    @Test
    @DisplayName("L'input viene passato sullo standard input")
    void shouldPassInputOnStdin() {
        assertEquals("a & !b", runner.run(shell("cat"), "a & !b", TIMEOUT));
    }

    @Test
    @DisplayName("Lo standard output viene restituito")
    void shouldReturnStdout() {
        String output = runner.run(shell("cat >/dev/null; echo '% VALID formula'"), "a | !a", TIMEOUT);

        assertTrue(output.contains(LimbooleSolver.VALID_MARKER));
    }

    @Test
    @DisplayName("Codice di uscita non nullo")
    void shouldFailOnNonZeroExit() {
        SolverException e = assertThrows(SolverException.class,
                () -> runner.run(shell("cat >/dev/null; echo boom >&2; exit 3"), "a", TIMEOUT));

        assertTrue(e.getMessage().contains("3"));
        assertTrue(e.getMessage().contains("boom"));
        assertEquals("a", e.getProposition());
    }

    @Test
    @DisplayName("Il processo viene terminato allo scadere del timeout")
    void shouldTimeOut() {
        SolverException e = assertThrows(SolverException.class,
                () -> runner.run(shell("exec sleep 5"), "a", Duration.ofMillis(200)));

        assertTrue(e.getMessage().contains("interrotto"));
    }

    @Test
    @DisplayName("Comando inesistente")
    void shouldFailOnMissingCommand() {
        assertThrows(SolverException.class,
                () -> runner.run(List.of("/nonexistent/limboole-" + System.nanoTime()), "a", TIMEOUT));
    }
}
