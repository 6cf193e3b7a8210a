package org.logica.solver;

import java.time.Duration;
import java.util.List;

/**
 * Esecutore di un comando esterno: passa {@code input} sullo standard input del
 * processo e ne restituisce lo standard output.
 *
 * Implementazioni diverse da {@link SubprocessRunner} servono a sostituire il
 * processo reale, ad esempio nei test.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @param command comando e argomenti
     * @param input testo da scrivere sullo standard input
     * @param timeout tempo massimo di attesa per la terminazione
     * @return lo standard output completo del processo
     * @throws org.logica.exception.SolverException in caso di uscita non nulla, timeout o errore di I/O
     */
    String run(List<String> command, String input, Duration timeout);
}
