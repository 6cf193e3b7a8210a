package org.logica.solver;

import org.logica.exception.SolverException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * ESECUTORE DI PROCESSI - Invocazione di un comando esterno con timeout
 *
 * FLUSSO ESECUZIONE:
 * 1. Avvio del processo con {@link ProcessBuilder}
 * 2. Lettura di stdout e stderr su due thread dedicati (evita il blocco sui buffer pieni)
 * 3. Scrittura dell'input su stdin e chiusura dello stream
 * 4. Attesa della terminazione entro il timeout; allo scadere il processo viene terminato
 *
 * Ogni invocazione è indipendente: nessuno stato è condiviso tra chiamate.
 */
public class SubprocessRunner implements CommandRunner {

    private static final Logger LOGGER = Logger.getLogger(SubprocessRunner.class.getName());

    @Override
    public String run(List<String> command, String input, Duration timeout) {
        LOGGER.fine(() -> "Avvio processo " + command + " (timeout: " + timeout.toMillis() + " ms)");
        long start = System.nanoTime();

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new SolverException("Impossibile avviare il processo " + command + ": " + e.getMessage(), input, e);
        }

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<String> stdout = executor.submit(() -> readFully(process.getInputStream()));
            Future<String> stderr = executor.submit(() -> readFully(process.getErrorStream()));

            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(input.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                // Il processo può chiudere stdin prima di leggere tutto l'input
                LOGGER.fine(() -> "Scrittura su stdin interrotta: " + e.getMessage());
            }

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                LOGGER.warning("Timeout raggiunto dopo " + elapsed.toMillis() + " ms, processo terminato");
                throw SolverException.timeout(elapsed, input);
            }

            String out = stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            String err = stderr.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                LOGGER.warning("Processo " + command + " terminato con codice " + exitCode);
                throw SolverException.processFailure(exitCode, err, input);
            }

            LOGGER.finest(() -> "Output del processo:\n" + out);
            return out;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new SolverException("Attesa del processo interrotta", input, e);
        } catch (ExecutionException e) {
            throw new SolverException("Errore durante la lettura dell'output del processo", input, e.getCause());
        } catch (TimeoutException e) {
            process.destroyForcibly();
            throw SolverException.timeout(Duration.ofNanos(System.nanoTime() - start), input);
        } finally {
            executor.shutdownNow();
        }
    }

    private static String readFully(InputStream stream) throws IOException {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
