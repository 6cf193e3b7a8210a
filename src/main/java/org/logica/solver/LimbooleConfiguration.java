package org.logica.solver;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Configurazione dell'invocazione di limboole: comando (eseguibile ed eventuali
 * argomenti fissi) e timeout per singola chiamata.
 *
 * PROPRIETÀ DI SISTEMA RICONOSCIUTE:
 * • {@value #COMMAND_PROPERTY}: comando separato da spazi (default "limboole")
 * • {@value #TIMEOUT_PROPERTY}: timeout in millisecondi (default 1000)
 */
public final class LimbooleConfiguration {

    public static final String COMMAND_PROPERTY = "logica.limboole.command";
    public static final String TIMEOUT_PROPERTY = "logica.limboole.timeout";

    public static final List<String> DEFAULT_COMMAND = List.of("limboole");
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1);

    private final List<String> command;
    private final Duration timeout;

    /**
     * @throws IllegalArgumentException se il comando è vuoto o il timeout non è positivo
     */
    public LimbooleConfiguration(List<String> command, Duration timeout) {
        Objects.requireNonNull(command, "Il comando non può essere null");
        Objects.requireNonNull(timeout, "Il timeout non può essere null");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Il comando di limboole non può essere vuoto");
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Il timeout deve essere positivo, ricevuto: " + timeout);
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    public static LimbooleConfiguration defaults() {
        return new LimbooleConfiguration(DEFAULT_COMMAND, DEFAULT_TIMEOUT);
    }

    /**
     * Legge la configurazione dalle proprietà di sistema, usando i default per quelle assenti.
     *
     * @throws IllegalArgumentException se il timeout non è un numero intero positivo
     */
    public static LimbooleConfiguration fromSystemProperties() {
        String commandValue = System.getProperty(COMMAND_PROPERTY);
        List<String> command = commandValue == null || commandValue.isBlank()
                ? DEFAULT_COMMAND
                : Arrays.asList(commandValue.trim().split("\\s+"));

        String timeoutValue = System.getProperty(TIMEOUT_PROPERTY);
        Duration timeout = DEFAULT_TIMEOUT;
        if (timeoutValue != null && !timeoutValue.isBlank()) {
            try {
                timeout = Duration.ofMillis(Long.parseLong(timeoutValue.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore di " + TIMEOUT_PROPERTY + " non valido: " + timeoutValue, e);
            }
        }
        return new LimbooleConfiguration(command, timeout);
    }

    public LimbooleConfiguration withCommand(List<String> command) {
        return new LimbooleConfiguration(command, timeout);
    }

    public LimbooleConfiguration withTimeout(Duration timeout) {
        return new LimbooleConfiguration(command, timeout);
    }

    public List<String> getCommand() {
        return command;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "LimbooleConfiguration{command=" + command + ", timeout=" + timeout.toMillis() + "ms}";
    }
}
