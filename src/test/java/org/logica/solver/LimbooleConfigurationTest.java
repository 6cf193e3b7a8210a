package org.logica.solver;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Configurazione di limboole")
class LimbooleConfigurationTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(LimbooleConfiguration.COMMAND_PROPERTY);
        System.clearProperty(LimbooleConfiguration.TIMEOUT_PROPERTY);
    }

    @Test
    @DisplayName("Valori predefiniti")
    void shouldProvideDefaults() {
        LimbooleConfiguration configuration = LimbooleConfiguration.defaults();

        assertEquals(List.of("limboole"), configuration.getCommand());
        assertEquals(Duration.ofSeconds(1), configuration.getTimeout());
    }

    @Test
    @DisplayName("Senza proprietà di sistema si usano i valori predefiniti")
    void shouldFallBackToDefaults() {
        LimbooleConfiguration configuration = LimbooleConfiguration.fromSystemProperties();

        assertEquals(LimbooleConfiguration.DEFAULT_COMMAND, configuration.getCommand());
        assertEquals(LimbooleConfiguration.DEFAULT_TIMEOUT, configuration.getTimeout());
    }

    @Test
    @DisplayName("Lettura dalle proprietà di sistema")
    void shouldReadSystemProperties() {
        System.setProperty(LimbooleConfiguration.COMMAND_PROPERTY, " /opt/limboole/limboole  -v ");
        System.setProperty(LimbooleConfiguration.TIMEOUT_PROPERTY, "2500");

        LimbooleConfiguration configuration = LimbooleConfiguration.fromSystemProperties();

        assertEquals(List.of("/opt/limboole/limboole", "-v"), configuration.getCommand());
        assertEquals(Duration.ofMillis(2500), configuration.getTimeout());
    }

    @Test
    @DisplayName("Timeout non numerico nelle proprietà di sistema")
    void shouldRejectInvalidTimeoutProperty() {
        System.setProperty(LimbooleConfiguration.TIMEOUT_PROPERTY, "presto");

        assertThrows(IllegalArgumentException.class, LimbooleConfiguration::fromSystemProperties);
    }

    @Test
    @DisplayName("Comando vuoto o timeout non positivo")
    void shouldValidateValues() {
        LimbooleConfiguration defaults = LimbooleConfiguration.defaults();

        assertThrows(IllegalArgumentException.class, () -> defaults.withCommand(List.of()));
        assertThrows(IllegalArgumentException.class, () -> defaults.withTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> defaults.withTimeout(Duration.ofMillis(-1)));
    }

    @Test
    @DisplayName("Le copie modificate non alterano l'originale")
    void shouldCopyOnChange() {
        LimbooleConfiguration defaults = LimbooleConfiguration.defaults();
        LimbooleConfiguration custom = defaults.withTimeout(Duration.ofSeconds(5)).withCommand(List.of("lb"));

        assertEquals(List.of("lb"), custom.getCommand());
        assertEquals(Duration.ofSeconds(5), custom.getTimeout());
        assertEquals(LimbooleConfiguration.DEFAULT_TIMEOUT, defaults.getTimeout());
    }
}
