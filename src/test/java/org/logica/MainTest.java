package org.logica;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

@DisplayName("Interfaccia a riga di comando")
class MainTest {

    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private int run(String... args) {
        return Main.run(args, out);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(MainTest.class.getResource(name).toURI());
    }

    @Test
    @DisplayName("Senza parametri termina con errore")
    void shouldFailWithoutArguments() {
        assertEquals(Main.EXIT_ERROR, run());
        assertTrue(output().startsWith("[E]"));
    }

    @Test
    @DisplayName("Messaggio di aiuto")
    void shouldPrintHelp() {
        assertEquals(Main.EXIT_OK, run("-h"));
        assertTrue(output().contains("Uso:"));
        assertTrue(output().contains("-check="));
    }

    @Test
    @DisplayName("Lettura e stampa della formula")
    void shouldEchoFormula() {
        assertEquals(Main.EXIT_OK, run("-e", "a & b -> c"));
        assertTrue(output().contains("[I] Formula letta: (a ∧ b) → c"));
    }

    @Test
    @DisplayName("Riduzione di una tautologia")
    void shouldReduceTautology() {
        assertEquals(Main.EXIT_OK, run("-e", "a | !a", "-op=reduce"));

        assertTrue(output().contains("[I] Dopo reduce: ⊤"));
        assertTrue(output().trim().endsWith("⊤"));
    }

    @Test
    @DisplayName("Operazioni in sequenza")
    void shouldApplyOperationsInOrder() {
        assertEquals(Main.EXIT_OK, run("-e", "!(a -> b)", "-op=nnf,expand"));

        String output = output();
        assertTrue(output.indexOf("[I] Dopo nnf: a ∧ ¬b") >= 0, output);
        assertTrue(output.indexOf("[I] Dopo expand: a ∧ ¬b") > output.indexOf("[I] Dopo nnf"), output);
    }

    @Test
    @DisplayName("Formati di output")
    void shouldFormatOutput() {
        assertEquals(Main.EXIT_OK, run("-e", "a ∧ ¬b", "-fmt=limboole"));
        assertTrue(output().contains("a & !b"));

        buffer.reset();
        assertEquals(Main.EXIT_OK, run("-e", "a -> b", "-fmt=latex"));
        assertTrue(output().contains("$a \\rightarrow b$"));
    }

    @Test
    @DisplayName("Albero degli assegnamenti")
    void shouldEvaluateAssignmentTree() {
        assertEquals(Main.EXIT_OK, run("-e", "? x x | !x", "-check=tree"));

        assertTrue(output().contains("profondità 1, foglie 2"));
        assertTrue(output().contains("[I] Valore: VERO"));
    }

    @Test
    @DisplayName("Formula letta da file con commenti")
    void shouldReadFormulaFromFile() throws URISyntaxException {
        assertEquals(Main.EXIT_OK, run("-f", resource("/formulas/prenex.txt").toString(), "-check=tree"));

        assertTrue(output().contains("[I] Formula letta: ∀a. ∃b. a ↔ b"), output());
        assertTrue(output().contains("profondità 2, foglie 4"));
        assertTrue(output().contains("[I] Valore: VERO"));
    }

    @Test
    @DisplayName("Formula da file temporaneo")
    void shouldReadTemporaryFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("formula.txt");
        Files.writeString(file, "% commento\n# a a\n");

        assertEquals(Main.EXIT_OK, run("-f", file.toString(), "-check=tree"));
        assertTrue(output().contains("[I] Valore: FALSO"));
    }

    @Test
    @DisplayName("Parametri non validi")
    void shouldRejectInvalidArguments() {
        assertEquals(Main.EXIT_ERROR, run("-e", "a", "-z"));
        assertTrue(output().contains("Parametro sconosciuto: -z"));

        assertEquals(Main.EXIT_ERROR, run("-e", "a", "-t", "0"));
        assertEquals(Main.EXIT_ERROR, run("-e", "a", "-t", "uno"));
        assertEquals(Main.EXIT_ERROR, run("-e", "a", "-op=semplifica"));
        assertEquals(Main.EXIT_ERROR, run("-e", "a", "-fmt=html"));
        assertEquals(Main.EXIT_ERROR, run("-e", "a", "-f", "formula.txt"));
        assertEquals(Main.EXIT_ERROR, run("-op=reduce"));
        assertEquals(Main.EXIT_ERROR, run("-f", "/nonexistent/formula.txt"));
        assertEquals(Main.EXIT_ERROR, run("-e"));
    }

    @Test
    @DisplayName("Errore di sintassi nella formula")
    void shouldReportSyntaxError() {
        assertEquals(Main.EXIT_ERROR, run("-e", "a & & b"));
        assertTrue(output().contains("[E] Errore di sintassi"));
    }

    @Test
    @DisplayName("Formula non prenessa con verifica dell'albero")
    void shouldRejectNonPrenexTree() {
        assertEquals(Main.EXIT_ERROR, run("-e", "(? a a) & b", "-check=tree"));
        assertTrue(output().contains("[E]"));
    }

    @Test
    @DisplayName("Verifica tramite un comando alternativo")
    void shouldUseCustomSolverCommand(@TempDir Path dir) throws IOException {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "Shell POSIX non disponibile");
        Path script = dir.resolve("limboole.sh");
        Files.writeString(script, "#!/bin/sh\ncat >/dev/null\necho '% SATISFIABLE formula'\necho 'a = 1'\necho 'b = 0'\n");
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwx------"));

        assertEquals(Main.EXIT_OK, run("-e", "a & !b", "-x", script.toString(), "-t", "5", "-check=model"));
        assertTrue(output().contains("[I] Modello:"));
        assertTrue(output().contains("a = true"));
        assertTrue(output().contains("b = false"));

        buffer.reset();
        assertEquals(Main.EXIT_OK, run("-e", "a & !b", "-x", script.toString(), "-t", "5", "-check=valid"));
        assertTrue(output().contains("[I] Validità: NON VALIDA"));
    }
}
