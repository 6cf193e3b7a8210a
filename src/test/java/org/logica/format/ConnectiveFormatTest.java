package org.logica.format;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.logica.proposition.AtomicProposition;
import org.logica.proposition.Connective;
import org.logica.proposition.Proposition;
import org.logica.proposition.TruthConstant;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Formattazione delle proposizioni")
class ConnectiveFormatTest {

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
    @DisplayName("Le sotto-formule composte sono tra parentesi, la radice no")
    void shouldParenthesizeCompoundChildren() {
        assertEquals("(a ∧ b) ∨ c", a.and(b).or(c).toPrettyPrint());
        assertEquals("a ∧ b ∧ c", a.and(b).and(c).toPrettyPrint());
        assertEquals("a → (b → c)", a.implies(b.implies(c)).toPrettyPrint());
    }

    @Test
    @DisplayName("Negazioni")
    void shouldFormatNegations() {
        assertEquals("¬a", a.not().toPrettyPrint());
        assertEquals("¬(a ∧ b)", a.and(b).not().toPrettyPrint());
        assertEquals("!(a & b)", a.and(b).not().toLimboole());
        assertEquals("$\\neg{(a \\land b)}$", a.and(b).not().toLatex());
    }

    @Test
    @DisplayName("Il corpo del quantificatore non è racchiuso tra parentesi")
    void shouldNotParenthesizeQuantifierBody() {
        Proposition quantified = a.exists(a.or(b));

        assertEquals("∃a. a ∨ b", quantified.toPrettyPrint());
        assertEquals("?a a | b", quantified.toLimboole());
        assertEquals("$\\exists a\\colon a \\lor b$", quantified.toLatex());
        assertEquals("#a a", a.forAll(a).toLimboole());
    }

    @Test
    @DisplayName("Un quantificatore annidato è racchiuso tra parentesi")
    void shouldParenthesizeNestedQuantifier() {
        assertEquals("¬(∃a. b)", a.exists(b).not().toPrettyPrint());
        assertEquals("(∃a. b) ∧ c", a.exists(b).and(c).toPrettyPrint());
    }

    @Test
    @DisplayName("Costanti di verità")
    void shouldFormatTruthConstants() {
        assertEquals("⊤", TruthConstant.TOP.toPrettyPrint());
        assertEquals("(top | !top)", TruthConstant.TOP.toLimboole());
        assertEquals("(bottom & !bottom)", TruthConstant.BOTTOM.toLimboole());
        assertEquals("$\\bot$", TruthConstant.BOTTOM.toLatex());
        assertEquals("a ∧ ⊥", a.and(TruthConstant.BOTTOM).toPrettyPrint());
    }

    @Test
    @DisplayName("Il simbolo primo viene adattato al formato")
    void shouldReplacePrime() {
        AtomicProposition primed = AtomicProposition.named("x" + ConnectiveFormat.PRIME);

        assertEquals("x′", primed.toPrettyPrint());
        assertEquals("x-prime", primed.toLimboole());
        assertEquals("$x'$", primed.toLatex());
    }

    @Test
    @DisplayName("Implicazioni e bicondizionale in tutti i formati")
    void shouldFormatImplications() {
        Proposition p = a.impliedBy(b).iff(c);

        assertEquals("(a ← b) ↔ c", p.toPrettyPrint());
        assertEquals("(a <- b) <-> c", p.toLimboole());
        assertEquals("$(a \\leftarrow b) \\leftrightarrow c$", p.toLatex());
    }

    @Test
    @DisplayName("Formato personalizzato")
    void shouldUseCustomTable() {
        Map<Connective, ConnectiveFormat.Entry> entries = new EnumMap<>(Connective.class);
        for (Connective connective : Connective.values()) {
            entries.put(connective, ConnectiveFormat.PRETTY_PRINT.getEntry(connective));
        }
        entries.put(Connective.AND, new ConnectiveFormat.Entry("AND[", ", ", "]"));
        ConnectiveFormat custom = new ConnectiveFormat("custom", entries, "^", "T", "F");

        assertEquals("AND[a, b]", a.and(b).format(custom));
        assertEquals("AND[a, T]", custom.format(Connective.AND, List.of("a", "T")));
        assertEquals("x^", custom.formatName("x" + ConnectiveFormat.PRIME));
    }

    @Test
    @DisplayName("Una tabella incompleta viene rifiutata")
    void shouldRejectIncompleteTable() {
        Map<Connective, ConnectiveFormat.Entry> entries = new EnumMap<>(Connective.class);
        entries.put(Connective.AND, new ConnectiveFormat.Entry("", " ", ""));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new ConnectiveFormat("incompleta", entries, "'", "T", "F"));
        assertTrue(e.getMessage().contains("incompleta"));
    }
}
