package org.logica.format;

import org.logica.proposition.Connective;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * FORMATO DEI CONNETTIVI - Tabella di rendering per le proposizioni
 *
 * Associa a ogni {@link Connective} un {@link Entry} (prefisso, separatore, suffisso)
 * e definisce come rendere le parti che non dipendono dal connettivo: il simbolo
 * "primo" dei nomi volatili e le costanti di verità.
 *
 * TABELLE PREDEFINITE:
 * • {@link #PRETTY_PRINT}: operatori Unicode (¬, ∧, ∨, →, ←, ↔, ∃, ∀)
 * • {@link #LIMBOOLE}: sintassi ASCII accettata da limboole (!, &amp;, |, -&gt;, &lt;-, &lt;-&gt;, ?, #)
 * • {@link #LATEX}: comandi matematici LaTeX (\neg, \land, \lor, ...)
 *
 * ESEMPIO:
 * Entry("", " ∧ ", "") applicata agli operandi (a, b, c) produce "a ∧ b ∧ c".
 */
public final class ConnectiveFormat {

    /** Simbolo "primo" usato nei nomi volatili delle proposizioni atomiche */
    public static final String PRIME = "′";

    //region TABELLE PREDEFINITE

    public static final ConnectiveFormat PRETTY_PRINT = new ConnectiveFormat("pretty-print", entries(
            new Entry("", "", ""),
            new Entry("", "", ""),
            new Entry("¬", "", ""),
            new Entry("∃", ". ", ""),
            new Entry("∀", ". ", ""),
            new Entry("", " ∧ ", ""),
            new Entry("", " ∨ ", ""),
            new Entry("", " → ", ""),
            new Entry("", " ← ", ""),
            new Entry("", " ↔ ", "")),
            PRIME, "⊤", "⊥");

    public static final ConnectiveFormat LIMBOOLE = new ConnectiveFormat("limboole", entries(
            new Entry("", "", ""),
            new Entry("", "", ""),
            new Entry("!", "", ""),
            new Entry("?", " ", ""),
            new Entry("#", " ", ""),
            new Entry("", " & ", ""),
            new Entry("", " | ", ""),
            new Entry("", " -> ", ""),
            new Entry("", " <- ", ""),
            new Entry("", " <-> ", "")),
            "-prime", "(top | !top)", "(bottom & !bottom)");

    public static final ConnectiveFormat LATEX = new ConnectiveFormat("latex", entries(
            new Entry("", "", ""),
            new Entry("", "", ""),
            new Entry("\\neg{", "", "}"),
            new Entry("\\exists ", "\\colon ", ""),
            new Entry("\\forall ", "\\colon ", ""),
            new Entry("", " \\land ", ""),
            new Entry("", " \\lor ", ""),
            new Entry("", " \\rightarrow ", ""),
            new Entry("", " \\leftarrow ", ""),
            new Entry("", " \\leftrightarrow ", "")),
            "'", "\\top", "\\bot");

    //endregion

    //region STATO

    private final String name;
    private final Map<Connective, Entry> entries;
    private final String primeReplacement;
    private final String topSymbol;
    private final String bottomSymbol;

    //endregion

    //region COSTRUZIONE

    /**
     * Costruisce una tabella di formato completa.
     *
     * @param name nome della tabella, usato nei log e negli errori
     * @param entries mappa connettivo → entry, deve coprire tutti i connettivi
     * @param primeReplacement testo che sostituisce {@link #PRIME} nei nomi delle variabili
     * @param topSymbol rendering della costante vera
     * @param bottomSymbol rendering della costante falsa
     * @throws IllegalArgumentException se manca l'entry di qualche connettivo
     */
    public ConnectiveFormat(String name, Map<Connective, Entry> entries,
                            String primeReplacement, String topSymbol, String bottomSymbol) {
        for (Connective connective : Connective.values()) {
            if (!entries.containsKey(connective)) {
                throw new IllegalArgumentException("Connettivo " + connective.name()
                        + " mancante nella tabella di formato '" + name + "'");
            }
        }
        this.name = Objects.requireNonNull(name);
        this.entries = new EnumMap<>(entries);
        this.primeReplacement = Objects.requireNonNull(primeReplacement);
        this.topSymbol = Objects.requireNonNull(topSymbol);
        this.bottomSymbol = Objects.requireNonNull(bottomSymbol);
    }

    /**
     * Costruisce la mappa delle entry nell'ordine di dichiarazione di {@link Connective}.
     */
    private static Map<Connective, Entry> entries(Entry... ordered) {
        Connective[] connectives = Connective.values();
        if (ordered.length != connectives.length) {
            throw new IllegalArgumentException("Attese " + connectives.length + " entry, ricevute " + ordered.length);
        }
        Map<Connective, Entry> map = new EnumMap<>(Connective.class);
        for (int i = 0; i < connectives.length; i++) {
            map.put(connectives[i], ordered[i]);
        }
        return map;
    }

    //endregion

    //region RENDERING

    /**
     * Formatta gli operandi già resi come stringhe secondo l'entry del connettivo.
     *
     * @param connective connettivo che unisce gli operandi
     * @param operands operandi già formattati
     * @return prefisso + operandi uniti dal separatore + suffisso
     */
    public String format(Connective connective, List<String> operands) {
        Entry entry = entries.get(connective);
        return entry.getPrefix() + String.join(entry.getJoiner(), operands) + entry.getSuffix();
    }

    /**
     * Adatta un nome volatile alla sintassi della tabella sostituendo il simbolo primo.
     */
    public String formatName(String volatileName) {
        return volatileName.replace(PRIME, primeReplacement);
    }

    public Entry getEntry(Connective connective) {
        return entries.get(connective);
    }

    public String getName() {
        return name;
    }

    public String getTopSymbol() {
        return topSymbol;
    }

    public String getBottomSymbol() {
        return bottomSymbol;
    }

    @Override
    public String toString() {
        return "ConnectiveFormat[" + name + "]";
    }

    //endregion

    /**
     * Entry della tabella: stringa da anteporre agli operandi, separatore, stringa da posporre.
     */
    public static final class Entry {

        private final String prefix;
        private final String joiner;
        private final String suffix;

        public Entry(String prefix, String joiner, String suffix) {
            this.prefix = Objects.requireNonNull(prefix);
            this.joiner = Objects.requireNonNull(joiner);
            this.suffix = Objects.requireNonNull(suffix);
        }

        public String getPrefix() {
            return prefix;
        }

        public String getJoiner() {
            return joiner;
        }

        public String getSuffix() {
            return suffix;
        }
    }
}
