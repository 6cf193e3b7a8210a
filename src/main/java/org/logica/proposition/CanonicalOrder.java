package org.logica.proposition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * ORDINE CANONICO - Ordinamento delle proposizioni indipendente dall'ordine di inserimento
 *
 * Congiunzioni e disgiunzioni sono uguali a meno dell'ordine dei figli, ma riduttore ed
 * espansore esaminano i figli in sequenza. Scorrendoli in questo ordine, due nodi uguali
 * vengono riscritti allo stesso modo.
 *
 * • gli atomi precedono i nodi composti, a parità di nome si distinguono per id
 * • i nodi composti sono ordinati per connettivo e poi per le chiavi dei figli
 */
final class CanonicalOrder {

    static final Comparator<Proposition> COMPARATOR = Comparator.comparing(CanonicalOrder::key);

    /** Prima i nodi con meno sottoformule, a parità l'ordine canonico */
    static final Comparator<Proposition> SMALLEST_FIRST =
            Comparator.comparingInt(CanonicalOrder::nodeCount).thenComparing(COMPARATOR);

    private CanonicalOrder() {
    }

    static List<Proposition> sorted(List<Proposition> propositions) {
        List<Proposition> sorted = new ArrayList<>(propositions);
        sorted.sort(COMPARATOR);
        return sorted;
    }

    static String key(Proposition proposition) {
        if (proposition.isAtomic()) {
            AtomicProposition atom = (AtomicProposition) proposition;
            return String.format("%02d:%s#%d", Connective.NONE.ordinal(), atom.getVolatileName(), atom.getId());
        }
        List<String> keys = new ArrayList<>(proposition.size());
        for (Proposition p : proposition.getPropositions()) {
            keys.add(key(p));
        }
        if (proposition.getConnective().isJunction()) {
            Collections.sort(keys);
        }
        return String.format("%02d(", proposition.getConnective().ordinal()) + String.join(",", keys) + ")";
    }

    static int nodeCount(Proposition proposition) {
        int count = 1;
        for (Proposition p : proposition.getPropositions()) {
            count += nodeCount(p);
        }
        return count;
    }
}
