package org.logica.proposition;

import org.logica.format.ConnectiveFormat;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Registro globale delle proposizioni atomiche: genera identificatori univoci e
 * nomi volatili. Gli accessi sono sincronizzati perché le proposizioni possono
 * essere create da più thread.
 *
 * Gli id 0 e 1 sono riservati a {@link TruthConstant#BOTTOM} e {@link TruthConstant#TOP}.
 */
final class AtomicRegistry {

    static final long BOTTOM_ID = 0L;
    static final long TOP_ID = 1L;

    private static final Set<Long> USED_IDS = new HashSet<>();
    private static final Map<Class<?>, NameSequence> NAME_SEQUENCES = new HashMap<>();
    private static final Random RANDOM = new Random();

    private AtomicRegistry() {
    }

    /**
     * Genera un id mai usato prima: tempo corrente in nanosecondi più una componente casuale.
     */
    static synchronized long nextId() {
        long id;
        do {
            id = System.nanoTime() + RANDOM.nextInt(1_000_001);
        } while (id == BOTTOM_ID || id == TOP_ID || USED_IDS.contains(id));
        USED_IDS.add(id);
        return id;
    }

    /**
     * Riserva un id specifico.
     *
     * @throws IllegalStateException se l'id è già in uso
     */
    static synchronized long claimId(long id) {
        if (!USED_IDS.add(id)) {
            throw new IllegalStateException("Id " + id + " già in uso da un'altra proposizione atomica");
        }
        return id;
    }

    /**
     * Prossimo nome volatile della sequenza associata alla classe: a, b, ..., z, a′, b′, ...
     * Le sottoclassi hanno una sequenza propria con prefisso "NomeClasse_".
     */
    static synchronized String nextVolatileName(Class<? extends AtomicProposition> kind) {
        return NAME_SEQUENCES.computeIfAbsent(kind, NameSequence::new).next();
    }

    private static final class NameSequence {

        private final String prefix;
        private char current = 'a' - 1;
        private int primes = 0;

        NameSequence(Class<?> kind) {
            this.prefix = kind == AtomicProposition.class ? "" : kind.getSimpleName() + "_";
        }

        String next() {
            if (current < 'z') {
                current++;
            } else {
                current = 'a';
                primes++;
            }
            return prefix + current + ConnectiveFormat.PRIME.repeat(primes);
        }
    }
}
