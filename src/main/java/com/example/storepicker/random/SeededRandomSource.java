package com.example.storepicker.random;

import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * The single random source of a sampling run. Each draw asks for its own sub-stream, seeded
 * from one bounded integer taken off the parent, so the selection only depends on the seed and
 * on the order in which draws are made.
 */
public class SeededRandomSource {

    static final int MAX_SUB_SEED = 999_999;

    private final RandomDataGenerator parent;

    /**
     * @param seed parent seed, or {@code null} for a self-seeded, non-reproducible run
     */
    public SeededRandomSource(Long seed) {
        this.parent = new RandomDataGenerator(seed == null ? new Well19937c() : new Well19937c(seed));
    }

    public SubStream nextSubStream() {
        return new SubStream(parent.nextInt(0, MAX_SUB_SEED));
    }

    /**
     * An independent generator for one draw.
     */
    public static class SubStream {

        private final int seed;
        private final RandomDataGenerator generator;

        SubStream(int seed) {
            this.seed = seed;
            this.generator = new RandomDataGenerator(new Well19937c(seed));
        }

        public int seed() {
            return seed;
        }

        /**
         * Picks {@code k} distinct indices out of {@code [0, n)}, uniformly. Asking for more than
         * {@code n} yields all of them; asking for none yields an empty array.
         */
        public int[] drawIndices(int n, int k) {
            int count = Math.min(k, n);
            if (count <= 0) {
                return new int[0];
            }
            return generator.nextPermutation(n, count);
        }
    }
}
