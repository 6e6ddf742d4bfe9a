package ai.nimmt.game;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of uniformly distributed integers used for shuffling.
 * <p>
 * Kept as a port so tests can deal reproducible games from a seed.
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * Draws an integer uniformly from {@code minInclusive..maxInclusive}.
     */
    int nextIntInclusive(int minInclusive, int maxInclusive);

    static RandomSource threadLocal() {
        return (minInclusive, maxInclusive) -> {
            checkBounds(minInclusive, maxInclusive);
            return ThreadLocalRandom.current().nextInt(minInclusive, maxInclusive + 1);
        };
    }

    static RandomSource seeded(long seed) {
        Random random = new Random(seed);
        return (minInclusive, maxInclusive) -> {
            checkBounds(minInclusive, maxInclusive);
            return minInclusive + random.nextInt(maxInclusive - minInclusive + 1);
        };
    }

    private static void checkBounds(int minInclusive, int maxInclusive) {
        if (maxInclusive < minInclusive) {
            throw new IllegalArgumentException("maxInclusive must be >= minInclusive");
        }
    }
}
