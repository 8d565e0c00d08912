package games.dog.game;

import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Injectable pseudo-random source behind every shuffle and random choice.
 * <p>
 * Games, the round dealer and random players all draw from a {@code RandomSource}
 * instead of global randomness, so a test can pin a seed and assert exact deals.
 */
public class RandomSource {
    private final Random random;

    private RandomSource(Random random) {
        this.random = random;
    }

    /**
     * Creates a source whose sequence is fully determined by {@code seed}.
     */
    public static RandomSource seeded(long seed) {
        return new RandomSource(new Random(seed));
    }

    /**
     * Creates a source with a nondeterministic seed.
     */
    public static RandomSource unseeded() {
        return new RandomSource(new Random());
    }

    /**
     * Shuffles the list in place with a uniform random permutation.
     *
     * @param cards the list to shuffle
     */
    public void shuffle(List<?> cards) {
        Collections.shuffle(cards, random);
    }

    /**
     * Returns a uniformly distributed value in {@code [0, bound)}.
     *
     * @param bound the exclusive upper bound; must be positive
     * @return the random value
     */
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }
}
