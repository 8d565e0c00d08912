package games.dog.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Represents the 110-card Dog deck.
 * <p>
 * The canonical deck is a fixed multiset: every suited card (4 suits × 13 ranks)
 * plus three jokers, with that 55-card block appearing twice. A {@code Deck} is built
 * in canonical order and shuffled with the supplied {@link RandomSource}; a new game
 * takes it as its draw pile, whose top is the end of the list.
 */
public class Deck {
    /** Number of cards in the canonical deck. */
    public static final int SIZE = 110;
    /** Number of copies of the 55-card block that make up the deck. */
    private static final int COPIES = 2;
    /** Jokers per 55-card block. */
    private static final int JOKERS_PER_COPY = 3;

    /** The list of cards currently in the deck. */
    private final List<Card> cards = new ArrayList<>();

    /**
     * Constructs a full deck and shuffles it.
     *
     * @param random the source used for the shuffle; must not be null
     */
    public Deck(RandomSource random) {
        Objects.requireNonNull(random, "random");
        cards.addAll(canonicalCards());
        random.shuffle(cards);
    }

    /**
     * Returns the canonical deck in its fixed order: for each copy, ranks 2 through
     * Ace in all four suits, followed by three jokers.
     *
     * @return a new mutable list of 110 cards
     */
    public static List<Card> canonicalCards() {
        List<Card> canonical = new ArrayList<>(SIZE);
        for (int copy = 0; copy < COPIES; copy++) {
            for (Rank rank : Rank.values()) {
                if (rank == Rank.JOKER) {
                    continue;
                }
                for (Suit suit : Suit.regularSuits()) {
                    canonical.add(new Card(rank, suit));
                }
            }
            for (int j = 0; j < JOKERS_PER_COPY; j++) {
                canonical.add(Card.joker());
            }
        }
        return canonical;
    }

    /**
     * Returns an unmodifiable view of the cards in the deck.
     */
    public List<Card> asUnmodifiableList() {
        return Collections.unmodifiableList(cards);
    }

    @Override
    public String toString() {
        return "Deck(size=" + cards.size() + ")";
    }
}
