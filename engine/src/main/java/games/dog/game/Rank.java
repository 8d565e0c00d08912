package games.dog.game;

/**
 * Enumeration of the fourteen card ranks of the Dog deck.
 * <p>
 * Declaration order (2 through 10, J, Q, K, A, joker) is the rank index used for
 * sorting. Each rank carries the number of track squares it advances a marble when
 * played as a plain forward move; ranks with special movement (7, J, A, K, joker)
 * or no movement at all (4, Q) report zero.
 */
public enum Rank {
    TWO("2", 2),
    THREE("3", 3),
    FOUR("4", 0),
    FIVE("5", 5),
    SIX("6", 6),
    /** Seven: split into several forward moves totalling seven squares. */
    SEVEN("7", 0),
    EIGHT("8", 8),
    NINE("9", 9),
    TEN("10", 10),
    /** Jack: swaps two marbles. */
    JACK("J", 0),
    QUEEN("Q", 0),
    /** King: brings a marble out of the kennel. */
    KING("K", 0),
    /** Ace: brings a marble out of the kennel or advances it one square. */
    ACE("A", 0),
    /** Joker: leaves the kennel or stands in for any other rank. */
    JOKER("JKR", 0);

    /** Short label for display (e.g., "A", "10", "JKR"). */
    private final String label;
    /** Squares advanced by a plain forward move with this rank; zero if the rank has none. */
    private final int forwardSteps;

    Rank(String label, int forwardSteps) {
        this.label = label;
        this.forwardSteps = forwardSteps;
    }

    /**
     * Returns the short string label of this rank.
     *
     * @return the label (e.g., "A", "K", "10", "JKR")
     */
    public String getLabel() {
        return label;
    }

    /**
     * Returns how many squares a plain forward move with this rank covers.
     *
     * @return the forward step count, or zero for ranks without a plain forward move
     */
    public int getForwardSteps() {
        return forwardSteps;
    }

    /**
     * Resolves a rank from its label (case-insensitive).
     *
     * @param label the label to look up (e.g., "10", "j", "JKR")
     * @return the matching rank
     * @throws IllegalArgumentException if no rank uses the label
     */
    public static Rank fromLabel(String label) {
        for (Rank rank : values()) {
            if (rank.label.equalsIgnoreCase(label)) {
                return rank;
            }
        }
        throw new IllegalArgumentException("Unknown rank label: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
