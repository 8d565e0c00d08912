package games.dog.game;

/**
 * Enumeration of the card suits used by the Dog deck.
 * <p>
 * The four French suits carry a Unicode symbol; jokers belong to {@link #NONE},
 * whose symbol is empty. Declaration order (♠, ♥, ♦, ♣, then none) is the suit
 * order used when sorting cards for display and tests.
 */
public enum Suit {
    /** Spades, represented by the ♠ symbol. */
    SPADES("♠"),
    /** Hearts, represented by the ♥ symbol. */
    HEARTS("♥"),
    /** Diamonds, represented by the ♦ symbol. */
    DIAMONDS("♦"),
    /** Clubs, represented by the ♣ symbol. */
    CLUBS("♣"),
    /** No suit; only jokers use it. */
    NONE("");

    /** The Unicode symbol representing this suit (empty for {@link #NONE}). */
    private final String symbol;

    Suit(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the Unicode symbol of this suit.
     *
     * @return the suit symbol (e.g., "♣", "♦"), or an empty string for {@link #NONE}
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the four playable suits, excluding {@link #NONE}.
     *
     * @return the suits that regular (non-joker) cards carry
     */
    public static Suit[] regularSuits() {
        return new Suit[] {SPADES, HEARTS, DIAMONDS, CLUBS};
    }

    /**
     * Resolves a suit from its symbol.
     *
     * @param symbol the symbol to look up; an empty string resolves to {@link #NONE}
     * @return the matching suit
     * @throws IllegalArgumentException if no suit uses the symbol
     */
    public static Suit fromSymbol(String symbol) {
        for (Suit suit : values()) {
            if (suit.symbol.equals(symbol)) {
                return suit;
            }
        }
        throw new IllegalArgumentException("Unknown suit symbol: " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
