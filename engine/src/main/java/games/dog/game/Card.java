package games.dog.game;

import java.util.Comparator;
import java.util.Objects;

/**
 * Represents a single playing card with a {@link Rank} and a {@link Suit}.
 * <p>
 * Cards are immutable and value-based: two cards with the same rank and suit are
 * interchangeable, which is how the doubled deck holds two copies of every card.
 * The natural order (suit, then rank index) is only used for deterministic display
 * and testing; it plays no part in legality.
 */
public final class Card implements Comparable<Card> {
    private static final Comparator<Card> ORDER = Comparator
            .comparing(Card::getSuit)
            .thenComparing(Card::getRank);

    /** The rank (2 through Ace, or joker) of this card. */
    private final Rank rank;
    /** The suit of this card; {@link Suit#NONE} for jokers. */
    private final Suit suit;

    /**
     * Constructs a Card with the given rank and suit.
     *
     * @param rank the rank of the card (must not be null)
     * @param suit the suit of the card (must not be null)
     * @throws NullPointerException if rank or suit is null
     * @throws IllegalArgumentException if a joker is given a suit or a regular card none
     */
    public Card(Rank rank, Suit suit) {
        this.rank = Objects.requireNonNull(rank, "rank");
        this.suit = Objects.requireNonNull(suit, "suit");
        if ((rank == Rank.JOKER) != (suit == Suit.NONE)) {
            throw new IllegalArgumentException("Jokers and only jokers have no suit: " + rank + suit);
        }
    }

    /**
     * Returns a joker.
     *
     * @return a card of rank {@link Rank#JOKER} without suit
     */
    public static Card joker() {
        return new Card(Rank.JOKER, Suit.NONE);
    }

    /**
     * Parses a short name such as "A♠", "10♦" or "JKR".
     *
     * @param shortName the short name to parse (must not be null)
     * @return the parsed card
     * @throws IllegalArgumentException if the name does not denote a card
     */
    public static Card parse(String shortName) {
        String name = Objects.requireNonNull(shortName, "shortName").trim();
        if (name.equalsIgnoreCase(Rank.JOKER.getLabel())) {
            return joker();
        }
        if (name.length() < 2) {
            throw new IllegalArgumentException("Invalid card: " + shortName);
        }
        String symbol = name.substring(name.length() - 1);
        Rank rank = Rank.fromLabel(name.substring(0, name.length() - 1));
        return new Card(rank, Suit.fromSymbol(symbol));
    }

    public Rank getRank() {
        return rank;
    }

    public Suit getSuit() {
        return suit;
    }

    /**
     * Returns {@code true} if this card is a joker.
     */
    public boolean isJoker() {
        return rank == Rank.JOKER;
    }

    /**
     * Returns the short name of this card: the rank label followed by the suit
     * symbol (e.g., "Q♠", "10♦"), or just "JKR" for a joker.
     *
     * @return the short name of the card
     */
    public String shortName() {
        return rank.getLabel() + suit.getSymbol();
    }

    @Override
    public int compareTo(Card other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return shortName();
    }

    /**
     * Two cards are equal if and only if they have the same rank and suit.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return rank == card.rank && suit == card.suit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, suit);
    }
}
