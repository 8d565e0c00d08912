package games.dog.game;

import java.util.Objects;

/**
 * A single player action.
 * <p>
 * Which fields are set depends on the kind of action:
 * <ul>
 *   <li><strong>Card exchange:</strong> only {@code card}, the card handed to the partner.</li>
 *   <li><strong>Marble move or jack swap:</strong> {@code card}, {@code posFrom} and {@code posTo}.</li>
 *   <li><strong>Joker substitution:</strong> the joker as {@code card} and the declared card as {@code cardSwap}.</li>
 * </ul>
 * Equality is structural over all four fields, so a set of actions never holds two
 * actions that mean the same thing.
 *
 * @param card the card played; never null
 * @param posFrom the square of the marble moved, or null
 * @param posTo the target square, or null
 * @param cardSwap the card a joker stands in for, or null
 */
public record Action(Card card, Integer posFrom, Integer posTo, Card cardSwap) {

    public Action {
        Objects.requireNonNull(card, "card");
    }

    public static Action exchange(Card card) {
        return new Action(card, null, null, null);
    }

    public static Action move(Card card, int posFrom, int posTo) {
        return new Action(card, posFrom, posTo, null);
    }

    public static Action substitute(Card joker, Card cardSwap) {
        return new Action(joker, null, null, Objects.requireNonNull(cardSwap, "cardSwap"));
    }

    /**
     * Returns {@code true} if this action names a joker substitution.
     */
    public boolean isSubstitution() {
        return cardSwap != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(card.shortName());
        if (posFrom != null || posTo != null) {
            sb.append(' ').append(posFrom).append("->").append(posTo);
        }
        if (cardSwap != null) {
            sb.append(" as ").append(cardSwap.shortName());
        }
        return sb.toString();
    }
}
