package games.dog.game;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One seat at the table: a name, the hand of cards and the seat's four marbles.
 * <p>
 * The hand and marble lists are live and mutable; the engine moves cards and
 * marbles through them in place.
 */
public class PlayerState {
    private final String name;
    private final List<Card> hand;
    private final List<Marble> marbles;

    public PlayerState(String name, List<Card> hand, List<Marble> marbles) {
        this.name = Objects.requireNonNull(name, "name");
        this.hand = new ArrayList<>(Objects.requireNonNull(hand, "hand"));
        this.marbles = new ArrayList<>(Objects.requireNonNull(marbles, "marbles"));
    }

    /**
     * Creates a seat with an empty hand and all marbles in the kennel.
     *
     * @param name the display name
     * @param seat the seat index whose kennel the marbles occupy
     * @return the new player state
     */
    public static PlayerState inKennel(String name, int seat) {
        List<Marble> marbles = new ArrayList<>(Board.MARBLES_PER_SEAT);
        for (int j = 0; j < Board.MARBLES_PER_SEAT; j++) {
            marbles.add(new Marble(Board.kennelStart(seat) + j, false));
        }
        return new PlayerState(name, new ArrayList<>(), marbles);
    }

    public String getName() {
        return name;
    }

    public List<Card> getHand() {
        return hand;
    }

    public List<Marble> getMarbles() {
        return marbles;
    }

    /**
     * Returns a deep copy: a new hand list and copies of every marble.
     */
    public PlayerState copy() {
        List<Marble> marbleCopies = new ArrayList<>(marbles.size());
        for (Marble marble : marbles) {
            marbleCopies.add(marble.copy());
        }
        return new PlayerState(name, hand, marbleCopies);
    }

    @Override
    public String toString() {
        return name + "(hand=" + hand + ", marbles=" + marbles + ")";
    }
}
