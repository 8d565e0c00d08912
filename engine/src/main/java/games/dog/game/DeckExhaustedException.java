package games.dog.game;

/**
 * Thrown when the draw pile cannot serve a deal even after the discard pile has been
 * shuffled back into it. Fatal to the game instance.
 */
public class DeckExhaustedException extends IllegalStateException {
    public DeckExhaustedException(int needed, int available) {
        super("Cannot deal " + needed + " cards; only " + available + " left after reshuffling");
    }
}
