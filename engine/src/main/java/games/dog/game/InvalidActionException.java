package games.dog.game;

/**
 * Thrown when an action references a card or marble that is not where the action
 * expects it, or is otherwise not applicable in the current state.
 * <p>
 * Callers that choose from {@link DogGame#getListAction()} never see it; it signals
 * a programming error upstream, not a game event.
 */
public class InvalidActionException extends IllegalArgumentException {
    public InvalidActionException(String message) {
        super(message);
    }
}
