package games.dog.player;

import games.dog.game.Action;
import games.dog.game.GameState;
import java.util.Set;

/**
 * Chooses the action for a seat's turn.
 */
public interface Player {

    /**
     * @param view the game as the seat sees it; other seats' hands are hidden
     * @param actions the legal actions, possibly empty
     * @return one of {@code actions}, or {@code null} for "none" (fold, or abort a seven)
     */
    Action selectAction(GameState view, Set<Action> actions);
}
