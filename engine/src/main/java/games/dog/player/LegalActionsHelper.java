package games.dog.player;

import games.dog.game.Action;
import games.dog.game.GamePhase;
import games.dog.game.GameState;
import games.dog.player.moves.ExchangeActionsHelper;
import games.dog.player.moves.PlayActionsHelper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Facade for computing legal actions in Dog.
 * <p>
 * Dispatches to the appropriate implementation based on the phase of the round:
 * <ul>
 *   <li><b>Card exchange pending:</b> uses {@link ExchangeActionsHelper}
 *   <li><b>Regular play:</b> uses {@link PlayActionsHelper}
 * </ul>
 * A finished game has no legal actions. Computing actions never mutates the state.
 */
public final class LegalActionsHelper {
    private LegalActionsHelper() {
    }

    /**
     * Return all currently legal actions for the active player.
     */
    public static Set<Action> listLegalActions(GameState state) {
        if (state == null || state.getPhase() == GamePhase.FINISHED) {
            return Collections.emptySet();
        }
        if (!state.isCardExchanged()) {
            return new ExchangeActionsHelper().listLegalActions(state);
        }
        return new PlayActionsHelper().listLegalActions(state);
    }

    /**
     * Returns the actions that occur more than once in {@code actions}, each reported once,
     * in order of their second occurrence.
     */
    public static List<Action> findDuplicates(List<Action> actions) {
        Set<Action> seen = new HashSet<>();
        Set<Action> duplicates = new LinkedHashSet<>();
        for (Action action : actions) {
            if (!seen.add(action)) {
                duplicates.add(action);
            }
        }
        return new ArrayList<>(duplicates);
    }
}
