package games.dog.player.moves;

import games.dog.game.Action;
import games.dog.game.Card;
import games.dog.game.GameState;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Computes legal actions while the round's card exchange is pending.
 * <p>
 * The only thing the active player may do is pick a card to hand to the partner,
 * so there is one action per distinct card in hand and no marble ever moves.
 */
public class ExchangeActionsHelper extends ActionsHelper {

    @Override
    public Set<Action> listLegalActions(GameState state) {
        this.state = state;
        Set<Action> actions = new LinkedHashSet<>();
        for (Card card : state.getActivePlayer().getHand()) {
            actions.add(Action.exchange(card));
        }
        return actions;
    }
}
