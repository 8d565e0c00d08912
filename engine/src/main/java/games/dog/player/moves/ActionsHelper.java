package games.dog.player.moves;

import games.dog.game.Action;
import games.dog.game.Board;
import games.dog.game.Card;
import games.dog.game.GameState;
import games.dog.game.Marble;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Abstract base class for computing legal actions in Dog.
 * <p>
 * Two implementations exist:
 * <ul>
 *   <li><b>ExchangeActionsHelper:</b> for the card exchange that opens a round
 *   <li><b>PlayActionsHelper:</b> for regular play, dispatched per card rank
 * </ul>
 * <p>
 * The base class holds the state being analysed and the movement rules both share:
 * route blocking and route-to-action conversion.
 */
public abstract class ActionsHelper {
    /** The game state being analysed. */
    protected GameState state;

    /**
     * Computes all legal actions for the given state.
     *
     * @param state the game state; must not be null
     * @return the legal actions, free of duplicates, in a stable iteration order
     */
    public abstract Set<Action> listLegalActions(GameState state);

    /**
     * Checks whether a route is blocked for the moving marble.
     * <p>
     * On the track a safe marble blocks its square, destination included. In a finish
     * lane every marble blocks, since marbles there can neither be jumped nor taken.
     *
     * @param squares the squares the marble steps on, destination last
     * @param moving the marble making the move; ignored if met on the route
     * @return {@code true} if some square on the route is blocked
     */
    protected boolean isRouteBlocked(List<Integer> squares, Marble moving) {
        for (int square : squares) {
            Optional<Marble> occupant = state.findMarbleAt(square);
            if (occupant.isEmpty() || occupant.get() == moving) {
                continue;
            }
            if (!Board.isOnTrack(square) || occupant.get().isSave()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Adds a move action for every unblocked route a marble can take with
     * {@code steps} squares: around the track and, where reachable, into its finish lane.
     *
     * @param out the set to add actions to
     * @param card the card the actions play
     * @param seat the seat owning the marble
     * @param marble the marble to move
     * @param steps how many squares to advance
     */
    protected void addForwardRoutes(Set<Action> out, Card card, int seat, Marble marble, int steps) {
        for (boolean intoFinish : new boolean[] {false, true}) {
            List<Integer> squares = Board.walk(seat, marble.getPos(), steps, intoFinish);
            if (squares != null && !isRouteBlocked(squares, marble)) {
                out.add(Action.move(card, marble.getPos(), squares.get(squares.size() - 1)));
            }
        }
    }
}
