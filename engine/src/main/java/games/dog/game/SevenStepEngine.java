package games.dog.game;

import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plays a seven: seven track squares split over one or more marbles, applied as a
 * sequence of partial moves within one turn.
 * <p>
 * The first partial move snapshots the board ({@link SevenSnapshot}); the seven then
 * becomes the active card and the steps left are tracked in
 * {@link GameState#getSevenStepsRemaining()}. Passing over a marble sends the first
 * marble met on the route home. When the last step is spent the seven is discarded
 * and the snapshot dropped; aborting earlier restores the snapshot verbatim.
 */
public class SevenStepEngine {
    private static final Logger log = LoggerFactory.getLogger(SevenStepEngine.class);

    /** Squares a seven moves in total. */
    public static final int STEPS = 7;

    private SevenSnapshot snapshot;

    /**
     * Applies one partial move.
     *
     * @param state the game state, whose active card (if any) is this seven
     * @param action the partial move; {@code card} is the seven being played
     * @return {@code true} if this move spent the last step and the turn is over
     * @throws InvalidActionException if no movable marble stands on {@code posFrom} or
     *         no forward route leads to {@code posTo}
     * @throws StepBudgetExceededException if the move costs more than the steps left
     */
    public boolean applyPartial(GameState state, Action action) {
        if (action.posFrom() == null || action.posTo() == null) {
            throw new InvalidActionException("A seven move needs a start and a target square: " + action);
        }
        int from = action.posFrom();
        int to = action.posTo();
        Marble moving = state.findMovableMarbleAt(from)
                .orElseThrow(() -> new InvalidActionException("No movable marble at " + from));
        int seat = state.seatOf(moving);
        List<Integer> route = Board.route(seat, from, to);
        if (route == null) {
            throw new InvalidActionException("No forward route from " + from + " to " + to);
        }
        boolean started = state.isSevenInProgress();
        int remaining = started ? state.getSevenStepsRemaining() : STEPS;
        if (route.size() > remaining) {
            throw new StepBudgetExceededException(route.size(), remaining);
        }

        if (!started) {
            snapshot = SevenSnapshot.capture(state);
            state.setActiveCard(action.card());
        }
        for (int square : route) {
            Optional<Marble> occupant = state.findMarbleAt(square);
            if (occupant.isPresent() && occupant.get() != moving) {
                state.sendHome(occupant.get());
                break;
            }
        }
        moving.setPos(to);
        remaining -= route.size();

        if (remaining > 0) {
            state.setSevenStepsRemaining(remaining);
            return false;
        }
        state.setSevenStepsRemaining(0);
        state.setActiveCard(null);
        if (playedFromHand(state, action.card())) {
            state.getActivePlayer().getHand().remove(action.card());
            state.getDiscardPile().add(action.card());
        }
        snapshot = null;
        return true;
    }

    /**
     * Undoes every partial move of the seven in progress.
     *
     * @param state the game state
     * @return {@code true} if a snapshot was restored; {@code false} if none was held,
     *         in which case only the step counter and active card are cleared
     */
    public boolean rollback(GameState state) {
        boolean restored = snapshot != null;
        if (restored) {
            snapshot.restore(state);
            if (log.isDebugEnabled()) {
                log.debug("Seven aborted; board restored for seat {}", state.getActivePlayerIdx());
            }
        } else {
            state.setActiveCard(null);
        }
        state.setSevenStepsRemaining(0);
        snapshot = null;
        return restored;
    }

    /**
     * Forgets any held snapshot, e.g. when the state is replaced wholesale.
     */
    public void clear() {
        snapshot = null;
    }

    /**
     * A seven declared through a joker was never in the hand; the joker went to the
     * discard pile when it was declared.
     */
    private boolean playedFromHand(GameState state, Card seven) {
        if (snapshot != null) {
            return snapshot.activeCard() == null;
        }
        return state.getActivePlayer().getHand().contains(seven);
    }
}
