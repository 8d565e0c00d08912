package games.dog.game;

import games.dog.player.LegalActionsHelper;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A game of Dog: four players in two teams race their marbles around a shared track
 * into their finish lanes, moving by playing cards.
 * <p>
 * This is the game contract drivers use: {@link #reset()}, {@link #getListAction()},
 * {@link #applyAction(Action)} and {@link #getPlayerView(int)}. Tests and trusted
 * drivers may read or replace the full state with {@link #getState()} and
 * {@link #setState(GameState)}.
 * <p>
 * Instances are not thread-safe; calls on one game must be serialised by the caller.
 */
public class DogGame {
    private static final Logger log = LoggerFactory.getLogger(DogGame.class);

    private final RandomSource random;
    private final boolean cardExchange;
    private final RoundDealer dealer;
    private final TurnEngine turnEngine;
    private GameState state;

    public DogGame() {
        this(RandomSource.unseeded());
    }

    public DogGame(RandomSource random) {
        this(random, true);
    }

    /**
     * @param random shuffles the deck and the reshuffled discard pile
     * @param cardExchange whether each round opens with the partner card exchange
     */
    public DogGame(RandomSource random, boolean cardExchange) {
        this.random = Objects.requireNonNull(random, "random");
        this.cardExchange = cardExchange;
        this.dealer = new RoundDealer(random, cardExchange);
        this.turnEngine = new TurnEngine(dealer);
        reset();
    }

    /**
     * Starts a fresh game: a shuffled deck, round one, every marble in its kennel and
     * six cards dealt to each player. Seat 0 starts.
     */
    public void reset() {
        Deck deck = new Deck(random);
        List<PlayerState> players = new ArrayList<>(Board.SEATS);
        for (int seat = 0; seat < Board.SEATS; seat++) {
            players.add(PlayerState.inKennel("Player " + (seat + 1), seat));
        }
        GameState fresh = new GameState(players, deck.asUnmodifiableList(), List.of());
        fresh.setCardExchanged(!cardExchange);
        dealer.deal(fresh);
        turnEngine.reset();
        state = fresh;
        if (log.isDebugEnabled()) {
            log.debug("New game dealt: {}", state);
        }
    }

    /**
     * Returns the full, unmasked state. The returned object is live.
     */
    public GameState getState() {
        return state;
    }

    /**
     * Replaces the state wholesale.
     * <p>
     * The board as it stood before a seven is kept by the game, not by the state. Setting
     * the current state again keeps it; setting any other state drops it, so aborting a
     * seven that state has in progress only clears the seven and restores nothing.
     */
    public void setState(GameState state) {
        Objects.requireNonNull(state, "state");
        if (state != this.state) {
            turnEngine.reset();
        }
        this.state = state;
    }

    /**
     * Lists the actions the active player may take now.
     *
     * @return the legal actions; empty when none exist or the game is finished
     */
    public Set<Action> getListAction() {
        return LegalActionsHelper.listLegalActions(state);
    }

    /**
     * Applies an action of the active player, or "none" when {@code action} is null.
     *
     * @throws InvalidActionException if the action is not allowed in this state
     * @throws StepBudgetExceededException if a seven move costs more than the steps left
     * @throws DeckExhaustedException if the next round cannot be dealt
     */
    public void applyAction(Action action) {
        turnEngine.apply(state, action);
    }

    /**
     * Returns what one seat may see: a copy of the state with the other seats' hands and
     * exchange cards removed and both piles emptied.
     *
     * @param idx the viewing seat
     */
    public GameState getPlayerView(int idx) {
        if (idx < 0 || idx >= Board.SEATS) {
            throw new IllegalArgumentException("Seat out of range: " + idx);
        }
        GameState view = state.copy();
        for (int seat = 0; seat < Board.SEATS; seat++) {
            if (seat != idx) {
                view.getPlayer(seat).getHand().clear();
                view.setExchangeCard(seat, null);
            }
        }
        view.getDrawPile().clear();
        view.getDiscardPile().clear();
        return view;
    }

    /**
     * Returns the team that has brought all its marbles home, if any.
     */
    public Optional<Team> getWinner() {
        return WinDetector.winningTeam(state);
    }
}
