package games.dog.game;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies actions to a {@link GameState}.
 * <p>
 * Every action is validated before the state is touched, so a rejected action leaves
 * the state as it was. After each applied action the {@link WinDetector} runs; once the
 * game is finished every further action is rejected.
 * <p>
 * A {@code null} action means "none": it aborts a seven in progress (restoring the board)
 * or, outside a seven, folds the hand. Either way the turn passes.
 */
public class TurnEngine {
    private static final Logger log = LoggerFactory.getLogger(TurnEngine.class);

    private final RoundDealer dealer;
    private final SevenStepEngine seven = new SevenStepEngine();
    private final WinDetector winDetector = new WinDetector();

    public TurnEngine(RoundDealer dealer) {
        this.dealer = Objects.requireNonNull(dealer, "dealer");
    }

    /**
     * Applies one action, or "none" when {@code action} is null.
     *
     * @throws InvalidActionException if the action is not allowed in this state
     * @throws StepBudgetExceededException if a seven move costs more than the steps left
     * @throws DeckExhaustedException if the turn ends a round and the next deal cannot be served
     */
    public void apply(GameState state, Action action) {
        Objects.requireNonNull(state, "state");
        if (state.getPhase() == GamePhase.FINISHED) {
            throw new InvalidActionException("The game is already finished");
        }
        if (!state.isCardExchanged()) {
            exchange(state, action);
        } else if (action == null) {
            passTurn(state);
        } else if (action.isSubstitution()) {
            substitute(state, action);
        } else {
            play(state, action);
        }
        winDetector.check(state);
    }

    /**
     * Drops any seven snapshot; used when the state is replaced.
     */
    public void reset() {
        seven.clear();
    }

    private void exchange(GameState state, Action action) {
        if (action == null) {
            throw new InvalidActionException("Every player must give a card to their partner");
        }
        if (action.posFrom() != null || action.posTo() != null || action.cardSwap() != null) {
            throw new InvalidActionException("Only card exchanges are allowed before play: " + action);
        }
        int seat = state.getActivePlayerIdx();
        if (state.getExchangeCard(seat) != null) {
            throw new InvalidActionException("Seat " + seat + " has already given a card");
        }
        if (!state.getActivePlayer().getHand().remove(action.card())) {
            throw new InvalidActionException(action.card() + " is not in the hand of seat " + seat);
        }
        state.setExchangeCard(seat, action.card());
        state.setActivePlayerIdx((seat + 1) % Board.SEATS);

        if (state.isExchangeBufferFull()) {
            Card[] given = new Card[Board.SEATS];
            for (int s = 0; s < Board.SEATS; s++) {
                given[s] = state.getExchangeCard(s);
                state.setExchangeCard(s, null);
            }
            for (int s = 0; s < Board.SEATS; s++) {
                state.getPlayer(s).getHand().add(given[Team.partnerOf(s)]);
            }
            state.setCardExchanged(true);
            state.setActivePlayerIdx(state.getStartedPlayerIdx());
            if (log.isDebugEnabled()) {
                log.debug("Card exchange complete in round {}", state.getRound());
            }
        }
    }

    private void passTurn(GameState state) {
        if (state.isSevenInProgress()) {
            seven.rollback(state);
        } else {
            List<Card> hand = state.getActivePlayer().getHand();
            if (log.isDebugEnabled()) {
                log.debug("Seat {} folds {} cards", state.getActivePlayerIdx(), hand.size());
            }
            state.getDiscardPile().addAll(hand);
            hand.clear();
        }
        endTurn(state);
    }

    private void substitute(GameState state, Action action) {
        Card joker = action.card();
        Card declared = action.cardSwap();
        if (!joker.isJoker()) {
            throw new InvalidActionException("Only a joker can stand in for another card: " + action);
        }
        if (declared.isJoker() || action.posFrom() != null || action.posTo() != null) {
            throw new InvalidActionException("Malformed joker declaration: " + action);
        }
        if (state.getActiveCard() != null) {
            throw new InvalidActionException("A card is already active: " + state.getActiveCard());
        }
        if (state.isBeginningPhase() && declared.getRank() != Rank.ACE && declared.getRank() != Rank.KING) {
            throw new InvalidActionException("With every marble in the kennel a joker can only be an ace or a king");
        }
        if (!state.getActivePlayer().getHand().remove(joker)) {
            throw new InvalidActionException("No joker in the hand of seat " + state.getActivePlayerIdx());
        }
        state.getDiscardPile().add(joker);
        state.setActiveCard(declared);
        if (log.isDebugEnabled()) {
            log.debug("Seat {} plays a joker as {}", state.getActivePlayerIdx(), declared.shortName());
        }
    }

    private void play(GameState state, Action action) {
        Card card = action.card();
        requirePlayable(state, card);
        boolean turnOver = switch (card.getRank()) {
            case SEVEN -> seven.applyPartial(state, action);
            case JACK -> {
                swap(state, action);
                yield true;
            }
            case ACE, KING, JOKER, TWO, THREE, FIVE, SIX, EIGHT, NINE, TEN -> {
                move(state, action);
                yield true;
            }
            case FOUR, QUEEN -> throw new InvalidActionException(card.shortName() + " cannot move a marble");
        };
        if (turnOver) {
            endTurn(state);
        }
    }

    /**
     * A card is playable when it is the active card or, with no active card, in the hand.
     */
    private void requirePlayable(GameState state, Card card) {
        Card active = state.getActiveCard();
        if (active != null) {
            if (!active.equals(card)) {
                throw new InvalidActionException(active.shortName() + " is active; cannot play " + card.shortName());
            }
        } else if (!state.getActivePlayer().getHand().contains(card)) {
            throw new InvalidActionException(card.shortName() + " is not in the hand of seat " + state.getActivePlayerIdx());
        }
    }

    private void move(GameState state, Action action) {
        int from = requireSquare(action.posFrom(), action);
        int to = requireSquare(action.posTo(), action);
        Marble moving = state.findMovableMarbleAt(from)
                .orElseThrow(() -> new InvalidActionException("No movable marble at " + from));
        int seat = state.seatOf(moving);
        if (!Board.isOnTrack(to) && !Board.isInFinish(to, seat)) {
            throw new InvalidActionException("Square " + to + " is not reachable for seat " + seat);
        }
        state.findMarbleAt(to)
                .filter(occupant -> occupant != moving)
                .ifPresent(state::sendHome);
        moving.setPos(to);
        moving.setSave(true);
        discardPlayed(state, action.card());
    }

    private void swap(GameState state, Action action) {
        int from = requireSquare(action.posFrom(), action);
        int to = requireSquare(action.posTo(), action);
        if (!Board.isOnTrack(from) || !Board.isOnTrack(to) || from == to) {
            throw new InvalidActionException("A jack swaps two marbles on the track: " + action);
        }
        Marble first = state.findMarbleAt(from)
                .orElseThrow(() -> new InvalidActionException("No marble at " + from));
        Marble second = state.findMarbleAt(to)
                .orElseThrow(() -> new InvalidActionException("No marble at " + to));
        if (state.findMovableMarbleAt(from).isEmpty() && state.findMovableMarbleAt(to).isEmpty()) {
            throw new InvalidActionException("A jack needs one marble of your own: " + action);
        }
        first.setPos(to);
        second.setPos(from);
        discardPlayed(state, action.card());
    }

    private static int requireSquare(Integer pos, Action action) {
        if (pos == null) {
            throw new InvalidActionException("Action needs a start and a target square: " + action);
        }
        return pos;
    }

    /**
     * A card from the hand goes to the discard pile; a card declared through a joker was
     * never in the hand.
     */
    private static void discardPlayed(GameState state, Card card) {
        if (state.getActiveCard() == null) {
            state.getActivePlayer().getHand().remove(card);
            state.getDiscardPile().add(card);
        }
    }

    private void endTurn(GameState state) {
        seven.clear();
        state.setActiveCard(null);
        int next = (state.getActivePlayerIdx() + 1) % Board.SEATS;
        state.setActivePlayerIdx(next);
        if (next == state.getStartedPlayerIdx()) {
            dealer.startNextRound(state);
        }
    }
}
