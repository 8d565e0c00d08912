package games.dog.game;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Complete mutable state of a Dog game.
 * <p>
 * <strong>Contents:</strong>
 * <ul>
 *   <li>Four {@link PlayerState seats}; seats {@code i} and {@code i+2} are partners.</li>
 *   <li>The draw pile (dealt from its end) and the discard pile.</li>
 *   <li>Round and turn counters: the round number, the seat that started the round and
 *       the seat whose turn it is.</li>
 *   <li>The <em>active card</em>: the card a joker stands in for during the current turn,
 *       or the seven while its steps are being spent. At most one card is active.</li>
 *   <li>Card exchange progress: whether this round's exchange is done, and the cards
 *       each seat has already parked for its partner.</li>
 * </ul>
 * <p>
 * <strong>Card conservation:</strong> draw pile, discard pile, hands and parked exchange
 * cards always add up to {@link Deck#SIZE} cards; see {@link #totalCardCount()}.
 */
public class GameState {
    private GamePhase phase = GamePhase.RUNNING;
    private int round = 1;
    private int startedPlayerIdx;
    private int activePlayerIdx;
    private final List<PlayerState> players;
    private final List<Card> drawPile;
    private final List<Card> discardPile;
    private Card activeCard;
    private boolean cardExchanged;
    /** Steps left on the seven being played; zero when no seven is in progress. */
    private int sevenStepsRemaining;
    /** Cards parked for the partner during the card exchange, indexed by seat. */
    private final Card[] exchangeBuffer = new Card[Board.SEATS];

    /**
     * Constructs a running round-one state.
     *
     * @param players exactly four seats
     * @param drawPile the draw pile, top card last
     * @param discardPile the discard pile
     */
    public GameState(List<PlayerState> players, List<Card> drawPile, List<Card> discardPile) {
        Objects.requireNonNull(players, "players");
        if (players.size() != Board.SEATS) {
            throw new IllegalArgumentException("Dog is played by " + Board.SEATS + " players, got " + players.size());
        }
        this.players = new ArrayList<>(players);
        this.drawPile = new ArrayList<>(Objects.requireNonNull(drawPile, "drawPile"));
        this.discardPile = new ArrayList<>(Objects.requireNonNull(discardPile, "discardPile"));
    }

    /**
     * Creates a deep copy: new lists and marble copies; cards are immutable and shared.
     */
    public GameState copy() {
        List<PlayerState> playerCopies = new ArrayList<>(players.size());
        for (PlayerState player : players) {
            playerCopies.add(player.copy());
        }
        GameState clone = new GameState(playerCopies, drawPile, discardPile);
        clone.phase = phase;
        clone.round = round;
        clone.startedPlayerIdx = startedPlayerIdx;
        clone.activePlayerIdx = activePlayerIdx;
        clone.activeCard = activeCard;
        clone.cardExchanged = cardExchanged;
        clone.sevenStepsRemaining = sevenStepsRemaining;
        System.arraycopy(exchangeBuffer, 0, clone.exchangeBuffer, 0, exchangeBuffer.length);
        return clone;
    }

    public GamePhase getPhase() {
        return phase;
    }

    public void setPhase(GamePhase phase) {
        this.phase = Objects.requireNonNull(phase, "phase");
    }

    public int getRound() {
        return round;
    }

    public void setRound(int round) {
        if (round < 1) {
            throw new IllegalArgumentException("Round numbers start at 1: " + round);
        }
        this.round = round;
    }

    public int getStartedPlayerIdx() {
        return startedPlayerIdx;
    }

    public void setStartedPlayerIdx(int startedPlayerIdx) {
        this.startedPlayerIdx = checkSeat(startedPlayerIdx);
    }

    public int getActivePlayerIdx() {
        return activePlayerIdx;
    }

    public void setActivePlayerIdx(int activePlayerIdx) {
        this.activePlayerIdx = checkSeat(activePlayerIdx);
    }

    public List<PlayerState> getPlayers() {
        return players;
    }

    public PlayerState getPlayer(int seat) {
        return players.get(checkSeat(seat));
    }

    public PlayerState getActivePlayer() {
        return players.get(activePlayerIdx);
    }

    public List<Card> getDrawPile() {
        return drawPile;
    }

    public List<Card> getDiscardPile() {
        return discardPile;
    }

    public Card getActiveCard() {
        return activeCard;
    }

    public void setActiveCard(Card activeCard) {
        this.activeCard = activeCard;
    }

    public boolean isCardExchanged() {
        return cardExchanged;
    }

    public void setCardExchanged(boolean cardExchanged) {
        this.cardExchanged = cardExchanged;
    }

    public int getSevenStepsRemaining() {
        return sevenStepsRemaining;
    }

    public void setSevenStepsRemaining(int sevenStepsRemaining) {
        if (sevenStepsRemaining < 0 || sevenStepsRemaining > 7) {
            throw new IllegalArgumentException("Seven steps must lie in 0..7: " + sevenStepsRemaining);
        }
        this.sevenStepsRemaining = sevenStepsRemaining;
    }

    /**
     * Returns {@code true} while a seven has been started but not all its steps are spent.
     */
    public boolean isSevenInProgress() {
        return sevenStepsRemaining > 0;
    }

    /**
     * Returns the card the seat has parked for its partner in this round's exchange.
     *
     * @return the parked card, or {@code null} if the seat has not chosen yet
     */
    public Card getExchangeCard(int seat) {
        return exchangeBuffer[checkSeat(seat)];
    }

    public void setExchangeCard(int seat, Card card) {
        exchangeBuffer[checkSeat(seat)] = card;
    }

    /**
     * Returns {@code true} once every seat has parked a card for the exchange.
     */
    public boolean isExchangeBufferFull() {
        return Arrays.stream(exchangeBuffer).allMatch(Objects::nonNull);
    }

    /**
     * Counts every card in the game: draw pile, discard pile, hands and parked exchange cards.
     *
     * @return the total, which equals {@link Deck#SIZE} in every reachable state
     */
    public int totalCardCount() {
        int total = drawPile.size() + discardPile.size();
        for (PlayerState player : players) {
            total += player.getHand().size();
        }
        for (Card parked : exchangeBuffer) {
            if (parked != null) {
                total++;
            }
        }
        return total;
    }

    /**
     * Finds the marble standing on {@code pos}, whoever owns it.
     */
    public Optional<Marble> findMarbleAt(int pos) {
        for (PlayerState player : players) {
            for (Marble marble : player.getMarbles()) {
                if (marble.getPos() == pos) {
                    return Optional.of(marble);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the seat owning {@code marble}, matched by identity.
     *
     * @throws IllegalArgumentException if the marble belongs to no seat of this state
     */
    public int seatOf(Marble marble) {
        for (int seat = 0; seat < players.size(); seat++) {
            for (Marble candidate : players.get(seat).getMarbles()) {
                if (candidate == marble) {
                    return seat;
                }
            }
        }
        throw new IllegalArgumentException("Marble is not on this board: " + marble);
    }

    /**
     * Returns {@code true} if all four marbles of the seat are in its finish lane.
     */
    public boolean isPlayerFinished(int seat) {
        for (Marble marble : getPlayer(seat).getMarbles()) {
            if (!Board.isInFinish(marble.getPos(), seat)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the seats whose marbles the active player may move: the active seat, plus
     * the partner's seat once the active player's own marbles are all home.
     */
    public List<Integer> getMovableSeats() {
        if (isPlayerFinished(activePlayerIdx)) {
            return List.of(activePlayerIdx, Team.partnerOf(activePlayerIdx));
        }
        return List.of(activePlayerIdx);
    }

    /**
     * Finds a marble the active player may move standing on {@code pos}.
     */
    public Optional<Marble> findMovableMarbleAt(int pos) {
        for (int seat : getMovableSeats()) {
            for (Marble marble : players.get(seat).getMarbles()) {
                if (marble.getPos() == pos) {
                    return Optional.of(marble);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Returns {@code true} while none of the active player's own marbles has left the kennel.
     */
    public boolean isBeginningPhase() {
        for (Marble marble : getActivePlayer().getMarbles()) {
            if (!Board.isInKennel(marble.getPos(), activePlayerIdx)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the lowest kennel square of {@code seat} that no marble occupies.
     *
     * @throws IllegalStateException if the kennel is full
     */
    public int lowestFreeKennelSquare(int seat) {
        for (int pos = Board.kennelStart(seat); pos < Board.kennelStart(seat) + Board.LANE_SIZE; pos++) {
            if (findMarbleAt(pos).isEmpty()) {
                return pos;
            }
        }
        throw new IllegalStateException("Kennel of seat " + seat + " is full");
    }

    /**
     * Sends a marble back to its owner's kennel, onto the lowest free kennel square,
     * and clears its safe flag.
     */
    public void sendHome(Marble marble) {
        marble.setPos(lowestFreeKennelSquare(seatOf(marble)));
        marble.setSave(false);
    }

    /**
     * Returns a one-line summary for logs.
     */
    @Override
    public String toString() {
        return "GameState(phase=" + phase
                + ", round=" + round
                + ", started=" + startedPlayerIdx
                + ", active=" + activePlayerIdx
                + ", activeCard=" + activeCard
                + ", cardExchanged=" + cardExchanged
                + ", sevenSteps=" + sevenStepsRemaining
                + ", draw=" + drawPile.size()
                + ", discard=" + discardPile.size()
                + ", players=" + Collections.unmodifiableList(players) + ")";
    }

    private static int checkSeat(int seat) {
        if (seat < 0 || seat >= Board.SEATS) {
            throw new IllegalArgumentException("Seat out of range: " + seat);
        }
        return seat;
    }
}
