package games.dog.game;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts rounds and deals hands.
 * <p>
 * Hand sizes follow a five-round saw-tooth: 6, 5, 4, 3, 2 cards, then again from 6.
 * Before dealing, whatever is left in the hands goes to the discard pile; if the draw
 * pile then holds too few cards, the discard pile is shuffled back into it.
 */
public class RoundDealer {
    private static final Logger log = LoggerFactory.getLogger(RoundDealer.class);
    private static final int CYCLE = 5;
    private static final int LARGEST_HAND = 6;

    private final RandomSource random;
    private final boolean cardExchange;

    /**
     * @param random the source for reshuffles; must not be null
     * @param cardExchange whether every round opens with the partner card exchange
     */
    public RoundDealer(RandomSource random, boolean cardExchange) {
        this.random = Objects.requireNonNull(random, "random");
        this.cardExchange = cardExchange;
    }

    /**
     * Returns the hand size for a round: {@code 7 - ((round - 1) mod 5 + 1)}.
     *
     * @param round the round number, starting at 1
     * @return the number of cards each player receives
     */
    public static int cardsForRound(int round) {
        if (round < 1) {
            throw new IllegalArgumentException("Round numbers start at 1: " + round);
        }
        return LARGEST_HAND + 1 - ((round - 1) % CYCLE + 1);
    }

    /**
     * Moves to the next round: increments the round, passes the start to the next seat
     * (who becomes the active player), reopens the card exchange and deals.
     *
     * @throws DeckExhaustedException if the cards cannot serve the deal
     */
    public void startNextRound(GameState state) {
        state.setRound(state.getRound() + 1);
        int started = (state.getStartedPlayerIdx() + 1) % Board.SEATS;
        state.setStartedPlayerIdx(started);
        state.setActivePlayerIdx(started);
        state.setActiveCard(null);
        state.setCardExchanged(!cardExchange);
        deal(state);
        if (log.isInfoEnabled()) {
            log.info("Round {} started with {} cards per player", state.getRound(), cardsForRound(state.getRound()));
        }
    }

    /**
     * Deals the current round's hand size to every seat, after returning all hands
     * (and any parked exchange cards) to the discard pile.
     *
     * @throws DeckExhaustedException if the cards cannot serve the deal
     */
    public void deal(GameState state) {
        int perPlayer = cardsForRound(state.getRound());
        List<Card> discard = state.getDiscardPile();
        for (int seat = 0; seat < Board.SEATS; seat++) {
            List<Card> hand = state.getPlayer(seat).getHand();
            discard.addAll(hand);
            hand.clear();
            Card parked = state.getExchangeCard(seat);
            if (parked != null) {
                discard.add(parked);
                state.setExchangeCard(seat, null);
            }
        }
        replenish(state, perPlayer * Board.SEATS);

        List<Card> draw = state.getDrawPile();
        for (int seat = 0; seat < Board.SEATS; seat++) {
            List<Card> hand = state.getPlayer(seat).getHand();
            for (int i = 0; i < perPlayer; i++) {
                hand.add(draw.remove(draw.size() - 1));
            }
        }
    }

    private void replenish(GameState state, int needed) {
        List<Card> draw = state.getDrawPile();
        if (draw.size() >= needed) {
            return;
        }
        draw.addAll(state.getDiscardPile());
        state.getDiscardPile().clear();
        random.shuffle(draw);
        if (log.isDebugEnabled()) {
            log.debug("Discard pile shuffled back; draw pile now holds {} cards", draw.size());
        }
        if (draw.size() < needed) {
            throw new DeckExhaustedException(needed, draw.size());
        }
    }
}
