package games.dog.player.moves;

import games.dog.game.Action;
import games.dog.game.Board;
import games.dog.game.Card;
import games.dog.game.GameState;
import games.dog.game.Marble;
import games.dog.game.Rank;
import games.dog.game.SevenStepEngine;
import games.dog.game.Suit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Computes legal actions for regular play.
 * <p>
 * Each card the active player may play is dispatched on its rank. The dispatch is a
 * switch expression over {@link Rank}, so a rank without a handler fails to compile
 * instead of silently producing nothing.
 * <ul>
 *   <li><b>A / K:</b> leave the kennel; an ace may also advance one square on the track.</li>
 *   <li><b>2, 3, 5, 6, 8, 9, 10:</b> advance one marble by the face value.</li>
 *   <li><b>7:</b> advance one marble by 1 up to the steps left on the seven.</li>
 *   <li><b>J:</b> swap a team marble with an unprotected opponent marble, or two team
 *       marbles when no opponent qualifies.</li>
 *   <li><b>Joker:</b> leave the kennel, or declare itself as another card.</li>
 *   <li><b>4, Q:</b> no actions.</li>
 * </ul>
 * While a card is active (a joker substitution, or a seven in progress) only that card
 * is considered, not the hand.
 */
public class PlayActionsHelper extends ActionsHelper {
    @Override
    public Set<Action> listLegalActions(GameState state) {
        this.state = state;
        Set<Action> actions = new LinkedHashSet<>();
        List<Card> cards = state.getActiveCard() != null
                ? List.of(state.getActiveCard())
                : state.getActivePlayer().getHand();
        for (Card card : cards) {
            actions.addAll(actionsFor(card));
        }
        return actions;
    }

    private Set<Action> actionsFor(Card card) {
        return switch (card.getRank()) {
            case ACE -> union(kennelExits(card), singleSteps(card));
            case KING -> kennelExits(card);
            case TWO, THREE, FIVE, SIX, EIGHT, NINE, TEN -> forwardMoves(card, card.getRank().getForwardSteps());
            case SEVEN -> sevenMoves(card);
            case JACK -> jackSwaps(card);
            case JOKER -> union(kennelExits(card), substitutions(card));
            case FOUR, QUEEN -> Set.of();
        };
    }

    private static Set<Action> union(Set<Action> first, Set<Action> second) {
        Set<Action> both = new LinkedHashSet<>(first);
        both.addAll(second);
        return both;
    }

    /**
     * Kennel marbles move onto their owner's start square unless a safe marble holds it.
     */
    private Set<Action> kennelExits(Card card) {
        Set<Action> out = new LinkedHashSet<>();
        for (int seat : state.getMovableSeats()) {
            int start = Board.startSquare(seat);
            Optional<Marble> onStart = state.findMarbleAt(start);
            if (onStart.isPresent() && onStart.get().isSave()) {
                continue;
            }
            for (Marble marble : state.getPlayer(seat).getMarbles()) {
                if (Board.isInKennel(marble.getPos(), seat)) {
                    out.add(Action.move(card, marble.getPos(), start));
                }
            }
        }
        return out;
    }

    private Set<Action> singleSteps(Card card) {
        Set<Action> out = new LinkedHashSet<>();
        for (int seat : state.getMovableSeats()) {
            for (Marble marble : state.getPlayer(seat).getMarbles()) {
                if (!Board.isOnTrack(marble.getPos())) {
                    continue;
                }
                List<Integer> squares = Board.walk(seat, marble.getPos(), 1, false);
                if (!isRouteBlocked(squares, marble)) {
                    out.add(Action.move(card, marble.getPos(), squares.get(0)));
                }
            }
        }
        return out;
    }

    private Set<Action> forwardMoves(Card card, int steps) {
        Set<Action> out = new LinkedHashSet<>();
        for (int seat : state.getMovableSeats()) {
            for (Marble marble : state.getPlayer(seat).getMarbles()) {
                addForwardRoutes(out, card, seat, marble, steps);
            }
        }
        return out;
    }

    /**
     * A seven is spent in partial moves; each may use any number of the steps left.
     */
    private Set<Action> sevenMoves(Card card) {
        Set<Action> out = new LinkedHashSet<>();
        int remaining = state.isSevenInProgress() ? state.getSevenStepsRemaining() : SevenStepEngine.STEPS;
        for (int seat : state.getMovableSeats()) {
            for (Marble marble : state.getPlayer(seat).getMarbles()) {
                for (int steps = 1; steps <= remaining; steps++) {
                    addSevenRoutes(out, card, seat, marble, steps);
                }
            }
        }
        return out;
    }

    /**
     * Like {@link #addForwardRoutes}, except that a seven sends home only the first
     * marble it passes: a route that passes one marble and ends on another is skipped,
     * as it would leave two marbles on one square.
     */
    private void addSevenRoutes(Set<Action> out, Card card, int seat, Marble marble, int steps) {
        for (boolean intoFinish : new boolean[] {false, true}) {
            List<Integer> squares = Board.walk(seat, marble.getPos(), steps, intoFinish);
            if (squares == null || isRouteBlocked(squares, marble) || passesAndLandsOnOthers(squares, marble)) {
                continue;
            }
            out.add(Action.move(card, marble.getPos(), squares.get(squares.size() - 1)));
        }
    }

    private boolean passesAndLandsOnOthers(List<Integer> squares, Marble moving) {
        int last = squares.size() - 1;
        if (!isOccupiedByOther(squares.get(last), moving)) {
            return false;
        }
        for (int i = 0; i < last; i++) {
            if (isOccupiedByOther(squares.get(i), moving)) {
                return true;
            }
        }
        return false;
    }

    private boolean isOccupiedByOther(int square, Marble moving) {
        Optional<Marble> occupant = state.findMarbleAt(square);
        return occupant.isPresent() && occupant.get() != moving;
    }

    private Set<Action> jackSwaps(Card card) {
        Set<Action> out = new LinkedHashSet<>();
        List<Marble> team = new ArrayList<>();
        for (int seat : state.getMovableSeats()) {
            for (Marble marble : state.getPlayer(seat).getMarbles()) {
                if (Board.isOnTrack(marble.getPos())) {
                    team.add(marble);
                }
            }
        }
        int active = state.getActivePlayerIdx();
        int[] opponentSeats = {(active + 1) % Board.SEATS, (active + 3) % Board.SEATS};
        for (Marble own : team) {
            for (int seat : opponentSeats) {
                for (Marble opponent : state.getPlayer(seat).getMarbles()) {
                    if (opponent.isSave() || !Board.isOnTrack(opponent.getPos())) {
                        continue;
                    }
                    out.add(Action.move(card, own.getPos(), opponent.getPos()));
                    out.add(Action.move(card, opponent.getPos(), own.getPos()));
                }
            }
        }
        if (!out.isEmpty()) {
            return out;
        }
        // No opponent can be taken: the jack swaps two team marbles instead.
        for (int i = 0; i < team.size(); i++) {
            for (int j = i + 1; j < team.size(); j++) {
                out.add(Action.move(card, team.get(i).getPos(), team.get(j).getPos()));
                out.add(Action.move(card, team.get(j).getPos(), team.get(i).getPos()));
            }
        }
        return out;
    }

    /**
     * Until one of the player's own marbles is out, a joker may only stand in for an
     * ace or a king; afterwards it may be any card but another joker.
     */
    private Set<Action> substitutions(Card joker) {
        Set<Action> out = new LinkedHashSet<>();
        List<Rank> ranks = new ArrayList<>();
        if (state.isBeginningPhase()) {
            ranks.add(Rank.ACE);
            ranks.add(Rank.KING);
        } else {
            for (Rank rank : Rank.values()) {
                if (rank != Rank.JOKER) {
                    ranks.add(rank);
                }
            }
        }
        for (Suit suit : Suit.regularSuits()) {
            for (Rank rank : ranks) {
                out.add(Action.substitute(joker, new Card(rank, suit)));
            }
        }
        return out;
    }
}
