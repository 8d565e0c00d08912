package games.dog;

import games.dog.game.Action;
import games.dog.game.Board;
import games.dog.game.DogGame;
import games.dog.game.GamePhase;
import games.dog.game.GameState;
import games.dog.game.Team;
import games.dog.player.Player;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plays one game of Dog between four {@link Player} seats.
 */
public class Match {
    private static final Logger log = LoggerFactory.getLogger(Match.class);
    public static final int SEATS = Board.SEATS;

    private final Supplier<DogGame> games;
    private final List<Player> seats;
    private final int maxActions;

    /**
     * @param games supplies a freshly dealt game for each {@link #play()}
     * @param seats the players, indexed by seat
     * @param maxActions actions after which the match is stopped undecided
     */
    public Match(Supplier<DogGame> games, List<Player> seats, int maxActions) {
        this.games = Objects.requireNonNull(games, "games");
        this.seats = List.copyOf(Objects.requireNonNull(seats, "seats"));
        if (this.seats.size() != SEATS) {
            throw new IllegalArgumentException("A match needs " + SEATS + " players, got " + this.seats.size());
        }
        if (maxActions <= 0) {
            throw new IllegalArgumentException("maxActions must be positive: " + maxActions);
        }
        this.maxActions = maxActions;
    }

    /**
     * Core game loop: each turn the active seat picks from the legal actions shown on
     * its player view, and the choice is applied.
     * <p>
     * A choice outside the legal set is logged and replaced: by "none" during play, or
     * by the first legal card during the card exchange, where none is not allowed.
     * Engine exceptions propagate.
     *
     * @return the winning team, if any, with the actions applied, rounds reached and duration
     */
    public MatchResult play() {
        DogGame game = games.get();
        long startNanos = System.nanoTime();
        int applied = 0;
        log.info("Match started");

        while (game.getState().getPhase() == GamePhase.RUNNING) {
            if (applied >= maxActions) {
                log.info("Action limit reached ({}); stopping match undecided", maxActions);
                break;
            }
            GameState state = game.getState();
            int seat = state.getActivePlayerIdx();
            Set<Action> legal = game.getListAction();
            Action chosen = seats.get(seat).selectAction(game.getPlayerView(seat), legal);
            if (chosen != null && !legal.contains(chosen)) {
                log.warn("Seat {} chose illegal action {}; playing none instead", seat, chosen);
                chosen = null;
            }
            if (chosen == null && !state.isCardExchanged() && !legal.isEmpty()) {
                chosen = legal.iterator().next();
                log.warn("Seat {} must exchange a card; giving {}", seat, chosen);
            }
            if (log.isDebugEnabled()) {
                log.debug("Seat {} plays {}", seat, chosen == null ? "none" : chosen);
            }
            game.applyAction(chosen);
            applied++;
        }

        long durationNanos = System.nanoTime() - startNanos;
        Optional<Team> winner = game.getWinner();
        int rounds = game.getState().getRound();
        log.info("Match over after {} actions in {} rounds; winner: {}",
                applied, rounds, winner.map(Team::toString).orElse("none"));
        return new MatchResult(winner, applied, rounds, durationNanos);
    }

    /**
     * Summary of a played match.
     */
    public static final class MatchResult {
        private final Optional<Team> winner;
        private final int actions;
        private final int rounds;
        private final long durationNanos;

        public MatchResult(Optional<Team> winner, int actions, int rounds, long durationNanos) {
            this.winner = Objects.requireNonNull(winner, "winner");
            this.actions = actions;
            this.rounds = rounds;
            this.durationNanos = durationNanos;
        }

        public Optional<Team> getWinner() {
            return winner;
        }

        public int getActions() {
            return actions;
        }

        public int getRounds() {
            return rounds;
        }

        public long getDurationNanos() {
            return durationNanos;
        }

        @Override
        public String toString() {
            return "MatchResult(winner=" + winner.map(Team::toString).orElse("none")
                    + ", actions=" + actions + ", rounds=" + rounds
                    + ", durationMs=" + durationNanos / 1_000_000 + ")";
        }
    }
}
