package games.dog.game;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects the end of the game: a team wins once all eight of its marbles sit in the
 * partners' finish lanes.
 */
public class WinDetector {
    private static final Logger log = LoggerFactory.getLogger(WinDetector.class);

    /**
     * Checks for a winner and finishes the game when one is found.
     * <p>
     * The game is finished at most once: on a game that is already finished this is a
     * no-op returning empty.
     *
     * @return the winning team, if the game has just been won
     */
    public Optional<Team> check(GameState state) {
        if (state.getPhase() == GamePhase.FINISHED) {
            return Optional.empty();
        }
        Optional<Team> winner = winningTeam(state);
        if (winner.isPresent()) {
            state.setPhase(GamePhase.FINISHED);
            log.info("Game finished in round {}: seats {} and {} win",
                    state.getRound(), winner.get().firstSeat(), winner.get().secondSeat());
        }
        return winner;
    }

    /**
     * Returns the team whose marbles are all home, without changing the state.
     */
    public static Optional<Team> winningTeam(GameState state) {
        for (int first = 0; first < Board.SEATS / 2; first++) {
            Team team = new Team(first, first + 2);
            if (state.isPlayerFinished(team.firstSeat()) && state.isPlayerFinished(team.secondSeat())) {
                return Optional.of(team);
            }
        }
        return Optional.empty();
    }
}
