package games.dog.unit.game;

import static games.dog.unit.helpers.DogTestHelper.assertConservation;
import static games.dog.unit.helpers.DogTestHelper.assertMarblesValid;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.dog.game.Action;
import games.dog.game.DogGame;
import games.dog.game.GamePhase;
import games.dog.game.GameState;
import games.dog.game.RandomSource;
import games.dog.player.LegalActionsHelper;
import games.dog.player.RandomPlayer;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Plays seeded random games and checks the game invariants after every action.
 */
class RandomPlayTest {
    private static final int ACTIONS_PER_GAME = 3_000;

    @ParameterizedTest
    @ValueSource(longs = {1L, 2L, 3L, 17L, 2024L})
    void invariantsHoldThroughoutRandomPlay(long seed) {
        DogGame game = new DogGame(RandomSource.seeded(seed));
        RandomPlayer player = new RandomPlayer(RandomSource.seeded(seed * 31));

        for (int i = 0; i < ACTIONS_PER_GAME && game.getState().getPhase() == GamePhase.RUNNING; i++) {
            GameState state = game.getState();
            Set<Action> legal = game.getListAction();
            assertTrue(LegalActionsHelper.findDuplicates(new ArrayList<>(legal)).isEmpty());

            Action chosen = player.selectAction(game.getPlayerView(state.getActivePlayerIdx()), legal);
            game.applyAction(chosen);

            assertConservation(state);
            assertMarblesValid(state);
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {5L, 6L})
    void seededGamesReplayIdentically(long seed) {
        assertEquals(replay(seed), replay(seed));
    }

    private static List<Action> replay(long seed) {
        DogGame game = new DogGame(RandomSource.seeded(seed));
        RandomPlayer player = new RandomPlayer(RandomSource.seeded(seed));
        List<Action> played = new ArrayList<>();
        for (int i = 0; i < 500 && game.getState().getPhase() == GamePhase.RUNNING; i++) {
            Action chosen = player.selectAction(game.getState(), game.getListAction());
            played.add(chosen);
            game.applyAction(chosen);
        }
        return played;
    }
}
