package games.dog.unit.player;

import static games.dog.unit.helpers.DogTestHelper.move;
import static org.junit.jupiter.api.Assertions.*;

import games.dog.game.Action;
import games.dog.game.RandomSource;
import games.dog.player.RandomPlayer;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RandomPlayerTest {

    @Test
    void returnsNoneWhenNothingIsLegal() {
        RandomPlayer player = new RandomPlayer(RandomSource.seeded(1L));

        assertNull(player.selectAction(null, Set.of()));
    }

    @Test
    void picksOneOfTheLegalActions() {
        RandomPlayer player = new RandomPlayer(RandomSource.seeded(2L));
        Set<Action> actions = new LinkedHashSet<>(List.of(move("2♣", 10, 12), move("5♥", 10, 15), move("A♠", 64, 0)));

        for (int i = 0; i < 50; i++) {
            assertTrue(actions.contains(player.selectAction(null, actions)));
        }
    }

    @Test
    void eventuallyPicksEveryAction() {
        RandomPlayer player = new RandomPlayer(RandomSource.seeded(3L));
        Set<Action> actions = new LinkedHashSet<>(List.of(move("2♣", 10, 12), move("5♥", 10, 15)));
        Set<Action> seen = new LinkedHashSet<>();

        for (int i = 0; i < 100; i++) {
            seen.add(player.selectAction(null, actions));
        }

        assertEquals(actions, seen);
    }
}
