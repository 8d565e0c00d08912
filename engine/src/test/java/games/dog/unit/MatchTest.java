package games.dog.unit;

import static org.junit.jupiter.api.Assertions.*;

import games.dog.Match;
import games.dog.game.Action;
import games.dog.game.Card;
import games.dog.game.DogGame;
import games.dog.game.RandomSource;
import games.dog.player.Player;
import games.dog.player.RandomPlayer;
import java.util.List;
import org.junit.jupiter.api.Test;

class MatchTest {

    private static List<Player> randomSeats(long seed) {
        RandomSource random = RandomSource.seeded(seed);
        return List.of(new RandomPlayer(random), new RandomPlayer(random),
                new RandomPlayer(random), new RandomPlayer(random));
    }

    @Test
    void playsUntilWonOrCapped() {
        Match match = new Match(() -> new DogGame(RandomSource.seeded(21L)), randomSeats(21L), 400);

        Match.MatchResult result = match.play();

        assertTrue(result.getActions() > 0);
        assertTrue(result.getActions() <= 400);
        assertTrue(result.getRounds() >= 1);
        if (result.getWinner().isEmpty()) {
            assertEquals(400, result.getActions());
        }
    }

    @Test
    void illegalChoicesAreReplaced() {
        Action illegal = Action.move(Card.parse("4♠"), 0, 4);
        Player cheat = (view, actions) -> illegal;
        Match match = new Match(() -> new DogGame(RandomSource.seeded(4L)), List.of(cheat, cheat, cheat, cheat), 60);

        Match.MatchResult result = match.play();

        assertEquals(60, result.getActions());
        assertTrue(result.getWinner().isEmpty());
    }

    @Test
    void needsFourSeats() {
        List<Player> three = randomSeats(1L).subList(0, 3);

        assertThrows(IllegalArgumentException.class, () -> new Match(DogGame::new, three, 10));
        assertThrows(IllegalArgumentException.class, () -> new Match(DogGame::new, randomSeats(1L), 0));
    }
}
