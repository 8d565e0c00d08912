package games.dog.player;

import games.dog.game.Action;
import games.dog.game.GameState;
import games.dog.game.RandomSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Picks uniformly among the legal actions; returns none when there is nothing to play.
 */
public class RandomPlayer implements Player {
    private final RandomSource random;

    public RandomPlayer(RandomSource random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public Action selectAction(GameState view, Set<Action> actions) {
        if (actions == null || actions.isEmpty()) {
            return null;
        }
        List<Action> choices = new ArrayList<>(actions);
        return choices.get(random.nextInt(choices.size()));
    }
}
