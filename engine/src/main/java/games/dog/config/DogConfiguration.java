package games.dog.config;

import games.dog.Match;
import games.dog.game.DogGame;
import games.dog.game.RandomSource;
import games.dog.player.Player;
import games.dog.player.RandomPlayer;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires a {@link Match} of four random players from {@link DogProperties}.
 */
@Configuration
@EnableConfigurationProperties(DogProperties.class)
public class DogConfiguration {

  @Bean
  public RandomSource randomSource(DogProperties properties) {
    Long seed = properties.getSeed();
    return seed != null ? RandomSource.seeded(seed) : RandomSource.unseeded();
  }

  @Bean
  public Supplier<DogGame> dogGames(RandomSource randomSource, DogProperties properties) {
    boolean cardExchange = properties.isCardExchange();
    return () -> new DogGame(randomSource, cardExchange);
  }

  @Bean
  public Match match(Supplier<DogGame> dogGames, RandomSource randomSource, DogProperties properties) {
    List<Player> seats = new ArrayList<>();
    for (int i = 0; i < Match.SEATS; i++) {
      seats.add(new RandomPlayer(randomSource));
    }
    return new Match(dogGames, seats, properties.getMaxActionsPerMatch());
  }
}
