package games.dog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for Dog matches.
 *
 * Usage:
 * {@code java -jar dog-engine.jar --dog.seed=42 --dog.card-exchange=false}
 */
@ConfigurationProperties(prefix = "dog")
public class DogProperties {
  /** Seed for shuffling and random players; unset means a fresh seed per run. */
  private Long seed;
  private boolean cardExchange = true;
  private int maxActionsPerMatch = 10_000;

  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }

  /**
   * Returns whether each round opens with the partner card exchange.
   * @return true if the exchange is played
   */
  public boolean isCardExchange() {
    return cardExchange;
  }

  public void setCardExchange(boolean cardExchange) {
    this.cardExchange = cardExchange;
  }

  /**
   * Returns the number of actions after which a match is stopped undecided.
   * @return the action cap
   */
  public int getMaxActionsPerMatch() {
    return maxActionsPerMatch;
  }

  public void setMaxActionsPerMatch(int maxActionsPerMatch) {
    if (maxActionsPerMatch <= 0) {
      throw new IllegalArgumentException("dog.max-actions-per-match must be positive: " + maxActionsPerMatch);
    }
    this.maxActionsPerMatch = maxActionsPerMatch;
  }
}
