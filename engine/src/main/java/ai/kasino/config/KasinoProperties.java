package ai.kasino.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the Casino engine and match runner.
 *
 * Usage:
 * {@code java -jar kasino-engine.jar --kasino.players=3 --kasino.target-score=21 --kasino.seed=42}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "kasino")
public class KasinoProperties {
  private int players = 2;
  private int targetScore = 11;
  private int maxActionLog = 50;
  private Long seed;
  private int maxMovesPerMatch = 2000;

  /**
   * Returns the number of seats, 2 to 4.
   * @return the seat count
   */
  public int getPlayers() {
    return players;
  }

  public void setPlayers(int players) {
    this.players = players;
  }

  /**
   * Returns the match score that ends a match.
   * @return the target score
   */
  public int getTargetScore() {
    return targetScore;
  }

  public void setTargetScore(int targetScore) {
    this.targetScore = targetScore;
  }

  /**
   * Returns how many actions a game state keeps in its log before dropping the oldest.
   * @return the action log capacity
   */
  public int getMaxActionLog() {
    return maxActionLog;
  }

  public void setMaxActionLog(int maxActionLog) {
    this.maxActionLog = maxActionLog;
  }

  /**
   * Returns the seed for shuffling and random play, or null for a fresh seed every run.
   * @return the seed, possibly null
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }

  /**
   * Returns the safety cap on commands processed in one match.
   * @return the maximum number of commands
   */
  public int getMaxMovesPerMatch() {
    return maxMovesPerMatch;
  }

  public void setMaxMovesPerMatch(int maxMovesPerMatch) {
    this.maxMovesPerMatch = maxMovesPerMatch;
  }
}
