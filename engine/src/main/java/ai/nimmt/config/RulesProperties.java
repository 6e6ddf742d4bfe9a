package ai.nimmt.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the game rules.
 * 
 * Usage:
 * {@code java -jar engine.jar --rules.score-limit=33 --rules.hand-size=10}
 * 
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "rules")
public class RulesProperties {
  private int handSize = 10;
  private int scoreLimit = 66;

  /**
   * Returns the number of cards dealt to each participant.
   * @return cards per hand
   */
  public int getHandSize() {
    return handSize;
  }

  public void setHandSize(int handSize) {
    this.handSize = handSize;
  }

  /**
   * Returns the score at which the game ends.
   * @return the score limit
   */
  public int getScoreLimit() {
    return scoreLimit;
  }

  public void setScoreLimit(int scoreLimit) {
    this.scoreLimit = scoreLimit;
  }
}
