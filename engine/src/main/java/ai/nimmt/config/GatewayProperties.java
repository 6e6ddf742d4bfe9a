package ai.nimmt.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the AI move service.
 * 
 * Usage:
 * {@code java -jar engine.jar --gateway.base-url=http://127.0.0.1:8000 --gateway.algorithm=mcts}
 * 
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {
  private String baseUrl = "http://127.0.0.1:8000";
  private int connectTimeoutMillis = 2_000;
  private int readTimeoutMillis = 5_000;
  private int maxAttempts = 3;
  private long backoffMillis = 200;
  /** Bound on one AI move including retries; after it the fallback card is played. */
  private long moveTimeoutMillis = 20_000;
  private String algorithm = "expectiminimax";

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public int getConnectTimeoutMillis() {
    return connectTimeoutMillis;
  }

  public void setConnectTimeoutMillis(int connectTimeoutMillis) {
    this.connectTimeoutMillis = connectTimeoutMillis;
  }

  public int getReadTimeoutMillis() {
    return readTimeoutMillis;
  }

  public void setReadTimeoutMillis(int readTimeoutMillis) {
    this.readTimeoutMillis = readTimeoutMillis;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public long getBackoffMillis() {
    return backoffMillis;
  }

  public void setBackoffMillis(long backoffMillis) {
    this.backoffMillis = backoffMillis;
  }

  public long getMoveTimeoutMillis() {
    return moveTimeoutMillis;
  }

  public void setMoveTimeoutMillis(long moveTimeoutMillis) {
    this.moveTimeoutMillis = moveTimeoutMillis;
  }

  /**
   * Returns the algorithm name sent to the service ({@code expectiminimax} or {@code mcts}).
   * @return the algorithm name
   */
  public String getAlgorithm() {
    return algorithm;
  }

  public void setAlgorithm(String algorithm) {
    this.algorithm = algorithm;
  }
}
