package ai.nimmt.config;

import ai.nimmt.gateway.AiMoveGateway;
import ai.nimmt.gateway.HttpAiMoveGateway;
import ai.nimmt.gateway.ResilientAiMoveGateway;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the HTTP gateway behind the retrying, validating wrapper.
 */
@Configuration
public class GatewayConfiguration {

  @Bean
  public AiMoveGateway aiMoveGateway(GatewayProperties properties) {
    HttpAiMoveGateway http = new HttpAiMoveGateway(
        properties.getBaseUrl(),
        properties.getConnectTimeoutMillis(),
        properties.getReadTimeoutMillis());
    return new ResilientAiMoveGateway(http, properties.getMaxAttempts(), properties.getBackoffMillis());
  }
}
