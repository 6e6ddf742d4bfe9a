package ai.nimmt.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin HTTP client for the AI move service.
 * <p>
 * Posts an {@link AiMoveRequest} as JSON to {@code {baseUrl}/move} and reads back an
 * {@link AiMoveResponse}. Connect and read timeouts bound every call. Failures are reported as
 * typed exceptions; retrying and falling back are left to {@link ResilientAiMoveGateway}.
 */
public class HttpAiMoveGateway implements AiMoveGateway {

    private static final Logger log = LoggerFactory.getLogger(HttpAiMoveGateway.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /**
     * URI endpoint for the /move POST request.
     * Expected format: http://host:port/move
     */
    private final URI moveUri;
    private final int connectTimeoutMillis;
    private final int readTimeoutMillis;

    /**
     * @param baseUrl base URL of the service, e.g. {@code http://127.0.0.1:8000}
     * @param connectTimeoutMillis connect timeout
     * @param readTimeoutMillis read timeout
     */
    public HttpAiMoveGateway(String baseUrl, int connectTimeoutMillis, int readTimeoutMillis) {
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.moveUri = URI.create(trimmed + "/move");
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.readTimeoutMillis = readTimeoutMillis;
    }

    @Override
    public AiMoveResponse chooseMove(AiMoveRequest request) {
        long startNanos = System.nanoTime();
        if (log.isDebugEnabled()) {
            log.debug("Calling AI move service at {} for round {} with {} cards in hand ({})",
                    moveUri, request.getRound(), request.getAiHand().size(), request.getAlgorithm());
        }

        byte[] body;
        try {
            body = OBJECT_MAPPER.writeValueAsBytes(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise AI move request", e);
        }

        int statusCode;
        String responseBody;
        try {
            HttpURLConnection conn = (HttpURLConnection) moveUri.toURL().openConnection();
            conn.setRequestMethod("POST");
            conn.setDoOutput(true);
            conn.setConnectTimeout(connectTimeoutMillis);
            conn.setReadTimeout(readTimeoutMillis);
            conn.setRequestProperty("Content-Type", "application/json");
            conn.setRequestProperty("Accept", "application/json");
            conn.setRequestProperty("Connection", "close");
            conn.setFixedLengthStreamingMode(body.length);

            conn.connect();
            try (OutputStream os = conn.getOutputStream()) {
                os.write(body);
                os.flush();
            }

            statusCode = conn.getResponseCode();
            InputStream is = statusCode >= 200 && statusCode < 300
                    ? conn.getInputStream()
                    : conn.getErrorStream();
            responseBody = "";
            if (is != null) {
                try (InputStream in = is) {
                    responseBody = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                }
            }
        } catch (IOException e) {
            long durationMillis = (System.nanoTime() - startNanos) / 1_000_000L;
            throw new GatewayUnavailableException(
                    "AI move service at " + moveUri + " failed after " + durationMillis + " ms: " + e, e);
        }

        if (statusCode < 200 || statusCode >= 300) {
            throw new GatewayUnavailableException(
                    "AI move service at " + moveUri + " answered HTTP " + statusCode + ": " + responseBody);
        }

        AiMoveResponse response;
        try {
            response = OBJECT_MAPPER.readValue(responseBody, AiMoveResponse.class);
        } catch (JsonProcessingException e) {
            throw new InvalidGatewayResponseException("Unparseable AI move response: " + responseBody, e);
        }
        if (response == null || response.getChosenCardNumber() == null) {
            throw new InvalidGatewayResponseException("AI move response has no chosenCardNumber: " + responseBody);
        }

        if (log.isDebugEnabled()) {
            long durationMillis = (System.nanoTime() - startNanos) / 1_000_000L;
            log.debug("AI move service responded in {} ms with {}", durationMillis, response);
        }
        return response;
    }

    public URI getMoveUri() {
        return moveUri;
    }
}
