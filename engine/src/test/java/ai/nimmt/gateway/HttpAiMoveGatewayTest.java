package ai.nimmt.gateway;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Runs the client against a local HTTP server that plays back canned answers.
 */
class HttpAiMoveGatewayTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final AiMoveRequest REQUEST = new AiMoveRequest(
            List.of(List.of(3, 9), List.of(20), List.of(31, 44, 51), List.of(70)),
            List.of(12, 55, 88),
            3,
            new AiMoveRequest.Scores(6, 11),
            AiAlgorithm.MCTS,
            4);

    private HttpServer server;
    private final AtomicReference<String> receivedBody = new AtomicReference<>();
    private final AtomicReference<String> receivedMethod = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String reply = "{}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/move", exchange -> {
            receivedMethod.set(exchange.getRequestMethod());
            receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = reply.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop(0);
        }
    }

    private HttpAiMoveGateway gateway() {
        return new HttpAiMoveGateway("http://127.0.0.1:" + server.getAddress().getPort() + "/", 1_000, 2_000);
    }

    @Test
    void postsPublicStateAndReadsTheChosenCard() throws IOException {
        reply = "{\"chosenCardNumber\": 55, \"rowChoice\": 1}";

        AiMoveResponse response = gateway().chooseMove(REQUEST);

        assertEquals(55, response.getChosenCardNumber());
        assertEquals(1, response.getRowChoice());
        assertEquals("POST", receivedMethod.get());
        JsonNode sent = MAPPER.readTree(receivedBody.get());
        assertEquals("[[3,9],[20],[31,44,51],[70]]", sent.get("board").toString());
        assertEquals("[12,55,88]", sent.get("aiHand").toString());
        assertEquals(3, sent.get("humanHandSize").asInt());
        assertEquals(6, sent.get("scores").get("human").asInt());
        assertEquals(11, sent.get("scores").get("ai").asInt());
        assertEquals("mcts", sent.get("algorithm").asText());
        assertEquals(4, sent.get("round").asInt());
    }

    @Test
    void ignoresFieldsItDoesNotKnow() {
        reply = "{\"chosenCardNumber\": 12, \"newState\": {\"rows\": []}, \"elapsed\": 0.4}";

        AiMoveResponse response = gateway().chooseMove(REQUEST);

        assertEquals(12, response.getChosenCardNumber());
        assertNull(response.getRowChoice());
    }

    @Test
    void serverErrorMeansUnavailable() {
        status = 500;
        reply = "{\"detail\": \"model crashed\"}";

        assertThrows(GatewayUnavailableException.class, () -> gateway().chooseMove(REQUEST));
    }

    @Test
    void garbageBodyIsInvalid() {
        reply = "<html>oops</html>";

        assertThrows(InvalidGatewayResponseException.class, () -> gateway().chooseMove(REQUEST));
    }

    @Test
    void missingCardIsInvalid() {
        reply = "{\"rowChoice\": 2}";

        assertThrows(InvalidGatewayResponseException.class, () -> gateway().chooseMove(REQUEST));
    }

    @Test
    void refusedConnectionMeansUnavailable() {
        HttpAiMoveGateway gateway = gateway();
        server.stop(0);
        server = null;

        assertThrows(GatewayUnavailableException.class, () -> gateway.chooseMove(REQUEST));
    }

    @Test
    void trailingSlashIsDropped() {
        assertEquals("/move", gateway().getMoveUri().getPath());
    }
}
