package ai.nimmt.gateway;

/**
 * The AI move service answered, but the answer cannot be used: unparseable JSON, no card
 * number, a card the AI does not hold, or a row index off the board.
 */
public class InvalidGatewayResponseException extends GatewayException {

    public InvalidGatewayResponseException(String message) {
        super(message);
    }

    public InvalidGatewayResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
