package ai.nimmt.gateway;

/**
 * Base type for failures talking to the AI move service.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
