package ai.nimmt.gateway;

/**
 * The AI move service could not be reached, timed out, or answered with a non-2xx status.
 */
public class GatewayUnavailableException extends GatewayException {

    public GatewayUnavailableException(String message) {
        super(message);
    }

    public GatewayUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
