package ai.nimmt.game;

/**
 * Base type for rule violations raised by the engine.
 * <p>
 * Every rejected operation leaves board, hands and scores untouched, so callers may catch
 * this type, report it and carry on with the same session.
 */
public class NimmtException extends RuntimeException {

    public NimmtException(String message) {
        super(message);
    }

    public NimmtException(String message, Throwable cause) {
        super(message, cause);
    }
}
