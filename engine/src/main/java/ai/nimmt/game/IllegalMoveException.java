package ai.nimmt.game;

/**
 * Raised when a submitted move breaks the rules: the card is not in the player's hand, the
 * row index is out of range, the player already submitted this round, or the session is not
 * accepting moves.
 */
public class IllegalMoveException extends NimmtException {

    public IllegalMoveException(String message) {
        super(message);
    }
}
