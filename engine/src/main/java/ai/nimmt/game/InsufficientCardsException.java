package ai.nimmt.game;

/**
 * Raised when a deal asks for more cards than the deck holds. Nothing is dealt.
 */
public class InsufficientCardsException extends NimmtException {

    public InsufficientCardsException(int requested, int available) {
        super("Deal needs " + requested + " cards but the deck holds " + available);
    }
}
