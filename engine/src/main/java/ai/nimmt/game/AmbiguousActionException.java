package ai.nimmt.game;

/**
 * Raised when a played card is lower than the last card of every row and the player has not
 * said which row to take. Resolution stays blocked until a row is chosen.
 */
public class AmbiguousActionException extends NimmtException {
    private final ParticipantId participant;
    private final Card card;

    public AmbiguousActionException(ParticipantId participant, Card card) {
        super("Card " + card + " played by " + participant + " fits no row; a row to take must be chosen");
        this.participant = participant;
        this.card = card;
    }

    public ParticipantId getParticipant() {
        return participant;
    }

    public Card getCard() {
        return card;
    }
}
