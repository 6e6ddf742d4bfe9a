package ai.nimmt.game;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * One participant's card for the current round, with the row to take should the card fit
 * no row.
 *
 * @param participant who played the card
 * @param card the played card
 * @param rowChoice 0-based row to take when no row is a valid target, or {@code null} if not given
 */
public record Submission(ParticipantId participant, Card card, Integer rowChoice) {

    public Submission {
        Objects.requireNonNull(participant, "participant");
        Objects.requireNonNull(card, "card");
    }

    public static Submission of(ParticipantId participant, int cardNumber) {
        return new Submission(participant, Card.of(cardNumber), null);
    }

    public static Submission of(ParticipantId participant, int cardNumber, int rowChoice) {
        return new Submission(participant, Card.of(cardNumber), rowChoice);
    }

    public OptionalInt optionalRowChoice() {
        return rowChoice == null ? OptionalInt.empty() : OptionalInt.of(rowChoice);
    }

    /**
     * Returns a copy of this submission with the given row choice.
     */
    public Submission withRowChoice(int row) {
        return new Submission(participant, card, row);
    }
}
