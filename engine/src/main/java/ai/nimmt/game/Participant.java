package ai.nimmt.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Score record for one seat.
 * <p>
 * The score is the running bull-head total across all deals of a game and never decreases.
 * The taken pile holds the cards collected during the current deal only; it is handed back
 * to the deck when the next deal starts.
 */
public class Participant {
    private final ParticipantId id;
    private final List<Card> takenPile = new ArrayList<>();
    private int score;
    private boolean won;

    public Participant(ParticipantId id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    /**
     * Creates an independent copy for working-copy resolution.
     */
    public Participant copy() {
        Participant clone = new Participant(id);
        clone.takenPile.addAll(takenPile);
        clone.score = score;
        clone.won = won;
        return clone;
    }

    public ParticipantId getId() {
        return id;
    }

    public int getScore() {
        return score;
    }

    public boolean hasWon() {
        return won;
    }

    void markWinner() {
        this.won = true;
    }

    /**
     * Returns an unmodifiable view of the cards taken during the current deal.
     */
    public List<Card> getTakenPile() {
        return Collections.unmodifiableList(takenPile);
    }

    /**
     * Adds taken cards to the pile and their bull heads to the score.
     *
     * @param cards the cards collected from a row
     * @return the bull heads added
     */
    int collect(List<Card> cards) {
        takenPile.addAll(cards);
        int points = BullHeadTable.total(cards);
        score += points;
        return points;
    }

    /**
     * Empties the taken pile, keeping the score.
     *
     * @return the cards that were in the pile
     */
    public List<Card> returnTakenPile() {
        List<Card> returned = new ArrayList<>(takenPile);
        takenPile.clear();
        return returned;
    }

    @Override
    public String toString() {
        return id + "(score=" + score + ")";
    }
}
