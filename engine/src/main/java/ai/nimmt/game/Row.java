package ai.nimmt.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One of the four rows on the table.
 * <p>
 * Cards are kept in play order, which is always strictly ascending by number. A row holds
 * at most {@link #MAX_LENGTH} cards at rest; the sixth card forces a take before it is laid.
 */
public class Row {
    /** Number of cards a row can hold before the next card forces a take. */
    public static final int MAX_LENGTH = 5;

    private final List<Card> cards = new ArrayList<>();

    public Row() {
    }

    public Row(List<Card> cards) {
        for (Card card : cards) {
            append(card);
        }
    }

    public Row copy() {
        return new Row(cards);
    }

    /**
     * Returns the last card laid on the row.
     *
     * @throws IllegalStateException if the row is empty
     */
    public Card last() {
        if (cards.isEmpty()) {
            throw new IllegalStateException("Row is empty");
        }
        return cards.get(cards.size() - 1);
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    public boolean isFull() {
        return cards.size() >= MAX_LENGTH;
    }

    public int bullHeads() {
        return BullHeadTable.total(cards);
    }

    public List<Card> cards() {
        return Collections.unmodifiableList(cards);
    }

    /**
     * Lays a card at the end of the row.
     *
     * @throws IllegalStateException if the card is not higher than the last card or the row is full
     */
    void append(Card card) {
        if (!cards.isEmpty() && card.getNumber() <= last().getNumber()) {
            throw new IllegalStateException("Card " + card + " cannot follow " + last());
        }
        if (cards.size() >= MAX_LENGTH) {
            throw new IllegalStateException("Row already holds " + MAX_LENGTH + " cards");
        }
        cards.add(card);
    }

    /**
     * Removes every card and seeds the row with a single card.
     *
     * @param seed the card that starts the row again
     * @return the removed cards, in row order
     */
    List<Card> resetTo(Card seed) {
        List<Card> taken = new ArrayList<>(cards);
        cards.clear();
        cards.add(seed);
        return taken;
    }

    @Override
    public String toString() {
        return cards.toString();
    }
}
