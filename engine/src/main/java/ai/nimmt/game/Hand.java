package ai.nimmt.game;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Cards held by one participant and not yet played, kept sorted by number.
 */
public class Hand {
    private final ParticipantId owner;
    private final TreeSet<Card> cards = new TreeSet<>();

    public Hand(ParticipantId owner, Collection<Card> cards) {
        this.owner = Objects.requireNonNull(owner, "owner");
        for (Card card : cards) {
            if (!this.cards.add(card)) {
                throw new IllegalArgumentException("Duplicate card in hand: " + card);
            }
        }
    }

    public Hand copy() {
        return new Hand(owner, cards);
    }

    public boolean contains(Card card) {
        return cards.contains(card);
    }

    /**
     * Looks up a card by its number.
     *
     * @param number the card number
     * @return the card, or empty if the hand does not hold it
     */
    public Optional<Card> find(int number) {
        if (number < Card.MIN_NUMBER || number > Card.MAX_NUMBER) {
            return Optional.empty();
        }
        Card card = new Card(number);
        return cards.contains(card) ? Optional.of(card) : Optional.empty();
    }

    /**
     * Removes a card that is about to be played.
     *
     * @param card the card to remove
     * @throws IllegalMoveException if the hand does not hold the card
     */
    public void remove(Card card) {
        if (!cards.remove(card)) {
            throw new IllegalMoveException(owner + " does not hold card " + card);
        }
    }

    /**
     * Returns the lowest-numbered card, used as the deterministic fallback move.
     *
     * @return the lowest card, or empty if the hand is empty
     */
    public Optional<Card> lowest() {
        return cards.isEmpty() ? Optional.empty() : Optional.of(cards.first());
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Returns the cards in ascending order as an unmodifiable list.
     */
    public List<Card> cards() {
        return Collections.unmodifiableList(new ArrayList<>(cards));
    }

    @Override
    public String toString() {
        return owner + cards.toString();
    }
}
