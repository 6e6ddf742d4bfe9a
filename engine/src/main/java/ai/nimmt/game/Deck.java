package ai.nimmt.game;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The 104-card 6 Nimmt deck.
 * <p>
 * A {@code Deck} owns the cards that are not yet in a hand or on the board. It is built
 * complete (cards 1–104), shuffled with an unbiased Fisher–Yates pass, and then dealt from
 * the top (index 0). Cards left over after a deal stay in the deck and are not used for play.
 */
public class Deck {
    /** Number of cards in a complete deck. */
    public static final int SIZE = Card.MAX_NUMBER;

    /** The list of cards currently in the deck; index 0 is the top. */
    private final List<Card> cards = new ArrayList<>();

    /**
     * Constructs a complete deck in ascending order. Call {@link #shuffle(RandomSource)} before dealing.
     */
    public Deck() {
        for (int n = Card.MIN_NUMBER; n <= Card.MAX_NUMBER; n++) {
            cards.add(new Card(n));
        }
    }

    /**
     * Constructs a deck holding exactly the given cards in the given order (top first).
     * <p>
     * Used to deal prepared games in tests and replays.
     *
     * @param cards the cards, top first; must not contain duplicates
     * @throws IllegalArgumentException if a card appears twice
     */
    public Deck(Collection<Card> cards) {
        Objects.requireNonNull(cards, "cards");
        for (Card card : cards) {
            if (this.cards.contains(card)) {
                throw new IllegalArgumentException("Duplicate card in deck: " + card);
            }
            this.cards.add(card);
        }
    }

    /**
     * Shuffles the deck in place.
     * <p>
     * Walks from the last index down to 1 and swaps each position with a partner drawn
     * uniformly from {@code 0..i} inclusive, so every permutation is equally likely.
     *
     * @param random the source of swap partners
     */
    public void shuffle(RandomSource random) {
        for (int i = cards.size() - 1; i > 0; i--) {
            int j = random.nextIntInclusive(0, i);
            Collections.swap(cards, i, j);
        }
    }

    /**
     * Deals two hands and the row seeds from the top of the deck.
     * <p>
     * The human hand takes the first {@code handSize} cards, the AI hand the next
     * {@code handSize}, and each starter row one of the following {@code starterRows} cards.
     * Nothing is removed when the deck is too small.
     *
     * @param handSize cards per hand
     * @param starterRows number of single-card row seeds
     * @return the dealt cards
     * @throws InsufficientCardsException if {@code 2 * handSize + starterRows} exceeds the deck size
     */
    public Deal deal(int handSize, int starterRows) {
        if (handSize < 0 || starterRows < 0) {
            throw new IllegalArgumentException("handSize and starterRows must be non-negative");
        }
        int needed = 2 * handSize + starterRows;
        if (needed > cards.size()) {
            throw new InsufficientCardsException(needed, cards.size());
        }
        List<Card> top = cards.subList(0, needed);
        Deal deal = new Deal(
                List.copyOf(top.subList(0, handSize)),
                List.copyOf(top.subList(handSize, 2 * handSize)),
                List.copyOf(top.subList(2 * handSize, needed)));
        top.clear();
        return deal;
    }

    /**
     * Returns the number of cards remaining in the deck.
     */
    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Returns an unmodifiable view of the cards in the deck, top first.
     */
    public List<Card> asUnmodifiableList() {
        return Collections.unmodifiableList(cards);
    }

    @Override
    public String toString() {
        return "Deck(size=" + cards.size() + ")";
    }

    /**
     * Cards handed out by one {@link #deal(int, int)} call.
     *
     * @param humanHand the human's hand
     * @param aiHand the AI's hand
     * @param starters one seed card per row, in row order
     */
    public record Deal(List<Card> humanHand, List<Card> aiHand, List<Card> starters) {
    }
}
