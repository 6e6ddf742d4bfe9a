package ai.nimmt.game;

/**
 * Represents a single numbered 6 Nimmt card.
 * <p>
 * Each card is immutable and uniquely identified by its number (1–104). The bull-head
 * penalty carried by the card is derived from the number via {@link BullHeadTable} and
 * cached at construction. Cards are ordered by number, which is the only ordering the
 * rules ever use (row placement and turn resolution).
 */
public final class Card implements Comparable<Card> {
    /** Lowest card number in the deck. */
    public static final int MIN_NUMBER = 1;
    /** Highest card number in the deck. */
    public static final int MAX_NUMBER = 104;

    /** The face value of this card (1–104). */
    private final int number;
    /** Penalty points carried by this card. */
    private final int bullHeads;

    /**
     * Constructs a Card with the given number.
     *
     * @param number the face value (1–104)
     * @throws IllegalArgumentException if the number is outside 1–104
     */
    public Card(int number) {
        this.bullHeads = BullHeadTable.bullHeads(number);
        this.number = number;
    }

    /**
     * Convenience factory, equivalent to {@code new Card(number)}.
     *
     * @param number the face value (1–104)
     * @return the card
     */
    public static Card of(int number) {
        return new Card(number);
    }

    /**
     * Returns the face value of this card.
     *
     * @return the card number (1–104)
     */
    public int getNumber() {
        return number;
    }

    /**
     * Returns the bull-head penalty of this card.
     *
     * @return the penalty points (1, 2, 3, 5 or 7)
     */
    public int getBullHeads() {
        return bullHeads;
    }

    /**
     * Returns a short name for console display, e.g. {@code "55*7"} for card 55 worth 7 bull heads.
     *
     * @return the short name of the card
     */
    public String shortName() {
        return number + "*" + bullHeads;
    }

    @Override
    public int compareTo(Card other) {
        return Integer.compare(number, other.number);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return number == card.number;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(number);
    }

    @Override
    public String toString() {
        return Integer.toString(number);
    }
}
