package ai.nimmt.game;

import java.util.Collection;

/**
 * Maps card numbers to their bull-head penalty.
 * <p>
 * Rules are evaluated in priority order and the first match wins:
 * <ol>
 *   <li>55 is worth 7</li>
 *   <li>multiples of 11 are worth 5</li>
 *   <li>multiples of 10 are worth 3</li>
 *   <li>multiples of 5 are worth 2</li>
 *   <li>everything else is worth 1</li>
 * </ol>
 * 55 must be checked before the multiple-of-11 and multiple-of-5 rules, and multiples of
 * 10 before the multiple-of-5 rule.
 */
public final class BullHeadTable {
    private BullHeadTable() {
    }

    /**
     * Returns the bull-head penalty for the given card number.
     *
     * @param number the card number (1–104)
     * @return the penalty points
     * @throws IllegalArgumentException if the number is outside 1–104
     */
    public static int bullHeads(int number) {
        if (number < Card.MIN_NUMBER || number > Card.MAX_NUMBER) {
            throw new IllegalArgumentException("Card number out of range: " + number);
        }
        if (number == 55) {
            return 7;
        }
        if (number % 11 == 0) {
            return 5;
        }
        if (number % 10 == 0) {
            return 3;
        }
        if (number % 5 == 0) {
            return 2;
        }
        return 1;
    }

    /**
     * Sums the penalty of a collection of cards.
     *
     * @param cards the cards to total; may be empty
     * @return the total bull heads
     */
    public static int total(Collection<Card> cards) {
        int sum = 0;
        for (Card card : cards) {
            sum += card.getBullHeads();
        }
        return sum;
    }
}
