package ai.nimmt.game;

/**
 * Picks the row to take when a played card is lower than every row's last card.
 */
@FunctionalInterface
public interface RowSelector {

    /**
     * Takes the row with the fewest bull heads; the lowest index wins ties.
     */
    RowSelector FEWEST_BULL_HEADS = (board, card) -> {
        int best = 0;
        for (int i = 1; i < Board.ROW_COUNT; i++) {
            if (board.rowBullHeads(i) < board.rowBullHeads(best)) {
                best = i;
            }
        }
        return best;
    };

    /**
     * @param board the board as it stands when the card is resolved
     * @param card the card that fits no row
     * @return the 0-based row to take
     */
    int chooseRow(Board board, Card card);
}
