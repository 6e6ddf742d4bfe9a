package ai.nimmt.game;

import java.util.List;

/**
 * Handles formatting of the table for console display.
 * <p>
 * Renders the four rows (numbered 1–4 for players), each card as {@code number*bullHeads},
 * an empty slot for each free place before the forced take, and the row's bull-head total.
 * Hands and scores are appended by {@link #formatTable}.
 */
public class BoardFormatter {
    /** Width of one card cell; fits {@code "104*1"}. */
    private static final int CELL_WIDTH = 6;

    private final Board board;

    /**
     * @param board the board to format; must not be null
     */
    public BoardFormatter(Board board) {
        this.board = board;
    }

    /**
     * Renders the rows as a multi-line string.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        String border = "-".repeat(8 + (Row.MAX_LENGTH + 1) * CELL_WIDTH + 12);
        sb.append(border).append('\n');
        List<List<Card>> rows = board.rows();
        for (int i = 0; i < rows.size(); i++) {
            sb.append("Row ").append(i + 1).append(" | ");
            List<Card> row = rows.get(i);
            for (int slot = 0; slot <= Row.MAX_LENGTH; slot++) {
                String cell;
                if (slot < row.size()) {
                    cell = row.get(slot).shortName();
                } else if (slot == Row.MAX_LENGTH) {
                    cell = "!";
                } else {
                    cell = ".";
                }
                sb.append(pad(cell));
            }
            sb.append("| ").append(board.rowBullHeads(i)).append(" bh\n");
        }
        sb.append(border).append('\n');
        return sb.toString();
    }

    /**
     * Renders the rows followed by the human's hand, the AI's hand size and both scores.
     */
    public String formatTable(Hand humanHand, int aiHandSize, int humanScore, int aiScore) {
        StringBuilder sb = new StringBuilder(format());
        sb.append("Your hand: ");
        for (Card card : humanHand.cards()) {
            sb.append(card.shortName()).append(' ');
        }
        sb.append('\n');
        sb.append("AI holds ").append(aiHandSize).append(" cards\n");
        sb.append("Score  you: ").append(humanScore).append("  ai: ").append(aiScore).append('\n');
        return sb.toString();
    }

    private static String pad(String cell) {
        if (cell.length() >= CELL_WIDTH) {
            return cell;
        }
        return cell + " ".repeat(CELL_WIDTH - cell.length());
    }
}
