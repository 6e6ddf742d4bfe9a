package ai.nimmt.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The four rows on the table and the placement rules that extend them.
 * <p>
 * <strong>Placement:</strong> a row is a candidate for a played card when its last card is
 * strictly lower than the played card. Of the candidates, the row whose last card is the
 * highest (closest below the played card) receives it. If no row is a candidate the player
 * must take a row of their choosing instead, see {@link #take(int, Card)}.
 * <p>
 * <strong>Forced take:</strong> a card that would become the sixth card of a row first
 * clears the five cards already there; the player collects them and the played card starts
 * the row again.
 * <p>
 * Row indices are 0-based. Every row holds at least one card while a deal is in progress.
 */
public class Board {
    /** Number of rows on the table. */
    public static final int ROW_COUNT = 4;

    private final List<Row> rows = new ArrayList<>();

    /**
     * Constructs a board with one starter card per row.
     *
     * @param starters exactly {@link #ROW_COUNT} cards, in row order
     */
    public Board(List<Card> starters) {
        Objects.requireNonNull(starters, "starters");
        if (starters.size() != ROW_COUNT) {
            throw new IllegalArgumentException("Expected " + ROW_COUNT + " starter cards, got " + starters.size());
        }
        for (Card starter : starters) {
            rows.add(new Row(List.of(starter)));
        }
    }

    private Board() {
    }

    /**
     * Constructs a board from explicit row contents; every list must be strictly ascending
     * and hold 1 to 5 cards.
     *
     * @param rowCards {@link #ROW_COUNT} lists of cards
     * @return the board
     */
    public static Board ofRows(List<List<Card>> rowCards) {
        if (rowCards.size() != ROW_COUNT) {
            throw new IllegalArgumentException("Expected " + ROW_COUNT + " rows, got " + rowCards.size());
        }
        Board board = new Board();
        for (List<Card> cards : rowCards) {
            if (cards.isEmpty()) {
                throw new IllegalArgumentException("Rows must hold at least one card");
            }
            board.rows.add(new Row(cards));
        }
        return board;
    }

    /**
     * Creates a deep copy; rows are independent of this board.
     */
    public Board copy() {
        Board clone = new Board();
        for (Row row : rows) {
            clone.rows.add(row.copy());
        }
        return clone;
    }

    /**
     * Finds the row a card would be laid on.
     *
     * @param card the played card
     * @return the target row, or {@link Placement#noValidRow()} when the card is lower than every row's last card
     */
    public Placement placementTarget(Card card) {
        int best = -1;
        int bestLast = 0;
        for (int i = 0; i < rows.size(); i++) {
            int last = rows.get(i).last().getNumber();
            if (last < card.getNumber() && last > bestLast) {
                best = i;
                bestLast = last;
            }
        }
        return best < 0 ? Placement.noValidRow() : Placement.row(best);
    }

    /**
     * Lays a card on the given row.
     * <p>
     * If the row already holds five cards they are removed and returned, and the row restarts
     * with the played card. Otherwise the card is appended and nothing is returned.
     *
     * @param rowIndex the target row, normally taken from {@link #placementTarget(Card)}
     * @param card the played card
     * @return the cards taken by the player; empty when no take happened
     * @throws IllegalStateException if the card is not higher than the row's last card
     */
    public List<Card> apply(int rowIndex, Card card) {
        Row row = row(rowIndex);
        if (card.getNumber() <= row.last().getNumber()) {
            throw new IllegalStateException("Card " + card + " cannot follow " + row.last() + " in row " + rowIndex);
        }
        if (row.isFull()) {
            return row.resetTo(card);
        }
        row.append(card);
        return Collections.emptyList();
    }

    /**
     * Takes a whole row because the played card fits nowhere; the card starts the row again.
     *
     * @param rowIndex the row the player chose
     * @param card the played card
     * @return every card the row held
     */
    public List<Card> take(int rowIndex, Card card) {
        return row(rowIndex).resetTo(card);
    }

    /**
     * Returns an unmodifiable view of the row at {@code rowIndex}.
     */
    public List<Card> rowCards(int rowIndex) {
        return row(rowIndex).cards();
    }

    /**
     * Returns unmodifiable views of every row, in row order.
     */
    public List<List<Card>> rows() {
        List<List<Card>> view = new ArrayList<>();
        for (Row row : rows) {
            view.add(row.cards());
        }
        return Collections.unmodifiableList(view);
    }

    public int rowBullHeads(int rowIndex) {
        return row(rowIndex).bullHeads();
    }

    /**
     * Counts every card on the board.
     */
    public int cardCount() {
        int count = 0;
        for (Row row : rows) {
            count += row.size();
        }
        return count;
    }

    public static boolean isValidRowIndex(int rowIndex) {
        return rowIndex >= 0 && rowIndex < ROW_COUNT;
    }

    private Row row(int rowIndex) {
        if (!isValidRowIndex(rowIndex)) {
            throw new IndexOutOfBoundsException("Row index " + rowIndex + " outside 0.." + (ROW_COUNT - 1));
        }
        return rows.get(rowIndex);
    }

    @Override
    public String toString() {
        return rows.toString();
    }
}
