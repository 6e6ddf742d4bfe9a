package ai.nimmt.game;

import static ai.nimmt.unit.helpers.BoardBuilder.numbers;
import static ai.nimmt.unit.helpers.BoardBuilder.rows;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Row placement, forced takes and no-valid-row takes.
 */
class BoardTest {

    @Test
    void cardGoesAfterTheClosestLowerLastCard() {
        Board board = rows(new int[]{1}, new int[]{10}, new int[]{50}, new int[]{90});

        assertEquals(Placement.row(2), board.placementTarget(Card.of(55)));
        List<Card> taken = board.apply(2, Card.of(55));

        assertTrue(taken.isEmpty());
        assertEquals(List.of(50, 55), numbers(board.rowCards(2)));
    }

    @Test
    void sixthCardForcesTakeOfTheFullRow() {
        Board board = rows(new int[]{1, 3, 5, 7, 9}, new int[]{20}, new int[]{30}, new int[]{40});

        assertEquals(Placement.row(0), board.placementTarget(Card.of(11)));
        List<Card> taken = board.apply(0, Card.of(11));

        assertEquals(List.of(1, 3, 5, 7, 9), numbers(taken));
        assertEquals(6, BullHeadTable.total(taken));
        assertEquals(List.of(11), numbers(board.rowCards(0)));
    }

    @Test
    void cardBelowEveryRowHasNoValidRow() {
        Board board = rows(new int[]{10}, new int[]{20}, new int[]{30}, new int[]{40});
        assertTrue(board.placementTarget(Card.of(4)).isNoValidRow());
        assertTrue(board.placementTarget(Card.of(4)).rowIndex().isEmpty());
    }

    @Test
    void takeEmptiesTheChosenRowWhateverItsLength() {
        Board board = rows(new int[]{10, 12}, new int[]{20}, new int[]{30, 31, 32}, new int[]{40});

        List<Card> taken = board.take(2, Card.of(4));

        assertEquals(List.of(30, 31, 32), numbers(taken));
        assertEquals(List.of(4), numbers(board.rowCards(2)));
        assertEquals(List.of(10, 12), numbers(board.rowCards(0)));
    }

    @Test
    void applyRejectsCardsThatWouldBreakOrdering() {
        Board board = rows(new int[]{10}, new int[]{20}, new int[]{30}, new int[]{40});
        assertThrows(IllegalStateException.class, () -> board.apply(3, Card.of(35)));
        assertEquals(List.of(40), numbers(board.rowCards(3)));
    }

    @Test
    void rowsStayStrictlyAscendingThroughManyPlacements() {
        Board board = rows(new int[]{2}, new int[]{27}, new int[]{53}, new int[]{80});
        int[] plays = {5, 30, 31, 60, 9, 12, 33, 34, 35, 81, 82, 90, 100, 13, 36, 14, 15, 16};
        for (int n : plays) {
            Card card = Card.of(n);
            Placement placement = board.placementTarget(card);
            if (placement.isNoValidRow()) {
                board.take(0, card);
            } else {
                board.apply(placement.rowIndex().getAsInt(), card);
            }
            for (List<Card> row : board.rows()) {
                assertTrue(row.size() >= 1 && row.size() <= Row.MAX_LENGTH, "row length " + row.size());
                for (int i = 1; i < row.size(); i++) {
                    assertTrue(row.get(i - 1).getNumber() < row.get(i).getNumber(), "row " + row);
                }
            }
        }
    }

    @Test
    void copyIsIndependent() {
        Board board = rows(new int[]{10}, new int[]{20}, new int[]{30}, new int[]{40});
        Board copy = board.copy();
        copy.apply(0, Card.of(11));

        assertEquals(List.of(10), numbers(board.rowCards(0)));
        assertEquals(List.of(10, 11), numbers(copy.rowCards(0)));
    }

    @Test
    void rowIndexOutsideBoardIsRejected() {
        Board board = rows(new int[]{10}, new int[]{20}, new int[]{30}, new int[]{40});
        assertThrows(IndexOutOfBoundsException.class, () -> board.take(4, Card.of(1)));
    }

    @Test
    void fewestBullHeadsSelectorPrefersCheapestThenLowestIndex() {
        Board board = rows(new int[]{10}, new int[]{55}, new int[]{41}, new int[]{42});
        assertEquals(2, RowSelector.FEWEST_BULL_HEADS.chooseRow(board, Card.of(3)));
    }
}
