package ai.nimmt.game;

import java.util.OptionalInt;

/**
 * Where a played card goes: a specific row, or nowhere because it is lower than every row's
 * last card.
 */
public final class Placement {
    private static final Placement NO_VALID_ROW = new Placement(-1);

    private final int rowIndex;

    private Placement(int rowIndex) {
        this.rowIndex = rowIndex;
    }

    public static Placement row(int rowIndex) {
        if (rowIndex < 0) {
            throw new IllegalArgumentException("rowIndex must be >= 0");
        }
        return new Placement(rowIndex);
    }

    public static Placement noValidRow() {
        return NO_VALID_ROW;
    }

    public boolean isNoValidRow() {
        return rowIndex < 0;
    }

    public OptionalInt rowIndex() {
        return isNoValidRow() ? OptionalInt.empty() : OptionalInt.of(rowIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Placement)) {
            return false;
        }
        return rowIndex == ((Placement) o).rowIndex;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(rowIndex);
    }

    @Override
    public String toString() {
        return isNoValidRow() ? "NoValidRow" : "Row(" + rowIndex + ")";
    }
}
