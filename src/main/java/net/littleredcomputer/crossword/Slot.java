// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;

import java.util.Objects;

/**
 * A maximal run of fillable cells in one direction: the variable of the crossword CSP.
 * Slots order by starting row, then column, then direction (across first), then length.
 */
public final class Slot implements Comparable<Slot> {
    public enum Direction {
        ACROSS,
        DOWN,
    }

    private final int row;
    private final int column;
    private final Direction direction;
    private final int length;

    Slot(int row, int column, Direction direction, int length) {
        if (length < 1) throw new IllegalArgumentException("slot length must be positive: " + length);
        this.row = row;
        this.column = column;
        this.direction = direction;
        this.length = length;
    }

    public int row() { return row; }
    public int column() { return column; }
    public Direction direction() { return direction; }
    public int length() { return length; }

    /**
     * @return the (row, column) pairs covered by this slot, in word order
     */
    public ImmutableList<int[]> cells() {
        ImmutableList.Builder<int[]> b = ImmutableList.builder();
        for (int k = 0; k < length; ++k) b.add(cell(k));
        return b.build();
    }

    /**
     * @param k offset within the word [0..length)
     * @return the grid cell holding letter k of this slot's word
     */
    int[] cell(int k) {
        return direction == Direction.ACROSS ? new int[]{row, column + k} : new int[]{row + k, column};
    }

    @Override
    public int compareTo(Slot o) {
        return ComparisonChain.start()
                .compare(row, o.row)
                .compare(column, o.column)
                .compare(direction, o.direction)
                .compare(length, o.length)
                .result();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Slot)) return false;
        Slot s = (Slot) o;
        return row == s.row && column == s.column && direction == s.direction && length == s.length;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column, direction, length);
    }

    @Override
    public String toString() {
        return String.format("(%d, %d) %s : %d", row, column, direction.name().toLowerCase(), length);
    }
}
