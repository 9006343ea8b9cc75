package net.littleredcomputer.crossword;

import com.google.common.base.Objects;

/**
 * A fill-in slot of the crossword: a run of open cells starting at (row, column) and
 * extending to the right (ACROSS) or downward (DOWN).
 */
public final class Variable {
    public enum Direction {
        ACROSS,
        DOWN,
    }

    private final int row;
    private final int column;
    private final Direction direction;
    private final int length;

    public Variable(int row, int column, Direction direction, int length) {
        if (row < 0 || column < 0) throw new IllegalArgumentException(
                String.format("negative start cell %d,%d", row, column));
        if (length < 1) throw new IllegalArgumentException("length must be positive: " + length);
        if (direction == null) throw new IllegalArgumentException("direction is required");
        this.row = row;
        this.column = column;
        this.direction = direction;
        this.length = length;
    }

    public int row() { return row; }
    public int column() { return column; }
    public Direction direction() { return direction; }
    public int length() { return length; }

    /** @return row of the k-th cell of this variable */
    int rowOf(int k) { return direction == Direction.DOWN ? row + k : row; }

    /** @return column of the k-th cell of this variable */
    int columnOf(int k) { return direction == Direction.ACROSS ? column + k : column; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable)) return false;
        Variable v = (Variable) o;
        return row == v.row && column == v.column && length == v.length && direction == v.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(row, column, direction, length);
    }

    @Override
    public String toString() {
        return String.format("(%d, %d) %s : %d", row, column, direction, length);
    }
}
