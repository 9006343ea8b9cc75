package net.littleredcomputer.crossword;

import com.google.common.base.Objects;

/**
 * The cell shared by two crossing variables x and y, given as the index of that cell
 * within x's word and within y's word.
 */
public final class Overlap {
    private final int first;
    private final int second;

    Overlap(int first, int second) {
        this.first = first;
        this.second = second;
    }

    /** @return index of the shared cell in the first variable */
    public int first() { return first; }

    /** @return index of the shared cell in the second variable */
    public int second() { return second; }

    /** @return true if the two words agree on the shared cell */
    public boolean agrees(String x, String y) {
        return x.charAt(first) == y.charAt(second);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Overlap)) return false;
        Overlap that = (Overlap) o;
        return first == that.first && second == that.second;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(first, second);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
