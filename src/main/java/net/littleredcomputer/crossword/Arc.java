package net.littleredcomputer.crossword;

import com.google.common.base.Objects;

/** The directed constraint "every word of x has a support in y". */
public final class Arc {
    private final Variable x;
    private final Variable y;

    public Arc(Variable x, Variable y) {
        this.x = x;
        this.y = y;
    }

    public Variable x() { return x; }
    public Variable y() { return y; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Arc)) return false;
        Arc a = (Arc) o;
        return x.equals(a.x) && y.equals(a.y);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(x, y);
    }

    @Override
    public String toString() {
        return x + " -> " + y;
    }
}
