package net.littleredcomputer.crossword;

/**
 * The shared cell of two slots x and y, as offsets into their words: x.word[first] must
 * equal y.word[second].
 */
public final class Overlap {
    final int first;
    final int second;

    Overlap(int first, int second) {
        this.first = first;
        this.second = second;
    }

    public int first() { return first; }
    public int second() { return second; }

    Overlap reversed() { return new Overlap(second, first); }

    /**
     * @return true if the two words agree at the shared cell
     */
    boolean agrees(String x, String y) {
        return x.charAt(first) == y.charAt(second);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Overlap)) return false;
        Overlap v = (Overlap) o;
        return first == v.first && second == v.second;
    }

    @Override
    public int hashCode() { return 31 * first + second; }

    @Override
    public String toString() { return "(" + first + ", " + second + ")"; }
}
