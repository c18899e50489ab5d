// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ImmutableTable;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The geometry of a crossword: which cells are fillable, the slots they form, and the
 * cells shared between slots. Instances are immutable.
 */
public class Crossword {
    private final static CharMatcher fillable = CharMatcher.is('_');

    private final int height;
    private final int width;
    private final boolean[][] structure;
    private final ImmutableList<Slot> slots;
    private final ImmutableTable<Slot, Slot, Overlap> overlaps;
    private final ImmutableSetMultimap<Slot, Slot> neighbors;

    /**
     * @param structure rectangular grid; true marks a fillable cell
     */
    public Crossword(boolean[][] structure) {
        if (structure.length == 0 || structure[0].length == 0) throw new IllegalArgumentException("empty grid");
        height = structure.length;
        width = structure[0].length;
        this.structure = new boolean[height][];
        for (int i = 0; i < height; ++i) {
            if (structure[i].length != width) throw new IllegalArgumentException("ragged grid at row " + i);
            this.structure[i] = structure[i].clone();
        }
        slots = findSlots();
        ImmutableTable.Builder<Slot, Slot, Overlap> tb = ImmutableTable.builder();
        ImmutableSetMultimap.Builder<Slot, Slot> nb = ImmutableSetMultimap.builder();
        for (int a = 0; a < slots.size(); ++a) {
            for (int b = a + 1; b < slots.size(); ++b) {
                Slot x = slots.get(a);
                Slot y = slots.get(b);
                Overlap o = overlapOf(x, y);
                if (o == null) continue;
                tb.put(x, y, o);
                tb.put(y, x, o.reversed());
                nb.put(x, y);
                nb.put(y, x);
            }
        }
        overlaps = tb.build();
        neighbors = nb.build();
    }

    private boolean open(int i, int j) {
        return i >= 0 && i < height && j >= 0 && j < width && structure[i][j];
    }

    /**
     * Scan cells in row-major order; a slot starts wherever a run of at least two
     * fillable cells begins. Across is considered before down at each cell, so the
     * result is in Slot order.
     */
    private ImmutableList<Slot> findSlots() {
        ImmutableList.Builder<Slot> b = ImmutableList.builder();
        for (int i = 0; i < height; ++i) {
            for (int j = 0; j < width; ++j) {
                if (!structure[i][j]) continue;
                if (!open(i, j - 1)) {
                    int n = 1;
                    while (open(i, j + n)) ++n;
                    if (n > 1) b.add(new Slot(i, j, Slot.Direction.ACROSS, n));
                }
                if (!open(i - 1, j)) {
                    int n = 1;
                    while (open(i + n, j)) ++n;
                    if (n > 1) b.add(new Slot(i, j, Slot.Direction.DOWN, n));
                }
            }
        }
        return b.build();
    }

    private static Overlap overlapOf(Slot x, Slot y) {
        if (x.direction() == y.direction()) return null;
        for (int k = 0; k < x.length(); ++k) {
            int[] c = x.cell(k);
            for (int l = 0; l < y.length(); ++l) {
                int[] d = y.cell(l);
                if (c[0] == d[0] && c[1] == d[1]) return new Overlap(k, l);
            }
        }
        return null;
    }

    public int height() { return height; }
    public int width() { return width; }

    /**
     * @return true if the cell at row i, column j may hold a letter
     */
    public boolean isFillable(int i, int j) { return structure[i][j]; }

    public ImmutableList<Slot> slots() { return slots; }

    /**
     * @return the offsets (i, j) such that x.word[i] must equal y.word[j], or empty when
     * the slots share no cell
     */
    public Optional<Overlap> overlap(Slot x, Slot y) {
        return Optional.ofNullable(overlaps.get(x, y));
    }

    public ImmutableSet<Slot> neighbors(Slot x) { return neighbors.get(x); }

    public static Crossword parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Parses a grid, one row per line: '_' is a fillable cell and any other character
     * is blocked. Trailing blank lines are ignored.
     * @param r source of the grid description
     * @return the crossword it describes
     */
    public static Crossword parseFrom(Reader r) {
        List<String> rows = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(r)) {
            String line;
            while ((line = br.readLine()) != null) rows.add(line);
        } catch (IOException e) {
            throw new IllegalArgumentException("Parse error", e);
        }
        while (!rows.isEmpty() && rows.get(rows.size() - 1).trim().isEmpty()) rows.remove(rows.size() - 1);
        if (rows.isEmpty()) throw new IllegalArgumentException("empty grid");
        boolean[][] g = new boolean[rows.size()][];
        for (int i = 0; i < g.length; ++i) {
            String row = rows.get(i);
            g[i] = new boolean[row.length()];
            for (int j = 0; j < row.length(); ++j) g[i][j] = fillable.matches(row.charAt(j));
        }
        return new Crossword(g);
    }
}
