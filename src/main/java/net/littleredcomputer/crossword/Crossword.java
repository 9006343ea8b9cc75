// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.*;
import java.util.stream.Collectors;

/**
 * The constraint model of a crossword: the grid, its variables, the overlap table
 * and the word list. Instances are immutable.
 */
public class Crossword {
    private static final char OPEN = '_';
    private static final char BLOCKED = '█';

    private static class Slot {
        Slot(Variable v, int index) { this.v = v; this.index = index; }
        final Variable v;
        final int index;
    }

    private final int height;
    private final int width;
    private final boolean[][] structure;  // true iff the cell is open
    private final ImmutableList<Variable> variables;
    private final ImmutableSet<String> words;
    private final ImmutableMap<Variable, ImmutableMap<Variable, Overlap>> overlaps;

    private Crossword(boolean[][] structure, int width, Iterable<Variable> variables, Iterable<String> words) {
        this.height = structure.length;
        this.width = width;
        this.structure = structure;
        this.variables = ImmutableList.copyOf(variables);
        if (ImmutableSet.copyOf(this.variables).size() != this.variables.size()) {
            throw new IllegalArgumentException("duplicate variable in " + this.variables);
        }
        ImmutableSet.Builder<String> wb = ImmutableSet.builder();
        for (String w : words) {
            String t = w.trim();
            if (!t.isEmpty()) wb.add(t.toUpperCase(Locale.ROOT));
        }
        this.words = wb.build();

        // Index every cell by the variables passing through it.
        ListMultimap<Integer, Slot> cells = ArrayListMultimap.create();
        for (Variable v : this.variables) {
            for (int k = 0; k < v.length(); ++k) {
                int i = v.rowOf(k), j = v.columnOf(k);
                if (i >= height || j >= width || !structure[i][j]) {
                    throw new IllegalArgumentException(
                            String.format("variable %s leaves the open cells at %d,%d", v, i, j));
                }
                cells.put(i * width + j, new Slot(v, k));
            }
        }
        Map<Variable, Map<Variable, Overlap>> table = new LinkedHashMap<>();
        for (Variable v : this.variables) table.put(v, new LinkedHashMap<>());
        for (Integer cell : cells.keySet()) {
            List<Slot> here = cells.get(cell);
            for (Slot a : here) {
                for (Slot b : here) {
                    if (a.v.equals(b.v)) continue;
                    Overlap previous = table.get(a.v).put(b.v, new Overlap(a.index, b.index));
                    if (previous != null) {
                        throw new IllegalArgumentException(
                                String.format("variables %s and %s share more than one cell", a.v, b.v));
                    }
                }
            }
        }
        ImmutableMap.Builder<Variable, ImmutableMap<Variable, Overlap>> ob = ImmutableMap.builder();
        // Neighbors are kept in model order so that iteration is independent of hashing.
        for (Variable v : this.variables) {
            Map<Variable, Overlap> row = table.get(v);
            ImmutableMap.Builder<Variable, Overlap> rb = ImmutableMap.builder();
            for (Variable u : this.variables) {
                if (row.containsKey(u)) rb.put(u, row.get(u));
            }
            ob.put(v, rb.build());
        }
        this.overlaps = ob.build();
    }

    public int height() { return height; }
    public int width() { return width; }

    /** @return true iff the cell at (i, j) may hold a letter */
    public boolean isOpen(int i, int j) { return structure[i][j]; }

    public ImmutableList<Variable> variables() { return variables; }

    /** @return the full word list, the universal domain of every variable */
    public ImmutableSet<String> words() { return words; }

    /** @return the variables sharing a cell with v */
    public ImmutableSet<Variable> neighbors(Variable v) {
        return overlapsOf(v).keySet();
    }

    /**
     * @return the indices at which the words of v1 and v2 must agree, or empty if the two
     * variables do not cross
     */
    public Optional<Overlap> overlap(Variable v1, Variable v2) {
        return Optional.ofNullable(overlapsOf(v1).get(v2));
    }

    private ImmutableMap<Variable, Overlap> overlapsOf(Variable v) {
        ImmutableMap<Variable, Overlap> o = overlaps.get(v);
        if (o == null) throw new IllegalArgumentException("unknown variable: " + v);
        return o;
    }

    /**
     * @return the letters placed by the assignment, indexed by row and column; cells not
     * covered by an assigned variable are null
     */
    public Character[][] letterGrid(Map<Variable, String> assignment) {
        Character[][] letters = new Character[height][width];
        assignment.forEach((v, word) -> {
            if (!overlaps.containsKey(v)) throw new IllegalArgumentException("unknown variable: " + v);
            if (word.length() != v.length()) throw new IllegalArgumentException(
                    String.format("word %s does not fit %s", word, v));
            for (int k = 0; k < word.length(); ++k) letters[v.rowOf(k)][v.columnOf(k)] = word.charAt(k);
        });
        return letters;
    }

    /** @return the grid as text, blocked cells drawn as solid blocks */
    public String render(Map<Variable, String> assignment) {
        Character[][] letters = letterGrid(assignment);
        StringBuilder s = new StringBuilder();
        for (int i = 0; i < height; ++i) {
            for (int j = 0; j < width; ++j) {
                if (!structure[i][j]) s.append(BLOCKED);
                else s.append(letters[i][j] != null ? letters[i][j] : ' ');
            }
            s.append('\n');
        }
        return s.toString();
    }

    /**
     * Build a model directly from variable geometry. The grid is the bounding box of the
     * variables; the cells they cover are open and all others blocked.
     */
    public static Crossword fromVariables(Iterable<Variable> variables, Iterable<String> words) {
        int h = 0, w = 0;
        for (Variable v : variables) {
            h = Math.max(h, v.rowOf(v.length() - 1) + 1);
            w = Math.max(w, v.columnOf(v.length() - 1) + 1);
        }
        if (h == 0) throw new IllegalArgumentException("there must be at least one variable");
        boolean[][] structure = new boolean[h][w];
        for (Variable v : variables) {
            for (int k = 0; k < v.length(); ++k) structure[v.rowOf(k)][v.columnOf(k)] = true;
        }
        return new Crossword(structure, w, variables, words);
    }

    public static Crossword parseFrom(String structure, String words) {
        return parseFrom(new StringReader(structure), new StringReader(words));
    }

    /**
     * Parse a grid layout and a word list. In the layout each line is one row of the grid;
     * '_' marks an open cell and any other character a blocked one. Rows shorter than the
     * longest are padded with blocked cells. The word list has one word per line.
     * @param structure textual grid layout
     * @param words word list
     * @return the constraint model, with one variable per run of two or more open cells
     */
    public static Crossword parseFrom(Reader structure, Reader words) {
        List<String> rows = new BufferedReader(structure).lines().collect(Collectors.toList());
        while (!rows.isEmpty() && rows.get(rows.size() - 1).trim().isEmpty()) rows.remove(rows.size() - 1);
        if (rows.isEmpty()) throw new IllegalArgumentException("empty structure");
        final int w = rows.stream().mapToInt(String::length).max().orElse(0);
        boolean[][] open = new boolean[rows.size()][w];
        for (int i = 0; i < rows.size(); ++i) {
            String row = rows.get(i);
            for (int j = 0; j < row.length(); ++j) open[i][j] = row.charAt(j) == OPEN;
        }
        List<Variable> vs = new ArrayList<>();
        for (int i = 0; i < open.length; ++i) {
            for (int j = 0; j < w; ++j) {
                if (!open[i][j]) continue;
                if (j == 0 || !open[i][j-1]) {
                    int len = 1;
                    while (j + len < w && open[i][j+len]) ++len;
                    if (len > 1) vs.add(new Variable(i, j, Variable.Direction.ACROSS, len));
                }
                if (i == 0 || !open[i-1][j]) {
                    int len = 1;
                    while (i + len < open.length && open[i+len][j]) ++len;
                    if (len > 1) vs.add(new Variable(i, j, Variable.Direction.DOWN, len));
                }
            }
        }
        return new Crossword(open, w, vs, new BufferedReader(words).lines().collect(Collectors.toList()));
    }
}
