// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import org.junit.Test;

import java.util.Optional;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static net.littleredcomputer.crossword.Puzzles.*;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertThat;

public class CrosswordTest {

    @Test(expected = IllegalArgumentException.class)
    public void emptyGrid() {
        Crossword.parseFrom("");
    }

    @Test(expected = IllegalArgumentException.class)
    public void blankGrid() {
        Crossword.parseFrom("\n\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void raggedGrid() {
        Crossword.parseFrom("___\n__\n___");
    }

    @Test(expected = IllegalArgumentException.class)
    public void raggedArray() {
        new Crossword(new boolean[][]{{true, true}, {true}});
    }

    @Test
    public void dimensions() {
        assertThat(structure0.height(), is(5));
        assertThat(structure0.width(), is(5));
        assertThat(structure0.isFillable(0, 0), is(false));
        assertThat(structure0.isFillable(0, 1), is(true));
        assertThat(structure0.isFillable(4, 4), is(true));
    }

    @Test
    public void slotsInOrder() {
        assertThat(structure0.slots(), contains(across3, down5, down4, across4));
    }

    @Test
    public void singleCellsAreNotSlots() {
        assertThat(Crossword.parseFrom("_#_\n###\n_#_").slots(), is(empty()));
    }

    @Test
    public void overlaps() {
        assertThat(structure0.overlap(across3, down5), isPresentAndIs(new Overlap(0, 0)));
        assertThat(structure0.overlap(down5, across4), isPresentAndIs(new Overlap(4, 0)));
        assertThat(structure0.overlap(across4, down5), isPresentAndIs(new Overlap(0, 4)));
        assertThat(structure0.overlap(down4, across4), isPresentAndIs(new Overlap(3, 3)));
        assertThat(structure0.overlap(across3, down4), isEmpty());
        assertThat(structure0.overlap(across3, across4), isEmpty());
    }

    @Test
    public void neighbors() {
        assertThat(structure0.neighbors(down5), contains(across3, across4));
        assertThat(structure0.neighbors(across4), contains(down5, down4));
        assertThat(structure0.neighbors(across3), contains(down5));
    }

    @Test
    public void hookOverlapsAtEndOfAcross() {
        Crossword c = Crossword.parseFrom(HOOK);
        assertThat(c.slots(), contains(new Slot(0, 0, Slot.Direction.ACROSS, 3), new Slot(0, 2, Slot.Direction.DOWN, 3)));
        Optional<Overlap> o = c.overlap(across(c), down(c));
        assertThat(o, isPresentAndIs(new Overlap(2, 0)));
    }

    @Test
    public void parsingIsDeterministic() {
        Crossword a = crosswordFromResource("lattice.txt");
        Crossword b = crosswordFromResource("lattice.txt");
        assertThat(a.slots(), is(b.slots()));
        assertThat(a.slots().size(), is(6));
        for (Slot x : a.slots()) {
            assertThat(a.neighbors(x), is(b.neighbors(x)));
            assertThat(a.neighbors(x).size(), is(3));
        }
    }

    @Test
    public void slotCells() {
        assertThat(down4.cells().size(), is(4));
        assertThat(down4.cells().get(3)[0], is(4));
        assertThat(down4.cells().get(3)[1], is(4));
        assertThat(down5.toString(), is("(0, 1) down : 5"));
    }
}
