// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static net.littleredcomputer.crossword.TestPuzzles.*;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertThat;

public class CrosswordTest {
    private final Variable a1 = new Variable(0, 0, Variable.Direction.ACROSS, 4);
    private final Variable d1 = new Variable(0, 0, Variable.Direction.DOWN, 3);
    private final Variable d2 = new Variable(0, 2, Variable.Direction.DOWN, 3);
    private final Variable a2 = new Variable(2, 0, Variable.Direction.ACROSS, 4);

    @Test
    public void variablesFromStructure() {
        Crossword c = fromResources("structure0.txt", "words0.txt");
        assertThat(c.height(), is(3));
        assertThat(c.width(), is(4));
        assertThat(c.variables(), contains(a1, d1, d2, a2));
        assertThat(c.isOpen(1, 0), is(true));
        assertThat(c.isOpen(1, 1), is(false));
    }

    @Test
    public void overlapsAreMirrored() {
        Crossword c = fromResources("structure0.txt", "words0.txt");
        assertThat(c.overlap(a1, d2), isPresentAndIs(new Overlap(2, 0)));
        assertThat(c.overlap(d2, a1), isPresentAndIs(new Overlap(0, 2)));
        assertThat(c.overlap(a2, d1), isPresentAndIs(new Overlap(0, 2)));
        assertThat(c.overlap(a1, a2), isEmpty());
        assertThat(c.overlap(d1, d2), isEmpty());
        assertThat(c.neighbors(a1), contains(d1, d2));
        assertThat(c.neighbors(d2), contains(a1, a2));
    }

    @Test
    public void singleCellsAreNotVariables() {
        Crossword c = Crossword.parseFrom("_#_\n###\n_#_\n", "a");
        assertThat(c.variables(), is(empty()));
    }

    @Test
    public void shortRowsArePadded() {
        Crossword c = Crossword.parseFrom("___\n_\n_\n\n", "cat");
        assertThat(c.height(), is(3));
        assertThat(c.variables(), contains(
                new Variable(0, 0, Variable.Direction.ACROSS, 3),
                new Variable(0, 0, Variable.Direction.DOWN, 3)));
        assertThat(c.isOpen(1, 2), is(false));
    }

    @Test
    public void wordsAreNormalized() {
        assertThat(Crossword.parseFrom(CROSS, " cat\n\nDog \ncat\nCAT\n").words(), contains("CAT", "DOG"));
    }

    @Test
    public void fromVariablesMatchesParsedGeometry() {
        Crossword parsed = cross("cat");
        Crossword built = Crossword.fromVariables(Arrays.asList(X1, X2), Collections.singletonList("cat"));
        assertThat(built.variables(), is(parsed.variables()));
        assertThat(built.overlap(X1, X2), is(parsed.overlap(X1, X2)));
        assertThat(built.overlap(X1, X2), isPresentAndIs(new Overlap(1, 0)));
        assertThat(built.render(Collections.emptyMap()), is(parsed.render(Collections.emptyMap())));
    }

    @Test
    public void render() {
        Crossword c = fromResources("structure0.txt", "words0.txt");
        assertThat(c.render(ImmutableMap.of(a1, "CART", d1, "CUT", d2, "RAT", a2, "TOTE")),
                is("CART\nU█A█\nTOTE\n"));
        assertThat(c.render(ImmutableMap.of(a1, "CART")), is("CART\n █ █\n    \n"));
        Character[][] letters = c.letterGrid(ImmutableMap.of(d1, "CUT"));
        assertThat(letters[2][0], is('T'));
        assertThat(letters[0][1] == null, is(true));
    }

    @Test(expected = IllegalArgumentException.class)
    public void renderRejectsMisfit() {
        cross("cat").render(ImmutableMap.of(X1, "CATS"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void variablesShareAtMostOneCell() {
        Crossword.fromVariables(ImmutableList.of(
                new Variable(0, 0, Variable.Direction.ACROSS, 3),
                new Variable(0, 1, Variable.Direction.ACROSS, 3)), ImmutableList.of("cat"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateVariables() {
        Crossword.fromVariables(ImmutableList.of(X1, X2, X1), ImmutableList.of("cat"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void noVariables() {
        Crossword.fromVariables(ImmutableList.of(), ImmutableList.of("cat"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyStructure() {
        Crossword.parseFrom("\n\n", "cat");
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownVariable() {
        cross("cat").neighbors(X3);
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonPositiveLength() {
        new Variable(0, 0, Variable.Direction.DOWN, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeStart() {
        new Variable(-1, 0, Variable.Direction.DOWN, 2);
    }

    @Test
    public void variableIdentity() {
        assertThat(new Variable(0, 1, Variable.Direction.DOWN, 3), is(X2));
        assertThat(new Variable(0, 1, Variable.Direction.DOWN, 3).hashCode(), is(X2.hashCode()));
        assertThat(new Variable(0, 1, Variable.Direction.ACROSS, 3).equals(X2), is(false));
        assertThat(X2.toString(), is("(0, 1) DOWN : 3"));
    }
}
