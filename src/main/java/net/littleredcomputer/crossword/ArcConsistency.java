package net.littleredcomputer.crossword;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * The AC-3 algorithm over the binary overlap constraints of a crossword. Domains are
 * narrowed in place.
 */
public class ArcConsistency {
    private static final Logger log = LogManager.getFormatterLogger(ArcConsistency.class);
    private final Crossword crossword;
    private final Domains domains;
    private long revisions;

    public ArcConsistency(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
    }

    /** @return number of calls to revise() that removed at least one word */
    public long revisions() { return revisions; }

    /**
     * Make x arc consistent with y: drop each word of x that no word of y agrees with at
     * their shared cell. Variables that do not cross constrain nothing.
     * @return true iff the domain of x was changed
     */
    public boolean revise(Variable x, Variable y) {
        Optional<Overlap> o = crossword.overlap(x, y);
        if (!o.isPresent()) return false;
        final int i = o.get().first();
        final int j = o.get().second();
        // The letters y can still offer at the shared cell.
        Set<Character> supported = new HashSet<>();
        for (String wy : domains.get(y)) supported.add(wy.charAt(j));
        boolean revised = domains.mutableDomain(x).removeIf(wx -> !supported.contains(wx.charAt(i)));
        if (revised) ++revisions;
        return revised;
    }

    /** Run AC-3 starting from every arc of the crossword. */
    public boolean ac3() {
        Queue<Arc> queue = new ArrayDeque<>();
        for (Variable x : crossword.variables()) {
            for (Variable y : crossword.neighbors(x)) queue.add(new Arc(x, y));
        }
        return propagate(queue);
    }

    /**
     * Run AC-3 starting from the given arcs only.
     * @return false iff some domain was emptied, in which case propagation stops at once
     */
    public boolean ac3(Collection<Arc> arcs) {
        return propagate(new ArrayDeque<>(arcs));
    }

    private boolean propagate(Queue<Arc> queue) {
        while (!queue.isEmpty()) {
            Arc a = queue.remove();
            Variable x = a.x();
            if (!revise(x, a.y())) continue;
            if (domains.size(x) == 0) {
                log.debug("domain of %s emptied by %s: %s", x, a.y(), domains);
                return false;
            }
            // x has lost words, so its other neighbors may have lost their support.
            for (Variable z : crossword.neighbors(x)) {
                if (!z.equals(a.y())) queue.add(new Arc(z, x));
            }
        }
        return true;
    }
}
