// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Node and arc consistency (AC-3) over the domains of a crossword. Pruning happens in
 * place on the supplied Domains.
 */
public class ArcConsistency {
    private static final Logger log = LogManager.getFormatterLogger(ArcConsistency.class);
    private final Crossword crossword;
    private final Domains domains;
    private long revisions = 0;

    /**
     * A directed arc: x is to be made consistent with y.
     */
    public static final class Arc {
        final Slot x;
        final Slot y;

        public Arc(Slot x, Slot y) {
            this.x = x;
            this.y = y;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Arc)) return false;
            Arc a = (Arc) o;
            return x.equals(a.x) && y.equals(a.y);
        }

        @Override
        public int hashCode() { return Objects.hash(x, y); }

        @Override
        public String toString() { return x + " -> " + y; }
    }

    public ArcConsistency(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
    }

    /**
     * @return number of calls to revise which removed at least one word
     */
    public long revisions() { return revisions; }

    /**
     * Remove from each slot's domain the words whose length differs from the slot's.
     */
    public void enforceNodeConsistency() {
        for (Slot s : crossword.slots()) {
            domains.removeIf(s, w -> w.length() != s.length());
        }
    }

    /**
     * Make x arc consistent with y: drop every word of x's domain which no word of y's
     * domain agrees with at the shared cell. The domain of y is untouched.
     * @return true if x's domain changed; false also when x and y do not overlap
     */
    public boolean revise(Slot x, Slot y) {
        Optional<Overlap> o = crossword.overlap(x, y);
        if (!o.isPresent()) return false;
        final Overlap overlap = o.get();
        // Letters y can supply at the shared cell.
        final Set<Character> supported = domains.get(y).stream()
                .map(w -> w.charAt(overlap.second))
                .collect(Collectors.toSet());
        boolean revised = domains.removeIf(x, w -> !supported.contains(w.charAt(overlap.first)));
        if (revised) ++revisions;
        return revised;
    }

    /**
     * @return every directed arc between neighboring slots, in slot order
     */
    public List<Arc> allArcs() {
        return crossword.slots().stream()
                .flatMap(x -> crossword.neighbors(x).stream().map(y -> new Arc(x, y)))
                .collect(Collectors.toList());
    }

    /**
     * @return the arcs (z, x) for each neighbor z of x
     */
    public List<Arc> arcsInto(Slot x) {
        return crossword.neighbors(x).stream().map(z -> new Arc(z, x)).collect(Collectors.toList());
    }

    public boolean ac3() {
        return ac3(allArcs());
    }

    /**
     * Propagate arc consistency starting from the given arcs.
     * @param arcs initial contents of the work queue
     * @return false if some domain was emptied, in which case the puzzle cannot be completed
     * from the current domains; true otherwise
     */
    public boolean ac3(Collection<Arc> arcs) {
        Deque<Arc> queue = new ArrayDeque<>(arcs);
        while (!queue.isEmpty()) {
            Arc a = queue.removeFirst();
            if (!revise(a.x, a.y)) continue;
            if (domains.isEmpty(a.x)) {
                log.debug("domain of %s emptied by %s", a.x, a.y);
                return false;
            }
            for (Slot z : crossword.neighbors(a.x)) {
                if (!z.equals(a.y)) queue.addLast(new Arc(z, a.x));
            }
        }
        return true;
    }
}
