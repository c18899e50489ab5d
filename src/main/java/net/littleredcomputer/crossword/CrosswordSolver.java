// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Backtracking search for a crossword fill. Each solve() begins with node consistency and
 * a full AC-3 pass, then searches depth first, choosing slots by minimum remaining values
 * (ties to the higher degree) and trying words least-constraining first. Arc consistency
 * is re-established after every tentative assignment.
 */
public class CrosswordSolver {
    private static final Logger log = LogManager.getFormatterLogger(CrosswordSolver.class);

    /**
     * How much of the puzzle AC-3 revisits after a slot is assigned.
     */
    public enum Propagation {
        LOCAL,  // only arcs into the assigned slot, and what follows from them
        FULL,   // every arc in the puzzle
    }

    private final Crossword crossword;
    private final Vocabulary vocabulary;
    private Propagation propagation = Propagation.LOCAL;
    private Domains domains;
    private ArcConsistency arcs;

    final int logCheckSteps = 1000;
    private long stepCount;
    private long nodeCount;
    private long lastStepCount;
    private int depth;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public CrosswordSolver(Crossword crossword, Vocabulary vocabulary) {
        this.crossword = crossword;
        this.vocabulary = vocabulary;
        resetDomains();
    }

    public CrosswordSolver setPropagation(Propagation propagation) {
        this.propagation = propagation;
        return this;
    }

    public CrosswordSolver setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    public Crossword crossword() { return crossword; }

    /**
     * @return the domains of the most recent (or current) solve
     */
    public Domains domains() { return domains; }

    /**
     * @return the number of tentative assignments made by the most recent solve
     */
    public long nodeCount() { return nodeCount; }

    private void resetDomains() {
        domains = Domains.of(crossword, vocabulary);
        arcs = new ArcConsistency(crossword, domains);
    }

    /**
     * One level of the search: the slot being filled, the words to try for it in order, and
     * the domains as they were before any of those words was tried.
     */
    private static class Frame {
        final Slot slot;
        final List<String> values;
        final Domains snapshot;
        int next = 0;

        Frame(Slot slot, List<String> values, Domains snapshot) {
            this.slot = slot;
            this.values = values;
            this.snapshot = snapshot;
        }

        boolean exhausted() { return next >= values.size(); }
    }

    /**
     * @return a complete, consistent assignment, or empty if the puzzle has none
     */
    public Optional<Assignment> solve() {
        resetDomains();
        stepCount = nodeCount = lastStepCount = 0;
        depth = 0;
        stopwatch.reset().start();
        lastLogTime = Instant.now();
        log.info("solving %d slots with %d words", crossword.slots().size(), vocabulary.size());

        arcs.enforceNodeConsistency();
        if (!arcs.ac3() || domains.anyEmpty()) {
            stopwatch.stop();
            log.info("initial arc consistency left an empty domain; no solution");
            return Optional.empty();
        }
        Optional<Assignment> result = backtrack(new Assignment());
        stopwatch.stop();
        log.info("%s after %d nodes, %d revisions %s", result.isPresent() ? "solved" : "no solution",
                nodeCount, arcs.revisions(), stopwatch);
        return result;
    }

    /**
     * Depth-first search from the given partial assignment, on the solver's current
     * domains. The steps are: 2, enter a level (done if complete, otherwise choose a slot);
     * 3, try the next word for the slot; 4, undo the word; 5, leave the level.
     * @return a completion of the assignment, or empty if none exists
     */
    Optional<Assignment> backtrack(Assignment assignment) {
        final Deque<Frame> stack = new ArrayDeque<>();
        Frame f = null;
        int step = 2;
        while (true) {
            ++stepCount;
            if (stepCount % logCheckSteps == 0) maybeReportProgress(assignment);
            switch (step) {
                case 2: {  // Enter level.
                    if (assignment.isComplete(crossword)) return Optional.of(new Assignment(assignment.asMap()));
                    Slot s = selectUnassignedVariable(assignment);
                    f = new Frame(s, orderDomainValues(s, assignment), domains.copy());
                    stack.push(f);
                    depth = stack.size();
                }
                case 3: {  // Try the next word.
                    if (f.exhausted()) {
                        step = 5;
                        continue;
                    }
                    String word = f.values.get(f.next++);
                    ++nodeCount;
                    assignment.put(f.slot, word);
                    domains.restrict(f.slot, word);
                    if (propagate(f.slot) && consistent(assignment)) {
                        if (log.isDebugEnabled()) log.debug("%s %s at depth %d", f.slot, word, stack.size());
                        step = 2;
                        continue;
                    }
                }
                case 4:  // Undo the word.
                    assignment.remove(f.slot);
                    domains.restore(f.snapshot);
                    step = 3;
                    continue;
                case 5:  // Leave level.
                    stack.pop();
                    depth = stack.size();
                    if (stack.isEmpty()) return Optional.empty();
                    f = stack.peek();
                    step = 4;
            }
        }
    }

    private boolean propagate(Slot s) {
        switch (propagation) {
            case FULL:
                return arcs.ac3();
            case LOCAL:
            default:
                return arcs.ac3(arcs.arcsInto(s));
        }
    }

    /**
     * Choose the unassigned slot with the fewest remaining words; break ties by the most
     * neighbors, then by slot order.
     */
    public Slot selectUnassignedVariable(Assignment assignment) {
        return crossword.slots().stream()
                .filter(s -> !assignment.contains(s))
                .min(Comparator.<Slot>comparingInt(domains::size)
                        .thenComparing(Comparator.<Slot>comparingInt(s -> crossword.neighbors(s).size()).reversed())
                        .thenComparing(Comparator.naturalOrder()))
                .orElseThrow(() -> new IllegalStateException("assignment is already complete"));
    }

    /**
     * Order the domain of a slot so that the word ruling out the fewest choices for the
     * unassigned neighbors comes first. Equal counts keep alphabetical order.
     */
    public List<String> orderDomainValues(Slot slot, Assignment assignment) {
        final TObjectIntMap<String> conflicts = new TObjectIntHashMap<>();
        for (String w : domains.get(slot)) {
            int n = 0;
            for (Slot z : crossword.neighbors(slot)) {
                if (assignment.contains(z)) continue;
                Overlap o = crossword.overlap(slot, z).get();
                for (String v : domains.get(z)) {
                    if (!o.agrees(w, v)) ++n;
                }
            }
            conflicts.put(w, n);
        }
        List<String> values = new ArrayList<>(domains.get(slot));
        values.sort(Comparator.comparingInt(conflicts::get));
        return values;
    }

    /**
     * @return true if the assignment uses no word twice, gives every slot a word of its
     * length, and agrees at every cell shared by two assigned slots
     */
    public boolean consistent(Assignment assignment) {
        Set<String> seen = new HashSet<>();
        for (Map.Entry<Slot, String> e : assignment.asMap().entrySet()) {
            if (!seen.add(e.getValue())) return false;
            if (e.getValue().length() != e.getKey().length()) return false;
        }
        for (Map.Entry<Slot, String> e : assignment.asMap().entrySet()) {
            Slot x = e.getKey();
            for (Slot y : crossword.neighbors(x)) {
                if (!assignment.contains(y)) continue;
                if (!crossword.overlap(x, y).get().agrees(e.getValue(), assignment.get(y))) return false;
            }
        }
        return true;
    }

    private void maybeReportProgress(Assignment assignment) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%d nodes %d steps %s %.0f steps/sec depth %d/%d %s",
                nodeCount, stepCount, stopwatch, perSec, depth, crossword.slots().size(),
                assignment.words()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }
}
