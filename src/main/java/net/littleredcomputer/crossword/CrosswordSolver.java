// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Fills a crossword by backtracking search, maintaining arc consistency after each
 * choice. Variables are chosen by minimum remaining values (ties broken by degree) and
 * values in least-constraining order. Every choice point snapshots the domains, and a
 * failed choice restores them before the next value is tried.
 *
 * <p>A solver owns its domains and must not be shared between threads; independent
 * puzzles may be solved concurrently on separate instances.
 */
public class CrosswordSolver {
    private static final Logger log = LogManager.getFormatterLogger(CrosswordSolver.class);

    public enum VariableOrder {
        FIRST,
        MRV,
    }

    public enum ValueOrder {
        DOMAIN,
        LCV,
    }

    private final int logCheckSteps = 1000;
    private final Crossword crossword;
    private final Domains domains;
    private final ArcConsistency arcConsistency;
    private VariableOrder variableOrder = VariableOrder.MRV;
    private ValueOrder valueOrder = ValueOrder.LCV;
    private BooleanSupplier cancellation = () -> false;
    private Duration timeLimit;
    private Instant deadline;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();
    private long nodeCount;
    private long lastNodeCount;
    private long inferenceCount;
    private long backtrackCount;

    /**
     * The effect of one choice: the domains as they were before it, and the variables
     * whose values were inferred from it. retract() undoes all of it.
     */
    static final class Choice {
        final Variable variable;
        final Domains.Snapshot before;
        final ImmutableList<Variable> inferred;

        Choice(Variable variable, Domains.Snapshot before, ImmutableList<Variable> inferred) {
            this.variable = variable;
            this.before = before;
            this.inferred = inferred;
        }
    }

    // One level of the search: a variable, the values not yet tried, and the choice in force.
    private static final class Level {
        Level(Variable variable, List<String> values) {
            this.variable = variable;
            this.values = values.iterator();
        }
        final Variable variable;
        final Iterator<String> values;
        Choice choice;
    }

    public CrosswordSolver(Crossword crossword) {
        this.crossword = crossword;
        this.domains = new Domains(crossword);
        this.arcConsistency = new ArcConsistency(crossword, domains);
    }

    public CrosswordSolver setVariableOrder(VariableOrder variableOrder) {
        this.variableOrder = variableOrder;
        return this;
    }

    public CrosswordSolver setValueOrder(ValueOrder valueOrder) {
        this.valueOrder = valueOrder;
        return this;
    }

    public CrosswordSolver setLogInterval(Duration logInterval) {
        this.logInterval = logInterval;
        return this;
    }

    /** Abandon the search with a CancellationException once the flag reads true. */
    public CrosswordSolver setCancellation(BooleanSupplier cancellation) {
        this.cancellation = cancellation;
        return this;
    }

    /** Abandon the search with a CancellationException after this much time in solve(). */
    public CrosswordSolver setTimeLimit(Duration timeLimit) {
        this.timeLimit = timeLimit;
        return this;
    }

    public Crossword crossword() { return crossword; }
    public Domains domains() { return domains; }

    /** @return number of search steps entered */
    public long nodeCount() { return nodeCount; }

    /** @return number of values assigned by inference rather than by choice */
    public long inferenceCount() { return inferenceCount; }

    /** @return number of choices withdrawn after their subtree failed */
    public long backtrackCount() { return backtrackCount; }

    /**
     * Solve the crossword.
     * @return a complete assignment, or empty if the puzzle has none
     * @throws CancellationException if the cancellation flag or time limit fires first;
     * the domains are then as they were before the call, so the solver may be retried
     */
    public Optional<ImmutableMap<Variable, String>> solve() {
        stopwatch.reset().start();
        lastLogTime = Instant.now();
        lastNodeCount = nodeCount;
        deadline = timeLimit != null ? lastLogTime.plus(timeLimit) : null;
        Domains.Snapshot initial = domains.snapshot();
        try {
            enforceNodeConsistency();
            if (!ac3()) {
                log.debug("arc consistency refutes the puzzle before search %s", stopwatch);
                return Optional.empty();
            }
            Optional<ImmutableMap<Variable, String>> result = backtrack(new LinkedHashMap<>());
            log.debug("%s after %d nodes, %d inferences, %d backtracks %s",
                    result.isPresent() ? "solved" : "no solution", nodeCount, inferenceCount, backtrackCount, stopwatch);
            return result;
        } catch (CancellationException e) {
            // An abandoned search leaves the domains of the branch it was in.
            domains.restore(initial);
            throw e;
        } finally {
            stopwatch.stop();
        }
    }

    public void enforceNodeConsistency() {
        domains.enforceNodeConsistency();
    }

    public boolean revise(Variable x, Variable y) {
        return arcConsistency.revise(x, y);
    }

    public boolean ac3() {
        return arcConsistency.ac3();
    }

    public boolean ac3(Collection<Arc> arcs) {
        return arcConsistency.ac3(arcs);
    }

    /**
     * Search for a completion of the given partial assignment, which must be consistent
     * with the current domains. On failure the assignment and domains are left as they
     * were on entry.
     */
    Optional<ImmutableMap<Variable, String>> backtrack(Map<Variable, String> assignment) {
        Deque<Level> levels = new ArrayDeque<>();
        ENTER: while (true) {
            step(levels.size());
            if (complete(assignment)) return Optional.of(ImmutableMap.copyOf(assignment));
            Variable var = selectUnassignedVariable(assignment);
            levels.push(new Level(var, orderDomainValues(var, assignment)));
            while (!levels.isEmpty()) {
                Level top = levels.peek();
                if (top.choice != null) {
                    retract(assignment, top.choice);
                    top.choice = null;
                    ++backtrackCount;
                }
                while (top.values.hasNext()) {
                    Optional<Choice> c = assign(assignment, top.variable, top.values.next());
                    if (c.isPresent()) {
                        top.choice = c.get();
                        continue ENTER;
                    }
                }
                levels.pop();
            }
            return Optional.empty();
        }
    }

    /**
     * Try var = word: check it against the assignment, narrow the domains by arc
     * consistency, and assign every variable left with a single candidate.
     * @return the choice made, or empty (with nothing changed) if the word leads to a
     * contradiction
     */
    Optional<Choice> assign(Map<Variable, String> assignment, Variable var, String word) {
        assignment.put(var, word);
        if (!consistent(assignment)) {
            assignment.remove(var);
            return Optional.empty();
        }
        Domains.Snapshot before = domains.snapshot();
        domains.restrict(var, word);
        List<Arc> arcs = new ArrayList<>();
        for (Variable n : crossword.neighbors(var)) arcs.add(new Arc(n, var));
        if (!arcConsistency.ac3(arcs)) {
            domains.restore(before);
            assignment.remove(var);
            return Optional.empty();
        }
        ImmutableList.Builder<Variable> inferred = ImmutableList.builder();
        for (Variable v : crossword.variables()) {
            if (!assignment.containsKey(v) && domains.size(v) == 1) {
                assignment.put(v, domains.get(v).iterator().next());
                inferred.add(v);
            }
        }
        Choice c = new Choice(var, before, inferred.build());
        inferenceCount += c.inferred.size();
        // Arc consistency says nothing about repeated words, so inferences are checked here.
        if (!c.inferred.isEmpty() && !consistent(assignment)) {
            retract(assignment, c);
            return Optional.empty();
        }
        return Optional.of(c);
    }

    /** Undo a choice: unassign its variable and inferences and restore the domains. */
    void retract(Map<Variable, String> assignment, Choice c) {
        assignment.remove(c.variable);
        c.inferred.forEach(assignment::remove);
        domains.restore(c.before);
    }

    private boolean complete(Map<Variable, String> assignment) {
        for (Variable v : crossword.variables()) {
            if (!assignment.containsKey(v)) return false;
        }
        return true;
    }

    /**
     * @return true iff the assigned words are distinct, fit their variables, and agree
     * wherever two assigned variables cross
     */
    public boolean consistent(Map<Variable, String> assignment) {
        if (new HashSet<>(assignment.values()).size() != assignment.size()) return false;
        for (Map.Entry<Variable, String> e : assignment.entrySet()) {
            Variable v = e.getKey();
            String word = e.getValue();
            if (word.length() != v.length()) return false;
            for (Variable n : crossword.neighbors(v)) {
                String other = assignment.get(n);
                if (other != null && !crossword.overlap(v, n).get().agrees(word, other)) return false;
            }
        }
        return true;
    }

    /**
     * @return an unassigned variable: under MRV, the one with the fewest remaining words,
     * ties going to the one with the most neighbors
     */
    public Variable selectUnassignedVariable(Map<Variable, String> assignment) {
        Variable best = null;
        for (Variable v : crossword.variables()) {
            if (assignment.containsKey(v)) continue;
            if (variableOrder == VariableOrder.FIRST) return v;
            if (best == null) {
                best = v;
                continue;
            }
            int size = domains.size(v), bestSize = domains.size(best);
            if (size < bestSize || size == bestSize
                    && crossword.neighbors(v).size() > crossword.neighbors(best).size()) {
                best = v;
            }
        }
        if (best == null) throw new IllegalArgumentException("every variable is assigned");
        return best;
    }

    /**
     * @return the words of var's domain; under LCV, ordered by how many candidates of the
     * unassigned neighbors each would rule out, fewest first
     */
    public List<String> orderDomainValues(Variable var, Map<Variable, String> assignment) {
        List<String> words = new ArrayList<>(domains.get(var));
        if (valueOrder == ValueOrder.DOMAIN) return words;
        List<Variable> open = new ArrayList<>();
        for (Variable n : crossword.neighbors(var)) {
            if (!assignment.containsKey(n)) open.add(n);
        }
        Map<String, Integer> ruledOut = new HashMap<>();
        for (String w : words) {
            int count = 0;
            for (Variable n : open) {
                Overlap o = crossword.overlap(var, n).get();
                for (String y : domains.get(n)) {
                    if (!o.agrees(w, y)) ++count;
                }
            }
            ruledOut.put(w, count);
        }
        words.sort(Comparator.comparingInt(ruledOut::get));
        return words;
    }

    private void step(int depth) {
        if (cancellation.getAsBoolean() || deadline != null && !Instant.now().isBefore(deadline)) {
            throw new CancellationException(String.format("search abandoned after %d nodes %s", nodeCount, stopwatch));
        }
        ++nodeCount;
        if (nodeCount % logCheckSteps == 0) maybeReportProgress(depth);
    }

    private void maybeReportProgress(int depth) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (nodeCount - lastNodeCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%d nodes %s %.0f/sec depth %d/%d %d backtracks",
                nodeCount, stopwatch, perSec, depth, crossword.variables().size(), backtrackCount));
        lastLogTime = now;
        lastNodeCount = nodeCount;
    }
}
