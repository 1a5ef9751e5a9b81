// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import gnu.trove.list.array.TIntArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Fills a crossword by treating it as a constraint satisfaction problem: the slots are the
 * variables, their domains are the dictionary words of the right length, neighboring slots
 * must agree on the letter they share, and no word may be used twice.
 * <p>
 * The search is depth-first backtracking with minimum-remaining-values/degree variable
 * ordering, least-constraining-value ordering, and arc consistency (AC-3) re-established
 * after every tentative assignment. Domain removals are recorded on a trail so that each
 * branch can be undone exactly.
 */
public class CrosswordSolver {
    private static final Logger log = LogManager.getFormatterLogger(CrosswordSolver.class);
    private static final int logCheckSteps = 1000;

    public enum Outcome {
        NOT_STARTED,
        SOLVED,
        EMPTY_DOMAIN,   // some slot had no word of its length before search began
        EXHAUSTED,      // the whole search space was explored without success
        LIMIT_REACHED,  // the step or time limit stopped the search
    }

    private final Crossword crossword;
    private final ImmutableList<Slot> slots;
    private final ImmutableList<String> words;
    private final int n;
    private final int[] assigned;   // slot -> word number, or -1
    private final boolean[] used;   // word number -> in the current assignment?
    private final boolean[] queued; // arc number -> in the AC-3 worklist?
    private final BitSet support = new BitSet();
    private Domains domains;
    private int nAssigned;

    private Outcome outcome = Outcome.NOT_STARTED;
    private long stepCount;
    private long lastStepCount;
    private long stepLimit = 0;
    private Duration timeLimit = null;
    private boolean limitReached;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    /**
     * @param crossword the grid to fill
     * @param words the dictionary. Repeated entries are considered once; no case or
     *              whitespace normalization is done here.
     */
    public CrosswordSolver(Crossword crossword, Collection<String> words) {
        this.crossword = crossword;
        this.slots = crossword.slots();
        this.words = ImmutableSet.copyOf(words).asList();
        this.n = slots.size();
        queued = new boolean[arcCount(n)];
        assigned = new int[n];
        used = new boolean[this.words.size()];
        reset();
    }

    /** @return the number of ordered pairs of the given number of slots, each of which gets an arc number */
    static int arcCount(int slots) {
        if ((long) slots * slots > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("too many slots to number their arcs: " + slots);
        }
        return slots * slots;
    }

    public CrosswordSolver setLogInterval(Duration logInterval) {
        this.logInterval = logInterval;
        return this;
    }

    /** @param stepLimit maximum number of search nodes to visit; 0 means no limit */
    public CrosswordSolver setStepLimit(long stepLimit) {
        if (stepLimit < 0) throw new IllegalArgumentException("negative step limit");
        this.stepLimit = stepLimit;
        return this;
    }

    /** @param timeLimit how long the search may run; null means no limit */
    public CrosswordSolver setTimeLimit(Duration timeLimit) {
        this.timeLimit = timeLimit;
        return this;
    }

    public Outcome outcome() {
        return outcome;
    }

    public long stepCount() {
        return stepCount;
    }

    /** @return the words currently considered possible for the slot */
    public ImmutableSet<String> domain(Slot s) {
        return domains.wordsOf(crossword.indexOf(s));
    }

    /**
     * Solves the puzzle from scratch.
     * @return a complete, consistent assignment, or empty if there is none (or if a limit
     * stopped the search first; {@link #outcome()} tells which).
     */
    public Optional<Assignment> solve() {
        reset();
        stopwatch.reset().start();
        lastLogTime = Instant.now();
        log.info("solving %d slots with %d words", n, words.size());
        try {
            if (!enforceNodeConsistency()) {
                outcome = Outcome.EMPTY_DOMAIN;
                return Optional.empty();
            }
            if (!enforceArcConsistency()) {
                outcome = Outcome.EXHAUSTED;
                return Optional.empty();
            }
            if (backtrack()) {
                outcome = Outcome.SOLVED;
                return Optional.of(currentAssignment());
            }
            outcome = limitReached ? Outcome.LIMIT_REACHED : Outcome.EXHAUSTED;
            return Optional.empty();
        } finally {
            stopwatch.stop();
            log.info("%s after %d steps %s", outcome, stepCount, stopwatch);
        }
    }

    private void reset() {
        domains = new Domains(slots, words);
        Arrays.fill(assigned, -1);
        Arrays.fill(used, false);
        nAssigned = 0;
        stepCount = 0;
        lastStepCount = 0;
        limitReached = false;
        outcome = Outcome.NOT_STARTED;
    }

    /**
     * Removes from every domain the words whose length differs from their slot's.
     * @return false if some slot is left without candidates
     */
    boolean enforceNodeConsistency() {
        boolean ok = true;
        for (int x = 0; x < n; ++x) {
            final int length = slots.get(x).length();
            for (int k = domains.size(x) - 1; k >= 0; --k) {
                if (words.get(domains.get(x, k)).length() != length) domains.removeAt(x, k);
            }
            if (domains.size(x) == 0) {
                log.debug("no word of length %d for slot %s", length, slots.get(x));
                ok = false;
            }
        }
        return ok;
    }

    /**
     * Runs AC-3 over every pair of overlapping slots.
     * @return false if some domain was wiped out
     */
    boolean enforceArcConsistency() {
        TIntArrayList arcs = new TIntArrayList();
        for (int x = 0; x < n; ++x) {
            TIntArrayList ns = crossword.neighbors(x);
            for (int k = 0; k < ns.size(); ++k) arcs.add(arc(x, ns.get(k)));
        }
        return enforceArcConsistency(arcs);
    }

    /**
     * Runs AC-3 starting from the given arcs (see {@link #arc}). Arcs between slots that
     * don't overlap are ignored.
     * @return false if some domain was wiped out
     */
    boolean enforceArcConsistency(TIntArrayList arcs) {
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        for (int k = 0; k < arcs.size(); ++k) {
            int a = arcs.get(k);
            if (!queued[a] && crossword.offset(a / n, a % n) >= 0) {
                queued[a] = true;
                queue.add(a);
            }
        }
        while (!queue.isEmpty()) {
            final int a = queue.poll();
            queued[a] = false;
            final int x = a / n;
            final int y = a % n;
            if (!revise(x, y)) continue;
            if (domains.size(x) == 0) {
                log.debug("domain of %s wiped out by %s", slots.get(x), slots.get(y));
                for (int b : queue) queued[b] = false;
                return false;
            }
            TIntArrayList ns = crossword.neighbors(x);
            for (int k = 0; k < ns.size(); ++k) {
                final int z = ns.get(k);
                if (z == y || queued[arc(z, x)]) continue;
                queued[arc(z, x)] = true;
                queue.add(arc(z, x));
            }
        }
        return true;
    }

    /** @return the number by which the ordered slot pair (x, y) is known to AC-3 */
    int arc(int x, int y) {
        return x * n + y;
    }

    /**
     * Makes slot x arc consistent with slot y: removes from x's domain every word that has
     * no partner in y's domain with the same letter in the shared cell.
     * @return true if x's domain changed
     */
    boolean revise(int x, int y) {
        final int i = crossword.offset(x, y);
        if (i < 0) return false;
        final int j = crossword.offset(y, x);
        support.clear();
        for (int k = 0; k < domains.size(y); ++k) support.set(words.get(domains.get(y, k)).charAt(j));
        boolean revised = false;
        for (int k = domains.size(x) - 1; k >= 0; --k) {
            if (!support.get(words.get(domains.get(x, k)).charAt(i))) {
                domains.removeAt(x, k);
                revised = true;
            }
        }
        return revised;
    }

    /**
     * @return the unassigned slot with the fewest remaining candidates, preferring the one
     * with the most neighbors among those, and then the lowest numbered; -1 if every slot
     * is assigned.
     */
    int selectUnassignedVariable() {
        int best = -1;
        for (int x = 0; x < n; ++x) {
            if (assigned[x] >= 0) continue;
            if (best < 0) {
                best = x;
                continue;
            }
            final int d = domains.size(x) - domains.size(best);
            if (d < 0 || (d == 0 && crossword.neighbors(x).size() > crossword.neighbors(best).size())) best = x;
        }
        return best;
    }

    /**
     * Orders the candidates for slot x so that those ruling out the fewest words from the
     * domains of x's unassigned neighbors come first. Ties keep dictionary order.
     * @return word numbers
     */
    int[] orderDomainValues(int x) {
        final int size = domains.size(x);
        final int[] candidates = new int[size];
        final int[] ruledOut = new int[size];
        for (int k = 0; k < size; ++k) candidates[k] = domains.get(x, k);
        TIntArrayList ns = crossword.neighbors(x);
        for (int m = 0; m < ns.size(); ++m) {
            final int z = ns.get(m);
            if (assigned[z] >= 0) continue;
            final int i = crossword.offset(x, z);
            final int j = crossword.offset(z, x);
            Multiset<Character> letters = HashMultiset.create();
            for (int k = 0; k < domains.size(z); ++k) letters.add(words.get(domains.get(z, k)).charAt(j));
            for (int k = 0; k < size; ++k) {
                ruledOut[k] += domains.size(z) - letters.count(words.get(candidates[k]).charAt(i));
            }
        }
        Integer[] order = new Integer[size];
        Arrays.setAll(order, k -> k);
        Arrays.sort(order, Comparator.<Integer>comparingInt(k -> ruledOut[k]).thenComparingInt(k -> candidates[k]));
        return Arrays.stream(order).mapToInt(k -> candidates[k]).toArray();
    }

    /**
     * @return true if word w may be given to slot x: it is not in use elsewhere and agrees
     * with every assigned neighbor on their shared letter.
     */
    boolean consistent(int x, int w) {
        if (used[w]) return false;
        final String word = words.get(w);
        TIntArrayList ns = crossword.neighbors(x);
        for (int k = 0; k < ns.size(); ++k) {
            final int z = ns.get(k);
            if (assigned[z] < 0) continue;
            if (word.charAt(crossword.offset(x, z)) != words.get(assigned[z]).charAt(crossword.offset(z, x))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Extends the current assignment to a complete one. On failure, the domains and the
     * assignment are exactly as they were on entry.
     * @return true if the assignment is now complete
     */
    boolean backtrack() {
        ++stepCount;
        if (stepCount % logCheckSteps == 0) maybeReportProgress();
        if (limitExceeded()) {
            limitReached = true;
            return false;
        }
        if (nAssigned == n) return true;
        final int x = selectUnassignedVariable();
        for (int w : orderDomainValues(x)) {
            if (!consistent(x, w)) continue;
            final int mark = domains.mark();
            assign(x, w);
            domains.narrow(x, w);
            if (enforceArcConsistency(arcsInto(x)) && backtrack()) return true;
            domains.undoTo(mark);
            unassign(x, w);
            if (limitReached) return false;
        }
        return false;
    }

    private boolean limitExceeded() {
        if (stepLimit > 0 && stepCount > stepLimit) return true;
        return timeLimit != null && stopwatch.elapsed().compareTo(timeLimit) > 0;
    }

    private TIntArrayList arcsInto(int x) {
        TIntArrayList ns = crossword.neighbors(x);
        TIntArrayList arcs = new TIntArrayList(ns.size());
        for (int k = 0; k < ns.size(); ++k) arcs.add(arc(ns.get(k), x));
        return arcs;
    }

    private void assign(int x, int w) {
        assigned[x] = w;
        used[w] = true;
        ++nAssigned;
    }

    private void unassign(int x, int w) {
        assigned[x] = -1;
        used[w] = false;
        --nAssigned;
    }

    int assignedCount() {
        return nAssigned;
    }

    String word(int w) {
        return words.get(w);
    }

    Domains domains() {
        return domains;
    }

    private Assignment currentAssignment() {
        ImmutableMap.Builder<Slot, String> b = ImmutableMap.builder();
        for (int x = 0; x < n; ++x) b.put(slots.get(x), words.get(assigned[x]));
        return new Assignment(b.build());
    }

    private void maybeReportProgress() {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%d steps %s %.0f/sec %d/%d slots assigned",
                stepCount, stopwatch, perSec, nAssigned, n));
        lastLogTime = now;
        lastStepCount = stepCount;
    }
}
