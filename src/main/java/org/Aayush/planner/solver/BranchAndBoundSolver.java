package org.Aayush.planner.solver;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Exact depth-first branch-and-bound over the attend/skip decisions.
 *
 * <p>Decisions are taken in index order, "attend" before "skip". The candidate set of a
 * node holds every undecided index compatible with all attended ones, so an index outside
 * it is skipped without branching. Bounds per pass:</p>
 * <ul>
 * <li>Attendance: attended count plus remaining candidates. A node that cannot beat the
 * best count is pruned.</li>
 * <li>Transit: accumulated transit never decreases along a branch, so a node whose
 * accumulated cost already reaches the best complete cost is pruned; nodes that can no
 * longer reach the target attendance are pruned too.</li>
 * </ul>
 *
 * <p>Among equal objectives the first assignment in search order wins, i.e. the one that
 * attends the earliest differing index. With {@code parallelism > 1} the leading decisions
 * are expanded into disjoint subtrees kept in search order; workers share the incumbent
 * bound, and ties between subtrees go to the earlier subtree, so the outcome equals the
 * sequential one.</p>
 */
@Slf4j
public final class BranchAndBoundSolver implements ScheduleSolver {
    public static final String ID = "BRANCH_AND_BOUND";
    public static final String REASON_WORKER_FAILED = "SOLVER_WORKER_FAILED";
    public static final String REASON_INTERRUPTED = "SOLVER_INTERRUPTED";

    /** Upper bound on worker threads per solve. */
    public static final int MAX_PARALLELISM = 256;

    private static final int SUBTREES_PER_WORKER = 4;

    private final int parallelism;

    /**
     * Creates a sequential solver.
     */
    public BranchAndBoundSolver() {
        this(1);
    }

    /**
     * Creates a solver that spreads subtrees over {@code parallelism} worker threads.
     */
    public BranchAndBoundSolver(int parallelism) {
        if (parallelism < 1 || parallelism > MAX_PARALLELISM) {
            throw new IllegalArgumentException(
                    "parallelism must be in [1, " + MAX_PARALLELISM + "], got " + parallelism
            );
        }
        this.parallelism = parallelism;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public SolveOutcome solve(SelectionModel model, SolverBudget budget, ProgressListener listener) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(budget, "budget");
        Objects.requireNonNull(listener, "listener");
        long startedAt = System.nanoTime();
        SolverBudget.Tracker tracker = budget.start();

        Incumbent attendanceBest = new Incumbent(SearchPhase.MAXIMIZE_ATTENDANCE, model, listener, tracker);
        int subtrees = runPhase(model, SearchPhase.MAXIMIZE_ATTENDANCE, 0, attendanceBest, tracker);
        long attendanceNodes = tracker.nodes();
        SelectionAssignment best = attendanceBest.assignment();
        if (best == null) {
            best = SelectionAssignment.none(model.size());
        }
        log.debug("attendance pass: attendance={}, nodes={}, subtrees={}", best.attendance(), attendanceNodes, subtrees);

        if (tracker.stopped()) {
            return outcome(model, best, tracker, attendanceNodes, 0L, subtrees, startedAt);
        }

        Incumbent transitBest = new Incumbent(SearchPhase.MINIMIZE_TRANSIT, model, listener, tracker);
        transitBest.seed(best, model.totalTransit(best));
        runPhase(model, SearchPhase.MINIMIZE_TRANSIT, best.attendance(), transitBest, tracker);
        long transitNodes = tracker.nodes() - attendanceNodes;
        log.debug("transit pass: transit={}, nodes={}", transitBest.cost(), transitNodes);

        return outcome(model, transitBest.assignment(), tracker, attendanceNodes, transitNodes, subtrees, startedAt);
    }

    private SolveOutcome outcome(
            SelectionModel model,
            SelectionAssignment assignment,
            SolverBudget.Tracker tracker,
            long attendanceNodes,
            long transitNodes,
            int subtrees,
            long startedAt
    ) {
        TerminationReason reason = tracker.stopped() ? tracker.stopReason() : TerminationReason.OPTIMAL;
        return SolveOutcome.builder()
                .assignment(assignment)
                .attendance(assignment.attendance())
                .totalTransit(model.totalTransit(assignment))
                .terminationReason(reason)
                .stats(SolverStats.builder()
                        .attendanceNodes(attendanceNodes)
                        .transitNodes(transitNodes)
                        .subtrees(subtrees)
                        .parallelism(parallelism)
                        .elapsed(Duration.ofNanos(System.nanoTime() - startedAt))
                        .build())
                .build();
    }

    /**
     * Runs one pass to completion or budget exhaustion.
     *
     * @return number of subtrees searched.
     */
    private int runPhase(
            SelectionModel model,
            SearchPhase phase,
            int target,
            Incumbent incumbent,
            SolverBudget.Tracker tracker
    ) {
        List<SearchNode> subtrees = parallelism == 1
                ? List.of(SearchNode.root(model))
                : partition(model, phase, target, parallelism * SUBTREES_PER_WORKER);
        if (parallelism == 1 || subtrees.size() == 1) {
            for (int order = 0; order < subtrees.size() && !tracker.stopped(); order++) {
                new SubtreeSearch(model, phase, target, incumbent, tracker, order).run(subtrees.get(order));
            }
            return subtrees.size();
        }

        int workers = Math.min(parallelism, subtrees.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        AtomicInteger nextSubtree = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>(workers);
        try {
            for (int w = 0; w < workers; w++) {
                futures.add(pool.submit(() -> {
                    int order;
                    while ((order = nextSubtree.getAndIncrement()) < subtrees.size() && !tracker.stopped()) {
                        new SubtreeSearch(model, phase, target, incumbent, tracker, order).run(subtrees.get(order));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (ExecutionException ex) {
            tracker.cancel();
            throw new SolverExecutionException(
                    REASON_WORKER_FAILED,
                    phase + " worker failed: " + ex.getCause().getMessage(),
                    ex.getCause()
            );
        } catch (InterruptedException ex) {
            tracker.cancel();
            Thread.currentThread().interrupt();
            throw new SolverExecutionException(REASON_INTERRUPTED, phase + " interrupted", ex);
        } finally {
            pool.shutdownNow();
        }
        return subtrees.size();
    }

    /**
     * Expands the leading decisions breadth-wise while keeping search order.
     */
    private static List<SearchNode> partition(SelectionModel model, SearchPhase phase, int target, int wanted) {
        List<SearchNode> frontier = List.of(SearchNode.root(model));
        while (frontier.size() < wanted) {
            List<SearchNode> next = new ArrayList<>(frontier.size() * 2);
            boolean expanded = false;
            for (SearchNode node : frontier) {
                int index = node.candidates.nextSetBit(0);
                boolean saturated = phase == SearchPhase.MINIMIZE_TRANSIT && node.selected >= target;
                if (index < 0 || saturated) {
                    next.add(node);
                    continue;
                }
                next.add(node.attend(index, model));
                next.add(node.skip(index));
                expanded = true;
            }
            frontier = next;
            if (!expanded) {
                break;
            }
        }
        return frontier;
    }

    /**
     * Root of one subtree: decided prefix plus remaining candidates.
     */
    private static final class SearchNode {
        private final boolean[] chosen;
        private final BitSet candidates;
        private final int selected;
        private final int last;
        private final long transit;

        private SearchNode(boolean[] chosen, BitSet candidates, int selected, int last, long transit) {
            this.chosen = chosen;
            this.candidates = candidates;
            this.selected = selected;
            this.last = last;
            this.transit = transit;
        }

        static SearchNode root(SelectionModel model) {
            return new SearchNode(new boolean[model.size()], model.allIndices(), 0, -1, 0L);
        }

        SearchNode attend(int index, SelectionModel model) {
            boolean[] nextChosen = chosen.clone();
            nextChosen[index] = true;
            BitSet nextCandidates = (BitSet) candidates.clone();
            nextCandidates.and(model.compatibleAfter(index));
            long step = last >= 0 ? model.transitCostUnchecked(last, index) : 0L;
            return new SearchNode(nextChosen, nextCandidates, selected + 1, index, transit + step);
        }

        SearchNode skip(int index) {
            BitSet nextCandidates = (BitSet) candidates.clone();
            nextCandidates.clear(index);
            return new SearchNode(chosen.clone(), nextCandidates, selected, last, transit);
        }
    }

    /**
     * Depth-first search of one subtree with a subtree-local bound.
     *
     * <p>Costs are minimized: the attendance pass uses negated attendance.</p>
     */
    private static final class SubtreeSearch {
        private final SelectionModel model;
        private final SearchPhase phase;
        private final int target;
        private final Incumbent incumbent;
        private final SolverBudget.Tracker tracker;
        private final int order;
        private boolean[] chosen;
        private long localBest = Long.MAX_VALUE;

        SubtreeSearch(
                SelectionModel model,
                SearchPhase phase,
                int target,
                Incumbent incumbent,
                SolverBudget.Tracker tracker,
                int order
        ) {
            this.model = model;
            this.phase = phase;
            this.target = target;
            this.incumbent = incumbent;
            this.tracker = tracker;
            this.order = order;
        }

        void run(SearchNode node) {
            chosen = node.chosen.clone();
            descend((BitSet) node.candidates.clone(), node.selected, node.last, node.transit);
        }

        private void descend(BitSet candidates, int selected, int last, long transit) {
            if (!tracker.admitNode()) {
                return;
            }
            int remaining = candidates.cardinality();
            if (phase == SearchPhase.MAXIMIZE_ATTENDANCE) {
                long bound = -(long) (selected + remaining);
                // equal cost inside one subtree loses to the earlier find; across subtrees order decides
                if (bound >= localBest || bound > incumbent.cost()) {
                    return;
                }
                if (remaining == 0) {
                    record(-(long) selected);
                    return;
                }
            } else {
                if (selected + remaining < target) {
                    return;
                }
                if (transit >= localBest || transit > incumbent.cost()) {
                    return;
                }
                if (selected == target) {
                    record(transit);
                    return;
                }
            }

            int index = candidates.nextSetBit(0);

            BitSet attended = (BitSet) candidates.clone();
            attended.and(model.compatibleAfter(index));
            long step = last >= 0 ? model.transitCostUnchecked(last, index) : 0L;
            chosen[index] = true;
            descend(attended, selected + 1, index, transit + step);
            chosen[index] = false;

            candidates.clear(index);
            descend(candidates, selected, last, transit);
            candidates.set(index);
        }

        private void record(long cost) {
            localBest = cost;
            incumbent.offer(cost, order, chosen);
        }
    }

    /**
     * Best assignment of one pass, shared by all workers.
     *
     * <p>Updates happen under the monitor and only ever move to a lower cost, or to an
     * equal cost from an earlier subtree. Pruning reads the cost without locking.</p>
     */
    private static final class Incumbent {
        private final SearchPhase phase;
        private final SelectionModel model;
        private final ProgressListener listener;
        private final SolverBudget.Tracker tracker;
        private volatile long cost = Long.MAX_VALUE;
        private int order = Integer.MAX_VALUE;
        private SelectionAssignment assignment;

        Incumbent(SearchPhase phase, SelectionModel model, ProgressListener listener, SolverBudget.Tracker tracker) {
            this.phase = phase;
            this.model = model;
            this.listener = listener;
            this.tracker = tracker;
        }

        long cost() {
            return cost;
        }

        synchronized SelectionAssignment assignment() {
            return assignment;
        }

        /**
         * Installs a known feasible assignment that any search result may replace on a tie.
         */
        synchronized void seed(SelectionAssignment seedAssignment, long seedCost) {
            this.assignment = seedAssignment;
            this.order = Integer.MAX_VALUE;
            this.cost = seedCost;
        }

        synchronized void offer(long candidateCost, int candidateOrder, boolean[] chosen) {
            if (tracker.cancelled()) {
                return;
            }
            if (candidateCost > cost || (candidateCost == cost && candidateOrder >= order)) {
                return;
            }
            assignment = SelectionAssignment.of(chosen);
            order = candidateOrder;
            cost = candidateCost;
            int transit = model.totalTransit(assignment);
            log.debug("{} improved: attendance={}, transit={}", phase, assignment.attendance(), transit);
            ProgressSnapshot snapshot = ProgressSnapshot.builder()
                    .phase(phase)
                    .assignment(assignment)
                    .attendance(assignment.attendance())
                    .totalTransit(transit)
                    .nodesExplored(tracker.nodes())
                    .build();
            try {
                listener.onImprovement(snapshot);
            } catch (RuntimeException ex) {
                // observer failures never affect the search
                log.warn("progress listener failed on {} improvement", phase, ex);
            }
        }
    }
}
