package com.domineering.core.ai;

import com.domineering.core.DomineeringState;
import com.domineering.core.Fingerprint;
import com.domineering.core.Move;
import com.domineering.core.Player;
import com.domineering.core.ai.eval.EvaluationPipeline;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Depth-limited minimax searcher with alpha-beta pruning.
 *
 * <p>Children recorded two plies below the root are kept in a {@link MoveOrderCache} and sorted on
 * a background thread after each search, so that the next search, which usually starts from one
 * of those positions, examines the strongest moves first.
 *
 * <p>Instances are not thread-safe: run one search at a time and call {@link #shutdown()} when
 * done.
 */
public final class SearchEngine implements Searcher, AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(SearchEngine.class.getName());

    /**
     * Depth whose children are recorded for the next search.
     */
    static final int CACHED_DEPTH = 2;

    private final EvaluationPipeline pipeline;
    private final TranspositionTable transpositionTable;
    private final MoveOrderCache moveOrderCache = new MoveOrderCache();
    private final ExecutorService sorterExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "move-order-sorter");
        thread.setDaemon(true);
        return thread;
    });
    private CompletableFuture<Void> pendingSort = CompletableFuture.completedFuture(null);
    private volatile boolean shutdown;

    private SearchConstraints.PruningMode pruning = SearchConstraints.PruningMode.ALPHA_BETA;
    private long visitedNodes;
    private long cutoffs;
    private boolean moveOrderReused;
    private List<SearchNode> rootOrdering;

    public SearchEngine() {
        this(EvaluationPipeline.standard());
    }

    public SearchEngine(EvaluationPipeline pipeline) {
        this(pipeline, null);
    }

    /**
     * @param pipeline           heuristic applied at the depth limit
     * @param transpositionTable table receiving every completed root result, or {@code null}
     */
    public SearchEngine(EvaluationPipeline pipeline, TranspositionTable transpositionTable) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.transpositionTable = transpositionTable;
    }

    /**
     * Searches {@code position} to {@code depthLimit} plies and returns the resolved root choice.
     * The returned node carries the chosen move as its origin move, or is the root itself
     * (without a move) when the side to move has no placement or the limit is zero.
     */
    public SearchNode search(DomineeringState position, int depthLimit) {
        return search(position, SearchConstraints.ofDepth(depthLimit)).bestNode();
    }

    @Override
    public SearchResult search(DomineeringState state, SearchConstraints constraints) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(constraints, "constraints");
        if (shutdown) {
            throw new IllegalStateException("Search engine has been shut down");
        }

        awaitPendingSort();

        pruning = constraints.pruning();
        visitedNodes = 0L;
        cutoffs = 0L;
        moveOrderReused = false;

        DomineeringState root = new DomineeringState(state);
        Fingerprint rootKey = root.fingerprint();
        SearchNode rootNode = SearchNode.root(root.getToMove());
        int depthLimit = constraints.depthLimit();

        rootOrdering = moveOrderCache.take(rootKey);
        // Anything left belongs to positions the game did not reach.
        moveOrderCache.clear();

        long start = System.nanoTime();
        SearchNode best = searchUnder(rootNode, PruningWindow.full(), root, depthLimit);
        long elapsedNanos = System.nanoTime() - start;
        rootOrdering = null;

        Player chooser = rootNode.mover();
        pendingSort = CompletableFuture.runAsync(() -> moveOrderCache.sortAll(chooser), sorterExecutor);
        pendingSort.whenComplete((ignored, error) -> {
            if (error != null) {
                LOGGER.log(Level.WARNING, "Failed to sort cached move orderings", error);
            }
        });

        if (transpositionTable != null) {
            transpositionTable.put(rootKey, new TTEntry(best.score(), depthLimit, TTFlag.EXACT, best.originMove()));
        }

        long nodes = visitedNodes;
        long cuts = cutoffs;
        LOGGER.info(() -> String.format("Search explored %d nodes (depth=%d, cutoffs=%d, move=%s, score=%s)",
                nodes, depthLimit, cuts, best.originMove(), best.score()));

        return new SearchResult(best, depthLimit, nodes, cuts, moveOrderReused, elapsedNanos);
    }

    /**
     * Returns the heuristic value of the position. Works on a copy; the position is not modified.
     */
    public double evaluate(DomineeringState position) {
        return pipeline.evaluate(position);
    }

    /**
     * Waits for the background sort to finish and stops the sorter thread. Further searches are
     * rejected.
     */
    public void shutdown() {
        shutdown = true;
        awaitPendingSort();
        sorterExecutor.shutdown();
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Returns the move-order cache once the background sort has released it.
     */
    MoveOrderCache moveOrderCache() {
        awaitPendingSort();
        return moveOrderCache;
    }

    private SearchNode searchUnder(SearchNode parent, PruningWindow window, DomineeringState position,
            int depthLimit) {
        visitedNodes++;

        if (parent.depth() >= depthLimit) {
            // A root without placements is decided whatever the limit.
            if (parent.depth() == 0 && !position.hasLegalMove()) {
                return parent.asTerminal();
            }
            return parent.withScore(evaluate(position));
        }

        List<SearchNode> children = expand(parent, position);
        if (children.isEmpty()) {
            return parent.asTerminal();
        }

        Player mover = parent.mover();
        DomineeringState next = new DomineeringState(position);
        next.togglePlayer();

        SearchNode best = null;
        for (int i = 0; i < children.size(); i++) {
            SearchNode child = children.get(i);

            // One working copy per level; place and lift each child instead of copying per child.
            tap(child, next);
            SearchNode result = searchUnder(child, window.copy(), next, depthLimit);
            untap(child, next);

            SearchNode scored = child.withScore(result.score());
            children.set(i, scored);

            if (result.score() == mover.winningScore()) {
                best = scored.asProven(result.score());
                break;
            }

            if (best == null || improves(scored.score(), best.score(), mover)) {
                best = scored;
                window.updateIfNeeded(scored.score(), mover);
                if (pruning == SearchConstraints.PruningMode.ALPHA_BETA && window.canPrune(scored.score(), mover)) {
                    cutoffs++;
                    break;
                }
            }
        }

        if (parent.depth() == CACHED_DEPTH) {
            moveOrderCache.record(position.fingerprint(), children);
        }

        if (Double.isInfinite(best.score())) {
            best = best.asProven(best.score());
        }
        return best;
    }

    private List<SearchNode> expand(SearchNode parent, DomineeringState position) {
        if (parent.depth() == 0) {
            List<SearchNode> cached = rootOrdering;
            rootOrdering = null;
            if (cached != null && !cached.isEmpty()) {
                moveOrderReused = true;
                LOGGER.fine(() -> String.format("Reusing cached ordering of %d moves", cached.size()));
                List<SearchNode> children = new ArrayList<>(cached.size());
                for (SearchNode node : cached) {
                    children.add(parent.child(node.originMove()));
                }
                return children;
            }
        }

        List<Move> moves = position.legalMoves();
        List<SearchNode> children = new ArrayList<>(moves.size());
        for (Move move : moves) {
            children.add(parent.child(move));
        }
        return children;
    }

    private static boolean improves(double candidate, double currentBest, Player mover) {
        return mover.isMaximizer() ? candidate > currentBest : candidate < currentBest;
    }

    private static void tap(SearchNode child, DomineeringState state) {
        char symbol = child.mover().opponent().symbol();
        Move move = child.originMove();
        state.setCell(move.r1(), move.c1(), symbol);
        state.setCell(move.r2(), move.c2(), symbol);
    }

    private static void untap(SearchNode child, DomineeringState state) {
        Move move = child.originMove();
        state.setCell(move.r1(), move.c1(), DomineeringState.EMPTY);
        state.setCell(move.r2(), move.c2(), DomineeringState.EMPTY);
    }

    private void awaitPendingSort() {
        try {
            pendingSort.join();
        } catch (CompletionException | CancellationException ex) {
            // Already reported by the task's completion handler; the cache stays usable unsorted.
            LOGGER.log(Level.FINE, "Previous move-order sort did not complete", ex);
        }
    }
}
