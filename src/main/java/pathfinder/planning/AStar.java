package pathfinder.planning;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pathfinder.domain.Cell;
import pathfinder.domain.Grid;
import pathfinder.domain.Position;

import java.util.List;
import java.util.PriorityQueue;

/**
 * Weighted A* search from the grid's Start to its End.
 * 
 * Each step onto a cell costs that cell's movement cost, so
 * f(n) = g(n) + h(n) where g(n) is the summed terrain cost from Start and
 * h(n) is the heuristic estimate to End.
 * 
 * Search policy:
 * - the open set is a priority queue on f; equal f values are served in
 *   insertion order, so identical grids always expand in the same order
 * - an improved cell is pushed again instead of being updated in place;
 *   stale queue entries are skipped when popped
 * - a closed cell is final and never relaxed again, even if a cheaper route
 *   to it turns up later
 * 
 * The search is cooperative: after every expansion it reports to the
 * {@link SearchListener} and polls it for cancellation before the next one.
 * It never touches terrain or roles; callers must not edit the grid while a
 * search is running.
 * 
 * An instance runs once. Build a new one for the next search.
 */
public class AStar {
    
    private static final Logger LOG = LoggerFactory.getLogger(AStar.class);
    
    private final Grid grid;
    private final Heuristic heuristic;
    private final SearchListener listener;
    private final SearchConfig config;
    
    private SearchPhase phase = SearchPhase.UNSTARTED;
    private int expandedCount;
    
    /**
     * Entry in the open set. A cell can have several entries; only the one
     * popped first is expanded.
     */
    private static class OpenEntry implements Comparable<OpenEntry> {
        final Position position;
        final double f;
        final long sequence;
        
        OpenEntry(Position position, double f, long sequence) {
            this.position = position;
            this.f = f;
            this.sequence = sequence;
        }
        
        @Override
        public int compareTo(OpenEntry other) {
            int fCompare = Double.compare(this.f, other.f);
            if (fCompare != 0) return fCompare;
            
            // Tie-breaker: first inserted wins
            return Long.compare(this.sequence, other.sequence);
        }
    }
    
    /**
     * Creates a search with the Manhattan heuristic and default config.
     */
    public AStar(Grid grid, SearchListener listener) {
        this(grid, new ManhattanHeuristic(), listener, SearchConfig.defaults());
    }
    
    /**
     * Creates a new A* search instance.
     * 
     * @param grid the grid to search; its adjacency must be up to date
     * @param heuristic the heuristic function
     * @param listener receives progress, status and cancellation polls
     * @param config search configuration
     */
    public AStar(Grid grid, Heuristic heuristic, SearchListener listener, SearchConfig config) {
        this.grid = grid;
        this.heuristic = heuristic;
        this.listener = listener != null ? listener : SearchListener.NONE;
        this.config = config;
    }
    
    public SearchPhase getPhase() {
        return phase;
    }
    
    /**
     * Runs the search to a terminal outcome.
     * 
     * Leaves the open/closed/on-path marks and costs in the grid for display.
     * A cancelled search leaves them exactly as they were at the last step.
     * Costs left over from an earlier search are not cleared here; call
     * {@link Grid#resetSearchState()} before searching the same grid again.
     *
     * @return the outcome, with path and cost on success
     * @throws IllegalStateException if this instance already ran, Start or End
     *         is missing, or the grid's adjacency is stale
     */
    public SearchResult search() {
        if (phase != SearchPhase.UNSTARTED) {
            throw new IllegalStateException("Search already ran (phase " + phase + ")");
        }
        Position start = grid.getStart();
        Position end = grid.getEnd();
        if (start == null || end == null) {
            throw new IllegalStateException("Search needs both Start and End (start=" + start + ", end=" + end + ")");
        }
        if (grid.isAdjacencyStale()) {
            throw new IllegalStateException("Adjacency is stale; call rebuildAdjacency() before searching");
        }
        
        phase = SearchPhase.RUNNING;
        LOG.debug("A* from {} to {} on {}x{} grid", start, end, grid.getRows(), grid.getCols());
        
        PriorityQueue<OpenEntry> openSet = new PriorityQueue<>();
        long sequence = 0;
        
        Cell startCell = grid.getCell(start);
        startCell.setParent(null);
        startCell.updateCosts(0, heuristic.estimate(start, end));
        openSet.add(new OpenEntry(start, startCell.getFCost(), sequence++));
        startCell.markOpen();
        
        listener.onStatus(StatusMessages.RUNNING);
        
        while (!openSet.isEmpty()) {
            if (listener.isCancelled()) {
                phase = SearchPhase.CANCELLED;
                LOG.info("Search cancelled after {} expansions", expandedCount);
                return SearchResult.cancelled(expandedCount);
            }
            
            OpenEntry entry = openSet.poll();
            Cell current = grid.getCell(entry.position);
            
            // Skip stale duplicates of cells already expanded
            if (current.isInClosedSet()) {
                continue;
            }
            current.clearMarks();
            
            if (entry.position.equals(end)) {
                return succeed(current);
            }
            
            for (Position neighborPos : grid.neighbors(entry.position)) {
                Cell neighbor = grid.getCell(neighborPos);
                if (neighbor.isInClosedSet()) {
                    continue;
                }
                
                double tentativeG = current.getGCost() + neighbor.getMovementCost();
                if (tentativeG < neighbor.getGCost()) {
                    neighbor.setParent(current.getPosition());
                    neighbor.updateCosts(tentativeG, heuristic.estimate(neighborPos, end));
                    openSet.add(new OpenEntry(neighborPos, neighbor.getFCost(), sequence++));
                    neighbor.markOpen();
                }
            }
            
            current.markClosed();
            expandedCount++;
            if (expandedCount % config.getProgressLogInterval() == 0) {
                LOG.debug("Expanded {} cells, open set size {}", expandedCount, openSet.size());
            }
            listener.onStep(current);
        }
        
        phase = SearchPhase.FAILED;
        LOG.info("No path from {} to {} ({} cells expanded)", start, end, expandedCount);
        listener.onStatus(StatusMessages.NOT_FOUND);
        return SearchResult.failure(expandedCount);
    }
    
    private SearchResult succeed(Cell endCell) {
        phase = SearchPhase.SUCCEEDED;
        double cost = endCell.getGCost();
        listener.onStatus(StatusMessages.found(cost));
        
        List<Position> path = new PathReconstructor(grid, listener).reconstruct(endCell.getPosition());
        LOG.info("Path found: cost {}, {} cells, {} expanded", cost, path.size(), expandedCount);
        return SearchResult.success(path, cost, expandedCount);
    }
}
