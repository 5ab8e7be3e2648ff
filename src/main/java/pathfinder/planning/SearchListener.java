package pathfinder.planning;

import pathfinder.domain.Cell;

/**
 * Callbacks a search reports through. The search runs on the caller's thread
 * and hands control back through these methods once per step, so a host can
 * redraw, poll input and decide whether to cancel without a second thread.
 * 
 * All methods have no-op defaults; implement only what you need.
 */
public interface SearchListener {
    
    /** Listener that ignores everything and never cancels */
    SearchListener NONE = new SearchListener() {};
    
    /**
     * Called after each cell is expanded, and after each step of path
     * reconstruction.
     * 
     * @param cell the cell just processed
     */
    default void onStep(Cell cell) {}
    
    /**
     * Called on status transitions with a human-readable message
     * (see {@link StatusMessages}).
     * 
     * @param message the status message
     */
    default void onStatus(String message) {}
    
    /**
     * Polled once per search iteration, never in the middle of one.
     * 
     * @return true to stop the search with a CANCELLED outcome
     */
    default boolean isCancelled() { return false; }
}
