package pathfinder.planning;

/**
 * Lifecycle of one {@link AStar} run.
 * UNSTARTED -> RUNNING -> one of SUCCEEDED, FAILED, CANCELLED.
 */
public enum SearchPhase {
    UNSTARTED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;
    
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
