package pathfinder.domain;

/**
 * The four cardinal directions a path may step in.
 * Diagonal movement is not supported.
 */
public enum Direction {
    /** North - move up (decrease row) */
    N(-1, 0),
    
    /** South - move down (increase row) */
    S(1, 0),
    
    /** East - move right (increase column) */
    E(0, 1),
    
    /** West - move left (decrease column) */
    W(0, -1);
    
    /**
     * Order in which neighbours are listed in adjacency snapshots.
     * Expansion order, and so tie-breaking between equal-cost paths, depends on it.
     */
    public static final Direction[] NEIGHBOR_ORDER = {E, W, S, N};
    
    /** Row delta when moving in this direction */
    public final int dRow;
    
    /** Column delta when moving in this direction */
    public final int dCol;
    
    Direction(int dRow, int dCol) {
        this.dRow = dRow;
        this.dCol = dCol;
    }
}
