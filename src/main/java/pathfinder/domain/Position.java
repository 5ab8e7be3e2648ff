package pathfinder.domain;

/**
 * Immutable coordinate of a cell on the grid.
 * Row 0 is the top row and column 0 the leftmost column.
 * 
 * Positions are used as the only link between cells (parent pointers,
 * Start/End identity, adjacency), so no cell ever owns another.
 */
public final class Position {
    
    /** The row index (0-indexed from top) */
    public final int row;
    
    /** The column index (0-indexed from left) */
    public final int col;
    
    /**
     * Creates a new Position with the specified row and column.
     * 
     * @param row the row index
     * @param col the column index
     */
    public Position(int row, int col) {
        this.row = row;
        this.col = col;
    }
    
    /**
     * Factory method, reads better at call sites than the constructor.
     */
    public static Position of(int row, int col) {
        return new Position(row, col);
    }
    
    /**
     * Returns the Position adjacent to this one in the given direction.
     * The result may lie outside the grid; callers check bounds.
     * 
     * @param direction the direction to move
     * @return the neighbouring position
     */
    public Position move(Direction direction) {
        return new Position(row + direction.dRow, col + direction.dCol);
    }
    
    /**
     * Manhattan distance |row1 - row2| + |col1 - col2|.
     * 
     * @param other the other position
     * @return the Manhattan distance
     */
    public int manhattanDistance(Position other) {
        return Math.abs(this.row - other.row) + Math.abs(this.col - other.col);
    }
    
    /**
     * Checks if this position shares an edge with another position
     * (N/S/E/W only, never diagonal).
     * 
     * @param other the other position
     * @return true if positions are cardinally adjacent
     */
    public boolean isCardinallyAdjacentTo(Position other) {
        return manhattanDistance(other) == 1;
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Position position = (Position) obj;
        return row == position.row && col == position.col;
    }
    
    @Override
    public int hashCode() {
        return 31 * row + col;
    }
    
    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
