package pathfinder.domain;

/**
 * Thrown when a coordinate outside the grid is passed to a grid query or
 * paint operation. Boundary code (input handling, parsers) is expected to
 * validate coordinates first, so this signals a caller bug.
 */
public class OutOfBoundsException extends IndexOutOfBoundsException {
    
    private final int row;
    private final int col;
    
    public OutOfBoundsException(int row, int col, int rows, int cols) {
        super("Position (" + row + "," + col + ") is outside the " + rows + "x" + cols + " grid");
        this.row = row;
        this.col = col;
    }
    
    public int getRow() { return row; }
    
    public int getCol() { return col; }
}
