package pathfinder.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Fixed-size arena of {@link Cell}s for one editing session.
 * 
 * Cells are stored in a flat array indexed by {@code row * cols + col} and
 * are never replaced; a fresh grid is built to start over.
 * 
 * The grid is the single source of truth for which positions hold the Start
 * and End roles. It also caches a 4-directional adjacency list per cell.
 * That cache is a snapshot of the terrain at the time of the last
 * {@link #rebuildAdjacency()} call and goes stale on every terrain change;
 * searches refuse to run on a stale snapshot.
 * 
 * Invariants maintained here:
 * - at most one Start and one End, never on the same position
 * - a role never sits on an obstacle
 * - adjacency never lists an impassable cell
 * - repainting a cell resets its search state
 */
public class Grid {
    
    private final int rows;
    private final int cols;
    
    private final Cell[] cells;
    
    /** adjacency[index] is the neighbour snapshot of the cell at that index */
    private final List<List<Position>> adjacency;
    
    private boolean adjacencyStale = true;
    
    private Position start;
    private Position end;
    
    /**
     * Creates a square grid with every cell at the default terrain.
     * 
     * @param size number of rows and columns
     */
    public Grid(int size) {
        this(size, size);
    }
    
    /**
     * Creates a grid with every cell at the default terrain and no roles.
     * 
     * @param rows number of rows
     * @param cols number of columns
     * @throws IllegalArgumentException if either dimension is not positive
     * @throws ArithmeticException if rows * cols overflows an int
     */
    public Grid(int rows, int cols) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
        int count = Math.multiplyExact(rows, cols);
        this.cells = new Cell[count];
        this.adjacency = new ArrayList<>(count);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                cells[r * cols + c] = new Cell(new Position(r, c));
                adjacency.add(Collections.emptyList());
            }
        }
    }
    
    public int getRows() {
        return rows;
    }
    
    public int getCols() {
        return cols;
    }
    
    /** @return total number of cells */
    public int size() {
        return cells.length;
    }
    
    public boolean isInBounds(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }
    
    public boolean isInBounds(Position pos) {
        return isInBounds(pos.row, pos.col);
    }
    
    /**
     * @throws OutOfBoundsException if (row, col) is outside the grid
     */
    public Cell getCell(int row, int col) {
        return cells[indexOf(row, col)];
    }
    
    public Cell getCell(Position pos) {
        return getCell(pos.row, pos.col);
    }
    
    /**
     * @return all cells in row-major order (unmodifiable)
     */
    public List<Cell> getCells() {
        return Collections.unmodifiableList(Arrays.asList(cells));
    }
    
    public Terrain getTerrain(int row, int col) {
        return getCell(row, col).getTerrain();
    }
    
    // ========== Painting ==========
    
    /**
     * Repaints a cell. Replaces terrain and movement cost, resets the cell's
     * search state, and drops any role it held. Applying the same terrain
     * twice leaves the same state as applying it once.
     * 
     * @param row the row index
     * @param col the column index
     * @param terrain the new terrain
     * @throws OutOfBoundsException if (row, col) is outside the grid
     */
    public void setTerrain(int row, int col, Terrain terrain) {
        Cell cell = getCell(row, col);
        Position pos = cell.getPosition();
        if (pos.equals(start)) {
            start = null;
        }
        if (pos.equals(end)) {
            end = null;
        }
        cell.applyTerrain(terrain);
        adjacencyStale = true;
    }
    
    /**
     * Erase brush: repaints the cell with {@link Terrain#DEFAULT}.
     */
    public void resetToDefaultTerrain(int row, int col) {
        setTerrain(row, col, Terrain.DEFAULT);
    }
    
    // ========== Roles ==========
    
    /**
     * Gives a cell the Start or End role.
     * 
     * Start gets g = 0 (h and f are computed when a search starts); End has
     * its search state reset. Open/closed/on-path flags are cleared either way.
     * The previous holder of the role, if any, loses it, and if the target held
     * the other role that role is cleared, so Start and End never coincide.
     * 
     * @param row the row index
     * @param col the column index
     * @param role the role to assign
     * @throws IllegalArgumentException if the cell is an obstacle
     * @throws OutOfBoundsException if (row, col) is outside the grid
     */
    public void assignRole(int row, int col, Role role) {
        Cell cell = getCell(row, col);
        if (!cell.isPassable()) {
            throw new IllegalArgumentException("Cannot place " + role + " on obstacle at " + cell.getPosition());
        }
        Position pos = cell.getPosition();
        if (pos.equals(holderOf(role.other()))) {
            setHolder(role.other(), null);
        }
        setHolder(role, pos);
        
        if (role == Role.START) {
            cell.prepareAsStart();
        } else {
            cell.resetSearchState();
        }
    }
    
    /**
     * Removes a role from whichever cell holds it. The cell keeps its terrain.
     */
    public void clearRole(Role role) {
        setHolder(role, null);
    }
    
    /** @return position of the Start cell, or null if none is set */
    public Position getStart() {
        return start;
    }
    
    /** @return position of the End cell, or null if none is set */
    public Position getEnd() {
        return end;
    }
    
    public Position holderOf(Role role) {
        return role == Role.START ? start : end;
    }
    
    /**
     * @return the role held at (row, col), or null
     * @throws OutOfBoundsException if (row, col) is outside the grid
     */
    public Role roleAt(int row, int col) {
        Position pos = getCell(row, col).getPosition();
        if (pos.equals(start)) return Role.START;
        if (pos.equals(end)) return Role.END;
        return null;
    }
    
    public boolean hasRole(Position pos) {
        return pos.equals(start) || pos.equals(end);
    }
    
    private void setHolder(Role role, Position pos) {
        if (role == Role.START) {
            start = pos;
        } else {
            end = pos;
        }
    }
    
    // ========== Adjacency ==========
    
    /**
     * Returns the passable 4-neighbours of a cell as of the last
     * {@link #rebuildAdjacency()}, in East, West, South, North order.
     * 
     * @throws OutOfBoundsException if (row, col) is outside the grid
     */
    public List<Position> neighbors(int row, int col) {
        return adjacency.get(indexOf(row, col));
    }
    
    public List<Position> neighbors(Position pos) {
        return neighbors(pos.row, pos.col);
    }
    
    /**
     * Recomputes the adjacency snapshot of every cell from the current terrain.
     * Must be called after terrain changes and before a search.
     */
    public void rebuildAdjacency() {
        for (Cell cell : cells) {
            List<Position> neighbors = new ArrayList<>(4);
            for (Direction dir : Direction.NEIGHBOR_ORDER) {
                Position next = cell.getPosition().move(dir);
                if (isInBounds(next) && getCell(next).isPassable()) {
                    neighbors.add(next);
                }
            }
            adjacency.set(indexOf(cell.getRow(), cell.getCol()), Collections.unmodifiableList(neighbors));
        }
        adjacencyStale = false;
    }
    
    /** @return true if terrain changed since the last adjacency rebuild */
    public boolean isAdjacencyStale() {
        return adjacencyStale;
    }
    
    // ========== Search state ==========
    
    /**
     * Wipes the A* bookkeeping of every cell, then gives Start g = 0 again.
     * Terrain and roles are untouched.
     */
    public void resetSearchState() {
        for (Cell cell : cells) {
            cell.resetSearchState();
        }
        if (start != null) {
            getCell(start).prepareAsStart();
        }
    }
    
    // ========== Display ==========
    
    /**
     * Resolves what a renderer should show at (row, col).
     * Role beats path, path beats open, open beats closed, closed beats terrain.
     */
    public DisplayState displayStateAt(int row, int col) {
        Cell cell = getCell(row, col);
        Role role = roleAt(row, col);
        if (role == Role.START) return DisplayState.START;
        if (role == Role.END) return DisplayState.END;
        if (cell.isOnPath()) return DisplayState.PATH;
        if (cell.isInOpenSet()) return DisplayState.OPEN;
        if (cell.isInClosedSet()) return DisplayState.CLOSED;
        return DisplayState.TERRAIN;
    }
    
    /**
     * Short status label for an info panel, e.g. "In Open Set" or "Obstacle".
     */
    public String describe(int row, int col) {
        Cell cell = getCell(row, col);
        return switch (displayStateAt(row, col)) {
            case START -> Role.START.getLabel();
            case END -> Role.END.getLabel();
            case PATH -> "On Path";
            case OPEN -> "In Open Set";
            case CLOSED -> "In Closed Set";
            case TERRAIN -> cell.isPassable() ? "Idle" : "Obstacle";
        };
    }
    
    /**
     * Renders the grid as text, one line per row, using display glyphs.
     */
    public String toGridString() {
        StringBuilder sb = new StringBuilder(rows * (cols + 1));
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                sb.append(displayStateAt(r, c).glyph(getTerrain(r, c)));
            }
            sb.append('\n');
        }
        return sb.toString();
    }
    
    private int indexOf(int row, int col) {
        if (!isInBounds(row, col)) {
            throw new OutOfBoundsException(row, col, rows, cols);
        }
        return row * cols + col;
    }
    
    @Override
    public String toString() {
        return "Grid{rows=" + rows + ", cols=" + cols + ", start=" + start + ", end=" + end + "}";
    }
}
