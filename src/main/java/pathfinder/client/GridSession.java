package pathfinder.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pathfinder.domain.Cell;
import pathfinder.domain.Grid;
import pathfinder.domain.Position;
import pathfinder.domain.Role;
import pathfinder.planning.AStar;
import pathfinder.planning.ManhattanHeuristic;
import pathfinder.planning.SearchConfig;
import pathfinder.planning.SearchListener;
import pathfinder.planning.SearchPhase;
import pathfinder.planning.SearchResult;
import pathfinder.planning.StatusMessages;
import pathfinder.planning.fill.RegionFill;

/**
 * Editing session over one grid: the state a UI keeps between input events.
 * 
 * Holds the selected brush and paint mode, turns clicks, drags and erases
 * into grid operations, and runs searches. It also enforces the rule that
 * the grid is not edited while a search is running.
 * 
 * Not thread-safe. Everything, including search callbacks, runs on the
 * caller's thread.
 */
public class GridSession {
    
    private static final Logger LOG = LoggerFactory.getLogger(GridSession.class);
    
    private final SearchConfig config;
    
    private Grid grid;
    private Brush brush = Brush.START;
    private PaintMode paintMode = PaintMode.SINGLE_TILE;
    private String status = StatusMessages.READY;
    
    private boolean running;
    private SearchResult lastResult;
    
    /**
     * Creates a session with a fresh square grid of the configured size.
     */
    public GridSession(SearchConfig config) {
        this(new Grid(config.getGridSize()), config);
    }
    
    /**
     * Creates a session over an existing grid (e.g. one loaded from a text map).
     */
    public GridSession(Grid grid, SearchConfig config) {
        this.grid = grid;
        this.config = config;
    }
    
    public Grid getGrid() { return grid; }
    
    public Brush getBrush() { return brush; }
    
    public PaintMode getPaintMode() { return paintMode; }
    
    public String getStatus() { return status; }
    
    public boolean isRunning() { return running; }
    
    /** @return result of the most recent completed run, or null */
    public SearchResult getLastResult() { return lastResult; }
    
    // ========== Tool selection ==========
    
    public void selectBrush(Brush brush) {
        this.brush = brush;
        status = "Brush: " + brush.getDisplayName() + ", " + paintMode.getLabel();
    }
    
    public void selectPaintMode(PaintMode paintMode) {
        this.paintMode = paintMode;
        status = "Mode: " + brush.getDisplayName() + ", " + paintMode.getLabel();
    }
    
    // ========== Editing ==========
    
    /**
     * Applies the current brush to a clicked cell.
     * 
     * A Start or End brush moves that role here; the cell that held it before
     * is reset to default terrain, and an obstacle under the click is cleared
     * first. A terrain brush paints the cell, or floods its region in
     * FLOOD_FILL mode.
     * 
     * @return true if the grid changed
     * @throws IllegalStateException if a search is running
     * @throws pathfinder.domain.OutOfBoundsException if (row, col) is outside the grid
     */
    public boolean click(int row, int col) {
        ensureIdle();
        if (brush.isRole()) {
            placeRole(row, col, brush.getRole());
            return true;
        }
        if (paintMode == PaintMode.FLOOD_FILL) {
            return new RegionFill(grid).fill(row, col, brush.getTerrain());
        }
        grid.setTerrain(row, col, brush.getTerrain());
        return true;
    }
    
    /**
     * Continues a click-and-drag stroke over a cell. Drags always paint a
     * single tile, skip Start and End, and do nothing with a role brush.
     * 
     * @return true if the cell was painted
     * @throws IllegalStateException if a search is running
     */
    public boolean drag(int row, int col) {
        ensureIdle();
        if (brush.isRole()) {
            return false;
        }
        if (grid.roleAt(row, col) != null) {
            return false;
        }
        grid.setTerrain(row, col, brush.getTerrain());
        return true;
    }
    
    /**
     * Erases a cell back to default terrain, dropping any role it held.
     * 
     * @throws IllegalStateException if a search is running
     */
    public void erase(int row, int col) {
        ensureIdle();
        grid.resetToDefaultTerrain(row, col);
    }
    
    /**
     * Replaces the grid with a fresh one of the same size. All terrain, roles
     * and search history are discarded.
     * 
     * @throws IllegalStateException if a search is running
     */
    public void clear() {
        ensureIdle();
        grid = new Grid(grid.getRows(), grid.getCols());
        lastResult = null;
        status = StatusMessages.CLEARED;
        LOG.debug("Grid cleared ({}x{})", grid.getRows(), grid.getCols());
    }
    
    private void placeRole(int row, int col, Role role) {
        Position previous = grid.holderOf(role);
        if (previous != null) {
            grid.resetToDefaultTerrain(previous.row, previous.col);
        }
        if (!grid.getCell(row, col).isPassable()) {
            grid.resetToDefaultTerrain(row, col);
        }
        grid.assignRole(row, col, role);
    }
    
    // ========== Searching ==========
    
    /**
     * Runs A* from Start to End. Rebuilds adjacency and clears the previous
     * run's costs and marks first.
     * 
     * @param listener host callbacks; may be null
     * @return the result, or null if Start or End is not placed (nothing runs)
     * @throws IllegalStateException if a search is already running
     */
    public SearchResult run(SearchListener listener) {
        ensureIdle();
        if (grid.getStart() == null || grid.getEnd() == null) {
            LOG.debug("Run ignored: start={}, end={}", grid.getStart(), grid.getEnd());
            return null;
        }
        
        SearchListener host = listener != null ? listener : SearchListener.NONE;
        running = true;
        try {
            grid.rebuildAdjacency();
            grid.resetSearchState();
            
            AStar search = new AStar(grid, new ManhattanHeuristic(), new StatusTracker(host), config);
            SearchResult result = search.search();
            if (result.outcome == SearchPhase.CANCELLED) {
                status = StatusMessages.CANCELLED;
                host.onStatus(StatusMessages.CANCELLED);
            }
            lastResult = result;
            return result;
        } finally {
            running = false;
        }
    }
    
    private void ensureIdle() {
        if (running) {
            throw new IllegalStateException("Grid cannot be edited while a search is running");
        }
    }
    
    /**
     * Records status messages on the session before passing everything on
     * to the host listener.
     */
    private class StatusTracker implements SearchListener {
        private final SearchListener host;
        
        StatusTracker(SearchListener host) {
            this.host = host;
        }
        
        @Override
        public void onStep(Cell cell) {
            host.onStep(cell);
        }
        
        @Override
        public void onStatus(String message) {
            status = message;
            host.onStatus(message);
        }
        
        @Override
        public boolean isCancelled() {
            return host.isCancelled();
        }
    }
}
