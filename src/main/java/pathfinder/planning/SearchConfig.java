package pathfinder.planning;

/**
 * Configuration for grid sessions and searches.
 * Centralizes tunable parameters to avoid hardcoding.
 */
public class SearchConfig {
    
    /** Default number of rows and columns of a fresh grid */
    public static final int DEFAULT_GRID_SIZE = 30;
    
    /** Largest grid a session will create */
    public static final int MAX_GRID_SIZE = 500;
    
    /** Progress logging interval (log every N expanded cells) */
    public static final int DEFAULT_PROGRESS_LOG_INTERVAL = 500;
    
    /** Environment variable that overrides the grid size */
    public static final String GRID_SIZE_ENV = "GRID_SIZE";
    
    private int gridSize = DEFAULT_GRID_SIZE;
    private int progressLogInterval = DEFAULT_PROGRESS_LOG_INTERVAL;
    
    public SearchConfig() {}
    
    public SearchConfig(int gridSize, int progressLogInterval) {
        setGridSize(gridSize);
        setProgressLogInterval(progressLogInterval);
    }
    
    /**
     * Creates a SearchConfig with default values.
     */
    public static SearchConfig defaults() {
        return new SearchConfig();
    }
    
    public int getGridSize() { return gridSize; }
    
    /**
     * @throws IllegalArgumentException if the size is outside 1..MAX_GRID_SIZE
     */
    public void setGridSize(int gridSize) {
        if (gridSize < 1 || gridSize > MAX_GRID_SIZE) {
            throw new IllegalArgumentException("Grid size must be between 1 and " + MAX_GRID_SIZE + ": " + gridSize);
        }
        this.gridSize = gridSize;
    }
    
    public int getProgressLogInterval() { return progressLogInterval; }
    
    /**
     * @throws IllegalArgumentException if the interval is not positive
     */
    public void setProgressLogInterval(int progressLogInterval) {
        if (progressLogInterval < 1) {
            throw new IllegalArgumentException("Progress log interval must be positive: " + progressLogInterval);
        }
        this.progressLogInterval = progressLogInterval;
    }
}
