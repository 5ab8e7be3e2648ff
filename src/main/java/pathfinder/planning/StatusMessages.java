package pathfinder.planning;

import java.util.Locale;

/**
 * Status lines shown to the user as a session moves between states.
 */
public final class StatusMessages {
    
    public static final String READY = "Select Brush & Paint Mode";
    public static final String RUNNING = "Algorithm Running...";
    public static final String NOT_FOUND = "Path Not Found.";
    public static final String CANCELLED = "Search Cancelled.";
    public static final String CLEARED = "Grid Cleared! Select Brush & Paint Mode.";
    
    private StatusMessages() {}
    
    /**
     * @param cost total path cost
     * @return e.g. "Path Found! Cost: 8.0"
     */
    public static String found(double cost) {
        return String.format(Locale.ROOT, "Path Found! Cost: %.1f", cost);
    }
}
