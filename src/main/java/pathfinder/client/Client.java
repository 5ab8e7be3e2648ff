package pathfinder.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pathfinder.domain.Cell;
import pathfinder.domain.Grid;
import pathfinder.planning.SearchConfig;
import pathfinder.planning.SearchListener;
import pathfinder.planning.SearchResult;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Text front end for the pathfinder.
 * 
 * Reads a map and command script (see {@link GridParser}) from stdin,
 * replays the commands on a {@link GridSession}, runs the search if the
 * script did not, and prints the final grid and status to stdout.
 * 
 * Log output goes to stderr so stdout carries only the rendered result.
 * 
 * Environment Variables:
 * - GRID_SIZE=n : size of the grid when the script gives no map or size
 * - MAX_STEPS=n : cancel a search after n progress steps (0 = no limit)
 */
public class Client {
    
    private static final Logger LOG = LoggerFactory.getLogger(Client.class);
    
    /** Environment variable holding the progress step budget per run */
    public static final String MAX_STEPS_ENV = "MAX_STEPS";
    
    private final BufferedReader in;
    private final PrintStream out;
    private final SearchConfig config;
    private final int maxSteps;
    
    /**
     * Creates a Client with standard I/O streams and environment settings.
     */
    public Client() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
             System.out, configFromEnvironment(), intFromEnvironment(MAX_STEPS_ENV, 0));
    }
    
    /**
     * Creates a Client with custom streams (for testing).
     * 
     * @param in script input
     * @param out rendered output
     * @param config session configuration
     * @param maxSteps progress steps allowed per run before cancelling, 0 for no limit
     */
    public Client(BufferedReader in, PrintStream out, SearchConfig config, int maxSteps) {
        this.in = in;
        this.out = out;
        this.config = config;
        this.maxSteps = maxSteps;
    }
    
    /**
     * Main entry point.
     * 
     * @param args command line arguments (not used)
     */
    public static void main(String[] args) {
        try {
            new Client().run();
        } catch (IOException | RuntimeException e) {
            LOG.error("Client error: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
    
    /**
     * Parses the script, replays it and prints the outcome.
     * 
     * @return the result of the last run, or null if no run happened
     * @throws IOException if reading the script fails
     */
    public SearchResult run() throws IOException {
        GridParser.ParseResult parsed = new GridParser().parse(in, config.getGridSize());
        GridSession session = new GridSession(parsed.grid, config);
        Grid grid = session.getGrid();
        LOG.info("Loaded {}x{} grid, {} commands", grid.getRows(), grid.getCols(), parsed.commands.size());
        
        StepBudget listener = new StepBudget(maxSteps);
        boolean ran = false;
        for (SessionCommand command : parsed.commands) {
            LOG.debug("> {}", command);
            if (command.type == SessionCommand.Type.RUN) {
                listener.reset();
                ran = true;
            }
            command.apply(session, listener);
        }
        if (!ran) {
            session.run(listener);
        }
        
        SearchResult result = session.getLastResult();
        out.print(session.getGrid().toGridString());
        out.println(session.getStatus());
        if (result != null && result.isFound()) {
            out.println("Path: " + result.path);
        }
        out.flush();
        return result;
    }
    
    static SearchConfig configFromEnvironment() {
        SearchConfig config = SearchConfig.defaults();
        int size = intFromEnvironment(SearchConfig.GRID_SIZE_ENV, SearchConfig.DEFAULT_GRID_SIZE);
        config.setGridSize(size);
        return config;
    }
    
    private static int intFromEnvironment(String name, int fallback) {
        String value = System.getenv(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring {}={}: not a number", name, value);
            return fallback;
        }
    }
    
    /**
     * Cancels a run once it has reported a fixed number of progress steps.
     * Path reconstruction steps are counted too, but cancellation is only
     * polled between expansions, so a path that is found is always completed.
     */
    static class StepBudget implements SearchListener {
        private final int maxSteps;
        private int steps;
        
        StepBudget(int maxSteps) {
            this.maxSteps = maxSteps;
        }
        
        void reset() {
            steps = 0;
        }
        
        @Override
        public void onStep(Cell cell) {
            steps++;
        }
        
        @Override
        public void onStatus(String message) {
            LOG.info(message);
        }
        
        @Override
        public boolean isCancelled() {
            return maxSteps > 0 && steps >= maxSteps;
        }
    }
}
