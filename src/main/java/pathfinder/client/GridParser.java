package pathfinder.client;

import pathfinder.domain.Grid;
import pathfinder.domain.Role;
import pathfinder.domain.Terrain;
import pathfinder.planning.SearchConfig;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses a text map and an optional command script.
 * 
 * Format:
 * <pre>
 * #size
 * 5
 * #map
 * S..+.
 * .==+.
 * ...+E
 * #commands
 * brush road
 * mode flood_fill
 * click 1 1
 * run
 * #end
 * </pre>
 * 
 * Map symbols:
 * - '.' : Grass
 * - '=' : Road
 * - ':' : Dirt
 * - '~' : Water
 * - '+' : Obstacle
 * - 'S' : Start (on grass)
 * - 'E' : End (on grass)
 * 
 * {@code #size} takes "n" or "rows cols" and is only required when there is
 * no {@code #map} section. Either dimension must lie in
 * 1..{@link SearchConfig#MAX_GRID_SIZE}, for {@code #size} and {@code #map} alike. Lines starting with "//" are ignored in
 * {@code #commands}.
 */
public class GridParser {
    
    /**
     * Result of parsing: the grid and the commands to replay on it.
     */
    public static class ParseResult {
        public final Grid grid;
        public final List<SessionCommand> commands;
        
        public ParseResult(Grid grid, List<SessionCommand> commands) {
            this.grid = grid;
            this.commands = List.copyOf(commands);
        }
    }
    
    /**
     * Parses a map from a BufferedReader.
     * Reads until the #end marker or end of stream.
     * 
     * @param reader the reader to read from
     * @param defaultSize grid size used when neither #size nor #map is given
     * @return ParseResult containing the grid and commands
     * @throws IOException if reading fails
     * @throws IllegalArgumentException if the map or a command is malformed
     */
    public ParseResult parse(BufferedReader reader, int defaultSize) throws IOException {
        String line;
        int[] size = null;
        List<String> mapLines = new ArrayList<>();
        int mapStartLine = 0;
        List<SessionCommand> commands = new ArrayList<>();
        
        String currentSection = null;
        int lineNumber = 0;
        
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.startsWith("#")) {
                currentSection = line.substring(1).trim().toLowerCase();
                if (currentSection.equals("end")) {
                    break;
                }
                continue;
            }
            
            if (currentSection == null) {
                continue;
            }
            
            switch (currentSection) {
                case "size":
                    if (!line.isBlank()) {
                        size = parseSize(line, lineNumber);
                    }
                    break;
                    
                case "map":
                    if (!line.isBlank()) {
                        if (mapLines.isEmpty()) {
                            mapStartLine = lineNumber;
                        }
                        mapLines.add(line.strip());
                    }
                    break;
                    
                case "commands":
                    String trimmed = line.trim();
                    if (!trimmed.isEmpty() && !trimmed.startsWith("//")) {
                        commands.add(parseCommand(trimmed, lineNumber));
                    }
                    break;
                    
                default:
                    throw new IllegalArgumentException("Unknown section '#" + currentSection + "' at line " + lineNumber);
            }
        }
        
        Grid grid;
        if (!mapLines.isEmpty()) {
            grid = parseMap(mapLines, mapStartLine);
            if (size != null && (size[0] != grid.getRows() || size[1] != grid.getCols())) {
                throw new IllegalArgumentException("#size " + size[0] + "x" + size[1]
                        + " does not match map " + grid.getRows() + "x" + grid.getCols());
            }
        } else if (size != null) {
            grid = new Grid(size[0], size[1]);
        } else {
            grid = new Grid(defaultSize);
        }
        
        validateCommands(commands, grid);
        return new ParseResult(grid, commands);
    }
    
    /**
     * Parses a map from a string (for tests and embedded maps).
     */
    public ParseResult parse(String text, int defaultSize) throws IOException {
        return parse(new BufferedReader(new StringReader(text)), defaultSize);
    }
    
    private int[] parseSize(String line, int lineNumber) {
        String[] parts = line.trim().split("\\s+");
        int[] size;
        try {
            if (parts.length == 1) {
                int n = Integer.parseInt(parts[0]);
                size = new int[] {n, n};
            } else if (parts.length == 2) {
                size = new int[] {Integer.parseInt(parts[0]), Integer.parseInt(parts[1])};
            } else {
                throw new IllegalArgumentException("Invalid size at line " + lineNumber + ": " + line);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid size at line " + lineNumber + ": " + line, e);
        }
        checkSize(size[0], size[1], lineNumber);
        return size;
    }
    
    private static void checkSize(int rows, int cols, int lineNumber) {
        int max = SearchConfig.MAX_GRID_SIZE;
        if (rows < 1 || rows > max || cols < 1 || cols > max) {
            throw new IllegalArgumentException("Grid size " + rows + "x" + cols + " at line " + lineNumber
                    + " is outside 1.." + max);
        }
    }
    
    private Grid parseMap(List<String> mapLines, int startLine) {
        int rows = mapLines.size();
        int cols = mapLines.get(0).length();
        checkSize(rows, cols, startLine);
        Grid grid = new Grid(rows, cols);
        
        boolean seenStart = false;
        boolean seenEnd = false;
        for (int r = 0; r < rows; r++) {
            String row = mapLines.get(r);
            if (row.length() != cols) {
                throw new IllegalArgumentException("Map row " + r + " has " + row.length()
                        + " columns, expected " + cols);
            }
            for (int c = 0; c < cols; c++) {
                char ch = row.charAt(c);
                if (ch == 'S' || ch == 'E') {
                    Role role = ch == 'S' ? Role.START : Role.END;
                    boolean seen = role == Role.START ? seenStart : seenEnd;
                    if (seen) {
                        throw new IllegalArgumentException("Duplicate " + role + " at (" + r + "," + c + ")");
                    }
                    grid.assignRole(r, c, role);
                    if (role == Role.START) {
                        seenStart = true;
                    } else {
                        seenEnd = true;
                    }
                    continue;
                }
                try {
                    grid.setTerrain(r, c, Terrain.fromSymbol(ch));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException(e.getMessage() + " at (" + r + "," + c + ")", e);
                }
            }
        }
        return grid;
    }
    
    private SessionCommand parseCommand(String line, int lineNumber) {
        String[] parts = line.split("\\s+");
        String name = parts[0].toLowerCase();
        try {
            return switch (name) {
                case "brush" -> SessionCommand.brush(Brush.fromString(argument(parts, 1)));
                case "mode" -> SessionCommand.mode(PaintMode.fromString(argument(parts, 1)));
                case "click" -> SessionCommand.click(intArgument(parts, 1), intArgument(parts, 2));
                case "drag" -> SessionCommand.drag(intArgument(parts, 1), intArgument(parts, 2));
                case "erase" -> SessionCommand.erase(intArgument(parts, 1), intArgument(parts, 2));
                case "clear" -> SessionCommand.clear();
                case "run" -> SessionCommand.run();
                default -> throw new IllegalArgumentException("Unknown command '" + parts[0] + "'");
            };
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Line " + lineNumber + ": " + e.getMessage(), e);
        }
    }
    
    private static String argument(String[] parts, int index) {
        if (index >= parts.length) {
            throw new IllegalArgumentException("Missing argument " + index + " for '" + parts[0] + "'");
        }
        return parts[index];
    }
    
    private static int intArgument(String[] parts, int index) {
        String arg = argument(parts, index);
        try {
            return Integer.parseInt(arg);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: '" + arg + "'", e);
        }
    }
    
    /**
     * Coordinates are checked against the initial grid here so a bad script
     * fails before anything runs. {@code clear} keeps the grid size, so the
     * bounds hold for the whole script.
     */
    private void validateCommands(List<SessionCommand> commands, Grid grid) {
        for (SessionCommand command : commands) {
            boolean targetsCell = command.type == SessionCommand.Type.CLICK
                    || command.type == SessionCommand.Type.DRAG
                    || command.type == SessionCommand.Type.ERASE;
            if (targetsCell && !grid.isInBounds(command.row, command.col)) {
                throw new IllegalArgumentException("Command '" + command + "' is outside the "
                        + grid.getRows() + "x" + grid.getCols() + " grid");
            }
        }
    }
}
