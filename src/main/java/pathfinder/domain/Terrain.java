package pathfinder.domain;

/**
 * Catalog of terrain kinds a cell can be painted with.
 * 
 * Each kind has a movement-cost multiplier paid when a path steps onto a cell
 * of that kind. OBSTACLE has an infinite cost, which is the sentinel for
 * "impassable": obstacle cells never appear in adjacency lists.
 * 
 * Road is cheaper than one step, which makes the Manhattan heuristic
 * inadmissible on maps that contain road (see {@code ManhattanHeuristic}).
 */
public enum Terrain {
    GRASS("Grass", '.', 0x228B22, 1.0),
    ROAD("Road", '=', 0xA0A0A0, 0.5),
    DIRT("Dirt", ':', 0x8B4513, 2.0),
    WATER("Water", '~', 0x1E90FF, 5.0),
    OBSTACLE("Obstacle", '+', 0x323232, Double.POSITIVE_INFINITY);
    
    /** Terrain every cell starts with, and the one the erase brush paints */
    public static final Terrain DEFAULT = GRASS;
    
    private final String displayName;
    private final char symbol;
    private final int rgb;
    private final double movementCost;
    
    Terrain(String displayName, char symbol, int rgb, double movementCost) {
        this.displayName = displayName;
        this.symbol = symbol;
        this.rgb = rgb;
        this.movementCost = movementCost;
    }
    
    /** @return human readable name shown in legends and status messages */
    public String getDisplayName() {
        return displayName;
    }
    
    /** @return the character used for this terrain in text maps */
    public char getSymbol() {
        return symbol;
    }
    
    /** @return display colour packed as 0xRRGGBB */
    public int getRgb() {
        return rgb;
    }
    
    /** @return cost of stepping onto a cell of this terrain, infinite for obstacles */
    public double getMovementCost() {
        return movementCost;
    }
    
    public boolean isPassable() {
        return !Double.isInfinite(movementCost);
    }
    
    /**
     * Legend label, e.g. "Road (Cost: 0.5)". Obstacles show the bare name.
     */
    public String getLabel() {
        return isPassable() ? displayName + " (Cost: " + movementCost + ")" : displayName;
    }
    
    /**
     * Parses a terrain from its name (case-insensitive).
     * 
     * @param s the terrain name, e.g. "road" or "WATER"
     * @return the corresponding Terrain
     * @throws IllegalArgumentException if the name is not recognized
     */
    public static Terrain fromString(String s) {
        return switch (s.trim().toLowerCase()) {
            case "grass" -> GRASS;
            case "road" -> ROAD;
            case "dirt" -> DIRT;
            case "water" -> WATER;
            case "obstacle", "wall" -> OBSTACLE;
            default -> throw new IllegalArgumentException("Unknown terrain: " + s);
        };
    }
    
    /**
     * Parses a terrain from its map symbol.
     * 
     * @param symbol one of {@code . = : ~ +}
     * @return the corresponding Terrain
     * @throws IllegalArgumentException if the symbol is not a terrain symbol
     */
    public static Terrain fromSymbol(char symbol) {
        for (Terrain terrain : values()) {
            if (terrain.symbol == symbol) {
                return terrain;
            }
        }
        throw new IllegalArgumentException("Unknown terrain symbol: '" + symbol + "'");
    }
}
