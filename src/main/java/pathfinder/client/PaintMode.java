package pathfinder.client;

/**
 * How a terrain brush applies on click.
 */
public enum PaintMode {
    /** Paint only the clicked cell; dragging keeps painting */
    SINGLE_TILE,
    
    /** Repaint the whole same-terrain region around the clicked cell */
    FLOOD_FILL;
    
    /** @return label used in status messages, e.g. "SINGLE TILE" */
    public String getLabel() {
        return name().replace('_', ' ');
    }
    
    /**
     * @throws IllegalArgumentException if the name is not recognized
     */
    public static PaintMode fromString(String s) {
        return switch (s.trim().toUpperCase().replace(' ', '_')) {
            case "SINGLE_TILE", "SINGLE" -> SINGLE_TILE;
            case "FLOOD_FILL", "FLOOD" -> FLOOD_FILL;
            default -> throw new IllegalArgumentException("Unknown paint mode: " + s);
        };
    }
}
