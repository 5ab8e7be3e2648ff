package pathfinder.domain;

/**
 * One grid position: its terrain and the A* bookkeeping attached to it.
 * 
 * The search state follows the usual A* naming:
 * - gCost is the best known cost from Start to this cell
 * - hCost is the heuristic estimate from this cell to End
 * - fCost = gCost + hCost
 * 
 * All three default to +infinity. The parent is kept as a {@link Position}
 * rather than a reference to another cell. The open, closed and on-path
 * flags are mutually exclusive; setting one clears the others.
 * 
 * Terrain changes go through {@link Grid#setTerrain}, which also keeps role
 * and adjacency bookkeeping consistent. A cell does not know whether it is
 * Start or End; ask the grid.
 */
public class Cell {
    
    private final Position position;
    
    private Terrain terrain = Terrain.DEFAULT;
    
    private double gCost = Double.POSITIVE_INFINITY;
    private double hCost = Double.POSITIVE_INFINITY;
    private double fCost = Double.POSITIVE_INFINITY;
    
    /** Predecessor on the best known path, null for Start or undiscovered cells */
    private Position parent;
    
    private boolean inOpenSet;
    private boolean inClosedSet;
    private boolean onPath;
    
    Cell(Position position) {
        this.position = position;
    }
    
    public Position getPosition() {
        return position;
    }
    
    public int getRow() {
        return position.row;
    }
    
    public int getCol() {
        return position.col;
    }
    
    public Terrain getTerrain() {
        return terrain;
    }
    
    /** @return cost of stepping onto this cell, infinite for obstacles */
    public double getMovementCost() {
        return terrain.getMovementCost();
    }
    
    public boolean isPassable() {
        return terrain.isPassable();
    }
    
    public double getGCost() { return gCost; }
    
    public double getHCost() { return hCost; }
    
    public double getFCost() { return fCost; }
    
    public Position getParent() { return parent; }
    
    public boolean isInOpenSet() { return inOpenSet; }
    
    public boolean isInClosedSet() { return inClosedSet; }
    
    public boolean isOnPath() { return onPath; }
    
    /**
     * Sets g and h, and derives f = g + h.
     */
    public void updateCosts(double g, double h) {
        this.gCost = g;
        this.hCost = h;
        this.fCost = g + h;
    }
    
    public void setParent(Position parent) {
        this.parent = parent;
    }
    
    public void markOpen() {
        inOpenSet = true;
        inClosedSet = false;
        onPath = false;
    }
    
    public void markClosed() {
        inOpenSet = false;
        inClosedSet = true;
        onPath = false;
    }
    
    public void markOnPath() {
        inOpenSet = false;
        inClosedSet = false;
        onPath = true;
    }
    
    /**
     * Clears the open/closed/on-path flags, leaving costs and parent alone.
     */
    public void clearMarks() {
        inOpenSet = false;
        inClosedSet = false;
        onPath = false;
    }
    
    /**
     * Restores g = h = f = +infinity, no parent, no flags.
     */
    public void resetSearchState() {
        gCost = Double.POSITIVE_INFINITY;
        hCost = Double.POSITIVE_INFINITY;
        fCost = Double.POSITIVE_INFINITY;
        parent = null;
        clearMarks();
    }
    
    void applyTerrain(Terrain terrain) {
        this.terrain = terrain;
        resetSearchState();
    }
    
    /**
     * Marks this cell as the Start of a search: g = 0, no flags.
     */
    void prepareAsStart() {
        gCost = 0;
        clearMarks();
    }
    
    @Override
    public String toString() {
        return "Cell" + position + "[" + terrain.getDisplayName() + ", g=" + format(gCost)
                + ", h=" + format(hCost) + ", f=" + format(fCost) + "]";
    }
    
    private static String format(double cost) {
        return Double.isInfinite(cost) ? "-" : String.valueOf(cost);
    }
}
