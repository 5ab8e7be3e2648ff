package pathfinder.domain;

/**
 * Designation a cell can hold. At most one cell per role exists on a grid,
 * and the {@link Grid} is the only place that records who holds it.
 */
public enum Role {
    START("Start Node"),
    END("End Node");
    
    private final String label;
    
    Role(String label) {
        this.label = label;
    }
    
    public String getLabel() {
        return label;
    }
    
    /** @return the other role */
    public Role other() {
        return this == START ? END : START;
    }
}
