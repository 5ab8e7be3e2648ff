package pathfinder.client;

import pathfinder.domain.Role;
import pathfinder.domain.Terrain;

/**
 * What a click on the grid paints: one of the two roles, or a terrain.
 */
public enum Brush {
    START(Role.START, null),
    END(Role.END, null),
    GRASS(null, Terrain.GRASS),
    ROAD(null, Terrain.ROAD),
    DIRT(null, Terrain.DIRT),
    WATER(null, Terrain.WATER),
    OBSTACLE(null, Terrain.OBSTACLE);
    
    private final Role role;
    private final Terrain terrain;
    
    Brush(Role role, Terrain terrain) {
        this.role = role;
        this.terrain = terrain;
    }
    
    /** @return the role this brush places, or null for terrain brushes */
    public Role getRole() {
        return role;
    }
    
    /** @return the terrain this brush paints, or null for role brushes */
    public Terrain getTerrain() {
        return terrain;
    }
    
    public boolean isRole() {
        return role != null;
    }
    
    /**
     * Name used in status messages: "Start", "End", or the terrain's display name.
     */
    public String getDisplayName() {
        return isRole() ? (role == Role.START ? "Start" : "End") : terrain.getDisplayName();
    }
    
    /**
     * Parses a brush name (case-insensitive): "start", "end" or a terrain name.
     * 
     * @throws IllegalArgumentException if the name is not recognized
     */
    public static Brush fromString(String s) {
        String name = s.trim().toLowerCase();
        if (name.equals("start")) return START;
        if (name.equals("end")) return END;
        return forTerrain(Terrain.fromString(name));
    }
    
    public static Brush forTerrain(Terrain terrain) {
        return switch (terrain) {
            case GRASS -> GRASS;
            case ROAD -> ROAD;
            case DIRT -> DIRT;
            case WATER -> WATER;
            case OBSTACLE -> OBSTACLE;
        };
    }
}
