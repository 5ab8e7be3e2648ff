package pathfinder.planning.fill;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pathfinder.domain.Direction;
import pathfinder.domain.Grid;
import pathfinder.domain.Position;
import pathfinder.domain.Terrain;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Queue;
import java.util.Set;

/**
 * Flood-fill repaint of a contiguous same-terrain region.
 * 
 * Starting from a seed cell, a breadth-first walk visits every 4-connected
 * cell whose terrain equals the seed's original terrain and repaints it
 * through {@link Grid#setTerrain}, so each repainted cell also has its
 * search state reset. Start and End are never repainted and do not carry
 * the fill past them.
 * 
 * An obstacle region can be filled with obstacle only; filling other
 * terrain with obstacle is allowed.
 */
public class RegionFill {
    
    private static final Logger LOG = LoggerFactory.getLogger(RegionFill.class);
    
    private final Grid grid;
    
    public RegionFill(Grid grid) {
        this.grid = grid;
    }
    
    /**
     * Repaints the region around (seedRow, seedCol) with {@code target}.
     * 
     * Does nothing and returns false when the seed is Start or End, the seed
     * already has the target terrain, or the seed is an obstacle and the
     * target is not.
     * 
     * @param seedRow row of the seed cell
     * @param seedCol column of the seed cell
     * @param target the terrain to paint
     * @return true if at least one cell was repainted
     * @throws pathfinder.domain.OutOfBoundsException if the seed is outside the grid
     */
    public boolean fill(int seedRow, int seedCol, Terrain target) {
        Position seed = grid.getCell(seedRow, seedCol).getPosition();
        Terrain original = grid.getTerrain(seedRow, seedCol);
        
        if (!canRepaint(seed, original, target)) {
            LOG.debug("Fill from {} with {} skipped", seed, target);
            return false;
        }
        
        Queue<Position> queue = new ArrayDeque<>();
        Set<Position> visited = new HashSet<>();
        queue.add(seed);
        visited.add(seed);
        int repainted = 0;
        
        while (!queue.isEmpty()) {
            Position current = queue.poll();
            
            // Re-check on dequeue; enqueue-time checks should already hold
            if (!canRepaint(current, original, target)) {
                continue;
            }
            
            grid.setTerrain(current.row, current.col, target);
            repainted++;
            
            for (Direction dir : Direction.NEIGHBOR_ORDER) {
                Position next = current.move(dir);
                if (!grid.isInBounds(next) || visited.contains(next)) {
                    continue;
                }
                if (canRepaint(next, original, target)) {
                    visited.add(next);
                    queue.add(next);
                }
            }
        }
        
        LOG.debug("Filled {} cells from {} ({} -> {})", repainted, seed, original, target);
        return repainted > 0;
    }
    
    /**
     * The checks applied to the seed and to every cell before it joins the region.
     */
    private boolean canRepaint(Position pos, Terrain original, Terrain target) {
        Terrain terrain = grid.getTerrain(pos.row, pos.col);
        if (terrain != original || terrain == target) {
            return false;
        }
        if (grid.hasRole(pos)) {
            return false;
        }
        return terrain.isPassable() || !target.isPassable();
    }
}
