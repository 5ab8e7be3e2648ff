package pathfinder.planning;

import pathfinder.domain.Position;

/**
 * Interface for heuristic functions used by {@link AStar}.
 * 
 * A heuristic estimates the remaining cost from a position to the goal.
 * A* only guarantees optimal paths when the estimate never exceeds the true
 * remaining cost (admissibility).
 */
public interface Heuristic {
    
    /**
     * Estimates the cost of travelling from one position to another.
     * 
     * @param from the current position
     * @param to the goal position
     * @return estimated remaining cost
     */
    double estimate(Position from, Position to);
}
