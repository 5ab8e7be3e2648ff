package pathfinder.planning;

import pathfinder.domain.Position;

/**
 * Manhattan distance heuristic: |row1 - row2| + |col1 - col2|.
 * 
 * Admissible for 4-directional movement only while every step costs at least
 * 1.0. Road costs 0.5 per step, so on maps with road this heuristic can
 * overestimate and A* may return a path that is not the cheapest. That is a
 * known property of this search, kept deliberately; do not replace it with a
 * scaled heuristic without changing the expected results.
 */
public class ManhattanHeuristic implements Heuristic {
    
    @Override
    public double estimate(Position from, Position to) {
        return from.manhattanDistance(to);
    }
}
