package pathfinder.planning;

import pathfinder.domain.Cell;
import pathfinder.domain.Grid;
import pathfinder.domain.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Follows parent links from End back to Start after a successful search and
 * marks the cells in between as on-path. Start and End keep their own marks.
 */
public class PathReconstructor {
    
    private final Grid grid;
    private final SearchListener listener;
    
    public PathReconstructor(Grid grid, SearchListener listener) {
        this.grid = grid;
        this.listener = listener != null ? listener : SearchListener.NONE;
    }
    
    /**
     * Walks the parent chain ending at {@code end}. The listener gets one
     * {@code onStep} per cell visited on the way back.
     * 
     * @param end the cell the walk starts from
     * @return the path ordered from Start to End, both included
     * @throws IllegalStateException if the chain is longer than the grid or
     *         does not end at the grid's Start
     */
    public List<Position> reconstruct(Position end) {
        Position start = grid.getStart();
        List<Position> path = new ArrayList<>();
        path.add(end);
        
        Position parent = grid.getCell(end).getParent();
        while (parent != null) {
            if (path.size() > grid.size()) {
                throw new IllegalStateException("Parent chain from " + end + " contains a cycle");
            }
            Cell cell = grid.getCell(parent);
            if (!parent.equals(start)) {
                cell.markOnPath();
            }
            path.add(parent);
            listener.onStep(cell);
            parent = cell.getParent();
        }
        
        Position first = path.get(path.size() - 1);
        if (!first.equals(start)) {
            throw new IllegalStateException("Parent chain from " + end + " ends at " + first + ", not at Start " + start);
        }
        
        Collections.reverse(path);
        return path;
    }
}
