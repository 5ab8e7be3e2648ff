package pathfinder.planning;

import pathfinder.domain.Position;

import java.util.List;

/**
 * Outcome of a finished search.
 * 
 * On success the path runs from Start to End, both included, and totalCost
 * equals End's g-cost. Failed and cancelled results have an empty path and a
 * NaN cost.
 */
public class SearchResult {
    
    public final SearchPhase outcome;
    public final List<Position> path;
    public final double totalCost;
    
    /** Number of cells expanded (popped and closed) before the search ended */
    public final int expandedCells;
    
    private SearchResult(SearchPhase outcome, List<Position> path, double totalCost, int expandedCells) {
        this.outcome = outcome;
        this.path = path;
        this.totalCost = totalCost;
        this.expandedCells = expandedCells;
    }
    
    public static SearchResult success(List<Position> path, double totalCost, int expandedCells) {
        return new SearchResult(SearchPhase.SUCCEEDED, List.copyOf(path), totalCost, expandedCells);
    }
    
    public static SearchResult failure(int expandedCells) {
        return new SearchResult(SearchPhase.FAILED, List.of(), Double.NaN, expandedCells);
    }
    
    public static SearchResult cancelled(int expandedCells) {
        return new SearchResult(SearchPhase.CANCELLED, List.of(), Double.NaN, expandedCells);
    }
    
    public boolean isFound() {
        return outcome == SearchPhase.SUCCEEDED;
    }
    
    @Override
    public String toString() {
        if (isFound()) {
            return "SearchResult[cost=" + totalCost + ", cells=" + path.size() + ", expanded=" + expandedCells + "]";
        }
        return "SearchResult[" + outcome + ", expanded=" + expandedCells + "]";
    }
}
