package pathfinder.planning;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import pathfinder.domain.Cell;
import pathfinder.domain.DisplayState;
import pathfinder.domain.Grid;
import pathfinder.domain.Position;
import pathfinder.domain.Role;
import pathfinder.domain.Terrain;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("A* search")
class AStarTest {

    /** Records every callback the search makes */
    private static class RecordingListener implements SearchListener {
        final List<Position> steps = new ArrayList<>();
        final List<String> statuses = new ArrayList<>();
        int cancelAfter = -1;

        @Override
        public void onStep(Cell cell) {
            steps.add(cell.getPosition());
        }

        @Override
        public void onStatus(String message) {
            statuses.add(message);
        }

        @Override
        public boolean isCancelled() {
            return cancelAfter >= 0 && steps.size() >= cancelAfter;
        }
    }

    private static Grid grid(int size, int startRow, int startCol, int endRow, int endCol) {
        Grid grid = new Grid(size);
        grid.assignRole(startRow, startCol, Role.START);
        grid.assignRole(endRow, endCol, Role.END);
        return grid;
    }

    /** Builds a grid from map rows: terrain symbols plus 'S' and 'E' on grass */
    private static Grid grid(String... rows) {
        Grid grid = new Grid(rows.length, rows[0].length());
        for (int r = 0; r < rows.length; r++) {
            for (int c = 0; c < rows[r].length(); c++) {
                char ch = rows[r].charAt(c);
                if (ch == 'S') {
                    grid.assignRole(r, c, Role.START);
                } else if (ch == 'E') {
                    grid.assignRole(r, c, Role.END);
                } else {
                    grid.setTerrain(r, c, Terrain.fromSymbol(ch));
                }
            }
        }
        return grid;
    }

    private static SearchResult search(Grid grid, SearchListener listener) {
        grid.rebuildAdjacency();
        return new AStar(grid, listener).search();
    }

    @Nested
    @DisplayName("Successful searches")
    class SuccessTests {

        @Test
        @DisplayName("5x5 grass from (0,0) to (4,4): 9 cells, cost 8.0")
        void testOpenGridScenario() {
            Grid grid = grid(5, 0, 0, 4, 4);
            RecordingListener listener = new RecordingListener();

            SearchResult result = search(grid, listener);

            assertEquals(SearchPhase.SUCCEEDED, result.outcome);
            assertEquals(9, result.path.size());
            assertEquals(8.0, result.totalCost);
            assertEquals(Position.of(0, 0), result.path.get(0));
            assertEquals(Position.of(4, 4), result.path.get(8));
            assertEquals(List.of(StatusMessages.RUNNING, "Path Found! Cost: 8.0"), listener.statuses);
        }

        @Test
        @DisplayName("On uniform grass the cost equals the Manhattan distance")
        void testUniformCostEqualsManhattan() {
            int[][] pairs = {{0, 0, 6, 6}, {3, 1, 0, 5}, {6, 6, 6, 0}, {2, 2, 2, 3}, {5, 0, 1, 4}};
            for (int[] p : pairs) {
                Grid grid = grid(7, p[0], p[1], p[2], p[3]);
                SearchResult result = search(grid, SearchListener.NONE);
                int manhattan = Position.of(p[0], p[1]).manhattanDistance(Position.of(p[2], p[3]));
                assertTrue(result.isFound());
                assertEquals(manhattan, result.totalCost, 1e-9);
                assertEquals(manhattan + 1, result.path.size());
            }
        }

        @Test
        @DisplayName("Path is 4-adjacent with increasing g and cost equal to End's g")
        void testPathIsContiguous() {
            Grid grid = new Grid(6);
            grid.setTerrain(1, 1, Terrain.WATER);
            grid.setTerrain(1, 2, Terrain.WATER);
            grid.setTerrain(2, 3, Terrain.OBSTACLE);
            grid.setTerrain(3, 3, Terrain.OBSTACLE);
            grid.setTerrain(4, 1, Terrain.DIRT);
            grid.setTerrain(4, 2, Terrain.ROAD);
            grid.setTerrain(5, 3, Terrain.ROAD);
            grid.assignRole(0, 0, Role.START);
            grid.assignRole(5, 5, Role.END);

            SearchResult result = search(grid, SearchListener.NONE);

            assertTrue(result.isFound());
            double summed = 0;
            for (int i = 1; i < result.path.size(); i++) {
                Position prev = result.path.get(i - 1);
                Position next = result.path.get(i);
                assertTrue(prev.isCardinallyAdjacentTo(next), prev + " -> " + next);
                assertTrue(grid.getCell(next).getGCost() >= grid.getCell(prev).getGCost());
                summed += grid.getCell(next).getMovementCost();
            }
            assertEquals(summed, result.totalCost, 1e-9);
            assertEquals(grid.getCell(5, 5).getGCost(), result.totalCost);
        }

        @Test
        @DisplayName("Road steps cost half")
        void testRoadCost() {
            Grid grid = grid(5, 0, 0, 0, 4);
            for (int c = 1; c < 4; c++) {
                grid.setTerrain(0, c, Terrain.ROAD);
            }

            SearchResult result = search(grid, SearchListener.NONE);

            assertEquals(2.5, result.totalCost, 1e-9);
            assertEquals(List.of(Position.of(0, 0), Position.of(0, 1), Position.of(0, 2), Position.of(0, 3),
                    Position.of(0, 4)), result.path);
        }

        @Test
        @DisplayName("Path cells are marked, Start and End keep their roles on display")
        void testPathMarking() {
            Grid grid = grid(5, 0, 0, 4, 4);
            SearchResult result = search(grid, SearchListener.NONE);

            for (Position pos : result.path.subList(1, result.path.size() - 1)) {
                assertTrue(grid.getCell(pos).isOnPath());
                assertEquals(DisplayState.PATH, grid.displayStateAt(pos.row, pos.col));
            }
            assertFalse(grid.getCell(0, 0).isOnPath());
            assertTrue(grid.getCell(0, 0).isInClosedSet());
            assertEquals(DisplayState.START, grid.displayStateAt(0, 0));
            assertEquals(DisplayState.END, grid.displayStateAt(4, 4));
        }

        @Test
        @DisplayName("Identical grids expand in identical order")
        void testDeterministicExpansion() {
            RecordingListener first = new RecordingListener();
            RecordingListener second = new RecordingListener();

            SearchResult a = search(grid(8, 1, 1, 6, 5), first);
            SearchResult b = search(grid(8, 1, 1, 6, 5), second);

            assertEquals(first.steps, second.steps);
            assertEquals(a.path, b.path);
            assertEquals(a.expandedCells, b.expandedCells);
        }

        @Test
        @DisplayName("Progress is reported once per expansion and once per path step")
        void testProgressCallbacks() {
            Grid grid = grid(5, 0, 0, 0, 4);
            RecordingListener listener = new RecordingListener();

            SearchResult result = search(grid, listener);

            int pathSteps = result.path.size() - 1;
            assertEquals(result.expandedCells + pathSteps, listener.steps.size());
            assertEquals(Position.of(0, 0), listener.steps.get(0));
        }
    }

    @Nested
    @DisplayName("Open and closed set policy")
    class OpenSetPolicyTests {

        @Test
        @DisplayName("Equal f values are expanded in insertion order")
        void testTieBreakByInsertionOrder() {
            // From (1,1) East, West, South, North are pushed in that order.
            // West (1,0) and North (0,1) both have f = 2; West went in first.
            Grid grid = grid(3, 1, 1, 0, 0);
            RecordingListener listener = new RecordingListener();

            SearchResult result = search(grid, listener);

            assertEquals(3, result.expandedCells);
            assertEquals(List.of(Position.of(1, 1), Position.of(1, 0), Position.of(0, 1)),
                    listener.steps.subList(0, 3));
            assertEquals(List.of(Position.of(1, 1), Position.of(1, 0), Position.of(0, 0)), result.path);
            assertEquals(2.0, result.totalCost);
        }

        @Test
        @DisplayName("A cell improved while open is expanded once; its stale entry is skipped")
        void testStaleEntrySkipped() {
            // The road cells (0,1) and (0,2) are first reached from the dirt row
            // and improved later from (0,0) and (0,1). End is walled in, so the
            // open set drains and both stale entries get popped.
            Grid grid = grid(
                    "====+",
                    "S:.+E");
            RecordingListener listener = new RecordingListener();

            SearchResult result = search(grid, listener);

            assertEquals(SearchPhase.FAILED, result.outcome);
            assertEquals(7, result.expandedCells);
            assertEquals(List.of(Position.of(1, 0), Position.of(1, 1), Position.of(1, 2), Position.of(0, 0),
                    Position.of(0, 1), Position.of(0, 2), Position.of(0, 3)), listener.steps);
            assertEquals(1.0, grid.getCell(0, 1).getGCost());
            assertEquals(Position.of(0, 0), grid.getCell(0, 1).getParent());
            assertEquals(1.5, grid.getCell(0, 2).getGCost());
            assertEquals(Position.of(0, 1), grid.getCell(0, 2).getParent());
        }

        @Test
        @DisplayName("A closed cell is never reopened, even when a cheaper route turns up")
        void testClosedCellIsFinal() {
            // (1,2) closes with g = 3 via the dirt cell. The road route reaches it
            // later for 2.5, which the Manhattan estimate hid by overrating roads.
            Grid grid = grid(
                    "=====",
                    "S:.+E");
            RecordingListener listener = new RecordingListener();

            SearchResult result = search(grid, listener);

            assertEquals(SearchPhase.SUCCEEDED, result.outcome);
            assertEquals(8, result.expandedCells);
            assertEquals(3.5, result.totalCost, 1e-9);
            assertEquals(List.of(Position.of(1, 0), Position.of(0, 0), Position.of(0, 1), Position.of(0, 2),
                    Position.of(0, 3), Position.of(0, 4), Position.of(1, 4)), result.path);

            Cell closed = grid.getCell(1, 2);
            assertTrue(closed.isInClosedSet());
            assertEquals(3.0, closed.getGCost());
            assertEquals(Position.of(1, 1), closed.getParent());
            long expansionsOfClosed = listener.steps.subList(0, result.expandedCells).stream()
                    .filter(Position.of(1, 2)::equals)
                    .count();
            assertEquals(1, expansionsOfClosed);
        }

        @Test
        @DisplayName("The Manhattan estimate can settle on a costlier route than the cheapest")
        void testInadmissibleEstimateKept() {
            // Straight through dirt and grass costs 5; the road detour costs 3.5
            Grid grid = grid(
                    "=====",
                    "S:..E");

            SearchResult result = search(grid, SearchListener.NONE);

            assertEquals(5.0, result.totalCost, 1e-9);
            assertEquals(4, result.expandedCells);
            assertEquals(List.of(Position.of(1, 0), Position.of(1, 1), Position.of(1, 2), Position.of(1, 3),
                    Position.of(1, 4)), result.path);
        }
    }

    @Nested
    @DisplayName("Failed searches")
    class FailureTests {

        @Test
        @DisplayName("An obstacle row between Start and End makes the search fail")
        void testWallScenario() {
            Grid grid = grid(5, 0, 0, 4, 0);
            for (int c = 0; c < 5; c++) {
                grid.setTerrain(2, c, Terrain.OBSTACLE);
            }
            RecordingListener listener = new RecordingListener();

            SearchResult result = search(grid, listener);

            assertEquals(SearchPhase.FAILED, result.outcome);
            assertTrue(result.path.isEmpty());
            assertTrue(Double.isNaN(result.totalCost));
            assertEquals(10, result.expandedCells);
            assertEquals(StatusMessages.NOT_FOUND, listener.statuses.get(listener.statuses.size() - 1));
        }

        @Test
        @DisplayName("An obstacle column between Start and End makes the search fail")
        void testColumnWall() {
            Grid grid = grid(6, 3, 0, 3, 5);
            for (int r = 0; r < 6; r++) {
                grid.setTerrain(r, 2, Terrain.OBSTACLE);
            }
            assertFalse(search(grid, SearchListener.NONE).isFound());
        }
    }

    @Nested
    @DisplayName("Cancellation and preconditions")
    class LifecycleTests {

        @Test
        @DisplayName("Cancellation stops the search and leaves marks in place")
        void testCancellation() {
            Grid grid = grid(5, 0, 0, 4, 4);
            RecordingListener listener = new RecordingListener();
            listener.cancelAfter = 3;
            grid.rebuildAdjacency();
            AStar search = new AStar(grid, listener);

            SearchResult result = search.search();

            assertEquals(SearchPhase.CANCELLED, result.outcome);
            assertEquals(SearchPhase.CANCELLED, search.getPhase());
            assertEquals(3, result.expandedCells);
            assertTrue(result.path.isEmpty());
            assertFalse(listener.statuses.contains(StatusMessages.NOT_FOUND));
            long open = grid.getCells().stream().filter(Cell::isInOpenSet).count();
            long closed = grid.getCells().stream().filter(Cell::isInClosedSet).count();
            assertEquals(3, closed);
            assertTrue(open > 0);
        }

        @Test
        void testPhases() {
            Grid grid = grid(3, 0, 0, 2, 2);
            grid.rebuildAdjacency();
            AStar search = new AStar(grid, SearchListener.NONE);
            assertEquals(SearchPhase.UNSTARTED, search.getPhase());

            search.search();

            assertEquals(SearchPhase.SUCCEEDED, search.getPhase());
            assertTrue(search.getPhase().isTerminal());
            assertThrows(IllegalStateException.class, search::search);
        }

        @Test
        void testMissingEndRejected() {
            Grid grid = new Grid(3);
            grid.assignRole(0, 0, Role.START);
            grid.rebuildAdjacency();
            assertThrows(IllegalStateException.class, () -> new AStar(grid, SearchListener.NONE).search());
        }

        @Test
        void testStaleAdjacencyRejected() {
            Grid grid = grid(3, 0, 0, 2, 2);
            grid.rebuildAdjacency();
            grid.setTerrain(1, 1, Terrain.DIRT);
            assertThrows(IllegalStateException.class, () -> new AStar(grid, SearchListener.NONE).search());
        }
    }
}
