package pathfinder.planning;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import pathfinder.domain.Cell;
import pathfinder.domain.Grid;
import pathfinder.domain.Position;
import pathfinder.domain.Role;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PathReconstructorTest {

    private Grid grid;

    @BeforeEach
    void setUp() {
        grid = new Grid(1, 4);
        grid.assignRole(0, 0, Role.START);
        grid.assignRole(0, 3, Role.END);
    }

    private void link(int col, int parentCol) {
        grid.getCell(0, col).setParent(Position.of(0, parentCol));
    }

    @Test
    void testReturnsStartToEndAndMarksInterior() {
        link(1, 0);
        link(2, 1);
        link(3, 2);
        List<Position> visited = new ArrayList<>();

        List<Position> path = new PathReconstructor(grid, new SearchListener() {
            @Override
            public void onStep(Cell cell) {
                visited.add(cell.getPosition());
            }
        }).reconstruct(Position.of(0, 3));

        assertEquals(List.of(Position.of(0, 0), Position.of(0, 1), Position.of(0, 2), Position.of(0, 3)), path);
        assertEquals(List.of(Position.of(0, 2), Position.of(0, 1), Position.of(0, 0)), visited);
        assertTrue(grid.getCell(0, 1).isOnPath());
        assertTrue(grid.getCell(0, 2).isOnPath());
        assertFalse(grid.getCell(0, 0).isOnPath());
        assertFalse(grid.getCell(0, 3).isOnPath());
    }

    @Test
    void testCycleDetected() {
        link(3, 2);
        link(2, 1);
        link(1, 2);
        PathReconstructor reconstructor = new PathReconstructor(grid, null);
        assertThrows(IllegalStateException.class, () -> reconstructor.reconstruct(Position.of(0, 3)));
    }

    @Test
    void testChainMustReachStart() {
        link(3, 2);
        PathReconstructor reconstructor = new PathReconstructor(grid, SearchListener.NONE);
        assertThrows(IllegalStateException.class, () -> reconstructor.reconstruct(Position.of(0, 3)));
    }
}
