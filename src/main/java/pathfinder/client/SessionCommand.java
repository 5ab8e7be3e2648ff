package pathfinder.client;

import pathfinder.planning.SearchListener;

/**
 * One scripted input event for a {@link GridSession}, as read from the
 * {@code #commands} section of a map file.
 */
public class SessionCommand {
    
    /**
     * Type of command.
     */
    public enum Type {
        BRUSH,
        MODE,
        CLICK,
        DRAG,
        ERASE,
        CLEAR,
        RUN
    }
    
    public final Type type;
    
    /** Target row for CLICK, DRAG and ERASE, -1 otherwise */
    public final int row;
    
    /** Target column for CLICK, DRAG and ERASE, -1 otherwise */
    public final int col;
    
    /** Brush for BRUSH, null otherwise */
    public final Brush brush;
    
    /** Paint mode for MODE, null otherwise */
    public final PaintMode paintMode;
    
    private SessionCommand(Type type, int row, int col, Brush brush, PaintMode paintMode) {
        this.type = type;
        this.row = row;
        this.col = col;
        this.brush = brush;
        this.paintMode = paintMode;
    }
    
    public static SessionCommand brush(Brush brush) {
        return new SessionCommand(Type.BRUSH, -1, -1, brush, null);
    }
    
    public static SessionCommand mode(PaintMode paintMode) {
        return new SessionCommand(Type.MODE, -1, -1, null, paintMode);
    }
    
    public static SessionCommand click(int row, int col) {
        return new SessionCommand(Type.CLICK, row, col, null, null);
    }
    
    public static SessionCommand drag(int row, int col) {
        return new SessionCommand(Type.DRAG, row, col, null, null);
    }
    
    public static SessionCommand erase(int row, int col) {
        return new SessionCommand(Type.ERASE, row, col, null, null);
    }
    
    public static SessionCommand clear() {
        return new SessionCommand(Type.CLEAR, -1, -1, null, null);
    }
    
    public static SessionCommand run() {
        return new SessionCommand(Type.RUN, -1, -1, null, null);
    }
    
    /**
     * Applies this command to a session.
     * 
     * @param session the session to drive
     * @param listener passed to the search for RUN commands
     */
    public void apply(GridSession session, SearchListener listener) {
        switch (type) {
            case BRUSH -> session.selectBrush(brush);
            case MODE -> session.selectPaintMode(paintMode);
            case CLICK -> session.click(row, col);
            case DRAG -> session.drag(row, col);
            case ERASE -> session.erase(row, col);
            case CLEAR -> session.clear();
            case RUN -> session.run(listener);
        }
    }
    
    @Override
    public String toString() {
        return switch (type) {
            case BRUSH -> "brush " + brush;
            case MODE -> "mode " + paintMode;
            case CLICK, DRAG, ERASE -> type.name().toLowerCase() + " " + row + " " + col;
            case CLEAR, RUN -> type.name().toLowerCase();
        };
    }
}
