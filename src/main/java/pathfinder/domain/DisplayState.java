package pathfinder.domain;

/**
 * What a cell looks like to a renderer. When several states apply at once the
 * one declared first wins: role, then path, then open, then closed, then the
 * bare terrain.
 */
public enum DisplayState {
    START('S', 0xFFA500),
    END('E', 0x40E0D0),
    PATH('*', 0x800080),
    OPEN('o', 0x96FF96),
    CLOSED('x', 0xFF9696),
    TERRAIN('\0', -1);
    
    private final char glyph;
    private final int rgb;
    
    DisplayState(char glyph, int rgb) {
        this.glyph = glyph;
        this.rgb = rgb;
    }
    
    /**
     * @param terrain the cell's terrain, used when this state is TERRAIN
     * @return the text glyph for this state
     */
    public char glyph(Terrain terrain) {
        return this == TERRAIN ? terrain.getSymbol() : glyph;
    }
    
    /**
     * @param terrain the cell's terrain, used when this state is TERRAIN
     * @return display colour packed as 0xRRGGBB
     */
    public int rgb(Terrain terrain) {
        return this == TERRAIN ? terrain.getRgb() : rgb;
    }
}
