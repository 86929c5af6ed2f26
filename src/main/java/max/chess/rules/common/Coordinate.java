package max.chess.rules.common;

/**
 * A square of the board, file {@code x} and rank {@code y} both in [0,8).
 * (0,0) is a1, (7,0) is h1, (0,7) is a8 and (7,7) is h8.
 * <p>
 * Instances are interned, so identity comparison is valid.
 */
public final class Coordinate {

    private static final Coordinate[] COORDINATE_CACHE = new Coordinate[64];
    static {
        for(int i = 0; i < 64; i++) {
            COORDINATE_CACHE[i] = new Coordinate(i % 8, i / 8);
        }
    }

    public static Coordinate of(int x, int y) {
        if(!isOnBoard(x, y)) {
            throw new IllegalArgumentException("Coordinate out of the board: (" + x + ", " + y + ")");
        }
        return COORDINATE_CACHE[x + 8 * y];
    }

    public static Coordinate of(int flatIndex) {
        if(flatIndex < 0 || flatIndex >= 64) {
            throw new IllegalArgumentException("Flat index out of the board: " + flatIndex);
        }
        return COORDINATE_CACHE[flatIndex];
    }

    public static boolean isOnBoard(int x, int y) {
        return x >= 0 && x < 8 && y >= 0 && y < 8;
    }

    public final int x;
    public final int y;
    public final int flatIndex;

    private Coordinate(int x, int y) {
        this.x = x;
        this.y = y;
        this.flatIndex = x + 8 * y;
    }

    // Returns null when the shifted square falls off the board
    public Coordinate offset(int dx, int dy) {
        int nx = x + dx;
        int ny = y + dy;
        if(!isOnBoard(nx, ny)) {
            return null;
        }
        return COORDINATE_CACHE[nx + 8 * ny];
    }

    /** File letter followed by rank digit, e.g. {@code e4}. */
    public String toText() {
        return String.valueOf((char) (x + 97)) + (char) (y + 49);
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this;
    }

    @Override
    public int hashCode() {
        return flatIndex;
    }

    @Override
    public String toString() {
        return toText();
    }
}
