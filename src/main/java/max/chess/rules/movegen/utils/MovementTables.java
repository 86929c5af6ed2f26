package max.chess.rules.movegen.utils;

import max.chess.rules.common.PieceKind;

// {dx, dy} offsets, dx along files and dy along ranks
public final class MovementTables {
    public static final int[][] KNIGHT_OFFSETS = {
            {1, 2}, {-1, 2}, {2, 1}, {-2, 1}, {2, -1}, {-2, -1}, {1, -2}, {-1, -2}
    };
    public static final int[][] KING_OFFSETS = {
            {-1, -1}, {-1, 0}, {-1, 1}, {0, 1}, {0, -1}, {1, -1}, {1, 0}, {1, 1}
    };
    public static final int[][] ROOK_OFFSETS = {
            {-1, 0}, {1, 0}, {0, -1}, {0, 1}
    };
    public static final int[][] BISHOP_OFFSETS = {
            {-1, -1}, {1, -1}, {-1, 1}, {1, 1}
    };
    public static final int[][] QUEEN_OFFSETS = {
            {-1, -1}, {1, -1}, {-1, 1}, {1, 1}, {-1, 0}, {1, 0}, {0, -1}, {0, 1}
    };
    // Pawns are handled separately as their offsets depend on colour and history
    private static final int[][] NO_OFFSETS = {};

    public static int[][] getOffsets(PieceKind kind) {
        return switch (kind) {
            case KNIGHT -> KNIGHT_OFFSETS;
            case KING -> KING_OFFSETS;
            case ROOK -> ROOK_OFFSETS;
            case BISHOP -> BISHOP_OFFSETS;
            case QUEEN -> QUEEN_OFFSETS;
            case PAWN -> NO_OFFSETS;
        };
    }

    private MovementTables() {
    }
}
