package max.chess.rules.movegen;

public enum MoveKind {
    NORMAL,
    DOUBLE_PUSH,
    EN_PASSANT,
    CASTLE_KING_SIDE,
    CASTLE_QUEEN_SIDE,
    PROMOTION;

    public boolean isCastle() {
        return this == CASTLE_KING_SIDE || this == CASTLE_QUEEN_SIDE;
    }
}
