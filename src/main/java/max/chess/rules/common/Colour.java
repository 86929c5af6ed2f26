package max.chess.rules.common;

public enum Colour {
    WHITE, BLACK;

    public Colour flip() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    // +1 for White, -1 for Black: the rank direction pawns of this colour advance in
    public int forward() {
        return this == WHITE ? 1 : -1;
    }

    public int homeRank() {
        return this == WHITE ? 0 : 7;
    }

    public int promotionRank() {
        return this == WHITE ? 7 : 0;
    }

    @Override
    public String toString() {
        return this == WHITE ? "white" : "black";
    }
}
