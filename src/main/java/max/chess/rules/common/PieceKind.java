package max.chess.rules.common;

public enum PieceKind {
    PAWN('p'), ROOK('r'), KNIGHT('n'), BISHOP('b'), QUEEN('q'), KING('k');

    public static final PieceKind[] VALUES = PieceKind.values();

    public final char letter;

    PieceKind(char letter) {
        this.letter = letter;
    }

    public boolean isSliding() {
        return switch (this) {
            case ROOK, BISHOP, QUEEN -> true;
            case PAWN, KNIGHT, KING -> false;
        };
    }

    public boolean isPromotionCandidate() {
        return this != PAWN && this != KING;
    }

    public static PieceKind fromLetter(char letter) {
        char lower = Character.toLowerCase(letter);
        for(PieceKind kind : VALUES) {
            if(kind.letter == lower) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown piece letter " + letter);
    }
}
