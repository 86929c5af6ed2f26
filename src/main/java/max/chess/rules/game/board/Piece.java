package max.chess.rules.game.board;

import max.chess.rules.common.Colour;
import max.chess.rules.common.PieceKind;

public record Piece(PieceKind kind, Colour colour, boolean hasMoved, boolean enPassantEligible) {

    public static Piece of(PieceKind kind, Colour colour) {
        return new Piece(kind, colour, false, false);
    }

    /** Uppercase letter for White, lowercase for Black. */
    public static Piece fromLetter(char letter) {
        Colour colour = Character.isUpperCase(letter) ? Colour.WHITE : Colour.BLACK;
        return Piece.of(PieceKind.fromLetter(letter), colour);
    }

    public Piece moved() {
        return hasMoved ? this : new Piece(kind, colour, true, enPassantEligible);
    }

    public Piece withEnPassantEligible(boolean eligible) {
        return eligible == enPassantEligible ? this : new Piece(kind, colour, hasMoved, eligible);
    }

    public boolean isEnemyOf(Colour other) {
        return colour != other;
    }

    public char toLetter() {
        return colour == Colour.WHITE ? Character.toUpperCase(kind.letter) : kind.letter;
    }
}
