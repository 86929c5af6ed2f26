package max.chess.rules.game.board;

import max.chess.rules.common.Coordinate;

// piece is null for an empty square
public record Square(Coordinate coordinate, Piece piece) {

    public boolean isEmpty() {
        return piece == null;
    }

    public boolean isOccupied() {
        return piece != null;
    }

    public Square withPiece(Piece newPiece) {
        return newPiece == piece ? this : new Square(coordinate, newPiece);
    }
}
