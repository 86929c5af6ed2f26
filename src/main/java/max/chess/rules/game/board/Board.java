package max.chess.rules.game.board;

import max.chess.rules.common.Colour;
import max.chess.rules.common.Coordinate;
import max.chess.rules.common.PieceKind;

import java.util.Arrays;
import java.util.function.Predicate;

/**
 * 64 squares indexed by {@code file + 8 * rank}. Pieces are immutable, so copying the square array is a full copy.
 */
public class Board {
    private final Square[] squares;

    public Board() {
        this.squares = new Square[64];
        for(int i = 0; i < 64; i++) {
            squares[i] = new Square(Coordinate.of(i), null);
        }
    }

    public Board(Board other) {
        this.squares = other.squares.clone();
    }

    public Square getSquare(Coordinate coordinate) {
        return squares[coordinate.flatIndex];
    }

    public Square getSquare(int flatIndex) {
        return squares[flatIndex];
    }

    public Piece getPiece(Coordinate coordinate) {
        return squares[coordinate.flatIndex].piece();
    }

    public Piece getPiece(int flatIndex) {
        return squares[flatIndex].piece();
    }

    public boolean isEmpty(Coordinate coordinate) {
        return squares[coordinate.flatIndex].isEmpty();
    }

    public Board setPiece(Coordinate coordinate, Piece piece) {
        squares[coordinate.flatIndex] = squares[coordinate.flatIndex].withPiece(piece);
        return this;
    }

    public Board clear(Coordinate coordinate) {
        return setPiece(coordinate, null);
    }

    // Generic relocation: the piece lands marked as moved, whatever was on the destination is gone
    public void relocate(Coordinate source, Coordinate destination) {
        Piece piece = getPiece(source);
        if(piece == null) {
            throw new IllegalStateException("No piece to relocate on " + source);
        }
        setPiece(destination, piece.moved());
        clear(source);
    }

    public void enPassant(Coordinate source, Coordinate destination) {
        Piece pawn = getPiece(source);
        setPiece(destination, pawn.moved());
        clear(Coordinate.of(destination.x, source.y));
        clear(source);
    }

    public void promote(Coordinate source, Coordinate destination, PieceKind promotion) {
        if(!promotion.isPromotionCandidate()) {
            throw new IllegalArgumentException("Cannot promote to " + promotion);
        }
        Colour colour = getPiece(source).colour();
        setPiece(destination, new Piece(promotion, colour, true, false));
        clear(source);
    }

    public Coordinate getKingCoordinate(Colour colour) {
        for(Square square : squares) {
            Piece piece = square.piece();
            if(piece != null && piece.kind() == PieceKind.KING && piece.colour() == colour) {
                return square.coordinate();
            }
        }
        throw new IllegalStateException("No " + colour + " king on the board:\n" + this);
    }

    public void clearEnPassantFlags(Colour colour) {
        for(int i = 0; i < 64; i++) {
            Piece piece = squares[i].piece();
            if(piece != null && piece.colour() == colour && piece.enPassantEligible()) {
                squares[i] = squares[i].withPiece(piece.withEnPassantEligible(false));
            }
        }
    }

    public int count(Predicate<Piece> filter) {
        int count = 0;
        for(Square square : squares) {
            if(square.isOccupied() && filter.test(square.piece())) {
                count++;
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(squares, ((Board) o).squares);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(squares);
    }

    /** ASCII diagram, rank 8 first. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(8 * (8 * 2 + 4));
        for (int rank = 7; rank >= 0; rank--) {
            sb.append(rank + 1).append("  ");
            for (int file = 0; file < 8; file++) {
                Piece piece = squares[file + 8 * rank].piece();
                sb.append(piece == null ? '.' : piece.toLetter()).append(' ');
            }
            sb.append('\n');
        }
        sb.append("\n   a b c d e f g h");
        return sb.toString();
    }
}
