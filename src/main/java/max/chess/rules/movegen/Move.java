package max.chess.rules.movegen;

import max.chess.rules.common.Coordinate;
import max.chess.rules.common.PieceKind;

import java.util.Objects;

/**
 * A move as plain data. For castles, source and destination are the king's squares; the rook squares follow from
 * {@link #castleRookSource()} and {@link #castleRookDestination()}.
 * {@code promotion} is only set for {@link MoveKind#PROMOTION}.
 */
public record Move(MoveKind kind, Coordinate source, Coordinate destination, PieceKind promotion) {

    public Move {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(source);
        Objects.requireNonNull(destination);
        if(kind == MoveKind.PROMOTION) {
            if(promotion == null || !promotion.isPromotionCandidate()) {
                throw new IllegalArgumentException("Cannot promote to " + promotion);
            }
        } else if(promotion != null) {
            throw new IllegalArgumentException("Only promotion moves carry a promotion kind, got " + kind);
        }
    }

    public static Move normal(Coordinate source, Coordinate destination) {
        return new Move(MoveKind.NORMAL, source, destination, null);
    }

    public static Move doublePush(Coordinate source, Coordinate destination) {
        return new Move(MoveKind.DOUBLE_PUSH, source, destination, null);
    }

    public static Move enPassant(Coordinate source, Coordinate destination) {
        return new Move(MoveKind.EN_PASSANT, source, destination, null);
    }

    public static Move promotion(Coordinate source, Coordinate destination, PieceKind promotion) {
        return new Move(MoveKind.PROMOTION, source, destination, promotion);
    }

    public static Move castle(boolean longCastle, Coordinate kingSource) {
        Coordinate kingTarget = Coordinate.of(kingSource.x + (longCastle ? -2 : 2), kingSource.y);
        return new Move(longCastle ? MoveKind.CASTLE_QUEEN_SIDE : MoveKind.CASTLE_KING_SIDE,
                kingSource, kingTarget, null);
    }

    public boolean hasDestination(Coordinate coordinate) {
        return destination == coordinate;
    }

    public Coordinate castleRookSource() {
        return Coordinate.of(kind == MoveKind.CASTLE_QUEEN_SIDE ? 0 : 7, source.y);
    }

    public Coordinate castleRookDestination() {
        return Coordinate.of(kind == MoveKind.CASTLE_QUEEN_SIDE ? 3 : 5, source.y);
    }

    /** Coordinate text, with the promotion letter appended for promotions, e.g. {@code e7e8q}. */
    public String toText() {
        String text = source.toText() + destination.toText();
        return promotion == null ? text : text + promotion.letter;
    }

    @Override
    public String toString() {
        return toText();
    }
}
