package max.chess.rules.movegen;

import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntSet;
import max.chess.rules.common.Coordinate;
import max.chess.rules.common.PieceKind;
import max.chess.rules.game.board.Board;
import max.chess.rules.game.board.Piece;
import max.chess.rules.movegen.pieces.Pawn;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns bare destinations into moves: promotion, double push and en passant for pawns, normal moves otherwise.
 * Castles are not derived from destinations, see {@link max.chess.rules.movegen.pieces.King#getCastlingMoves}.
 */
public final class SpecialMoves {

    public static List<Move> classify(Board board, Coordinate source, Piece piece, IntSet destinations,
                                      PieceKind promotionKind) {
        List<Move> moves = new ArrayList<>(destinations.size() + 2);
        IntIterator iterator = destinations.iterator();
        while(iterator.hasNext()) {
            Coordinate destination = Coordinate.of(iterator.nextInt());
            moves.add(classify(board, source, destination, piece, promotionKind));
        }
        return moves;
    }

    static Move classify(Board board, Coordinate source, Coordinate destination, Piece piece, PieceKind promotionKind) {
        if(piece.kind() != PieceKind.PAWN) {
            return Move.normal(source, destination);
        }
        if(Pawn.isPromotion(destination, piece)) {
            return Move.promotion(source, destination, promotionKind);
        }
        if(Pawn.isDoublePush(source, destination, piece)) {
            return Move.doublePush(source, destination);
        }
        if(Pawn.isEnPassantCapture(board, source, destination, piece.colour())) {
            return Move.enPassant(source, destination);
        }
        return Move.normal(source, destination);
    }

    private SpecialMoves() {
    }
}
