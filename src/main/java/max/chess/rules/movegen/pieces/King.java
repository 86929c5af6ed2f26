package max.chess.rules.movegen.pieces;

import it.unimi.dsi.fastutil.ints.IntSet;
import max.chess.rules.common.Coordinate;
import max.chess.rules.common.PieceKind;
import max.chess.rules.game.board.Board;
import max.chess.rules.game.board.Piece;
import max.chess.rules.movegen.Move;
import max.chess.rules.movegen.utils.DestinationUtils;
import max.chess.rules.movegen.utils.MovementTables;

import java.util.ArrayList;
import java.util.List;

public final class King {

    public static IntSet getPseudoLegalDestinations(Board board, Coordinate source, Piece king) {
        return DestinationUtils.step(board, source, king.colour(), MovementTables.KING_OFFSETS);
    }

    /**
     * Castles available to an unmoved king on its starting square (e1 or e8): the rook in the corner of its rank must be of the same colour and unmoved,
     * and every square strictly between king and rook must be empty.
     * <p>
     * Attacked squares are not looked at: the king may castle out of, through or into check.
     */
    public static List<Move> getCastlingMoves(Board board, Coordinate source, Piece king) {
        List<Move> castles = new ArrayList<>(2);
        if(king.hasMoved() || source != Coordinate.of(4, king.colour().homeRank())) {
            return castles;
        }

        if(isCastlePathFree(board, source, king, 0)) {
            castles.add(Move.castle(true, source));
        }
        if(isCastlePathFree(board, source, king, 7)) {
            castles.add(Move.castle(false, source));
        }
        return castles;
    }

    private static boolean isCastlePathFree(Board board, Coordinate kingSource, Piece king, int rookFile) {
        Piece rook = board.getPiece(Coordinate.of(rookFile, kingSource.y));
        if(rook == null || rook.kind() != PieceKind.ROOK || rook.colour() != king.colour() || rook.hasMoved()) {
            return false;
        }

        int from = Math.min(rookFile, kingSource.x) + 1;
        int to = Math.max(rookFile, kingSource.x);
        for(int file = from; file < to; file++) {
            if(!board.isEmpty(Coordinate.of(file, kingSource.y))) {
                return false;
            }
        }
        return true;
    }

    private King() {
    }
}
