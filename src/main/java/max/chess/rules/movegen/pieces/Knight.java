package max.chess.rules.movegen.pieces;

import it.unimi.dsi.fastutil.ints.IntSet;
import max.chess.rules.common.Coordinate;
import max.chess.rules.game.board.Board;
import max.chess.rules.game.board.Piece;
import max.chess.rules.movegen.utils.DestinationUtils;
import max.chess.rules.movegen.utils.MovementTables;

public final class Knight {
    public static IntSet getPseudoLegalDestinations(Board board, Coordinate source, Piece knight) {
        return DestinationUtils.step(board, source, knight.colour(), MovementTables.KNIGHT_OFFSETS);
    }

    private Knight() {
    }
}
