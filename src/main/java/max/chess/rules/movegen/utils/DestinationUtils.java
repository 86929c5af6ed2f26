package max.chess.rules.movegen.utils;

import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import max.chess.rules.common.Colour;
import max.chess.rules.common.Coordinate;
import max.chess.rules.game.board.Board;
import max.chess.rules.game.board.Piece;

public final class DestinationUtils {

    // One step per offset; keeps empty squares and enemy-occupied squares
    public static IntSet step(Board board, Coordinate source, Colour colour, int[][] offsets) {
        IntSet destinations = new IntLinkedOpenHashSet(offsets.length);
        for(int[] offset : offsets) {
            Coordinate target = source.offset(offset[0], offset[1]);
            if(target == null) {
                continue;
            }
            Piece occupant = board.getPiece(target);
            if(occupant == null || occupant.isEnemyOf(colour)) {
                destinations.add(target.flatIndex);
            }
        }
        return destinations;
    }

    // Ray-casts every offset until the edge, a friendly piece (excluded) or an enemy piece (included)
    public static IntSet slide(Board board, Coordinate source, Colour colour, int[][] offsets) {
        IntSet destinations = new IntLinkedOpenHashSet(offsets.length * 7);
        for(int[] direction : offsets) {
            Coordinate current = source.offset(direction[0], direction[1]);
            while(current != null) {
                Piece occupant = board.getPiece(current);
                if(occupant != null) {
                    if(occupant.isEnemyOf(colour)) {
                        destinations.add(current.flatIndex);
                    }
                    break;
                }
                destinations.add(current.flatIndex);
                current = current.offset(direction[0], direction[1]);
            }
        }
        return destinations;
    }

    private DestinationUtils() {
    }
}
