package max.chess.rules.movegen;

import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import max.chess.rules.common.Colour;
import max.chess.rules.common.Coordinate;
import max.chess.rules.common.PieceKind;
import max.chess.rules.game.GameState;
import max.chess.rules.game.board.Board;
import max.chess.rules.game.board.Piece;
import max.chess.rules.movegen.pieces.King;
import max.chess.rules.movegen.pieces.Knight;
import max.chess.rules.movegen.pieces.Pawn;
import max.chess.rules.movegen.pieces.SlidingPiece;
import max.chess.rules.movegen.utils.CheckUtils;

import java.util.ArrayList;
import java.util.List;

public class MoveGenerator {

    /**
     * Moves of the piece on {@code source}. With {@code filterForChecks}, destinations leaving the mover's king
     * attacked are dropped; castles are appended either way.
     *
     * @throws IllegalStateException if {@code source} is empty
     */
    public static List<Move> getMoves(GameState game, Coordinate source, boolean filterForChecks) {
        Board board = game.board();
        Piece piece = board.getPiece(source);
        if(piece == null) {
            throw new IllegalStateException("Cannot generate moves for empty square " + source);
        }

        IntSet destinations = getPseudoLegalDestinations(board, source);
        if(filterForChecks) {
            destinations = filterChecks(game, source, piece.colour(), destinations);
        }

        List<Move> moves = SpecialMoves.classify(board, source, piece, destinations, game.getPromotionKind());
        if(piece.kind() == PieceKind.KING) {
            moves.addAll(King.getCastlingMoves(board, source, piece));
        }
        return moves;
    }

    // All legal moves of the side to move
    public static List<Move> generateMoves(GameState game) {
        return generateMoves(game, game.getTurn());
    }

    public static List<Move> generateMoves(GameState game, Colour colour) {
        List<Move> moves = new ArrayList<>();
        Board board = game.board();
        for(int i = 0; i < 64; i++) {
            Piece piece = board.getPiece(i);
            if(piece != null && piece.colour() == colour) {
                moves.addAll(getMoves(game, Coordinate.of(i), true));
            }
        }
        return moves;
    }

    public static boolean hasLegalMove(GameState game, Colour colour) {
        Board board = game.board();
        for(int i = 0; i < 64; i++) {
            Piece piece = board.getPiece(i);
            if(piece != null && piece.colour() == colour && !getMoves(game, Coordinate.of(i), true).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Candidate destinations ignoring king safety, as flat square indices.
     *
     * @throws IllegalStateException if {@code source} is empty
     */
    public static IntSet getPseudoLegalDestinations(Board board, Coordinate source) {
        Piece piece = board.getPiece(source);
        if(piece == null) {
            throw new IllegalStateException("Cannot generate moves for empty square " + source);
        }
        return switch (piece.kind()) {
            case PAWN -> Pawn.getPseudoLegalDestinations(board, source, piece);
            case KNIGHT -> Knight.getPseudoLegalDestinations(board, source, piece);
            case KING -> King.getPseudoLegalDestinations(board, source, piece);
            case ROOK, BISHOP, QUEEN -> SlidingPiece.getPseudoLegalDestinations(board, source, piece);
        };
    }

    // Returns null when no move lands on destination
    public static Move findMoveTo(List<Move> moves, Coordinate destination) {
        for(Move move : moves) {
            if(move.hasDestination(destination)) {
                return move;
            }
        }
        return null;
    }

    private static IntSet filterChecks(GameState game, Coordinate source, Colour colour, IntSet candidates) {
        IntSet legal = new IntLinkedOpenHashSet(candidates.size());
        IntIterator iterator = candidates.iterator();
        while(iterator.hasNext()) {
            int destination = iterator.nextInt();
            if(!CheckUtils.wouldKingBeInCheck(game, source, Coordinate.of(destination), colour)) {
                legal.add(destination);
            }
        }
        return legal;
    }
}
