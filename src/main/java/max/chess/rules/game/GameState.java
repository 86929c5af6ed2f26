package max.chess.rules.game;

import max.chess.rules.common.Colour;
import max.chess.rules.common.Coordinate;
import max.chess.rules.common.PieceKind;
import max.chess.rules.game.board.Board;
import max.chess.rules.game.board.PerformedMove;
import max.chess.rules.game.board.Piece;
import max.chess.rules.game.board.utils.BoardGenerator;
import max.chess.rules.movegen.Move;
import max.chess.rules.movegen.MoveGenerator;
import max.chess.rules.movegen.utils.CheckUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class GameState {
    private static final Logger LOGGER = LoggerFactory.getLogger(GameState.class);

    private final Board board;
    private Colour turn = Colour.WHITE;
    private final List<PerformedMove> history;
    private PieceKind promotionKind = PieceKind.QUEEN;

    // Selection is owned by the input layer, the rules never read it
    private Coordinate selectedSquare;

    public static GameState newGame() {
        return new GameState(BoardGenerator.newStandardBoard());
    }

    public static GameState empty() {
        return new GameState(BoardGenerator.newEmptyBoard());
    }

    public GameState(Board board) {
        this.board = board;
        this.history = new ArrayList<>();
    }

    private GameState(GameState other) {
        this.board = new Board(other.board);
        this.turn = other.turn;
        this.history = new ArrayList<>(other.history);
        this.promotionKind = other.promotionKind;
        this.selectedSquare = other.selectedSquare;
    }

    public GameState copy() {
        return new GameState(this);
    }

    public List<Move> getMoves(Coordinate source, boolean filterForChecks) {
        return MoveGenerator.getMoves(this, source, filterForChecks);
    }

    public boolean isInCheck(Colour colour) {
        return CheckUtils.isInCheck(board, colour);
    }

    /**
     * Runs the move's own effect first; when the effect did not relocate anything itself, the piece is moved from
     * source to destination and marked as moved.
     */
    public void makeMove(Move move) {
        Piece piece = board.getPiece(move.source());
        if(piece == null) {
            throw new IllegalStateException("Cannot play " + move + ": no piece on " + move.source());
        }

        boolean relocationHandled = applyEffect(move, piece);
        if(!relocationHandled) {
            board.relocate(move.source(), move.destination());
        }
        LOGGER.debug("{} played {} ({})", piece.colour(), move, move.kind());
    }

    // Returns whether pieces were already relocated
    private boolean applyEffect(Move move, Piece piece) {
        Coordinate source = move.source();
        Coordinate destination = move.destination();
        return switch (move.kind()) {
            case NORMAL -> {
                record(source, destination);
                yield false;
            }
            case DOUBLE_PUSH -> {
                record(source, destination);
                board.setPiece(source, piece.moved().withEnPassantEligible(true));
                yield false;
            }
            case EN_PASSANT -> {
                record(source, destination);
                board.enPassant(source, destination);
                yield true;
            }
            case PROMOTION -> {
                record(source, destination);
                board.promote(source, destination, move.promotion());
                yield true;
            }
            case CASTLE_KING_SIDE, CASTLE_QUEEN_SIDE -> {
                Coordinate rookSource = move.castleRookSource();
                Coordinate rookDestination = move.castleRookDestination();
                board.relocate(rookSource, rookDestination);
                record(rookSource, rookDestination);
                board.relocate(source, destination);
                record(source, destination);
                yield true;
            }
        };
    }

    private void record(Coordinate source, Coordinate destination) {
        history.add(new PerformedMove(source, destination));
    }

    /** Gives the move to the other side and clears the en passant flags of the side that now moves. */
    public void completeTurn() {
        turn = turn.flip();
        board.clearEnPassantFlags(turn);
        LOGGER.debug("{} to play", turn);
    }

    public void playMove(Move move) {
        makeMove(move);
        completeTurn();
    }

    public boolean select(Coordinate coordinate) {
        Piece piece = board.getPiece(coordinate);
        if(piece == null || piece.colour() != turn) {
            return false;
        }
        selectedSquare = coordinate;
        return true;
    }

    /**
     * Plays the move of the selected piece landing on {@code target}, if it is legal. The selection is cleared in
     * any case. The caller completes the turn on success.
     */
    public boolean attemptMove(Coordinate target) {
        Coordinate source = selectedSquare;
        selectedSquare = null;
        if(source == null || source == target) {
            return false;
        }

        Piece sourcePiece = board.getPiece(source);
        Piece targetPiece = board.getPiece(target);
        if(sourcePiece == null || (targetPiece != null && targetPiece.colour() == sourcePiece.colour())) {
            return false;
        }

        Move move = MoveGenerator.findMoveTo(getMoves(source, true), target);
        if(move == null) {
            return false;
        }
        makeMove(move);
        return true;
    }

    public PlayerState getPlayerState() {
        if(isInCheck(turn) && !MoveGenerator.hasLegalMove(this, turn)) {
            return PlayerState.CHECKMATE;
        }
        return PlayerState.IN_PROGRESS;
    }

    public boolean isGameOver() {
        return getPlayerState() == PlayerState.CHECKMATE;
    }

    public Board board() {
        return board;
    }

    public Colour getTurn() {
        return turn;
    }

    public GameState setTurn(Colour turn) {
        this.turn = Objects.requireNonNull(turn);
        return this;
    }

    public List<PerformedMove> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public PieceKind getPromotionKind() {
        return promotionKind;
    }

    public void setPromotionKind(PieceKind promotionKind) {
        if(!promotionKind.isPromotionCandidate()) {
            throw new IllegalArgumentException("Cannot promote to " + promotionKind);
        }
        this.promotionKind = promotionKind;
    }

    public Coordinate getSelectedSquare() {
        return selectedSquare;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        GameState other = (GameState) o;
        return turn == other.turn
                && promotionKind == other.promotionKind
                && board.equals(other.board)
                && history.equals(other.history);
    }

    @Override
    public int hashCode() {
        return Objects.hash(board, turn, history, promotionKind);
    }

    @Override
    public String toString() {
        return board.toString();
    }
}
