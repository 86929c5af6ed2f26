package max.chess.rules.game;

// Stalemate is not scored: a side without legal moves that is not in check stays IN_PROGRESS
public enum PlayerState {
    IN_PROGRESS, CHECKMATE
}
