package max.chess.rules.player;

public enum PlayerType {
    HUMAN, RANDOM
}
