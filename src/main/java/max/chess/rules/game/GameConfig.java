package max.chess.rules.game;

import max.chess.rules.common.PieceKind;
import max.chess.rules.player.PlayerType;

import java.util.Locale;

public final class GameConfig {

    public final PlayerType whitePlayer;
    public final PlayerType blackPlayer;
    public final Long randomSeed;            // null: unseeded
    public final PieceKind defaultPromotion; // queen, rook, bishop or knight
    public final int maxPlies;               // bound for games without human players

    private GameConfig(Builder b) {
        whitePlayer = b.whitePlayer;
        blackPlayer = b.blackPlayer;
        randomSeed = b.randomSeed;
        defaultPromotion = b.defaultPromotion;
        maxPlies = b.maxPlies;
    }

    public static GameConfig fromSystemProperties() {
        Builder builder = new Builder()
                .whitePlayer(PlayerType.valueOf(System.getProperty("white.player", "HUMAN").toUpperCase(Locale.ROOT)))
                .blackPlayer(PlayerType.valueOf(System.getProperty("black.player", "RANDOM").toUpperCase(Locale.ROOT)))
                .defaultPromotion(PieceKind.valueOf(System.getProperty("promotion", "QUEEN").toUpperCase(Locale.ROOT)))
                .maxPlies(Integer.parseInt(System.getProperty("max.plies", "200")));
        String seed = System.getProperty("random.seed");
        if(seed != null && !seed.isBlank()) {
            builder.randomSeed(Long.parseLong(seed.trim()));
        }
        return builder.build();
    }

    public boolean hasHumanPlayer() {
        return whitePlayer == PlayerType.HUMAN || blackPlayer == PlayerType.HUMAN;
    }

    @Override
    public String toString() {
        return "GameConfig{" +
                "whitePlayer=" + whitePlayer +
                ", blackPlayer=" + blackPlayer +
                ", randomSeed=" + randomSeed +
                ", defaultPromotion=" + defaultPromotion +
                ", maxPlies=" + maxPlies +
                '}';
    }

    public static final class Builder {
        private PlayerType whitePlayer = PlayerType.HUMAN;
        private PlayerType blackPlayer = PlayerType.RANDOM;
        private Long randomSeed = null;
        private PieceKind defaultPromotion = PieceKind.QUEEN;
        private int maxPlies = 200;

        public Builder whitePlayer(PlayerType v) { this.whitePlayer = v; return this; }
        public Builder blackPlayer(PlayerType v) { this.blackPlayer = v; return this; }
        public Builder randomSeed(Long v) { this.randomSeed = v; return this; }
        public Builder defaultPromotion(PieceKind v) { this.defaultPromotion = v; return this; }
        public Builder maxPlies(int v) { this.maxPlies = v; return this; }

        public GameConfig build() {
            if(whitePlayer == null || blackPlayer == null) {
                throw new IllegalArgumentException("Both player types are required");
            }
            if(defaultPromotion == null || !defaultPromotion.isPromotionCandidate()) {
                throw new IllegalArgumentException("Cannot promote to " + defaultPromotion);
            }
            if(maxPlies <= 0) {
                throw new IllegalArgumentException("maxPlies must be positive, got " + maxPlies);
            }
            return new GameConfig(this);
        }
    }
}
