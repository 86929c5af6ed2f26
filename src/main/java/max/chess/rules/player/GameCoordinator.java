package max.chess.rules.player;

import max.chess.rules.common.Colour;
import max.chess.rules.game.GameConfig;
import max.chess.rules.game.GameState;
import max.chess.rules.movegen.Move;
import max.chess.rules.movegen.MoveGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Random;

/**
 * Owns the live game. Moves sent by the player to move are checked against the live legal moves, played, then
 * forwarded to the opponent's mirror.
 */
public class GameCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(GameCoordinator.class);

    private final GameState live;
    private final Map<Colour, MirroredPlayer> players = new EnumMap<>(Colour.class);
    private final int plyLimit;
    private int pliesPlayed = 0;
    private boolean halted = false;

    public GameCoordinator(GameState live, MirroredPlayer white, MirroredPlayer black) {
        this(live, white, black, Integer.MAX_VALUE);
    }

    public GameCoordinator(GameState live, MirroredPlayer white, MirroredPlayer black, int plyLimit) {
        if(white.colour() != Colour.WHITE || black.colour() != Colour.BLACK) {
            throw new IllegalArgumentException("Expected a white and a black player, got "
                    + white.colour() + " and " + black.colour());
        }
        this.live = live;
        this.players.put(Colour.WHITE, white);
        this.players.put(Colour.BLACK, black);
        this.plyLimit = plyLimit;
    }

    public static GameCoordinator fromConfig(GameConfig config) {
        GameState live = GameState.newGame();
        live.setPromotionKind(config.defaultPromotion);
        Random random = config.randomSeed == null ? new Random() : new Random(config.randomSeed);
        MirroredPlayer white = createPlayer(config.whitePlayer, Colour.WHITE, live, random);
        MirroredPlayer black = createPlayer(config.blackPlayer, Colour.BLACK, live, random);
        LOGGER.info("New game: {} plays white, {} plays black", config.whitePlayer, config.blackPlayer);
        return new GameCoordinator(live, white, black, config.hasHumanPlayer() ? Integer.MAX_VALUE : config.maxPlies);
    }

    private static MirroredPlayer createPlayer(PlayerType type, Colour colour, GameState live, Random random) {
        return switch (type) {
            case HUMAN -> new HumanPlayer(colour, live);
            case RANDOM -> new RandomPlayer(colour, live, random);
        };
    }

    /** @return whether any player or the live game made progress */
    public boolean tick() {
        if(isFinished()) {
            return false;
        }

        boolean progress = false;
        for(MirroredPlayer player : players.values()) {
            progress |= player.tick();
        }

        Move move = players.get(live.getTurn()).outbound().poll();
        if(move != null) {
            apply(move);
            progress = true;
        }
        return progress;
    }

    private void apply(Move move) {
        Colour mover = live.getTurn();
        if(live.board().isEmpty(move.source())) {
            throw new IllegalStateException(mover + " player sent " + move + " from an empty square, mirror diverged");
        }
        // promotion kind is the sender's choice, only kind and squares are checked
        Move legal = MoveGenerator.findMoveTo(live.getMoves(move.source(), true), move.destination());
        if(legal == null || legal.kind() != move.kind()) {
            throw new IllegalStateException(mover + " player sent illegal move " + move + ", mirror diverged");
        }

        live.playMove(move);
        pliesPlayed++;
        players.get(live.getTurn()).inbound().offer(move);

        if(live.isGameOver()) {
            LOGGER.info("Checkmate, {} wins after {} plies", mover, pliesPlayed);
        }
    }

    /** Ticks until nothing moves any more, e.g. when waiting on a human. */
    public void settle() {
        while(tick()) {
            // keep ticking
        }
        checkStalled();
    }

    /** Plays up to {@code maxPlies} more plies; meant for games without human players. */
    public void run(int maxPlies) {
        int target = pliesPlayed + maxPlies;
        while(!isFinished() && pliesPlayed < target) {
            if(!tick()) {
                checkStalled();
                if(!halted) {
                    LOGGER.warn("No player made progress, stopping after {} plies", pliesPlayed);
                }
                return;
            }
        }
    }

    // A side without any legal move that is not mated would otherwise wait forever
    private void checkStalled() {
        if(halted || live.isGameOver() || pliesPlayed >= plyLimit) {
            return;
        }
        if(!MoveGenerator.hasLegalMove(live, live.getTurn())) {
            halted = true;
            LOGGER.warn("{} has no legal move and is not in check, stopping the game", live.getTurn());
        }
    }

    public boolean isFinished() {
        return halted || pliesPlayed >= plyLimit || live.isGameOver();
    }

    public boolean isHalted() {
        return halted;
    }

    public int getPliesPlayed() {
        return pliesPlayed;
    }

    public GameState live() {
        return live;
    }

    public MirroredPlayer getPlayer(Colour colour) {
        return players.get(colour);
    }
}
