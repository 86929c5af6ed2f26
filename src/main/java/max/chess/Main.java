package max.chess;

import max.chess.rules.console.ConsoleServer;
import max.chess.rules.game.GameConfig;
import max.chess.rules.game.GameState;
import max.chess.rules.player.GameCoordinator;
import max.chess.rules.utils.notations.MoveIOUtils;

public class Main {
    public static void main(String[] args) {
        GameConfig config = GameConfig.fromSystemProperties();
        GameCoordinator coordinator = GameCoordinator.fromConfig(config);
        if(config.hasHumanPlayer()) {
            new ConsoleServer(coordinator, System.in, System.out).run();
            return;
        }

        coordinator.run(config.maxPlies);
        GameState live = coordinator.live();
        System.out.println(live);
        System.out.println(MoveIOUtils.writeHistory(live.getHistory()));
        System.out.println(live.isGameOver() ? "checkmate!" : "game stopped after " + coordinator.getPliesPlayed() + " plies");
    }
}
