package max.chess.rules.console;

import max.chess.rules.common.Colour;
import max.chess.rules.common.Coordinate;
import max.chess.rules.common.PieceKind;
import max.chess.rules.game.GameState;
import max.chess.rules.movegen.Move;
import max.chess.rules.player.GameCoordinator;
import max.chess.rules.player.HumanPlayer;
import max.chess.rules.player.MirroredPlayer;
import max.chess.rules.utils.notations.MoveIOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Text front end for human players. Commands: {@code e2e4}, {@code moves e2}, {@code promote q|r|b|n},
 * {@code board}, {@code history}, {@code quit}.
 */
public final class ConsoleServer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConsoleServer.class);

    private final GameCoordinator coordinator;
    private final BufferedReader in;
    private final PrintWriter out;

    public ConsoleServer(GameCoordinator coordinator, InputStream input, OutputStream output) {
        this.coordinator = Objects.requireNonNull(coordinator);
        this.in = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        this.out = new PrintWriter(new BufferedWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8)), true);
    }

    /** Runs the command loop on the current thread until {@code quit} or end of input. */
    public void run() {
        coordinator.settle();
        printPosition();
        try {
            String line;
            while ((line = in.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;
                if (line.equals("quit")) {
                    break;
                }
                try {
                    handle(line);
                } catch (IllegalArgumentException e) {
                    LOGGER.warn("Rejected input '{}': {}", line, e.getMessage());
                    send("error: " + e.getMessage());
                }
            }
        } catch (IOException e) {
            LOGGER.error("Console input failed, leaving the game", e);
        }
    }

    private void handle(String line) {
        if (line.equals("board")) {
            printPosition();
        } else if (line.equals("history")) {
            send(MoveIOUtils.writeHistory(coordinator.live().getHistory()));
        } else if (line.startsWith("moves")) {
            handleMoves(line.substring("moves".length()).trim());
        } else if (line.startsWith("promote")) {
            handlePromote(line.substring("promote".length()).trim());
        } else if (line.length() == 4) {
            handleMove(line);
        } else {
            send("unknown command: " + line);
        }
    }

    private void handleMove(String text) {
        Coordinate[] squares = MoveIOUtils.getCoordinatesFromMoveText(text);
        HumanPlayer human = humanToMove();
        if (human == null) {
            send("not your turn");
            return;
        }
        if (!human.select(squares[0], squares[1])) {
            send("illegal move: " + text);
            return;
        }
        coordinator.settle();
        printPosition();
    }

    private void handleMoves(String square) {
        Coordinate source = MoveIOUtils.getCoordinateFromSquare(square);
        HumanPlayer human = humanToMove();
        if (human == null) {
            send("not your turn");
            return;
        }
        List<Move> moves = human.getLegalMoves(source);
        send(moves.stream().map(m -> m.destination().toText()).collect(Collectors.joining(" ")));
    }

    private void handlePromote(String letter) {
        if (letter.length() != 1) {
            throw new IllegalArgumentException("promote expects one of q, r, b, n");
        }
        PieceKind kind = MoveIOUtils.getPromotionKindFromLetter(letter.charAt(0));
        for (Colour colour : Colour.values()) {
            if (coordinator.getPlayer(colour) instanceof HumanPlayer human) {
                human.setPromotionKind(kind);
            }
        }
        send("promotion: " + kind.name().toLowerCase());
    }

    private HumanPlayer humanToMove() {
        MirroredPlayer player = coordinator.getPlayer(coordinator.live().getTurn());
        return player instanceof HumanPlayer human ? human : null;
    }

    private void printPosition() {
        GameState live = coordinator.live();
        send(live.toString());
        if (live.isGameOver()) {
            send("checkmate!");
        } else if (coordinator.isHalted()) {
            send(live.getTurn() + " has no legal move, game stopped");
        } else {
            send(live.getTurn() + " to play");
        }
    }

    private void send(String line) {
        out.println(line);
        out.flush();
    }
}
