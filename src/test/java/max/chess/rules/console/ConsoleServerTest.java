package max.chess.rules.console;

import max.chess.rules.game.GameConfig;
import max.chess.rules.player.GameCoordinator;
import max.chess.rules.player.PlayerType;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConsoleServerTest {

    private static List<String> runConsole(GameCoordinator coordinator, String input) {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        new ConsoleServer(coordinator,
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                output).run();
        return Arrays.asList(output.toString(StandardCharsets.UTF_8).split("\\R"));
    }

    private static GameCoordinator humanAgainstRandom(PlayerType white, PlayerType black) {
        return GameCoordinator.fromConfig(new GameConfig.Builder()
                .whitePlayer(white)
                .blackPlayer(black)
                .randomSeed(17L)
                .build());
    }

    @Test
    public void humanPlaysAMoveAndTheMachineAnswers() {
        // Given
        GameCoordinator coordinator = humanAgainstRandom(PlayerType.HUMAN, PlayerType.RANDOM);

        // When
        List<String> lines = runConsole(coordinator, "e2e4\nhistory\nmoves g1\nquit\nboard\n");

        // Then
        assertEquals(2, coordinator.getPliesPlayed());
        assertTrue(lines.contains("white to play"));
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("e2e4 ") && l.split(" ").length == 2));
        assertTrue(lines.stream().anyMatch(l -> new HashSet<>(Arrays.asList(l.split(" "))).equals(Set.of("e2", "f3", "h3"))));
        // quit ends the session before the last command
        assertEquals(2, lines.stream().filter(l -> l.equals("   a b c d e f g h")).count());
    }

    @Test
    public void badInputIsReportedAndIgnored() {
        // Given
        GameCoordinator coordinator = humanAgainstRandom(PlayerType.HUMAN, PlayerType.RANDOM);

        // When
        List<String> lines = runConsole(coordinator, "foo\ne2e5\ni9i9\npromote k\npromote r\n");

        // Then
        assertEquals(0, coordinator.getPliesPlayed());
        assertTrue(lines.contains("unknown command: foo"));
        assertTrue(lines.contains("illegal move: e2e5"));
        assertEquals(2, lines.stream().filter(l -> l.startsWith("error: ")).count());
        assertTrue(lines.contains("promotion: rook"));
    }

    @Test
    public void machineOpensWhenTheHumanPlaysBlack() {
        // Given
        GameCoordinator coordinator = humanAgainstRandom(PlayerType.RANDOM, PlayerType.HUMAN);

        // When
        List<String> lines = runConsole(coordinator, "");

        // Then
        assertEquals(1, coordinator.getPliesPlayed());
        assertTrue(lines.contains("black to play"));
        assertFalse(lines.contains("white to play"));
    }
}
