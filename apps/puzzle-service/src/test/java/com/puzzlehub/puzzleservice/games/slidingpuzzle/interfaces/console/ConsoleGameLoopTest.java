package com.puzzlehub.puzzleservice.games.slidingpuzzle.interfaces.console;

import com.puzzlehub.puzzleservice.clock.MutableClock;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.engine.SlidingPuzzleEngine;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.enums.SessionPhase;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.Position;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.PuzzleSession;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.PuzzleSnapshot;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.rule.ShuffleGenerator;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.service.SlidingPuzzleService;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.service.impl.SlidingPuzzleServiceImpl;
import com.puzzlehub.puzzleservice.platform.config.PuzzleProperties;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConsoleGameLoopTest {

    private static final long SEED = 314L;
    private static final Position[] RING = {
            new Position(0, 0), new Position(0, 1), new Position(1, 1), new Position(1, 0)};

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final SlidingPuzzleService svc = new SlidingPuzzleServiceImpl(
            engine(), new PuzzleProperties(), new MutableClock(Instant.EPOCH), e -> { });

    @Test
    void scriptedGameIsPlayedToTheEnd() throws Exception {
        // 用同一种子的引擎预演同一局，算出顺时针绕行的解法
        PuzzleSession preview = engine().newSession(2);
        StringBuilder script = new StringBuilder("hello\n2\n9, 9\n");
        SlidingPuzzleEngine referee = engine();
        while (preview.phase() != SessionPhase.WON) {
            Position next = nextOnRing(preview.blank());
            referee.move(preview, next.row(), next.col());
            script.append(next.row() + 1).append(", ").append(next.col() + 1).append('\n');
        }

        PuzzleSnapshot end = loop(script.toString()).play(2);

        String out = output();
        assertThat(end.phase()).isEqualTo("WON");
        assertThat(end.moves()).isEqualTo(preview.moves());
        assertThat(out).contains("Invalid input. Please enter row, col");
        assertThat(out).contains("Invalid move! Tile at (9, 9) cannot be moved.");
        assertThat(out).contains("Congratulations!").contains("You solved the 2x2 puzzle!");
        assertThat(out).contains("|  1|  2|").contains("|  3|   |");
        assertThatThrownBy(() -> svc.snapshot(end.sessionId())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void zeroQuitsWithoutMoving() throws Exception {
        PuzzleSnapshot end = loop("0\n").play(3);
        assertThat(end.phase()).isEqualTo("PLAYING");
        assertThat(end.moves()).isZero();
        assertThat(output()).contains("Current Puzzle (3x3):").contains("Thanks for playing!");
    }

    @Test
    void endOfInputQuits() throws Exception {
        PuzzleSnapshot end = loop("").play(4);
        assertThat(end.moves()).isZero();
        assertThat(output()).contains("Thanks for playing!");
    }

    private ConsoleGameLoop loop(String script) {
        return new ConsoleGameLoop(svc, new BufferedReader(new StringReader(script)),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static SlidingPuzzleEngine engine() {
        return new SlidingPuzzleEngine(new ShuffleGenerator(new Random(SEED)));
    }

    private static Position nextOnRing(Position blank) {
        for (int i = 0; i < RING.length; i++) {
            if (RING[i].equals(blank)) return RING[(i + 1) % RING.length];
        }
        throw new AssertionError("blank not on ring");
    }
}
