package com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.engine;

import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.enums.SessionPhase;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.Grid;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.Position;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.PuzzleSession;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.rule.ShuffleGenerator;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.rule.SolvabilityJudge;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlidingPuzzleEngineTest {

    private SlidingPuzzleEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SlidingPuzzleEngine(new ShuffleGenerator(new Random(42)));
    }

    @Test
    void newSessionIsSolvablePermutationAtMoveZero() {
        for (int n = 2; n <= 6; n++) {
            PuzzleSession s = engine.newSession(n);
            Grid g = s.grid();
            assertThat(g.isPermutation()).isTrue();
            assertThat(SolvabilityJudge.isSolvable(g)).isTrue();
            assertThat(s.solvable()).isTrue();
            assertThat(s.moves()).isZero();
            assertThat(s.phase()).isEqualTo(SessionPhase.PLAYING);
            assertThat(s.blank()).isEqualTo(g.locateBlank());
            assertThat(engine.isSolved(s)).isFalse();
        }
    }

    @Test
    void sizeBelowTwoIsRejected() {
        assertThatThrownBy(() -> engine.newSession(1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.newSession(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void moveThenInverseRestoresGridAndCountsTwo() {
        PuzzleSession s = engine.sessionFrom(Grid.of(new int[][]{
                {5, 1, 2, 4},
                {9, 6, 3, 8},
                {0, 10, 7, 11},
                {13, 14, 15, 12}}));
        Grid before = s.grid();
        Position blank = s.blank();
        Position tile = firstMovable(s);

        assertThat(engine.move(s, tile.row(), tile.col())).isTrue();
        assertThat(s.blank()).isEqualTo(tile);
        assertThat(s.tileAt(blank.row(), blank.col())).isEqualTo(before.tileAt(tile));

        assertThat(engine.move(s, blank.row(), blank.col())).isTrue();
        assertThat(s.grid()).isEqualTo(before);
        assertThat(s.blank()).isEqualTo(blank);
        assertThat(s.moves()).isEqualTo(2);
    }

    @Test
    void rejectedMovesLeaveEverythingUnchanged() {
        PuzzleSession s = engine.sessionFrom(Grid.of(new int[][]{{1, 2, 3}, {4, 0, 5}, {6, 7, 8}}));
        Grid before = s.grid();

        assertThat(engine.move(s, 0, 0)).isFalse();   // 对角
        assertThat(engine.move(s, 1, 1)).isFalse();   // 空格本身
        assertThat(engine.move(s, -1, 1)).isFalse();  // 越界
        assertThat(engine.move(s, 1, 3)).isFalse();   // 越界
        assertThat(engine.move(s, 2, 0)).isFalse();   // 距离 2

        assertThat(s.grid()).isEqualTo(before);
        assertThat(s.blank()).isEqualTo(new Position(1, 1));
        assertThat(s.moves()).isZero();
    }

    @Test
    void winningMoveEndsTheSession() {
        PuzzleSession s = engine.sessionFrom(Grid.of(new int[][]{{1, 2, 3}, {4, 5, 6}, {7, 0, 8}}));
        assertThat(engine.isSolved(s)).isFalse();
        assertThat(s.isSolved()).isFalse();

        assertThat(engine.move(s, 2, 2)).isTrue();

        assertThat(engine.isSolved(s)).isTrue();
        assertThat(s.isSolved()).isTrue();
        assertThat(s.phase()).isEqualTo(SessionPhase.WON);
        assertThat(s.moves()).isEqualTo(1);
        // 终态：不再接受移动
        assertThat(engine.move(s, 2, 1)).isFalse();
        assertThat(s.moves()).isEqualTo(1);
        assertThatThrownBy(() -> engine.pause(s)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void pausedSessionRejectsMovesUntilResumed() {
        PuzzleSession s = engine.newSession(3);
        Position tile = firstMovable(s);

        engine.pause(s);
        assertThat(s.phase()).isEqualTo(SessionPhase.PAUSED);
        assertThat(engine.move(s, tile.row(), tile.col())).isFalse();
        assertThat(s.moves()).isZero();
        assertThatThrownBy(() -> engine.pause(s)).isInstanceOf(IllegalStateException.class);

        engine.resume(s);
        assertThat(s.phase()).isEqualTo(SessionPhase.PLAYING);
        assertThat(engine.move(s, tile.row(), tile.col())).isTrue();
        assertThatThrownBy(() -> engine.resume(s)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void suppliedUnsolvableArrangementIsRepairedOnce() {
        PuzzleSession s = engine.sessionFrom(Grid.of(new int[][]{{1, 2, 3}, {4, 5, 6}, {8, 7, 0}}));
        assertThat(s.grid()).isEqualTo(Grid.of(new int[][]{{2, 1, 3}, {4, 5, 6}, {8, 7, 0}}));
        assertThat(s.solvable()).isTrue();
    }

    @Test
    void suppliedArrangementIsCopied() {
        Grid fixture = Grid.of(new int[][]{{1, 2, 3}, {4, 5, 6}, {7, 0, 8}});
        PuzzleSession s = engine.sessionFrom(fixture);
        engine.move(s, 2, 2);
        assertThat(fixture).isEqualTo(Grid.of(new int[][]{{1, 2, 3}, {4, 5, 6}, {7, 0, 8}}));
    }

    @Test
    void restartAndChangeSizeProduceFreshSessions() {
        PuzzleSession s = engine.newSession(3);
        Position tile = firstMovable(s);
        engine.move(s, tile.row(), tile.col());

        PuzzleSession restarted = engine.restart(s);
        assertThat(restarted).isNotSameAs(s);
        assertThat(restarted.size()).isEqualTo(3);
        assertThat(restarted.moves()).isZero();

        PuzzleSession resized = engine.changeSize(restarted, 5);
        assertThat(resized.size()).isEqualTo(5);
        assertThat(resized.moves()).isZero();
        assertThat(resized.phase()).isEqualTo(SessionPhase.PLAYING);
    }

    @Test
    void copyDoesNotShareTheGrid() {
        PuzzleSession s = engine.newSession(3);
        PuzzleSession snapshot = s.copy();
        Position tile = firstMovable(s);
        engine.move(s, tile.row(), tile.col());

        assertThat(snapshot.moves()).isZero();
        assertThat(snapshot.grid()).isNotEqualTo(s.grid());
    }

    private Position firstMovable(PuzzleSession s) {
        for (int r = 0; r < s.size(); r++) {
            for (int c = 0; c < s.size(); c++) {
                if (engine.canMove(s, r, c)) return new Position(r, c);
            }
        }
        throw new AssertionError("no movable tile");
    }
}
