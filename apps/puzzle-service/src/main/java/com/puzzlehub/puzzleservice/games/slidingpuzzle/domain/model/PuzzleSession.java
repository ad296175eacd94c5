package com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model;

import com.puzzlehub.puzzleservice.engine.core.GameState;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.enums.SessionPhase;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.rule.PuzzleJudge;

/**
 * 一局拼图的会话状态。
 * 作用：整局的“单一事实来源”（网格、空格位置、步数、是否可解、阶段）。
 * - 持有网格 Grid，外部拿到的都是副本/视图
 * - blank 在每次交换时增量维护，不重新扫描
 * - moves 只增不减，新会话才归零
 * 设计说明
 * -PuzzleSession 不做规则校验，只做状态变更（apply）；规则单独放在 rule 包，调度在 SlidingPuzzleEngine。
 * -WON 为终态：进入后不再回到 PLAYING/PAUSED。
 */
public class PuzzleSession implements GameState {

    private final Grid grid;
    private Position blank;
    private int moves;
    private final boolean solvable;
    private SessionPhase phase = SessionPhase.PLAYING;

    /**
     * 以一张已生成（且已校验）的网格开局。构造时扫描一次空格位置。
     */
    public PuzzleSession(Grid grid, boolean solvable) {
        this.grid = grid;
        this.blank = grid.locateBlank();
        this.solvable = solvable;
    }

    private PuzzleSession(Grid grid, Position blank, int moves, boolean solvable, SessionPhase phase) {
        this.grid = grid;
        this.blank = blank;
        this.moves = moves;
        this.solvable = solvable;
        this.phase = phase;
    }

    // --------- 读方法（暴露给外部） ----------
    public int size() { return grid.size(); }
    public Position blank() { return blank; }
    public int moves() { return moves; }
    public boolean solvable() { return solvable; }
    public SessionPhase phase() { return phase; }

    /** 读取某格的值（只读） */
    public int tileAt(int row, int col) { return grid.tileAt(row, col); }

    /** 只读网格副本，引擎外部不持有可变网格 */
    public Grid grid() { return grid.copy(); }

    /** 二维数组视图（副本） */
    public int[][] cells() { return grid.view(); }

    /** 是否已还原（直接读内部网格，不复制） */
    public boolean isSolved() { return PuzzleJudge.isSolved(grid); }

    // --------- 状态变更（由 SlidingPuzzleEngine 调用） ----------

    /**
     * 把 tile 处的块滑入空格（不做合法性判断，由规则层确保相邻且不是空格）。
     */
    public void apply(Position tile) {
        grid.swap(tile, blank);
        blank = tile;
        moves++;
    }

    /** 通关：进入终态 */
    public void markWon() {
        this.phase = SessionPhase.WON;
    }

    /** 暂停：只允许从 PLAYING 进入 */
    public void pause() {
        if (phase != SessionPhase.PLAYING) {
            throw new IllegalStateException("CANNOT_PAUSE: session is " + phase);
        }
        this.phase = SessionPhase.PAUSED;
    }

    /** 恢复：只允许从 PAUSED 回到 PLAYING */
    public void resume() {
        if (phase != SessionPhase.PAUSED) {
            throw new IllegalStateException("CANNOT_RESUME: session is " + phase);
        }
        this.phase = SessionPhase.PLAYING;
    }

    /** 深拷贝：复制网格与元信息 */
    @Override
    public PuzzleSession copy() {
        return new PuzzleSession(grid.copy(), blank, moves, solvable, phase);
    }
}
