package com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.engine;

import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.enums.SessionPhase;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.Grid;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.Position;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.PuzzleSession;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.rule.PuzzleJudge;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.rule.ShuffleGenerator;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.rule.SolvabilityJudge;
import lombok.extern.slf4j.Slf4j;

/**
 * 拼图引擎：所有前端（触屏网格 / 文本控制台 / 脚本循环）共用的唯一入口。
 * 流程：
 *  1) ShuffleGenerator 打乱 → 2) SolvabilityJudge 校验（不可解则修复一次）→ 3) 生成 PuzzleSession
 *  4) 每次移动：PuzzleJudge.canMove → PuzzleSession.apply → PuzzleJudge.isSolved
 *
 * 同步、单线程、无 IO；不依赖 Spring，也不持有任何 UI/计时器。
 * 调用方（service/控制台）负责串行化同一会话的操作，并在状态变化后自行通知观察者。
 */
@Slf4j
public class SlidingPuzzleEngine {

    /** 最小边长 */
    public static final int MIN_SIZE = 2;

    private final ShuffleGenerator shuffler;

    public SlidingPuzzleEngine(ShuffleGenerator shuffler) {
        this.shuffler = shuffler;
    }

    /**
     * 生成一局保证可解的新会话：步数 0，阶段 PLAYING。
     * @param size 边长，>= 2
     */
    public PuzzleSession newSession(int size) {
        if (size < MIN_SIZE) {
            throw new IllegalArgumentException("INVALID_SIZE: puzzle size must be >= " + MIN_SIZE + ", got " + size);
        }
        return validated(shuffler.shuffle(size));
    }

    /**
     * 用外部给定的排列开局（测试夹具、调试导入）。
     * 这是可解性校验真正起作用的路径：随机游走生成的网格永远可解。
     */
    public PuzzleSession sessionFrom(Grid arrangement) {
        return validated(arrangement.copy());
    }

    /** 该格能否移动（越界/空格/不相邻都返回 false） */
    public boolean canMove(PuzzleSession s, int row, int col) {
        return PuzzleJudge.canMove(s, row, col);
    }

    /**
     * 执行一步移动。
     * 非法移动（或会话不在 PLAYING）只返回 false，不抛异常、不改状态。
     * 合法时：交换、更新空格、步数+1、判胜；还原则进入 WON。
     *
     * @return true=已执行；false=被拒绝
     */
    public boolean move(PuzzleSession s, int row, int col) {
        if (s.phase() != SessionPhase.PLAYING) {
            log.debug("move ({},{}) rejected: session is {}", row, col, s.phase());
            return false;
        }
        if (!canMove(s, row, col)) {
            log.debug("move ({},{}) rejected: blank at {}", row, col, s.blank());
            return false;
        }
        s.apply(new Position(row, col));
        if (isSolved(s)) {
            s.markWon();
        }
        return true;
    }

    /** 是否已还原 */
    public boolean isSolved(PuzzleSession s) {
        return s.isSolved();
    }

    /** 按当前尺寸重新生成 */
    public PuzzleSession restart(PuzzleSession s) {
        return newSession(s.size());
    }

    /** 换尺寸重新生成 */
    public PuzzleSession changeSize(PuzzleSession s, int newSize) {
        return newSession(newSize);
    }

    /** 暂停（外部暂停/恢复协作方调用，引擎自身不会主动暂停） */
    public void pause(PuzzleSession s) {
        s.pause();
    }

    /** 恢复 */
    public void resume(PuzzleSession s) {
        s.resume();
    }

    // ----------- private helpers -----------

    /**
     * 校验可解性，不可解则修复一次；修复后仍不可解或不是排列，说明有 bug，直接失败。
     */
    private PuzzleSession validated(Grid g) {
        if (!SolvabilityJudge.isSolvable(g)) {
            SolvabilityJudge.repair(g);
            log.debug("{}x{} arrangement was unsolvable, swapped first two tiles", g.size(), g.size());
            if (!SolvabilityJudge.isSolvable(g)) {
                throw new IllegalStateException("arrangement still unsolvable after repair: " + g);
            }
        }
        g.checkInvariant();
        return new PuzzleSession(g, true);
    }
}
