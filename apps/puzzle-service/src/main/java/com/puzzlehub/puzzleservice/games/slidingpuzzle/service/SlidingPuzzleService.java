package com.puzzlehub.puzzleservice.games.slidingpuzzle.service;

import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.PuzzleSnapshot;

/**
 * 拼图会话服务：按 sessionId 托管多局游戏，前端（HTTP/控制台）只通过这里操作引擎。
 * 未知 sessionId 统一抛 IllegalArgumentException("SESSION_NOT_FOUND: ...")。
 */
public interface SlidingPuzzleService {

    /** 新开一局；size 为 null 时取 puzzle.default-size。返回 sessionId */
    String newGame(Integer size);

    /** 某格能否移动（只读） */
    boolean canMove(String sessionId, int row, int col);

    /**
     * 移动 (row,col) 处的块（0 起始坐标）。
     * 非法移动不抛异常：applied=false，快照与移动前一致。
     */
    MoveOutcome move(String sessionId, int row, int col);

    record MoveOutcome(boolean applied, PuzzleSnapshot snapshot) {}

    /** 以当前尺寸重开（步数、用时归零） */
    PuzzleSnapshot restart(String sessionId);

    /** 换尺寸重开 */
    PuzzleSnapshot changeSize(String sessionId, int newSize);

    /** 暂停：停止计时、拒绝移动；已通关时抛 IllegalStateException */
    PuzzleSnapshot pause(String sessionId);

    /** 恢复：只允许从暂停恢复 */
    PuzzleSnapshot resume(String sessionId);

    /** 只读快照 */
    PuzzleSnapshot snapshot(String sessionId);

    /** 结束并移除会话 */
    void close(String sessionId);
}
