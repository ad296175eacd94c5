package com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model;

import com.puzzlehub.puzzleservice.clock.SessionStopwatch;
import lombok.Getter;

/**
 * 服务端托管的一局游戏：固定的 sessionId + 当前会话 + 用时秒表。
 * 重开/换尺寸时替换 session 与 stopwatch，sessionId 不变（前端无需重新订阅）。
 * 所有读写都在 service 的会话锁内进行。
 */
@Getter
public class PuzzleGame {
    private final String sessionId;
    private PuzzleSession session;
    private SessionStopwatch stopwatch;

    public PuzzleGame(String sessionId, PuzzleSession session, SessionStopwatch stopwatch) {
        this.sessionId = sessionId;
        this.session = session;
        this.stopwatch = stopwatch;
    }

    /** 换上一局新生成的会话 */
    public void replace(PuzzleSession next, SessionStopwatch nextStopwatch) {
        this.session = next;
        this.stopwatch = nextStopwatch;
    }
}
