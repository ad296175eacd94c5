package com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.event;

/**
 * 通关事件：由 service 在一步移动使会话进入 WON 后发布。
 * 引擎本身不发事件，何时通知观察者由调用方决定。
 */
public record PuzzleSolvedEvent(String sessionId, int size, int moves, long elapsedMillis) {
}
