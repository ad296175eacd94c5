package com.puzzlehub.puzzleservice.engine.core;

/**
 * 游戏状态快照接口。
 * - 必须可 copy：给前端的只读视图、测试里的“走前/走后”对比都基于副本。
 * - 具体游戏（如 PuzzleSession）实现此接口。
 * - 副本与实盘互不影响：任何一方修改都不能穿透到另一方。
 */
public interface GameState {

    /**
     * 返回当前状态的深拷贝快照。
     */
    GameState copy();
}
