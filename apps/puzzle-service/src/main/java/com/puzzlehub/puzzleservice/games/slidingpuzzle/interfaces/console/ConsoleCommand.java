package com.puzzlehub.puzzleservice.games.slidingpuzzle.interfaces.console;

/**
 * 控制台一行输入解析后的结果。
 * MOVE 时 row/col 为玩家输入的 1 起始坐标，原样保留，由循环换算成 0 起始。
 */
public record ConsoleCommand(Kind kind, int row, int col) {

    public enum Kind {
        /** 一对坐标 */
        MOVE,
        /** 0 / 空行 / 输入结束 */
        QUIT,
        /** 个数不对或不是数字：重新提示，不算一步，也不算非法移动 */
        INVALID
    }

    public static ConsoleCommand move(int row, int col) {
        return new ConsoleCommand(Kind.MOVE, row, col);
    }

    public static ConsoleCommand quit() {
        return new ConsoleCommand(Kind.QUIT, 0, 0);
    }

    public static ConsoleCommand invalid() {
        return new ConsoleCommand(Kind.INVALID, 0, 0);
    }
}
