package com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model;

/**
 * 网格坐标：(row, col)，均为 0 起始。
 * 用 record 表达不可变坐标，空格位置更新时直接换一个新对象。
 */
public record Position(int row, int col) {

    /** 与另一坐标的曼哈顿距离 */
    public int manhattan(Position other) {
        return Math.abs(row - other.row) + Math.abs(col - other.col);
    }

    /** 是否相邻：曼哈顿距离恰好为 1（不含对角） */
    public boolean isAdjacent(Position other) {
        return manhattan(other) == 1;
    }

    /** 沿方向平移一格（不做越界判断，由 Grid.inBounds 负责） */
    public Position step(Direction d) {
        return new Position(row + d.dRow(), col + d.dCol());
    }
}
