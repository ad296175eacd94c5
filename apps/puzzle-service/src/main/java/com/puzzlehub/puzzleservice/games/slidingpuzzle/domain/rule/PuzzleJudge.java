package com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.rule;

import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.Grid;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.Position;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.PuzzleSession;

/**
 * 核心规则判断：移动合法性 + 是否还原。
 * 纯函数，不改任何状态。
 */
public final class PuzzleJudge {

    private PuzzleJudge() {
    }

    /**
     * (row,col) 处的块能否滑入空格：
     * 越界、本身是空格、与空格不相邻 → false。
     * 空格位置取会话里增量维护的 blank，不扫描网格。
     */
    public static boolean canMove(PuzzleSession s, int row, int col) {
        int n = s.size();
        if (row < 0 || row >= n || col < 0 || col >= n) return false;
        Position target = new Position(row, col);
        Position blank = s.blank();
        if (target.equals(blank)) return false;
        return target.isAdjacent(blank);
    }

    /**
     * 是否已还原：行优先依次为 1,2,...,N²-1，最后一格为空格。遇到第一个不符即返回。
     */
    public static boolean isSolved(Grid g) {
        int n = g.size();
        int last = n * n - 1;
        for (int i = 0; i < last; i++) {
            if (g.tileAt(i / n, i % n) != i + 1) return false;
        }
        return g.tileAt(n - 1, n - 1) == Grid.BLANK;
    }
}
