package com.puzzlehub.puzzleservice.games.slidingpuzzle.interfaces.console;

import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.Grid;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.PuzzleSnapshot;

/**
 * 文本控制台渲染：带边框的表格，每格 3 个字符宽，空格显示为空白。
 * <pre>
 * +---+---+---+
 * |  1|  2|  3|
 * +---+---+---+
 * |  4|   |  6|
 * +---+---+---+
 * </pre>
 */
public final class ConsoleBoardRenderer {

    private ConsoleBoardRenderer() {
    }

    public static String render(int[][] cells) {
        int n = cells.length;
        String border = "+" + "---+".repeat(n) + System.lineSeparator();
        StringBuilder sb = new StringBuilder(border);
        for (int[] row : cells) {
            sb.append('|');
            for (int v : row) {
                sb.append(v == Grid.BLANK ? "   " : String.format("%3d", v)).append('|');
            }
            sb.append(System.lineSeparator()).append(border);
        }
        return sb.toString();
    }

    /** 状态行：步数 + 用时 */
    public static String stats(PuzzleSnapshot s) {
        return String.format("Moves: %d  Time: %s  Difficulty: %s", s.moves(), s.elapsed(), s.label());
    }
}
