package com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.rule;

import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.Grid;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.Position;

/**
 * 可解性判定（15 数码奇偶定理）。
 * 只包含纯判断逻辑 + 一次性修复：
 * - 奇数边长：逆序数为偶数 ⇔ 可解
 * - 偶数边长：令 blankRowFromBottom = N - blankRow（最底行记为 1），
 *            (逆序数 + blankRowFromBottom) 为奇数 ⇔ 可解
 */
public final class SolvabilityJudge {

    private SolvabilityJudge() {
    }

    /**
     * 逆序数：行优先展开并去掉空格后，满足 i<j 且 a[i]>a[j] 的对数。
     */
    public static int countInversions(Grid g) {
        int[] flat = g.flatten();
        int inversions = 0;
        for (int i = 0; i < flat.length; i++) {
            if (flat[i] == Grid.BLANK) continue;
            for (int j = i + 1; j < flat.length; j++) {
                if (flat[j] != Grid.BLANK && flat[i] > flat[j]) inversions++;
            }
        }
        return inversions;
    }

    /** 是否能从还原状态经合法移动到达（等价于能被还原） */
    public static boolean isSolvable(Grid g) {
        int inversions = countInversions(g);
        int n = g.size();
        if (n % 2 == 1) {
            return inversions % 2 == 0;
        }
        int blankRowFromBottom = n - g.locateBlank().row();
        return (inversions + blankRowFromBottom) % 2 == 1;
    }

    /**
     * 修复：交换行优先扫描遇到的前两个非空格块。
     * 一次对换必然翻转逆序数奇偶，所以一次就够；每个生成周期最多调用一次。
     *
     * @return 是否发生了交换（非空格块不足两个时返回 false）
     */
    public static boolean repair(Grid g) {
        Position first = null;
        int n = g.size();
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                if (g.tileAt(r, c) == Grid.BLANK) continue;
                if (first == null) {
                    first = new Position(r, c);
                } else {
                    g.swap(first, new Position(r, c));
                    return true;
                }
            }
        }
        return false;
    }
}
