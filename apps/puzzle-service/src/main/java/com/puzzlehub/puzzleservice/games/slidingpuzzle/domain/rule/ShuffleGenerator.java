package com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.rule;

import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.Direction;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.Grid;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.Position;
import lombok.extern.slf4j.Slf4j;

import java.util.random.RandomGenerator;

/**
 * 打乱生成器：从还原状态出发，让空格随机游走 N²·factor 步。
 * 每一步都是合法移动，所以结果天然与还原状态同一可解类。
 *
 * 每步把 4 个方向随机排序，取第一个不越界的方向（比“随机选一个方向、越界就跳过”混得更开）。
 * 随机源由外部注入，测试里传固定种子即可复现。
 */
@Slf4j
public class ShuffleGenerator {

    /** 默认步数系数：N²·10 */
    public static final int DEFAULT_FACTOR = 10;

    private final RandomGenerator random;
    private final int factor;

    public ShuffleGenerator(RandomGenerator random) {
        this(random, DEFAULT_FACTOR);
    }

    public ShuffleGenerator(RandomGenerator random, int factor) {
        if (factor < 1) throw new IllegalArgumentException("shuffle factor must be >= 1: " + factor);
        this.random = random;
        this.factor = factor;
    }

    /**
     * 生成一张打乱后的网格（新对象），空格起点为右下角。
     */
    public Grid shuffle(int n) {
        Grid g = Grid.solved(n);
        Position blank = new Position(n - 1, n - 1);
        int steps = n * n * factor;
        Direction[] dirs = Direction.values();
        for (int i = 0; i < steps; i++) {
            shuffleInPlace(dirs);
            for (Direction d : dirs) {
                Position next = blank.step(d);
                if (g.inBounds(next)) {
                    g.swap(blank, next);
                    blank = next;
                    break;
                }
            }
        }
        // 随机游走恰好回到还原状态（小盘面常见）：再合法地走一步，保证开局不是已还原
        if (n >= 2 && PuzzleJudge.isSolved(g)) {
            Position up = blank.step(Direction.UP);
            g.swap(blank, up);
            blank = up;
        }
        log.debug("shuffled {}x{} grid with {} steps, blank ends at {}", n, n, steps, blank);
        return g;
    }

    /** 打乱方向顺序（Fisher–Yates） */
    private void shuffleInPlace(Direction[] dirs) {
        for (int i = dirs.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            Direction tmp = dirs[i];
            dirs[i] = dirs[j];
            dirs[j] = tmp;
        }
    }
}
