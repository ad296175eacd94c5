package com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model;

import java.util.Arrays;

/**
 * 拼图网格：N x N 的整数排列。
 * 约定：BLANK=0 表示空格；其余数字是该块在还原状态下的行优先序号（1 起始）。
 * 还原状态：(r,c) 处为 r*N+c+1，最后一格为 0。
 *
 * 网格只负责存取与交换，不做“能不能走”的判断，由规则层（rule 包）判定。
 */
public final class Grid {

    /** 空格标记 */
    public static final int BLANK = 0;

    private final int size;
    private final int[][] cells;

    private Grid(int size, int[][] cells) {
        this.size = size;
        this.cells = cells;
    }

    /**
     * 生成还原状态的网格。
     * @param n 边长，必须 >= 1
     */
    public static Grid solved(int n) {
        if (n < 1) throw new IllegalArgumentException("grid size must be >= 1: " + n);
        int[][] c = new int[n][n];
        for (int r = 0; r < n; r++) {
            for (int col = 0; col < n; col++) {
                c[r][col] = r * n + col + 1;
            }
        }
        c[n - 1][n - 1] = BLANK;
        return new Grid(n, c);
    }

    /**
     * 从外部数据（测试夹具、调试输入）构造网格，构造时即校验是方阵且是 0..N²-1 的排列。
     */
    public static Grid of(int[][] rows) {
        if (rows == null || rows.length == 0) {
            throw new IllegalArgumentException("grid must not be empty");
        }
        int n = rows.length;
        int[][] c = new int[n][];
        for (int r = 0; r < n; r++) {
            if (rows[r] == null || rows[r].length != n) {
                throw new IllegalArgumentException("grid must be square, row " + r + " has wrong length");
            }
            c[r] = rows[r].clone();
        }
        Grid g = new Grid(n, c);
        if (!g.isPermutation()) {
            throw new IllegalArgumentException("grid must be a permutation of 0.." + (n * n - 1));
        }
        return g;
    }

    public int size() { return size; }

    /** 是否在网格内 */
    public boolean inBounds(int row, int col) {
        return row >= 0 && row < size && col >= 0 && col < size;
    }

    public boolean inBounds(Position p) {
        return inBounds(p.row(), p.col());
    }

    /** 读取 (row,col) 的值；越界属于编程错误，直接抛出 */
    public int tileAt(int row, int col) {
        checkIndex(row, col);
        return cells[row][col];
    }

    public int tileAt(Position p) {
        return tileAt(p.row(), p.col());
    }

    /** 写入 (row,col)；越界直接抛出。不校验排列性，调用方负责成对写入（见 swap） */
    public void setTile(int row, int col, int value) {
        checkIndex(row, col);
        cells[row][col] = value;
    }

    /** 交换两格的值 */
    public void swap(Position a, Position b) {
        int tmp = tileAt(a);
        setTile(a.row(), a.col(), tileAt(b));
        setTile(b.row(), b.col(), tmp);
    }

    /**
     * 扫描整盘找空格。
     * 只在构造会话和一致性校验时使用；走子时空格位置由会话增量维护，不能每步都扫。
     */
    public Position locateBlank() {
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                if (cells[r][c] == BLANK) return new Position(r, c);
            }
        }
        throw new IllegalStateException("grid has no blank cell");
    }

    /** 行优先展开（含空格） */
    public int[] flatten() {
        int[] flat = new int[size * size];
        for (int r = 0; r < size; r++) {
            System.arraycopy(cells[r], 0, flat, r * size, size);
        }
        return flat;
    }

    /** 是否恰好是 0..N²-1 的一个排列（空格因此也恰好一个） */
    public boolean isPermutation() {
        boolean[] seen = new boolean[size * size];
        for (int v : flatten()) {
            if (v < 0 || v >= seen.length || seen[v]) return false;
            seen[v] = true;
        }
        return true;
    }

    /**
     * 不变量校验：生成/修复后调用，不满足说明代码有 bug，快速失败。
     */
    public void checkInvariant() {
        if (!isPermutation()) {
            throw new IllegalStateException("grid is not a permutation of 0.." + (size * size - 1)
                    + ": " + Arrays.toString(flatten()));
        }
    }

    /** 深拷贝 */
    public Grid copy() {
        int[][] c = new int[size][];
        for (int r = 0; r < size; r++) c[r] = cells[r].clone();
        return new Grid(size, c);
    }

    /** 返回一个只读视图副本（用于序列化给前端/控制台渲染） */
    public int[][] view() {
        return copy().cells;
    }

    private void checkIndex(int row, int col) {
        if (!inBounds(row, col)) {
            throw new IndexOutOfBoundsException("(" + row + "," + col + ") outside " + size + "x" + size + " grid");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grid)) return false;
        Grid other = (Grid) o;
        return size == other.size && Arrays.deepEquals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }

    @Override
    public String toString() {
        return "Grid" + Arrays.deepToString(cells);
    }
}
