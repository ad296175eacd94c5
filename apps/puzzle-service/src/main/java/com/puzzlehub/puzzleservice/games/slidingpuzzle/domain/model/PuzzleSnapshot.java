package com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 一局拼图的只读快照（前端首屏渲染 / 每步刷新）。
 * cells 为副本，修改它不会影响服务端会话。
 *
 * @param movable 当前可以点击移动的格子（前端用于高亮）
 * @param elapsed 格式化用时 mm:ss.d
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PuzzleSnapshot(String sessionId,
                             int size,
                             String label,
                             int[][] cells,
                             int blankRow,
                             int blankCol,
                             int moves,
                             String phase,
                             boolean solvable,
                             long elapsedMillis,
                             String elapsed,
                             List<Position> movable) {
}
