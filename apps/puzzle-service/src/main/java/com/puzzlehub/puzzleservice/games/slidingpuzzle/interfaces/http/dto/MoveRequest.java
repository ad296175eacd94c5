package com.puzzlehub.puzzleservice.games.slidingpuzzle.interfaces.http.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 移动请求体：被点击格子的坐标（0 起始）。
 * 越界/不相邻不在这里校验，由引擎判定并返回 applied=false。
 */
@Data
public class MoveRequest {

    @NotNull(message = "row is required")
    private Integer row;

    @NotNull(message = "col is required")
    private Integer col;
}
