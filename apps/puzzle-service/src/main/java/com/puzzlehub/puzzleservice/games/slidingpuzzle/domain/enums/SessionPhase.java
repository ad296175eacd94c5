package com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.enums;

public enum SessionPhase {

    PLAYING,   // 对局中（允许移动，计时）
    PAUSED,    // 已暂停（不能移动，不计时），仅由外部暂停/恢复触发
    WON        // 已通关（终态，只能通过重开/换尺寸生成新会话）
}
