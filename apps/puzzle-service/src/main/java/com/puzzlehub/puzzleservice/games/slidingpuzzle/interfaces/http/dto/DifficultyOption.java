package com.puzzlehub.puzzleservice.games.slidingpuzzle.interfaces.http.dto;

/** 难度选择器的一项 */
public record DifficultyOption(int size, String label) {
}
