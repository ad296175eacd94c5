package com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.constants;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 边长 → 难度显示名的对照表（仅展示层使用，引擎只认整数边长）。
 */
public final class DifficultyLabels {

    private static final Map<Integer, String> LABELS = new LinkedHashMap<>();

    static {
        LABELS.put(3, "Easy (3×3)");
        LABELS.put(4, "Medium (4×4)");
        LABELS.put(5, "Hard (5×5)");
        LABELS.put(6, "Expert (6×6)");
    }

    private DifficultyLabels() {
    }

    /** 有名字的取名字，其余显示 N×N */
    public static String labelOf(int size) {
        String label = LABELS.get(size);
        return label != null ? label : size + "×" + size;
    }

    /** 难度选择器使用的预设边长（有序） */
    public static Map<Integer, String> presets() {
        return Collections.unmodifiableMap(LABELS);
    }
}
