package com.puzzlehub.puzzleservice.games.slidingpuzzle.interfaces.console;

import java.util.regex.Pattern;

/**
 * 解析控制台输入的坐标。
 * 接受 "2, 3" / "2 3" / "[2 3]" / "(2,3)"；单独的 0、空行、null（输入结束）表示退出。
 * 其余（数量不是 2、含非数字）一律 INVALID，交给循环重新提示。
 */
public final class ConsoleMoveParser {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s,]+");

    private ConsoleMoveParser() {
    }

    public static ConsoleCommand parse(String line) {
        if (line == null) return ConsoleCommand.quit();
        String body = line.trim();
        if (body.startsWith("[") || body.startsWith("(")) body = body.substring(1);
        if (body.endsWith("]") || body.endsWith(")")) body = body.substring(0, body.length() - 1);
        body = body.trim();
        if (body.isEmpty()) return ConsoleCommand.quit();

        String[] parts = SEPARATORS.split(body);
        int[] nums = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                nums[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                return ConsoleCommand.invalid();
            }
        }
        if (nums.length == 1 && nums[0] == 0) return ConsoleCommand.quit();
        if (nums.length != 2) return ConsoleCommand.invalid();
        return ConsoleCommand.move(nums[0], nums[1]);
    }
}
