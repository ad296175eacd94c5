package com.puzzlehub.puzzleservice.clock;

import java.time.Clock;

/**
 * SessionStopwatch
 * ---------------------------------------
 * 单局用时统计（正计时），与引擎解耦：引擎只暴露阶段，是否计时由上层按阶段驱动。
 *
 * 约定：
 *  - 只在 PLAYING 期间累计；pause 时冻结，resume 继续，stop 后不再变化。
 *  - 时间来源为注入的 {@link Clock}，测试里用可拨动的时钟即可精确断言。
 *  - 非线程安全，调用方（会话锁内）串行使用。
 */
public class SessionStopwatch {

    private final Clock clock;
    /** 已累计的毫秒数（不含当前运行段） */
    private long accumulatedMs;
    /** 当前运行段的起点；null 表示未在计时 */
    private Long runningSince;
    private boolean stopped;

    public SessionStopwatch(Clock clock) {
        this.clock = clock;
    }

    /** 创建并立即开始计时 */
    public static SessionStopwatch started(Clock clock) {
        SessionStopwatch w = new SessionStopwatch(clock);
        w.resume();
        return w;
    }

    /** 冻结计时（重复调用无副作用） */
    public void pause() {
        if (runningSince != null) {
            accumulatedMs += clock.millis() - runningSince;
            runningSince = null;
        }
    }

    /** 继续计时；已 stop 的秒表不再启动 */
    public void resume() {
        if (!stopped && runningSince == null) {
            runningSince = clock.millis();
        }
    }

    /** 终止计时（通关时调用），此后用时固定 */
    public void stop() {
        pause();
        stopped = true;
    }

    public boolean isRunning() {
        return runningSince != null;
    }

    /** 当前累计用时（毫秒） */
    public long elapsedMillis() {
        long ms = accumulatedMs;
        if (runningSince != null) ms += clock.millis() - runningSince;
        return ms;
    }

    /**
     * 格式化为 mm:ss.d（十分之一秒），如 01:05.3
     */
    public static String format(long elapsedMs) {
        long tenths = elapsedMs / 100;
        long minutes = tenths / 600;
        long seconds = (tenths / 10) % 60;
        return String.format("%02d:%02d.%d", minutes, seconds, tenths % 10);
    }
}
