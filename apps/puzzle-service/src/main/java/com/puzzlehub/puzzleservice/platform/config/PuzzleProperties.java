package com.puzzlehub.puzzleservice.platform.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 拼图相关配置（application.yml 中的 puzzle.*），支持环境变量覆盖。
 */
@Data
@ConfigurationProperties(prefix = "puzzle")
public class PuzzleProperties {

    /**
     * 新开一局时默认边长（3 = 3x3）
     */
    private int defaultSize = 3;

    /**
     * 允许的最小边长
     */
    private int minSize = 2;

    /**
     * 允许的最大边长
     */
    private int maxSize = 10;

    /**
     * 打乱步数系数：步数 = N² * shuffleFactor
     */
    private int shuffleFactor = 10;

    /**
     * 随机种子；为空时每次启动随机，设置后打乱序列可复现
     */
    private Long seed;

    private Console console = new Console();

    @Data
    public static class Console {
        /**
         * 是否在启动后进入文本控制台对局
         */
        private boolean enabled = false;

        /**
         * 控制台对局的边长；为空时取 defaultSize
         */
        private Integer size;
    }
}
