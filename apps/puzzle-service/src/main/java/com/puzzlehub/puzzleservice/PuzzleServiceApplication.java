package com.puzzlehub.puzzleservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * puzzle-service 启动入口。
 * 通过 @ConfigurationPropertiesScan 统一加载 puzzle.* 配置。
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PuzzleServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PuzzleServiceApplication.class, args);
    }
}
