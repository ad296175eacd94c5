package com.puzzlehub.puzzleservice.games.slidingpuzzle.infrastructure.config;

import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.engine.SlidingPuzzleEngine;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.rule.ShuffleGenerator;
import com.puzzlehub.puzzleservice.platform.config.PuzzleProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * 引擎装配：随机源 → 打乱生成器 → 引擎。
 * 引擎本身是纯 Java 对象，这里只负责把配置拼起来。
 */
@Slf4j
@Configuration
public class PuzzleEngineConfig {

    /** 打乱用随机源；配置了 puzzle.seed 时固定种子 */
    @Bean
    public RandomGenerator puzzleRandom(PuzzleProperties props) {
        if (props.getSeed() != null) {
            log.info("puzzle shuffle uses fixed seed {}", props.getSeed());
            return new Random(props.getSeed());
        }
        return new Random();
    }

    @Bean
    public ShuffleGenerator shuffleGenerator(RandomGenerator puzzleRandom, PuzzleProperties props) {
        return new ShuffleGenerator(puzzleRandom, props.getShuffleFactor());
    }

    @Bean
    public SlidingPuzzleEngine slidingPuzzleEngine(ShuffleGenerator shuffleGenerator) {
        return new SlidingPuzzleEngine(shuffleGenerator);
    }
}
