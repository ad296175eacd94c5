package com.puzzlehub.puzzleservice.clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * ClockAutoConfig
 * ---------------------------------------
 * 计时相关 Bean：提供系统时钟，供 {@link SessionStopwatch} 使用。
 */
@Configuration
public class ClockAutoConfig {

    @Bean
    public Clock puzzleClock() {
        return Clock.systemUTC();
    }
}
