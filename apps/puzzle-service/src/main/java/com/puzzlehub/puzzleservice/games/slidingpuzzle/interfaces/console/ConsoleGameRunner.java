package com.puzzlehub.puzzleservice.games.slidingpuzzle.interfaces.console;

import com.puzzlehub.puzzleservice.games.slidingpuzzle.service.SlidingPuzzleService;
import com.puzzlehub.puzzleservice.platform.config.PuzzleProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * 启动后进入文本控制台对局（puzzle.console.enabled=true 时生效，见 application-console.yml）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "puzzle.console", name = "enabled", havingValue = "true")
public class ConsoleGameRunner implements CommandLineRunner {

    private final SlidingPuzzleService svc;
    private final PuzzleProperties props;

    @Override
    public void run(String... args) throws Exception {
        Integer configured = props.getConsole().getSize();
        int size = configured != null ? configured : props.getDefaultSize();
        log.info("starting console puzzle, size={}", size);
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        new ConsoleGameLoop(svc, in, System.out).play(size);
    }
}
