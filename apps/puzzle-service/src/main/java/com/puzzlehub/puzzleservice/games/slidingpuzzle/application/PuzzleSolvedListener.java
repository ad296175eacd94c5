package com.puzzlehub.puzzleservice.games.slidingpuzzle.application;

import com.puzzlehub.puzzleservice.clock.SessionStopwatch;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.event.PuzzleSolvedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 通关事件监听：目前只记录日志，后续排行榜等可以挂在这里。
 */
@Slf4j
@Component
public class PuzzleSolvedListener {

    @EventListener
    public void onSolved(PuzzleSolvedEvent e) {
        log.info("puzzle solved: sessionId={}, size={}x{}, moves={}, time={}",
                e.sessionId(), e.size(), e.size(), e.moves(), SessionStopwatch.format(e.elapsedMillis()));
    }
}
