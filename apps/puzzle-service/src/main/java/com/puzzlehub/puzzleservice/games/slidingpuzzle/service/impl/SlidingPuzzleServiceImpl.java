package com.puzzlehub.puzzleservice.games.slidingpuzzle.service.impl;

import com.puzzlehub.puzzleservice.clock.SessionStopwatch;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.constants.DifficultyLabels;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.engine.SlidingPuzzleEngine;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.enums.SessionPhase;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.event.PuzzleSolvedEvent;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.Direction;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.Position;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.PuzzleGame;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.PuzzleSession;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.PuzzleSnapshot;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.service.SlidingPuzzleService;
import com.puzzlehub.puzzleservice.platform.config.PuzzleProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;


@Slf4j
@Service
@RequiredArgsConstructor
public class SlidingPuzzleServiceImpl implements SlidingPuzzleService {

    // ====== 内存会话表 ======
    private final Map<String, PuzzleGame> games = new ConcurrentHashMap<>();

    private final SlidingPuzzleEngine engine;
    private final PuzzleProperties props;
    private final Clock clock;
    private final ApplicationEventPublisher events;

    /**
     * 新开一局
     */
    @Override
    public String newGame(Integer size) {
        // 1) 尺寸默认值与范围校验
        int n = checkSize(size == null ? props.getDefaultSize() : size);

        // 2) 引擎生成保证可解的会话，秒表立即开始
        PuzzleSession session = engine.newSession(n);
        String sessionId = UUID.randomUUID().toString();
        games.put(sessionId, new PuzzleGame(sessionId, session, SessionStopwatch.started(clock)));

        log.info("puzzle session created: sessionId={}, size={}", sessionId, n);
        return sessionId;
    }

    @Override
    public boolean canMove(String sessionId, int row, int col) {
        PuzzleGame g = game(sessionId);
        synchronized (g) {
            return engine.canMove(g.getSession(), row, col);
        }
    }

    /**
     * 移动一步；通关时停表并发布 PuzzleSolvedEvent
     */
    @Override
    public MoveOutcome move(String sessionId, int row, int col) {
        PuzzleGame g = game(sessionId);
        PuzzleSolvedEvent solved = null;
        MoveOutcome outcome;
        synchronized (g) {
            PuzzleSession s = g.getSession();
            boolean applied = engine.move(s, row, col);
            if (applied && s.phase() == SessionPhase.WON) {
                g.getStopwatch().stop();
                solved = new PuzzleSolvedEvent(sessionId, s.size(), s.moves(), g.getStopwatch().elapsedMillis());
            }
            outcome = new MoveOutcome(applied, toSnapshot(g));
        }
        // 锁外通知观察者
        if (solved != null) {
            events.publishEvent(solved);
        }
        return outcome;
    }

    @Override
    public PuzzleSnapshot restart(String sessionId) {
        PuzzleGame g = game(sessionId);
        synchronized (g) {
            g.replace(engine.restart(g.getSession()), SessionStopwatch.started(clock));
            log.info("puzzle session restarted: sessionId={}, size={}", sessionId, g.getSession().size());
            return toSnapshot(g);
        }
    }

    @Override
    public PuzzleSnapshot changeSize(String sessionId, int newSize) {
        int n = checkSize(newSize);
        PuzzleGame g = game(sessionId);
        synchronized (g) {
            int old = g.getSession().size();
            g.replace(engine.changeSize(g.getSession(), n), SessionStopwatch.started(clock));
            log.info("puzzle session resized: sessionId={}, {} -> {}", sessionId, old, n);
            return toSnapshot(g);
        }
    }

    @Override
    public PuzzleSnapshot pause(String sessionId) {
        PuzzleGame g = game(sessionId);
        synchronized (g) {
            engine.pause(g.getSession());
            g.getStopwatch().pause();
            return toSnapshot(g);
        }
    }

    @Override
    public PuzzleSnapshot resume(String sessionId) {
        PuzzleGame g = game(sessionId);
        synchronized (g) {
            engine.resume(g.getSession());
            g.getStopwatch().resume();
            return toSnapshot(g);
        }
    }

    @Override
    public PuzzleSnapshot snapshot(String sessionId) {
        PuzzleGame g = game(sessionId);
        synchronized (g) {
            return toSnapshot(g);
        }
    }

    @Override
    public void close(String sessionId) {
        if (games.remove(sessionId) == null) {
            throw new IllegalArgumentException("SESSION_NOT_FOUND: " + sessionId);
        }
        log.info("puzzle session closed: sessionId={}", sessionId);
    }

    // ----------- private helpers -----------

    private PuzzleGame game(String sessionId) {
        PuzzleGame g = games.get(sessionId);
        if (g == null) {
            throw new IllegalArgumentException("SESSION_NOT_FOUND: " + sessionId);
        }
        return g;
    }

    private int checkSize(int size) {
        if (size < props.getMinSize() || size > props.getMaxSize()) {
            throw new IllegalArgumentException("INVALID_SIZE: size must be within ["
                    + props.getMinSize() + ", " + props.getMaxSize() + "], got " + size);
        }
        return size;
    }

    /** 组装只读快照（需在会话锁内调用） */
    private PuzzleSnapshot toSnapshot(PuzzleGame g) {
        PuzzleSession s = g.getSession();
        long elapsed = g.getStopwatch().elapsedMillis();
        Position blank = s.blank();
        return new PuzzleSnapshot(
                g.getSessionId(),
                s.size(),
                DifficultyLabels.labelOf(s.size()),
                s.cells(),
                blank.row(),
                blank.col(),
                s.moves(),
                s.phase().name(),
                s.solvable(),
                elapsed,
                SessionStopwatch.format(elapsed),
                movableCells(s));
    }

    /** 可移动格：空格四周的合法格，只有 PLAYING 时才有（暂停/通关时前端不高亮） */
    private List<Position> movableCells(PuzzleSession s) {
        List<Position> out = new ArrayList<>(4);
        if (s.phase() != SessionPhase.PLAYING) return out;
        for (Direction d : Direction.values()) {
            Position p = s.blank().step(d);
            if (engine.canMove(s, p.row(), p.col())) out.add(p);
        }
        return out;
    }
}
