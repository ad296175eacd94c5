package com.puzzlehub.puzzleservice.games.slidingpuzzle.interfaces.console;

import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.enums.SessionPhase;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.PuzzleSnapshot;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.service.SlidingPuzzleService;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * 文本控制台对局循环（桌面控制台 / 脚本输入共用）。
 * 读一行 → 解析 → 调 service → 重绘，直到通关或退出。
 * 玩家输入 1 起始坐标，这里换算成引擎的 0 起始坐标。
 */
public class ConsoleGameLoop {

    private final SlidingPuzzleService svc;
    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleGameLoop(SlidingPuzzleService svc, BufferedReader in, PrintStream out) {
        this.svc = svc;
        this.in = in;
        this.out = out;
    }

    /**
     * 跑完一整局。
     * @param size 边长
     * @return 结束时的快照（phase=WON 表示通关，否则为中途退出）
     */
    public PuzzleSnapshot play(int size) throws IOException {
        String sessionId = svc.newGame(size);
        try {
            PuzzleSnapshot snap = svc.snapshot(sessionId);
            show(snap);
            while (true) {
                out.print("Enter your move (row, col) or 0 to quit: ");
                out.flush();
                ConsoleCommand cmd = ConsoleMoveParser.parse(in.readLine());
                switch (cmd.kind()) {
                    case QUIT:
                        out.println("Thanks for playing!");
                        return snap;
                    case INVALID:
                        out.println("Invalid input. Please enter row, col");
                        continue;
                    default:
                        break;
                }
                SlidingPuzzleService.MoveOutcome outcome = svc.move(sessionId, cmd.row() - 1, cmd.col() - 1);
                snap = outcome.snapshot();
                if (!outcome.applied()) {
                    out.printf("Invalid move! Tile at (%d, %d) cannot be moved.%n", cmd.row(), cmd.col());
                    continue;
                }
                show(snap);
                if (SessionPhase.WON.name().equals(snap.phase())) {
                    out.println();
                    out.println("Congratulations!");
                    out.printf("You solved the %dx%d puzzle!%n", snap.size(), snap.size());
                    out.printf("Moves: %d%n", snap.moves());
                    out.printf("Time: %s%n", snap.elapsed());
                    return snap;
                }
            }
        } finally {
            svc.close(sessionId);
        }
    }

    private void show(PuzzleSnapshot snap) {
        out.println();
        out.printf("Current Puzzle (%dx%d):%n", snap.size(), snap.size());
        out.print(ConsoleBoardRenderer.render(snap.cells()));
        out.println(ConsoleBoardRenderer.stats(snap));
    }
}
