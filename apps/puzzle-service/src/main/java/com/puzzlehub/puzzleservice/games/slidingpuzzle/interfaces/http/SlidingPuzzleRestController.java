package com.puzzlehub.puzzleservice.games.slidingpuzzle.interfaces.http;

import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.constants.DifficultyLabels;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.domain.model.PuzzleSnapshot;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.interfaces.http.dto.DifficultyOption;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.interfaces.http.dto.MoveRequest;
import com.puzzlehub.puzzleservice.games.slidingpuzzle.service.SlidingPuzzleService;
import com.puzzlehub.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 拼图 http 接口（触屏网格前端）
 * 坐标一律 0 起始；每次操作都返回最新快照，前端据此整盘重绘。
 */
@RestController
@RequestMapping("/api/puzzle")
@RequiredArgsConstructor
public class SlidingPuzzleRestController {

    private final SlidingPuzzleService svc;

    /**
     * 新开一局：size 缺省取 puzzle.default-size
     */
    @PostMapping("/new")
    public ResponseEntity<ApiResponse<String>> newGame(@RequestParam(name = "size", required = false) Integer size) {
        return ResponseEntity.ok(ApiResponse.success(svc.newGame(size)));
    }

    /**
     * 获取会话的只读快照（首屏渲染 / 断线后重新拉取）
     */
    @GetMapping("/sessions/{sessionId}/view")
    public ResponseEntity<ApiResponse<PuzzleSnapshot>> view(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(svc.snapshot(sessionId)));
    }

    /**
     * 点击某块移动
     * 语义：
     * - 合法：applied=true，快照为移动后的局面（可能已 WON）；
     * - 非法（越界/空格/不相邻/暂停中）：仍返回 200，applied=false，局面不变。
     */
    @PostMapping("/sessions/{sessionId}/move")
    public ResponseEntity<ApiResponse<SlidingPuzzleService.MoveOutcome>> move(@PathVariable String sessionId,
                                                                              @Valid @RequestBody MoveRequest req) {
        var outcome = svc.move(sessionId, req.getRow(), req.getCol());
        return ResponseEntity.ok(ApiResponse.success(outcome));
    }

    /** 以当前尺寸重开 */
    @PostMapping("/sessions/{sessionId}/restart")
    public ResponseEntity<ApiResponse<PuzzleSnapshot>> restart(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(svc.restart(sessionId)));
    }

    /** 换难度（尺寸）重开 */
    @PostMapping("/sessions/{sessionId}/size")
    public ResponseEntity<ApiResponse<PuzzleSnapshot>> changeSize(@PathVariable String sessionId,
                                                                  @RequestParam(name = "size") int size) {
        return ResponseEntity.ok(ApiResponse.success(svc.changeSize(sessionId, size)));
    }

    /** 暂停（切后台 / 打开设置页） */
    @PostMapping("/sessions/{sessionId}/pause")
    public ResponseEntity<ApiResponse<PuzzleSnapshot>> pause(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(svc.pause(sessionId)));
    }

    /** 恢复 */
    @PostMapping("/sessions/{sessionId}/resume")
    public ResponseEntity<ApiResponse<PuzzleSnapshot>> resume(@PathVariable String sessionId) {
        return ResponseEntity.ok(ApiResponse.success(svc.resume(sessionId)));
    }

    /** 关闭会话 */
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<ApiResponse<Void>> close(@PathVariable String sessionId) {
        svc.close(sessionId);
        return ResponseEntity.ok(ApiResponse.success());
    }

    /** 难度选择器：预设尺寸与显示名 */
    @GetMapping("/difficulties")
    public ResponseEntity<ApiResponse<List<DifficultyOption>>> difficulties() {
        List<DifficultyOption> options = DifficultyLabels.presets().entrySet().stream()
                .map(e -> new DifficultyOption(e.getKey(), e.getValue()))
                .toList();
        return ResponseEntity.ok(ApiResponse.success(options));
    }
}
