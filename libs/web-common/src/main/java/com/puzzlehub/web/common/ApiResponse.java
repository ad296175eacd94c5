package com.puzzlehub.web.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式（所有前端：触屏网格 / 调试页面共用）
 *
 * @param code    状态码：200 成功，400 参数错误，409 状态冲突
 * @param message 响应消息
 * @param data    响应数据
 * @param <T>     响应数据类型
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    /** 成功响应（无数据），如关闭会话 */
    public static <T> ApiResponse<T> success() {
        return new ApiResponse<>(200, "success", null);
    }

    /** 成功响应（带数据） */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    /** 400：参数不合法（尺寸越界、会话不存在、请求体缺字段） */
    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, message, null);
    }

    /** 409：会话状态不允许该操作（例如已通关后再暂停） */
    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(409, message, null);
    }
}
