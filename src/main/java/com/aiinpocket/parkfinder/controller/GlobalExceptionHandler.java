package com.aiinpocket.parkfinder.controller;

import com.aiinpocket.parkfinder.exception.DuplicateVoteException;
import com.aiinpocket.parkfinder.exception.NotFoundOrHiddenException;
import com.aiinpocket.parkfinder.exception.UnauthorizedException;
import com.aiinpocket.parkfinder.exception.UnknownParkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

/**
 * 全域 REST API 異常處理器。
 * 把服務層的領域例外轉成統一的 {@code {"error": "..."}} 回應，前端永遠不會收到原始堆疊追蹤。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(DuplicateVoteException.class)
    public ResponseEntity<Map<String, String>> handleDuplicateVote(DuplicateVoteException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler({UnknownParkException.class, NotFoundOrHiddenException.class})
    public ResponseEntity<Map<String, String>> handleNotFound(RuntimeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<Map<String, String>> handleUnauthorized(UnauthorizedException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        String msg = sanitizeMessage(e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", msg));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .orElse("請求欄位驗證失敗");
        return ResponseEntity.badRequest().body(Map.of("error", msg));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "參數 " + e.getName() + " 格式不正確"));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "請求格式不正確，請檢查欄位型別"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, String>> handleNoResource(NoResourceFoundException e) {
        log.debug("資源不存在: {}", e.getResourcePath());
        return ResponseEntity.status(404).body(Map.of("error", "資源不存在"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneral(Exception e) {
        log.error("[GlobalExceptionHandler] 未預期的錯誤", e);
        return ResponseEntity.internalServerError()
                .body(Map.of("error", "系統發生錯誤，請稍後重試"));
    }

    /** 過濾可能含有敏感資訊的錯誤訊息 */
    private static String sanitizeMessage(String msg) {
        if (msg == null || msg.length() > 200) return "操作失敗，請稍後重試";
        String lower = msg.toLowerCase();
        if (lower.contains("sql") || lower.contains("exception") || lower.contains("constraint")
                || lower.contains("connection") || lower.contains("token")) {
            return "操作失敗，請稍後重試";
        }
        return msg;
    }
}
