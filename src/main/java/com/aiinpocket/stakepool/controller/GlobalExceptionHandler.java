package com.aiinpocket.stakepool.controller;

import com.aiinpocket.stakepool.exception.StakingError;
import com.aiinpocket.stakepool.exception.StakingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * 全域 REST API 異常處理器。
 * 業務例外依錯誤類別對應 HTTP 狀態碼，回傳 {error, code}；永遠不回傳堆疊追蹤。
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(StakingException.class)
    public ResponseEntity<Map<String, String>> handleStaking(StakingException e) {
        HttpStatus status = statusOf(e.getError());
        log.debug("[API] {} -> {}: {}", e.getError(), status.value(), e.getMessage());
        return ResponseEntity.status(status)
                .body(Map.of("error", sanitizeMessage(e.getMessage()), "code", e.getError().name()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException e) {
        String field = e.getBindingResult().getFieldError() != null
                ? e.getBindingResult().getFieldError().getField() : "request";
        return ResponseEntity.badRequest().body(Map.of("error", "欄位不正確: " + field, "code", "INVALID_REQUEST"));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, String>> handleMissingHeader(MissingRequestHeaderException e) {
        return ResponseEntity.badRequest()
                .body(Map.of("error", "缺少標頭 " + e.getHeaderName(), "code", StakingError.INVALID_ADDRESS.name()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest().body(Map.of("error", "請求格式不正確，請檢查欄位型別", "code", "INVALID_REQUEST"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneral(Exception e) {
        log.error("[GlobalExceptionHandler] 未預期的錯誤", e);
        return ResponseEntity.internalServerError()
                .body(Map.of("error", "系統發生錯誤，請稍後重試", "code", "INTERNAL_ERROR"));
    }

    static HttpStatus statusOf(StakingError error) {
        return switch (error) {
            case DAILY_LIMIT_EXCEEDED, TOO_MANY_ACTIONS_TODAY -> HttpStatus.TOO_MANY_REQUESTS;
            case CONTRACT_PAUSED -> HttpStatus.LOCKED;
            default -> switch (error.getCategory()) {
                case VALIDATION -> HttpStatus.BAD_REQUEST;
                case AUTHORIZATION -> HttpStatus.FORBIDDEN;
                case POLICY, RESOURCE, STATE -> HttpStatus.CONFLICT;
            };
        };
    }

    /** 過濾可能含有敏感資訊的錯誤訊息 */
    private static String sanitizeMessage(String msg) {
        if (msg == null || msg.length() > 200) return "操作失敗，請稍後重試";
        String lower = msg.toLowerCase();
        if (lower.contains("sql") || lower.contains("exception") || lower.contains("constraint")
                || lower.contains("connection") || lower.contains("timeout")) {
            return "操作失敗，請稍後重試";
        }
        return msg;
    }
}
