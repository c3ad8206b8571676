package com.golizard.termgraph.controller;

import com.golizard.termgraph.exception.GraphCleaningException;
import com.golizard.termgraph.exception.MalformedTermGraphException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 清理接口异常处理
 * 清理失败和图不合法返回 422，参数错误返回 400
 */
@Slf4j
@RestControllerAdvice
public class TermGraphExceptionHandler {

    @ExceptionHandler(GraphCleaningException.class)
    public ResponseEntity<Map<String, Object>> handleCleaningFailure(GraphCleaningException e) {
        log.error("【术语图清理】-> 清理失败: 类别={}, 尝试次数={}, 原因={}", e.getCategory(), e.getAttempt(), e.getMessage());
        Map<String, Object> body = errorBody(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
        body.put("category", e.getCategory());
        body.put("attempt", e.getAttempt());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(MalformedTermGraphException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedGraph(MalformedTermGraphException e) {
        log.error("【术语图清理】-> 术语图不合法: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(errorBody(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        log.warn("【输入验证失败】-> {}", e.getMessage());
        return ResponseEntity.badRequest().body(errorBody(HttpStatus.BAD_REQUEST, e.getMessage()));
    }

    private static Map<String, Object> errorBody(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        return body;
    }
}
