package com.astrochart.engine.controller;

import com.astrochart.engine.exception.ChartEvaluationException;
import com.astrochart.engine.exception.InvalidChartException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 컨트롤러 공통 오류 응답
 */
final class ApiErrors {

    private ApiErrors() {
    }

    static ResponseEntity<Object> response(Throwable error) {
        Throwable cause = unwrap(error);

        if (cause instanceof InvalidChartException || cause instanceof IllegalArgumentException) {
            return body(HttpStatus.BAD_REQUEST, "잘못된 요청입니다", cause);
        }
        if (cause instanceof ChartEvaluationException) {
            return body(HttpStatus.BAD_GATEWAY, "차트 계산기 오류가 발생했습니다", cause);
        }
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "계산 중 오류가 발생했습니다", cause);
    }

    static ResponseEntity<Object> body(HttpStatus status, String error, Throwable cause) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", cause.getMessage());
        return ResponseEntity.status(status).body(body);
    }

    static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
