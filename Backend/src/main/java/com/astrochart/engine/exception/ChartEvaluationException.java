package com.astrochart.engine.exception;

import lombok.Getter;

import java.time.Instant;

/**
 * 외부 차트 계산기 실패 (success=false, 예외, 요청 천체 누락)
 */
@Getter
public class ChartEvaluationException extends RuntimeException {

    private final Instant instant;

    public ChartEvaluationException(String message, Instant instant) {
        super(message);
        this.instant = instant;
    }

    public ChartEvaluationException(String message, Instant instant, Throwable cause) {
        super(message, cause);
        this.instant = instant;
    }
}
