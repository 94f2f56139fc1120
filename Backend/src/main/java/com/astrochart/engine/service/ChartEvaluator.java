package com.astrochart.engine.service;

import com.astrochart.engine.model.ChartEvaluation;
import com.astrochart.engine.model.GeoLocation;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * 외부 차트 계산기 (천문력 엔진). 주어진 시각/위치의 천체 위치와 하우스를 계산한다.
 * 실패 시 success=false 를 반환하거나 예외로 완료한다.
 */
@FunctionalInterface
public interface ChartEvaluator {

    CompletableFuture<ChartEvaluation> evaluate(Instant instant, GeoLocation location);
}
