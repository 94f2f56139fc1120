package com.astrochart.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ReturnResult {
    Instant exactTimestamp;

    ChartSnapshot chart;

    int iterations;

    double residual; // 결과 시점의 황경 - 목표 황경 (도)

    boolean converged; // 0.01도 이내 도달 여부
}
