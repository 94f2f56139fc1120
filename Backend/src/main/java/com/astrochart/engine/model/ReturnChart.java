package com.astrochart.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 솔라/루나 리턴 차트
 */
@Value
@Builder
public class ReturnChart {
    ReturnType returnType;

    Instant returnTimestamp;

    ChartSnapshot chart;

    ChartSnapshot natalChart;

    boolean converged;
}
