package com.astrochart.engine.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EclipseActivationRequest {
    private ChartSnapshot natalChart;

    private List<EclipseEvent> eclipses = new ArrayList<>();

    private Instant referenceDate; // 없으면 현재 시각

    private Double orb; // 없으면 설정값 사용

    private ActivationStatus status; // 상태 필터 (선택)
}
