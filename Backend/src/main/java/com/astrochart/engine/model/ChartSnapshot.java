package com.astrochart.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 특정 시각에 계산된 차트 스냅샷. 생성 후 변경하지 않는다.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChartSnapshot {
    Instant timestamp;

    GeoLocation location;

    @Builder.Default
    List<Double> houseCusps = List.of(); // 12개 하우스 커스프 황경

    double ascendant;

    double midheaven;

    Map<String, PlanetPosition> planets;
}
