package com.astrochart.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * 일식/월식 이벤트 (외부 카탈로그 제공, 읽기 전용)
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class EclipseEvent {
    Instant date;

    EclipseType type;

    String kind; // total, partial, annular, hybrid, penumbral

    Double longitude; // 식 발생 황경, 없으면 카탈로그의 영향 정보를 그대로 사용

    @Builder.Default
    List<AffectedPlanet> affectedPlanets = List.of();

    Integer house;

    @JsonProperty("hasImpact")
    boolean hasImpact;
}
