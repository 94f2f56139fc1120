package com.astrochart.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 천체 위치 (외부 차트 계산기가 제공)
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlanetPosition {
    String name;

    double longitude; // 황경 (도, 0~360)

    @Builder.Default
    double latitude = 0.0; // 황위 (도), 알 수 없으면 0

    double velocity; // 일일 속도 (도/일), 음수면 역행

    @JsonIgnore
    public boolean isRetrograde() {
        return velocity < 0;
    }
}
