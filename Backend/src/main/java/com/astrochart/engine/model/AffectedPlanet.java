package com.astrochart.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 일식/월식 황경과 오브 이내에 있는 출생 천체
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AffectedPlanet {
    String planet;
    String planetKey;
    double natalLongitude;
    double orb;    // 실제 각거리 (도)
    String aspect; // "exact" (1도 미만) 또는 "applying"
}
