package com.astrochart.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 차트 계산기 응답
 */
@Value
@Builder
public class ChartEvaluation {
    boolean success;

    String error;

    @Builder.Default
    Map<String, PlanetPosition> planets = Map.of();

    @Builder.Default
    List<Double> houses = List.of();

    double ascendant;

    double midheaven;

    public static ChartEvaluation failure(String error) {
        return ChartEvaluation.builder().success(false).error(error).build();
    }

    public ChartSnapshot toSnapshot(Instant timestamp, GeoLocation location) {
        return ChartSnapshot.builder()
                .timestamp(timestamp)
                .location(location)
                .houseCusps(houses == null ? List.of() : List.copyOf(houses))
                .ascendant(ascendant)
                .midheaven(midheaven)
                .planets(planets == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(planets)))
                .build();
    }
}
