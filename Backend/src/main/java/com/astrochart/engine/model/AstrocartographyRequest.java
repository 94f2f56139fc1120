package com.astrochart.engine.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AstrocartographyRequest {
    private Instant birthInstant; // 출생 시각 (UTC)

    private Map<String, PlanetPosition> planets = new LinkedHashMap<>();

    // 비어 있으면 모든 천체 계산
    private List<String> enabledBodies = new ArrayList<>();
}
