package com.astrochart.engine.model;

import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Value
public class AstrocartographyResult {
    Instant birthInstant;
    double julianDay;
    double gmst;
    Map<String, BodyLines> bodies; // 요청 순서 유지

    /**
     * 성공한 천체의 라인만 (천체명 → 라인)
     */
    public Map<String, PlanetLines> successfulLines() {
        Map<String, PlanetLines> result = new LinkedHashMap<>();
        bodies.forEach((name, body) -> {
            if (body.isSuccess()) {
                result.put(name, body.getLines());
            }
        });
        return result;
    }

    /**
     * 성공한 천체의 라인을 천체별 4개씩 펼친 목록
     */
    public List<AstrocartographyLine> allLines() {
        return bodies.values().stream()
                .filter(BodyLines::isSuccess)
                .flatMap(body -> body.getLines().toLines(body.getBodyName()).stream())
                .collect(Collectors.toList());
    }

    public List<String> failedBodies() {
        return bodies.values().stream()
                .filter(body -> !body.isSuccess())
                .map(BodyLines::getBodyName)
                .collect(Collectors.toList());
    }
}
