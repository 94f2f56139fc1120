package com.astrochart.engine.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 천체 하나의 라인 4개
 */
@Value
@Builder
public class PlanetLines {
    List<GeoPoint> rise;
    List<GeoPoint> set;
    List<GeoPoint> culminate;
    List<GeoPoint> anticulminate;

    public List<GeoPoint> line(LineType type) {
        switch (type) {
            case RISE:
                return rise;
            case SET:
                return set;
            case CULMINATE:
                return culminate;
            default:
                return anticulminate;
        }
    }

    public List<AstrocartographyLine> toLines(String bodyName) {
        return List.of(
                new AstrocartographyLine(bodyName, LineType.RISE, rise),
                new AstrocartographyLine(bodyName, LineType.SET, set),
                new AstrocartographyLine(bodyName, LineType.CULMINATE, culminate),
                new AstrocartographyLine(bodyName, LineType.ANTICULMINATE, anticulminate));
    }
}
