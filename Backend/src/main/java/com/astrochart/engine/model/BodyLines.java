package com.astrochart.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 천체별 계산 결과. 성공 시 라인, 실패 시 사유를 가진다.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BodyLines {
    String bodyName;
    boolean success;
    EquatorialPosition equatorial;
    PlanetLines lines;
    String failureReason;

    public static BodyLines succeeded(String bodyName, EquatorialPosition equatorial, PlanetLines lines) {
        return new BodyLines(bodyName, true, equatorial, lines, null);
    }

    public static BodyLines failed(String bodyName, String reason) {
        return new BodyLines(bodyName, false, null, null, reason);
    }
}
