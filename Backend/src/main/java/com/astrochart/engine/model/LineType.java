package com.astrochart.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 천체가 지평선/자오선에 위치하는 네 가지 라인
 */
public enum LineType {
    RISE("rise", "ASC"),
    SET("set", "DSC"),
    CULMINATE("culminate", "MC"),
    ANTICULMINATE("anticulminate", "IC");

    private final String jsonName;
    private final String angle;

    LineType(String jsonName, String angle) {
        this.jsonName = jsonName;
        this.angle = angle;
    }

    @JsonValue
    public String getJsonName() {
        return jsonName;
    }

    public String getAngle() {
        return angle;
    }

    @JsonCreator
    public static LineType fromValue(String value) {
        for (LineType type : values()) {
            if (type.jsonName.equalsIgnoreCase(value) || type.angle.equalsIgnoreCase(value)
                    || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("알 수 없는 라인 타입: " + value);
    }
}
