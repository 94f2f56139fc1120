package com.astrochart.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EclipseType {
    SOLAR,
    LUNAR;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static EclipseType fromValue(String value) {
        return EclipseType.valueOf(value.trim().toUpperCase());
    }
}
