package com.astrochart.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 기준일 대비 일식/월식 활성 상태
 */
public enum ActivationStatus {
    FUTURE,
    APPROACHING,
    ACTIVE,
    INTEGRATING,
    COMPLETE;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ActivationStatus fromValue(String value) {
        return ActivationStatus.valueOf(value.trim().toUpperCase());
    }
}
