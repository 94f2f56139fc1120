package com.astrochart.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReturnType {
    SOLAR("SUN"),
    LUNAR("MOON");

    private final String bodyKey;

    ReturnType(String bodyKey) {
        this.bodyKey = bodyKey;
    }

    public String getBodyKey() {
        return bodyKey;
    }

    @JsonValue
    public String jsonName() {
        return name().toLowerCase();
    }
}
