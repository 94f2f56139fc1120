package com.astrochart.engine.model;

import lombok.Value;

import java.util.Map;

@Value
public class ActivationStats {
    int total;
    Map<ActivationStatus, Integer> byStatus;
    Map<EclipseType, Integer> byType;
    Map<Integer, Integer> byHouse;
}
