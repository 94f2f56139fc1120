package com.astrochart.engine.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class EclipseActivation {
    EclipseEvent eclipse;

    ActivationStatus status;

    Integer sarosGroupId; // 사로스 그룹핑 전에는 null
}
