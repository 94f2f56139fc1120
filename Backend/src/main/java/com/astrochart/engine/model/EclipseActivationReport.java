package com.astrochart.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class EclipseActivationReport {
    Instant referenceDate;
    double orb;
    List<EclipseActivation> activations; // 날짜순, 사로스 그룹 id 포함
    List<SarosGroup> sarosGroups;
    ActivationStats stats;
}
