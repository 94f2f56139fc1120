package com.astrochart.engine.model;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 사로스 주기로 묶인 일식/월식 (날짜순)
 */
@Value
public class SarosGroup {
    int id;
    List<EclipseActivation> members;

    public Instant earliestDate() {
        return members.get(0).getEclipse().getDate();
    }
}
