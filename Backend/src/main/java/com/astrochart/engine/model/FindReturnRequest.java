package com.astrochart.engine.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
public class FindReturnRequest {
    private double targetLongitude;
    private Instant windowStart;
    private Instant windowEnd;
    private String bodyKey;
    private GeoLocation location;
}
