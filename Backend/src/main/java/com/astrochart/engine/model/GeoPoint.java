package com.astrochart.engine.model;

import lombok.Value;

@Value
public class GeoPoint {
    double latitude;
    double longitude; // (-180, 180]
}
