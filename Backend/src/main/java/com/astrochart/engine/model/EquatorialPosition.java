package com.astrochart.engine.model;

import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class EquatorialPosition {
    double rightAscension; // 적경, 0~360 (도)
    double declination;    // 적위 (도)
}
