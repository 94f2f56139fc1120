package com.astrochart.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class GeoLocation {
    double latitude;
    double longitude;

    @Builder.Default
    String houseSystem = "placidus";

    public static GeoLocation of(double latitude, double longitude) {
        return GeoLocation.builder().latitude(latitude).longitude(longitude).build();
    }
}
