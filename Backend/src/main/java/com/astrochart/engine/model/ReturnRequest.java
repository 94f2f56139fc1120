package com.astrochart.engine.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 솔라/루나 리턴 요청
 */
@Data
@NoArgsConstructor
public class ReturnRequest {
    private Instant natalInstant;
    private GeoLocation natalLocation;
    private int returnYear;
    private Integer returnMonth; // 루나 리턴에만 사용
    private GeoLocation returnLocation; // 없으면 출생지
}
