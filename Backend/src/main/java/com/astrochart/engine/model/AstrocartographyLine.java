package com.astrochart.engine.model;

import lombok.Value;

import java.util.List;

@Value
public class AstrocartographyLine {
    String bodyName;
    LineType lineType;
    List<GeoPoint> points; // 위도 오름차순, 중간에 빠진 위도가 있을 수 있음
}
