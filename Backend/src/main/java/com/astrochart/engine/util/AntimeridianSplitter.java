package com.astrochart.engine.util;

import com.astrochart.engine.model.GeoPoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 지도 표시용: 인접 점의 경도 차가 180도를 넘는 곳(날짜변경선 통과)에서 라인을 끊는다.
 * 계산 결과 자체는 끊지 않으며, 표시하는 쪽에서 필요할 때만 사용한다.
 */
public final class AntimeridianSplitter {

    private AntimeridianSplitter() {
    }

    public static List<List<GeoPoint>> split(List<GeoPoint> points) {
        List<List<GeoPoint>> segments = new ArrayList<>();
        if (points == null || points.isEmpty()) {
            return segments;
        }

        List<GeoPoint> current = new ArrayList<>();
        GeoPoint previous = null;

        for (GeoPoint point : points) {
            if (previous != null && Math.abs(point.getLongitude() - previous.getLongitude()) > 180) {
                segments.add(Collections.unmodifiableList(current));
                current = new ArrayList<>();
            }
            current.add(point);
            previous = point;
        }
        segments.add(Collections.unmodifiableList(current));

        return segments;
    }
}
