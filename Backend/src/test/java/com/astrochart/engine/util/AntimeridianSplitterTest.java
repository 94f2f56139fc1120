package com.astrochart.engine.util;

import com.astrochart.engine.model.GeoPoint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AntimeridianSplitterTest {

    @Test
    void split_breaksWhereLineCrossesDateLine() {
        List<GeoPoint> points = List.of(
                new GeoPoint(0, 170), new GeoPoint(1, 179),
                new GeoPoint(2, -179), new GeoPoint(3, -170));

        List<List<GeoPoint>> segments = AntimeridianSplitter.split(points);

        assertThat(segments).hasSize(2);
        assertThat(segments.get(0)).extracting(GeoPoint::getLongitude).containsExactly(170.0, 179.0);
        assertThat(segments.get(1)).extracting(GeoPoint::getLongitude).containsExactly(-179.0, -170.0);
    }

    @Test
    void split_keepsContinuousLineWhole() {
        List<GeoPoint> points = List.of(new GeoPoint(0, -10), new GeoPoint(1, 0), new GeoPoint(2, 10));

        assertThat(AntimeridianSplitter.split(points)).containsExactly(points);
    }

    @Test
    void geoPoint_usesValueSemantics() {
        GeoPoint point = new GeoPoint(12.5, -170.25);

        assertThat(point).isEqualTo(new GeoPoint(12.5, -170.25));
        assertThat(point.toString()).isEqualTo("GeoPoint(latitude=12.5, longitude=-170.25)");
    }

    @Test
    void split_emptyInput() {
        assertThat(AntimeridianSplitter.split(List.of())).isEmpty();
        assertThat(AntimeridianSplitter.split(null)).isEmpty();
    }
}
