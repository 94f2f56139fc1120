package com.astrochart.engine.util;

import com.astrochart.engine.model.EquatorialPosition;
import com.astrochart.engine.model.GeoPoint;
import com.astrochart.engine.model.PlanetLines;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AstrocartographyCalculatorTest {

    @Test
    @DisplayName("적경 0, GMST 0 이면 MC 라인은 경도 0, IC 라인은 180")
    void meridianLines_atZeroRightAscension() {
        List<GeoPoint> mc = AstrocartographyCalculator.calculateCulminateLine(0.0, 0.0);
        List<GeoPoint> ic = AstrocartographyCalculator.calculateAnticulminateLine(0.0, 0.0);

        // -80 ~ 80, 5도 간격
        assertThat(mc).hasSize(33);
        assertThat(ic).hasSize(33);
        assertThat(mc).allSatisfy(point -> assertThat(point.getLongitude()).isCloseTo(0.0, within(1e-9)));
        assertThat(ic).allSatisfy(point -> assertThat(point.getLongitude()).isCloseTo(180.0, within(1e-9)));
        assertThat(mc.get(0).getLatitude()).isEqualTo(-80.0);
        assertThat(mc.get(32).getLatitude()).isEqualTo(80.0);
    }

    @Test
    void meridianLines_areOppositeForAnyRightAscension() {
        for (double ra = 0; ra < 360; ra += 37.5) {
            double mc = AstrocartographyCalculator.culminationLongitude(ra, 123.4);
            double ic = AstrocartographyCalculator.anticulminationLongitude(ra, 123.4);

            assertThat(CoordinateTransform.angularDistance(mc, ic)).isCloseTo(180.0, within(1e-9));
            assertThat(mc).isGreaterThan(-180.0).isLessThanOrEqualTo(180.0);
            assertThat(ic).isGreaterThan(-180.0).isLessThanOrEqualTo(180.0);
        }
    }

    @Test
    @DisplayName("적위 0인 천체는 모든 위도에서 뜨고 지며 MC 에서 90도 떨어져 있다")
    void horizonLines_forEquatorialBody() {
        List<GeoPoint> rise = AstrocartographyCalculator.calculateRiseLine(0.0, 0.0, 0.0);
        List<GeoPoint> set = AstrocartographyCalculator.calculateSetLine(0.0, 0.0, 0.0);

        assertThat(rise).hasSize(161);
        assertThat(set).hasSize(161);
        assertThat(rise).allSatisfy(point -> assertThat(point.getLongitude()).isCloseTo(-90.0, within(1e-9)));
        assertThat(set).allSatisfy(point -> assertThat(point.getLongitude()).isCloseTo(90.0, within(1e-9)));
    }

    @Test
    @DisplayName("하지 태양은 극권 위도에서 지평선 라인이 끊긴다")
    void horizonLines_skipCircumpolarLatitudes() {
        EquatorialPosition sun = CoordinateTransform.eclipticToEquatorial(90.0, 0.0);

        PlanetLines lines = AstrocartographyCalculator.calculateLines(sun, 0.0);

        assertThat(lines.getRise()).hasSize(133);
        assertThat(lines.getSet()).hasSize(133);
        assertThat(lines.getRise().get(0).getLatitude()).isEqualTo(-66.0);
        assertThat(lines.getRise().get(132).getLatitude()).isEqualTo(66.0);
        assertThat(lines.getRise()).noneMatch(point -> Math.abs(point.getLatitude()) > 66.0);
    }

    @Test
    @DisplayName("지평선 라인 점은 |-tan(위도)·tan(적위)| <= 1 인 위도에만 존재한다")
    void horizonLines_pointExistsIffHourAngleDefined() {
        double[] declinations = {-28.5, -23.4397, -10.0, -0.5, 0.0, 5.0, 17.3, 23.4397, 28.5};

        for (double dec : declinations) {
            List<GeoPoint> rise = AstrocartographyCalculator.calculateRiseLine(45.0, dec, 100.0);
            List<GeoPoint> set = AstrocartographyCalculator.calculateSetLine(45.0, dec, 100.0);

            for (int lat = AstrocartographyCalculator.MIN_LATITUDE; lat <= AstrocartographyCalculator.MAX_LATITUDE; lat++) {
                double latitude = lat;
                boolean defined = Math.abs(-Math.tan(Math.toRadians(lat)) * Math.tan(Math.toRadians(dec))) <= 1;

                assertThat(rise.stream().anyMatch(point -> point.getLatitude() == latitude))
                        .as("상승 dec=%s lat=%s", dec, lat)
                        .isEqualTo(defined);
                assertThat(set.stream().anyMatch(point -> point.getLatitude() == latitude))
                        .as("하강 dec=%s lat=%s", dec, lat)
                        .isEqualTo(defined);
            }
        }
    }

    @Test
    void horizonHourAngleCosine_isNullOnlyOutsideUnitRange() {
        double dec = 23.4397;

        assertThat(AstrocartographyCalculator.horizonHourAngleCosine(66.0, dec)).isNotNull();
        assertThat(AstrocartographyCalculator.horizonHourAngleCosine(67.0, dec)).isNull();
        assertThat(AstrocartographyCalculator.horizonHourAngleCosine(-67.0, dec)).isNull();
        assertThat(AstrocartographyCalculator.horizonHourAngleCosine(0.0, Double.NaN)).isNull();
    }

    @Test
    void allLongitudes_stayInHalfOpenRange() {
        EquatorialPosition body = CoordinateTransform.eclipticToEquatorial(217.3, 1.2);

        PlanetLines lines = AstrocartographyCalculator.calculateLines(body, 311.7);

        for (List<GeoPoint> line : List.of(lines.getRise(), lines.getSet(),
                lines.getCulminate(), lines.getAnticulminate())) {
            assertThat(line).allSatisfy(point -> assertThat(point.getLongitude())
                    .isGreaterThan(-180.0).isLessThanOrEqualTo(180.0));
        }
    }
}
