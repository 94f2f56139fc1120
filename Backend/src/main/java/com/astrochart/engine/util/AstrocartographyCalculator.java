package com.astrochart.engine.util;

import com.astrochart.engine.model.EquatorialPosition;
import com.astrochart.engine.model.GeoPoint;
import com.astrochart.engine.model.PlanetLines;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 천체 라인 계산 유틸리티 클래스
 * 천체가 동쪽 지평선(상승), 서쪽 지평선(하강), 상부 자오선(남중), 하부 자오선(북중)에
 * 놓이는 지구상 경도를 위도별로 계산한다.
 */
public final class AstrocartographyCalculator {

    /** 위도 범위 (극지방은 지평선 식이 발산하므로 제외) */
    public static final int MIN_LATITUDE = -80;
    public static final int MAX_LATITUDE = 80;

    /** 상승/하강 라인 위도 간격 */
    public static final int HORIZON_LATITUDE_STEP = 1;

    /** 남중/북중 라인은 경도가 일정하므로 성긴 간격 사용 */
    public static final int MERIDIAN_LATITUDE_STEP = 5;

    private AstrocartographyCalculator() {
    }

    /**
     * 한 천체의 라인 4개 계산
     */
    public static PlanetLines calculateLines(EquatorialPosition equatorial, double gmst) {
        double ra = equatorial.getRightAscension();
        double dec = equatorial.getDeclination();

        return PlanetLines.builder()
                .rise(calculateRiseLine(ra, dec, gmst))
                .set(calculateSetLine(ra, dec, gmst))
                .culminate(calculateCulminateLine(ra, gmst))
                .anticulminate(calculateAnticulminateLine(ra, gmst))
                .build();
    }

    /**
     * 상승(ASC) 라인: 시간각 음수 (동쪽 지평선)
     */
    public static List<GeoPoint> calculateRiseLine(double ra, double dec, double gmst) {
        return calculateHorizonLine(ra, dec, gmst, -1);
    }

    /**
     * 하강(DSC) 라인: 시간각 양수 (서쪽 지평선)
     */
    public static List<GeoPoint> calculateSetLine(double ra, double dec, double gmst) {
        return calculateHorizonLine(ra, dec, gmst, 1);
    }

    private static List<GeoPoint> calculateHorizonLine(double ra, double dec, double gmst, int hourAngleSign) {
        List<GeoPoint> points = new ArrayList<>();

        for (int lat = MIN_LATITUDE; lat <= MAX_LATITUDE; lat += HORIZON_LATITUDE_STEP) {
            Double cosH = horizonHourAngleCosine(lat, dec);

            // 주극성이거나 뜨지 않는 위도는 건너뜀
            if (cosH == null) {
                continue;
            }

            double hourAngle = hourAngleSign * Math.toDegrees(Math.acos(cosH));

            // 천체가 지평선에 있을 때의 지방 항성시 → 경도
            double lst = CoordinateTransform.normalizeAngle(ra + hourAngle);
            double longitude = CoordinateTransform.normalizeLongitude(lst - gmst);

            points.add(new GeoPoint(lat, longitude));
        }

        return Collections.unmodifiableList(points);
    }

    /**
     * 지평선 통과 시간각의 코사인. |cosH| > 1 이면 해당 위도에서 뜨거나 지지 않으므로 null.
     */
    public static Double horizonHourAngleCosine(double latitude, double declination) {
        double cosH = -Math.tan(Math.toRadians(latitude)) * Math.tan(Math.toRadians(declination));
        if (Double.isNaN(cosH) || Math.abs(cosH) > 1) {
            return null;
        }
        return cosH;
    }

    /**
     * 남중(MC) 라인: 적경 = 지방 항성시
     */
    public static List<GeoPoint> calculateCulminateLine(double ra, double gmst) {
        return meridianLine(culminationLongitude(ra, gmst));
    }

    /**
     * 북중(IC) 라인: 남중 라인의 정반대 경도
     */
    public static List<GeoPoint> calculateAnticulminateLine(double ra, double gmst) {
        return meridianLine(anticulminationLongitude(ra, gmst));
    }

    public static double culminationLongitude(double ra, double gmst) {
        return CoordinateTransform.normalizeLongitude(ra - gmst);
    }

    public static double anticulminationLongitude(double ra, double gmst) {
        return CoordinateTransform.normalizeLongitude(culminationLongitude(ra, gmst) + 180);
    }

    private static List<GeoPoint> meridianLine(double longitude) {
        List<GeoPoint> points = new ArrayList<>();
        for (int lat = MIN_LATITUDE; lat <= MAX_LATITUDE; lat += MERIDIAN_LATITUDE_STEP) {
            points.add(new GeoPoint(lat, longitude));
        }
        return Collections.unmodifiableList(points);
    }
}
