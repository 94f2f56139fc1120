package com.astrochart.engine.util;

import com.astrochart.engine.model.EquatorialPosition;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.JulianFields;

/**
 * 좌표계 변환 및 항성시 계산 유틸리티 클래스
 * 황도 좌표 → 적도 좌표, 율리우스 일, 그리니치 평균 항성시(GMST)
 */
public final class CoordinateTransform {

    /** 황도 경사각 (도, 고정값) */
    public static final double OBLIQUITY = 23.4397;

    /** J2000.0 기준 율리우스 일 */
    public static final double J2000 = 2451545.0;

    private CoordinateTransform() {
    }

    /**
     * 황도 좌표(경도, 위도)를 적도 좌표(적경, 적위)로 변환
     */
    public static EquatorialPosition eclipticToEquatorial(double longitude, double latitude) {
        double lambda = Math.toRadians(longitude);
        double beta = Math.toRadians(latitude);
        double eps = Math.toRadians(OBLIQUITY);

        // 1. 적경 계산
        double ra = Math.atan2(
                Math.sin(lambda) * Math.cos(eps) - Math.tan(beta) * Math.sin(eps),
                Math.cos(lambda));

        // 2. 적위 계산
        double dec = Math.asin(
                Math.sin(beta) * Math.cos(eps) + Math.cos(beta) * Math.sin(eps) * Math.sin(lambda));

        return new EquatorialPosition(normalizeAngle(Math.toDegrees(ra)), Math.toDegrees(dec));
    }

    /**
     * UTC 시각을 율리우스 일로 변환
     */
    public static double julianDay(Instant instant) {
        return julianDay(instant.atZone(ZoneOffset.UTC));
    }

    /**
     * UTC 기준 LocalDateTime을 율리우스 일로 변환
     */
    public static double julianDay(LocalDateTime utcDateTime) {
        return julianDay(utcDateTime.atZone(ZoneOffset.UTC));
    }

    public static double julianDay(ZonedDateTime dateTime) {
        ZonedDateTime utcDateTime = dateTime.withZoneSameInstant(ZoneOffset.UTC);

        // JULIAN_DAY는 해당 날짜 정오 기준 정수 일수이므로 시간에서 12시간을 뺀다
        return utcDateTime.getLong(JulianFields.JULIAN_DAY) +
                (utcDateTime.getHour() - 12) / 24.0 +
                utcDateTime.getMinute() / 1440.0 +
                utcDateTime.getSecond() / 86400.0 +
                utcDateTime.getNano() / 86400.0e9;
    }

    /**
     * 그리니치 평균 항성시 계산 (도, 0~360)
     */
    public static double gmst(double julianDay) {
        // J2000.0 이후 율리우스 세기
        double t = (julianDay - J2000) / 36525.0;

        double gmst = 280.46061837 + 360.98564736629 * (julianDay - J2000) +
                0.000387933 * t * t - (t * t * t) / 38710000.0;

        return normalizeAngle(gmst);
    }

    /**
     * 지방 항성시 계산 (동경 양수)
     */
    public static double localSiderealTime(double gmst, double longitude) {
        return normalizeAngle(gmst + longitude);
    }

    /**
     * 각도를 [0, 360) 범위로 정규화
     */
    public static double normalizeAngle(double angle) {
        double normalized = angle % 360.0;
        if (normalized < 0) {
            normalized += 360.0;
        }
        // -1e-15 % 360 + 360 이 360.0 으로 반올림되는 경우
        return normalized >= 360.0 ? 0.0 : normalized;
    }

    /**
     * 경도를 (-180, 180] 범위로 정규화
     */
    public static double normalizeLongitude(double longitude) {
        double normalized = normalizeAngle(longitude);
        return normalized > 180.0 ? normalized - 360.0 : normalized;
    }

    /**
     * 두 황경 사이의 최단 부호 호 (a - b), (-180, 180]
     */
    public static double angularDifference(double a, double b) {
        return normalizeLongitude(a - b);
    }

    /**
     * 두 황경 사이의 각거리, [0, 180]
     */
    public static double angularDistance(double a, double b) {
        return Math.abs(angularDifference(a, b));
    }
}
