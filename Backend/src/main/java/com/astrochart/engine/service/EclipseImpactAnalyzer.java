package com.astrochart.engine.service;

import com.astrochart.engine.model.AffectedPlanet;
import com.astrochart.engine.model.ChartSnapshot;
import com.astrochart.engine.model.EclipseEvent;
import com.astrochart.engine.model.PlanetPosition;
import com.astrochart.engine.util.CoordinateTransform;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 일식/월식이 출생 차트에 미치는 영향 (오브 이내 천체, 해당 하우스)
 */
@Service
public class EclipseImpactAnalyzer {

    /** 이 각거리 미만이면 exact */
    private static final double EXACT_ORB = 1.0;

    /**
     * 황경이 있는 이벤트는 출생 차트 기준으로 영향 정보를 다시 계산한 새 이벤트를 반환한다.
     * 황경이 없으면 카탈로그가 준 영향 정보를 그대로 둔다.
     */
    public EclipseEvent annotate(ChartSnapshot natalChart, EclipseEvent eclipse, double orb) {
        if (eclipse.getLongitude() == null) {
            return eclipse;
        }

        double eclipseLongitude = CoordinateTransform.normalizeAngle(eclipse.getLongitude());
        List<AffectedPlanet> affected = findAffectedPlanets(natalChart.getPlanets(), eclipseLongitude, orb);

        return eclipse.toBuilder()
                .affectedPlanets(affected)
                .house(determineHouse(eclipseLongitude, natalChart.getHouseCusps()))
                .hasImpact(!affected.isEmpty())
                .build();
    }

    List<AffectedPlanet> findAffectedPlanets(Map<String, PlanetPosition> planets, double eclipseLongitude, double orb) {
        List<AffectedPlanet> affected = new ArrayList<>();

        for (Map.Entry<String, PlanetPosition> entry : planets.entrySet()) {
            PlanetPosition planet = entry.getValue();
            if (planet == null || !Double.isFinite(planet.getLongitude())) {
                continue;
            }

            double distance = CoordinateTransform.angularDistance(eclipseLongitude, planet.getLongitude());
            if (distance <= orb) {
                affected.add(AffectedPlanet.builder()
                        .planet(planet.getName() != null ? planet.getName() : entry.getKey())
                        .planetKey(entry.getKey())
                        .natalLongitude(planet.getLongitude())
                        .orb(distance)
                        .aspect(distance < EXACT_ORB ? "exact" : "applying")
                        .build());
            }
        }

        // 가장 가까운 오브 순
        affected.sort(Comparator.comparingDouble(AffectedPlanet::getOrb));
        return List.copyOf(affected);
    }

    /**
     * 황경이 속한 하우스 (1~12). 커스프가 12개가 아니면 null.
     */
    Integer determineHouse(double longitude, List<Double> cusps) {
        if (cusps == null || cusps.size() != 12) {
            return null;
        }

        for (int i = 0; i < 12; i++) {
            double current = CoordinateTransform.normalizeAngle(cusps.get(i));
            double next = CoordinateTransform.normalizeAngle(cusps.get((i + 1) % 12));

            if (next > current) {
                if (longitude >= current && longitude < next) {
                    return i + 1;
                }
            } else if (longitude >= current || longitude < next) {
                // 0도를 넘어가는 하우스
                return i + 1;
            }
        }

        return 1;
    }
}
