package com.astrochart.engine.service;

import com.astrochart.engine.exception.InvalidChartException;
import com.astrochart.engine.model.AstrocartographyRequest;
import com.astrochart.engine.model.AstrocartographyResult;
import com.astrochart.engine.model.BodyLines;
import com.astrochart.engine.model.EquatorialPosition;
import com.astrochart.engine.model.PlanetLines;
import com.astrochart.engine.model.PlanetPosition;
import com.astrochart.engine.util.AstrocartographyCalculator;
import com.astrochart.engine.util.CoordinateTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 출생 시각 기준 천체별 상승/하강/남중/북중 라인 생성
 */
@Service
public class AstrocartographyService {

    private static final Logger logger = LoggerFactory.getLogger(AstrocartographyService.class);

    private final Executor executor;

    public AstrocartographyService(@Qualifier("engineExecutor") Executor executor) {
        this.executor = executor;
    }

    /**
     * 모든 (활성) 천체의 라인을 병렬로 계산.
     * 한 천체의 계산 실패는 해당 천체만 실패로 기록하고 나머지는 계속 진행한다.
     */
    public AstrocartographyResult generateLines(AstrocartographyRequest request) {
        if (request == null || request.getBirthInstant() == null) {
            throw new InvalidChartException("출생 시각이 없는 차트입니다");
        }
        if (request.getPlanets() == null) {
            throw new InvalidChartException("천체 정보가 없는 차트입니다");
        }

        Instant birthInstant = request.getBirthInstant();

        // 출생 시각의 율리우스 일, 항성시 (모든 천체 공통)
        double julianDay = CoordinateTransform.julianDay(birthInstant);
        double gmst = CoordinateTransform.gmst(julianDay);

        logger.info("천체 라인 계산 시작: 출생={}, JD={}, GMST={}", birthInstant, julianDay, gmst);

        List<String> bodyNames = new ArrayList<>();
        List<CompletableFuture<BodyLines>> futures = new ArrayList<>();

        for (Map.Entry<String, PlanetPosition> entry : request.getPlanets().entrySet()) {
            if (!isEnabled(entry.getKey(), entry.getValue(), request.getEnabledBodies())) {
                continue;
            }

            String bodyName = bodyName(entry.getKey(), entry.getValue());
            PlanetPosition planet = entry.getValue();

            bodyNames.add(bodyName);
            futures.add(CompletableFuture.supplyAsync(() -> calculateBody(bodyName, planet, gmst), executor));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .exceptionally(e -> null)
                .join();

        Map<String, BodyLines> bodies = new LinkedHashMap<>();
        for (int i = 0; i < futures.size(); i++) {
            String bodyName = bodyNames.get(i);
            String key = bodies.containsKey(bodyName) ? bodyName + "#" + i : bodyName;
            try {
                bodies.put(key, futures.get(i).join());
            } catch (CompletionException e) {
                logger.error("천체 라인 수집 오류: {}", bodyName, e);
                bodies.put(key, BodyLines.failed(bodyName, String.valueOf(e.getCause())));
            }
        }

        AstrocartographyResult result = new AstrocartographyResult(
                birthInstant, julianDay, gmst, Collections.unmodifiableMap(bodies));

        logger.info("천체 라인 계산 완료: 성공 {}개 (라인 {}개), 실패 {}개",
                result.successfulLines().size(), result.allLines().size(), result.failedBodies().size());
        return result;
    }

    /**
     * 단일 천체 계산
     */
    BodyLines calculateBody(String bodyName, PlanetPosition planet, double gmst) {
        try {
            if (planet == null) {
                throw new IllegalArgumentException("천체 위치가 없습니다");
            }
            if (!Double.isFinite(planet.getLongitude()) || !Double.isFinite(planet.getLatitude())) {
                throw new IllegalArgumentException(String.format(
                        "잘못된 황도 좌표: 경도=%s, 위도=%s", planet.getLongitude(), planet.getLatitude()));
            }

            // 1. 황도 → 적도 좌표
            EquatorialPosition equatorial = CoordinateTransform.eclipticToEquatorial(
                    planet.getLongitude(), planet.getLatitude());

            if (!Double.isFinite(equatorial.getRightAscension()) || !Double.isFinite(equatorial.getDeclination())) {
                throw new IllegalArgumentException("적도 좌표 변환 실패: " + equatorial);
            }

            // 2. 라인 4개
            PlanetLines lines = AstrocartographyCalculator.calculateLines(equatorial, gmst);

            logger.debug("{} 라인 계산: RA={}, Dec={}, 상승 {}점, 하강 {}점",
                    bodyName, equatorial.getRightAscension(), equatorial.getDeclination(),
                    lines.getRise().size(), lines.getSet().size());

            return BodyLines.succeeded(bodyName, equatorial, lines);

        } catch (Exception e) {
            logger.warn("{} 라인 계산 실패: {}", bodyName, e.getMessage());
            return BodyLines.failed(bodyName, e.getMessage());
        }
    }

    private static String bodyName(String key, PlanetPosition planet) {
        return planet != null && planet.getName() != null && !planet.getName().isBlank()
                ? planet.getName()
                : key;
    }

    private static boolean isEnabled(String key, PlanetPosition planet, List<String> enabledBodies) {
        if (enabledBodies == null || enabledBodies.isEmpty()) {
            return true;
        }
        String name = planet != null ? planet.getName() : null;
        for (String enabled : enabledBodies) {
            if (enabled == null) {
                continue;
            }
            if (enabled.equalsIgnoreCase(key) || enabled.equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }
}
