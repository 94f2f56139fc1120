package com.astrochart.engine.service;

import com.astrochart.engine.model.ChartSnapshot;
import com.astrochart.engine.model.GeoLocation;
import com.astrochart.engine.model.PlanetPosition;
import com.astrochart.engine.model.ReturnChart;
import com.astrochart.engine.model.ReturnType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

/**
 * 솔라 리턴 / 루나 리턴 차트 계산
 */
@Service
public class ReturnChartService {

    private static final Logger logger = LoggerFactory.getLogger(ReturnChartService.class);

    /** 솔라 리턴 탐색: 생일 전후 일수 */
    private static final int SOLAR_WINDOW_DAYS = 2;

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    private final ReturnSolver returnSolver;
    private final ChartEvaluator chartEvaluator;

    public ReturnChartService(ReturnSolver returnSolver, ChartEvaluator chartEvaluator) {
        this.returnSolver = returnSolver;
        this.chartEvaluator = chartEvaluator;
    }

    /**
     * 솔라 리턴: 해당 연도 생일 ±2일 구간에서 태양이 출생 황경으로 돌아오는 시각
     */
    public CompletableFuture<ReturnChart> calculateSolarReturn(Instant natalInstant,
                                                               GeoLocation natalLocation,
                                                               int returnYear,
                                                               GeoLocation returnLocation) {
        requireNatal(natalInstant, natalLocation);

        LocalDate birthday = MonthDay.from(natalInstant.atZone(ZoneOffset.UTC)).atYear(returnYear);
        Instant windowStart = birthday.minusDays(SOLAR_WINDOW_DAYS).atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant windowEnd = birthday.plusDays(SOLAR_WINDOW_DAYS).atTime(END_OF_DAY).toInstant(ZoneOffset.UTC);

        return calculateReturn(ReturnType.SOLAR, natalInstant, natalLocation, windowStart, windowEnd, returnLocation);
    }

    /**
     * 루나 리턴: 지정한 달 전체 구간에서 달이 출생 황경으로 돌아오는 시각
     */
    public CompletableFuture<ReturnChart> calculateLunarReturn(Instant natalInstant,
                                                               GeoLocation natalLocation,
                                                               int returnYear,
                                                               int returnMonth,
                                                               GeoLocation returnLocation) {
        requireNatal(natalInstant, natalLocation);
        if (returnMonth < 1 || returnMonth > 12) {
            throw new IllegalArgumentException("잘못된 월: " + returnMonth);
        }

        YearMonth month = YearMonth.of(returnYear, returnMonth);
        Instant windowStart = month.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant windowEnd = month.atEndOfMonth().atTime(END_OF_DAY).toInstant(ZoneOffset.UTC);

        return calculateReturn(ReturnType.LUNAR, natalInstant, natalLocation, windowStart, windowEnd, returnLocation);
    }

    private CompletableFuture<ReturnChart> calculateReturn(ReturnType returnType,
                                                           Instant natalInstant,
                                                           GeoLocation natalLocation,
                                                           Instant windowStart,
                                                           Instant windowEnd,
                                                           GeoLocation returnLocation) {
        GeoLocation location = returnLocation != null ? returnLocation : natalLocation;
        String bodyKey = returnType.getBodyKey();

        logger.info("{} 리턴 계산: 출생={}, 구간={} ~ {}", returnType, natalInstant, windowStart, windowEnd);

        // 1. 출생 차트에서 천체 황경 확인
        return ReturnSolver.evaluate(chartEvaluator, natalInstant, natalLocation).thenCompose(natalEvaluation -> {
            PlanetPosition natalBody = ReturnSolver.requireBody(natalEvaluation, bodyKey, natalInstant);
            ChartSnapshot natalChart = natalEvaluation.toSnapshot(natalInstant, natalLocation);

            // 2. 리턴 시각 탐색
            return returnSolver.findReturn(natalBody.getLongitude(), windowStart, windowEnd,
                            chartEvaluator, bodyKey, location)
                    .thenApply(result -> ReturnChart.builder()
                            .returnType(returnType)
                            .returnTimestamp(result.getExactTimestamp())
                            .chart(result.getChart())
                            .natalChart(natalChart)
                            .converged(result.isConverged())
                            .build());
        });
    }

    private static void requireNatal(Instant natalInstant, GeoLocation natalLocation) {
        if (natalInstant == null || natalLocation == null) {
            throw new IllegalArgumentException("출생 시각과 출생지가 필요합니다");
        }
    }
}
