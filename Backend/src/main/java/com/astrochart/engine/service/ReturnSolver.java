package com.astrochart.engine.service;

import com.astrochart.engine.exception.ChartEvaluationException;
import com.astrochart.engine.model.ChartEvaluation;
import com.astrochart.engine.model.ChartSnapshot;
import com.astrochart.engine.model.GeoLocation;
import com.astrochart.engine.model.PlanetPosition;
import com.astrochart.engine.model.ReturnResult;
import com.astrochart.engine.util.CoordinateTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 천체가 목표 황경으로 돌아오는 정확한 시각을 이분 탐색으로 찾는다.
 *
 * 탐색 구간이 정확히 한 번의 통과를 포함하는지는 검사하지 않는다. 구간에 통과가 없거나
 * 여러 번(역행 정지 부근 등) 있으면 잘못된 근이나 정밀도 미달 결과가 그대로 반환된다.
 */
@Service
public class ReturnSolver {

    private static final Logger logger = LoggerFactory.getLogger(ReturnSolver.class);

    /** 허용 오차 (도), 0.01도 = 약 36초각 */
    public static final double PRECISION = 0.01;

    public static final int MAX_ITERATIONS = 50;

    /** 탐색 구간 최소 길이 (밀리초) */
    private static final long MIN_WINDOW_MILLIS = 1000;

    /**
     * 리턴 시각 탐색
     *
     * @param targetLongitude 목표 황경 (출생 차트의 천체 황경)
     * @param windowStart     탐색 시작 시각
     * @param windowEnd       탐색 종료 시각
     * @param evaluator       차트 계산기
     * @param bodyKey         추적할 천체 키 (예: SUN, MOON)
     * @param location        차트 계산 위치
     */
    public CompletableFuture<ReturnResult> findReturn(double targetLongitude,
                                                      Instant windowStart,
                                                      Instant windowEnd,
                                                      ChartEvaluator evaluator,
                                                      String bodyKey,
                                                      GeoLocation location) {
        if (evaluator == null || bodyKey == null || windowStart == null || windowEnd == null || location == null) {
            throw new IllegalArgumentException("리턴 탐색 인자가 누락되었습니다");
        }
        if (windowEnd.isBefore(windowStart)) {
            throw new IllegalArgumentException("탐색 종료 시각이 시작 시각보다 빠릅니다: " + windowStart + " ~ " + windowEnd);
        }

        double target = CoordinateTransform.normalizeAngle(targetLongitude);

        logger.debug("리턴 탐색 시작: 천체={}, 목표={}, 구간={} ~ {}", bodyKey, target, windowStart, windowEnd);

        SearchContext context = new SearchContext(target, evaluator, bodyKey, location);
        return step(context, windowStart.toEpochMilli(), windowEnd.toEpochMilli(), 0);
    }

    /**
     * 구간 중간점 한 번 평가. 차트 계산기 호출은 순차적으로만 이루어진다.
     */
    private CompletableFuture<ReturnResult> step(SearchContext context, long start, long end, int iteration) {
        long midMillis = start + (end - start) / 2;
        Instant mid = Instant.ofEpochMilli(midMillis);

        return evaluate(context.evaluator, mid, context.location).thenCompose(evaluation -> {
            PlanetPosition body = requireBody(evaluation, context.bodyKey, mid);
            ChartSnapshot chart = evaluation.toSnapshot(mid, context.location);
            int count = iteration + 1;

            double current = CoordinateTransform.normalizeAngle(body.getLongitude());
            double diff = CoordinateTransform.angularDifference(current, context.target);

            logger.debug("반복 {}: 시각={}, 황경={}, 차이={}, 속도={}",
                    count, mid, current, diff, body.getVelocity());

            if (Math.abs(diff) < PRECISION) {
                logger.info("리턴 시각 확정: 천체={}, 시각={}, 반복={}회", context.bodyKey, mid, count);
                return CompletableFuture.completedFuture(result(mid, chart, count, diff, true));
            }

            // 순행이면 목표보다 뒤처질 때 시작점을 당기고, 역행이면 반대
            boolean direct = !body.isRetrograde();
            boolean behind = diff < 0;
            long nextStart = start;
            long nextEnd = end;
            if (direct == behind) {
                nextStart = midMillis;
            } else {
                nextEnd = midMillis;
            }

            if (nextEnd - nextStart < MIN_WINDOW_MILLIS || count >= MAX_ITERATIONS) {
                logger.warn("리턴 탐색 정밀도 미달: 천체={}, 시각={}, 차이={}도, 반복={}회",
                        context.bodyKey, mid, diff, count);
                return CompletableFuture.completedFuture(result(mid, chart, count, diff, false));
            }

            return step(context, nextStart, nextEnd, count);
        });
    }

    /**
     * 차트 계산기 호출. 동기 예외, null 결과, 비동기 실패를 모두 ChartEvaluationException 으로 바꾼다.
     */
    static CompletableFuture<ChartEvaluation> evaluate(ChartEvaluator evaluator, Instant instant, GeoLocation location) {
        CompletableFuture<ChartEvaluation> future;
        try {
            future = evaluator.evaluate(instant, location);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(toEvaluationException(e, instant));
        }

        if (future == null) {
            return CompletableFuture.failedFuture(
                    new ChartEvaluationException("차트 계산기가 결과를 반환하지 않았습니다: " + instant, instant));
        }

        return future.handle((evaluation, error) -> {
            if (error != null) {
                throw toEvaluationException(error, instant);
            }
            return evaluation;
        });
    }

    /**
     * 차트 계산 결과에서 천체 위치를 꺼낸다. 실패 응답이나 천체 누락은 치명적 오류.
     */
    static PlanetPosition requireBody(ChartEvaluation evaluation, String bodyKey, Instant instant) {
        if (evaluation == null || !evaluation.isSuccess()) {
            String reason = evaluation == null ? "응답 없음" : evaluation.getError();
            throw new ChartEvaluationException("차트 계산 실패 (" + instant + "): " + reason, instant);
        }

        PlanetPosition body = evaluation.getPlanets() == null ? null : evaluation.getPlanets().get(bodyKey);
        if (body == null) {
            throw new ChartEvaluationException("차트에 천체 " + bodyKey + " 가 없습니다 (" + instant + ")", instant);
        }
        return body;
    }

    private static ChartEvaluationException toEvaluationException(Throwable error, Instant instant) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof ChartEvaluationException) {
            return (ChartEvaluationException) cause;
        }
        return new ChartEvaluationException("차트 계산기 오류 (" + instant + "): " + cause.getMessage(), instant, cause);
    }

    private static ReturnResult result(Instant mid, ChartSnapshot chart, int iterations, double diff, boolean converged) {
        return ReturnResult.builder()
                .exactTimestamp(mid)
                .chart(chart)
                .iterations(iterations)
                .residual(diff)
                .converged(converged)
                .build();
    }

    private static final class SearchContext {
        private final double target;
        private final ChartEvaluator evaluator;
        private final String bodyKey;
        private final GeoLocation location;

        private SearchContext(double target, ChartEvaluator evaluator, String bodyKey, GeoLocation location) {
            this.target = target;
            this.evaluator = evaluator;
            this.bodyKey = bodyKey;
            this.location = location;
        }
    }
}
