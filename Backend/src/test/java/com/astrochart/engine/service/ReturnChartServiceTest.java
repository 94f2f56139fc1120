package com.astrochart.engine.service;

import com.astrochart.engine.exception.ChartEvaluationException;
import com.astrochart.engine.model.ChartEvaluation;
import com.astrochart.engine.model.GeoLocation;
import com.astrochart.engine.model.ReturnChart;
import com.astrochart.engine.model.ReturnType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.astrochart.engine.service.ChartEvaluatorStubs.MILLIS_PER_DAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReturnChartServiceTest {

    private static final Instant NATAL = Instant.parse("1990-06-15T10:30:00Z");
    private static final GeoLocation SEOUL = GeoLocation.of(37.5665, 126.9780);
    private static final GeoLocation BUSAN = GeoLocation.of(35.1796, 129.0756);

    @Test
    @DisplayName("솔라 리턴은 출생 차트를 먼저 계산하고 생일 ±2일 안에서 탐색한다")
    void calculateSolarReturn_searchesAroundBirthday() {
        // Given - 2024년 생일 같은 시각에 출생 황경으로 돌아오는 태양
        Instant expected = Instant.parse("2024-06-15T10:30:00Z");
        ChartEvaluatorStubs.LinearBody returningSun = new ChartEvaluatorStubs.LinearBody("SUN", expected, 84.2, 0.9856);
        RecordingEvaluator evaluator = new RecordingEvaluator(returningSun, 84.2, 0.9856);
        ReturnChartService service = new ReturnChartService(new ReturnSolver(), evaluator);

        // When
        ReturnChart chart = service.calculateSolarReturn(NATAL, SEOUL, 2024, BUSAN).join();

        // Then
        assertThat(chart.getReturnType()).isEqualTo(ReturnType.SOLAR);
        assertThat(chart.isConverged()).isTrue();
        assertThat((double) Math.abs(chart.getReturnTimestamp().toEpochMilli() - expected.toEpochMilli()))
                .isLessThan(0.02 * MILLIS_PER_DAY);
        assertThat(chart.getNatalChart().getTimestamp()).isEqualTo(NATAL);
        assertThat(chart.getNatalChart().getLocation()).isEqualTo(SEOUL);
        assertThat(chart.getChart().getLocation()).isEqualTo(BUSAN);

        assertThat(evaluator.requested.get(0)).isEqualTo(NATAL);
        assertThat(evaluator.locations.get(0)).isEqualTo(SEOUL);
        assertThat(evaluator.requested.subList(1, evaluator.requested.size()))
                .allSatisfy(instant -> assertThat(instant)
                        .isBetween(Instant.parse("2024-06-13T00:00:00Z"), Instant.parse("2024-06-17T23:59:59Z")));
        assertThat(evaluator.locations.subList(1, evaluator.locations.size())).containsOnly(BUSAN);
    }

    @Test
    void calculateSolarReturn_defaultsToNatalLocation() {
        Instant expected = Instant.parse("2024-06-15T10:30:00Z");
        ChartEvaluatorStubs.LinearBody returningSun = new ChartEvaluatorStubs.LinearBody("SUN", expected, 84.2, 0.9856);
        RecordingEvaluator evaluator = new RecordingEvaluator(returningSun, 84.2, 0.9856);
        ReturnChartService service = new ReturnChartService(new ReturnSolver(), evaluator);

        ReturnChart chart = service.calculateSolarReturn(NATAL, SEOUL, 2024, null).join();

        assertThat(chart.getChart().getLocation()).isEqualTo(SEOUL);
    }

    @Test
    @DisplayName("루나 리턴은 지정한 달 전체를 탐색한다")
    void calculateLunarReturn_searchesWholeMonth() {
        // 5월 10일 0도, 하루 13도 → 130도는 5월 20일
        ChartEvaluatorStubs.LinearBody moon = new ChartEvaluatorStubs.LinearBody(
                "MOON", Instant.parse("2024-05-10T00:00:00Z"), 0.0, 13.0);
        RecordingEvaluator evaluator = new RecordingEvaluator(moon, 130.0, 13.0);
        ReturnChartService service = new ReturnChartService(new ReturnSolver(), evaluator);

        ReturnChart chart = service.calculateLunarReturn(NATAL, SEOUL, 2024, 5, null).join();

        Instant expected = Instant.parse("2024-05-20T00:00:00Z");
        assertThat(chart.getReturnType()).isEqualTo(ReturnType.LUNAR);
        assertThat(chart.isConverged()).isTrue();
        // 0.01도 / 13도 = 약 66초
        assertThat(Math.abs(chart.getReturnTimestamp().toEpochMilli() - expected.toEpochMilli()))
                .isLessThan(Duration.ofMinutes(2).toMillis());
        assertThat(evaluator.requested.subList(1, evaluator.requested.size()))
                .allSatisfy(instant -> assertThat(instant)
                        .isBetween(Instant.parse("2024-05-01T00:00:00Z"), Instant.parse("2024-05-31T23:59:59Z")));
    }

    @Test
    void calculateLunarReturn_rejectsInvalidMonth() {
        ReturnChartService service = new ReturnChartService(new ReturnSolver(),
                (instant, location) -> CompletableFuture.completedFuture(ChartEvaluation.failure("unused")));

        assertThatThrownBy(() -> service.calculateLunarReturn(NATAL, SEOUL, 2024, 13, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.calculateLunarReturn(NATAL, SEOUL, 2024, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void calculateSolarReturn_natalWithoutSunFails() {
        ReturnChartService service = new ReturnChartService(new ReturnSolver(),
                (instant, location) -> CompletableFuture.completedFuture(
                        ChartEvaluatorStubs.evaluation("MOON", 10.0, 13.0)));

        assertThatThrownBy(() -> service.calculateSolarReturn(NATAL, SEOUL, 2024, null).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ChartEvaluationException.class);
    }

    @Test
    void calculateReturn_rejectsMissingNatalData() {
        ReturnChartService service = new ReturnChartService(new ReturnSolver(),
                (instant, location) -> CompletableFuture.completedFuture(ChartEvaluation.failure("unused")));

        assertThatThrownBy(() -> service.calculateSolarReturn(null, SEOUL, 2024, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.calculateSolarReturn(NATAL, null, 2024, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.calculateLunarReturn(null, SEOUL, 2024, 5, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("출생 차트 계산기의 비동기 실패는 ChartEvaluationException 으로 전달된다")
    void calculateSolarReturn_failedNatalFutureIsWrapped() {
        ReturnChartService service = new ReturnChartService(new ReturnSolver(),
                (instant, location) -> CompletableFuture.failedFuture(new IllegalStateException("ephemeris down")));

        assertThatThrownBy(() -> service.calculateSolarReturn(NATAL, SEOUL, 2024, null).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(ChartEvaluationException.class)
                .hasRootCauseInstanceOf(IllegalStateException.class);
    }

    /**
     * 출생 시각에는 고정된 출생 차트를, 그 외에는 위임 계산기 결과를 돌려준다
     */
    private static final class RecordingEvaluator implements ChartEvaluator {
        private final ChartEvaluatorStubs.LinearBody delegate;
        private final double natalLongitude;
        private final double velocity;
        final List<Instant> requested = new CopyOnWriteArrayList<>();
        final List<GeoLocation> locations = new CopyOnWriteArrayList<>();

        RecordingEvaluator(ChartEvaluatorStubs.LinearBody delegate, double natalLongitude, double velocity) {
            this.delegate = delegate;
            this.natalLongitude = natalLongitude;
            this.velocity = velocity;
        }

        @Override
        public CompletableFuture<ChartEvaluation> evaluate(Instant instant, GeoLocation location) {
            requested.add(instant);
            locations.add(location);
            if (instant.equals(NATAL)) {
                return CompletableFuture.completedFuture(
                        ChartEvaluatorStubs.evaluation(delegate.bodyKey(), natalLongitude, velocity));
            }
            return delegate.evaluate(instant, location);
        }
    }
}
