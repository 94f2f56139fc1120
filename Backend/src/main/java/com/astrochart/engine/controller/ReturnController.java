package com.astrochart.engine.controller;

import com.astrochart.engine.model.FindReturnRequest;
import com.astrochart.engine.model.ReturnChart;
import com.astrochart.engine.model.ReturnRequest;
import com.astrochart.engine.model.ReturnResult;
import com.astrochart.engine.service.ChartEvaluator;
import com.astrochart.engine.service.ReturnChartService;
import com.astrochart.engine.service.ReturnSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@RestController
@RequestMapping("/api/returns")
public class ReturnController {

    private static final Logger logger = LoggerFactory.getLogger(ReturnController.class);

    @Autowired
    private ReturnChartService returnChartService;

    @Autowired
    private ReturnSolver returnSolver;

    @Autowired
    private ChartEvaluator chartEvaluator;

    @Value("${engine.return.timeout-seconds:60}")
    private long timeoutSeconds;

    /**
     * 솔라 리턴 차트 API
     */
    @PostMapping("/solar")
    public ResponseEntity<Object> solarReturn(@RequestBody ReturnRequest request) {
        logger.info("솔라 리턴 요청: 출생={}, 연도={}", request.getNatalInstant(), request.getReturnYear());

        try {
            ReturnChart chart = returnChartService.calculateSolarReturn(
                    request.getNatalInstant(), request.getNatalLocation(),
                    request.getReturnYear(), request.getReturnLocation())
                    .get(timeoutSeconds, TimeUnit.SECONDS);
            return ResponseEntity.ok(chart);

        } catch (TimeoutException e) {
            logger.error("솔라 리턴 계산 시간 초과", e);
            return ApiErrors.body(HttpStatus.GATEWAY_TIMEOUT, "계산 시간이 초과되었습니다", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ApiErrors.response(e);
        } catch (Exception e) {
            logger.error("솔라 리턴 계산 오류: " + e.getMessage(), e);
            return ApiErrors.response(e);
        }
    }

    /**
     * 루나 리턴 차트 API
     */
    @PostMapping("/lunar")
    public ResponseEntity<Object> lunarReturn(@RequestBody ReturnRequest request) {
        logger.info("루나 리턴 요청: 출생={}, {}년 {}월",
                request.getNatalInstant(), request.getReturnYear(), request.getReturnMonth());

        if (request.getReturnMonth() == null) {
            return ApiErrors.body(HttpStatus.BAD_REQUEST, "잘못된 요청입니다",
                    new IllegalArgumentException("returnMonth 가 필요합니다"));
        }

        try {
            ReturnChart chart = returnChartService.calculateLunarReturn(
                    request.getNatalInstant(), request.getNatalLocation(),
                    request.getReturnYear(), request.getReturnMonth(), request.getReturnLocation())
                    .get(timeoutSeconds, TimeUnit.SECONDS);
            return ResponseEntity.ok(chart);

        } catch (TimeoutException e) {
            logger.error("루나 리턴 계산 시간 초과", e);
            return ApiErrors.body(HttpStatus.GATEWAY_TIMEOUT, "계산 시간이 초과되었습니다", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ApiErrors.response(e);
        } catch (Exception e) {
            logger.error("루나 리턴 계산 오류: " + e.getMessage(), e);
            return ApiErrors.response(e);
        }
    }

    /**
     * 임의 천체/구간 리턴 시각 탐색 API
     */
    @PostMapping("/find")
    public ResponseEntity<Object> findReturn(@RequestBody FindReturnRequest request) {
        logger.info("리턴 탐색 요청: 천체={}, 목표={}, 구간={} ~ {}", request.getBodyKey(),
                request.getTargetLongitude(), request.getWindowStart(), request.getWindowEnd());

        try {
            ReturnResult result = returnSolver.findReturn(request.getTargetLongitude(),
                    request.getWindowStart(), request.getWindowEnd(),
                    chartEvaluator, request.getBodyKey(), request.getLocation())
                    .get(timeoutSeconds, TimeUnit.SECONDS);
            return ResponseEntity.ok(result);

        } catch (TimeoutException e) {
            logger.error("리턴 탐색 시간 초과", e);
            return ApiErrors.body(HttpStatus.GATEWAY_TIMEOUT, "계산 시간이 초과되었습니다", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ApiErrors.response(e);
        } catch (Exception e) {
            logger.error("리턴 탐색 오류: " + e.getMessage(), e);
            return ApiErrors.response(e);
        }
    }
}
