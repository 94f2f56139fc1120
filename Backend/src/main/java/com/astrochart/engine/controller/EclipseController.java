package com.astrochart.engine.controller;

import com.astrochart.engine.model.EclipseActivation;
import com.astrochart.engine.model.EclipseActivationReport;
import com.astrochart.engine.model.EclipseActivationRequest;
import com.astrochart.engine.model.SarosGroup;
import com.astrochart.engine.service.EclipseActivationClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/eclipses")
public class EclipseController {

    private static final Logger logger = LoggerFactory.getLogger(EclipseController.class);

    @Autowired
    private EclipseActivationClassifier eclipseActivationClassifier;

    @Value("${eclipse.default-orb:3.0}")
    private double defaultOrb;

    /**
     * 출생 차트에 영향을 주는 일식/월식 활성 상태 API
     */
    @PostMapping("/activations")
    public ResponseEntity<Object> getActivations(@RequestBody EclipseActivationRequest request) {
        try {
            List<EclipseActivation> activations = eclipseActivationClassifier.classifyActivations(
                    request.getNatalChart(), request.getEclipses(), referenceDate(request), orb(request),
                    request.getStatus());

            logger.info("일식/월식 활성 응답: {}개 (필터={})", activations.size(), request.getStatus());
            return ResponseEntity.ok(activations);

        } catch (Exception e) {
            logger.error("일식/월식 활성 분류 오류: " + e.getMessage(), e);
            return ApiErrors.response(e);
        }
    }

    /**
     * 사로스 주기 그룹 API
     */
    @PostMapping("/saros-groups")
    public ResponseEntity<Object> getSarosGroups(@RequestBody EclipseActivationRequest request) {
        try {
            List<EclipseActivation> activations = eclipseActivationClassifier.classifyActivations(
                    request.getNatalChart(), request.getEclipses(), referenceDate(request), orb(request));
            List<SarosGroup> groups = eclipseActivationClassifier.groupBySaros(activations);

            logger.info("사로스 그룹 응답: {}개 그룹", groups.size());
            return ResponseEntity.ok(groups);

        } catch (Exception e) {
            logger.error("사로스 그룹핑 오류: " + e.getMessage(), e);
            return ApiErrors.response(e);
        }
    }

    /**
     * 활성 목록, 사로스 그룹, 통계 API
     */
    @PostMapping("/report")
    public ResponseEntity<Object> getReport(@RequestBody EclipseActivationRequest request) {
        try {
            EclipseActivationReport report = eclipseActivationClassifier.analyze(
                    request.getNatalChart(), request.getEclipses(), referenceDate(request), orb(request));
            return ResponseEntity.ok(report);

        } catch (Exception e) {
            logger.error("일식/월식 보고서 생성 오류: " + e.getMessage(), e);
            return ApiErrors.response(e);
        }
    }

    private Instant referenceDate(EclipseActivationRequest request) {
        return request.getReferenceDate() != null ? request.getReferenceDate() : Instant.now();
    }

    private double orb(EclipseActivationRequest request) {
        return request.getOrb() != null ? request.getOrb() : defaultOrb;
    }
}
