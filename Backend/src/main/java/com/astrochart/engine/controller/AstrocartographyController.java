package com.astrochart.engine.controller;

import com.astrochart.engine.model.AstrocartographyRequest;
import com.astrochart.engine.model.AstrocartographyResult;
import com.astrochart.engine.model.BodyLines;
import com.astrochart.engine.model.GeoPoint;
import com.astrochart.engine.model.LineType;
import com.astrochart.engine.service.AstrocartographyService;
import com.astrochart.engine.service.LineInterpretationCatalog;
import com.astrochart.engine.util.AntimeridianSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/astrocartography")
public class AstrocartographyController {

    private static final Logger logger = LoggerFactory.getLogger(AstrocartographyController.class);

    @Autowired
    private AstrocartographyService astrocartographyService;

    @Autowired
    private LineInterpretationCatalog lineInterpretationCatalog;

    /**
     * 천체 라인 API. segmented=true 이면 날짜변경선에서 끊은 구간 목록을 함께 반환
     */
    @PostMapping("/lines")
    public ResponseEntity<Object> generateLines(
            @RequestBody AstrocartographyRequest request,
            @RequestParam(required = false, defaultValue = "false") boolean segmented) {

        logger.info("천체 라인 요청: 출생={}, 천체 {}개, 분할={}", request.getBirthInstant(),
                request.getPlanets() == null ? 0 : request.getPlanets().size(), segmented);

        try {
            AstrocartographyResult result = astrocartographyService.generateLines(request);
            if (!segmented) {
                return ResponseEntity.ok(result);
            }

            Map<String, Map<String, List<List<GeoPoint>>>> segments = new LinkedHashMap<>();
            Map<String, String> failures = new LinkedHashMap<>();

            for (Map.Entry<String, BodyLines> entry : result.getBodies().entrySet()) {
                BodyLines body = entry.getValue();
                if (!body.isSuccess()) {
                    failures.put(entry.getKey(), body.getFailureReason());
                    continue;
                }

                Map<String, List<List<GeoPoint>>> byLine = new LinkedHashMap<>();
                for (LineType lineType : LineType.values()) {
                    byLine.put(lineType.getJsonName(), AntimeridianSplitter.split(body.getLines().line(lineType)));
                }
                segments.put(entry.getKey(), byLine);
            }

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("birthInstant", result.getBirthInstant());
            response.put("julianDay", result.getJulianDay());
            response.put("gmst", result.getGmst());
            response.put("segments", segments);
            response.put("failures", failures);
            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("천체 라인 계산 오류: " + e.getMessage(), e);
            return ApiErrors.response(e);
        }
    }

    /**
     * 라인 해석 문구 API
     */
    @GetMapping("/interpretation")
    public ResponseEntity<Object> getInterpretation(
            @RequestParam String body,
            @RequestParam String lineType) {

        try {
            LineType type = LineType.fromValue(lineType);

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("body", body);
            response.put("lineType", type);
            response.put("interpretation", lineInterpretationCatalog.interpretation(body, type));
            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("라인 해석 조회 오류: " + e.getMessage(), e);
            return ApiErrors.response(e);
        }
    }
}
