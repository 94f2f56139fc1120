package com.astrochart.engine.service;

import com.astrochart.engine.model.LineType;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * 천체 라인 해석 문구 (line-interpretations.json)
 */
@Service
public class LineInterpretationCatalog {

    private static final Logger logger = LoggerFactory.getLogger(LineInterpretationCatalog.class);

    static final String RESOURCE = "line-interpretations.json";
    static final String NOT_AVAILABLE = "Interpretation not available.";

    private final Map<String, Map<String, String>> interpretations;

    public LineInterpretationCatalog() {
        this(new ObjectMapper());
    }

    LineInterpretationCatalog(ObjectMapper objectMapper) {
        try (InputStream in = new ClassPathResource(RESOURCE).getInputStream()) {
            this.interpretations = objectMapper.readValue(in, new TypeReference<Map<String, Map<String, String>>>() {
            });
        } catch (IOException e) {
            throw new UncheckedIOException("라인 해석 파일 로드 실패: " + RESOURCE, e);
        }
        logger.debug("라인 해석 로드: {}개 천체", interpretations.size());
    }

    public String interpretation(String bodyName, LineType lineType) {
        if (bodyName == null || lineType == null) {
            return NOT_AVAILABLE;
        }
        Map<String, String> byLine = interpretations.get(bodyName);
        if (byLine == null) {
            return NOT_AVAILABLE;
        }
        return byLine.getOrDefault(lineType.getJsonName(), NOT_AVAILABLE);
    }
}
