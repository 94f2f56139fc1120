package com.astrochart.engine.service;

import com.astrochart.engine.exception.ChartEvaluationException;
import com.astrochart.engine.model.ChartEvaluation;
import com.astrochart.engine.model.GeoLocation;
import com.astrochart.engine.model.PlanetPosition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * HTTP 천문력 엔진을 호출하는 기본 차트 계산기
 */
@Service
@Slf4j
public class RemoteChartEvaluator implements ChartEvaluator {

    @Value("${ephemeris.api.url:http://localhost:3001/api/chart}")
    private String ephemerisApiUrl;

    private final RestTemplate restTemplate;
    private final Executor executor;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public RemoteChartEvaluator(RestTemplate restTemplate,
                                @Qualifier("evaluatorExecutor") Executor executor) {
        this.restTemplate = restTemplate;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<ChartEvaluation> evaluate(Instant instant, GeoLocation location) {
        return CompletableFuture.supplyAsync(() -> requestChart(instant, location), executor);
    }

    /**
     * 차트 계산 요청 (UTC 기준)
     */
    ChartEvaluation requestChart(Instant instant, GeoLocation location) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("year", utc.getYear());
        body.put("month", utc.getMonthValue());
        body.put("day", utc.getDayOfMonth());
        body.put("hour", utc.getHour());
        body.put("minute", utc.getMinute());
        body.put("second", utc.getSecond());
        body.put("latitude", location.getLatitude());
        body.put("longitude", location.getLongitude());
        body.put("houseSystem", location.getHouseSystem());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        log.debug("차트 계산 요청: url={}, 시각={}, 위치=({}, {})",
                ephemerisApiUrl, instant, location.getLatitude(), location.getLongitude());

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    ephemerisApiUrl, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                log.warn("차트 계산기 응답 오류: 상태코드={}", response.getStatusCode());
                return ChartEvaluation.failure("차트 계산기 응답 오류: " + response.getStatusCode());
            }

            return parseEvaluation(response.getBody());

        } catch (RestClientException e) {
            throw new ChartEvaluationException("차트 계산기 호출 실패: " + e.getMessage(), instant, e);
        } catch (JsonProcessingException e) {
            throw new ChartEvaluationException("차트 계산기 응답 파싱 실패: " + e.getOriginalMessage(), instant, e);
        }
    }

    /**
     * 차트 계산기 JSON 응답 파싱
     */
    ChartEvaluation parseEvaluation(String json) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(json);

        if (!root.path("success").asBoolean(false)) {
            return ChartEvaluation.failure(root.path("error").asText("차트 계산 실패"));
        }

        Map<String, PlanetPosition> planets = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.path("planets").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode planet = entry.getValue();

            if (!planet.has("longitude")) {
                log.debug("황경 없는 천체 제외: {}", entry.getKey());
                continue;
            }

            planets.put(entry.getKey(), PlanetPosition.builder()
                    .name(planet.path("name").asText(entry.getKey()))
                    .longitude(planet.path("longitude").asDouble())
                    .latitude(planet.path("latitude").asDouble(0.0))
                    .velocity(planet.path("velocity").asDouble(0.0))
                    .build());
        }

        List<Double> houses = new ArrayList<>();
        for (JsonNode house : root.path("houses")) {
            houses.add(house.isObject() ? house.path("longitude").asDouble() : house.asDouble());
        }

        return ChartEvaluation.builder()
                .success(true)
                .planets(planets)
                .houses(houses)
                .ascendant(root.path("ascendant").asDouble())
                .midheaven(root.path("midheaven").asDouble())
                .build();
    }
}
