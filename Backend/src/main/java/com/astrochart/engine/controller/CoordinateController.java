package com.astrochart.engine.controller;

import com.astrochart.engine.model.EquatorialPosition;
import com.astrochart.engine.util.CoordinateTransform;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/coordinates")
public class CoordinateController {

    /**
     * 황도 → 적도 좌표 변환 API
     */
    @GetMapping("/equatorial")
    public ResponseEntity<EquatorialPosition> toEquatorial(
            @RequestParam double longitude,
            @RequestParam(required = false, defaultValue = "0") double latitude) {

        return ResponseEntity.ok(CoordinateTransform.eclipticToEquatorial(longitude, latitude));
    }

    /**
     * 항성시 API (dateTime 은 UTC)
     */
    @GetMapping("/sidereal-time")
    public ResponseEntity<Map<String, Object>> getSiderealTime(
            @RequestParam(required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime dateTime,
            @RequestParam(required = false, defaultValue = "0") double longitude) {

        if (dateTime == null) {
            dateTime = LocalDateTime.now(ZoneOffset.UTC);
        }

        double julianDay = CoordinateTransform.julianDay(dateTime);
        double gmst = CoordinateTransform.gmst(julianDay);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("dateTime", dateTime.toString());
        response.put("julianDay", julianDay);
        response.put("gmst", gmst);
        response.put("lst", CoordinateTransform.localSiderealTime(gmst, longitude));
        return ResponseEntity.ok(response);
    }
}
