package com.astrochart.engine.service;

import com.astrochart.engine.model.AffectedPlanet;
import com.astrochart.engine.model.ChartSnapshot;
import com.astrochart.engine.model.EclipseEvent;
import com.astrochart.engine.model.EclipseType;
import com.astrochart.engine.model.PlanetPosition;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EclipseImpactAnalyzerTest {

    private final EclipseImpactAnalyzer analyzer = new EclipseImpactAnalyzer();

    @Test
    void annotate_findsPlanetsWithinOrbSortedByDistance() {
        ChartSnapshot natal = natalChart(cusps(0));
        EclipseEvent eclipse = eclipse(12.0);

        EclipseEvent annotated = analyzer.annotate(natal, eclipse, 3.0);

        assertThat(annotated.isHasImpact()).isTrue();
        assertThat(annotated.getAffectedPlanets()).extracting(AffectedPlanet::getPlanetKey)
                .containsExactly("VENUS", "SUN");
        AffectedPlanet venus = annotated.getAffectedPlanets().get(0);
        assertThat(venus.getOrb()).isCloseTo(0.5, within(1e-9));
        assertThat(venus.getAspect()).isEqualTo("exact");
        assertThat(annotated.getAffectedPlanets().get(1).getAspect()).isEqualTo("applying");
        assertThat(annotated.getHouse()).isEqualTo(1);
        assertThat(annotated.getDate()).isEqualTo(eclipse.getDate());
    }

    @Test
    void annotate_handlesOrbAcrossZeroDegrees() {
        ChartSnapshot natal = natalChart(cusps(0));

        EclipseEvent annotated = analyzer.annotate(natal, eclipse(358.0), 3.0);

        assertThat(annotated.getAffectedPlanets()).extracting(AffectedPlanet::getPlanetKey).containsExactly("MARS");
        assertThat(annotated.getHouse()).isEqualTo(12);
    }

    @Test
    void annotate_noPlanetWithinOrbHasNoImpact() {
        EclipseEvent annotated = analyzer.annotate(natalChart(cusps(0)), eclipse(100.0), 3.0);

        assertThat(annotated.isHasImpact()).isFalse();
        assertThat(annotated.getAffectedPlanets()).isEmpty();
        assertThat(annotated.getHouse()).isEqualTo(4);
    }

    @Test
    void annotate_keepsCatalogImpactWhenLongitudeMissing() {
        EclipseEvent catalogEntry = EclipseEvent.builder()
                .date(Instant.parse("2024-04-08T18:17:00Z"))
                .type(EclipseType.SOLAR)
                .house(7)
                .hasImpact(true)
                .build();

        assertThat(analyzer.annotate(natalChart(cusps(0)), catalogEntry, 3.0)).isSameAs(catalogEntry);
    }

    @Test
    void determineHouse_wrapsAroundZeroAries() {
        List<Double> cusps = cusps(300);

        assertThat(analyzer.determineHouse(310.0, cusps)).isEqualTo(1);
        assertThat(analyzer.determineHouse(335.0, cusps)).isEqualTo(2);
        assertThat(analyzer.determineHouse(5.0, cusps)).isEqualTo(3);
        assertThat(analyzer.determineHouse(295.0, cusps)).isEqualTo(12);
    }

    @Test
    void determineHouse_requiresTwelveCusps() {
        assertThat(analyzer.determineHouse(10.0, List.of(0.0, 30.0, 60.0))).isNull();
        assertThat(analyzer.determineHouse(10.0, null)).isNull();
    }

    static List<Double> cusps(double first) {
        List<Double> cusps = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            cusps.add((first + i * 30) % 360);
        }
        return cusps;
    }

    static ChartSnapshot natalChart(List<Double> cusps) {
        Map<String, PlanetPosition> planets = new LinkedHashMap<>();
        planets.put("SUN", PlanetPosition.builder().name("Sun").longitude(10.0).build());
        planets.put("MOON", PlanetPosition.builder().name("Moon").longitude(200.0).build());
        planets.put("VENUS", PlanetPosition.builder().name("Venus").longitude(12.5).build());
        planets.put("MARS", PlanetPosition.builder().name("Mars").longitude(359.0).build());

        return ChartSnapshot.builder()
                .timestamp(Instant.parse("1990-06-15T10:30:00Z"))
                .houseCusps(cusps)
                .planets(planets)
                .build();
    }

    private static EclipseEvent eclipse(double longitude) {
        return EclipseEvent.builder()
                .date(Instant.parse("2024-04-08T18:17:00Z"))
                .type(EclipseType.SOLAR)
                .kind("total")
                .longitude(longitude)
                .build();
    }
}
