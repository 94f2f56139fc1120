package com.astrochart.engine.service;

import com.astrochart.engine.model.LineType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LineInterpretationCatalogTest {

    private final LineInterpretationCatalog catalog = new LineInterpretationCatalog();

    @Test
    void interpretation_returnsTextForKnownBodyAndLine() {
        assertThat(catalog.interpretation("Sun", LineType.RISE))
                .startsWith("Places where your identity and self-expression are emphasized");
    }

    @Test
    void interpretation_coversEveryLineTypeForMajorBodies() {
        for (String body : new String[]{"Sun", "Moon", "Mercury", "Venus", "Mars", "Jupiter", "Saturn"}) {
            for (LineType lineType : LineType.values()) {
                assertThat(catalog.interpretation(body, lineType))
                        .as("%s %s", body, lineType)
                        .isNotEqualTo(LineInterpretationCatalog.NOT_AVAILABLE);
            }
        }
    }

    @Test
    void interpretation_fallsBackForUnknownBody() {
        assertThat(catalog.interpretation("Eris", LineType.SET)).isEqualTo(LineInterpretationCatalog.NOT_AVAILABLE);
        assertThat(catalog.interpretation(null, LineType.SET)).isEqualTo(LineInterpretationCatalog.NOT_AVAILABLE);
        assertThat(catalog.interpretation("Sun", null)).isEqualTo(LineInterpretationCatalog.NOT_AVAILABLE);
    }
}
