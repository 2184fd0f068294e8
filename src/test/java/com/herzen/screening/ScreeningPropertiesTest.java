package com.herzen.screening;

import com.herzen.screening.config.ScreeningProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.NestedExceptionUtils;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "screening.quality.longstring-threshold=12")
class ScreeningPropertiesTest {
    @Autowired
    private ScreeningProperties properties;

    @Test
    void bindsOverridesAndKeepsDefaults() {
        assertEquals(12, properties.quality().longstringThreshold());
        assertEquals(2.0, properties.quality().minTimePerItem());
        assertEquals(0.001, properties.quality().mahalanobisPThreshold());
        assertEquals(0.7, properties.style().acquiescenceThreshold());
        assertEquals(50, properties.instrument().length());
        assertEquals(ScreeningProperties.ROSENBERG_REVERSE_ITEMS, properties.instrument().reverseItems());
    }

    @Test
    void defaultsMatchTheDocumentedValues() {
        ScreeningProperties defaults = ScreeningProperties.defaults();

        assertEquals(new ScreeningProperties.Quality(2.0, 1.0, 3, 10, 0.3, 0.001, 0.3), defaults.quality());
        assertEquals(new ScreeningProperties.Style(0.7, 0.7, 0.7), defaults.style());
        assertEquals(5, defaults.instrument().reversalSum());
    }

    @Test
    void rejectsThresholdsOutsideTheirRange() {
        assertThrows(IllegalArgumentException.class, () -> new ScreeningProperties.Style(1.2, 0.7, 0.7));
        assertThrows(IllegalArgumentException.class, () -> new ScreeningProperties.Style(0.7, -0.1, 0.7));
        assertThrows(IllegalArgumentException.class, () -> new ScreeningProperties.Style(0.7, 0.7, Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> new ScreeningProperties.Quality(2.0, 1.0, 3, 10, 1.5, 0.001, 0.3));
        assertThrows(IllegalArgumentException.class, () -> new ScreeningProperties.Quality(2.0, 1.0, 3, 10, 0.3, 0.0, 0.3));
        assertThrows(IllegalArgumentException.class, () -> new ScreeningProperties.Quality(0.0, 1.0, 3, 10, 0.3, 0.001, 0.3));
        assertThrows(IllegalArgumentException.class, () -> new ScreeningProperties.Quality(2.0, 1.0, 3, 1, 0.3, 0.001, 0.3));
        assertThrows(IllegalArgumentException.class, () -> new ScreeningProperties.Quality(2.0, 1.0, 3, 10, 0.3, 0.001, -0.3));
        assertThrows(IllegalArgumentException.class, () -> new ScreeningProperties.Instrument(50, 4, 1, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new ScreeningProperties.Instrument(10, 1, 4, List.of(2, 10)));
    }

    @Test
    void invalidDeploymentSettingFailsAtStartup() {
        var ex = assertThrows(BeanCreationException.class, () -> new SpringApplicationBuilder(ResponseScreeningApplication.class)
                .properties("screening.style.extreme-threshold=1.5")
                .run()
                .close());
        assertInstanceOf(IllegalArgumentException.class, NestedExceptionUtils.getMostSpecificCause(ex));
    }
}
