package com.herzen.screening;

import com.herzen.screening.style.StyleInterpretationService;
import com.herzen.screening.style.StyleModels;
import com.herzen.screening.style.StyleModels.StyleScores;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StyleInterpretationServiceTest {
    private final StyleInterpretationService service = new StyleInterpretationService();

    @Test
    void mapsScoresToLevels() {
        var result = service.interpret(new StyleScores(0.85, 0.10, 0.75));

        assertEquals(StyleInterpretationService.VERY_HIGH, result.get(StyleModels.EXTREME_RESPONDING).level());
        assertEquals(StyleInterpretationService.NORMAL, result.get(StyleModels.MIDPOINT_RESPONDING).level());
        assertNull(result.get(StyleModels.MIDPOINT_RESPONDING).recommendation());
        assertEquals(StyleInterpretationService.HIGH, result.get(StyleModels.ACQUIESCENCE).level());
        assertNotNull(result.get(StyleModels.ACQUIESCENCE).recommendation());
    }

    @Test
    void boundariesAreExclusive() {
        var result = service.interpret(new StyleScores(0.8, 0.6, 0.7));

        assertEquals(StyleInterpretationService.HIGH, result.get(StyleModels.EXTREME_RESPONDING).level());
        assertEquals(StyleInterpretationService.NORMAL, result.get(StyleModels.MIDPOINT_RESPONDING).level());
        assertEquals(StyleInterpretationService.NORMAL, result.get(StyleModels.ACQUIESCENCE).level());
    }

    @Test
    void skipsAcquiescenceWithoutScore() {
        var result = service.interpret(new StyleScores(0.2, 0.9, null));

        assertFalse(result.containsKey(StyleModels.ACQUIESCENCE));
        assertEquals(StyleInterpretationService.VERY_HIGH, result.get(StyleModels.MIDPOINT_RESPONDING).level());
    }
}
