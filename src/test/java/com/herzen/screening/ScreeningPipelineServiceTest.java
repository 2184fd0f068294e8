package com.herzen.screening;

import com.herzen.screening.pipeline.ScreeningModels.ScreeningOutcome;
import com.herzen.screening.pipeline.ScreeningModels.ScreeningRequest;
import com.herzen.screening.pipeline.ScreeningModels.ScreeningStatus;
import com.herzen.screening.pipeline.ScreeningPipelineService;
import com.herzen.screening.quality.QualityModels.QualityIssue;
import com.herzen.screening.quality.Recommendation;
import com.herzen.screening.style.StyleModels;
import com.herzen.screening.validation.InvalidInputException;
import com.herzen.screening.validation.ValidationCodes;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static com.herzen.screening.QualityScreeningServiceTest.*;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ScreeningPipelineServiceTest {
    @Autowired
    private ScreeningPipelineService pipeline;

    @Test
    void rejectedResponsesSkipStyleCorrection() {
        List<Integer> responses = Collections.nCopies(50, 2);

        ScreeningOutcome outcome = pipeline.assess(new ScreeningRequest("resp-1", responses, times(50, 3.5)));

        assertEquals(ScreeningStatus.INVALID, outcome.status());
        assertEquals(Recommendation.REJECT, outcome.quality().recommendation());
        assertNull(outcome.correction());
        assertEquals(responses, outcome.finalResponses());
        assertEquals(List.of("REPEATED_ANSWERS", "INCONSISTENT_ANSWERS", "LOW_SPREAD"),
                outcome.qualityIssues().stream().map(QualityIssue::code).toList());
    }

    @Test
    void warningLevelResponsesAreStillCorrected() {
        ScreeningOutcome outcome = pipeline.assess(new ScreeningRequest("resp-2", repeat(List.of(2, 3), 25), times(50, 3.5)));

        assertEquals(ScreeningStatus.WARNING, outcome.status());
        assertNotNull(outcome.correction());
        assertEquals(List.of(StyleModels.MIDPOINT_RESPONDING), outcome.correction().correctionsApplied());
        // default Rosenberg reverse items are applied, every adjacent pair sums to 5
        assertEquals(0.0, outcome.correction().styleScores().acquiescence());
        assertEquals(outcome.correction().correctedResponses(), outcome.finalResponses());
    }

    @Test
    void cleanResponsesSucceed() {
        ScreeningOutcome outcome = pipeline.assess(new ScreeningRequest("resp-3", consistentResponses(), times(50, 4.0)));

        assertEquals(ScreeningStatus.SUCCESS, outcome.status());
        assertTrue(outcome.qualityIssues().isEmpty());
        assertNotNull(outcome.correction().styleScores().acquiescence());
    }

    @Test
    void explicitReverseItemsOverrideTheDefault() {
        ScreeningOutcome outcome = pipeline.assess(new ScreeningRequest("resp-4", Collections.nCopies(50, 4),
                times(50, 4.0), Set.of(1, 3, 5, 7, 9, 11, 13, 15, 17, 19), null));

        // longstring + inconsistent + low variance already reject this one
        assertEquals(ScreeningStatus.INVALID, outcome.status());

        ScreeningOutcome emptyReverse = pipeline.assess(new ScreeningRequest("resp-5", consistentResponses(),
                times(50, 4.0), Set.of(), null));
        assertNull(emptyReverse.correction().styleScores().acquiescence());
    }

    @Test
    void enforcesConfiguredInstrumentLength() {
        var ex = assertThrows(InvalidInputException.class,
                () -> pipeline.assess(new ScreeningRequest("resp-6", List.of(1, 2, 3, 4), times(4, 3.0))));
        assertEquals(ValidationCodes.INSTRUMENT_LENGTH, ex.code());
    }
}
