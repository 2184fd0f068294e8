package com.herzen.screening;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.screening.pipeline.ScreeningModels.ScreeningRequest;
import com.herzen.screening.pipeline.ScreeningPipelineService;
import com.herzen.screening.quality.QualityScreeningService;
import com.herzen.screening.style.StyleCorrectionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.Collections;
import java.util.List;

import static com.herzen.screening.QualityScreeningServiceTest.*;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ResultSerializationTest {
    @Autowired
    private ObjectMapper objectMapper;
    @Autowired
    private QualityScreeningService qualityService;
    @Autowired
    private StyleCorrectionService styleService;
    @Autowired
    private ScreeningPipelineService pipeline;

    @Test
    void qualityResultFlattensToJson() throws Exception {
        var result = qualityService.analyze(Collections.nCopies(50, 2), times(50, 3.5));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(result));

        assertEquals("reject", json.get("recommendation").asText());
        assertTrue(json.get("careless").asBoolean());
        assertEquals(3, json.get("flags").size());
        assertEquals(50, json.at("/details/longstring/maxStreak").asInt());
        assertEquals(0, json.at("/details/longstring/longStreaks/0/startIndex").asInt());
        assertEquals("Too few responses for consistency check",
                objectMapper.readTree(objectMapper.writeValueAsString(
                        qualityService.analyze(List.of(1, 2, 3), List.of(3.0, 3.0, 3.0))))
                        .at("/details/consistency/error").asText());
    }

    @Test
    void correctionResultKeepsNullAcquiescence() throws Exception {
        var result = styleService.correct(repeat(List.of(1, 4), 25));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(result));

        assertTrue(json.at("/styleScores/acquiescence").isNull());
        assertEquals("extreme_responding", json.at("/correctionsApplied/0").asText());
        assertEquals(50, json.get("correctedResponses").size());
    }

    @Test
    void screeningOutcomeUsesLowerCaseStatus() throws Exception {
        var outcome = pipeline.assess(new ScreeningRequest("resp-json", consistentResponses(), times(50, 4.0)));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(outcome));

        assertEquals("success", json.get("status").asText());
        assertEquals("excellent", json.at("/quality/recommendation").asText());
    }
}
