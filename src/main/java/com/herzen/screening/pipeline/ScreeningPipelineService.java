package com.herzen.screening.pipeline;

import com.herzen.screening.config.ScreeningProperties;
import com.herzen.screening.pipeline.ScreeningModels.*;
import com.herzen.screening.quality.QualityFlags;
import com.herzen.screening.quality.QualityModels.QualityCheckResult;
import com.herzen.screening.quality.QualityScreeningService;
import com.herzen.screening.quality.Recommendation;
import com.herzen.screening.style.StyleCorrectionService;
import com.herzen.screening.style.StyleModels.CorrectionResult;
import com.herzen.screening.validation.ResponseValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

@Service
public class ScreeningPipelineService {
    private static final Logger log = LoggerFactory.getLogger(ScreeningPipelineService.class);

    private final QualityScreeningService qualityService;
    private final StyleCorrectionService styleService;
    private final ResponseValidator validator;
    private final Set<Integer> defaultReverseItems;

    public ScreeningPipelineService(QualityScreeningService qualityService,
                                    StyleCorrectionService styleService,
                                    ResponseValidator validator,
                                    ScreeningProperties properties) {
        this.qualityService = qualityService;
        this.styleService = styleService;
        this.validator = validator;
        this.defaultReverseItems = Set.copyOf(properties.instrument().reverseItems());
    }

    public ScreeningOutcome assess(ScreeningRequest request) {
        validator.validateInstrumentLength(request.responses());

        QualityCheckResult quality = qualityService.analyze(request.responses(), request.responseTimes(), request.referenceData());
        var issues = QualityFlags.issuesFor(quality.flags());

        if (quality.recommendation() == Recommendation.REJECT) {
            log.info("Rejected responses of {}: score={}, flags={}", request.respondentId(), quality.qualityScore(), quality.flags());
            return new ScreeningOutcome(request.respondentId(), ScreeningStatus.INVALID, quality, null,
                    List.copyOf(request.responses()), issues);
        }

        Set<Integer> reverseItems = request.reverseItems() == null ? defaultReverseItems : request.reverseItems();
        CorrectionResult correction = styleService.correct(request.responses(), reverseItems);

        ScreeningStatus status = quality.recommendation() == Recommendation.WARNING
                ? ScreeningStatus.WARNING
                : ScreeningStatus.SUCCESS;
        return new ScreeningOutcome(request.respondentId(), status, quality, correction,
                correction.correctedResponses(), issues);
    }
}
