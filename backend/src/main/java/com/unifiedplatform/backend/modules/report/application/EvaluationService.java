package com.unifiedplatform.backend.modules.report.application;

import java.util.List;

import com.unifiedplatform.backend.modules.report.domain.Evaluation;
import com.unifiedplatform.backend.modules.report.infrastructure.persistence.EvaluationRepository;
import com.unifiedplatform.backend.modules.report.infrastructure.persistence.FactSearchCondition;
import com.unifiedplatform.backend.modules.report.presentation.dto.EvaluationResponse;
import com.unifiedplatform.backend.modules.report.presentation.dto.SubmitEvaluationRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class EvaluationService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);

    private final EvaluationRepository evaluationRepository;
    private final LifecycleReferenceChecker referenceChecker;

    public EvaluationService(EvaluationRepository evaluationRepository, LifecycleReferenceChecker referenceChecker) {
        this.evaluationRepository = evaluationRepository;
        this.referenceChecker = referenceChecker;
    }

    public Evaluation submit(SubmitEvaluationRequest request) {
        LifecycleReferences references = referenceChecker.check(request.requestId(), request.eventId());
        Evaluation saved = evaluationRepository.save(new Evaluation(
                references.requestId(),
                references.eventId(),
                request.score(),
                blankToNull(request.methodology()),
                blankToNull(request.comments())
        ));
        log.info("Evaluation {} scored {} (request {}, event {})",
                saved.getId(), saved.getScore(), references.requestId(), references.eventId());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<EvaluationResponse> listEvaluations(FactSearchCondition condition) {
        if (condition.matchesNothing()) {
            return List.of();
        }
        return evaluationRepository.search(condition.requestId(), condition.eventId()).stream()
                .map(evaluation -> new EvaluationResponse(
                        evaluation.getId(),
                        evaluation.getRequestId(),
                        evaluation.getEventId(),
                        evaluation.getScore(),
                        evaluation.getMethodology(),
                        evaluation.getComments(),
                        evaluation.getCreatedAt()
                ))
                .toList();
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
