package com.unifiedplatform.backend.modules.report.presentation;

import java.util.List;

import com.unifiedplatform.backend.global.web.CreatedResponse;
import com.unifiedplatform.backend.modules.report.application.EvaluationService;
import com.unifiedplatform.backend.modules.report.domain.Evaluation;
import com.unifiedplatform.backend.modules.report.infrastructure.persistence.FactSearchCondition;
import com.unifiedplatform.backend.modules.report.presentation.dto.EvaluationResponse;
import com.unifiedplatform.backend.modules.report.presentation.dto.SubmitEvaluationRequest;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/evaluations")
public class EvaluationController {

    private final EvaluationService evaluationService;

    public EvaluationController(EvaluationService evaluationService) {
        this.evaluationService = evaluationService;
    }

    @PostMapping
    public ResponseEntity<CreatedResponse> submitEvaluation(@Valid @RequestBody SubmitEvaluationRequest request) {
        Evaluation saved = evaluationService.submit(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(CreatedResponse.of(saved.getId()));
    }

    @GetMapping
    public ResponseEntity<List<EvaluationResponse>> listEvaluations(
            @RequestParam(name = "request_id", required = false) String requestId,
            @RequestParam(name = "event_id", required = false) String eventId
    ) {
        return ResponseEntity.ok(evaluationService.listEvaluations(FactSearchCondition.of(requestId, eventId)));
    }
}
