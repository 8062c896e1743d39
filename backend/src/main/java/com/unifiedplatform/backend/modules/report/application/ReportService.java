package com.unifiedplatform.backend.modules.report.application;

import java.util.List;

import com.unifiedplatform.backend.modules.report.domain.Report;
import com.unifiedplatform.backend.modules.report.infrastructure.persistence.FactSearchCondition;
import com.unifiedplatform.backend.modules.report.infrastructure.persistence.ReportRepository;
import com.unifiedplatform.backend.modules.report.presentation.dto.ReportResponse;
import com.unifiedplatform.backend.modules.report.presentation.dto.SubmitReportRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private final ReportRepository reportRepository;
    private final LifecycleReferenceChecker referenceChecker;

    public ReportService(ReportRepository reportRepository, LifecycleReferenceChecker referenceChecker) {
        this.reportRepository = reportRepository;
        this.referenceChecker = referenceChecker;
    }

    public Report submit(SubmitReportRequest request) {
        LifecycleReferences references = referenceChecker.check(request.requestId(), request.eventId());
        List<String> photos = request.photos().stream().map(String::trim).toList();
        Report saved = reportRepository.save(new Report(
                references.requestId(),
                references.eventId(),
                trimToNull(request.submittedBy()),
                request.summary().trim(),
                request.attendeesCount(),
                photos
        ));
        log.info("Report {} submitted (request {}, event {})", saved.getId(), references.requestId(), references.eventId());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ReportResponse> listReports(FactSearchCondition condition) {
        if (condition.matchesNothing()) {
            return List.of();
        }
        return reportRepository.search(condition.requestId(), condition.eventId()).stream()
                .map(report -> new ReportResponse(
                        report.getId(),
                        report.getRequestId(),
                        report.getEventId(),
                        report.getSubmittedBy(),
                        report.getSummary(),
                        report.getAttendeesCount(),
                        report.getPhotos(),
                        report.getCreatedAt()
                ))
                .toList();
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
