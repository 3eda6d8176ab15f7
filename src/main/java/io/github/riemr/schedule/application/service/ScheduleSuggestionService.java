package io.github.riemr.schedule.application.service;

import io.github.riemr.schedule.application.dto.ConflictReport;
import io.github.riemr.schedule.application.dto.DateRangeMetadata;
import io.github.riemr.schedule.application.dto.ScheduleSuggestion;
import io.github.riemr.schedule.application.dto.ValidationResult;
import io.github.riemr.schedule.domain.model.DateRangeCandidate;
import io.github.riemr.schedule.domain.model.ScheduleVersion;
import io.github.riemr.schedule.domain.model.Severity;
import io.github.riemr.schedule.domain.model.SuggestionType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Hints shown while an operator picks the date range of a new schedule.
 * <p>
 * The order of the returned list is stable and meaningful to the UI: validator
 * warnings first, then optimization hints, then the conflict warning.
 */
@Service
@RequiredArgsConstructor
public class ScheduleSuggestionService {
    static final String MSG_MONTHLY_CYCLE = "Date range aligns well with monthly cycles";
    static final String MSG_WORKING_RATIO = "Good ratio of working days to weekends";
    static final String MSG_POTENTIAL_CONFLICTS = "Potential conflicts with existing schedules";
    static final String CANDIDATE_LABEL = "temp";

    private final DateRangeValidationService dateRangeValidationService;
    private final ScheduleConflictAnalysisService conflictAnalysisService;

    public List<ScheduleSuggestion> suggest(DateRangeCandidate candidate, List<ScheduleVersion> existingVersions) {
        if (candidate == null || !candidate.isComplete()) {
            return List.of();
        }
        List<ScheduleSuggestion> suggestions = new ArrayList<>();

        ValidationResult validation = dateRangeValidationService.validate(candidate);
        for (String warning : validation.warnings()) {
            suggestions.add(new ScheduleSuggestion(SuggestionType.WARNING, warning, Severity.MEDIUM));
        }

        DateRangeMetadata metadata = validation.metadata();
        if (metadata.weekCount() > 0) {
            if (metadata.weekCount() % 4 == 0) {
                suggestions.add(new ScheduleSuggestion(SuggestionType.OPTIMIZATION, MSG_MONTHLY_CYCLE, Severity.LOW));
            }
            if (metadata.workingDays() >= metadata.weekendDays() * 2) {
                suggestions.add(new ScheduleSuggestion(SuggestionType.OPTIMIZATION, MSG_WORKING_RATIO, Severity.LOW));
            }
        }

        if (existingVersions != null && !existingVersions.isEmpty()) {
            List<ScheduleVersion> audited = new ArrayList<>(existingVersions);
            audited.add(ScheduleVersion.of(0L, CANDIDATE_LABEL, candidate.from(), candidate.to(), false));
            ConflictReport report = conflictAnalysisService.analyze(audited);
            if (report.hasConflicts()) {
                suggestions.add(new ScheduleSuggestion(SuggestionType.WARNING, MSG_POTENTIAL_CONFLICTS, Severity.HIGH));
            }
        }
        return List.copyOf(suggestions);
    }
}
