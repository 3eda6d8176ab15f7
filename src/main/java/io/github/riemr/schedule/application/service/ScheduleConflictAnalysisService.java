package io.github.riemr.schedule.application.service;

import io.github.riemr.schedule.application.dto.ConflictReport;
import io.github.riemr.schedule.application.dto.ConflictResolution;
import io.github.riemr.schedule.application.dto.ScheduleConflict;
import io.github.riemr.schedule.application.util.ScheduleCalendarUtils;
import io.github.riemr.schedule.config.ScheduleValidationProperties;
import io.github.riemr.schedule.domain.model.ConflictKind;
import io.github.riemr.schedule.domain.model.ScheduleVersion;
import io.github.riemr.schedule.domain.model.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Audits a set of schedule versions for overlapping periods, coverage gaps and
 * unusable date ranges.
 * <p>
 * Versions are ordered by start date, then end date, then label; the sort is stable
 * so fully equal versions keep their input order. Overlaps and gaps between
 * neighbours come first in the report, followed by invalid ranges in input order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleConflictAnalysisService {

    private static final Comparator<LocatedVersion> CHRONOLOGICAL = Comparator
            .comparing(LocatedVersion::from, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()))
            .thenComparing(LocatedVersion::to, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()))
            .thenComparing(v -> v.version().version(), Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private final ScheduleValidationProperties properties;

    public ConflictReport analyze(List<ScheduleVersion> versions) {
        if (versions == null || versions.isEmpty()) {
            return ConflictReport.empty();
        }

        List<LocatedVersion> located = new ArrayList<>(versions.size());
        for (ScheduleVersion v : versions) {
            if (v == null) continue;
            located.add(new LocatedVersion(v,
                    ScheduleCalendarUtils.parseDate(v.fromDate()),
                    ScheduleCalendarUtils.parseDate(v.toDate())));
        }

        List<ScheduleConflict> conflicts = new ArrayList<>();
        List<ConflictResolution> resolutions = new ArrayList<>();

        // List.sort is a stable merge sort
        List<LocatedVersion> sorted = new ArrayList<>(located);
        sorted.sort(CHRONOLOGICAL);
        for (int i = 0; i < sorted.size() - 1; i++) {
            checkNeighbours(sorted.get(i), sorted.get(i + 1), conflicts, resolutions);
        }

        for (LocatedVersion v : located) {
            checkRange(v, conflicts, resolutions);
        }

        ConflictReport report = new ConflictReport(conflicts, resolutions);
        log.debug("Analyzed {} schedule versions: {} conflicts", versions.size(), conflicts.size());
        return report;
    }

    private void checkNeighbours(LocatedVersion current, LocatedVersion next,
                                 List<ScheduleConflict> conflicts, List<ConflictResolution> resolutions) {
        if (current.to() == null || next.from() == null) {
            // reported as invalid ranges instead
            return;
        }
        String currentLabel = current.version().version();
        String nextLabel = next.version().version();
        List<String> affected = List.of(current.version().toDate(), next.version().fromDate());

        // a same-day handover counts as an overlap
        if (!current.to().isBefore(next.from())) {
            conflicts.add(new ScheduleConflict(ConflictKind.OVERLAP,
                    "Schedule " + currentLabel + " overlaps with " + nextLabel,
                    affected, Severity.HIGH));
            resolutions.add(new ConflictResolution("Adjust dates",
                    "Move " + nextLabel + " start date to " + current.to().plusDays(1),
                    "Will create gap or extend current schedule"));
            return;
        }

        long gapDays = ScheduleCalendarUtils.gapDays(current.to(), next.from());
        if (gapDays > properties.getGapWarningDays()) {
            conflicts.add(new ScheduleConflict(ConflictKind.GAP,
                    gapDays + " day gap between " + currentLabel + " and " + nextLabel,
                    affected, Severity.MEDIUM));
            resolutions.add(new ConflictResolution("Fill gap",
                    "Create intermediate schedule or extend existing one",
                    "Will ensure continuous coverage"));
        }
    }

    private void checkRange(LocatedVersion v, List<ScheduleConflict> conflicts, List<ConflictResolution> resolutions) {
        String label = v.version().version();
        List<String> affected = new ArrayList<>(2);
        affected.add(v.version().fromDate());
        affected.add(v.version().toDate());

        if (v.from() == null || v.to() == null) {
            conflicts.add(new ScheduleConflict(ConflictKind.INVALID_RANGE,
                    "Invalid date range in schedule " + label, affected, Severity.HIGH));
            resolutions.add(new ConflictResolution("Fix dates",
                    "Correct invalid date format",
                    "Schedule will become usable"));
        } else if (!v.from().isBefore(v.to())) {
            conflicts.add(new ScheduleConflict(ConflictKind.INVALID_RANGE,
                    "Start date is not before end date in schedule " + label, affected, Severity.HIGH));
            resolutions.add(new ConflictResolution("Swap or adjust dates",
                    "Ensure start date is before end date",
                    "Schedule will have correct temporal order"));
        }
    }

    private record LocatedVersion(ScheduleVersion version, LocalDate from, LocalDate to) {}
}
