package io.github.riemr.schedule.application.service;

import io.github.riemr.schedule.domain.model.ExportFormat;
import io.github.riemr.schedule.domain.model.ScheduleVersion;
import io.github.riemr.schedule.domain.model.ScheduleVersion.ScheduleVersionMeta;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleVersionTransformServiceTest {

    private final ScheduleVersionTransformService service = new ScheduleVersionTransformService();

    @Test
    void transform_standard_keepsTimestampsAndMeta() {
        ScheduleVersionMeta meta = new ScheduleVersionMeta("1.2", "store-042", "Easter staffing");
        ScheduleVersion version = new ScheduleVersion(5L, "v5", "2024-03-25", "2024-04-07",
                "2024-03-01T09:00:00Z", "2024-03-02T10:30:00Z", true, meta);

        Map<String, Object> view = service.transform(version, ExportFormat.STANDARD);

        assertThat(view).containsOnlyKeys("id", "version", "fromDate", "toDate", "isActive",
                "createdAt", "updatedAt", "metadata");
        assertThat(view.keySet()).first().isEqualTo("id");
        assertThat(view).containsEntry("fromDate", "2024-03-25")
                .containsEntry("isActive", true)
                .containsEntry("updatedAt", "2024-03-02T10:30:00Z")
                .containsEntry("metadata", meta);
    }

    @Test
    void transform_standard_usesEmptyMetadataWhenMissing() {
        Map<String, Object> view = service.transform(
                ScheduleVersion.of(5L, "v5", "2024-03-25", "2024-04-07", false), ExportFormat.STANDARD);

        assertThat(view.get("metadata")).isEqualTo(Map.of());
    }

    @Test
    void transform_compact_encodesActiveAsNumber() {
        Map<String, Object> view = service.transform(
                ScheduleVersion.of(5L, "v5", "2024-03-25", "2024-04-07", false), ExportFormat.COMPACT);

        assertThat(view).containsExactly(
                Map.entry("id", 5L),
                Map.entry("v", "v5"),
                Map.entry("dates", "2024-03-25_2024-04-07"),
                Map.entry("active", 0));
    }
}
