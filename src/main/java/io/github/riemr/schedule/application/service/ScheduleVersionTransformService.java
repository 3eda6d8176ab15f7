package io.github.riemr.schedule.application.service;

import io.github.riemr.schedule.domain.model.ExportFormat;
import io.github.riemr.schedule.domain.model.ScheduleVersion;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@Service
public class ScheduleVersionTransformService {

    public Map<String, Object> transform(ScheduleVersion version, ExportFormat format) {
        Objects.requireNonNull(version, "version");
        Map<String, Object> m = new LinkedHashMap<>();
        if (format == ExportFormat.COMPACT) {
            m.put("id", version.id());
            m.put("v", version.version());
            m.put("dates", version.fromDate() + "_" + version.toDate());
            m.put("active", version.active() ? 1 : 0);
            return m;
        }
        m.put("id", version.id());
        m.put("version", version.version());
        m.put("fromDate", version.fromDate());
        m.put("toDate", version.toDate());
        m.put("isActive", version.active());
        m.put("createdAt", version.createdAt());
        m.put("updatedAt", version.updatedAt());
        m.put("metadata", version.meta() != null ? version.meta() : Map.of());
        return m;
    }
}
