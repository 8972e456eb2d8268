package com.example.JobCopilot.repository;

import com.example.JobCopilot.model.JobEvent;
import com.example.JobCopilot.util.SqlValues;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class JobEventRepository {

    private static final String SELECT_EVENTS = """
            SELECT id, job_id, property_id, client_id, equipment_id, event_type, issue, resolution,
                   parts_used_json, created_at
            FROM job_events
            WHERE tenant_id = ? AND job_id = ?
            ORDER BY created_at DESC, id
            """;

    private final JdbcTemplate jdbcTemplate;

    /** Most recent events of the job, newest first. */
    public List<JobEvent> findRecentByJob(String tenantId, String jobId, int limit) {
        return jdbcTemplate.query(SELECT_EVENTS + " LIMIT ?", EVENT_MAPPER, tenantId, jobId, limit);
    }

    public List<JobEvent> findAllByJob(String tenantId, String jobId) {
        return jdbcTemplate.query(SELECT_EVENTS, EVENT_MAPPER, tenantId, jobId);
    }

    private static final RowMapper<JobEvent> EVENT_MAPPER = (rs, rowNum) -> new JobEvent(
            rs.getString("id"),
            rs.getString("job_id"),
            rs.getString("property_id"),
            rs.getString("client_id"),
            rs.getString("equipment_id"),
            rs.getString("event_type"),
            rs.getString("issue"),
            rs.getString("resolution"),
            rs.getString("parts_used_json"),
            SqlValues.instant(rs, "created_at"));
}
