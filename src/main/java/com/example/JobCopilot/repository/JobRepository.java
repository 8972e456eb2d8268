package com.example.JobCopilot.repository;

import com.example.JobCopilot.model.Client;
import com.example.JobCopilot.model.Job;
import com.example.JobCopilot.model.JobContextRow;
import com.example.JobCopilot.model.JobContextSnapshot.AssignedUser;
import com.example.JobCopilot.model.JobContextSnapshot.JobDetails;
import com.example.JobCopilot.model.JobFilter;
import com.example.JobCopilot.model.JobScope;
import com.example.JobCopilot.model.JobSummary;
import com.example.JobCopilot.model.Property;
import com.example.JobCopilot.util.SqlValues;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Repository
@RequiredArgsConstructor
public class JobRepository {

    private static final TypeReference<List<String>> TAGS = new TypeReference<>() { };

    // Client and property are inner joins: a job missing either has no snapshot
    private static final String SELECT_CONTEXT = """
            SELECT j.id AS job_id, j.job_type, j.status, j.scheduled_at, j.summary,
                   j.created_at AS job_created_at, j.updated_at AS job_updated_at,
                   u.id AS user_id, u.first_name AS user_first_name, u.last_name AS user_last_name,
                   u.email AS user_email, u.role AS user_role,
                   c.id AS client_id, c.name AS client_name, c.type AS client_type,
                   c.primary_phone AS client_primary_phone, c.email AS client_email, c.tags_json AS client_tags_json,
                   c.created_at AS client_created_at, c.updated_at AS client_updated_at,
                   p.id AS property_id, p.address_line1, p.address_line2, p.city, p.state, p.zip, p.access_notes,
                   p.created_at AS property_created_at
            FROM jobs j
            JOIN clients c ON c.id = j.client_id AND c.tenant_id = j.tenant_id
            JOIN properties p ON p.id = j.property_id AND p.tenant_id = j.tenant_id
            LEFT JOIN users u ON u.id = j.assigned_user_id AND u.tenant_id = j.tenant_id
            WHERE j.tenant_id = ? AND j.id = ?
            """;

    private static final String SELECT_SUMMARY = """
            SELECT j.id, j.client_id, j.property_id, j.job_type, j.status, j.scheduled_at, j.summary,
                   j.assigned_user_id,
                   NULLIF(TRIM(COALESCE(u.first_name, '') || ' ' || COALESCE(u.last_name, '')), '') AS assigned_user_name,
                   j.created_at, j.updated_at
            FROM jobs j
            LEFT JOIN users u ON u.id = j.assigned_user_id AND u.tenant_id = j.tenant_id
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public void insert(String tenantId, Job job) {
        jdbcTemplate.update("""
                        INSERT INTO jobs (tenant_id, id, property_id, client_id, job_type, scheduled_at, status,
                                          assigned_user_id, summary, created_at, updated_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                tenantId,
                job.id(),
                job.propertyId(),
                job.clientId(),
                job.jobType(),
                SqlValues.timestamp(job.scheduledAt()),
                job.status(),
                job.assignedUserId(),
                job.summary(),
                SqlValues.timestamp(job.createdAt()),
                SqlValues.timestamp(job.updatedAt()));
    }

    public boolean exists(String tenantId, String jobId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM jobs WHERE tenant_id = ? AND id = ?",
                Integer.class, tenantId, jobId);
        return count != null && count > 0;
    }

    public Optional<Job> findById(String tenantId, String jobId) {
        return jdbcTemplate.query("""
                                SELECT id, client_id, property_id, job_type, status, scheduled_at, assigned_user_id,
                                       summary, created_at, updated_at
                                FROM jobs
                                WHERE tenant_id = ? AND id = ?
                                """,
                        JOB_MAPPER, tenantId, jobId)
                .stream()
                .findFirst();
    }

    /** Job with its client, property and assignee from one joined read. */
    public Optional<JobContextRow> findContext(String tenantId, String jobId) {
        return jdbcTemplate.query(SELECT_CONTEXT, new ContextRowMapper(), tenantId, jobId)
                .stream()
                .findFirst();
    }

    public Optional<JobSummary> findSummary(String tenantId, String jobId) {
        return jdbcTemplate.query(SELECT_SUMMARY + " WHERE j.tenant_id = ? AND j.id = ?", SUMMARY_MAPPER, tenantId, jobId)
                .stream()
                .findFirst();
    }

    /** Jobs of the tenant matching every set filter, earliest scheduled first. */
    public List<JobSummary> search(String tenantId, JobFilter filter) {
        List<String> where = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        where.add("j.tenant_id = ?");
        params.add(tenantId);

        if (filter.clientId() != null) {
            where.add("j.client_id = ?");
            params.add(filter.clientId());
        }
        if (filter.status() != null) {
            where.add("j.status = ?");
            params.add(filter.status());
        }
        if (filter.jobType() != null) {
            where.add("j.job_type = ?");
            params.add(filter.jobType());
        }
        if (filter.assignedUserId() != null) {
            where.add("j.assigned_user_id = ?");
            params.add(filter.assignedUserId());
        }
        if (filter.scheduledFrom() != null && filter.scheduledTo() != null) {
            where.add("j.scheduled_at >= ? AND j.scheduled_at <= ?");
            params.add(SqlValues.timestamp(filter.scheduledFrom()));
            params.add(SqlValues.timestamp(filter.scheduledTo()));
        }

        String sql = SELECT_SUMMARY + " WHERE " + String.join(" AND ", where) + " ORDER BY j.scheduled_at ASC, j.id";
        return jdbcTemplate.query(sql, SUMMARY_MAPPER, params.toArray());
    }

    /** Sets the assignee and moves the job to {@code assigned}. Returns the number of rows updated. */
    public int assign(String tenantId, String jobId, String userId, Instant updatedAt) {
        return jdbcTemplate.update(
                "UPDATE jobs SET assigned_user_id = ?, status = 'assigned', updated_at = ? WHERE tenant_id = ? AND id = ?",
                userId, SqlValues.timestamp(updatedAt), tenantId, jobId);
    }

    public Optional<JobScope> findScope(String tenantId, String jobId) {
        return jdbcTemplate.query(
                        "SELECT id, client_id, property_id FROM jobs WHERE tenant_id = ? AND id = ?",
                        (rs, rowNum) -> new JobScope(rs.getString("id"), rs.getString("client_id"), rs.getString("property_id")),
                        tenantId, jobId)
                .stream()
                .findFirst();
    }

    public List<String> findIdsByClient(String tenantId, String clientId) {
        return jdbcTemplate.queryForList(
                "SELECT id FROM jobs WHERE tenant_id = ? AND client_id = ? ORDER BY id",
                String.class, tenantId, clientId);
    }

    public List<String> findIdsByProperty(String tenantId, String propertyId) {
        return jdbcTemplate.queryForList(
                "SELECT id FROM jobs WHERE tenant_id = ? AND property_id = ? ORDER BY id",
                String.class, tenantId, propertyId);
    }

    public List<String> findIdsByTenant(String tenantId) {
        return jdbcTemplate.queryForList(
                "SELECT id FROM jobs WHERE tenant_id = ? ORDER BY id",
                String.class, tenantId);
    }

    private static final RowMapper<Job> JOB_MAPPER = (rs, rowNum) -> new Job(
            rs.getString("id"),
            rs.getString("client_id"),
            rs.getString("property_id"),
            rs.getString("job_type"),
            rs.getString("status"),
            SqlValues.instant(rs, "scheduled_at"),
            rs.getString("assigned_user_id"),
            rs.getString("summary"),
            SqlValues.instant(rs, "created_at"),
            SqlValues.instant(rs, "updated_at"));

    private static final RowMapper<JobSummary> SUMMARY_MAPPER = (rs, rowNum) -> new JobSummary(
            rs.getString("id"),
            rs.getString("client_id"),
            rs.getString("property_id"),
            rs.getString("job_type"),
            rs.getString("status"),
            SqlValues.instant(rs, "scheduled_at"),
            rs.getString("summary"),
            rs.getString("assigned_user_id"),
            rs.getString("assigned_user_name"),
            SqlValues.instant(rs, "created_at"),
            SqlValues.instant(rs, "updated_at"));

    private static String displayName(String first, String last, String email) {
        String name = ((first == null ? "" : first.trim()) + " " + (last == null ? "" : last.trim())).trim();
        return name.isEmpty() ? email : name;
    }

    private List<String> readTags(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, TAGS);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed client tags: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private class ContextRowMapper implements RowMapper<JobContextRow> {
        @Override
        public JobContextRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            String userId = rs.getString("user_id");
            AssignedUser assignedTo = userId == null
                    ? null
                    : new AssignedUser(
                    userId,
                    displayName(rs.getString("user_first_name"), rs.getString("user_last_name"), rs.getString("user_email")),
                    rs.getString("user_email"),
                    rs.getString("user_role"));

            JobDetails job = new JobDetails(
                    rs.getString("job_id"),
                    rs.getString("job_type"),
                    rs.getString("status"),
                    SqlValues.instant(rs, "scheduled_at"),
                    rs.getString("summary"),
                    assignedTo,
                    SqlValues.instant(rs, "job_created_at"),
                    SqlValues.instant(rs, "job_updated_at"));

            Client client = new Client(
                    rs.getString("client_id"),
                    rs.getString("client_name"),
                    rs.getString("client_type"),
                    rs.getString("client_primary_phone"),
                    rs.getString("client_email"),
                    readTags(rs.getString("client_tags_json")),
                    SqlValues.instant(rs, "client_created_at"),
                    SqlValues.instant(rs, "client_updated_at"));

            Property property = new Property(
                    rs.getString("property_id"),
                    rs.getString("client_id"),
                    rs.getString("address_line1"),
                    rs.getString("address_line2"),
                    rs.getString("city"),
                    rs.getString("state"),
                    rs.getString("zip"),
                    rs.getString("access_notes"),
                    SqlValues.instant(rs, "property_created_at"));

            return new JobContextRow(job, client, property);
        }
    }
}
