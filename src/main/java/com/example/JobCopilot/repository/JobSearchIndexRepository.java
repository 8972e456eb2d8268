package com.example.JobCopilot.repository;

import com.example.JobCopilot.util.SqlValues;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * One denormalized text row per job. PostgreSQL derives {@code content_tsv} from {@code content}.
 */
@Repository
@RequiredArgsConstructor
public class JobSearchIndexRepository {

    private final JdbcTemplate jdbcTemplate;

    public int delete(String tenantId, String jobId) {
        return jdbcTemplate.update("DELETE FROM job_search_index WHERE tenant_id = ? AND job_id = ?", tenantId, jobId);
    }

    public void insert(String tenantId, String jobId, String content, Instant updatedAt) {
        jdbcTemplate.update(
                "INSERT INTO job_search_index (tenant_id, job_id, content, updated_at) VALUES (?, ?, ?, ?)",
                tenantId, jobId, content, SqlValues.timestamp(updatedAt));
    }

    /**
     * Job ids whose content matches the {@code to_tsquery('simple', ...)} expression, best match first.
     */
    public List<String> search(String tenantId, String tsQuery, int limit) {
        return jdbcTemplate.queryForList("""
                        SELECT job_id
                        FROM job_search_index
                        WHERE tenant_id = ?
                          AND content_tsv @@ to_tsquery('simple', ?)
                        ORDER BY ts_rank_cd(content_tsv, to_tsquery('simple', ?)) DESC, job_id
                        LIMIT ?
                        """,
                String.class, tenantId, tsQuery, tsQuery, limit);
    }
}
