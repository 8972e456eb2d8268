package com.example.JobCopilot.repository;

import com.example.JobCopilot.model.JobScope;
import com.example.JobCopilot.model.NewNote;
import com.example.JobCopilot.model.Note;
import com.example.JobCopilot.util.SqlValues;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class NoteRepository {

    // Notes on the job itself, its client and its property, in one pass
    private static final String SELECT_SCOPED_NOTES = """
            SELECT n.id, n.entity_type, n.entity_id, n.note_type, n.content, n.author_user_id, n.created_at,
                   u.first_name AS author_first_name, u.last_name AS author_last_name, u.email AS author_email
            FROM notes n
            LEFT JOIN users u ON u.id = n.author_user_id AND u.tenant_id = n.tenant_id
            WHERE n.tenant_id = ?
              AND ((n.entity_type = 'job' AND n.entity_id = ?)
                OR (n.entity_type = 'client' AND n.entity_id = ?)
                OR (n.entity_type = 'property' AND n.entity_id = ?))
            ORDER BY n.created_at DESC, n.id
            """;

    private final JdbcTemplate jdbcTemplate;

    /**
     * Inserts the note. With {@code ignoreConflicts} a clash on the primary key or on the
     * idempotency key leaves the table untouched and reports zero rows.
     */
    public int insert(NewNote note, Instant createdAt, boolean ignoreConflicts) {
        String sql = """
                INSERT INTO notes (tenant_id, id, entity_type, entity_id, note_type, content, author_user_id,
                                   idempotency_key, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """ + (ignoreConflicts ? " ON CONFLICT DO NOTHING" : "");
        return jdbcTemplate.update(sql,
                note.tenantId(),
                note.id(),
                note.entityType(),
                note.entityId(),
                note.noteType(),
                note.content(),
                note.authorUserId(),
                note.idempotencyKey(),
                SqlValues.timestamp(createdAt));
    }

    public Optional<String> findIdByIdempotencyKey(String tenantId, String idempotencyKey) {
        return jdbcTemplate.queryForList(
                        "SELECT id FROM notes WHERE tenant_id = ? AND idempotency_key = ?",
                        String.class, tenantId, idempotencyKey)
                .stream()
                .findFirst();
    }

    /** Newest notes across the job, client and property scopes. */
    public List<Note> findRecentForScope(String tenantId, JobScope scope, int limit) {
        return jdbcTemplate.query(SELECT_SCOPED_NOTES + " LIMIT ?", NOTE_MAPPER,
                tenantId, scope.jobId(), scope.clientId(), scope.propertyId(), limit);
    }

    public List<Note> findAllForScope(String tenantId, JobScope scope) {
        return jdbcTemplate.query(SELECT_SCOPED_NOTES, NOTE_MAPPER,
                tenantId, scope.jobId(), scope.clientId(), scope.propertyId());
    }

    /** Notes attached to the job itself, newest first. */
    public List<Note> findByJob(String tenantId, String jobId) {
        return jdbcTemplate.query("""
                        SELECT n.id, n.entity_type, n.entity_id, n.note_type, n.content, n.author_user_id, n.created_at,
                               u.first_name AS author_first_name, u.last_name AS author_last_name, u.email AS author_email
                        FROM notes n
                        LEFT JOIN users u ON u.id = n.author_user_id AND u.tenant_id = n.tenant_id
                        WHERE n.tenant_id = ? AND n.entity_type = 'job' AND n.entity_id = ?
                        ORDER BY n.created_at DESC, n.id
                        """,
                NOTE_MAPPER, tenantId, jobId);
    }

    private static String authorName(String first, String last, String email) {
        String name = ((first == null ? "" : first.trim()) + " " + (last == null ? "" : last.trim())).trim();
        if (!name.isEmpty()) {
            return name;
        }
        return email;
    }

    private static final RowMapper<Note> NOTE_MAPPER = (rs, rowNum) -> new Note(
            rs.getString("id"),
            rs.getString("entity_type"),
            rs.getString("entity_id"),
            rs.getString("note_type"),
            rs.getString("content"),
            rs.getString("author_user_id"),
            authorName(rs.getString("author_first_name"), rs.getString("author_last_name"), rs.getString("author_email")),
            SqlValues.instant(rs, "created_at"));
}
