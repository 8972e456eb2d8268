package com.example.JobCopilot.repository;

import com.example.JobCopilot.model.VectorMatch;
import com.example.JobCopilot.model.VectorQuery;
import com.example.JobCopilot.model.VectorRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * {@link VectorIndex} on the {@code job_evidence_vectors} table.
 * Uses pgvector's cosine distance operator {@code <=>}; score = 1 - distance.
 * Filters are equality checks on top-level JSONB metadata keys.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class PgVectorIndex implements VectorIndex {

    private static final TypeReference<Map<String, Object>> METADATA = new TypeReference<>() { };

    // Filter keys are inlined into SQL
    private static final Pattern FILTER_KEY = Pattern.compile("[a-z_]{1,64}");

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public List<VectorMatch> query(float[] embedding, VectorQuery query) {
        PGvector queryVector = new PGvector(embedding);

        List<Object> params = new ArrayList<>();
        params.add(queryVector); // 1 - (embedding <=> ?)

        StringBuilder where = new StringBuilder();
        if (query.hasFilter()) {
            for (Map.Entry<String, Object> entry : query.filter().entrySet()) {
                if (!FILTER_KEY.matcher(entry.getKey()).matches()) {
                    throw new IllegalArgumentException("Unsupported metadata filter key: " + entry.getKey());
                }
                where.append(where.length() == 0 ? " WHERE " : " AND ");
                where.append("metadata ->> '").append(entry.getKey()).append("' = ?");
                params.add(String.valueOf(entry.getValue()));
            }
        }
        params.add(queryVector); // ORDER BY embedding <=> ?
        params.add(query.topK());

        String sql = """
                SELECT id,
                       metadata::text AS metadata,
                       1 - (embedding <=> ?) AS score
                FROM job_evidence_vectors
                """ + where + """

                ORDER BY embedding <=> ?
                LIMIT ?
                """;

        return jdbcTemplate.query(sql, new VectorMatchRowMapper(), params.toArray());
    }

    @Override
    public List<VectorRecord> get(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(ids.size(), "?"));
        String sql = "SELECT id, metadata::text AS metadata FROM job_evidence_vectors WHERE id IN (" + placeholders + ")";
        return jdbcTemplate.query(sql,
                (rs, rowNum) -> VectorRecord.metadataOnly(rs.getString("id"), readMetadata(rs.getString("metadata"))),
                ids.toArray());
    }

    @Override
    public void upsert(List<VectorRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        List<Object[]> batch = new ArrayList<>(records.size());
        for (VectorRecord record : records) {
            batch.add(new Object[]{record.id(), new PGvector(record.values()), writeMetadata(record.metadata())});
        }
        jdbcTemplate.batchUpdate("""
                INSERT INTO job_evidence_vectors (id, embedding, metadata, updated_at)
                VALUES (?, ?, CAST(? AS jsonb), CURRENT_TIMESTAMP)
                ON CONFLICT (id) DO UPDATE
                SET embedding = EXCLUDED.embedding,
                    metadata = EXCLUDED.metadata,
                    updated_at = EXCLUDED.updated_at
                """, batch);
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA);
        } catch (JsonProcessingException e) {
            // Unreadable metadata fails the tenant/job check downstream
            log.warn("Ignoring unreadable vector metadata: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private String writeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Vector metadata is not serializable", e);
        }
    }

    private class VectorMatchRowMapper implements RowMapper<VectorMatch> {
        @Override
        public VectorMatch mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new VectorMatch(
                    rs.getString("id"),
                    rs.getDouble("score"),
                    readMetadata(rs.getString("metadata")));
        }
    }
}
