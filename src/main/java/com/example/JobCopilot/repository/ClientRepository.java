package com.example.JobCopilot.repository;

import com.example.JobCopilot.model.Client;
import com.example.JobCopilot.model.ClientSummary;
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
import java.util.Locale;
import java.util.Optional;

@Slf4j
@Repository
@RequiredArgsConstructor
public class ClientRepository {

    private static final TypeReference<List<String>> TAGS = new TypeReference<>() { };

    // Oldest property of the client stands in as its address
    private static final String FIRST_PROPERTY = """
            (SELECT p.%s FROM properties p
             WHERE p.tenant_id = c.tenant_id AND p.client_id = c.id
             ORDER BY p.created_at LIMIT 1)""";

    private static final String SUMMARY_COLUMNS = """
            c.id, c.name, c.type, c.primary_phone, c.email,
            %s AS address_line1,
            %s AS city,
            %s AS state,
            %s AS zip,
            c.created_at, c.updated_at
            """.formatted(firstProperty("address_line1"), firstProperty("city"),
            firstProperty("state"), firstProperty("zip"));

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public void insert(String tenantId, Client client) {
        jdbcTemplate.update("""
                        INSERT INTO clients (tenant_id, id, name, type, primary_phone, email, tags_json, created_at, updated_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                tenantId,
                client.id(),
                client.name(),
                client.type(),
                client.primaryPhone(),
                client.email(),
                writeTags(client.tags()),
                SqlValues.timestamp(client.createdAt()),
                SqlValues.timestamp(client.updatedAt()));
    }

    public boolean exists(String tenantId, String clientId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM clients WHERE tenant_id = ? AND id = ?",
                Integer.class, tenantId, clientId);
        return count != null && count > 0;
    }

    public Optional<Client> findById(String tenantId, String clientId) {
        List<Client> rows = jdbcTemplate.query("""
                        SELECT id, name, type, primary_phone, email, tags_json, created_at, updated_at
                        FROM clients
                        WHERE tenant_id = ? AND id = ?
                        """,
                new ClientRowMapper(), tenantId, clientId);
        return rows.stream().findFirst();
    }

    public Optional<ClientSummary> findSummary(String tenantId, String clientId) {
        String sql = "SELECT " + SUMMARY_COLUMNS + " FROM clients c WHERE c.tenant_id = ? AND c.id = ?";
        return jdbcTemplate.query(sql, SUMMARY_MAPPER, tenantId, clientId).stream().findFirst();
    }

    /**
     * Clients of the tenant, newest first. {@code search} matches name, phone or email
     * case-insensitively; {@code city} and {@code state} match the primary property exactly.
     */
    public List<ClientSummary> search(String tenantId, String search, String city, String state) {
        List<String> where = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        where.add("c.tenant_id = ?");
        params.add(tenantId);

        if (search != null) {
            where.add("(LOWER(c.name) LIKE ? OR LOWER(c.primary_phone) LIKE ? OR LOWER(c.email) LIKE ?)");
            String token = "%" + search.toLowerCase(Locale.ROOT) + "%";
            params.add(token);
            params.add(token);
            params.add(token);
        }
        if (city != null) {
            where.add(firstProperty("city") + " = ?");
            params.add(city);
        }
        if (state != null) {
            where.add(firstProperty("state") + " = ?");
            params.add(state);
        }

        String sql = "SELECT " + SUMMARY_COLUMNS + " FROM clients c WHERE "
                + String.join(" AND ", where)
                + " ORDER BY c.created_at DESC";
        return jdbcTemplate.query(sql, SUMMARY_MAPPER, params.toArray());
    }

    private static String firstProperty(String column) {
        return FIRST_PROPERTY.formatted(column);
    }

    private String writeTags(List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(tags);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize client tags", e);
            return null;
        }
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

    private static final RowMapper<ClientSummary> SUMMARY_MAPPER = (rs, rowNum) -> new ClientSummary(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("type"),
            rs.getString("primary_phone"),
            rs.getString("email"),
            rs.getString("address_line1"),
            rs.getString("city"),
            rs.getString("state"),
            rs.getString("zip"),
            SqlValues.instant(rs, "created_at"),
            SqlValues.instant(rs, "updated_at"));

    private class ClientRowMapper implements RowMapper<Client> {
        @Override
        public Client mapRow(ResultSet rs, int rowNum) throws SQLException {
            Instant createdAt = SqlValues.instant(rs, "created_at");
            return new Client(
                    rs.getString("id"),
                    rs.getString("name"),
                    rs.getString("type"),
                    rs.getString("primary_phone"),
                    rs.getString("email"),
                    readTags(rs.getString("tags_json")),
                    createdAt,
                    SqlValues.instant(rs, "updated_at"));
        }
    }
}
