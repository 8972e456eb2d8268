package com.example.JobCopilot.repository;

import com.example.JobCopilot.model.Technician;
import com.example.JobCopilot.util.SqlValues;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Tenant users (technicians and office staff), stored in {@code users}.
 */
@Repository
@RequiredArgsConstructor
public class TechnicianRepository {

    private static final String COLUMNS = "id, first_name, last_name, email, role, phone, created_at";

    private final JdbcTemplate jdbcTemplate;

    public void insert(String tenantId, Technician technician) {
        Instant createdAt = technician.createdAt();
        jdbcTemplate.update("""
                        INSERT INTO users (id, tenant_id, first_name, last_name, email, role, phone, created_at, updated_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                technician.id(),
                tenantId,
                technician.firstName(),
                technician.lastName(),
                technician.email(),
                technician.role(),
                technician.phone(),
                SqlValues.timestamp(createdAt),
                SqlValues.timestamp(createdAt));
    }

    public Optional<Technician> findById(String tenantId, String userId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM users WHERE tenant_id = ? AND id = ?",
                        TECHNICIAN_MAPPER, tenantId, userId)
                .stream()
                .findFirst();
    }

    /** {@code search} matches first name, last name or email; {@code role} matches exactly. */
    public List<Technician> search(String tenantId, String search, String role) {
        List<String> where = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        where.add("tenant_id = ?");
        params.add(tenantId);

        if (search != null) {
            where.add("(LOWER(first_name) LIKE ? OR LOWER(last_name) LIKE ? OR LOWER(email) LIKE ?)");
            String token = "%" + search.toLowerCase(Locale.ROOT) + "%";
            params.add(token);
            params.add(token);
            params.add(token);
        }
        if (role != null) {
            where.add("role = ?");
            params.add(role);
        }

        String sql = "SELECT " + COLUMNS + " FROM users WHERE " + String.join(" AND ", where)
                + " ORDER BY created_at DESC, id";
        return jdbcTemplate.query(sql, TECHNICIAN_MAPPER, params.toArray());
    }

    private static final RowMapper<Technician> TECHNICIAN_MAPPER = (rs, rowNum) -> new Technician(
            rs.getString("id"),
            rs.getString("first_name"),
            rs.getString("last_name"),
            rs.getString("email"),
            rs.getString("role"),
            rs.getString("phone"),
            SqlValues.instant(rs, "created_at"));
}
