package com.example.JobCopilot.repository;

import com.example.JobCopilot.model.Property;
import com.example.JobCopilot.util.SqlValues;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class PropertyRepository {

    private final JdbcTemplate jdbcTemplate;

    public void insert(String tenantId, Property property) {
        jdbcTemplate.update("""
                        INSERT INTO properties (tenant_id, id, client_id, address_line1, address_line2, city, state, zip,
                                                access_notes, created_at, updated_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                tenantId,
                property.id(),
                property.clientId(),
                property.addressLine1(),
                property.addressLine2(),
                property.city(),
                property.state(),
                property.zip(),
                property.accessNotes(),
                SqlValues.timestamp(property.createdAt()),
                SqlValues.timestamp(property.createdAt()));
    }

    /** The property's client, if the property exists in the tenant. */
    public Optional<String> findClientId(String tenantId, String propertyId) {
        return jdbcTemplate.queryForList(
                        "SELECT client_id FROM properties WHERE tenant_id = ? AND id = ?",
                        String.class, tenantId, propertyId)
                .stream()
                .findFirst();
    }

    /** The client's oldest property, used when a job is created without one. */
    public Optional<String> findFirstIdByClient(String tenantId, String clientId) {
        return jdbcTemplate.queryForList(
                        "SELECT id FROM properties WHERE tenant_id = ? AND client_id = ? ORDER BY created_at ASC, id LIMIT 1",
                        String.class, tenantId, clientId)
                .stream()
                .findFirst();
    }

    public Optional<Property> findById(String tenantId, String propertyId) {
        return jdbcTemplate.query("""
                                SELECT id, client_id, address_line1, address_line2, city, state, zip, access_notes, created_at
                                FROM properties
                                WHERE tenant_id = ? AND id = ?
                                """,
                        PROPERTY_MAPPER, tenantId, propertyId)
                .stream()
                .findFirst();
    }

    private static final RowMapper<Property> PROPERTY_MAPPER = (rs, rowNum) -> new Property(
            rs.getString("id"),
            rs.getString("client_id"),
            rs.getString("address_line1"),
            rs.getString("address_line2"),
            rs.getString("city"),
            rs.getString("state"),
            rs.getString("zip"),
            rs.getString("access_notes"),
            SqlValues.instant(rs, "created_at"));
}
