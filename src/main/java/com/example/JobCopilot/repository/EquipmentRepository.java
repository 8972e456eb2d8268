package com.example.JobCopilot.repository;

import com.example.JobCopilot.model.Equipment;
import com.example.JobCopilot.util.SqlValues;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class EquipmentRepository {

    private final JdbcTemplate jdbcTemplate;

    /** Equipment installed at the property, most recently installed first. */
    public List<Equipment> findByProperty(String tenantId, String propertyId) {
        return jdbcTemplate.query("""
                        SELECT id, property_id, type, brand, model, serial, installed_at, installed_by, warranty_expires_at
                        FROM equipment
                        WHERE tenant_id = ? AND property_id = ?
                        ORDER BY installed_at DESC NULLS LAST, id
                        """,
                EQUIPMENT_MAPPER, tenantId, propertyId);
    }

    private static final RowMapper<Equipment> EQUIPMENT_MAPPER = (rs, rowNum) -> new Equipment(
            rs.getString("id"),
            rs.getString("property_id"),
            rs.getString("type"),
            rs.getString("brand"),
            rs.getString("model"),
            rs.getString("serial"),
            SqlValues.date(rs, "installed_at"),
            rs.getString("installed_by"),
            SqlValues.date(rs, "warranty_expires_at"));
}
