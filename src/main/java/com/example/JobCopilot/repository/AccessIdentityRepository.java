package com.example.JobCopilot.repository;

import com.example.JobCopilot.security.AccessIdentity;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Maps an identity provider's (issuer, subject) pair to a local user. The only lookup that is
 * not scoped by tenant: the tenant comes out of the mapped user.
 */
@Repository
@RequiredArgsConstructor
public class AccessIdentityRepository {

    private final JdbcTemplate jdbcTemplate;

    public Optional<AccessIdentity> findByIssuerAndSubject(String issuer, String subject) {
        return jdbcTemplate.query("""
                                SELECT u.id AS user_id, u.tenant_id, u.role, u.email
                                FROM access_identities ai
                                JOIN users u ON u.id = ai.user_id
                                WHERE ai.issuer = ? AND ai.subject = ?
                                """,
                        (rs, rowNum) -> new AccessIdentity(
                                rs.getString("user_id"),
                                rs.getString("tenant_id"),
                                rs.getString("role"),
                                rs.getString("email")),
                        issuer, subject)
                .stream()
                .findFirst();
    }
}
