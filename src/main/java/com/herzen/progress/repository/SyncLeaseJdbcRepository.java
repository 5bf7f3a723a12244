package com.herzen.progress.repository;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;

@Repository
public class SyncLeaseJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public SyncLeaseJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public boolean tryClaim(String leaseName, String owner, Instant now, Instant expiresAt) {
        int updated = jdbcTemplate.update(
                "UPDATE sync_lease SET lease_owner=?, lease_expires_at=? WHERE lease_name=? AND (lease_expires_at <= ? OR lease_owner = ?)",
                owner, Timestamp.from(expiresAt), leaseName, Timestamp.from(now), owner);
        if (updated == 1) return true;

        try {
            jdbcTemplate.update(
                    "INSERT INTO sync_lease(lease_name, lease_owner, lease_expires_at) VALUES (?,?,?)",
                    leaseName, owner, Timestamp.from(expiresAt));
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public void release(String leaseName, String owner, Instant now) {
        jdbcTemplate.update(
                "UPDATE sync_lease SET lease_expires_at=? WHERE lease_name=? AND lease_owner=?",
                Timestamp.from(now), leaseName, owner);
    }
}
