/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.ledger;

import com.uistudio.lock.model.LockRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Lock ledger backed by a relational table shared by every context.
 *
 * <pre>
 * resource_id VARCHAR PRIMARY KEY, owner_id VARCHAR, renewed_at BIGINT (epoch millis)
 * </pre>
 *
 * Upserts are an update followed by an insert when no row matched; losing the insert
 * to a concurrent writer falls back to the update, so the last write wins.
 */
@Slf4j
public class JdbcLockLedger implements LockLedger {

    public static final String DEFAULT_TABLE = "edit_locks";

    private final NamedParameterJdbcTemplate jdbc;
    private final String selectSql;
    private final String updateSql;
    private final String insertSql;
    private final String deleteSql;
    private final String createSql;

    public JdbcLockLedger(NamedParameterJdbcTemplate jdbc) {
        this(jdbc, DEFAULT_TABLE);
    }

    public JdbcLockLedger(NamedParameterJdbcTemplate jdbc, String table) {
        if (table == null || !table.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("Invalid lock table name: " + table);
        }
        this.jdbc = jdbc;
        this.selectSql = "SELECT resource_id, owner_id, renewed_at FROM " + table
                + " WHERE resource_id = :resourceId";
        this.updateSql = "UPDATE " + table
                + " SET owner_id = :ownerId, renewed_at = :renewedAt WHERE resource_id = :resourceId";
        this.insertSql = "INSERT INTO " + table
                + " (resource_id, owner_id, renewed_at) VALUES (:resourceId, :ownerId, :renewedAt)";
        this.deleteSql = "DELETE FROM " + table + " WHERE resource_id = :resourceId";
        this.createSql = "CREATE TABLE IF NOT EXISTS " + table + " ("
                + "resource_id VARCHAR(255) NOT NULL PRIMARY KEY, "
                + "owner_id VARCHAR(255) NOT NULL, "
                + "renewed_at BIGINT NOT NULL)";
    }

    /**
     * Creates the configured table when it does not exist yet.
     */
    public void createTableIfMissing() {
        try {
            jdbc.getJdbcOperations().execute(createSql);
        } catch (DataAccessException e) {
            throw new LedgerException(null, "Failed to create lock table: " + createSql, e);
        }
    }

    @Override
    public Optional<LockRecord> get(String resourceId) {
        try {
            List<LockRecord> rows = jdbc.query(selectSql, idParams(resourceId), this::mapRow);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new LedgerException(resourceId, "Failed to read lock record: " + resourceId, e);
        }
    }

    @Override
    public void put(LockRecord record) {
        MapSqlParameterSource params = idParams(record.resourceId())
                .addValue("ownerId", record.ownerId())
                .addValue("renewedAt", record.renewedAt().toEpochMilli());
        try {
            if (jdbc.update(updateSql, params) > 0) {
                return;
            }
            try {
                jdbc.update(insertSql, params);
            } catch (DuplicateKeyException e) {
                log.debug("Concurrent insert for lock {}, overwriting", record.resourceId());
                jdbc.update(updateSql, params);
            }
        } catch (DataAccessException e) {
            throw new LedgerException(record.resourceId(),
                    "Failed to write lock record: " + record.resourceId(), e);
        }
    }

    @Override
    public void delete(String resourceId) {
        try {
            jdbc.update(deleteSql, idParams(resourceId));
        } catch (DataAccessException e) {
            throw new LedgerException(resourceId, "Failed to delete lock record: " + resourceId, e);
        }
    }

    private MapSqlParameterSource idParams(String resourceId) {
        return new MapSqlParameterSource().addValue("resourceId", resourceId);
    }

    private LockRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new LockRecord(
                rs.getString("resource_id"),
                rs.getString("owner_id"),
                Instant.ofEpochMilli(rs.getLong("renewed_at"))
        );
    }
}
