package com.omkar.case_sync.store;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * JDBC access to the {@code cases} table.
 *
 * Methods join the caller's transaction when one is active, so the
 * reconciler decides where commits happen. Failures surface as Spring's
 * {@link org.springframework.dao.DataAccessException}.
 */
@Repository
@RequiredArgsConstructor
public class CaseStore {
    private static final RowMapper<CaseRecord> ROW_MAPPER = (rs, rowNum) -> new CaseRecord(
            rs.getLong("id"),
            rs.getLong("logical_timestamp"),
            rs.getString("payload"));

    private final JdbcTemplate jdbcTemplate;

    /**
     * Reads up to {@code limit} records with id >= {@code fromId}, ascending.
     */
    public List<CaseRecord> scanFrom(long fromId, int limit) {
        return jdbcTemplate.query(
                "SELECT id, logical_timestamp, payload FROM cases WHERE id >= ? ORDER BY id LIMIT ?",
                ROW_MAPPER, fromId, limit);
    }

    public Optional<CaseRecord> get(long id) {
        return jdbcTemplate.query(
                "SELECT id, logical_timestamp, payload FROM cases WHERE id = ?",
                ROW_MAPPER, id).stream().findFirst();
    }

    public void insert(CaseRecord record) {
        jdbcTemplate.update(
                "INSERT INTO cases (id, logical_timestamp, payload) VALUES (?, ?, ?)",
                record.getId(), record.getLogicalTimestamp(), record.getPayload());
    }

    /**
     * Inserts the record unless a row with its id already exists.
     *
     * @return false if the id was already present and nothing was written
     */
    public boolean insertIfAbsent(CaseRecord record) {
        return jdbcTemplate.update(
                "INSERT INTO cases (id, logical_timestamp, payload) "
                        + "SELECT ?, ?, ? WHERE NOT EXISTS (SELECT 1 FROM cases WHERE id = ?)",
                record.getId(), record.getLogicalTimestamp(), record.getPayload(), record.getId()) > 0;
    }

    public boolean updateVersionAndPayload(long id, long logicalTimestamp, String payload) {
        return jdbcTemplate.update(
                "UPDATE cases SET logical_timestamp = ?, payload = ? WHERE id = ?",
                logicalTimestamp, payload, id) > 0;
    }

    /**
     * Overwrites the stored record only when it holds an older version.
     *
     * @return true if a row was written
     */
    public boolean updateIfNewer(CaseRecord record) {
        return jdbcTemplate.update(
                "UPDATE cases SET logical_timestamp = ?, payload = ? WHERE id = ? AND logical_timestamp < ?",
                record.getLogicalTimestamp(), record.getPayload(), record.getId(), record.getLogicalTimestamp()) > 0;
    }

    public boolean delete(long id) {
        return jdbcTemplate.update("DELETE FROM cases WHERE id = ?", id) > 0;
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM cases", Long.class);
        return count != null ? count : 0L;
    }
}
