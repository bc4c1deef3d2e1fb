package com.irm.alert.service.persistence;

import com.irm.alert.service.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of AlertStore on the {@code alerts} table.
 *
 * {@code labels} and {@code annotations} are JSONB columns written from and read
 * back as JSON text. The unique index on {@code fingerprint} is what turns a lost
 * insert race into a {@link DuplicateFingerprintException}.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "irm.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcAlertStore implements AlertStore {

    private static final String COLUMNS =
            "id, fingerprint, status, labels, annotations, starts_at, ends_at, created_at";

    private static final RowMapper<AlertRecord> ROW_MAPPER = JdbcAlertStore::mapRow;

    private final NamedParameterJdbcTemplate jdbc;
    private final MetricsConfig metricsConfig;

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "irm.alerts.stored",
                "Number of alerts in the store",
                this::countForGauge
        );
        log.info("JdbcAlertStore initialized");
    }

    // ==================== Read operations ====================

    @Override
    public Optional<AlertRecord> findByFingerprint(String fingerprint) {
        try {
            return jdbc.query(
                            "select " + COLUMNS + " from alerts where fingerprint = :fingerprint",
                            new MapSqlParameterSource("fingerprint", fingerprint),
                            ROW_MAPPER)
                    .stream()
                    .findFirst();
        } catch (DataAccessException e) {
            log.error("Error in findByFingerprint fingerprint={}", fingerprint, e);
            throw new AlertStoreException("DB error in findByFingerprint", fingerprint, e);
        }
    }

    @Override
    public List<AlertRecord> findAll(String status, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource("limit", limit);
        String where = "";
        if (status != null) {
            where = " where status = :status";
            params.addValue("status", status);
        }
        try {
            return jdbc.query(
                    "select " + COLUMNS + " from alerts" + where + " order by created_at desc, id desc limit :limit",
                    params,
                    ROW_MAPPER);
        } catch (DataAccessException e) {
            log.error("Error in findAll status={}", status, e);
            throw new AlertStoreException("DB error in findAll", null, e);
        }
    }

    @Override
    public long count() {
        try {
            Long count = jdbc.getJdbcTemplate().queryForObject("select count(*) from alerts", Long.class);
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            throw new AlertStoreException("DB error in count", null, e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            jdbc.getJdbcTemplate().queryForObject("select 1", Integer.class);
            return true;
        } catch (DataAccessException e) {
            log.warn("Alert store unreachable: {}", e.getMessage());
            return false;
        }
    }

    // ==================== Write operations ====================

    @Override
    public AlertRecord insert(AlertRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("fingerprint", record.fingerprint())
                .addValue("status", record.status())
                .addValue("labels", record.labels())
                .addValue("annotations", record.annotations())
                .addValue("starts_at", toTimestamp(record.startsAt()))
                .addValue("ends_at", toTimestamp(record.endsAt()))
                .addValue("created_at", toTimestamp(record.createdAt()));
        KeyHolder keyHolder = new GeneratedKeyHolder();

        try {
            jdbc.update(
                    """
                    insert into alerts (fingerprint, status, labels, annotations, starts_at, ends_at, created_at)
                    values (:fingerprint, :status, cast(:labels as jsonb), cast(:annotations as jsonb),
                            :starts_at, :ends_at, :created_at)
                    """,
                    params,
                    keyHolder,
                    new String[] {"id"});
        } catch (DuplicateKeyException e) {
            throw new DuplicateFingerprintException(record.fingerprint(), e);
        } catch (DataAccessException e) {
            log.error("Error inserting alert fingerprint={}", record.fingerprint(), e);
            throw new AlertStoreException("DB error in insert", record.fingerprint(), e);
        }

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new AlertStoreException("Insert returned no id", record.fingerprint(), null);
        }
        log.debug("Inserted alert id={} fingerprint={}", key, record.fingerprint());
        return record.withId(key.longValue());
    }

    @Override
    public void updateStatusAndEndsAt(long id, String status, Instant endsAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("status", status)
                .addValue("ends_at", toTimestamp(endsAt));
        int rows;
        try {
            rows = jdbc.update("update alerts set status = :status, ends_at = :ends_at where id = :id", params);
        } catch (DataAccessException e) {
            log.error("Error updating alert id={}", id, e);
            throw new AlertStoreException("DB error in updateStatusAndEndsAt", null, e);
        }
        if (rows == 0) {
            throw new AlertStoreException("Alert not found for update: id=" + id, null, null);
        }
    }

    // ==================== Helpers ====================

    private long countForGauge() {
        try {
            return count();
        } catch (AlertStoreException e) {
            log.debug("Alert count unavailable for gauge: {}", e.getMessage());
            return -1L;
        }
    }

    private static AlertRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new AlertRecord(
                rs.getLong("id"),
                rs.getString("fingerprint"),
                rs.getString("status"),
                rs.getString("labels"),
                rs.getString("annotations"),
                toInstant(rs.getTimestamp("starts_at")),
                toInstant(rs.getTimestamp("ends_at")),
                toInstant(rs.getTimestamp("created_at"))
        );
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
