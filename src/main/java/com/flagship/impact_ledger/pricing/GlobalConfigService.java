package com.flagship.impact_ledger.pricing;

import com.flagship.impact_ledger.common.exception.InvalidValueException;
import com.flagship.impact_ledger.common.exception.NotFoundException;
import com.flagship.impact_ledger.common.exception.ValidationFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Key/value store over {@code global_config} with an audit row for every write.
 *
 * Writes lock the config row, bump its version and append to {@code config_audit_log}
 * in the caller's transaction. If the audit insert fails the value change rolls back with it.
 * Values are not interpreted here; typed access lives in {@link GlobalConfigPricingOracle}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GlobalConfigService {

    private final JdbcTemplate jdbcTemplate;

    @Transactional(readOnly = true)
    public Optional<String> findValue(String key) {
        List<String> values = jdbcTemplate.query(
            "SELECT config_value FROM global_config WHERE config_key = ?",
            (rs, rowNum) -> rs.getString("config_value"),
            key
        );
        return values.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public String getValue(String key) {
        return findValue(key).orElseThrow(() -> new NotFoundException("Config key", key));
    }

    /**
     * Writes a value, creating the key if needed.
     *
     * @return the previous value, or null if the key did not exist
     */
    @Transactional
    public String setValue(String key, String value, String actor) {
        if (key == null || key.isBlank()) {
            throw new ValidationFailedException("Config key is required");
        }
        if (value == null || value.isBlank()) {
            throw new ValidationFailedException("Config value is required for " + key);
        }
        if (actor == null || actor.isBlank()) {
            throw new ValidationFailedException("Actor is required to change " + key);
        }
        if (ConfigKeys.CURRENT_CSR_PRICE.equals(key)) {
            requirePositiveDecimal(key, value);
        }

        // A first write creates the row; a concurrent first writer waits on the key and then
        // falls through to the locked update below, auditing the value this one wrote
        int created = jdbcTemplate.update(
            "INSERT INTO global_config (config_key, config_value, version, updated_at) " +
            "VALUES (?, ?, 1, CURRENT_TIMESTAMP) ON CONFLICT (config_key) DO NOTHING",
            key,
            value
        );

        String oldValue = null;
        if (created == 0) {
            oldValue = jdbcTemplate.queryForObject(
                "SELECT config_value FROM global_config WHERE config_key = ? FOR UPDATE",
                String.class,
                key
            );
            jdbcTemplate.update(
                "UPDATE global_config SET config_value = ?, version = version + 1, " +
                "updated_at = CURRENT_TIMESTAMP WHERE config_key = ?",
                value,
                key
            );
        }

        jdbcTemplate.update(
            "INSERT INTO config_audit_log (id, config_key, old_value, new_value, changed_by, changed_at) " +
            "VALUES (?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            UUID.randomUUID(),
            key,
            oldValue,
            value,
            actor
        );

        log.info("Config changed: key={}, oldValue={}, newValue={}, actor={}", key, oldValue, value, actor);
        return oldValue;
    }

    @Transactional(readOnly = true)
    public List<ConfigEntry> getAll() {
        return jdbcTemplate.query(
            "SELECT config_key, config_value, description, version, updated_at " +
            "FROM global_config ORDER BY config_key",
            configEntryRowMapper()
        );
    }

    @Transactional(readOnly = true)
    public long getVersion(String key) {
        List<Long> versions = jdbcTemplate.query(
            "SELECT version FROM global_config WHERE config_key = ?",
            (rs, rowNum) -> rs.getLong("version"),
            key
        );
        return versions.stream().findFirst().orElseThrow(() -> new NotFoundException("Config key", key));
    }

    /**
     * Audit trail for one key, most recent change first.
     */
    @Transactional(readOnly = true)
    public List<ConfigAuditEntry> getAuditHistory(String key) {
        return jdbcTemplate.query(
            "SELECT id, config_key, old_value, new_value, changed_by, changed_at " +
            "FROM config_audit_log WHERE config_key = ? ORDER BY changed_at DESC, id",
            auditRowMapper(),
            key
        );
    }

    private RowMapper<ConfigEntry> configEntryRowMapper() {
        return (rs, rowNum) -> new ConfigEntry(
            rs.getString("config_key"),
            rs.getString("config_value"),
            rs.getString("description"),
            rs.getLong("version"),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private RowMapper<ConfigAuditEntry> auditRowMapper() {
        return (rs, rowNum) -> new ConfigAuditEntry(
            UUID.fromString(rs.getString("id")),
            rs.getString("config_key"),
            rs.getString("old_value"),
            rs.getString("new_value"),
            rs.getString("changed_by"),
            toInstant(rs.getTimestamp("changed_at"))
        );
    }

    private static void requirePositiveDecimal(String key, String value) {
        try {
            if (new BigDecimal(value.trim()).signum() > 0) {
                return;
            }
        } catch (NumberFormatException e) {
            log.debug("Rejected non-numeric value for {}: {}", key, value);
        }
        throw new InvalidValueException(key + " must be a positive decimal: " + value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
