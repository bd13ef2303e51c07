package com.bastion.storage;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.bastion.storage.JdbcSupport.toTimestamp;

/**
 * Key/value settings rows.
 */
@Repository
public class SettingsRepository {

    private final JdbcTemplate jdbcTemplate;

    public SettingsRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Map<String, String> findAll() {
        Map<String, String> settings = new LinkedHashMap<>();
        jdbcTemplate.query("SELECT key, value FROM settings ORDER BY key",
            rs -> {
                settings.put(rs.getString("key"), rs.getString("value"));
            });
        return settings;
    }

    /**
     * @return true if the row was created
     */
    public boolean insertIfAbsent(String key, String value, Instant now) {
        Integer existing = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM settings WHERE key = ?",
            Integer.class, key);
        if (existing != null && existing > 0) {
            return false;
        }
        jdbcTemplate.update("INSERT INTO settings (key, value, updated_at) VALUES (?, ?, ?)",
            key, value, toTimestamp(now));
        return true;
    }
}
