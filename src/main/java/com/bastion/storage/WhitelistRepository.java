package com.bastion.storage;

import com.bastion.domain.IndicatorType;
import com.bastion.domain.WhitelistEntry;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.bastion.storage.JdbcSupport.getInstant;
import static com.bastion.storage.JdbcSupport.getNullableLong;
import static com.bastion.storage.JdbcSupport.setNullableLong;
import static com.bastion.storage.JdbcSupport.toTimestamp;

@Repository
public class WhitelistRepository {

    private static final String SELECT_COLUMNS = """
        SELECT id, value, type, reason, created_at, created_by
        FROM whitelist
        """;

    private final JdbcTemplate jdbcTemplate;

    public WhitelistRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<WhitelistEntry> findAll() {
        return jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY id", new WhitelistRowMapper());
    }

    public Optional<WhitelistEntry> findById(Long id) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", new WhitelistRowMapper(), id)
            .stream().findFirst();
    }

    /**
     * @throws org.springframework.dao.DuplicateKeyException if the value is already whitelisted
     */
    public WhitelistEntry insert(WhitelistEntry entry, Instant now) {
        String sql = "INSERT INTO whitelist (value, type, reason, created_at, created_by) VALUES (?, ?, ?, ?, ?)";
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, entry.getValue());
            ps.setString(2, entry.getType().getValue());
            ps.setString(3, entry.getReason());
            ps.setTimestamp(4, toTimestamp(now));
            setNullableLong(ps, 5, entry.getCreatedBy());
            return ps;
        }, keyHolder);

        entry.setId(keyHolder.getKey().longValue());
        entry.setCreatedAt(now);
        return entry;
    }

    public boolean deleteById(Long id) {
        return jdbcTemplate.update("DELETE FROM whitelist WHERE id = ?", id) > 0;
    }

    private static class WhitelistRowMapper implements RowMapper<WhitelistEntry> {
        @Override
        public WhitelistEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
            WhitelistEntry entry = new WhitelistEntry(rs.getLong("id"), rs.getString("value"),
                IndicatorType.fromValue(rs.getString("type")), rs.getString("reason"));
            entry.setCreatedAt(getInstant(rs, "created_at"));
            entry.setCreatedBy(getNullableLong(rs, "created_by"));
            return entry;
        }
    }
}
