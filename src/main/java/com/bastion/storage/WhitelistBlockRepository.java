package com.bastion.storage;

import com.bastion.domain.IndicatorType;
import com.bastion.domain.PageResult;
import com.bastion.domain.WhitelistBlock;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import static com.bastion.storage.JdbcSupport.clampLimit;
import static com.bastion.storage.JdbcSupport.getInstant;
import static com.bastion.storage.JdbcSupport.getNullableLong;
import static com.bastion.storage.JdbcSupport.offset;
import static com.bastion.storage.JdbcSupport.toTimestamp;

/**
 * Append-only log of candidates rejected by the whitelist.
 */
@Repository
public class WhitelistBlockRepository {

    private final JdbcTemplate jdbcTemplate;

    public WhitelistBlockRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(WhitelistBlock block) {
        jdbcTemplate.update("""
            INSERT INTO whitelist_blocks (value, type, source, source_id, source_name, whitelist_entry_id,
                                          whitelist_value, blocked_reason, attempted_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """, block.getValue(), block.getType().getValue(), block.getSource(), block.getSourceId(),
            block.getSourceName(), block.getWhitelistEntryId(), block.getWhitelistValue(),
            block.getBlockedReason(), toTimestamp(block.getAttemptedAt()));
    }

    /**
     * Most recent blocks first.
     */
    public PageResult<WhitelistBlock> findPage(int page, int limit) {
        int size = clampLimit(limit);
        Long total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM whitelist_blocks", Long.class);
        List<WhitelistBlock> items = jdbcTemplate.query("""
            SELECT id, value, type, source, source_id, source_name, whitelist_entry_id, whitelist_value,
                   blocked_reason, attempted_at
            FROM whitelist_blocks
            ORDER BY attempted_at DESC, id DESC
            LIMIT ? OFFSET ?
            """, new BlockRowMapper(), size, offset(page, size));
        return new PageResult<>(items, total == null ? 0 : total, Math.max(page, 1), size);
    }

    private static class BlockRowMapper implements RowMapper<WhitelistBlock> {
        @Override
        public WhitelistBlock mapRow(ResultSet rs, int rowNum) throws SQLException {
            WhitelistBlock block = new WhitelistBlock();
            block.setId(rs.getLong("id"));
            block.setValue(rs.getString("value"));
            block.setType(IndicatorType.fromValue(rs.getString("type")));
            block.setSource(rs.getString("source"));
            block.setSourceId(getNullableLong(rs, "source_id"));
            block.setSourceName(rs.getString("source_name"));
            block.setWhitelistEntryId(getNullableLong(rs, "whitelist_entry_id"));
            block.setWhitelistValue(rs.getString("whitelist_value"));
            block.setBlockedReason(rs.getString("blocked_reason"));
            block.setAttemptedAt(getInstant(rs, "attempted_at"));
            return block;
        }
    }
}
