package com.bastion.storage;

import com.bastion.domain.HashType;
import com.bastion.domain.Indicator;
import com.bastion.domain.IndicatorType;
import com.bastion.domain.PageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.bastion.storage.JdbcSupport.clampLimit;
import static com.bastion.storage.JdbcSupport.getInstant;
import static com.bastion.storage.JdbcSupport.getNullableLong;
import static com.bastion.storage.JdbcSupport.offset;
import static com.bastion.storage.JdbcSupport.setNullableLong;
import static com.bastion.storage.JdbcSupport.toTimestamp;

/**
 * Repository for indicators.
 *
 * The (value, type) pair is unique in the table. Ingestion writes go through
 * {@link #upsert}, which is safe against concurrent writers racing on the same
 * pair: it tries an UPDATE first, falls back to INSERT, and on a unique
 * constraint conflict goes round again so the loser of the race ends up
 * updating the winner's row.
 */
@Repository
public class IndicatorRepository {

    private static final Logger log = LoggerFactory.getLogger(IndicatorRepository.class);

    /**
     * Upper bound on update/insert rounds for one upsert
     */
    static final int MAX_UPSERT_ATTEMPTS = 3;

    private static final String SELECT_COLUMNS = """
        SELECT id, value, type, hash_type, source, source_id, is_active, temp_active_until,
               notes, created_at, updated_at, created_by
        FROM indicators
        """;

    private final JdbcTemplate jdbcTemplate;

    public IndicatorRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Insert-if-absent, else refresh source attribution.
     *
     * An existing row keeps its isActive and tempActiveUntil; only source,
     * sourceId and updatedAt change.
     */
    public UpsertOutcome upsert(String value, IndicatorType type, HashType hashType,
                                String source, Long sourceId, Instant now) {
        for (int attempt = 1; ; attempt++) {
            int updated = jdbcTemplate.update("""
                UPDATE indicators
                SET source = ?, source_id = ?, updated_at = ?
                WHERE value = ? AND type = ?
                """, source, sourceId, toTimestamp(now), value, type.getValue());
            if (updated > 0) {
                return UpsertOutcome.UPDATED;
            }

            try {
                jdbcTemplate.update("""
                    INSERT INTO indicators (value, type, hash_type, source, source_id, is_active,
                                            created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, TRUE, ?, ?)
                    """, value, type.getValue(), hashType == null ? null : hashType.getValue(),
                    source, sourceId, toTimestamp(now), toTimestamp(now));
                return UpsertOutcome.INSERTED;
            } catch (DuplicateKeyException e) {
                if (attempt >= MAX_UPSERT_ATTEMPTS) {
                    throw e;
                }
                log.debug("Concurrent insert of {} {}, retrying as update (attempt {})", type, value, attempt);
            }
        }
    }

    /**
     * Insert a fully specified indicator (manual entry).
     *
     * @throws DuplicateKeyException if (value, type) already exists
     */
    public Indicator insert(Indicator indicator) {
        String sql = """
            INSERT INTO indicators (value, type, hash_type, source, source_id, is_active,
                                    temp_active_until, notes, created_at, updated_at, created_by)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        Instant now = indicator.getCreatedAt() != null ? indicator.getCreatedAt() : Instant.now();
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, indicator.getValue());
            ps.setString(2, indicator.getType().getValue());
            ps.setString(3, indicator.getHashType() == null ? null : indicator.getHashType().getValue());
            ps.setString(4, indicator.getSource());
            setNullableLong(ps, 5, indicator.getSourceId());
            ps.setBoolean(6, indicator.isActive());
            ps.setTimestamp(7, toTimestamp(indicator.getTempActiveUntil()));
            ps.setString(8, indicator.getNotes());
            ps.setTimestamp(9, toTimestamp(now));
            ps.setTimestamp(10, toTimestamp(now));
            setNullableLong(ps, 11, indicator.getCreatedBy());
            return ps;
        }, keyHolder);

        indicator.setId(keyHolder.getKey().longValue());
        indicator.setCreatedAt(now);
        indicator.setUpdatedAt(now);
        return indicator;
    }

    public Optional<Indicator> findById(Long id) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", new IndicatorRowMapper(), id)
            .stream().findFirst();
    }

    public Optional<Indicator> findByValueAndType(String value, IndicatorType type) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE value = ? AND type = ?",
                new IndicatorRowMapper(), value, type.getValue())
            .stream().findFirst();
    }

    public PageResult<Indicator> find(IndicatorQuery query) {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        List<Object> args = new ArrayList<>();

        if (query.getType() != null) {
            where.append(" AND type = ?");
            args.add(query.getType().getValue());
        }
        if (query.getSource() != null && !query.getSource().isBlank()) {
            where.append(" AND source = ?");
            args.add(query.getSource());
        }
        if (query.getActive() != null) {
            where.append(" AND is_active = ?");
            args.add(query.getActive());
        }
        if (query.getSearch() != null && !query.getSearch().isBlank()) {
            where.append(" AND LOWER(value) LIKE ?");
            args.add("%" + query.getSearch().trim().toLowerCase(Locale.ROOT) + "%");
        }

        Long total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM indicators" + where,
            Long.class, args.toArray());

        int limit = clampLimit(query.getLimit());
        List<Object> pageArgs = new ArrayList<>(args);
        pageArgs.add(limit);
        pageArgs.add(offset(query.getPage(), limit));
        List<Indicator> items = jdbcTemplate.query(
            SELECT_COLUMNS + where + " ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?",
            new IndicatorRowMapper(), pageArgs.toArray());

        return new PageResult<>(items, total == null ? 0 : total, Math.max(query.getPage(), 1), limit);
    }

    /**
     * Update the analyst-editable fields. Deactivating clears tempActiveUntil.
     */
    public boolean update(Indicator indicator, Instant now) {
        Instant tempActiveUntil = indicator.isActive() ? indicator.getTempActiveUntil() : null;
        int rows = jdbcTemplate.update("""
            UPDATE indicators
            SET is_active = ?, temp_active_until = ?, notes = ?, updated_at = ?
            WHERE id = ?
            """, indicator.isActive(), toTimestamp(tempActiveUntil), indicator.getNotes(),
            toTimestamp(now), indicator.getId());
        return rows > 0;
    }

    public boolean activateUntil(Long id, Instant until, Instant now) {
        int rows = jdbcTemplate.update("""
            UPDATE indicators
            SET is_active = TRUE, temp_active_until = ?, updated_at = ?
            WHERE id = ?
            """, toTimestamp(until), toTimestamp(now), id);
        return rows > 0;
    }

    /**
     * @return number of rows removed (0 if the row was already gone)
     */
    public int deleteById(Long id) {
        return jdbcTemplate.update("DELETE FROM indicators WHERE id = ?", id);
    }

    /**
     * Delete the row only if its temporary activation is still expired at
     * {@code now}. An extension or deactivation made after the expiry scan
     * leaves the row in place.
     *
     * @return 1 if this call removed the row, otherwise 0
     */
    public int deleteExpired(Long id, Instant now) {
        return jdbcTemplate.update("""
            DELETE FROM indicators
            WHERE id = ? AND temp_active_until IS NOT NULL AND temp_active_until <= ?
            """, id, toTimestamp(now));
    }

    /**
     * Ids of indicators whose temporary activation has run out at {@code now}.
     */
    public List<Long> findExpiredTempActivationIds(Instant now) {
        return jdbcTemplate.queryForList("""
            SELECT id FROM indicators
            WHERE temp_active_until IS NOT NULL AND temp_active_until <= ?
            ORDER BY id
            """, Long.class, toTimestamp(now));
    }

    public List<String> findActiveValues(IndicatorType type) {
        return jdbcTemplate.queryForList(
            "SELECT value FROM indicators WHERE type = ? AND is_active = TRUE ORDER BY id",
            String.class, type.getValue());
    }

    public Map<IndicatorType, Long> countActiveByType() {
        Map<IndicatorType, Long> counts = new EnumMap<>(IndicatorType.class);
        for (IndicatorType type : IndicatorType.values()) {
            counts.put(type, 0L);
        }
        jdbcTemplate.query("SELECT type, COUNT(*) AS total FROM indicators WHERE is_active = TRUE GROUP BY type",
            rs -> {
                counts.put(IndicatorType.fromValue(rs.getString("type")), rs.getLong("total"));
            });
        return counts;
    }

    private static class IndicatorRowMapper implements RowMapper<Indicator> {
        @Override
        public Indicator mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Indicator.builder()
                .id(rs.getLong("id"))
                .value(rs.getString("value"))
                .type(IndicatorType.fromValue(rs.getString("type")))
                .hashType(HashType.fromValue(rs.getString("hash_type")))
                .source(rs.getString("source"))
                .sourceId(getNullableLong(rs, "source_id"))
                .active(rs.getBoolean("is_active"))
                .tempActiveUntil(getInstant(rs, "temp_active_until"))
                .notes(rs.getString("notes"))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .createdBy(getNullableLong(rs, "created_by"))
                .build();
        }
    }
}
