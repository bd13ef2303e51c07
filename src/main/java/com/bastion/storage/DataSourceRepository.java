package com.bastion.storage;

import com.bastion.domain.DataSource;
import com.bastion.domain.FetchStatus;
import com.bastion.domain.IndicatorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static com.bastion.storage.JdbcSupport.getInstant;
import static com.bastion.storage.JdbcSupport.getNullableLong;
import static com.bastion.storage.JdbcSupport.setNullableLong;
import static com.bastion.storage.JdbcSupport.toTimestamp;

/**
 * Repository for feed definitions and their runtime fetch state.
 *
 * Administrative updates ({@link #update(DataSource)}) never touch the
 * lastFetch* columns; those are written only through
 * {@link #recordFetchSuccess} and {@link #recordFetchFailure}.
 */
@Repository
public class DataSourceRepository {

    private static final Logger log = LoggerFactory.getLogger(DataSourceRepository.class);

    private static final String SELECT_COLUMNS = """
        SELECT id, name, url, indicator_types, fetch_interval, is_active, is_paused,
               ignore_certificate_errors, last_fetch, last_fetch_status, last_fetch_error,
               resumed_at, created_at, created_by
        FROM data_sources
        """;

    private final JdbcTemplate jdbcTemplate;

    public DataSourceRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<DataSource> findAll() {
        return jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY id", new DataSourceRowMapper());
    }

    /**
     * Sources eligible for scheduling. Paused sources are included; the
     * scheduler decides what to do with them.
     */
    public List<DataSource> findActive() {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE is_active = TRUE ORDER BY id",
            new DataSourceRowMapper());
    }

    public Optional<DataSource> findById(Long id) {
        List<DataSource> found = jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?",
            new DataSourceRowMapper(), id);
        return found.stream().findFirst();
    }

    public DataSource insert(DataSource source) {
        String sql = """
            INSERT INTO data_sources (name, url, indicator_types, fetch_interval, is_active,
                                      is_paused, ignore_certificate_errors, created_at, created_by)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        Instant createdAt = source.getCreatedAt() != null ? source.getCreatedAt() : Instant.now();
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, source.getName());
            ps.setString(2, source.getUrl());
            ps.setString(3, joinTypes(source.getIndicatorTypes()));
            ps.setInt(4, source.getFetchInterval());
            ps.setBoolean(5, source.isActive());
            ps.setBoolean(6, source.isPaused());
            ps.setBoolean(7, source.isIgnoreCertificateErrors());
            ps.setTimestamp(8, toTimestamp(createdAt));
            setNullableLong(ps, 9, source.getCreatedBy());
            return ps;
        }, keyHolder);

        source.setId(keyHolder.getKey().longValue());
        source.setCreatedAt(createdAt);
        log.info("Created data source: id={}, name={}", source.getId(), source.getName());
        return source;
    }

    /**
     * Update the administrator-owned fields of a source.
     *
     * @return true if the row existed
     */
    public boolean update(DataSource source) {
        String sql = """
            UPDATE data_sources
            SET name = ?, url = ?, indicator_types = ?, fetch_interval = ?, is_active = ?,
                ignore_certificate_errors = ?
            WHERE id = ?
            """;
        int rows = jdbcTemplate.update(sql, source.getName(), source.getUrl(),
            joinTypes(source.getIndicatorTypes()), source.getFetchInterval(), source.isActive(),
            source.isIgnoreCertificateErrors(), source.getId());
        return rows > 0;
    }

    public boolean deleteById(Long id) {
        return jdbcTemplate.update("DELETE FROM data_sources WHERE id = ?", id) > 0;
    }

    public boolean pause(Long id) {
        return jdbcTemplate.update("UPDATE data_sources SET is_paused = TRUE WHERE id = ?", id) > 0;
    }

    /**
     * Clear the pause flag and move the scheduling anchor to {@code resumedAt}.
     */
    public boolean resume(Long id, Instant resumedAt) {
        return jdbcTemplate.update("UPDATE data_sources SET is_paused = FALSE, resumed_at = ? WHERE id = ?",
            toTimestamp(resumedAt), id) > 0;
    }

    public void recordFetchSuccess(Long id, Instant fetchedAt) {
        jdbcTemplate.update("""
            UPDATE data_sources
            SET last_fetch = ?, last_fetch_status = ?, last_fetch_error = NULL
            WHERE id = ?
            """, toTimestamp(fetchedAt), FetchStatus.SUCCESS.getValue(), id);
    }

    public void recordFetchFailure(Long id, Instant fetchedAt, String error) {
        jdbcTemplate.update("""
            UPDATE data_sources
            SET last_fetch = ?, last_fetch_status = ?, last_fetch_error = ?
            WHERE id = ?
            """, toTimestamp(fetchedAt), FetchStatus.ERROR.getValue(), error, id);
    }

    static String joinTypes(Set<IndicatorType> types) {
        return types.stream().map(IndicatorType::getValue).collect(Collectors.joining(","));
    }

    static Set<IndicatorType> splitTypes(String raw) {
        Set<IndicatorType> types = new LinkedHashSet<>();
        if (raw == null || raw.isBlank()) {
            return types;
        }
        Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(IndicatorType::fromValue)
            .forEach(types::add);
        return types;
    }

    private static class DataSourceRowMapper implements RowMapper<DataSource> {
        @Override
        public DataSource mapRow(ResultSet rs, int rowNum) throws SQLException {
            return DataSource.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .url(rs.getString("url"))
                .indicatorTypes(splitTypes(rs.getString("indicator_types")))
                .fetchInterval(rs.getInt("fetch_interval"))
                .active(rs.getBoolean("is_active"))
                .paused(rs.getBoolean("is_paused"))
                .ignoreCertificateErrors(rs.getBoolean("ignore_certificate_errors"))
                .lastFetch(getInstant(rs, "last_fetch"))
                .lastFetchStatus(FetchStatus.fromValue(rs.getString("last_fetch_status")))
                .lastFetchError(rs.getString("last_fetch_error"))
                .resumedAt(getInstant(rs, "resumed_at"))
                .createdAt(getInstant(rs, "created_at"))
                .createdBy(getNullableLong(rs, "created_by"))
                .build();
        }
    }
}
