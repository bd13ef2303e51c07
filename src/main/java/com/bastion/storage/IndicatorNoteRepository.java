package com.bastion.storage;

import com.bastion.domain.IndicatorNote;
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
import static com.bastion.storage.JdbcSupport.toTimestamp;

/**
 * Repository for analyst notes. Edits and deletes are scoped to the author:
 * a zero row count means the note is missing or belongs to someone else.
 */
@Repository
public class IndicatorNoteRepository {

    private static final String SELECT_COLUMNS = """
        SELECT id, indicator_id, user_id, content, is_edited, edited_at, created_at, updated_at
        FROM indicator_notes
        """;

    private final JdbcTemplate jdbcTemplate;

    public IndicatorNoteRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<IndicatorNote> findByIndicatorId(Long indicatorId) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE indicator_id = ? ORDER BY created_at DESC, id DESC",
            new NoteRowMapper(), indicatorId);
    }

    public Optional<IndicatorNote> findById(Long id) {
        return jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", new NoteRowMapper(), id)
            .stream().findFirst();
    }

    public IndicatorNote insert(IndicatorNote note, Instant now) {
        String sql = """
            INSERT INTO indicator_notes (indicator_id, user_id, content, is_edited, created_at, updated_at)
            VALUES (?, ?, ?, FALSE, ?, ?)
            """;
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setLong(1, note.getIndicatorId());
            ps.setLong(2, note.getUserId());
            ps.setString(3, note.getContent());
            ps.setTimestamp(4, toTimestamp(now));
            ps.setTimestamp(5, toTimestamp(now));
            return ps;
        }, keyHolder);

        note.setId(keyHolder.getKey().longValue());
        note.setCreatedAt(now);
        note.setUpdatedAt(now);
        return note;
    }

    public boolean updateContent(Long id, Long userId, String content, Instant now) {
        int rows = jdbcTemplate.update("""
            UPDATE indicator_notes
            SET content = ?, is_edited = TRUE, edited_at = ?, updated_at = ?
            WHERE id = ? AND user_id = ?
            """, content, toTimestamp(now), toTimestamp(now), id, userId);
        return rows > 0;
    }

    public boolean delete(Long id, Long userId) {
        return jdbcTemplate.update("DELETE FROM indicator_notes WHERE id = ? AND user_id = ?", id, userId) > 0;
    }

    private static class NoteRowMapper implements RowMapper<IndicatorNote> {
        @Override
        public IndicatorNote mapRow(ResultSet rs, int rowNum) throws SQLException {
            IndicatorNote note = new IndicatorNote(rs.getLong("indicator_id"), rs.getLong("user_id"),
                rs.getString("content"));
            note.setId(rs.getLong("id"));
            note.setEdited(rs.getBoolean("is_edited"));
            note.setEditedAt(getInstant(rs, "edited_at"));
            note.setCreatedAt(getInstant(rs, "created_at"));
            note.setUpdatedAt(getInstant(rs, "updated_at"));
            return note;
        }
    }
}
