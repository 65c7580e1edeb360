package com.demo.fit.repository;

import com.demo.fit.model.StudentProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static com.demo.fit.repository.JsonColumns.instant;
import static com.demo.fit.repository.JsonColumns.ts;

@Repository
@RequiredArgsConstructor
public class StudentProfileRepository {

    private final JdbcTemplate jdbc;
    private final JsonColumns json;

    public Optional<StudentProfile> find(String userId) {
        String sql = """
            SELECT user_id, profile_version, document, updated_at, fits_computed_at, fits_profile_version
            FROM student_profiles
            WHERE user_id = ?
        """;
        return jdbc.query(sql, rm(), userId).stream().findFirst();
    }

    /**
     * Stores the new document and bumps the version in one statement; inserts version 1 for a first upload.
     * Returns the version now on file.
     */
    public long recordChange(String userId, String documentJson, Instant now) {
        int updated = bump(userId, documentJson, now);
        if (updated == 0) {
            try {
                jdbc.update("""
                    INSERT INTO student_profiles (user_id, profile_version, document, updated_at)
                    VALUES (?, 1, ?, ?)
                """, userId, documentJson, ts(now));
            } catch (DuplicateKeyException race) {
                // another upload created the row first; count this one as the next version
                bump(userId, documentJson, now);
            }
        }
        Long version = jdbc.queryForObject(
                "SELECT profile_version FROM student_profiles WHERE user_id = ?", Long.class, userId);
        return version == null ? 0L : version;
    }

    private int bump(String userId, String documentJson, Instant now) {
        return jdbc.update("""
            UPDATE student_profiles
            SET profile_version = profile_version + 1, document = ?, updated_at = ?
            WHERE user_id = ?
        """, documentJson, ts(now), userId);
    }

    public void markFitsComputed(String userId, long profileVersion, Instant at) {
        jdbc.update("""
            UPDATE student_profiles
            SET fits_computed_at = ?, fits_profile_version = ?
            WHERE user_id = ?
        """, ts(at), profileVersion, userId);
    }

    public int delete(String userId) {
        return jdbc.update("DELETE FROM student_profiles WHERE user_id = ?", userId);
    }

    private RowMapper<StudentProfile> rm() {
        return (rs, i) -> new StudentProfile(
                rs.getString("user_id"),
                rs.getLong("profile_version"),
                json.tree(rs.getString("document")),
                instant(rs.getTimestamp("updated_at")),
                instant(rs.getTimestamp("fits_computed_at")),
                rs.getObject("fits_profile_version", Long.class)
        );
    }
}
