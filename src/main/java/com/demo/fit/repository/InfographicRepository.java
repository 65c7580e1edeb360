package com.demo.fit.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static com.demo.fit.repository.JsonColumns.instant;
import static com.demo.fit.repository.JsonColumns.ts;

@Repository
@RequiredArgsConstructor
public class InfographicRepository {

    private final JdbcTemplate jdbc;

    public void save(String userId, String universityId, String imageUrl, Instant generatedAt) {
        int updated = jdbc.update(
                "UPDATE fit_infographics SET image_url = ?, generated_at = ? WHERE user_id = ? AND university_id = ?",
                imageUrl, ts(generatedAt), userId, universityId);
        if (updated > 0) return;
        try {
            jdbc.update(
                    "INSERT INTO fit_infographics (user_id, university_id, image_url, generated_at) VALUES (?, ?, ?, ?)",
                    userId, universityId, imageUrl, ts(generatedAt));
        } catch (DuplicateKeyException race) {
            jdbc.update(
                    "UPDATE fit_infographics SET image_url = ?, generated_at = ? WHERE user_id = ? AND university_id = ?",
                    imageUrl, ts(generatedAt), userId, universityId);
        }
    }

    public Optional<Infographic> find(String userId, String universityId) {
        return jdbc.query(
                "SELECT image_url, generated_at FROM fit_infographics WHERE user_id = ? AND university_id = ?",
                (rs, i) -> new Infographic(rs.getString("image_url"), instant(rs.getTimestamp("generated_at"))),
                userId, universityId).stream().findFirst();
    }

    public int deleteAllForUser(String userId) {
        return jdbc.update("DELETE FROM fit_infographics WHERE user_id = ?", userId);
    }

    public record Infographic(String imageUrl, Instant generatedAt) {}
}
