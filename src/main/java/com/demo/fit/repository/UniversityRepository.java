package com.demo.fit.repository;

import com.demo.fit.model.UniversityRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Read-only university catalog. Ids passed in must already be normalized.
 */
@Repository
@RequiredArgsConstructor
public class UniversityRepository {

    private final JdbcTemplate jdbc;

    public Optional<UniversityRecord> findById(String universityId) {
        String sql = """
            SELECT university_id, name, us_news_rank, acceptance_rate, state, city, market_position
            FROM universities
            WHERE university_id = ?
        """;
        return jdbc.query(sql, rm(), universityId).stream().findFirst();
    }

    /** Whole catalog, best rank first, unranked last. */
    public List<UniversityRecord> findAll() {
        String sql = """
            SELECT university_id, name, us_news_rank, acceptance_rate, state, city, market_position
            FROM universities
            ORDER BY CASE WHEN us_news_rank IS NULL THEN 1 ELSE 0 END, us_news_rank, university_id
        """;
        return jdbc.query(sql, rm());
    }

    public List<String> findAllIds() {
        return findAll().stream().map(UniversityRecord::universityId).toList();
    }

    static RowMapper<UniversityRecord> rm() {
        return (rs, i) -> {
            BigDecimal rate = rs.getBigDecimal("acceptance_rate");
            return new UniversityRecord(
                    rs.getString("university_id"),
                    rs.getString("name"),
                    rs.getObject("us_news_rank", Integer.class),
                    rate == null ? null : rate.doubleValue(),
                    rs.getString("state"),
                    rs.getString("city"),
                    rs.getString("market_position")
            );
        };
    }
}
