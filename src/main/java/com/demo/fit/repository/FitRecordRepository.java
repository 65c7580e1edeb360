package com.demo.fit.repository;

import com.demo.fit.model.ApplicationTimeline;
import com.demo.fit.model.EssayAngle;
import com.demo.fit.model.FitCategory;
import com.demo.fit.model.FitFactor;
import com.demo.fit.model.FitQuery;
import com.demo.fit.model.FitRecord;
import com.demo.fit.model.GapAnalysis;
import com.demo.fit.model.Recommendation;
import com.demo.fit.model.ScholarshipMatch;
import com.demo.fit.model.SelectivityTier;
import com.demo.fit.model.UniversityRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.demo.fit.repository.JsonColumns.instant;
import static com.demo.fit.repository.JsonColumns.ts;

/**
 * One row per (user, university). Writes always replace the whole row.
 */
@Repository
@RequiredArgsConstructor
public class FitRecordRepository {

    private static final TypeReference<List<FitFactor>> FACTORS = new TypeReference<>() {};
    private static final TypeReference<List<Recommendation>> RECOMMENDATIONS = new TypeReference<>() {};
    private static final TypeReference<List<EssayAngle>> ESSAY_ANGLES = new TypeReference<>() {};
    private static final TypeReference<List<ScholarshipMatch>> SCHOLARSHIPS = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};

    private static final String COLUMNS = """
            f.user_id, f.university_id, f.match_percentage, f.fit_category, f.selectivity_tier, f.factors,
            f.explanation, f.gap_analysis, f.recommendations, f.essay_angles, f.scholarship_matches,
            f.application_timeline, f.test_strategy, f.major_strategy, f.demonstrated_interest_tips,
            f.red_flags_to_avoid, f.computed_at, f.profile_version
            """;

    private final JdbcTemplate jdbc;
    private final NamedParameterJdbcTemplate named;
    private final JsonColumns json;

    public Optional<FitRecord> find(String userId, String universityId) {
        String sql = "SELECT " + COLUMNS + " FROM fit_records f WHERE f.user_id = ? AND f.university_id = ?";
        return jdbc.query(sql, rm(), userId, universityId).stream().findFirst();
    }

    public List<FitRecord> findAllForUser(String userId) {
        String sql = "SELECT " + COLUMNS + " FROM fit_records f WHERE f.user_id = ? ORDER BY f.university_id";
        return jdbc.query(sql, rm(), userId);
    }

    public Set<String> universityIdsForUser(String userId) {
        return new HashSet<>(jdbc.queryForList(
                "SELECT university_id FROM fit_records WHERE user_id = ?", String.class, userId));
    }

    /** Full overwrite. Never merges with the previous row. */
    public void save(FitRecord r) {
        if (update(r) > 0) return;
        try {
            jdbc.update("""
                INSERT INTO fit_records (user_id, university_id, match_percentage, fit_category, selectivity_tier,
                    factors, explanation, gap_analysis, recommendations, essay_angles, scholarship_matches,
                    application_timeline, test_strategy, major_strategy, demonstrated_interest_tips,
                    red_flags_to_avoid, computed_at, profile_version)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
                    r.userId(), r.universityId(), r.matchPercentage(), r.fitCategory().name(),
                    r.selectivityTier().name(), json.write(r.factors()), r.explanation(),
                    json.write(r.gapAnalysis()), json.write(r.recommendations()), json.write(r.essayAngles()),
                    json.write(r.scholarshipMatches()), json.write(r.applicationTimeline()),
                    json.write(r.testStrategy()), json.write(r.majorStrategy()),
                    json.write(r.demonstratedInterestTips()), json.write(r.redFlagsToAvoid()),
                    ts(r.computedAt()), r.profileVersion());
        } catch (DuplicateKeyException race) {
            update(r);
        }
    }

    private int update(FitRecord r) {
        return jdbc.update("""
            UPDATE fit_records
            SET match_percentage = ?, fit_category = ?, selectivity_tier = ?, factors = ?, explanation = ?,
                gap_analysis = ?, recommendations = ?, essay_angles = ?, scholarship_matches = ?,
                application_timeline = ?, test_strategy = ?, major_strategy = ?, demonstrated_interest_tips = ?,
                red_flags_to_avoid = ?, computed_at = ?, profile_version = ?
            WHERE user_id = ? AND university_id = ?
        """,
                r.matchPercentage(), r.fitCategory().name(), r.selectivityTier().name(),
                json.write(r.factors()), r.explanation(), json.write(r.gapAnalysis()),
                json.write(r.recommendations()), json.write(r.essayAngles()), json.write(r.scholarshipMatches()),
                json.write(r.applicationTimeline()), json.write(r.testStrategy()), json.write(r.majorStrategy()),
                json.write(r.demonstratedInterestTips()), json.write(r.redFlagsToAvoid()),
                ts(r.computedAt()), r.profileVersion(),
                r.userId(), r.universityId());
    }

    /**
     * Records joined with their catalog entry, filtered by category and exclusions, in the requested order.
     * State filtering and paging happen in the caller because state names need normalizing first.
     */
    public List<FitRow> query(String userId, FitCategory category, Collection<String> excludeIds, FitQuery.SortBy sortBy) {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append("""
                , u.name AS u_name, u.us_news_rank AS u_rank, u.acceptance_rate AS u_rate, u.state AS u_state,
                  u.city AS u_city, u.market_position AS u_market
                FROM fit_records f
                LEFT JOIN universities u ON u.university_id = f.university_id
                WHERE f.user_id = :userId
                """);
        var params = new MapSqlParameterSource("userId", userId);
        if (category != null) {
            sql.append(" AND f.fit_category = :category");
            params.addValue("category", category.name());
        }
        if (excludeIds != null && !excludeIds.isEmpty()) {
            sql.append(" AND f.university_id NOT IN (:excludeIds)");
            params.addValue("excludeIds", excludeIds);
        }
        if (sortBy == FitQuery.SortBy.MATCH_SCORE) {
            sql.append(" ORDER BY f.match_percentage DESC, CASE WHEN u.us_news_rank IS NULL THEN 1 ELSE 0 END, u.us_news_rank, f.university_id");
        } else {
            sql.append(" ORDER BY CASE WHEN u.us_news_rank IS NULL THEN 1 ELSE 0 END, u.us_news_rank, f.university_id");
        }
        return named.query(sql.toString(), params, (rs, i) -> new FitRow(rm().mapRow(rs, i), university(rs)));
    }

    public int countStale(String userId, long currentVersion) {
        Integer n = jdbc.queryForObject(
                "SELECT COUNT(*) FROM fit_records WHERE user_id = ? AND profile_version <> ?",
                Integer.class, userId, currentVersion);
        return n == null ? 0 : n;
    }

    public int deleteAllForUser(String userId) {
        return jdbc.update("DELETE FROM fit_records WHERE user_id = ?", userId);
    }

    private RowMapper<FitRecord> rm() {
        return (rs, i) -> new FitRecord(
                rs.getString("user_id"),
                rs.getString("university_id"),
                rs.getInt("match_percentage"),
                FitCategory.valueOf(rs.getString("fit_category")),
                SelectivityTier.valueOf(rs.getString("selectivity_tier")),
                json.read(rs.getString("factors"), FACTORS, List.of()),
                rs.getString("explanation"),
                json.read(rs.getString("gap_analysis"), GapAnalysis.class),
                json.read(rs.getString("recommendations"), RECOMMENDATIONS, List.of()),
                json.read(rs.getString("essay_angles"), ESSAY_ANGLES, List.of()),
                json.read(rs.getString("scholarship_matches"), SCHOLARSHIPS, List.of()),
                json.read(rs.getString("application_timeline"), ApplicationTimeline.class),
                json.tree(rs.getString("test_strategy")),
                json.tree(rs.getString("major_strategy")),
                json.read(rs.getString("demonstrated_interest_tips"), STRINGS, List.of()),
                json.read(rs.getString("red_flags_to_avoid"), STRINGS, List.of()),
                instant(rs.getTimestamp("computed_at")),
                rs.getLong("profile_version")
        );
    }

    private static UniversityRecord university(ResultSet rs) throws SQLException {
        String name = rs.getString("u_name");
        if (name == null) return null;
        BigDecimal rate = rs.getBigDecimal("u_rate");
        return new UniversityRecord(
                rs.getString("university_id"),
                name,
                rs.getObject("u_rank", Integer.class),
                rate == null ? null : rate.doubleValue(),
                rs.getString("u_state"),
                rs.getString("u_city"),
                rs.getString("u_market")
        );
    }

    /** A fit record with its catalog entry; {@code university} is null if the catalog no longer lists it. */
    public record FitRow(FitRecord record, UniversityRecord university) {}
}
