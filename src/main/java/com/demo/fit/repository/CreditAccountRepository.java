package com.demo.fit.repository;

import com.demo.fit.model.CreditAccount;
import com.demo.fit.model.CreditHistoryEntry;
import com.demo.fit.model.Tier;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.demo.fit.repository.JsonColumns.instant;
import static com.demo.fit.repository.JsonColumns.ts;

/**
 * Credit balances and their history. Balance changes are single conditional UPDATEs so the
 * non-negative check and the decrement can never be split.
 */
@Repository
@RequiredArgsConstructor
public class CreditAccountRepository {

    private final JdbcTemplate jdbc;

    public Optional<CreditAccount> find(String userId) {
        String sql = """
            SELECT user_id, tier, credits_total, credits_used, credits_remaining, subscription_active,
                   subscription_plan, subscription_expires, created_at, updated_at
            FROM credit_accounts
            WHERE user_id = ?
        """;
        return jdbc.query(sql, rm(), userId).stream().findFirst();
    }

    /** Throws {@link org.springframework.dao.DuplicateKeyException} if the account already exists. */
    public void insert(CreditAccount a) {
        jdbc.update("""
            INSERT INTO credit_accounts (user_id, tier, credits_total, credits_used, credits_remaining,
                subscription_active, subscription_plan, subscription_expires, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """,
                a.userId(), a.tier().code(), a.creditsTotal(), a.creditsUsed(), a.creditsRemaining(),
                a.subscriptionActive(), a.subscriptionPlan(), ts(a.subscriptionExpires()),
                ts(a.createdAt()), ts(a.updatedAt()));
    }

    /** Returns 1 when the deduction happened, 0 when the balance was too low. */
    public int tryDeduct(String userId, int amount, Instant now) {
        return jdbc.update("""
            UPDATE credit_accounts
            SET credits_remaining = credits_remaining - ?, credits_used = credits_used + ?, updated_at = ?
            WHERE user_id = ? AND credits_remaining >= ?
        """, amount, amount, ts(now), userId, amount);
    }

    public int add(String userId, int amount, Instant now) {
        return jdbc.update("""
            UPDATE credit_accounts
            SET credits_remaining = credits_remaining + ?, credits_total = credits_total + ?, updated_at = ?
            WHERE user_id = ?
        """, amount, amount, ts(now), userId);
    }

    public int updateSubscription(String userId, Tier tier, boolean active, String plan, Instant expires, Instant now) {
        return jdbc.update("""
            UPDATE credit_accounts
            SET tier = ?, subscription_active = ?, subscription_plan = ?, subscription_expires = ?, updated_at = ?
            WHERE user_id = ?
        """, tier.code(), active, plan, ts(expires), ts(now), userId);
    }

    public int remaining(String userId) {
        Integer n = jdbc.queryForObject(
                "SELECT credits_remaining FROM credit_accounts WHERE user_id = ?", Integer.class, userId);
        return n == null ? 0 : n;
    }

    public void appendHistory(String userId, int amount, String reason, int balanceAfter, Instant at) {
        jdbc.update("""
            INSERT INTO credit_history (user_id, amount, reason, balance_after, created_at)
            VALUES (?, ?, ?, ?, ?)
        """, userId, amount, reason, balanceAfter, ts(at));
    }

    /** Most recent first. */
    public List<CreditHistoryEntry> history(String userId, int limit) {
        String sql = """
            SELECT id, user_id, amount, reason, balance_after, created_at
            FROM credit_history
            WHERE user_id = ?
            ORDER BY id DESC
            OFFSET 0 ROWS FETCH NEXT ? ROWS ONLY
        """;
        return jdbc.query(sql, (rs, i) -> new CreditHistoryEntry(
                rs.getLong("id"),
                rs.getString("user_id"),
                rs.getInt("amount"),
                rs.getString("reason"),
                rs.getInt("balance_after"),
                instant(rs.getTimestamp("created_at"))
        ), userId, limit);
    }

    private RowMapper<CreditAccount> rm() {
        return (rs, i) -> new CreditAccount(
                rs.getString("user_id"),
                Tier.parse(rs.getString("tier")),
                rs.getInt("credits_total"),
                rs.getInt("credits_used"),
                rs.getInt("credits_remaining"),
                rs.getBoolean("subscription_active"),
                rs.getString("subscription_plan"),
                instant(rs.getTimestamp("subscription_expires")),
                instant(rs.getTimestamp("created_at")),
                instant(rs.getTimestamp("updated_at"))
        );
    }
}
