package com.demo.fit.service;

import com.demo.fit.config.FitEngineProperties;
import com.demo.fit.model.CreditAccount;
import com.demo.fit.model.CreditHistoryEntry;
import com.demo.fit.model.MeteredOperation;
import com.demo.fit.model.SubscriptionPlan;
import com.demo.fit.model.Tier;
import com.demo.fit.repository.CreditAccountRepository;
import com.demo.fit.service.exception.InsufficientCreditsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-user credit balance. A deduction is check-and-decrement in one conditional UPDATE, so the
 * balance never goes negative and two concurrent callers can never both spend the last credit.
 * A striped per-user lock keeps the balance read for the history row consistent with the change.
 */
@Slf4j
@Service
public class CreditLedger {

    static final int LOCK_STRIPES = 64;

    private final CreditAccountRepository accounts;
    private final TransactionTemplate tx;
    private final FitEngineProperties.Credits config;
    private final Clock clock;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    public CreditLedger(CreditAccountRepository accounts, PlatformTransactionManager txManager,
                        FitEngineProperties properties, Clock clock) {
        this.accounts = accounts;
        this.tx = new TransactionTemplate(txManager);
        this.config = properties.credits();
        this.clock = clock;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /** Returns the account, creating a free-tier one on first sight. */
    public CreditAccount account(String userId) {
        return accounts.find(userId).orElseGet(() -> initFree(userId));
    }

    public int balance(String userId) {
        return account(userId).creditsRemaining();
    }

    public boolean hasCredits(String userId, int n) {
        return balance(userId) >= n;
    }

    public int cost(MeteredOperation op) {
        return switch (op) {
            case FIT_RECOMPUTE -> config.recomputeCost();
            case INFOGRAPHIC_REGENERATION -> config.infographicCost();
        };
    }

    /** Charges the configured cost of {@code op}; returns the balance after the charge. */
    public int charge(String userId, MeteredOperation op) {
        return deduct(userId, cost(op), op.reason());
    }

    /**
     * Atomically removes {@code n} credits.
     *
     * @return balance after the deduction
     * @throws InsufficientCreditsException when the balance is below {@code n}; nothing changes
     */
    public int deduct(String userId, int n, String reason) {
        if (n <= 0) {
            throw new IllegalArgumentException("Deduction must be positive");
        }
        account(userId);
        return withUserLock(userId, () -> tx.execute(status -> {
            Instant now = clock.instant();
            int updated = accounts.tryDeduct(userId, n, now);
            int remaining = accounts.remaining(userId);
            if (updated == 0) {
                log.info("[CREDITS] {} refused {} for {} (remaining {})", userId, n, reason, remaining);
                throw new InsufficientCreditsException(userId, remaining, n);
            }
            accounts.appendHistory(userId, -n, reason, remaining, now);
            log.info("[CREDITS] {} -{} {} -> {}", userId, n, reason, remaining);
            return remaining;
        }));
    }

    /** Adds {@code n} credits; returns the new balance. */
    public int add(String userId, int n, String reason) {
        if (n <= 0) {
            throw new IllegalArgumentException("Credit amount must be positive");
        }
        account(userId);
        return withUserLock(userId, () -> tx.execute(status -> {
            Instant now = clock.instant();
            accounts.add(userId, n, now);
            int remaining = accounts.remaining(userId);
            accounts.appendHistory(userId, n, reason, remaining, now);
            log.info("[CREDITS] {} +{} {} -> {}", userId, n, reason, remaining);
            return remaining;
        }));
    }

    /**
     * Moves the account to {@code tier}. A PRO upgrade activates the plan and grants its credit bundle;
     * a FREE downgrade deactivates the subscription and keeps the remaining credits.
     */
    public CreditAccount upgradeTier(String userId, Tier tier, SubscriptionPlan plan, Instant expires) {
        account(userId);
        withUserLock(userId, () -> tx.execute(status -> {
            Instant now = clock.instant();
            if (tier == Tier.PRO) {
                SubscriptionPlan p = plan == null ? SubscriptionPlan.MONTHLY : plan;
                Instant until = expires != null ? expires : now.plus(p.defaultLength());
                accounts.updateSubscription(userId, Tier.PRO, true, p.code(), until, now);
                int grant = p == SubscriptionPlan.SEASON_PASS ? config.seasonPassCredits() : config.monthlyPlanCredits();
                if (grant > 0) {
                    accounts.add(userId, grant, now);
                    accounts.appendHistory(userId, grant, "subscription_" + p.code(), accounts.remaining(userId), now);
                }
                log.info("[CREDITS] {} upgraded to pro ({}) until {}, +{}", userId, p.code(), until, grant);
            } else {
                accounts.updateSubscription(userId, Tier.FREE, false, null, null, now);
                log.info("[CREDITS] {} moved to free tier", userId);
            }
            return null;
        }));
        return account(userId);
    }

    public List<CreditHistoryEntry> history(String userId, int limit) {
        return accounts.history(userId, Math.max(1, limit));
    }

    private CreditAccount initFree(String userId) {
        Instant now = clock.instant();
        int credits = config.freeTierCredits();
        var fresh = new CreditAccount(userId, Tier.FREE, credits, 0, credits, false, null, null, now, now);
        try {
            tx.executeWithoutResult(status -> {
                accounts.insert(fresh);
                if (credits > 0) {
                    accounts.appendHistory(userId, credits, "free_tier", credits, now);
                }
            });
            log.info("[CREDITS] {} initialized on free tier with {}", userId, credits);
            return fresh;
        } catch (DuplicateKeyException race) {
            log.debug("[CREDITS] {} initialized concurrently", userId);
            return accounts.find(userId).orElseThrow(() -> race);
        }
    }

    /** Fixed stripe per user. Users sharing a stripe serialize. */
    ReentrantLock lockFor(String userId) {
        return locks[Math.floorMod(userId.hashCode(), locks.length)];
    }

    private <T> T withUserLock(String userId, Supplier<T> body) {
        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }
}
