package com.demo.fit.service;

import com.demo.fit.model.CreditAccount;
import com.demo.fit.model.CreditHistoryEntry;
import com.demo.fit.model.MeteredOperation;
import com.demo.fit.model.SubscriptionPlan;
import com.demo.fit.model.Tier;
import com.demo.fit.service.exception.InsufficientCreditsException;
import com.demo.fit.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CreditLedgerTest extends IntegrationTestSupport {

    @Test
    void newAccountStartsOnFreeTier() {
        String user = newUser();
        CreditAccount account = ledger.account(user);
        assertEquals(Tier.FREE, account.tier());
        assertEquals(0, account.creditsRemaining());
        assertFalse(account.subscriptionActive());
        assertFalse(ledger.hasCredits(user, 1));
    }

    @Test
    void refusedDeductionLeavesBalanceUntouched() {
        String user = newUser();
        ledger.add(user, 2, "purchase");

        assertThatThrownBy(() -> ledger.deduct(user, 3, "bulk"))
                .isInstanceOfSatisfying(InsufficientCreditsException.class, e -> {
                    assertEquals(2, e.getCreditsRemaining());
                    assertEquals(3, e.getCreditsNeeded());
                });
        assertEquals(2, ledger.balance(user));
        assertEquals(0, ledger.account(user).creditsUsed());
    }

    @Test
    void deductAndAddKeepTotalsAndHistory() {
        String user = newUser();
        assertEquals(5, ledger.add(user, 5, "purchase"));
        assertEquals(3, ledger.deduct(user, 2, "fit_analysis"));
        assertEquals(2, ledger.charge(user, MeteredOperation.INFOGRAPHIC_REGENERATION));

        CreditAccount account = ledger.account(user);
        assertEquals(5, account.creditsTotal());
        assertEquals(3, account.creditsUsed());
        assertEquals(2, account.creditsRemaining());

        List<CreditHistoryEntry> history = ledger.history(user, 10);
        assertThat(history).extracting(CreditHistoryEntry::reason)
                .containsExactly("infographic_regeneration", "fit_analysis", "purchase");
        assertThat(history).extracting(CreditHistoryEntry::amount).containsExactly(-1, -2, 5);
        assertThat(history).extracting(CreditHistoryEntry::balanceAfter).containsExactly(2, 3, 5);
    }

    @Test
    void nonPositiveAmountsAreRejected() {
        String user = newUser();
        assertThatThrownBy(() -> ledger.deduct(user, 0, "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledger.add(user, -1, "x")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentDeductionsNeverOverspend() throws Exception {
        String user = newUser();
        ledger.add(user, 10, "purchase");

        int callers = 25;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger refused = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    int remaining = ledger.deduct(user, 1, "fit_analysis");
                    assertTrue(remaining >= 0);
                    succeeded.incrementAndGet();
                } catch (InsufficientCreditsException e) {
                    refused.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(10, succeeded.get());
        assertEquals(callers - 10, refused.get());
        assertEquals(0, ledger.balance(user));
        assertEquals(10, ledger.account(user).creditsUsed());
    }

    @Test
    void seasonPassGrantsBundleAndDefaultExpiry() {
        String user = newUser();
        Instant before = Instant.now();
        CreditAccount account = ledger.upgradeTier(user, Tier.PRO, SubscriptionPlan.SEASON_PASS, null);

        assertEquals(Tier.PRO, account.tier());
        assertTrue(account.subscriptionActive());
        assertEquals("season_pass", account.subscriptionPlan());
        assertEquals(150, account.creditsRemaining());
        assertThat(account.subscriptionExpires())
                .isAfter(before.plus(Duration.ofDays(179)))
                .isBefore(before.plus(Duration.ofDays(181)));
    }

    @Test
    void monthlyPlanHonorsExplicitExpiry() {
        String user = newUser();
        Instant expires = Instant.parse("2030-01-31T00:00:00Z");
        CreditAccount account = ledger.upgradeTier(user, Tier.PRO, SubscriptionPlan.MONTHLY, expires);
        assertEquals(20, account.creditsRemaining());
        assertEquals(expires, account.subscriptionExpires());
    }

    @Test
    void downgradeKeepsRemainingCredits() {
        String user = newUser();
        ledger.upgradeTier(user, Tier.PRO, SubscriptionPlan.MONTHLY, null);
        ledger.deduct(user, 5, "fit_analysis");

        CreditAccount account = ledger.upgradeTier(user, Tier.FREE, null, null);
        assertEquals(Tier.FREE, account.tier());
        assertFalse(account.subscriptionActive());
        assertEquals(15, account.creditsRemaining());
    }

    @Test
    void userLocksComeFromAFixedStripeSet() {
        String user = newUser();
        assertThat(ledger.lockFor(user)).isSameAs(ledger.lockFor(user));

        var distinct = java.util.Collections.newSetFromMap(new java.util.IdentityHashMap<Object, Boolean>());
        for (int i = 0; i < 1_000; i++) {
            distinct.add(ledger.lockFor(newUser()));
        }
        assertThat(distinct.size()).isLessThanOrEqualTo(CreditLedger.LOCK_STRIPES);
    }
}
