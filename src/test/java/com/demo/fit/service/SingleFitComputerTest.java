package com.demo.fit.service;

import com.demo.fit.config.FitEngineProperties;
import com.demo.fit.model.FitCategory;
import com.demo.fit.model.FitResult;
import com.demo.fit.repository.FitRecordRepository;
import com.demo.fit.repository.UniversityRepository;
import com.demo.fit.service.exception.EvaluatorTimeoutException;
import com.demo.fit.service.exception.EvaluatorUnavailableException;
import com.demo.fit.service.exception.FitWaitExpiredException;
import com.demo.fit.service.exception.InsufficientCreditsException;
import com.demo.fit.service.exception.ProfileNotFoundException;
import com.demo.fit.service.exception.UniversityNotFoundException;
import com.demo.fit.support.IntegrationTestSupport;
import com.demo.fit.support.ScriptedFactorEvaluator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SingleFitComputerTest extends IntegrationTestSupport {

    @Autowired
    private SingleFitComputer computer;

    @Autowired
    private FitRecordRepository fits;

    @Autowired
    private UniversityRepository universities;

    @Autowired
    private FitEngineProperties properties;

    @Test
    void secondCallIsServedFromCacheWithoutCharge() {
        String user = userWithProfileAndCredits(5);

        FitResult first = computer.computeFit(user, "ohio_state", false);
        FitResult second = computer.computeFit(user, "ohio_state", false);

        assertFalse(first.fromCache());
        assertEquals(4, first.creditsRemaining());
        assertTrue(second.fromCache());
        assertEquals(first.record(), second.record());
        assertEquals(1, evaluator.calls());
        assertEquals(4, ledger.balance(user));
    }

    @Test
    void recordCarriesScoreArtifactsAndProfileVersion() {
        String user = userWithProfileAndCredits(1);

        var record = computer.computeFit(user, "Ohio-State", false).record();

        assertEquals("ohio_state", record.universityId());
        assertEquals(77, record.matchPercentage());
        assertEquals(FitCategory.SAFETY, record.fitCategory());
        assertEquals(1L, record.profileVersion());
        assertThat(record.factors()).extracting(f -> f.name()).contains("GPA Match", FitScorer.SELECTIVITY_CONTEXT);
        assertEquals("Test scores", record.gapAnalysis().primaryGap());
        assertThat(record.recommendations()).hasSize(1);
        assertThat(record.essayAngles()).hasSize(1);
        assertEquals("Early Action", record.applicationTimeline().recommendedPlan());
        assertThat(fits.find(user, "ohio_state")).contains(record);
    }

    @Test
    void selectivityCapsStrongProfileAtUltraSelectiveSchool() {
        String user = userWithProfileAndCredits(1);
        var record = computer.computeFit(user, "stanford", false).record();
        assertEquals(77, record.matchPercentage());
        assertEquals(FitCategory.SUPER_REACH, record.fitCategory());
    }

    @Test
    void zeroCreditsFailsWithoutCallingEvaluator() {
        String user = userWithProfileAndCredits(0);

        assertThatThrownBy(() -> computer.computeFit(user, "purdue", false))
                .isInstanceOfSatisfying(InsufficientCreditsException.class,
                        e -> assertEquals(0, e.getCreditsRemaining()));
        assertEquals(0, evaluator.calls());
        assertEquals(0, ledger.balance(user));
        assertThat(fits.find(user, "purdue")).isEmpty();
    }

    @Test
    void evaluatorFailureDoesNotBurnCredit() {
        String user = userWithProfileAndCredits(2);
        evaluator.failNext("purdue", new EvaluatorUnavailableException("agent down"));

        assertThatThrownBy(() -> computer.computeFit(user, "purdue", false))
                .isInstanceOf(EvaluatorUnavailableException.class);
        assertEquals(2, ledger.balance(user));
        assertThat(fits.find(user, "purdue")).isEmpty();

        FitResult retried = computer.computeFit(user, "purdue", false);
        assertFalse(retried.fromCache());
        assertEquals(1, ledger.balance(user));
    }

    @Test
    void staleRecordIsRecomputedAgainstNewVersion() {
        String user = userWithProfileAndCredits(3);
        computer.computeFit(user, "penn_state", false);

        long v2 = uploadProfile(user);
        FitResult refreshed = computer.computeFit(user, "penn_state", false);

        assertEquals(2L, v2);
        assertFalse(refreshed.fromCache());
        assertEquals(2L, refreshed.record().profileVersion());
        assertEquals(1, ledger.balance(user));
    }

    @Test
    void forceRecomputesFreshRecordAndCharges() {
        String user = userWithProfileAndCredits(2);
        computer.computeFit(user, "uiuc", false);
        evaluator.scoreAs("uiuc", ScriptedFactorEvaluator.weakProfile());

        FitResult forced = computer.computeFit(user, "uiuc", true);

        assertFalse(forced.fromCache());
        assertEquals(32, forced.record().matchPercentage());
        assertEquals(FitCategory.SUPER_REACH, forced.record().fitCategory());
        assertEquals(0, ledger.balance(user));
        assertEquals(2, evaluator.calls("uiuc"));
    }

    @Test
    void concurrentCallersShareOneComputation() throws Exception {
        String user = userWithProfileAndCredits(5);
        evaluator.delay(Duration.ofMillis(300));

        int callers = 10;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<FitResult>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return computer.computeFit(user, "umich", false);
            }));
        }
        start.countDown();
        List<FitResult> results = new ArrayList<>();
        for (Future<FitResult> f : futures) {
            results.add(f.get(10, TimeUnit.SECONDS));
        }
        pool.shutdown();

        assertEquals(1, evaluator.calls());
        assertEquals(4, ledger.balance(user));
        assertThat(results).extracting(r -> r.record().computedAt()).containsOnly(results.get(0).record().computedAt());
        assertEquals(0, computer.inFlightCount());
    }

    @Test
    void differentUniversitiesRunInParallel() throws Exception {
        String user = userWithProfileAndCredits(3);
        evaluator.delay(Duration.ofMillis(400));

        ExecutorService pool = Executors.newFixedThreadPool(3);
        long started = System.nanoTime();
        var a = pool.submit(() -> computer.computeFit(user, "ucla", false));
        var b = pool.submit(() -> computer.computeFit(user, "nyu", false));
        var c = pool.submit(() -> computer.computeFit(user, "unc", false));
        a.get(5, TimeUnit.SECONDS);
        b.get(5, TimeUnit.SECONDS);
        c.get(5, TimeUnit.SECONDS);
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
        pool.shutdown();

        assertEquals(3, evaluator.calls());
        assertThat(elapsedMs).isLessThan(1100);
    }

    @Test
    void callerTimeoutDoesNotCancelTheComputation() throws Exception {
        String user = userWithProfileAndCredits(1);
        evaluator.delay(Duration.ofMillis(500));

        assertThatThrownBy(() -> computer.computeFit(user, "arizona_state", false, Duration.ofMillis(50)))
                .isInstanceOf(FitWaitExpiredException.class)
                .isInstanceOf(EvaluatorTimeoutException.class);

        FitResult later = computer.computeFit(user, "arizona_state", false, Duration.ofSeconds(5));
        assertEquals(1, evaluator.calls());
        assertEquals(0, ledger.balance(user));
        assertEquals("arizona_state", later.record().universityId());
        assertThat(fits.find(user, "arizona_state")).isPresent();
    }

    @Test
    void missingProfileIsReported() {
        String user = newUser();
        ledger.add(user, 1, "purchase");
        assertThatThrownBy(() -> computer.computeFit(user, "purdue", false))
                .isInstanceOf(ProfileNotFoundException.class);
        assertEquals(1, ledger.balance(user));
    }

    @Test
    void unknownUniversityIsReported() {
        String user = userWithProfileAndCredits(1);
        assertThatThrownBy(() -> computer.computeFit(user, "hogwarts", false))
                .isInstanceOf(UniversityNotFoundException.class);
        assertEquals(1, ledger.balance(user));
        assertEquals(0, evaluator.calls());
    }

    @Test
    void cacheHitIsServedWhileEveryComputeThreadIsBusy() throws Exception {
        int poolSize = properties.compute().poolSize();
        String user = userWithProfileAndCredits(poolSize + 1);
        computer.computeFit(user, "umich", false);
        List<String> slow = universities.findAllIds().stream()
                .filter(id -> !id.equals("umich"))
                .limit(poolSize)
                .toList();

        evaluator.delay(Duration.ofMillis(1500));
        ExecutorService callers = Executors.newFixedThreadPool(poolSize);
        try {
            List<Future<FitResult>> running = new ArrayList<>();
            for (String id : slow) {
                running.add(callers.submit(() -> computer.computeFit(user, id, false, Duration.ofSeconds(10))));
            }
            long deadline = System.currentTimeMillis() + 5_000;
            while (evaluator.calls() < poolSize + 1 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(poolSize + 1, evaluator.calls());

            long started = System.nanoTime();
            FitResult hit = computer.computeFit(user, "umich", false, Duration.ofMillis(500));
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;

            assertTrue(hit.fromCache());
            assertThat(elapsedMs).isLessThan(500);
            for (Future<FitResult> f : running) {
                assertFalse(f.get(10, TimeUnit.SECONDS).fromCache());
            }
        } finally {
            callers.shutdownNow();
        }
        assertEquals(0, ledger.balance(user));
    }
}
