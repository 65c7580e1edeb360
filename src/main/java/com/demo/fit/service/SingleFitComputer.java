package com.demo.fit.service;

import com.demo.fit.config.FitEngineProperties;
import com.demo.fit.model.FitRecord;
import com.demo.fit.model.FitResult;
import com.demo.fit.model.MeteredOperation;
import com.demo.fit.model.StudentProfile;
import com.demo.fit.model.UniversityRecord;
import com.demo.fit.repository.FitRecordRepository;
import com.demo.fit.repository.UniversityRepository;
import com.demo.fit.service.dto.EvaluationResult;
import com.demo.fit.service.exception.EvaluatorTimeoutException;
import com.demo.fit.service.exception.EvaluatorUnavailableException;
import com.demo.fit.service.exception.FitWaitExpiredException;
import com.demo.fit.service.exception.InsufficientCreditsException;
import com.demo.fit.service.exception.StoreUnavailableException;
import com.demo.fit.service.exception.UniversityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Computes one (user, university) fit: cache check, credit check, evaluator call, scoring, charge, persist.
 *
 * <p>Calls for the same key share one in-flight computation. A caller that arrives while it runs gets its
 * result instead of starting another, so a burst of identical requests costs one evaluator call and one
 * credit. Calls for different keys run independently on the compute pool.
 *
 * <p>A caller's wait timeout ends only that caller's wait. The computation keeps running and still
 * writes its record, so the next caller finds it in the cache.
 */
@Slf4j
@Service
public class SingleFitComputer {

    private final FitRecordRepository fits;
    private final UniversityRepository universities;
    private final StalenessTracker staleness;
    private final CreditLedger credits;
    private final FactorEvaluator evaluator;
    private final FitScorer scorer;
    private final ExecutorService executor;
    private final Clock clock;
    private final Duration defaultWait;

    private final ConcurrentHashMap<FitKey, CompletableFuture<FitResult>> inFlight = new ConcurrentHashMap<>();

    public SingleFitComputer(FitRecordRepository fits,
                             UniversityRepository universities,
                             StalenessTracker staleness,
                             CreditLedger credits,
                             FactorEvaluator evaluator,
                             FitScorer scorer,
                             @Qualifier("fitComputeExecutor") ExecutorService executor,
                             Clock clock,
                             FitEngineProperties properties) {
        this.fits = fits;
        this.universities = universities;
        this.staleness = staleness;
        this.credits = credits;
        this.evaluator = evaluator;
        this.scorer = scorer;
        this.executor = executor;
        this.clock = clock;
        this.defaultWait = properties.compute().waitTimeout();
    }

    public FitResult computeFit(String userId, String universityId, boolean forceRecompute) {
        return computeFit(userId, universityId, forceRecompute, defaultWait);
    }

    /**
     * @param wait how long this caller waits; the computation itself is not cancelled when it expires
     * @throws FitWaitExpiredException when the wait expires before the computation finishes
     */
    public FitResult computeFit(String userId, String universityId, boolean forceRecompute, Duration wait) {
        String normalizedId = UniversityIds.normalize(universityId);
        if (normalizedId == null) {
            throw new IllegalArgumentException("university_id is required");
        }
        FitKey key = new FitKey(userId, normalizedId);
        if (!forceRecompute) {
            Optional<FitResult> hit = readFresh(key);
            if (hit.isPresent()) return hit.get();
        }
        CompletableFuture<FitResult> flight = join(key, forceRecompute);
        try {
            return flight.get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[FIT] {} {} caller gave up after {}ms, computation continues", key.userId(),
                    key.universityId(), wait.toMillis());
            throw new FitWaitExpiredException(key.universityId(), wait.toMillis(), flight);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EvaluatorTimeoutException("Interrupted waiting for fit " + key.universityId(), e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    /**
     * Keeps waiting, without a bound, on the computation an expired wait left running.
     * Never starts a new computation.
     */
    public FitResult awaitPending(FitWaitExpiredException expired) {
        try {
            return expired.pending().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EvaluatorTimeoutException("Interrupted waiting for pending fit", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    /** Number of computations currently running. */
    public int inFlightCount() {
        return inFlight.size();
    }

    private CompletableFuture<FitResult> join(FitKey key, boolean force) {
        CompletableFuture<FitResult> mine = new CompletableFuture<>();
        CompletableFuture<FitResult> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("[FIT] {} {} joined in-flight computation", key.userId(), key.universityId());
            return existing;
        }
        try {
            executor.execute(() -> run(key, force, mine));
        } catch (RejectedExecutionException ex) {
            inFlight.remove(key, mine);
            mine.completeExceptionally(new EvaluatorUnavailableException("Compute pool is not accepting work", ex));
        }
        return mine;
    }

    private void run(FitKey key, boolean force, CompletableFuture<FitResult> promise) {
        FitResult result = null;
        RuntimeException failure = null;
        try {
            result = compute(key, force);
        } catch (DataAccessException ex) {
            log.error("[FIT] {} {} store failure: {}", key.userId(), key.universityId(), ex.getMessage());
            failure = new StoreUnavailableException("Fit store unavailable", ex);
        } catch (RuntimeException ex) {
            failure = ex;
        } finally {
            inFlight.remove(key, promise);
        }
        if (failure != null) {
            promise.completeExceptionally(failure);
        } else {
            promise.complete(result);
        }
    }

    private FitResult compute(FitKey key, boolean force) {
        String userId = key.userId();
        String universityId = key.universityId();

        // 1) Profile and catalog entry must exist
        StudentProfile profile = staleness.currentProfile(userId);
        UniversityRecord university = universities.findById(universityId)
                .orElseThrow(() -> new UniversityNotFoundException(universityId));

        // 2) Re-check the cache: an earlier flight may have written it since the caller looked
        if (!force) {
            Optional<FitRecord> cached = fits.find(userId, universityId);
            if (cached.isPresent() && !cached.get().staleAgainst(profile.profileVersion())) {
                log.debug("[FIT] {} {} served from cache", userId, universityId);
                return FitResult.cached(cached.get());
            }
        }

        // 3) Credit gate, no side effects when refused
        int cost = credits.cost(MeteredOperation.FIT_RECOMPUTE);
        int balance = credits.balance(userId);
        if (balance < cost) {
            log.warn("[FIT] {} {} refused: {} credits, {} needed", userId, universityId, balance, cost);
            throw new InsufficientCreditsException(userId, balance, cost);
        }

        // 4) Evaluator call; a failure here never reaches the ledger
        long started = System.nanoTime();
        EvaluationResult evaluation = evaluator.evaluate(profile, university);
        if (evaluation == null || evaluation.getFactors() == null || evaluation.getFactors().isEmpty()) {
            throw new EvaluatorUnavailableException("Evaluator returned no factors for " + universityId);
        }

        // 5) Score from the factors alone; category capped by selectivity
        FitScorer.Score score = scorer.score(evaluation.getFactors(), university);

        // 6) Charge only after the evaluator succeeded
        int remaining = credits.charge(userId, MeteredOperation.FIT_RECOMPUTE);

        // 7) Full overwrite; refund if the write is lost
        FitRecord record = assemble(userId, universityId, profile.profileVersion(), score, evaluation,
                clock.instant().truncatedTo(ChronoUnit.MILLIS));
        try {
            fits.save(record);
        } catch (DataAccessException ex) {
            refund(userId, cost);
            throw ex;
        }

        log.info("[FIT] {} {} computed {}% {} ({}) v{} in {}ms, {} credits left", userId, universityId,
                score.matchPercentage(), score.category(), score.tier(), profile.profileVersion(),
                (System.nanoTime() - started) / 1_000_000, remaining);
        return FitResult.computed(record, remaining);
    }

    /** Cache lookup on the caller's thread, so a hit never queues behind running computations. */
    private Optional<FitResult> readFresh(FitKey key) {
        try {
            return staleness.findProfile(key.userId())
                    .flatMap(p -> fits.find(key.userId(), key.universityId())
                            .filter(r -> !r.staleAgainst(p.profileVersion())))
                    .map(r -> {
                        log.debug("[FIT] {} {} served from cache", key.userId(), key.universityId());
                        return FitResult.cached(r);
                    });
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Fit store unavailable", ex);
        }
    }

    private void refund(String userId, int cost) {
        try {
            credits.add(userId, cost, "refund");
        } catch (DataAccessException refundFailure) {
            log.error("[CREDITS] {} refund of {} failed: {}", userId, cost, refundFailure.getMessage());
        }
    }

    private static FitRecord assemble(String userId, String universityId, long profileVersion,
                                      FitScorer.Score score, EvaluationResult e, Instant now) {
        return new FitRecord(
                userId,
                universityId,
                score.matchPercentage(),
                score.category(),
                score.tier(),
                score.factors(),
                e.getExplanation(),
                e.getGapAnalysis(),
                nullToEmpty(e.getRecommendations()),
                nullToEmpty(e.getEssayAngles()),
                nullToEmpty(e.getScholarshipMatches()),
                e.getApplicationTimeline(),
                e.getTestStrategy(),
                e.getMajorStrategy(),
                nullToEmpty(e.getDemonstratedInterestTips()),
                nullToEmpty(e.getRedFlagsToAvoid()),
                now,
                profileVersion
        );
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new EvaluatorUnavailableException("Fit computation failed: " + cause.getMessage(), cause);
    }

    private record FitKey(String userId, String universityId) {}
}
