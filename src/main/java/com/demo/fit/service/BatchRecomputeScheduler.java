package com.demo.fit.service;

import com.demo.fit.config.FitEngineProperties;
import com.demo.fit.model.BatchResult;
import com.demo.fit.model.FitResult;
import com.demo.fit.model.StudentProfile;
import com.demo.fit.repository.UniversityRepository;
import com.demo.fit.service.exception.EvaluatorTimeoutException;
import com.demo.fit.service.exception.EvaluatorUnavailableException;
import com.demo.fit.service.exception.FitEngineException;
import com.demo.fit.service.exception.FitWaitExpiredException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Walks a list of universities in fixed-size batches. Requests inside a batch run concurrently and
 * batches run one after another, which bounds the load on the evaluator. One university failing is
 * recorded and never stops its siblings.
 */
@Slf4j
@Service
public class BatchRecomputeScheduler {

    private final SingleFitComputer computer;
    private final StalenessTracker staleness;
    private final UniversityRepository universities;
    private final ExecutorService executor;
    private final Clock clock;
    private final int batchSize;
    private final int retries;
    private final Duration retryDelay;

    public BatchRecomputeScheduler(SingleFitComputer computer,
                                   StalenessTracker staleness,
                                   UniversityRepository universities,
                                   @Qualifier("fitBatchExecutor") ExecutorService executor,
                                   Clock clock,
                                   FitEngineProperties properties) {
        this.computer = computer;
        this.staleness = staleness;
        this.universities = universities;
        this.executor = executor;
        this.clock = clock;
        this.batchSize = Math.max(1, properties.batch().size());
        this.retries = Math.max(0, properties.batch().evaluatorRetries());
        this.retryDelay = properties.batch().retryDelay() == null ? Duration.ZERO : properties.batch().retryDelay();
    }

    /**
     * Computes every listed university. {@code force=false} only touches missing or stale entries;
     * {@code force=true} recomputes and charges for every one of them.
     *
     * @param universityIds null or empty means the whole catalog
     */
    public BatchResult recomputeAll(String userId, List<String> universityIds, boolean force) {
        StudentProfile profile = staleness.currentProfile(userId);
        List<String> ids = (universityIds == null || universityIds.isEmpty())
                ? universities.findAllIds()
                : UniversityIds.normalizeAll(universityIds);

        log.info("[BATCH] {} start: {} universities, force={}, batch size {}", userId, ids.size(), force, batchSize);
        int computed = 0;
        int fromCache = 0;
        List<BatchResult.Failure> failures = new ArrayList<>();

        for (int from = 0; from < ids.size(); from += batchSize) {
            List<String> batch = ids.subList(from, Math.min(from + batchSize, ids.size()));
            List<CompletableFuture<Outcome>> futures = batch.stream()
                    .map(id -> CompletableFuture.supplyAsync(() -> attempt(userId, id, force), executor))
                    .toList();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            for (CompletableFuture<Outcome> f : futures) {
                Outcome o = f.join();
                if (o.failure() != null) {
                    failures.add(o.failure());
                } else if (o.result().fromCache()) {
                    fromCache++;
                } else {
                    computed++;
                }
            }
        }

        Instant at = clock.instant();
        staleness.markFitsComputed(userId, profile.profileVersion(), at);
        log.info("[BATCH] {} done: computed={}, cached={}, failed={}", userId, computed, fromCache, failures.size());
        return new BatchResult(computed, fromCache, List.copyOf(failures), at);
    }

    private Outcome attempt(String userId, String universityId, boolean force) {
        for (int attempt = 1; ; attempt++) {
            try {
                return Outcome.ok(computeOnce(userId, universityId, force));
            } catch (EvaluatorUnavailableException | EvaluatorTimeoutException e) {
                if (attempt > retries) {
                    log.warn("[BATCH] {} {} failed after {} attempts: {}", userId, universityId, attempt, e.getMessage());
                    return Outcome.failed(universityId, e.reasonCode(), e.getMessage());
                }
                log.warn("[BATCH] {} {} attempt {}/{} failed ({}), retrying in {}ms", userId, universityId,
                        attempt, retries + 1, e.getMessage(), retryDelay.toMillis());
                if (!pause()) {
                    return Outcome.failed(universityId, e.reasonCode(), "Interrupted before retry");
                }
            } catch (FitEngineException e) {
                log.warn("[BATCH] {} {} failed: {}", userId, universityId, e.reasonCode());
                return Outcome.failed(universityId, e.reasonCode(), e.getMessage());
            } catch (DataAccessException e) {
                log.error("[BATCH] {} {} store failure: {}", userId, universityId, e.getMessage());
                return Outcome.failed(universityId, "store_unavailable", e.getMessage());
            }
        }
    }

    /**
     * An expired wait is not a failed attempt: the computation is still running and may already have
     * charged, so the batch keeps waiting on it rather than starting a second one.
     */
    private FitResult computeOnce(String userId, String universityId, boolean force) {
        try {
            return computer.computeFit(userId, universityId, force);
        } catch (FitWaitExpiredException expired) {
            log.info("[BATCH] {} {} still computing, waiting on the running computation", userId, universityId);
            return computer.awaitPending(expired);
        }
    }

    private boolean pause() {
        if (retryDelay.isZero()) return true;
        try {
            Thread.sleep(retryDelay.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private record Outcome(FitResult result, BatchResult.Failure failure) {
        static Outcome ok(FitResult result) {
            return new Outcome(result, null);
        }

        static Outcome failed(String universityId, String reason, String message) {
            return new Outcome(null, new BatchResult.Failure(universityId, reason, message));
        }
    }
}
