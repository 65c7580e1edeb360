package com.demo.fit.service.exception;

import com.demo.fit.model.FitResult;

import java.util.concurrent.CompletableFuture;

/**
 * The caller stopped waiting while the computation kept running. The computation may still charge and
 * save; {@link #pending()} is that same computation, so a caller may keep waiting instead of starting
 * another one.
 */
public class FitWaitExpiredException extends EvaluatorTimeoutException {

    private final transient CompletableFuture<FitResult> pending;

    public FitWaitExpiredException(String universityId, long waitedMillis, CompletableFuture<FitResult> pending) {
        super("Timed out after " + waitedMillis + "ms waiting for fit " + universityId);
        this.pending = pending;
    }

    public CompletableFuture<FitResult> pending() {
        return pending;
    }
}
