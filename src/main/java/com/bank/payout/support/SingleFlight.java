package com.bank.payout.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.LongSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Coalesces concurrent requests for the same value into a single outstanding fetch.
 *
 * <p>A successful fetch is cached until the expiry it reports. A failure matching
 * {@code negativeCacheWhen} is remembered for {@code negativeTtlMs}: callers in that window
 * get the same failure without a new fetch. Other failures reach every waiting caller
 * and the next call fetches again.
 *
 * @param <T> value type, for example a session token
 */
public class SingleFlight<T> {

    private static final Logger log = LoggerFactory.getLogger(SingleFlight.class);

    /**
     * A fetched value and the epoch millis until which it may be reused.
     */
    public record Fetched<T>(T value, long validUntil) {}

    private final String name;
    private final LongSupplier clock;
    private final Predicate<RuntimeException> negativeCacheWhen;
    private final long negativeTtlMs;

    private final Object lock = new Object();

    // all guarded by lock
    private CompletableFuture<T> inFlight;
    private T cachedValue;
    private long cachedUntil;
    private RuntimeException cachedFailure;
    private long failureUntil;

    public SingleFlight(String name, LongSupplier clock,
                        Predicate<RuntimeException> negativeCacheWhen, long negativeTtlMs) {
        this.name = name;
        this.clock = clock;
        this.negativeCacheWhen = negativeCacheWhen;
        this.negativeTtlMs = negativeTtlMs;
    }

    public T get(Supplier<Fetched<T>> fetcher) {
        CompletableFuture<T> future;
        boolean leader = false;

        synchronized (lock) {
            long now = clock.getAsLong();
            if (cachedValue != null && now < cachedUntil) {
                return cachedValue;
            }
            if (cachedFailure != null && now < failureUntil) {
                throw cachedFailure;
            }
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                leader = true;
            }
            future = inFlight;
        }

        if (leader) {
            fetchAsLeader(fetcher, future);
        }

        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(name + " fetch failed", cause);
        }
    }

    /**
     * Drop the cached value so the next call fetches again.
     */
    public void invalidate() {
        synchronized (lock) {
            cachedValue = null;
            cachedUntil = 0;
        }
    }

    private void fetchAsLeader(Supplier<Fetched<T>> fetcher, CompletableFuture<T> future) {
        try {
            Fetched<T> fetched = fetcher.get();
            synchronized (lock) {
                cachedValue = fetched.value();
                cachedUntil = fetched.validUntil();
                cachedFailure = null;
                inFlight = null;
            }
            future.complete(fetched.value());
        } catch (RuntimeException e) {
            synchronized (lock) {
                if (negativeCacheWhen.test(e)) {
                    cachedFailure = e;
                    failureUntil = clock.getAsLong() + negativeTtlMs;
                    log.warn("{} fetch failed, suppressing retries for {}ms: {}", name, negativeTtlMs, e.getMessage());
                }
                inFlight = null;
            }
            future.completeExceptionally(e);
        }
    }
}
