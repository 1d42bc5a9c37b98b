package com.trelloreport.weekly.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-window gate for outbound Trello calls.
 *
 * At most {@code maxRequests} permits are handed out within any trailing {@code window}.
 * Callers queue on a fair lock, so they are admitted in arrival order. The thread at the
 * head of the queue sleeps while holding the lock until the oldest dispatch leaves the
 * window; nobody behind it could be admitted earlier anyway.
 *
 * One instance is shared by every request made through a {@link TrelloApiClient}.
 */
@Slf4j
public class RequestRateLimiter {

    private final int maxRequests;
    private final long windowNanos;

    /** Dispatch times (System.nanoTime) within the trailing window, oldest first. Guarded by lock. */
    private final Deque<Long> dispatched = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock(true);

    public RequestRateLimiter(int maxRequests, Duration window) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1, got " + maxRequests);
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive, got " + window);
        }
        this.maxRequests = maxRequests;
        this.windowNanos = window.toNanos();
    }

    /**
     * Block until a request may be dispatched, then claim the slot.
     *
     * @throws InterruptedException if the thread is interrupted while queued; no slot is claimed
     */
    public void acquire() throws InterruptedException {
        acquirePermit();
    }

    /**
     * Same as {@link #acquire()} but returns the nanoTime recorded for the dispatch.
     */
    long acquirePermit() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                long now = System.nanoTime();
                evictExpired(now);
                if (dispatched.size() < maxRequests) {
                    dispatched.addLast(now);
                    return now;
                }
                long waitNanos = dispatched.peekFirst() + windowNanos - now;
                log.trace("Rate limit reached ({} in window), waiting {} ms",
                        maxRequests, TimeUnit.NANOSECONDS.toMillis(waitNanos));
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            }
        } finally {
            lock.unlock();
        }
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    private void evictExpired(long now) {
        while (!dispatched.isEmpty() && now - dispatched.peekFirst() >= windowNanos) {
            dispatched.removeFirst();
        }
    }
}
