package com.khaounen.guard.security.mitigation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off between the decision path and the sync worker. {@link #enqueue} never blocks;
 * a notification whose key was already accepted is dropped as a duplicate.
 */
@Slf4j
public class MitigationQueue {

    private final BlockingQueue<MitigationNotification> queue;
    private final Cache<String, Boolean> accepted;

    public MitigationQueue(int capacity, Duration dedupeRetention) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.accepted = Caffeine.newBuilder()
                .expireAfterWrite(dedupeRetention)
                .maximumSize(Math.max(1_000L, capacity * 10L))
                .build();
    }

    /**
     * @return true if the notification was queued, false for a duplicate or a full queue
     */
    public boolean enqueue(MitigationNotification notification) {
        String key = notification.dedupeKey();
        if (accepted.asMap().putIfAbsent(key, Boolean.TRUE) != null) {
            log.debug("mitigation {} already queued", key);
            return false;
        }
        if (!queue.offer(notification)) {
            accepted.invalidate(key);
            log.warn("mitigation queue full, dropped {} for {}; the expired-block sweep will reconcile",
                    notification.action(), notification.identity());
            return false;
        }
        return true;
    }

    public MitigationNotification poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public MitigationNotification poll() {
        return queue.poll();
    }

    public int size() {
        return queue.size();
    }
}
