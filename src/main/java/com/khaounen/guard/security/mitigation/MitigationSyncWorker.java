package com.khaounen.guard.security.mitigation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.khaounen.guard.security.reputation.ReputationLedger;
import com.khaounen.guard.security.reputation.SyncRecord;
import com.khaounen.guard.security.reputation.SyncStatus;
import com.khaounen.guard.security.store.StoreUnavailableException;
import com.khaounen.guard.security.telemetry.DecisionTelemetry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Drains the {@link MitigationQueue} into the {@link EdgeFirewall}.
 *
 * <p>Per identity only the newest generation is applied: a notification older than the last
 * applied one, or a replay of it, is skipped. Transient edge failures are retried with exponential
 * backoff, then recorded as a failed sync in the ledger. Nothing here ever reaches the decision
 * path.
 */
@Slf4j
public class MitigationSyncWorker implements AutoCloseable {

    private final MitigationQueue queue;
    private final EdgeFirewall firewall;
    private final ReputationLedger ledger;
    private final DecisionTelemetry telemetry;
    private final List<MitigationSyncListener> listeners;
    private final MitigationSettings settings;
    private final Clock clock;
    private final Cache<String, Applied> applied;
    private final Map<String, Long> ruleExpiry = new ConcurrentHashMap<>();
    private ScheduledExecutorService scheduler;
    private volatile boolean running;

    public MitigationSyncWorker(
            MitigationQueue queue,
            EdgeFirewall firewall,
            ReputationLedger ledger,
            DecisionTelemetry telemetry,
            List<MitigationSyncListener> listeners,
            MitigationSettings settings,
            Clock clock
    ) {
        this.queue = queue;
        this.firewall = firewall;
        this.ledger = ledger;
        this.telemetry = telemetry == null ? DecisionTelemetry.NOOP : telemetry;
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.settings = settings;
        this.clock = clock;
        this.applied = Caffeine.newBuilder()
                .expireAfterWrite(settings.appliedRetention())
                .maximumSize(settings.maxTrackedIdentities())
                .build();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        try {
            firewall.initialize();
        } catch (EdgeFirewallException ex) {
            log.warn("edge firewall initialization failed, starting with an empty rule cache: {}", ex.getMessage());
        }
        scheduler = Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "abuse-guard-mitigation");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.execute(this::drainLoop);
        long sweep = settings.sweepInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::sweepExpired, sweep, sweep, TimeUnit.MILLISECONDS);
    }

    private void drainLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                MitigationNotification notification = queue.poll(settings.pollInterval().toMillis(),
                        TimeUnit.MILLISECONDS);
                if (notification != null) {
                    process(notification);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException ex) {
                log.error("mitigation sync loop error", ex);
            }
        }
    }

    /**
     * Applies one notification synchronously.
     *
     * @return true if the edge now reflects the notification, false if it was skipped or failed
     */
    public boolean process(MitigationNotification notification) throws InterruptedException {
        String identity = notification.identity();
        Applied last = applied.getIfPresent(identity);
        if (last != null && last.supersedes(notification)) {
            log.debug("skipping {} generation {} for {}, generation {} already applied",
                    notification.action(), notification.generation(), identity, last.generation());
            return false;
        }
        markSync(identity, notification, SyncStatus.PENDING, null);

        EdgeFirewallException failure = null;
        for (int attempt = 1; attempt <= settings.maxAttempts(); attempt++) {
            try {
                apply(notification);
                failure = null;
                break;
            } catch (EdgeFirewallException ex) {
                failure = ex;
                if (!ex.isRetryable() || attempt == settings.maxAttempts()) {
                    break;
                }
                long delay = settings.backoffMillis(attempt);
                log.debug("edge {} for {} failed (attempt {}), retrying in {}ms: {}",
                        notification.action(), identity, attempt, delay, ex.getMessage());
                Thread.sleep(delay);
            }
        }

        if (failure != null) {
            log.warn("edge {} for {} generation {} failed: {}", notification.action(), identity,
                    notification.generation(), failure.getMessage());
            markSync(identity, notification, SyncStatus.FAILED, failure.getMessage());
            telemetry.mitigationSync(false);
            String error = failure.getMessage();
            notifyListeners(listener -> listener.onFailed(notification, error));
            return false;
        }

        applied.put(identity, new Applied(notification.generation(), notification.action()));
        if (notification.action() == MitigationAction.UPSERT && notification.ttl() != null) {
            ruleExpiry.put(identity, clock.millis() + notification.ttl().toMillis());
        } else {
            ruleExpiry.remove(identity);
        }
        markSync(identity, notification, SyncStatus.SYNCED, null);
        telemetry.mitigationSync(true);
        notifyListeners(listener -> listener.onSynced(notification));
        return true;
    }

    private void apply(MitigationNotification notification) throws EdgeFirewallException {
        if (notification.action() == MitigationAction.UPSERT) {
            firewall.upsertBlockRule(notification.identity(), notification.ttl());
        } else {
            firewall.removeBlockRule(notification.identity());
        }
    }

    /**
     * Removes edge rules whose TTL elapsed. Identities that simply stop sending never produce an
     * exit transition, so without this their rules would outlive the block.
     */
    public void sweepExpired() {
        long now = clock.millis();
        for (Map.Entry<String, Long> entry : ruleExpiry.entrySet()) {
            if (entry.getValue() > now) {
                continue;
            }
            String identity = entry.getKey();
            try {
                firewall.removeBlockRule(identity);
                ruleExpiry.remove(identity, entry.getValue());
                log.info("expired edge block for {} removed", identity);
            } catch (EdgeFirewallException ex) {
                log.warn("removing expired edge block for {} failed, will retry: {}", identity, ex.getMessage());
            } catch (RuntimeException ex) {
                log.error("sweep of {} failed", identity, ex);
            }
        }
    }

    private void markSync(String identity, MitigationNotification notification, SyncStatus status, String detail) {
        try {
            ledger.markSync(identity, new SyncRecord(notification.generation(), notification.action().name(),
                    status, clock.millis(), detail));
        } catch (StoreUnavailableException ex) {
            log.warn("could not record {} sync state for {}: {}", status, identity, ex.getMessage());
        }
    }

    private void notifyListeners(Consumer<MitigationSyncListener> call) {
        for (MitigationSyncListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException ex) {
                log.warn("mitigation listener {} failed: {}", listener.getClass().getSimpleName(), ex.getMessage());
            }
        }
    }

    long trackedIdentities() {
        applied.cleanUp();
        return applied.estimatedSize();
    }

    Duration expiresIn(String identity) {
        Long expiry = ruleExpiry.get(identity);
        return expiry == null ? null : Duration.ofMillis(expiry - clock.millis());
    }

    @Override
    public synchronized void close() {
        running = false;
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    private record Applied(long generation, MitigationAction action) {

        boolean supersedes(MitigationNotification notification) {
            return notification.generation() < generation
                    || (notification.generation() == generation && notification.action() == action);
        }
    }
}
