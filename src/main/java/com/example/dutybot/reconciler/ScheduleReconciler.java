package com.example.dutybot.reconciler;

import com.example.dutybot.config.BotProperties;
import com.example.dutybot.domain.AggregatedState;
import com.example.dutybot.domain.DutyState;
import com.example.dutybot.domain.Transition;
import com.example.dutybot.notification.NotificationDispatcher;
import com.example.dutybot.provider.ProviderClient;
import com.example.dutybot.provider.ProviderException;
import com.example.dutybot.provider.ProviderRegistry;
import com.example.dutybot.provider.ProviderTimeoutException;
import com.example.dutybot.provider.ProviderUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Schedule Reconciler - keeps the authoritative {@link AggregatedState}.
 *
 * A scheduler ticks every second and polls each provider only when its own
 * poll interval has elapsed (or a refresh was requested for it). Due providers
 * are fetched concurrently; a failing provider keeps its last good state,
 * marked stale. The merged snapshot is published with a single reference swap
 * and the transitions against the previous snapshot go to the
 * {@link NotificationDispatcher}.
 */
@Slf4j
@Service
public class ScheduleReconciler {

    public enum Phase { IDLE, POLLING, MERGING, PUBLISHED }

    private final ProviderRegistry registry;
    private final NotificationDispatcher dispatcher;
    private final Executor providerExecutor;
    private final MeterRegistry meterRegistry;
    private final BotProperties properties;
    private final Clock clock;

    private final AtomicReference<AggregatedState> snapshot = new AtomicReference<>(AggregatedState.empty());
    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.IDLE);
    private final Map<String, Instant> lastPolledAt = new ConcurrentHashMap<>();
    private final Set<String> refreshRequested = ConcurrentHashMap.newKeySet();
    private volatile boolean ready = false;

    @Autowired
    public ScheduleReconciler(ProviderRegistry registry, NotificationDispatcher dispatcher,
                              @Qualifier("providerExecutor") Executor providerExecutor,
                              MeterRegistry meterRegistry, BotProperties properties) {
        this(registry, dispatcher, providerExecutor, meterRegistry, properties, Clock.systemUTC());
    }

    public ScheduleReconciler(ProviderRegistry registry, NotificationDispatcher dispatcher, Executor providerExecutor,
                              MeterRegistry meterRegistry, BotProperties properties, Clock clock) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.providerExecutor = providerExecutor;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Ticks often and polls each provider only when it is due, so every
     * provider's poll interval is honored independently.
     */
    @Scheduled(fixedDelayString = "${duty-bot.reconciler.tick-millis:1000}")
    public void tick() {
        if (!properties.getReconciler().isEnabled()) return;

        Instant now = clock.instant();
        List<ProviderClient> due = new ArrayList<>();
        for (ProviderClient client : registry.getClients()) {
            Instant last = lastPolledAt.get(client.providerId());
            if (last == null
                    || refreshRequested.contains(client.providerId())
                    || !now.isBefore(last.plus(client.config().pollInterval()))) {
                due.add(client);
            }
        }
        if (due.isEmpty()) return;

        try {
            reconcile(due);
        } catch (RuntimeException e) {
            log.error("Reconciliation cycle failed: {}", e.getMessage(), e);
        }
    }

    /**
     * One Polling → Merging → Published cycle over the given clients.
     * Single writer: cycles never overlap.
     *
     * @return the transitions handed to the dispatcher
     */
    public synchronized List<Transition> reconcile(List<ProviderClient> due) {
        phase.set(Phase.POLLING);
        try {
            Instant cycleStart = clock.instant();
            due.forEach(client -> {
                refreshRequested.remove(client.providerId());
                lastPolledAt.put(client.providerId(), cycleStart);
            });

            Map<String, CompletableFuture<DutyState>> futures = new LinkedHashMap<>();
            for (ProviderClient client : due) {
                futures.put(client.providerId(), CompletableFuture
                        .supplyAsync(() -> timedFetch(client), providerExecutor)
                        .orTimeout(fetchTimeout(client).toMillis(), TimeUnit.MILLISECONDS));
            }

            phase.set(Phase.MERGING);
            AggregatedState previous = snapshot.get();
            Map<String, DutyState> merged = new LinkedHashMap<>(previous.states());
            boolean anySuccess = false;
            for (Map.Entry<String, CompletableFuture<DutyState>> entry : futures.entrySet()) {
                String providerId = entry.getKey();
                try {
                    merged.put(providerId, entry.getValue().join());
                    anySuccess = true;
                } catch (CompletionException e) {
                    ProviderException failure = unwrap(providerId, e.getCause());
                    DutyState lastGood = previous.states().get(providerId);
                    if (lastGood != null) {
                        merged.put(providerId, lastGood.withStale(true));
                        log.warn("Provider {} failed ({}), keeping last known duty {} as stale: {}",
                                providerId, failure.reason(), lastGood.person().id(), failure.getMessage());
                    } else {
                        log.warn("Provider {} failed ({}) before any successful fetch: {}",
                                providerId, failure.reason(), failure.getMessage());
                    }
                }
            }

            Instant now = clock.instant();
            Instant observedAt = now.isBefore(previous.observedAt()) ? previous.observedAt() : now;
            AggregatedState next = new AggregatedState(merged, observedAt);
            List<Transition> transitions = next.diff(previous);

            snapshot.set(next);
            phase.set(Phase.PUBLISHED);
            if (anySuccess && !ready) {
                ready = true;
                log.info("First successful reconciliation completed, duty bot is ready");
            }

            for (Transition transition : transitions) {
                log.info("Duty transition on {}: {} -> {} (revision {})", transition.providerId(),
                        transition.previous() != null ? transition.previous().person().id() : "<none>",
                        transition.current().person().id(), transition.current().sourceRevision());
            }
            dispatcher.notifyEach(transitions);
            return transitions;
        } finally {
            phase.set(Phase.IDLE);
        }
    }

    public List<Transition> reconcileAll() {
        return reconcile(new ArrayList<>(registry.getClients()));
    }

    private DutyState timedFetch(ProviderClient client) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            return client.fetch();
        } catch (ProviderException e) {
            outcome = e.reason();
            throw e;
        } catch (RuntimeException e) {
            outcome = "error";
            throw new ProviderUnavailableException(client.providerId(), "Unexpected failure: " + e.getMessage(), e);
        } finally {
            sample.stop(Timer.builder("dutybot.provider.fetch")
                    .tag("provider", client.providerId())
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }

    /**
     * The whole cycle is bounded by the slowest of these.
     */
    private Duration fetchTimeout(ProviderClient client) {
        return client.fetchBudget().plusSeconds(properties.getReconciler().getCycleTimeoutMarginSeconds());
    }

    private static ProviderException unwrap(String providerId, Throwable cause) {
        if (cause instanceof ProviderException providerException) {
            return providerException;
        }
        if (cause instanceof TimeoutException) {
            return new ProviderTimeoutException(providerId, "Cycle timeout exceeded", cause);
        }
        return new ProviderUnavailableException(providerId, String.valueOf(cause), cause);
    }

    /**
     * Marks a provider due on the next tick. Push-style provider events use this,
     * so they go through the same fetch, merge and diff path as polling.
     *
     * @return false for unknown providers
     */
    public boolean requestRefresh(String providerId) {
        if (!registry.contains(providerId)) {
            return false;
        }
        refreshRequested.add(providerId);
        log.info("Refresh requested for provider {}", providerId);
        return true;
    }

    /**
     * Lock-free read of the latest published snapshot.
     */
    public AggregatedState getSnapshot() {
        return snapshot.get();
    }

    public boolean isReady() {
        return ready;
    }

    public Phase getPhase() {
        return phase.get();
    }
}
