package com.example.dutybot.notification;

import com.example.dutybot.config.BotProperties;
import com.example.dutybot.config.DutyConfig;
import com.example.dutybot.config.SinkConfig;
import com.example.dutybot.domain.Transition;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Notification Dispatcher - delivers duty transitions to every configured sink.
 *
 * Transitions are coalesced per provider: while a delivery for a lane is pending,
 * a newer transition replaces it, so only the latest duty is ever announced.
 * A lane that flickers and settles back before delivery produces no notification.
 * Transient sink failures are retried with exponential backoff, permanent ones
 * are logged and counted.
 */
@Slf4j
@Service
public class NotificationDispatcher {

    public enum NotifyResult { QUEUED, COALESCED }

    private final List<NotificationSink> sinks;
    private final Executor dispatchExecutor;
    private final MeterRegistry meterRegistry;
    private final Duration shutdownTimeout;

    private final Map<String, Transition> pending = new ConcurrentHashMap<>();
    private final Set<String> draining = ConcurrentHashMap.newKeySet();
    private volatile Instant abandonAfter;

    @Autowired
    public NotificationDispatcher(DutyConfig dutyConfig, BotProperties properties, OkHttpClient httpClient,
                                  ObjectMapper objectMapper, @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                                  MeterRegistry meterRegistry) {
        this(createSinks(dutyConfig, httpClient, objectMapper), dispatchExecutor, meterRegistry,
                Duration.ofSeconds(properties.getDispatcher().getShutdownTimeoutSeconds()));
    }

    public NotificationDispatcher(List<NotificationSink> sinks, Executor dispatchExecutor,
                                  MeterRegistry meterRegistry, Duration shutdownTimeout) {
        this.sinks = List.copyOf(sinks);
        this.dispatchExecutor = dispatchExecutor;
        this.meterRegistry = meterRegistry;
        this.shutdownTimeout = shutdownTimeout;
        log.info("Notification dispatcher ready with {} sink(s): {}",
                this.sinks.size(), this.sinks.stream().map(NotificationSink::name).toList());
    }

    private static List<NotificationSink> createSinks(DutyConfig dutyConfig, OkHttpClient httpClient,
                                                      ObjectMapper objectMapper) {
        List<NotificationSink> sinks = new ArrayList<>();
        for (SinkConfig sink : dutyConfig.sinks()) {
            sinks.add(sink.kind().createSink(sink, dutyConfig, httpClient, objectMapper));
        }
        return sinks;
    }

    /**
     * Hands a transition over for asynchronous delivery.
     *
     * @return COALESCED if it was merged into a transition of the same lane that had not been delivered yet
     */
    public NotifyResult notify(Transition transition) {
        String providerId = transition.providerId();
        boolean[] merged = {false};
        pending.merge(providerId, transition, (older, newer) -> {
            merged[0] = true;
            return older.coalesceWith(newer);
        });
        if (merged[0]) {
            log.debug("Coalesced pending transition for {}", providerId);
            Counter.builder("dutybot.dispatch.coalesced")
                    .tag("provider", providerId)
                    .register(meterRegistry)
                    .increment();
        }
        schedule(providerId);
        return merged[0] ? NotifyResult.COALESCED : NotifyResult.QUEUED;
    }

    public void notifyEach(List<Transition> transitions) {
        transitions.forEach(this::notify);
    }

    private void schedule(String providerId) {
        if (!draining.add(providerId)) {
            return;
        }
        try {
            dispatchExecutor.execute(() -> drain(providerId));
        } catch (RejectedExecutionException e) {
            draining.remove(providerId);
            log.error("Dispatch executor rejected delivery for {}: {}", providerId, e.getMessage());
        }
    }

    private void drain(String providerId) {
        try {
            Transition next;
            while ((next = pending.remove(providerId)) != null) {
                if (next.isNoop()) {
                    log.info("Duty for {} settled back to {}, nothing to announce",
                            providerId, next.current().person().id());
                    continue;
                }
                deliver(next);
            }
        } finally {
            draining.remove(providerId);
        }
        if (pending.containsKey(providerId)) {
            schedule(providerId);
        }
    }

    /**
     * Sends one transition to every sink, synchronously.
     *
     * @return number of sinks that acknowledged the delivery
     */
    public int deliver(Transition transition) {
        log.info("Announcing duty change for {}: {} -> {}", transition.providerId(),
                transition.previous() != null ? transition.previous().person().id() : "<none>",
                transition.current().person().id());
        int delivered = 0;
        for (NotificationSink sink : sinks) {
            if (deliverWithRetry(sink, transition)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliverWithRetry(NotificationSink sink, Transition transition) {
        RetryPolicy policy = sink.config().retryPolicy();
        while (true) {
            try {
                sink.deliver(transition);
                Counter.builder("dutybot.dispatch.delivered")
                        .tag("sink", sink.name())
                        .register(meterRegistry)
                        .increment();
                return true;
            } catch (DispatchException e) {
                Duration delay = policy.getNextDelay();
                policy.recordFailure();
                if (!e.isTransient()) {
                    log.error("Permanent delivery failure, dropping notification: {}", e.getMessage());
                    recordFailure(sink, "permanent");
                    return false;
                }
                if (!policy.shouldRetry()) {
                    log.error("Giving up after {} attempts: {}", policy.getAttemptCount(), e.getMessage());
                    recordFailure(sink, "exhausted");
                    return false;
                }
                Instant deadline = abandonAfter;
                if (deadline != null && Instant.now().plus(delay).isAfter(deadline)) {
                    log.warn("Shutting down, abandoning retries for {}: {}", sink.name(), e.getMessage());
                    recordFailure(sink, "shutdown");
                    return false;
                }
                log.warn("Delivery attempt {}/{} failed, retrying in {}ms: {}",
                        policy.getAttemptCount(), policy.getMaxAttempts(), delay.toMillis(), e.getMessage());
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while retrying {}, notification abandoned", sink.name());
                    recordFailure(sink, "interrupted");
                    return false;
                }
            }
        }
    }

    private void recordFailure(NotificationSink sink, String reason) {
        Counter.builder("dutybot.dispatch.failed")
                .tag("sink", sink.name())
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public int getPendingCount() {
        return pending.size();
    }

    public int getSinkCount() {
        return sinks.size();
    }

    /**
     * In-flight retries may continue until the shutdown timeout, then they are abandoned.
     * The dispatch executor itself waits for the same amount of time.
     */
    @PreDestroy
    public void shutdown() {
        abandonAfter = Instant.now().plus(shutdownTimeout);
        if (!pending.isEmpty() || !draining.isEmpty()) {
            log.info("Draining {} pending notification(s) for up to {}s",
                    pending.size() + draining.size(), shutdownTimeout.toSeconds());
        }
    }
}
