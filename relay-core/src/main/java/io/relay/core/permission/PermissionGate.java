package io.relay.core.permission;

import io.relay.core.bus.UiEvent;
import io.relay.core.bus.UiEventBus;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outstanding tool approval requests. Each request settles exactly once: by the operator, by the
 * timeout (as a denial) or by its turn stopping (exceptionally, with {@link AgentStoppedException}).
 */
public final class PermissionGate {
    private static final Logger LOG = LoggerFactory.getLogger(PermissionGate.class);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    private final UiEventBus eventBus;
    private final ScheduledExecutorService scheduler;
    private final Duration timeout;
    private final Clock clock;
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();

    public PermissionGate(UiEventBus eventBus, ScheduledExecutorService scheduler) {
        this(eventBus, scheduler, DEFAULT_TIMEOUT, Clock.systemUTC());
    }

    public PermissionGate(UiEventBus eventBus, ScheduledExecutorService scheduler, Duration timeout, Clock clock) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public CompletableFuture<PermissionDecision> request(
        String conversationId,
        String toolName,
        Map<String, Object> toolInput
    ) {
        Objects.requireNonNull(conversationId, "conversationId must not be null");
        Map<String, Object> input = toolInput == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(toolInput));
        String requestId = conversationId + "-" + UUID.randomUUID();
        PermissionRequest request = new PermissionRequest(requestId, conversationId, toolName, input, clock.instant());
        CompletableFuture<PermissionDecision> decision = new CompletableFuture<>();

        Pending entry = new Pending(request, decision);
        pending.put(requestId, entry);
        entry.timer = scheduler.schedule(() -> expire(requestId, entry), timeout.toMillis(), TimeUnit.MILLISECONDS);

        eventBus.publish(UiEvent.permissionRequest(conversationId, requestId, toolName, input));
        return decision;
    }

    /**
     * Blocks the calling turn until the request settles.
     *
     * @throws AgentStoppedException if the owning turn was stopped while waiting
     */
    public PermissionDecision await(String conversationId, String toolName, Map<String, Object> toolInput)
        throws InterruptedException {
        CompletableFuture<PermissionDecision> decision = request(conversationId, toolName, toolInput);
        try {
            return decision.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof AgentStoppedException stopped) {
                throw stopped;
            }
            throw new IllegalStateException("Permission request failed", e.getCause());
        }
    }

    public boolean resolve(String requestId, PermissionResponse response) {
        Objects.requireNonNull(response, "response must not be null");
        Pending entry = requestId == null ? null : pending.remove(requestId);
        if (entry == null) {
            LOG.warn("No pending permission for requestId: {}", requestId);
            return false;
        }
        entry.cancelTimer();
        if (response.approved()) {
            Map<String, Object> input = response.updatedInput() != null
                ? response.updatedInput()
                : entry.request.toolInput();
            entry.decision.complete(PermissionDecision.allow(input));
        } else {
            entry.decision.complete(PermissionDecision.deny(response.reason()));
        }
        return true;
    }

    /**
     * Rejects every pending request that belongs to the conversation.
     */
    public int cancel(String conversationId) {
        String prefix = conversationId + "-";
        int cancelled = 0;
        for (String requestId : new ArrayList<>(pending.keySet())) {
            if (!requestId.startsWith(prefix)) {
                continue;
            }
            Pending entry = pending.remove(requestId);
            if (entry != null) {
                entry.cancelTimer();
                entry.decision.completeExceptionally(new AgentStoppedException());
                cancelled++;
            }
        }
        if (cancelled > 0) {
            LOG.debug("Cancelled {} pending permission requests for {}", cancelled, conversationId);
        }
        return cancelled;
    }

    public List<PermissionRequest> pending() {
        return pending.values().stream().map(entry -> entry.request).toList();
    }

    public List<PermissionRequest> pending(String conversationId) {
        return pending().stream().filter(request -> request.conversationId().equals(conversationId)).toList();
    }

    private void expire(String requestId, Pending entry) {
        if (pending.remove(requestId, entry)) {
            LOG.warn("Permission request {} for {} timed out", requestId, entry.request.toolName());
            entry.decision.complete(PermissionDecision.timedOut());
        }
    }

    private static final class Pending {
        private final PermissionRequest request;
        private final CompletableFuture<PermissionDecision> decision;
        private volatile ScheduledFuture<?> timer;

        private Pending(PermissionRequest request, CompletableFuture<PermissionDecision> decision) {
            this.request = request;
            this.decision = decision;
        }

        private void cancelTimer() {
            ScheduledFuture<?> current = timer;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
