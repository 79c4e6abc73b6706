package io.relay.core.agent;

import io.relay.core.bus.UiEventBus;
import io.relay.core.permission.PermissionGate;
import io.relay.core.session.SessionRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide orchestration state: the running turns, pending permissions and the threads that
 * drive them. Built once at startup and closed at shutdown.
 */
public final class OrchestratorContext implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(OrchestratorContext.class);

    private final UiEventBus eventBus;
    private final SessionRegistry sessions;
    private final PermissionGate permissionGate;
    private final ExecutorService turnExecutor;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    public OrchestratorContext(
        UiEventBus eventBus,
        SessionRegistry sessions,
        PermissionGate permissionGate,
        ExecutorService turnExecutor,
        ScheduledExecutorService scheduler,
        Clock clock
    ) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus must not be null");
        this.sessions = Objects.requireNonNull(sessions, "sessions must not be null");
        this.permissionGate = Objects.requireNonNull(permissionGate, "permissionGate must not be null");
        this.turnExecutor = Objects.requireNonNull(turnExecutor, "turnExecutor must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static OrchestratorContext create(UiEventBus eventBus, Duration permissionTimeout, Clock clock) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(daemon("relay-timer"));
        Duration timeout = permissionTimeout == null ? PermissionGate.DEFAULT_TIMEOUT : permissionTimeout;
        return new OrchestratorContext(
            eventBus,
            new SessionRegistry(),
            new PermissionGate(eventBus, scheduler, timeout, clock),
            Executors.newCachedThreadPool(daemon("relay-turn")),
            scheduler,
            clock
        );
    }

    public UiEventBus eventBus() {
        return eventBus;
    }

    public SessionRegistry sessions() {
        return sessions;
    }

    public PermissionGate permissionGate() {
        return permissionGate;
    }

    public ExecutorService turnExecutor() {
        return turnExecutor;
    }

    public Clock clock() {
        return clock;
    }

    @Override
    public void close() {
        sessions.cancelAll();
        turnExecutor.shutdown();
        try {
            if (!turnExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Turns still running at shutdown, interrupting");
                turnExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            turnExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            scheduler.shutdownNow();
        }
    }

    private static ThreadFactory daemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
