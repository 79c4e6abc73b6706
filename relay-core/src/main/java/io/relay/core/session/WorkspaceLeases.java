package io.relay.core.session;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exclusive use of a directory by one turn at a time. Turns that find the directory taken wait
 * until it is released or they are cancelled.
 */
public final class WorkspaceLeases {
    private static final Logger LOG = LoggerFactory.getLogger(WorkspaceLeases.class);
    private static final Duration POLL_INTERVAL = Duration.ofMillis(50);

    private final Map<Path, Semaphore> locks = new ConcurrentHashMap<>();

    /**
     * Blocks until the directory is free. Empty when the token was cancelled while waiting.
     */
    public Optional<Lease> acquire(Path directory, CancellationToken cancellation) throws InterruptedException {
        Path key = normalize(directory);
        Semaphore lock = locks.computeIfAbsent(key, ignored -> new Semaphore(1));
        boolean waiting = false;
        while (!cancellation.isCancelled()) {
            if (lock.tryAcquire(POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
                if (cancellation.isCancelled()) {
                    lock.release();
                    return Optional.empty();
                }
                return Optional.of(new Lease(key, lock));
            }
            if (!waiting) {
                LOG.info("Waiting for another turn to release {}", key);
                waiting = true;
            }
        }
        return Optional.empty();
    }

    public boolean isHeld(Path directory) {
        Semaphore lock = locks.get(normalize(directory));
        return lock != null && lock.availablePermits() == 0;
    }

    private static Path normalize(Path directory) {
        return Objects.requireNonNull(directory, "directory must not be null").toAbsolutePath().normalize();
    }

    public static final class Lease implements AutoCloseable {
        private final Path directory;
        private final Semaphore lock;
        private final AtomicBoolean released = new AtomicBoolean();

        private Lease(Path directory, Semaphore lock) {
            this.directory = directory;
            this.lock = lock;
        }

        public Path directory() {
            return directory;
        }

        public boolean covers(Path other) {
            return directory.equals(normalize(other));
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                lock.release();
            }
        }
    }
}
