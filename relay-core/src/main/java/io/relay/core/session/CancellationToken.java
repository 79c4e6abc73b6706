package io.relay.core.session;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CancellationToken {
    private static final Logger LOG = LoggerFactory.getLogger(CancellationToken.class);

    private static final int OPEN = 0;
    private static final int CANCELLED = 1;
    private static final int SEALED = 2;

    private final AtomicInteger state = new AtomicInteger(OPEN);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * Trips the token and runs registered callbacks once. Returns false if it was already tripped
     * or sealed.
     */
    public boolean cancel() {
        if (!state.compareAndSet(OPEN, CANCELLED)) {
            return false;
        }
        for (Runnable callback : callbacks) {
            run(callback);
        }
        return true;
    }

    public boolean isCancelled() {
        return state.get() == CANCELLED;
    }

    /**
     * Refuses any later cancel. Returns false if the token had already been cancelled.
     */
    public boolean seal() {
        return state.compareAndSet(OPEN, SEALED) || state.get() == SEALED;
    }

    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            run(callback);
        }
    }

    private void run(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.warn("Cancellation callback failed: {}", e.getMessage());
        }
    }
}
