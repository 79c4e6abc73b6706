package io.relay.core.session;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class TurnHandle {
    private final String conversationId;
    private final String turnId;
    private final CancellationToken cancellation;
    private final CompletableFuture<Void> finished;
    private volatile TurnHandle superseded;

    TurnHandle(String conversationId, TurnHandle superseded) {
        this.conversationId = Objects.requireNonNull(conversationId, "conversationId must not be null");
        this.turnId = UUID.randomUUID().toString();
        this.cancellation = new CancellationToken();
        this.finished = new CompletableFuture<>();
        this.superseded = superseded;
    }

    public String conversationId() {
        return conversationId;
    }

    public String turnId() {
        return turnId;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public boolean cancel() {
        return cancellation.cancel();
    }

    /**
     * Marks the turn as past the point where a stop can take effect. False if it was stopped first.
     */
    public boolean beginFinalizing() {
        return cancellation.seal();
    }

    /** The turn this handle replaced, if one was still running when it was installed. */
    public Optional<TurnHandle> superseded() {
        return Optional.ofNullable(superseded);
    }

    public void releaseSuperseded() {
        superseded = null;
    }

    public void markFinished() {
        finished.complete(null);
    }

    public boolean isFinished() {
        return finished.isDone();
    }

    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        try {
            finished.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return true;
        }
    }
}
