package io.relay.core.bus;

import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;

public final class InMemoryUiEventBus implements UiEventBus {
    private final ConcurrentLinkedQueue<UiEvent> queue = new ConcurrentLinkedQueue<>();

    @Override
    public void publish(UiEvent event) {
        queue.offer(event);
    }

    @Override
    public Optional<UiEvent> poll() {
        return Optional.ofNullable(queue.poll());
    }
}
