package io.relay.core.bus;

import java.util.Optional;

public interface UiEventBus {
    void publish(UiEvent event);

    Optional<UiEvent> poll();
}
