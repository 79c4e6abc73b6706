package io.relay.core.api;

import io.relay.core.bus.UiEvent;

/**
 * Turns bus events into WebSocket frames; the frame type is the event's wire name.
 */
final class UiEventFrameMapper {

    GatewayServer.WsOutboundMessage map(UiEvent event) {
        return new GatewayServer.WsOutboundMessage(
            event.type().wireName(),
            event.conversationId(),
            event.agentId(),
            event.payload(),
            null,
            null,
            event.timestamp() == null ? null : event.timestamp().toString()
        );
    }
}
