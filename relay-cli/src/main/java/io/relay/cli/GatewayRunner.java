package io.relay.cli;

@FunctionalInterface
public interface GatewayRunner {
    /**
     * Runs the gateway until shutdown.
     *
     * @param portOverride port to bind, or null for the configured one
     */
    int run(Integer portOverride) throws Exception;
}
