package io.relay.core.backend;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class BackendRegistry {
    private final Map<String, AgentBackend> backends = new ConcurrentHashMap<>();

    public void register(AgentBackend backend) {
        backends.put(normalize(backend.name()), backend);
    }

    public Optional<AgentBackend> find(String name) {
        return Optional.ofNullable(backends.get(normalize(name)));
    }

    public Collection<AgentBackend> all() {
        return List.copyOf(backends.values());
    }

    static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase().replace('-', '_');
    }
}
