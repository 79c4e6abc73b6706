package io.relay.core.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.relay.core.backend.AgentBackend;
import io.relay.core.backend.BackendRouter;
import io.relay.core.backend.EventNormalizer;
import io.relay.core.backend.EventStream;
import io.relay.core.backend.TurnRequest;
import io.relay.core.backend.claude.ClaudeEventNormalizer;
import io.relay.core.turn.Turn;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Coding backend whose turns replay events the test pushes into a per-invocation script.
 */
final class ScriptedBackend implements AgentBackend {
    private static final Object END = new Object();

    private final ObjectMapper mapper = new ObjectMapper();
    private final Deque<BlockingQueue<Object>> scripts = new ConcurrentLinkedDeque<>();
    private final Map<String, BlockingQueue<Object>> active = new ConcurrentHashMap<>();
    private final Semaphore invocations = new Semaphore(0);
    private final AtomicInteger open = new AtomicInteger();
    final AtomicInteger maxOpen = new AtomicInteger();
    final List<TurnRequest> requests = new CopyOnWriteArrayList<>();
    volatile IOException failure;

    @FunctionalInterface
    interface Action {
        String run() throws Exception;
    }

    /** Script for the next invocation, prefilled with events. Call {@link #end} to finish it. */
    BlockingQueue<Object> script(String... events) {
        BlockingQueue<Object> script = new LinkedBlockingQueue<>();
        for (String event : events) {
            script.add(event);
        }
        scripts.addLast(script);
        return script;
    }

    BlockingQueue<Object> completedScript(String... events) {
        BlockingQueue<Object> script = script(events);
        end(script);
        return script;
    }

    static void end(BlockingQueue<Object> script) {
        script.add(END);
    }

    boolean awaitInvocation() throws InterruptedException {
        return awaitInvocation(5000);
    }

    boolean awaitInvocation(long millis) throws InterruptedException {
        return invocations.tryAcquire(millis, TimeUnit.MILLISECONDS);
    }

    /** Streams currently open, across all conversations. */
    int openStreams() {
        return open.get();
    }

    @Override
    public String name() {
        return BackendRouter.CODING;
    }

    @Override
    public EventStream invoke(TurnRequest request) throws IOException {
        requests.add(request);
        invocations.release();
        if (failure != null) {
            throw failure;
        }
        BlockingQueue<Object> script = scripts.pollFirst();
        BlockingQueue<Object> queue = script == null ? new LinkedBlockingQueue<>() : script;
        active.put(request.conversationId(), queue);
        maxOpen.accumulateAndGet(open.incrementAndGet(), Math::max);
        AtomicBoolean closed = new AtomicBoolean();
        return new EventStream() {
            private boolean ended;

            @Override
            public Optional<JsonNode> next() throws IOException {
                if (ended) {
                    return Optional.empty();
                }
                try {
                    Object item = queue.take();
                    if (item == END) {
                        ended = true;
                        return Optional.empty();
                    }
                    String line = item instanceof Action action ? action.run() : (String) item;
                    return Optional.of(mapper.readTree(line));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("interrupted");
                } catch (IOException | RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new UncheckedIOException(new IOException(e));
                }
            }

            @Override
            public void close() {
                if (closed.compareAndSet(false, true)) {
                    open.decrementAndGet();
                }
                active.remove(request.conversationId(), queue);
                queue.add(END);
            }
        };
    }

    @Override
    public EventNormalizer normalizer(Turn turn) {
        return new ClaudeEventNormalizer(turn, mapper, true);
    }

    @Override
    public void interrupt(String conversationId) {
        BlockingQueue<Object> queue = active.remove(conversationId);
        if (queue != null) {
            queue.add(END);
        }
    }
}
