package io.relay.core.backend.claude;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.relay.core.backend.BackendException;
import io.relay.core.backend.EventStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads NDJSON events from a child process's stdout. A non-zero exit surfaces as a
 * {@link BackendException} carrying the tail of stderr.
 */
class ProcessEventStream implements EventStream {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessEventStream.class);
    private static final int STDERR_TAIL = 2000;

    private final String label;
    private final Process process;
    private final Reader stdout;
    private final NdjsonDecoder decoder;
    private final Deque<JsonNode> pending = new ArrayDeque<>();
    private final StringBuilder stderrTail = new StringBuilder();
    private final Thread stderrPump;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Consumer<ProcessEventStream> onClose;
    private final char[] chunk = new char[8192];
    private boolean exhausted;
    private boolean exitChecked;

    ProcessEventStream(String label, Process process, ObjectMapper mapper, Consumer<ProcessEventStream> onClose) {
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.process = Objects.requireNonNull(process, "process must not be null");
        this.stdout = new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8);
        this.decoder = new NdjsonDecoder(mapper);
        this.onClose = onClose == null ? stream -> { } : onClose;
        this.stderrPump = new Thread(this::pumpStderr, label + "-stderr");
        this.stderrPump.setDaemon(true);
        this.stderrPump.start();
    }

    @Override
    public Optional<JsonNode> next() throws IOException {
        while (pending.isEmpty() && !exhausted) {
            int read = readChunk();
            if (read < 0) {
                exhausted = true;
                pending.addAll(decoder.flush());
            } else {
                pending.addAll(decoder.feed(new String(chunk, 0, read)));
            }
        }
        JsonNode event = pending.pollFirst();
        if (event != null) {
            return Optional.of(event);
        }
        if (!exitChecked && !closed.get()) {
            exitChecked = true;
            checkExit();
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (process.isAlive()) {
            LOG.debug("Destroying {} process {}", label, process.pid());
            process.destroy();
        }
        try {
            stdout.close();
        } catch (IOException e) {
            LOG.debug("Closing {} stdout failed: {}", label, e.getMessage());
        }
        onClose.accept(this);
    }

    protected Process process() {
        return process;
    }

    protected boolean isClosed() {
        return closed.get();
    }

    private int readChunk() throws IOException {
        try {
            return stdout.read(chunk);
        } catch (IOException e) {
            if (closed.get()) {
                return -1;
            }
            throw new BackendException(label + " stream failed: " + e.getMessage(), e);
        }
    }

    private void checkExit() throws IOException {
        int exitCode;
        try {
            if (!process.waitFor(10, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new BackendException(label + " did not exit after closing its output");
            }
            exitCode = process.exitValue();
            stderrPump.join(TimeUnit.SECONDS.toMillis(2));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException(label + " interrupted while waiting for exit");
        }
        if (exitCode != 0) {
            String tail = stderrTail();
            throw new BackendException(
                label + " exited with code " + exitCode + (tail.isBlank() ? "" : ": " + tail.strip())
            );
        }
    }

    private void pumpStderr() {
        try (BufferedReader reader = new BufferedReader(
            new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8)
        )) {
            String line;
            while ((line = reader.readLine()) != null) {
                LOG.debug("[{} stderr] {}", label, line);
                synchronized (stderrTail) {
                    stderrTail.append(line).append('\n');
                    if (stderrTail.length() > STDERR_TAIL) {
                        stderrTail.delete(0, stderrTail.length() - STDERR_TAIL);
                    }
                }
            }
        } catch (IOException e) {
            LOG.debug("{} stderr closed: {}", label, e.getMessage());
        }
    }

    private String stderrTail() {
        synchronized (stderrTail) {
            return stderrTail.toString();
        }
    }
}
