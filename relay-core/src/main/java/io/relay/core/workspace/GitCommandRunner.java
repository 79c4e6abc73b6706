package io.relay.core.workspace;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

public class GitCommandRunner {
    private final String executable;
    private final Duration timeout;

    public GitCommandRunner() {
        this("git", Duration.ofSeconds(10));
    }

    public GitCommandRunner(String executable, Duration timeout) {
        this.executable = executable;
        this.timeout = timeout;
    }

    public GitResult run(Path directory, String... args) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(List.of(args));
        Process process = new ProcessBuilder(command)
            .directory(directory.toFile())
            .redirectErrorStream(true)
            .start();
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new IOException("git " + args[0] + " timed out after " + timeout.toSeconds() + "s");
            }
            return new GitResult(process.exitValue(), output.join().trim());
        } catch (InterruptedException ie) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("git " + args[0] + " interrupted", ie);
        }
    }

    /**
     * Runs the command and fails unless it exits with 0.
     */
    public String require(Path directory, String... args) throws IOException {
        GitResult result = run(directory, args);
        if (!result.ok()) {
            throw new IOException("git " + String.join(" ", args) + " failed (" + result.exitCode() + "): " + result.output());
        }
        return result.output();
    }

    private static String readAll(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public record GitResult(int exitCode, String output) {
        public boolean ok() {
            return exitCode == 0;
        }
    }
}
