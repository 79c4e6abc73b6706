package io.relay.core.backend.research;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;

/**
 * Saves a research report as markdown and returns its path relative to the working directory.
 */
public final class ResearchOutputWriter {
    private static final int SLUG_LENGTH = 50;

    private final String outputDirectory;

    public ResearchOutputWriter(String outputDirectory) {
        this.outputDirectory = outputDirectory == null || outputDirectory.isBlank() ? "research" : outputDirectory;
    }

    public String write(Path workingDirectory, String query, String content, Instant now) throws IOException {
        Path configured = Path.of(outputDirectory);
        Path directory = configured.isAbsolute() ? configured : workingDirectory.resolve(configured);
        Files.createDirectories(directory);

        Path file = directory.resolve(fileName(query, now));
        String document = "# Research: " + query + "\n\n"
            + "Generated: " + now + "\n"
            + "Model: OpenAI Deep Research\n\n"
            + "---\n\n"
            + content + "\n";
        Files.writeString(file, document);
        return workingDirectory.toAbsolutePath().normalize()
            .relativize(file.toAbsolutePath().normalize())
            .toString();
    }

    static String fileName(String query, Instant now) {
        String timestamp = now.toString().replaceAll("[:.]", "-");
        if (timestamp.length() > 19) {
            timestamp = timestamp.substring(0, 19);
        }
        return timestamp + "-" + slug(query) + ".md";
    }

    static String slug(String query) {
        String slug = (query == null ? "" : query)
            .toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("^-+|-+$", "");
        if (slug.length() > SLUG_LENGTH) {
            slug = slug.substring(0, SLUG_LENGTH);
        }
        return slug.isEmpty() ? "research" : slug;
    }
}
