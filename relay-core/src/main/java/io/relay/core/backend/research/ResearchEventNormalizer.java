package io.relay.core.backend.research;

import com.fasterxml.jackson.databind.JsonNode;
import io.relay.core.backend.BackendException;
import io.relay.core.backend.EventNormalizer;
import io.relay.core.bus.UiEvent;
import io.relay.core.model.Message;
import io.relay.core.model.MessageType;
import io.relay.core.model.ResearchPhase;
import io.relay.core.model.ResearchSource;
import io.relay.core.turn.Turn;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks a deep research run through its phases and turns the final report into a saved,
 * committed markdown file.
 */
public final class ResearchEventNormalizer implements EventNormalizer {
    private static final Logger LOG = LoggerFactory.getLogger(ResearchEventNormalizer.class);
    static final String STOPPED = "Research stopped by user";
    static final String SAVE_TOOL = "ResearchSave";
    private static final int PROGRESS_EVERY = 5;
    private static final int COMMIT_SUMMARY_LENGTH = 50;

    private final Turn turn;
    private final ResearchOutputWriter outputWriter;
    private final List<ResearchSource> sources = new ArrayList<>();
    private ResearchPhase phase = ResearchPhase.ANALYZING;
    private int searchCount;
    private String completedText;

    public ResearchEventNormalizer(Turn turn, ResearchOutputWriter outputWriter) {
        this.turn = Objects.requireNonNull(turn, "turn must not be null");
        this.outputWriter = Objects.requireNonNull(outputWriter, "outputWriter must not be null");
    }

    @Override
    public void onStart() throws IOException {
        progress(ResearchPhase.ANALYZING, "Analyzing your research question...", false);
    }

    @Override
    public void onEvent(JsonNode event) throws IOException {
        String type = event.path("type").asText("");
        switch (type) {
            case "response.output_text.delta" -> onText(event.path("delta").asText(""));
            case "response.content_part.delta" -> onText(event.path("delta").path("text").asText(""));
            case "response.web_search_call.searching" -> onSearch(event);
            case "response.web_search_call.completed" -> addPage(event.path("url").asText(""), event.path("title").asText(null));
            case "response.output_item.added" -> onItemAdded(event.path("item"));
            case "response.output_item.done" -> onItemDone(event.path("item"));
            case "response.output_text.annotation.added" -> addAnnotation(event.path("annotation"));
            case "response.completed" -> onCompleted(event.path("response"));
            case "response.failed" -> throw new BackendException(
                "Research failed: " + event.path("response").path("error").path("message").asText("unknown error")
            );
            case "error" -> throw new BackendException("Research failed: " + event.path("message").asText("unknown error"));
            default -> LOG.debug("Ignoring research event {}", type);
        }
    }

    @Override
    public void onComplete() throws IOException {
        String report = completedText != null && !completedText.isBlank() ? completedText : turn.streamedText();
        String query = turn.userMessage();
        int wordCount = wordCount(report);
        int sourceCount = (int) sources.stream().filter(ResearchSource::hasUrl).count();
        long durationMs = Duration.between(turn.startedAt(), turn.now()).toMillis();

        String outputPath = outputWriter.write(turn.workingDirectory().path(), query, report, turn.now());
        turn.touch(outputPath);
        turn.persist(Message.researchResult(
            report,
            searchCount,
            sources,
            outputPath,
            wordCount,
            sourceCount,
            durationMs,
            turn.now()
        ));
        turn.emit(UiEvent.researchComplete(turn.conversationId(), outputPath, report));
        turn.emit(UiEvent.fileChanged(turn.conversationId(), outputPath, SAVE_TOOL));
        turn.commit(commitMessage(query, outputPath), List.of(outputPath));
        if (isFirstResearch()) {
            turn.applyTitle();
        }
        turn.persist(Message.system("Research complete. Saved to: " + outputPath, turn.now()));
    }

    @Override
    public String stoppedMessage() {
        return STOPPED;
    }

    static String commitMessage(String query, String outputPath) {
        String summary = query.length() > COMMIT_SUMMARY_LENGTH
            ? query.substring(0, COMMIT_SUMMARY_LENGTH) + "..."
            : query;
        return "[Deep Research] " + summary + "\n\nOutput: " + outputPath;
    }

    static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.strip().split("\\s+").length;
    }

    private boolean isFirstResearch() {
        return turn.history().stream()
            .noneMatch(message -> message.type() == MessageType.ASSISTANT || message.type() == MessageType.RESEARCH_RESULT);
    }

    private void onText(String delta) throws IOException {
        if (delta.isEmpty()) {
            return;
        }
        if (phase != ResearchPhase.SYNTHESIZING) {
            phase = ResearchPhase.SYNTHESIZING;
            progress(ResearchPhase.SYNTHESIZING, "Synthesizing findings from " + searchCount + " searches...", true);
        }
        turn.appendText(delta);
    }

    private void onSearch(JsonNode event) throws IOException {
        searchCount++;
        phase = ResearchPhase.SEARCHING;
        String query = event.path("query").asText("");
        if (!query.isBlank()) {
            sources.add(ResearchSource.ofQuery(query));
        }
        if (searchCount == 1 || searchCount % PROGRESS_EVERY == 0) {
            progress(ResearchPhase.SEARCHING, "Searching the web... (" + searchCount + " searches)", true);
        }
        if (searchCount == 1) {
            turn.streamOnly("Searching the web...\n");
        }
    }

    private void onItemAdded(JsonNode item) throws IOException {
        if (!"reasoning".equals(item.path("type").asText())) {
            return;
        }
        if (phase != ResearchPhase.REASONING) {
            phase = ResearchPhase.REASONING;
            long elapsed = Duration.between(turn.startedAt(), turn.now()).toSeconds();
            progress(ResearchPhase.REASONING, "Reasoning about findings... (" + elapsed + "s elapsed)", false);
        }
        if (searchCount == 0) {
            turn.streamOnly("Analyzing your question...\n");
        }
    }

    private void onItemDone(JsonNode item) {
        if (!"web_search_call".equals(item.path("type").asText())) {
            return;
        }
        String query = item.path("action").path("query").asText("");
        boolean known = sources.stream().anyMatch(source -> query.equals(source.query()));
        if (!query.isBlank() && !known) {
            sources.add(ResearchSource.ofQuery(query));
        }
    }

    private void onCompleted(JsonNode response) {
        StringBuilder text = new StringBuilder();
        for (JsonNode item : response.path("output")) {
            if (!"message".equals(item.path("type").asText())) {
                continue;
            }
            for (JsonNode part : item.path("content")) {
                if ("output_text".equals(part.path("type").asText())) {
                    text.append(part.path("text").asText(""));
                    part.path("annotations").forEach(this::addAnnotation);
                }
            }
        }
        if (text.length() > 0) {
            completedText = text.toString();
        }
    }

    private void addAnnotation(JsonNode annotation) {
        if ("url_citation".equals(annotation.path("type").asText())) {
            addPage(annotation.path("url").asText(""), annotation.path("title").asText(null));
        }
    }

    private void addPage(String url, String title) {
        if (url == null || url.isBlank()) {
            return;
        }
        boolean known = sources.stream().anyMatch(source -> url.equals(source.url()));
        if (!known) {
            sources.add(ResearchSource.ofPage(url, title));
        }
    }

    private void progress(ResearchPhase progressPhase, String content, boolean withSources) throws IOException {
        List<ResearchSource> snapshot = withSources ? List.copyOf(sources) : null;
        turn.persist(Message.researchProgress(content, progressPhase, searchCount, snapshot, turn.now()));
    }
}
