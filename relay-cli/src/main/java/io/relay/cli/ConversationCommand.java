package io.relay.cli;

import io.relay.core.model.Conversation;
import io.relay.core.model.ConversationSettings;
import io.relay.core.model.PermissionMode;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "conversation", description = "Create a conversation, or list existing ones")
public final class ConversationCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-l", "--list"}, description = "List conversations instead of creating one")
    boolean list;

    @Option(names = {"-r", "--repo"}, description = "Repository the agent works in", defaultValue = ".")
    Path repo;

    @Option(names = {"-t", "--agent-type"}, description = "Agent type: claude or research", defaultValue = "claude")
    String agentType;

    @Option(names = {"-a", "--agent-id"}, description = "Agent id (defaults to the agent type)")
    String agentId;

    @Option(names = {"-w", "--workspace"}, description = "Workspace id", defaultValue = "default")
    String workspaceId;

    @Option(names = {"-m", "--model"}, description = "Model override")
    String model;

    @Option(names = {"--permission-mode"}, description = "default, acceptEdits, plan or bypassPermissions")
    String permissionMode;

    @Option(names = {"--allowed-tools"}, split = ",", description = "Tools allowed without approval")
    List<String> allowedTools;

    @Option(names = {"--agent-file"}, description = "File appended to the system prompt of new sessions, relative to the repo")
    String agentFile;

    public ConversationCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            if (list) {
                for (Conversation conversation : context.orchestrator().listConversations()) {
                    System.out.println(conversation.id() + "  " + conversation.agentType() + "  "
                        + conversation.messageCount() + " messages  " + conversation.title());
                }
                return 0;
            }
            Conversation conversation = context.orchestrator().createConversation(
                workspaceId,
                agentId == null || agentId.isBlank() ? agentType : agentId,
                repo.toAbsolutePath().normalize().toString(),
                agentType,
                settings()
            );
            System.out.println("Created conversation: " + conversation.id());
            return 0;
        } catch (Exception e) {
            System.err.println("Conversation command failed: " + e.getMessage());
            return 1;
        }
    }

    private ConversationSettings settings() {
        if (model == null && permissionMode == null && allowedTools == null && agentFile == null) {
            return null;
        }
        return new ConversationSettings(parseMode(permissionMode), allowedTools, model, agentFile);
    }

    static PermissionMode parseMode(String raw) {
        if (raw == null || raw.isBlank()) {
            return PermissionMode.DEFAULT;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(PermissionMode.values())
            .filter(mode -> mode.wireName().toLowerCase(Locale.ROOT).equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown permission mode: " + raw));
    }
}
