package io.relay.cli;

import io.relay.core.model.LoadedConversation;
import io.relay.core.model.Message;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "history", description = "Print a conversation's messages")
public final class HistoryCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Conversation id")
    String conversationId;

    public HistoryCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            LoadedConversation loaded = context.orchestrator().loadConversation(conversationId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown conversation: " + conversationId));
            System.out.println("# " + loaded.conversation().title());
            for (Message message : loaded.messages()) {
                System.out.println("[" + message.type().name().toLowerCase() + "] " + message.content());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("History command failed: " + e.getMessage());
            return 1;
        }
    }
}
