package io.relay.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Set;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ConversationSettings(
    PermissionMode permissionMode,
    List<String> allowedTools,
    String model,
    @JsonAlias({"agent_file"}) String agentFile
) {
    public static final String DEFAULT_MODEL = "default";

    /** Tools that require operator approval unless listed in {@code allowedTools}. */
    public static final Set<String> PERMISSION_TOOLS = Set.of("Bash", "Edit", "Write", "WebFetch", "WebSearch", "NotebookEdit");

    public ConversationSettings {
        permissionMode = permissionMode == null ? PermissionMode.DEFAULT : permissionMode;
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        model = model == null || model.isBlank() ? DEFAULT_MODEL : model.trim();
        agentFile = agentFile == null || agentFile.isBlank() ? null : agentFile.trim();
    }

    public ConversationSettings(PermissionMode permissionMode, List<String> allowedTools, String model) {
        this(permissionMode, allowedTools, model, null);
    }

    public static ConversationSettings defaults() {
        return new ConversationSettings(PermissionMode.DEFAULT, List.of(), DEFAULT_MODEL, null);
    }

    public boolean usesDefaultModel() {
        return DEFAULT_MODEL.equals(model);
    }

    public boolean requiresApproval(String toolName) {
        if (permissionMode == PermissionMode.BYPASS_PERMISSIONS) {
            return false;
        }
        return PERMISSION_TOOLS.contains(toolName) && !allowedTools.contains(toolName);
    }
}
