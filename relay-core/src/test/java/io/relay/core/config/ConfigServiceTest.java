package io.relay.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.relay.core.config.model.RelayConfig;
import io.relay.core.model.PermissionMode;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        RelayConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.store().sqlite()).isFalse();
        assertThat(config.backends().claude().bridgeMode()).isFalse();
        assertThat(config.backends().claude().executable()).isEqualTo("claude");
        assertThat(config.backends().research().configured()).isFalse();
        assertThat(config.git().autoBranch()).isTrue();
        assertThat(config.git().branchPrefix()).isEqualTo("agent");
        assertThat(config.permissions().timeoutSeconds()).isEqualTo(300);
        assertThat(config.sessions().maxAgeDays()).isEqualTo(25);
        assertThat(config.conversationDefaults().permissionMode()).isEqualTo(PermissionMode.DEFAULT);
        assertThat(config.gateway().port()).isEqualTo(8787);
    }

    @Test
    void shouldMergeDefaultsWithExistingValues() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "backends": {
                "claude": { "mode": "bridge", "bridgeCommand": ["node", "bridge.js"] },
                "research": { "apiKey": "sk-test" }
              },
              "git": { "useWorktrees": true },
              "conversationDefaults": { "permissionMode": "acceptEdits" }
            }
            """);

        RelayConfig config = service.load(configPath);

        assertThat(config.backends().claude().bridgeMode()).isTrue();
        assertThat(config.backends().claude().bridgeCommand()).containsExactly("node", "bridge.js");
        assertThat(config.backends().claude().executable()).isEqualTo("claude");
        assertThat(config.backends().research().configured()).isTrue();
        assertThat(config.backends().research().model()).isEqualTo("o4-mini-deep-research-2025-06-26");
        assertThat(config.git().useWorktrees()).isTrue();
        assertThat(config.git().autoCommit()).isTrue();
        assertThat(config.conversationDefaults().permissionMode()).isEqualTo(PermissionMode.ACCEPT_EDITS);
    }

    @Test
    void onboardShouldKeepExistingValuesAndCreateStoreDirectory() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".relay/config.json");
        Path storeDir = tempDir.resolve("sessions");
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, """
            { "store": { "directory": "%s" }, "sessions": { "maxAgeDays": 7 } }
            """.formatted(storeDir.toString().replace("\\", "\\\\")));

        OnboardResult result = service.onboard(configPath, false);

        assertThat(result.createdConfig()).isFalse();
        assertThat(result.overwrittenConfig()).isFalse();
        assertThat(Files.isDirectory(storeDir)).isTrue();
        RelayConfig reloaded = service.load(configPath);
        assertThat(reloaded.sessions().maxAgeDays()).isEqualTo(7);
        assertThat(Files.readString(configPath)).contains("\"gateway\"");
    }

    @Test
    void shouldLetSnakeCaseKeysOverrideDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "backends": { "claude": { "bridge_command": ["node", "bridge.js"] } },
              "git": { "auto_commit": false, "branch_prefix": "bots" },
              "sessions": { "max_age_days": 3 }
            }
            """);

        RelayConfig config = service.load(configPath);

        assertThat(config.backends().claude().bridgeCommand()).containsExactly("node", "bridge.js");
        assertThat(config.git().autoCommit()).isFalse();
        assertThat(config.git().branchPrefix()).isEqualTo("bots");
        assertThat(config.git().autoBranch()).isTrue();
        assertThat(config.sessions().maxAgeDays()).isEqualTo(3);
    }

    @Test
    void shouldRejectInvalidValues() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            { "store": { "type": "postgres" }, "gateway": { "port": 0 } }
            """);

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("store.type must be file or sqlite")
            .hasMessageContaining("gateway.port");
    }

    @Test
    void shouldConvertSnakeCaseKeys() {
        assertThat(ConfigService.camelCase("max_age_days")).isEqualTo("maxAgeDays");
        assertThat(ConfigService.camelCase("apiKey")).isEqualTo("apiKey");
        assertThat(ConfigService.camelCase("_private")).isEqualTo("private");
    }
}
