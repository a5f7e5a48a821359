package io.agentfarm.config;

import io.agentfarm.error.ErrorKind;
import io.agentfarm.error.FarmException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

final class AgentCommandsTest {

    @Test
    void fallsBackToDefaultsWithoutConfig() throws Exception {
        Path missing = Files.createTempDirectory("agentfarm-cmds-none-").resolve("config.json");

        Assertions.assertEquals(AgentCommands.defaults(), AgentCommands.resolve(missing, null, Map.of()));
    }

    @Test
    void readsStringsAndArraysWithEnvExpansion() throws Exception {
        Path file = Files.createTempDirectory("agentfarm-cmds-file-").resolve("config.json");
        Files.writeString(file, """
                {"shell": {
                  "architect": "claude --model $MODEL",
                  "builder": ["claude", "--dangerously-skip-permissions", "${EXTRA}"],
                  "shell": ""
                }}
                """);

        AgentCommands commands = AgentCommands.resolve(file, null, Map.of("MODEL", "opus", "EXTRA", "-v"));

        Assertions.assertEquals("claude --model opus", commands.architect());
        Assertions.assertEquals("claude --dangerously-skip-permissions -v", commands.builder());
        Assertions.assertEquals(AgentCommands.DEFAULT_SHELL, commands.shell());
    }

    @Test
    void cliOverridesWin() throws Exception {
        Path file = Files.createTempDirectory("agentfarm-cmds-override-").resolve("config.json");
        Files.writeString(file, "{\"shell\": {\"architect\": \"from-file\"}}");

        AgentCommands commands = AgentCommands.resolve(file, new AgentCommands("from-cli", null, "zsh"), Map.of());

        Assertions.assertEquals("from-cli", commands.architect());
        Assertions.assertEquals(AgentCommands.DEFAULT_BUILDER, commands.builder());
        Assertions.assertEquals("zsh", commands.shell());
    }

    @Test
    void unknownVariablesExpandToEmpty() {
        Assertions.assertEquals("run  now", AgentCommands.expand("run $NOPE now", name -> Map.<String, String>of().getOrDefault(name, "")));
    }

    @Test
    void malformedConfigIsAnInvalidArgument() throws Exception {
        Path file = Files.createTempDirectory("agentfarm-cmds-bad-").resolve("config.json");
        Files.writeString(file, "{\"shell\": ");

        FarmException ex = Assertions.assertThrows(FarmException.class, () -> AgentCommands.resolve(file, null, Map.of()));
        Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, ex.kind());
    }
}
