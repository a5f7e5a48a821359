package io.agentfarm.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentfarm.error.ErrorKind;
import io.agentfarm.error.FarmException;
import io.agentfarm.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Commands launched inside the architect, builder and shell sessions.
 * Resolution order: CLI override, then {@code codev/config.json} {@code shell.*}, then defaults.
 */
public record AgentCommands(String architect, String builder, String shell) {
    public static final String DEFAULT_ARCHITECT = "claude";
    public static final String DEFAULT_BUILDER = "claude";
    public static final String DEFAULT_SHELL = "bash";

    private static final Pattern ENV_VAR = Pattern.compile("\\$\\{([^}]+)}|\\$([A-Za-z_][A-Za-z0-9_]*)");

    public static AgentCommands defaults() {
        return new AgentCommands(DEFAULT_ARCHITECT, DEFAULT_BUILDER, DEFAULT_SHELL);
    }

    public static AgentCommands resolve(FarmConfig config, AgentCommands overrides) {
        return resolve(config.userConfigFile(), overrides, System.getenv());
    }

    static AgentCommands resolve(Path userConfigFile, AgentCommands overrides, Map<String, String> env) {
        JsonNode shell = loadShellSection(userConfigFile);
        Function<String, String> lookup = name -> env.getOrDefault(name, "");
        return new AgentCommands(
                pick(overrides == null ? null : overrides.architect(), shell.path("architect"), DEFAULT_ARCHITECT, lookup),
                pick(overrides == null ? null : overrides.builder(), shell.path("builder"), DEFAULT_BUILDER, lookup),
                pick(overrides == null ? null : overrides.shell(), shell.path("shell"), DEFAULT_SHELL, lookup)
        );
    }

    private static JsonNode loadShellSection(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return Jsons.mapper().createObjectNode();
        }
        try {
            return Jsons.mapper().readTree(Files.readString(file)).path("shell");
        } catch (IOException e) {
            throw new FarmException(ErrorKind.INVALID_ARGUMENT, "Failed to parse " + file + ": " + e.getMessage(), e);
        }
    }

    private static String pick(String override, JsonNode configured, String fallback, Function<String, String> env) {
        if (override != null && !override.isBlank()) {
            return override;
        }
        if (configured.isTextual() && !configured.asText().isBlank()) {
            return expand(configured.asText(), env);
        }
        if (configured.isArray() && !configured.isEmpty()) {
            List<String> parts = new ArrayList<>();
            configured.forEach(part -> parts.add(expand(part.asText(), env)));
            return String.join(" ", parts);
        }
        return fallback;
    }

    static String expand(String raw, Function<String, String> env) {
        Matcher m = ENV_VAR.matcher(raw);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String name = m.group(1) != null ? m.group(1) : m.group(2);
            m.appendReplacement(sb, Matcher.quoteReplacement(env.apply(name)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
