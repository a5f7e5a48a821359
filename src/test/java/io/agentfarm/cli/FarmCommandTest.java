package io.agentfarm.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentfarm.config.AgentCommands;
import io.agentfarm.config.FarmConfig;
import io.agentfarm.model.Builder;
import io.agentfarm.registry.PortRegistry;
import io.agentfarm.runtime.FarmRuntime;
import io.agentfarm.runtime.SpawnRequest;
import io.agentfarm.testing.TestFarm;
import io.agentfarm.util.Jsons;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FarmCommandTest {
    @Test
    void statusPrintsJsonAndExitsZero() throws Exception {
        TestFarm farm = TestFarm.create("cli-status");
        Run run = run(farm, "status");

        assertEquals(0, run.exitCode, run.err);
        JsonNode status = Jsons.mapper().readTree(run.out);
        assertEquals(farm.projectRoot.toString(), status.path("project").asText());
        assertEquals(4200, status.path("ports").path("basePort").asInt());
    }

    @Test
    void farmErrorsMapToTheirExitCodes() throws Exception {
        TestFarm farm = TestFarm.create("cli-exit");
        Builder builder = farm.runtime.builders().spawn(SpawnRequest.worktree());

        Run missing = run(farm, "cleanup", "nope");
        assertEquals(4, missing.exitCode);
        assertTrue(missing.err.startsWith("af: "), missing.err);

        assertEquals(3, run(farm, "set-status", builder.id(), "complete").exitCode);
        assertEquals(8, run(farm, "set-status", builder.id(), "done").exitCode);
        assertEquals(8, run(farm, "spawn").exitCode);
        assertEquals(8, run(farm, "spawn", "--shell", "--worktree").exitCode);
        assertEquals(8, run(farm, "spawn", "--shell", "--files", "a.java").exitCode);

        farm.versionControl.markDirty(Path.of(builder.workspace()));
        assertEquals(7, run(farm, "cleanup", builder.id()).exitCode);
        assertEquals(0, run(farm, "cleanup", builder.id(), "--force").exitCode);
        assertTrue(farm.store.getBuilder(builder.id()).isEmpty());
    }

    @Test
    void forcedStatusSkipsTheTransitionGraph() throws Exception {
        TestFarm farm = TestFarm.create("cli-force");
        Builder builder = farm.runtime.builders().spawn(SpawnRequest.worktree());

        Run run = run(farm, "set-status", builder.id(), "pr_ready", "--force");

        assertEquals(0, run.exitCode, run.err);
        assertEquals("pr-ready", Jsons.mapper().readTree(run.out).path("status").asText());
    }

    @Test
    void forcedCompleteStillTearsTheBuilderDown() throws Exception {
        TestFarm farm = TestFarm.create("cli-force-complete");
        Builder builder = farm.runtime.builders().spawn(SpawnRequest.worktree());

        Run run = run(farm, "set-status", builder.id(), "complete", "--force");

        assertEquals(0, run.exitCode, run.err);
        assertEquals("complete", Jsons.mapper().readTree(run.out).path("status").asText());
        assertTrue(farm.store.getBuilder(builder.id()).isEmpty());
        assertFalse(farm.multiplexer.hasSession(builder.sessionName()));
        assertFalse(farm.prober.isPidAlive(builder.pid()));
        assertTrue(Files.isDirectory(Path.of(builder.workspace())));
    }

    @Test
    void portsListShowsTheProjectsBlock() throws Exception {
        TestFarm farm = TestFarm.create("cli-ports");
        Run run = run(farm, "ports", "list");

        assertEquals(0, run.exitCode, run.err);
        JsonNode rows = Jsons.mapper().readTree(run.out);
        assertEquals(1, rows.size());
        assertEquals(4200, rows.get(0).path("allocation").path("basePort").asInt());
        assertEquals(PortRegistry.canonicalize(farm.projectRoot), rows.get(0).path("allocation").path("projectPath").asText());

        assertEquals(4, run(farm, "ports", "remove", farm.projectRoot.resolve("elsewhere").toString()).exitCode);
    }

    @Test
    void auditVerifyReadsTheProjectsLog() throws Exception {
        TestFarm farm = TestFarm.create("cli-audit");
        farm.runtime.startArchitect(null, null);

        Run run = run(farm, "audit", "verify");

        assertEquals(0, run.exitCode, run.err);
        JsonNode result = Jsons.mapper().readTree(run.out);
        assertTrue(result.path("valid").asBoolean());
        assertEquals(1, result.path("rows").asInt());
    }

    private static Run run(TestFarm farm, String... args) {
        FarmCommand.Runtimes runtimes = new FarmCommand.Runtimes() {
            @Override
            public FarmRuntime open(FarmConfig config, AgentCommands overrides) {
                return farm.runtime;
            }

            @Override
            public PortRegistry registry(FarmConfig config) {
                return farm.registry;
            }
        };
        CommandLine cmd = FarmCommand.commandLine(new FarmCommand(runtimes));
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        String[] full = new String[args.length + 4];
        full[0] = "--project";
        full[1] = farm.projectRoot.toString();
        full[2] = "--registry-dir";
        full[3] = farm.config.registryDir().toString();
        System.arraycopy(args, 0, full, 4, args.length);
        int exitCode = cmd.execute(full);
        return new Run(exitCode, out.toString(), err.toString());
    }

    private record Run(int exitCode, String out, String err) {
    }
}
