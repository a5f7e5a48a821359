package io.agentfarm.runtime;

import io.agentfarm.error.ErrorKind;
import io.agentfarm.error.FarmException;
import io.agentfarm.model.Annotation;
import io.agentfarm.model.AnnotationParent;
import io.agentfarm.model.ArchitectState;
import io.agentfarm.model.Builder;
import io.agentfarm.model.FarmState;
import io.agentfarm.model.UtilTerminal;
import io.agentfarm.observability.AuditLogger;
import io.agentfarm.testing.TestFarm;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class FarmRuntimeTest {

    @Test
    void startArchitectRecordsSessionAndBridge() throws Exception {
        TestFarm farm = TestFarm.create("architect-start");

        ArchitectState architect = farm.runtime.startArchitect(null, null);

        Assertions.assertEquals(4201, architect.port());
        Assertions.assertEquals("af-architect-4201", architect.sessionName());
        Assertions.assertEquals("claude", architect.cmd());
        Assertions.assertEquals("claude", farm.multiplexer.commandOf("af-architect-4201"));
        Assertions.assertEquals(architect, farm.store.getArchitect().orElseThrow());

        FarmException again = Assertions.assertThrows(FarmException.class, () -> farm.runtime.startArchitect(null, null));
        Assertions.assertEquals(ErrorKind.CONFLICT, again.kind());
    }

    @Test
    void explicitArchitectPortMustBeValidAndOutsideOtherBlocks() throws Exception {
        Path base = Files.createTempDirectory("agentfarm-architect-port-");
        TestFarm farm = TestFarm.in(base.resolve("registry"), base.resolve("first"));
        TestFarm.in(base.resolve("registry"), base.resolve("second"));

        FarmException negative = Assertions.assertThrows(FarmException.class, () -> farm.runtime.startArchitect(null, -7));
        Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, negative.kind());
        FarmException privileged = Assertions.assertThrows(FarmException.class, () -> farm.runtime.startArchitect(null, 80));
        Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, privileged.kind());
        FarmException tooHigh = Assertions.assertThrows(FarmException.class, () -> farm.runtime.startArchitect(null, 65536));
        Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, tooHigh.kind());
        FarmException foreign = Assertions.assertThrows(FarmException.class, () -> farm.runtime.startArchitect(null, 4301));
        Assertions.assertEquals(ErrorKind.CONFLICT, foreign.kind());
        Assertions.assertTrue(farm.store.getArchitect().isEmpty());
        Assertions.assertTrue(farm.multiplexer.listSessions().isEmpty());

        ArchitectState architect = farm.runtime.startArchitect(null, 4205);
        Assertions.assertEquals(4205, architect.port());
        Assertions.assertEquals("af-architect-4205", architect.sessionName());
    }

    @Test
    void startArchitectReplacesAStaleRecordAndItsOrphanSession() throws Exception {
        TestFarm farm = TestFarm.create("architect-stale");
        farm.store.setArchitect(new ArchitectState(31337L, 4201, "old", 1L, "af-architect-4201"));
        farm.multiplexer.seed("af-architect-4201");

        ArchitectState architect = farm.runtime.startArchitect("claude --resume", null);

        Assertions.assertEquals("claude --resume", architect.cmd());
        Assertions.assertNotEquals(31337L, architect.pid());
        Assertions.assertTrue(farm.multiplexer.killed().contains("af-architect-4201"));
        Assertions.assertEquals(architect.pid(), farm.store.getArchitect().orElseThrow().pid());
    }

    @Test
    void failedArchitectBridgeRemovesTheSession() throws Exception {
        TestFarm farm = TestFarm.create("architect-fail");
        farm.bridge.failNextStart();

        Assertions.assertThrows(FarmException.class, () -> farm.runtime.startArchitect(null, null));

        Assertions.assertTrue(farm.store.getArchitect().isEmpty());
        Assertions.assertFalse(farm.multiplexer.hasSession("af-architect-4201"));
    }

    @Test
    void utilsAndAnnotationsTakePortsFromTheirOwnRanges() throws Exception {
        TestFarm farm = TestFarm.create("utils");
        Path notes = farm.write("docs/notes.md", "notes");

        UtilTerminal util = farm.runtime.spawnUtil("logs");
        farm.prober.markBusy(4250);
        Annotation annotation = farm.runtime.openAnnotation(Path.of("docs/notes.md"), AnnotationParent.util(util.id()));

        Assertions.assertEquals(4230, util.port());
        Assertions.assertEquals("logs", util.name());
        Assertions.assertTrue(util.pid() > 0);
        Assertions.assertEquals("bash", farm.multiplexer.commandOf(util.sessionName()));
        Assertions.assertEquals(4251, annotation.port());
        Assertions.assertEquals(notes.toString(), annotation.file());
        Assertions.assertTrue(annotation.pid() > 0);
        Assertions.assertEquals(annotation, farm.store.getAnnotation(annotation.id()).orElseThrow());

        FarmException missingFile = Assertions.assertThrows(FarmException.class,
                () -> farm.runtime.openAnnotation(Path.of("docs/none.md"), AnnotationParent.architect()));
        Assertions.assertEquals(ErrorKind.NOT_FOUND, missingFile.kind());
        FarmException missingParent = Assertions.assertThrows(FarmException.class,
                () -> farm.runtime.openAnnotation(notes, AnnotationParent.builder("0404")));
        Assertions.assertEquals(ErrorKind.NOT_FOUND, missingParent.kind());
        Assertions.assertEquals(1, farm.store.listAnnotations().size());
    }

    @Test
    void failedUtilBridgeLeavesNoRecord() throws Exception {
        TestFarm farm = TestFarm.create("util-fail");
        farm.bridge.failNextStart();

        Assertions.assertThrows(FarmException.class, () -> farm.runtime.spawnUtil(null));

        Assertions.assertTrue(farm.store.listUtils().isEmpty());
        Assertions.assertTrue(farm.multiplexer.listSessions().isEmpty());
    }

    @Test
    void renameFindsBuildersThenUtils() throws Exception {
        TestFarm farm = TestFarm.create("rename");
        Builder builder = farm.runtime.builders().spawn(SpawnRequest.worktree());
        UtilTerminal util = farm.runtime.spawnUtil(null);

        Assertions.assertEquals("builder", farm.runtime.rename(builder.id(), "auth rework"));
        Assertions.assertEquals("util", farm.runtime.rename(util.id(), "tail logs"));
        Assertions.assertEquals("auth rework", farm.store.getBuilder(builder.id()).orElseThrow().name());
        Assertions.assertEquals("tail logs", farm.store.getUtil(util.id()).orElseThrow().name());
        FarmException missing = Assertions.assertThrows(FarmException.class, () -> farm.runtime.rename("nope", "x"));
        Assertions.assertEquals(ErrorKind.NOT_FOUND, missing.kind());
    }

    @Test
    void statusDecoratesRecordsWithLiveness() throws Exception {
        TestFarm farm = TestFarm.create("status");
        farm.runtime.startArchitect(null, null);
        Builder builder = farm.runtime.builders().spawn(SpawnRequest.worktree());
        farm.prober.markDead(builder.pid());

        FarmRuntime.FarmStatus status = farm.runtime.status();

        Assertions.assertEquals(4200, status.ports().basePort());
        Assertions.assertTrue(status.architect().alive());
        Assertions.assertEquals(1, status.builders().size());
        Assertions.assertFalse(status.builders().get(0).alive());
        Assertions.assertEquals(builder.id(), status.builders().get(0).record().id());
    }

    @Test
    void stopAllStopsEverythingAndClearsTheStore() throws Exception {
        TestFarm farm = TestFarm.create("stop");
        ArchitectState architect = farm.runtime.startArchitect(null, null);
        Builder builder = farm.runtime.builders().spawn(SpawnRequest.worktree());
        UtilTerminal util = farm.runtime.spawnUtil(null);

        FarmRuntime.StopReport report = farm.runtime.stopAll();

        Assertions.assertEquals(List.of("util:" + util.id(), "builder:" + builder.id(), "architect"), report.stopped());
        Assertions.assertEquals(FarmState.empty(), farm.store.loadAll());
        Assertions.assertTrue(farm.multiplexer.listSessions().isEmpty());
        Assertions.assertFalse(farm.prober.isPidAlive(architect.pid()));
        // workspaces survive a stop
        Assertions.assertTrue(Files.isDirectory(Path.of(builder.workspace())));

        AuditLogger.VerifyResult audit = farm.audit.verify();
        Assertions.assertTrue(audit.valid());
        Assertions.assertTrue(audit.rows() >= 4);
    }
}
