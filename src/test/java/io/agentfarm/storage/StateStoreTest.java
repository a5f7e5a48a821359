package io.agentfarm.storage;

import io.agentfarm.config.FarmConfig;
import io.agentfarm.config.RegistrySettings;
import io.agentfarm.error.ErrorKind;
import io.agentfarm.error.FarmException;
import io.agentfarm.model.Annotation;
import io.agentfarm.model.AnnotationParent;
import io.agentfarm.model.ArchitectState;
import io.agentfarm.model.Builder;
import io.agentfarm.model.BuilderKind;
import io.agentfarm.model.BuilderStatus;
import io.agentfarm.model.FarmState;
import io.agentfarm.model.UtilTerminal;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class StateStoreTest {

    @Test
    void secondBuilderOnTheSamePortIsAConflict() throws Exception {
        StateStore store = store("port-conflict");
        store.insertBuilder(builder("0042", 4210, BuilderStatus.SPAWNING));

        FarmException ex = Assertions.assertThrows(FarmException.class,
                () -> store.insertBuilder(builder("0043", 4210, BuilderStatus.SPAWNING)));

        Assertions.assertEquals(ErrorKind.CONFLICT, ex.kind());
        Assertions.assertTrue(ex.getMessage().contains("4210"), ex.getMessage());
        Assertions.assertTrue(ex.getMessage().contains("0042"), ex.getMessage());
        List<Builder> builders = store.listBuilders();
        Assertions.assertEquals(1, builders.size());
        Assertions.assertEquals("0042", builders.get(0).id());
    }

    @Test
    void duplicateBuilderIdIsAConflict() throws Exception {
        StateStore store = store("id-conflict");
        store.insertBuilder(builder("0042", 4210, BuilderStatus.SPAWNING));

        FarmException ex = Assertions.assertThrows(FarmException.class,
                () -> store.insertBuilder(builder("0042", 4211, BuilderStatus.SPAWNING)));
        Assertions.assertEquals(ErrorKind.CONFLICT, ex.kind());
        Assertions.assertEquals(4210, store.getBuilder("0042").orElseThrow().port());
    }

    @Test
    void setStatusOnMissingBuilderChangesNothing() throws Exception {
        StateStore store = store("missing-status");
        store.insertBuilder(builder("0001", 4210, BuilderStatus.IMPLEMENTING));
        FarmState before = store.loadAll();

        Optional<Builder> result = store.setStatus("9999", BuilderStatus.BLOCKED);

        Assertions.assertTrue(result.isEmpty());
        Assertions.assertEquals(before, store.loadAll());
    }

    @Test
    void statusColumnRejectsUndeclaredValues() throws Exception {
        StateStore store = store("status-check");
        store.insertBuilder(builder("0001", 4210, BuilderStatus.SPAWNING));

        try (Connection c = store.database().openConnection(); Statement st = c.createStatement()) {
            Assertions.assertThrows(SQLException.class,
                    () -> st.executeUpdate("UPDATE builders SET status='done' WHERE id='0001'"));
        }
        Assertions.assertEquals(BuilderStatus.SPAWNING, store.getBuilder("0001").orElseThrow().status());
    }

    @Test
    void compareAndSetStatusFailsWhenTheStatusMovedOn() throws Exception {
        StateStore store = store("cas");
        store.insertBuilder(builder("0001", 4210, BuilderStatus.SPAWNING));

        Assertions.assertTrue(store.compareAndSetStatus("0001", BuilderStatus.SPAWNING, BuilderStatus.IMPLEMENTING).isPresent());
        Assertions.assertTrue(store.compareAndSetStatus("0001", BuilderStatus.SPAWNING, BuilderStatus.BLOCKED).isEmpty());
        Assertions.assertEquals(BuilderStatus.IMPLEMENTING, store.getBuilder("0001").orElseThrow().status());
    }

    @Test
    void concurrentUpsertsOfOneIdConvergeToASingleRow() throws Exception {
        StateStore store = store("upsert-race");
        store.insertBuilder(builder("0007", 4210, BuilderStatus.SPAWNING));
        List<BuilderStatus> statuses = List.of(BuilderStatus.IMPLEMENTING, BuilderStatus.BLOCKED, BuilderStatus.PR_READY);
        ExecutorService pool = Executors.newFixedThreadPool(6);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Builder>> results = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                BuilderStatus status = statuses.get(i % statuses.size());
                StateStore own = new StateStore(store.database());
                results.add(pool.submit(() -> {
                    start.await();
                    return own.upsertBuilder(builder("0007", 4210, status));
                }));
            }
            start.countDown();
            for (Future<Builder> result : results) {
                Assertions.assertEquals("0007", result.get(30, TimeUnit.SECONDS).id());
            }
        } finally {
            pool.shutdownNow();
        }

        List<Builder> rows = store.listBuilders();
        Assertions.assertEquals(1, rows.size());
        Assertions.assertTrue(EnumSet.copyOf(statuses).contains(rows.get(0).status()));

        store.upsertBuilder(builder("0007", 4210, BuilderStatus.BLOCKED));
        Assertions.assertEquals(BuilderStatus.BLOCKED, store.getBuilder("0007").orElseThrow().status());
        Assertions.assertEquals(1, store.listBuilders().size());
    }

    @Test
    void upsertKeepsTheOriginalStartTime() throws Exception {
        StateStore store = store("upsert-start");
        Builder first = store.insertBuilder(builder("0001", 4210, BuilderStatus.SPAWNING));

        Builder again = new Builder("0001", "renamed", 4211, 77L, BuilderStatus.IMPLEMENTING, "", "", "", null,
                BuilderKind.SHELL, null, null, first.startedAtMs() + 10_000L, 0L);
        Builder stored = store.upsertBuilder(again);

        Assertions.assertEquals(first.startedAtMs(), stored.startedAtMs());
        Assertions.assertEquals("renamed", stored.name());
        Assertions.assertEquals(4211, stored.port());
    }

    @Test
    void everyUpdateAdvancesUpdatedAt() throws Exception {
        StateStore store = store("touch");
        Builder inserted = store.insertBuilder(builder("0001", 4210, BuilderStatus.SPAWNING));

        Builder afterPhase = store.setPhase("0001", "tests").orElseThrow();
        Builder afterPid = store.setPid("0001", 123L).orElseThrow();

        Assertions.assertTrue(afterPhase.updatedAtMs() > inserted.updatedAtMs());
        Assertions.assertTrue(afterPid.updatedAtMs() > afterPhase.updatedAtMs());
        Assertions.assertEquals("tests", afterPid.phase());
    }

    @Test
    void architectIsASingletonReplacedWholesale() throws Exception {
        StateStore store = store("architect");
        store.setArchitect(new ArchitectState(100L, 4201, "claude", 1_000L, "af-architect-4201"));
        store.setArchitect(new ArchitectState(200L, 4201, "claude --resume", 2_000L, null));

        ArchitectState architect = store.getArchitect().orElseThrow();
        Assertions.assertEquals(200L, architect.pid());
        Assertions.assertEquals("claude --resume", architect.cmd());
        Assertions.assertNull(architect.sessionName());
        Assertions.assertTrue(store.clearArchitect());
        Assertions.assertTrue(store.getArchitect().isEmpty());
        Assertions.assertFalse(store.clearArchitect());
    }

    @Test
    void annotationParentMustExist() throws Exception {
        StateStore store = store("annotation-parent");
        store.insertBuilder(builder("0001", 4210, BuilderStatus.IMPLEMENTING));

        FarmException missing = Assertions.assertThrows(FarmException.class, () -> store.addAnnotation(
                new Annotation("ann-1", "/tmp/a.md", 4250, 0L, AnnotationParent.builder("0404"), 0L)));
        Assertions.assertEquals(ErrorKind.NOT_FOUND, missing.kind());
        FarmException missingUtil = Assertions.assertThrows(FarmException.class, () -> store.addAnnotation(
                new Annotation("ann-2", "/tmp/a.md", 4251, 0L, AnnotationParent.util("util-none"), 0L)));
        Assertions.assertEquals(ErrorKind.NOT_FOUND, missingUtil.kind());
        Assertions.assertTrue(store.listAnnotations().isEmpty());

        store.addAnnotation(new Annotation("ann-3", "/tmp/a.md", 4250, 0L, AnnotationParent.builder("0001"), 0L));
        store.addAnnotation(new Annotation("ann-4", "/tmp/b.md", 4251, 0L, AnnotationParent.architect(), 0L));

        List<Annotation> annotations = store.listAnnotations();
        Assertions.assertEquals(2, annotations.size());
        Assertions.assertEquals(AnnotationParent.builder("0001"), store.getAnnotation("ann-3").orElseThrow().parent());
        Assertions.assertEquals(AnnotationParent.architect(), store.getAnnotation("ann-4").orElseThrow().parent());
    }

    @Test
    void annotationParentKindAndIdMustAgree() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new AnnotationParent(AnnotationParent.Kind.ARCHITECT, "0001"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new AnnotationParent(AnnotationParent.Kind.BUILDER, " "));
        Assertions.assertEquals(AnnotationParent.util("util-1"), AnnotationParent.parse("util:util-1"));
        Assertions.assertEquals(AnnotationParent.architect(), AnnotationParent.parse("architect"));
    }

    @Test
    void utilPortCollisionIsReportedNotThrownByTryAdd() throws Exception {
        StateStore store = store("utils");
        Assertions.assertTrue(store.tryAddUtil(new UtilTerminal("util-a", "one", 4230, 0L, null, 0L)));
        Assertions.assertFalse(store.tryAddUtil(new UtilTerminal("util-b", "two", 4230, 0L, null, 0L)));

        FarmException ex = Assertions.assertThrows(FarmException.class,
                () -> store.addUtil(new UtilTerminal("util-c", "three", 4230, 0L, null, 0L)));
        Assertions.assertEquals(ErrorKind.CONFLICT, ex.kind());
        Assertions.assertEquals(1, store.listUtils().size());
        Assertions.assertEquals("renamed", store.renameUtil("util-a", " renamed ").orElseThrow().name());
        Assertions.assertEquals(55L, store.setUtilPid("util-a", 55L).orElseThrow().pid());
    }

    @Test
    void usedPortsSpansEveryTableAndClearAllEmptiesThem() throws Exception {
        StateStore store = store("used-ports");
        store.setArchitect(new ArchitectState(1L, 4201, "claude", 0L, "af-architect-4201"));
        store.insertBuilder(builder("0001", 4210, BuilderStatus.SPAWNING));
        store.addUtil(new UtilTerminal("util-a", "shell", 4230, 0L, null, 0L));
        store.addAnnotation(new Annotation("ann-a", "/tmp/x", 4250, 0L, AnnotationParent.util("util-a"), 0L));

        Assertions.assertEquals(Set.of(4201, 4210, 4230, 4250), store.usedPorts());

        store.clearAll();
        Assertions.assertEquals(FarmState.empty(), store.loadAll());
    }

    static StateStore store(String name) throws Exception {
        Path root = Files.createTempDirectory("agentfarm-store-" + name + "-");
        FarmConfig config = new FarmConfig(root, root.resolve("registry"), RegistrySettings.defaults(), false);
        Database database = Database.forProjectState(config);
        database.init();
        return new StateStore(database);
    }

    static Builder builder(String id, int port, BuilderStatus status) {
        return new Builder(id, "Builder " + id, port, 0L, status, "", "/work/" + id, "builder/" + id,
                "builder-test-" + id, BuilderKind.SPEC, null, null, 0L, 0L);
    }
}
