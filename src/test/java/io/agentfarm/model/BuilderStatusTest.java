package io.agentfarm.model;

import io.agentfarm.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class BuilderStatusTest {

    @Test
    void onlyDeclaredEdgesAreAllowed() {
        Assertions.assertTrue(BuilderStatus.SPAWNING.canMoveTo(BuilderStatus.IMPLEMENTING));
        Assertions.assertTrue(BuilderStatus.IMPLEMENTING.canMoveTo(BuilderStatus.BLOCKED));
        Assertions.assertTrue(BuilderStatus.BLOCKED.canMoveTo(BuilderStatus.IMPLEMENTING));
        Assertions.assertTrue(BuilderStatus.IMPLEMENTING.canMoveTo(BuilderStatus.PR_READY));
        Assertions.assertTrue(BuilderStatus.PR_READY.canMoveTo(BuilderStatus.COMPLETE));

        Assertions.assertFalse(BuilderStatus.SPAWNING.canMoveTo(BuilderStatus.COMPLETE));
        Assertions.assertFalse(BuilderStatus.BLOCKED.canMoveTo(BuilderStatus.PR_READY));
        Assertions.assertTrue(BuilderStatus.COMPLETE.successors().isEmpty());
    }

    @Test
    void wireNamesAcceptUnderscores() throws Exception {
        Assertions.assertEquals(BuilderStatus.PR_READY, BuilderStatus.fromWire("PR_READY"));
        Assertions.assertEquals("\"pr-ready\"", Jsons.toCompactJson(BuilderStatus.PR_READY));
        Assertions.assertEquals(BuilderStatus.BLOCKED, Jsons.mapper().readValue("\"blocked\"", BuilderStatus.class));
        Assertions.assertThrows(IllegalArgumentException.class, () -> BuilderStatus.fromWire("done"));
        Assertions.assertEquals(BuilderKind.SPEC, BuilderKind.fromWire(""));
    }
}
