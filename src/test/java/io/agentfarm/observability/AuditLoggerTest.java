package io.agentfarm.observability;

import io.agentfarm.observability.AuditLogger.AuditEvent;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class AuditLoggerTest {

    @Test
    void chainSurvivesReopenAndDetectsTampering() throws Exception {
        Path file = Files.createTempDirectory("agentfarm-audit-").resolve("state").resolve("audit.log");
        AuditLogger first = new AuditLogger(file, "demo");
        first.log(AuditEvent.of("builder.spawn", "0042", "ok", AuditEvent.details("port", 4210, "branch", null)));
        first.log(AuditEvent.of("builder.status", "0042", "ok", AuditEvent.details("to", "implementing")));

        AuditLogger reopened = new AuditLogger(file, "demo");
        Assertions.assertEquals(first.currentHash(), reopened.currentHash());
        reopened.log(AuditEvent.of("builder.cleanup", "0042", "ok", null));

        AuditLogger.VerifyResult ok = reopened.verify();
        Assertions.assertTrue(ok.valid());
        Assertions.assertEquals(3, ok.rows());

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        lines.set(1, lines.get(1).replace("implementing", "complete"));
        Files.write(file, lines, StandardCharsets.UTF_8);

        AuditLogger.VerifyResult broken = reopened.verify();
        Assertions.assertFalse(broken.valid());
        Assertions.assertEquals(List.of(2), broken.brokenLines());
    }

    @Test
    void detailsRejectsOddArguments() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> AuditEvent.details("key"));
    }
}
