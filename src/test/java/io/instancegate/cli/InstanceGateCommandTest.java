package io.instancegate.cli;

import io.instancegate.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class InstanceGateCommandTest {

    @Test
    void initPubkeyAndInstanceShareOneIdentity() throws Exception {
        Path root = Files.createTempDirectory("instancegate-test-cli-");
        try {
            Assertions.assertEquals(0, run(root, "init").code());
            Assertions.assertTrue(Files.exists(root.resolve("security").resolve("instance.key")));

            Result pubkey = run(root, "pubkey");
            Assertions.assertEquals(0, pubkey.code());
            String hex = Jsons.mapper().readTree(pubkey.out()).path("pubkey").asText();
            Assertions.assertEquals(64, hex.length());

            Result instance = run(root, "instance");
            Assertions.assertEquals(0, instance.code());
            Assertions.assertEquals(hex, Jsons.mapper().readTree(instance.out()).path("instance_pubkey").asText());
            Assertions.assertEquals("UNREGISTERED", Jsons.mapper().readTree(instance.out()).path("state").asText());

            Assertions.assertEquals(1, run(root, "instance", "dd".repeat(32)).code());
            Assertions.assertEquals(0, run(root, "audit-verify").code());
            Assertions.assertTrue(run(root, "schema-migrations").out().contains("20261019_001_lifecycle_state_index"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resetRequiresConfirmation() throws Exception {
        Path root = Files.createTempDirectory("instancegate-test-cli-reset-");
        try {
            Assertions.assertEquals(2, run(root, "reset").code());
            Result confirmed = run(root, "reset", "--yes");
            Assertions.assertEquals(0, confirmed.code());
            Assertions.assertFalse(Jsons.mapper().readTree(confirmed.out()).path("deleted").asBoolean());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result run(Path root, String... args) {
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(out, true, StandardCharsets.UTF_8);
             PrintStream errCapture = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            System.setErr(errCapture);
            int code = new CommandLine(new InstanceGateCommand()).execute(full);
            return new Result(code, out.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private record Result(int code, String out) {
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
