package com.regvm.runtime;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tests for the command-line runner.
 */
class RegVMRunnerTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return RegVMRunner.run(args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path write(int... bytes) throws IOException {
        byte[] data = new byte[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            data[i] = (byte) bytes[i];
        }
        Path file = tempDir.resolve("program.bin");
        Files.write(file, data);
        return file;
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8).trim();
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8).trim();
    }

    @Test
    void testRunPrintsResult() throws IOException {
        // r0 = 3; r1 = 4; r0 += r1; RET = r0
        Path file = write(0x02, 0, 3, 0x02, 1, 4, 0x0D, 0, 1, 0x0A, 254, 0);

        assertEquals(RegVMRunner.EXIT_OK, run(file.toString()));
        assertEquals("7", stdout());
    }

    @Test
    void testRunEval() throws IOException {
        Path file = write(0x01, 0, 0, 5, '6', ' ', '*', ' ', '7', 0x07, 254, 0);

        assertEquals(RegVMRunner.EXIT_OK, run(file.toString()));
        assertEquals("42", stdout());
    }

    @Test
    void testVmErrorExitsOne() throws IOException {
        Path file = write(0xEE);

        assertEquals(RegVMRunner.EXIT_ERROR, run(file.toString()));
        assertTrue(stderr().startsWith("Error [UNKNOWN_OPCODE]:"), stderr());
    }

    @Test
    void testStepLimitOption() throws IOException {
        // r0 = 1; r1 = -3 (32-bit); jump back onto the jump forever
        Path file = write(0x02, 0, 1, 0x04, 1, 0xFF, 0xFF, 0xFF, 0xFD, 0x0C, 0, 1);

        assertEquals(RegVMRunner.EXIT_ERROR, run(file.toString(), "--step-limit=50"));
        assertTrue(stderr().contains("STEP_LIMIT_EXCEEDED"), stderr());
    }

    @Test
    void testLegacyLengthOption() throws IOException {
        Path file = write(0x01, 254, 0x00, 0x02, 'o', 'k');

        assertEquals(RegVMRunner.EXIT_OK, run(file.toString(), "--legacy-length"));
        assertEquals("ok", stdout());
    }

    @Test
    void testTraceOption() throws IOException {
        Path file = write(0x02, 254, 1, 0x0B);

        assertEquals(RegVMRunner.EXIT_OK, run(file.toString(), "--trace"));
        assertTrue(stdout().contains("loadNum"), stdout());
        assertTrue(stdout().endsWith("1"), stdout());
    }

    @Test
    void testUsageErrors() {
        assertEquals(RegVMRunner.EXIT_USAGE, run());
        assertEquals(RegVMRunner.EXIT_USAGE, run("a.bin", "--bogus"));
        assertEquals(RegVMRunner.EXIT_USAGE, run("a.bin", "--step-limit=x"));
        assertEquals(RegVMRunner.EXIT_USAGE, run("a.bin", "b.bin"));
        assertTrue(stderr().contains("Usage"));
    }

    @Test
    void testMissingFile() {
        assertEquals(RegVMRunner.EXIT_ERROR, run(tempDir.resolve("missing.bin").toString()));
        assertTrue(stderr().startsWith("Error reading"), stderr());
    }
}
