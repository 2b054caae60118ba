package com.regvm.vm.trace;

import com.regvm.vm.RegVM;
import com.regvm.vm.RegisterFile;
import com.regvm.vm.TraceListener;
import com.regvm.vm.opcode.Opcode;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Unit tests for console trace formatting.
 */
class ConsoleTracePrinterTest {

    @Test
    void testFormatInstruction() {
        String line = ConsoleTracePrinter.formatInstruction(new TraceListener.InstructionInfo(7, 0x0D, "add", 3));
        assertTrue(line.startsWith("--> [  7] add"));
        assertTrue(line.endsWith("(0x0D)"));
    }

    @Test
    void testLoopIterationsSuppressed() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ConsoleTracePrinter printer = new ConsoleTracePrinter(new PrintStream(bytes, true, StandardCharsets.UTF_8));

        TraceListener.InstructionInfo info = new TraceListener.InstructionInfo(0, 0x0C, "condJump", 1);
        printer.onInstruction(info);
        printer.onInstruction(info);
        printer.onInstruction(info);

        String[] lines = bytes.toString(StandardCharsets.UTF_8).split("\\R");
        assertEquals(2, lines.length);
        assertTrue(lines[1].contains("loop iterations suppressed"));
    }

    @Test
    void testResetForgetsVisitedOffsets() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        ConsoleTracePrinter printer = new ConsoleTracePrinter(new PrintStream(bytes, true, StandardCharsets.UTF_8));

        TraceListener.InstructionInfo info = new TraceListener.InstructionInfo(0, 0x02, "loadNum", 1);
        printer.onInstruction(info);
        printer.reset();
        printer.onInstruction(info);

        String output = bytes.toString(StandardCharsets.UTF_8);
        assertFalse(output.contains("suppressed"), output);
        assertEquals(2, output.split("loadNum", -1).length - 1);
    }

    @Test
    void testSecondRunOnSameVmIsTracedInFull() {
        PrintStream original = System.out;
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(bytes, true, StandardCharsets.UTF_8));
            RegVM vm = new RegVM();
            vm.setTraceEnabled(true);
            int[] code = {Opcode.LOAD_NUM.getCode(), RegisterFile.RETURN_VAL, 3, Opcode.EXIT.getCode()};
            vm.init(code);
            vm.run();
            vm.init(code);
            vm.run();
        } finally {
            System.setOut(original);
        }

        String output = bytes.toString(StandardCharsets.UTF_8);
        assertFalse(output.contains("suppressed"), output);
        assertEquals(2, output.split("loadNum", -1).length - 1, output);
    }

    @Test
    void testTraceEnabledPrintsToStdout() {
        PrintStream original = System.out;
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(bytes, true, StandardCharsets.UTF_8));
            RegVM vm = new RegVM();
            vm.setTraceEnabled(true);
            vm.init(new int[] {Opcode.LOAD_NUM.getCode(), RegisterFile.RETURN_VAL, 3, Opcode.EXIT.getCode()});
            vm.run();
        } finally {
            System.setOut(original);
        }

        String output = bytes.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("loadNum"), output);
        assertTrue(output.contains("exit after 2 instructions, returned 3"), output);
    }
}
