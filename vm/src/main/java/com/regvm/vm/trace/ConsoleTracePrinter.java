package com.regvm.vm.trace;

import com.regvm.vm.TraceListener;
import com.regvm.vm.VMException;
import com.regvm.vm.Value;

import java.io.PrintStream;
import java.util.HashSet;
import java.util.Set;

/**
 * Formats and prints trace output to the console.
 *
 * Output format:
 * - Instructions: "--> [offset] mnemonic"
 * - Calls: "== call [offset] -> target"
 * - Returns: "== return to target with value"
 */
public class ConsoleTracePrinter implements TraceListener {

    private final PrintStream out;

    // Track visited instruction offsets to suppress loop repetitions
    private final Set<Integer> visitedOffsets = new HashSet<>();
    private boolean loopSuppressed = false;

    public ConsoleTracePrinter() {
        this(System.out);
    }

    public ConsoleTracePrinter(PrintStream out) {
        this.out = out;
    }

    /**
     * Forget visited offsets so a new program is traced from the start.
     */
    public void reset() {
        visitedOffsets.clear();
        loopSuppressed = false;
    }

    /**
     * Check if this instruction has been visited before (for loop suppression).
     * Returns true if we should skip printing this instruction.
     */
    private boolean shouldSuppressInstruction(int offset) {
        if (visitedOffsets.contains(offset)) {
            if (!loopSuppressed) {
                out.println("    ... [loop iterations suppressed] ...");
                loopSuppressed = true;
            }
            return true;
        }
        visitedOffsets.add(offset);
        loopSuppressed = false;
        return false;
    }

    @Override
    public void onInstruction(InstructionInfo info) {
        if (shouldSuppressInstruction(info.offset())) {
            return;
        }
        out.println(formatInstruction(info));
    }

    @Override
    public void onCall(int offset, int target) {
        // A subroutine body is new code even if it was visited before
        reset();
        out.println("== call [" + offset + "] -> " + target);
    }

    @Override
    public void onReturn(int offset, int returnAddress, Value returnValue) {
        out.println("== return [" + offset + "] -> " + returnAddress + " with " + returnValue);
    }

    @Override
    public void onError(String message, VMException error) {
        out.println("!! " + error.getKind() + ": " + message);
    }

    @Override
    public void onExit(Value returnValue, int steps) {
        out.println("== exit after " + steps + " instructions, returned " + returnValue);
    }

    /**
     * Format an instruction for display (without printing).
     */
    public static String formatInstruction(InstructionInfo info) {
        return String.format("--> [%3d] %-20s (0x%02X)", info.offset(), info.opcode(), info.code());
    }
}
