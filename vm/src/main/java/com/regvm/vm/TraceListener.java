package com.regvm.vm;

/**
 * Listener for VM execution trace events.
 * Implement this to receive detailed execution information.
 */
public interface TraceListener {

    /**
     * Called before each instruction is executed (after its opcode byte is read).
     */
    default void onInstruction(InstructionInfo info) {}

    /**
     * Called when CALL_BCFUNC transfers control into a subroutine.
     */
    default void onCall(int offset, int target) {}

    /**
     * Called when RETURN_BCFUNC has restored the register file.
     */
    default void onReturn(int offset, int returnAddress, Value returnValue) {}

    /**
     * Called when a run ends with a fatal condition.
     */
    default void onError(String message, VMException error) {}

    /**
     * Called when a run completes normally.
     */
    default void onExit(Value returnValue, int steps) {}

    /**
     * Instruction execution information.
     */
    record InstructionInfo(
        int offset,
        int code,
        String opcode,
        int step
    ) {}
}
