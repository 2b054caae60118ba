package com.regvm.vm.opcode;

import com.regvm.vm.InstructionCursor;
import com.regvm.vm.OperandDecoder;
import com.regvm.vm.RegisterFile;
import com.regvm.vm.TraceListener;
import com.regvm.vm.VMException;
import com.regvm.vm.Value;
import com.regvm.vm.host.HostBindings;

import java.util.List;

/**
 * Execution context passed to opcode handlers.
 * Provides operand decoding, register access and the host capabilities for one instruction.
 */
public final class ExecutionContext {

    private final RegisterFile registers;
    private final InstructionCursor cursor;
    private final OperandDecoder decoder;
    private final HostBindings host;
    private final TraceListener traceListener;
    private final Opcode opcode;
    private final int instructionOffset;

    public ExecutionContext(
            RegisterFile registers,
            InstructionCursor cursor,
            OperandDecoder decoder,
            HostBindings host,
            TraceListener traceListener,
            Opcode opcode,
            int instructionOffset) {
        this.registers = registers;
        this.cursor = cursor;
        this.decoder = decoder;
        this.host = host;
        this.traceListener = traceListener;
        this.opcode = opcode;
        this.instructionOffset = instructionOffset;
    }

    // Operand decoding

    public int nextByte() {
        return cursor.nextByte();
    }

    /**
     * Read a register-index operand and return the register's value.
     */
    public Value readRegisterValue() {
        return registers.get(cursor.nextByte());
    }

    public String readString() {
        return decoder.readString();
    }

    public List<Value> readRegisterArray() {
        return decoder.readRegisterArray();
    }

    public int readInt32() {
        return decoder.readInt32();
    }

    public double readFloat64() {
        return decoder.readFloat64();
    }

    // Register access

    public Value getRegister(int index) {
        return registers.get(index);
    }

    public void setRegister(int index, Value value) {
        registers.set(index, value);
    }

    public Value.Array snapshotRegisters() {
        return registers.snapshot();
    }

    public void restoreRegisters(List<Value> snapshot) {
        registers.restore(snapshot);
    }

    // Cursor control

    public int getPosition() {
        return cursor.position();
    }

    public void jumpTo(int target) {
        cursor.jumpTo(target);
    }

    public void exit() {
        cursor.exit();
    }

    // Host access

    public HostBindings getHost() {
        return host;
    }

    // Tracing

    public void traceCall(int target) {
        if (traceListener != null) {
            traceListener.onCall(instructionOffset, target);
        }
    }

    public void traceReturn(int returnAddress, Value returnValue) {
        if (traceListener != null) {
            traceListener.onReturn(instructionOffset, returnAddress, returnValue);
        }
    }

    // Exception helpers

    public VMException error(VMException.Kind kind, String message) {
        return new VMException(kind, opcode + ": " + message, instructionOffset, null);
    }

    public VMException error(VMException.Kind kind, String message, Throwable cause) {
        return new VMException(kind, opcode + ": " + message, instructionOffset, cause);
    }

    public VMException typeMismatch(String expected, Value actual) {
        return error(VMException.Kind.TYPE_MISMATCH, "expected " + expected + ", got " + actual.typeName());
    }
}
