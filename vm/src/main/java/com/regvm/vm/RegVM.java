package com.regvm.vm;

import com.regvm.vm.host.HostBindings;
import com.regvm.vm.opcode.ExecutionContext;
import com.regvm.vm.opcode.Opcode;
import com.regvm.vm.opcode.OpcodeHandler;
import com.regvm.vm.opcode.OpcodeRegistry;
import com.regvm.vm.trace.ConsoleTracePrinter;

import java.util.Objects;

/**
 * Register-based bytecode virtual machine.
 * Executes one pre-encoded program+data stream per {@link #init} and returns the
 * {@link RegisterFile#RETURN_VAL} register.
 *
 * Not thread-safe; one run at a time per instance.
 */
public class RegVM {

    private final HostBindings host;
    private final OpcodeRegistry opcodeRegistry;
    private final ConsoleTracePrinter consolePrinter;

    private boolean traceEnabled = false;
    private int stepLimit = 0;
    private LengthPrefixMode lengthPrefixMode = LengthPrefixMode.BIG_ENDIAN;

    // Trace listener for tooling
    private TraceListener traceListener;

    // Per-program state, rebuilt by init()
    private RegisterFile registers;
    private InstructionCursor cursor;
    private OperandDecoder decoder;

    public RegVM() {
        this(HostBindings.detached());
    }

    public RegVM(HostBindings host) {
        this.host = Objects.requireNonNull(host, "host");
        this.opcodeRegistry = new OpcodeRegistry();
        this.consolePrinter = new ConsoleTracePrinter();
    }

    // Configuration

    public void setTraceEnabled(boolean enabled) {
        this.traceEnabled = enabled;
    }

    public boolean isTraceEnabled() {
        return traceEnabled;
    }

    public void setTraceListener(TraceListener listener) {
        this.traceListener = listener;
    }

    public TraceListener getTraceListener() {
        return traceListener;
    }

    /**
     * Maximum number of instructions per run; 0 means unlimited.
     */
    public void setStepLimit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Step limit must be >= 0: " + limit);
        }
        this.stepLimit = limit;
    }

    public int getStepLimit() {
        return stepLimit;
    }

    /**
     * Takes effect on the next {@link #init}.
     */
    public void setLengthPrefixMode(LengthPrefixMode mode) {
        this.lengthPrefixMode = Objects.requireNonNull(mode, "mode");
    }

    public LengthPrefixMode getLengthPrefixMode() {
        return lengthPrefixMode;
    }

    public OpcodeRegistry getOpcodeRegistry() {
        return opcodeRegistry;
    }

    public HostBindings getHost() {
        return host;
    }

    // Lifecycle

    /**
     * Load a stream of signed bytes; each is read as its unsigned value.
     */
    public void init(byte[] bytecode) {
        int[] stream = new int[bytecode.length];
        for (int i = 0; i < bytecode.length; i++) {
            stream[i] = bytecode[i] & 0xFF;
        }
        load(stream);
    }

    /**
     * Load a stream of byte values (0-255).
     */
    public void init(int[] bytecode) {
        for (int i = 0; i < bytecode.length; i++) {
            if (bytecode[i] < 0 || bytecode[i] > 0xFF) {
                throw new IllegalArgumentException("Stream value at " + i + " is not a byte: " + bytecode[i]);
            }
        }
        load(bytecode.clone());
    }

    private void load(int[] stream) {
        consolePrinter.reset();
        registers = new RegisterFile();
        cursor = new InstructionCursor(stream, registers);
        decoder = new OperandDecoder(cursor, registers, lengthPrefixMode);

        registers.set(RegisterFile.STACK_PTR, Value.ZERO);
        registers.set(RegisterFile.RETURN_VAL, Value.ZERO);
        registers.set(RegisterFile.WINDOW, host.environment());
        registers.set(RegisterFile.DOCUMENT, host.document());
        registers.set(RegisterFile.VOID, Value.VOID);
        registers.set(RegisterFile.EMPTY_OBJ, host.newEmptyObject());
    }

    public boolean isInitialized() {
        return registers != null;
    }

    /**
     * Execute until the stack pointer reaches the end of the stream.
     * @return The content of the return-value register
     * @throws VMException on the first fatal condition
     */
    public Value run() {
        if (!isInitialized()) {
            throw new IllegalStateException("init() must be called before run()");
        }

        int steps = 0;
        int offset = -1;
        try {
            while (!cursor.atEnd()) {
                offset = cursor.position();
                if (stepLimit > 0 && steps >= stepLimit) {
                    throw new VMException(VMException.Kind.STEP_LIMIT_EXCEEDED,
                        "Step limit exceeded (" + stepLimit + " instructions)");
                }
                executeInstruction(offset, ++steps);
            }
        } catch (VMException e) {
            VMException located = offset >= 0 ? e.at(offset) : e;
            if (traceEnabled) {
                consolePrinter.onError(located.getMessage(), located);
            }
            if (traceListener != null) {
                traceListener.onError(located.getMessage(), located);
            }
            throw located;
        }

        Value result = registers.get(RegisterFile.RETURN_VAL);
        if (traceEnabled) {
            consolePrinter.onExit(result, steps);
        }
        if (traceListener != null) {
            traceListener.onExit(result, steps);
        }
        return result;
    }

    /**
     * Execute a single instruction starting at {@code offset}.
     */
    private void executeInstruction(int offset, int step) {
        int code = cursor.nextByte();
        Opcode op = Opcode.fromCode(code);
        OpcodeHandler handler = op == null ? null : opcodeRegistry.get(op);
        if (handler == null) {
            throw new VMException(VMException.Kind.UNKNOWN_OPCODE,
                String.format("Unknown opcode 0x%02X", code), offset, null);
        }

        if (traceEnabled || traceListener != null) {
            TraceListener.InstructionInfo info = new TraceListener.InstructionInfo(offset, code, op.getMnemonic(), step);
            if (traceEnabled) {
                consolePrinter.onInstruction(info);
            }
            if (traceListener != null) {
                traceListener.onInstruction(info);
            }
        }

        handler.execute(createExecutionContext(op, offset));
    }

    /**
     * Create an execution context for opcode handlers.
     */
    private ExecutionContext createExecutionContext(Opcode op, int offset) {
        TraceListener listener = traceListener;
        if (traceEnabled) {
            listener = listener == null ? consolePrinter : new TraceFanout(consolePrinter, listener);
        }
        return new ExecutionContext(registers, cursor, decoder, host, listener, op, offset);
    }

    // Register access for embedders and tests

    public Value getRegister(int index) {
        requireInitialized();
        return registers.get(index);
    }

    public void setRegister(int index, Value value) {
        requireInitialized();
        registers.set(index, value);
    }

    public int getStackPointer() {
        requireInitialized();
        return cursor.position();
    }

    public int getStreamLength() {
        requireInitialized();
        return cursor.length();
    }

    private void requireInitialized() {
        if (!isInitialized()) {
            throw new IllegalStateException("VM has not been initialized");
        }
    }

    /**
     * Forwards call/return events to the console printer and a custom listener.
     */
    private record TraceFanout(TraceListener first, TraceListener second) implements TraceListener {
        @Override
        public void onCall(int offset, int target) {
            first.onCall(offset, target);
            second.onCall(offset, target);
        }

        @Override
        public void onReturn(int offset, int returnAddress, Value returnValue) {
            first.onReturn(offset, returnAddress, returnValue);
            second.onReturn(offset, returnAddress, returnValue);
        }
    }
}
