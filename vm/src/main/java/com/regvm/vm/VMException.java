package com.regvm.vm;

/**
 * Fatal condition raised while executing bytecode.
 * Every failed run surfaces exactly one of these, tagged with its {@link Kind}.
 */
public class VMException extends RuntimeException {

    /**
     * Fatal condition kinds.
     */
    public enum Kind {
        /** Opcode byte has no registered handler */
        UNKNOWN_OPCODE,
        /** Cursor read or jump outside the stream */
        OUT_OF_BOUNDS,
        /** Operation applied to a value of the wrong kind */
        TYPE_MISMATCH,
        /** Host source evaluation raised or no evaluator is bound */
        HOST_EVALUATION_FAILURE,
        /** Host property read or function call raised */
        HOST_INVOCATION_FAILURE,
        /** Instruction budget exhausted */
        STEP_LIMIT_EXCEEDED
    }

    private final Kind kind;
    private final int offset;

    public VMException(Kind kind, String message) {
        super(message);
        this.kind = kind;
        this.offset = -1;
    }

    public VMException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.offset = -1;
    }

    public VMException(Kind kind, String message, int offset, Throwable cause) {
        super(message + " at [" + offset + "]", cause);
        this.kind = kind;
        this.offset = offset;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Stream offset of the instruction that failed, or -1 if unknown.
     */
    public int getOffset() {
        return offset;
    }

    /**
     * Attach the offset of the failing instruction, keeping kind and cause.
     */
    public VMException at(int offset) {
        if (this.offset >= 0) {
            return this;
        }
        VMException located = new VMException(kind, getMessage(), offset, getCause());
        located.setStackTrace(getStackTrace());
        return located;
    }
}
