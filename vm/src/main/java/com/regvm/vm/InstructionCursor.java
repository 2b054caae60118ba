package com.regvm.vm;

/**
 * Sequential reader over the combined code/data stream.
 * The position lives in the {@link RegisterFile#STACK_PTR} register, so restoring the
 * register file also moves the cursor.
 */
public final class InstructionCursor {

    private final int[] stream;
    private final RegisterFile registers;

    public InstructionCursor(int[] stream, RegisterFile registers) {
        this.stream = stream;
        this.registers = registers;
    }

    /**
     * Read the value at the current position and advance by one.
     */
    public int nextByte() {
        int position = position();
        if (position < 0 || position >= stream.length) {
            throw new VMException(VMException.Kind.OUT_OF_BOUNDS,
                "Read at " + position + " outside stream of length " + stream.length);
        }
        registers.set(RegisterFile.STACK_PTR, Value.of(position + 1));
        return stream[position];
    }

    public int position() {
        Value sp = registers.get(RegisterFile.STACK_PTR);
        if (!(sp instanceof Value.Int i)) {
            throw new VMException(VMException.Kind.TYPE_MISMATCH,
                "Stack pointer holds " + sp.typeName() + ", expected int");
        }
        return i.value();
    }

    /**
     * Move to an absolute position. The end of the stream is a valid target and ends execution.
     */
    public void jumpTo(int target) {
        if (target < 0 || target > stream.length) {
            throw new VMException(VMException.Kind.OUT_OF_BOUNDS,
                "Jump target " + target + " outside stream of length " + stream.length);
        }
        registers.set(RegisterFile.STACK_PTR, Value.of(target));
    }

    /**
     * Move to the end of the stream.
     */
    public void exit() {
        registers.set(RegisterFile.STACK_PTR, Value.of(stream.length));
    }

    public int length() {
        return stream.length;
    }

    public boolean atEnd() {
        return position() >= stream.length;
    }
}
