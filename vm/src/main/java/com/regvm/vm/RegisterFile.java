package com.regvm.vm;

import java.util.Arrays;
import java.util.List;

/**
 * Indexed storage of 256 dynamically-typed registers.
 * The top of the file is reserved for machine state; the rest is free for program data.
 */
public final class RegisterFile {

    public static final int SIZE = 256;

    /** Cursor position into the instruction stream */
    public static final int STACK_PTR = 255;
    /** Value surfaced by a completed run */
    public static final int RETURN_VAL = 254;
    /** Register-file snapshot held across a bytecode call */
    public static final int REG_BACKUP = 253;
    /** Host environment root */
    public static final int WINDOW = 252;
    /** Host document root */
    public static final int DOCUMENT = 251;
    /** Void constant */
    public static final int VOID = 250;
    /** Empty host object constant */
    public static final int EMPTY_OBJ = 249;

    private Value[] registers;

    public RegisterFile() {
        this.registers = new Value[SIZE];
        clear();
    }

    public Value get(int index) {
        checkIndex(index);
        return registers[index];
    }

    public void set(int index, Value value) {
        checkIndex(index);
        registers[index] = value == null ? Value.VOID : value;
    }

    /**
     * Reset every register to void.
     */
    public void clear() {
        Arrays.fill(registers, Value.VOID);
    }

    /**
     * Copy of the whole file, including the reserved registers.
     */
    public Value.Array snapshot() {
        return new Value.Array(Arrays.asList(registers.clone()));
    }

    /**
     * Replace the whole file with a snapshot taken by {@link #snapshot()}.
     */
    public void restore(List<Value> snapshot) {
        if (snapshot.size() != SIZE) {
            throw new IllegalArgumentException("Snapshot has " + snapshot.size() + " registers, expected " + SIZE);
        }
        registers = snapshot.toArray(new Value[0]);
    }

    public static boolean isSnapshot(Value value) {
        return value instanceof Value.Array array && array.size() == SIZE;
    }

    public static String nameOf(int index) {
        return switch (index) {
            case STACK_PTR -> "STACK_PTR";
            case RETURN_VAL -> "RETURN_VAL";
            case REG_BACKUP -> "REG_BACKUP";
            case WINDOW -> "WINDOW";
            case DOCUMENT -> "DOCUMENT";
            case VOID -> "VOID";
            case EMPTY_OBJ -> "EMPTY_OBJ";
            default -> "r" + index;
        };
    }

    private static void checkIndex(int index) {
        if (index < 0 || index >= SIZE) {
            throw new IllegalArgumentException("Register index out of range: " + index);
        }
    }
}
