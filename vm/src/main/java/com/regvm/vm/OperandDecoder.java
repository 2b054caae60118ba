package com.regvm.vm;

import java.util.ArrayList;
import java.util.List;

/**
 * Readers for multi-byte operands, built on the instruction cursor.
 */
public final class OperandDecoder {

    private final InstructionCursor cursor;
    private final RegisterFile registers;
    private final LengthPrefixMode lengthPrefixMode;

    public OperandDecoder(InstructionCursor cursor, RegisterFile registers, LengthPrefixMode lengthPrefixMode) {
        this.cursor = cursor;
        this.registers = registers;
        this.lengthPrefixMode = lengthPrefixMode;
    }

    public int readLength() {
        int high = cursor.nextByte();
        if (lengthPrefixMode == LengthPrefixMode.LEGACY_SHORT_CIRCUIT) {
            int shifted = high << 8;
            return shifted != 0 ? shifted : cursor.nextByte();
        }
        int low = cursor.nextByte();
        return (high << 8) | low;
    }

    /**
     * Length-prefixed string, one character code per byte.
     */
    public String readString() {
        int length = readLength();
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append((char) cursor.nextByte());
        }
        return sb.toString();
    }

    /**
     * Length-prefixed list of register indices, resolved to their current values.
     */
    public List<Value> readRegisterArray() {
        int length = readLength();
        List<Value> values = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            values.add(registers.get(cursor.nextByte()));
        }
        return values;
    }

    /**
     * 32-bit big-endian two's complement integer.
     */
    public int readInt32() {
        int value = 0;
        for (int i = 0; i < 4; i++) {
            value = (value << 8) | cursor.nextByte();
        }
        return value;
    }

    /**
     * 64-bit big-endian IEEE-754 double.
     */
    public double readFloat64() {
        long bits = 0;
        for (int i = 0; i < 8; i++) {
            bits = (bits << 8) | cursor.nextByte();
        }
        return Double.longBitsToDouble(bits);
    }

    public LengthPrefixMode getLengthPrefixMode() {
        return lengthPrefixMode;
    }
}
