package com.regvm.vm.opcode;

import java.util.HashMap;
import java.util.Map;

/**
 * RegVM opcodes, keyed by their byte in the instruction stream.
 */
public enum Opcode {

    LOAD_STRING(0x01, "loadString"),
    LOAD_NUM(0x02, "loadNum"),
    LOAD_FLOAT_NUM(0x03, "loadFloatNum"),
    LOAD_LONG_NUM(0x04, "loadLongNum"),
    PROPACCESS(0x05, "propAccess"),
    FUNC_CALL(0x06, "funcCall"),
    EVAL(0x07, "eval"),
    CALL_BCFUNC(0x08, "callBcFunc"),
    RETURN_BCFUNC(0x09, "returnBcFunc"),
    COPY(0x0A, "copy"),
    EXIT(0x0B, "exit"),
    COND_JUMP(0x0C, "condJump"),
    ADD(0x0D, "add"),
    MUL(0x0E, "mul"),
    MINUS(0x0F, "minus"),
    DIV(0x10, "div"),
    COMP_EQUAL(0x11, "compEqual"),
    COMP_NOT_EQUAL(0x12, "compNotEqual"),
    COMP_STRICT_EQUAL(0x13, "compStrictEqual"),
    COMP_STRICT_NOT_EQUAL(0x14, "compStrictNotEqual"),
    COMP_LESS_THAN(0x15, "compLessThan"),
    COMP_GREATER_THAN(0x16, "compGreaterThan"),
    COMP_LESS_THAN_EQUAL(0x17, "compLessThanEqual"),
    COMP_GREATER_THAN_EQUAL(0x18, "compGreaterThanEqual");

    private static final Map<Integer, Opcode> BY_CODE = new HashMap<>();

    static {
        for (Opcode op : values()) {
            BY_CODE.put(op.code, op);
        }
    }

    private final int code;
    private final String mnemonic;

    Opcode(int code, String mnemonic) {
        this.code = code;
        this.mnemonic = mnemonic;
    }

    public int getCode() {
        return code;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    /**
     * Look up an opcode by its byte.
     * @return The opcode, or null if the byte is unassigned
     */
    public static Opcode fromCode(int code) {
        return BY_CODE.get(code);
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
