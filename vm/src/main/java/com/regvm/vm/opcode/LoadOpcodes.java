package com.regvm.vm.opcode;

import com.regvm.vm.Value;

import java.util.Map;

/**
 * Register load and copy opcodes.
 */
public final class LoadOpcodes {

    private LoadOpcodes() {}

    public static void register(Map<Opcode, OpcodeHandler> handlers) {
        handlers.put(Opcode.LOAD_NUM, LoadOpcodes::loadNum);
        handlers.put(Opcode.LOAD_LONG_NUM, LoadOpcodes::loadLongNum);
        handlers.put(Opcode.LOAD_FLOAT_NUM, LoadOpcodes::loadFloatNum);
        handlers.put(Opcode.LOAD_STRING, LoadOpcodes::loadString);
        handlers.put(Opcode.COPY, LoadOpcodes::copy);
    }

    private static void loadNum(ExecutionContext ctx) {
        int dst = ctx.nextByte();
        int value = ctx.nextByte();
        ctx.setRegister(dst, Value.of(value));
    }

    private static void loadLongNum(ExecutionContext ctx) {
        int dst = ctx.nextByte();
        int value = ctx.readInt32();
        ctx.setRegister(dst, Value.of(value));
    }

    private static void loadFloatNum(ExecutionContext ctx) {
        int dst = ctx.nextByte();
        double value = ctx.readFloat64();
        ctx.setRegister(dst, Value.of(value));
    }

    private static void loadString(ExecutionContext ctx) {
        int dst = ctx.nextByte();
        String value = ctx.readString();
        ctx.setRegister(dst, Value.of(value));
    }

    private static void copy(ExecutionContext ctx) {
        int dst = ctx.nextByte();
        int src = ctx.nextByte();
        ctx.setRegister(dst, ctx.getRegister(src));
    }
}
