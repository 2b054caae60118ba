package com.regvm.vm.opcode;

import com.regvm.vm.Value;

import java.util.Map;

/**
 * Arithmetic operation opcodes.
 * All take {@code dst, src} and compute {@code reg[dst] = reg[dst] op reg[src]}.
 */
public final class ArithmeticOpcodes {

    private ArithmeticOpcodes() {}

    public static void register(Map<Opcode, OpcodeHandler> handlers) {
        handlers.put(Opcode.ADD, ArithmeticOpcodes::add);
        handlers.put(Opcode.MINUS, ArithmeticOpcodes::minus);
        handlers.put(Opcode.MUL, ArithmeticOpcodes::mul);
        handlers.put(Opcode.DIV, ArithmeticOpcodes::div);
    }

    private static void add(ExecutionContext ctx) {
        int dst = ctx.nextByte();
        Value b = ctx.readRegisterValue();
        Value a = ctx.getRegister(dst);

        // String on either side concatenates
        if (a.isString() || b.isString()) {
            ctx.setRegister(dst, Value.of(a.toStr() + b.toStr()));
            return;
        }

        requireNumbers(ctx, a, b);
        if (a instanceof Value.Int ia && b instanceof Value.Int ib) {
            long sum = (long) ia.value() + ib.value();
            ctx.setRegister(dst, narrow(sum));
        } else {
            ctx.setRegister(dst, Value.of(a.toDouble() + b.toDouble()));
        }
    }

    private static void minus(ExecutionContext ctx) {
        int dst = ctx.nextByte();
        Value b = ctx.readRegisterValue();
        Value a = ctx.getRegister(dst);

        requireNumbers(ctx, a, b);
        if (a instanceof Value.Int ia && b instanceof Value.Int ib) {
            long difference = (long) ia.value() - ib.value();
            ctx.setRegister(dst, narrow(difference));
        } else {
            ctx.setRegister(dst, Value.of(a.toDouble() - b.toDouble()));
        }
    }

    private static void mul(ExecutionContext ctx) {
        int dst = ctx.nextByte();
        Value b = ctx.readRegisterValue();
        Value a = ctx.getRegister(dst);

        requireNumbers(ctx, a, b);
        if (a instanceof Value.Int ia && b instanceof Value.Int ib) {
            long product = (long) ia.value() * ib.value();
            ctx.setRegister(dst, narrow(product));
        } else {
            ctx.setRegister(dst, Value.of(a.toDouble() * b.toDouble()));
        }
    }

    private static void div(ExecutionContext ctx) {
        int dst = ctx.nextByte();
        Value b = ctx.readRegisterValue();
        Value a = ctx.getRegister(dst);

        requireNumbers(ctx, a, b);
        if (a instanceof Value.Int ia && b instanceof Value.Int ib
                && ib.value() != 0 && ia.value() % ib.value() == 0) {
            ctx.setRegister(dst, narrow((long) ia.value() / ib.value()));
            return;
        }
        // Division by zero follows IEEE-754: +/-Infinity or NaN
        ctx.setRegister(dst, Value.of(a.toDouble() / b.toDouble()));
    }

    private static void requireNumbers(ExecutionContext ctx, Value a, Value b) {
        if (!a.isNumber()) {
            throw ctx.typeMismatch("number", a);
        }
        if (!b.isNumber()) {
            throw ctx.typeMismatch("number", b);
        }
    }

    // Int results that leave the int range widen to float
    private static Value narrow(long value) {
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return Value.of((int) value);
        }
        return Value.of((double) value);
    }
}
