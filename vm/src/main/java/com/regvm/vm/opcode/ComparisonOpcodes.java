package com.regvm.vm.opcode;

import com.regvm.vm.Value;

import java.util.Map;
import java.util.function.IntPredicate;

/**
 * Comparison opcodes.
 * All take {@code dst, left, right} and store {@link Value#TRUE} or {@link Value#FALSE}.
 */
public final class ComparisonOpcodes {

    private ComparisonOpcodes() {}

    public static void register(Map<Opcode, OpcodeHandler> handlers) {
        handlers.put(Opcode.COMP_EQUAL, ctx -> compare(ctx, ComparisonOpcodes::looseEquals));
        handlers.put(Opcode.COMP_NOT_EQUAL, ctx -> compare(ctx, (c, a, b) -> !looseEquals(c, a, b)));
        handlers.put(Opcode.COMP_STRICT_EQUAL, ctx -> compare(ctx, ComparisonOpcodes::strictEquals));
        handlers.put(Opcode.COMP_STRICT_NOT_EQUAL, ctx -> compare(ctx, (c, a, b) -> !strictEquals(c, a, b)));
        handlers.put(Opcode.COMP_LESS_THAN, ctx -> compare(ctx, (c, a, b) -> relate(c, a, b, r -> r < 0)));
        handlers.put(Opcode.COMP_GREATER_THAN, ctx -> compare(ctx, (c, a, b) -> relate(c, a, b, r -> r > 0)));
        handlers.put(Opcode.COMP_LESS_THAN_EQUAL, ctx -> compare(ctx, (c, a, b) -> relate(c, a, b, r -> r <= 0)));
        handlers.put(Opcode.COMP_GREATER_THAN_EQUAL, ctx -> compare(ctx, (c, a, b) -> relate(c, a, b, r -> r >= 0)));
    }

    @FunctionalInterface
    private interface Predicate {
        boolean test(ExecutionContext ctx, Value a, Value b);
    }

    private static void compare(ExecutionContext ctx, Predicate predicate) {
        int dst = ctx.nextByte();
        Value a = ctx.readRegisterValue();
        Value b = ctx.readRegisterValue();
        ctx.setRegister(dst, Value.of(predicate.test(ctx, a, b)));
    }

    static boolean strictEquals(ExecutionContext ctx, Value a, Value b) {
        if (a.isNumber() && b.isNumber()) {
            return a.toDouble() == b.toDouble();
        }
        if (a instanceof Value.Host ha && b instanceof Value.Host hb) {
            return ha.object() == hb.object();
        }
        if (a instanceof Value.Callable ca && b instanceof Value.Callable cb) {
            return ca.function() == cb.function();
        }
        if (a instanceof Value.Array && b instanceof Value.Array) {
            return a == b;
        }
        return a.equals(b);
    }

    static boolean looseEquals(ExecutionContext ctx, Value a, Value b) {
        if ((a.isNumber() && b.isString()) || (a.isString() && b.isNumber())) {
            return a.toDouble() == b.toDouble();
        }
        return strictEquals(ctx, a, b);
    }

    // NaN is unordered: every relation involving it is false
    static boolean relate(ExecutionContext ctx, Value a, Value b, IntPredicate relation) {
        if (a instanceof Value.Str sa && b instanceof Value.Str sb) {
            return relation.test(Integer.signum(sa.value().compareTo(sb.value())));
        }
        if (!a.isNumber()) {
            throw ctx.typeMismatch("number or string", a);
        }
        if (!b.isNumber()) {
            throw ctx.typeMismatch("number or string", b);
        }
        double x = a.toDouble();
        double y = b.toDouble();
        if (Double.isNaN(x) || Double.isNaN(y)) {
            return false;
        }
        return relation.test(x == y ? 0 : (x < y ? -1 : 1));
    }
}
