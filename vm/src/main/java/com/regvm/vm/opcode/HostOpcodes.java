package com.regvm.vm.opcode;

import com.regvm.vm.VMException;
import com.regvm.vm.Value;
import com.regvm.vm.host.HostEvaluator;
import com.regvm.vm.host.HostObject;

import java.util.List;
import java.util.Map;

/**
 * Host interop opcodes: property access, host function calls and host source evaluation.
 * Host-side failures are wrapped so that a run always ends with a {@link VMException}.
 */
public final class HostOpcodes {

    private HostOpcodes() {}

    public static void register(Map<Opcode, OpcodeHandler> handlers) {
        handlers.put(Opcode.PROPACCESS, HostOpcodes::propAccess);
        handlers.put(Opcode.FUNC_CALL, HostOpcodes::funcCall);
        handlers.put(Opcode.EVAL, HostOpcodes::eval);
    }

    private static void propAccess(ExecutionContext ctx) {
        int dst = ctx.nextByte();
        Value obj = ctx.readRegisterValue();
        Value prop = ctx.readRegisterValue();
        ctx.setRegister(dst, getProperty(ctx, obj, prop));
    }

    static Value getProperty(ExecutionContext ctx, Value obj, Value prop) {
        if (obj instanceof Value.Host host) {
            return readHostProperty(ctx, host.object(), prop);
        }
        // Host functions that are also objects carry properties of their own
        if (obj instanceof Value.Callable callable && callable.function() instanceof HostObject functionObject) {
            return readHostProperty(ctx, functionObject, prop);
        }
        if (obj instanceof Value.Str str) {
            String s = str.value();
            if ("length".equals(prop.toStr())) {
                return Value.of(s.length());
            }
            int index = indexOf(prop);
            return index >= 0 && index < s.length() ? Value.of(String.valueOf(s.charAt(index))) : Value.VOID;
        }
        if (obj instanceof Value.Array array) {
            List<Value> items = array.items();
            if ("length".equals(prop.toStr())) {
                return Value.of(items.size());
            }
            int index = indexOf(prop);
            return index >= 0 && index < items.size() ? items.get(index) : Value.VOID;
        }
        throw ctx.typeMismatch("object", obj);
    }

    private static Value readHostProperty(ExecutionContext ctx, HostObject object, Value prop) {
        try {
            return orVoid(object.getProperty(prop));
        } catch (VMException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ctx.error(VMException.Kind.HOST_INVOCATION_FAILURE,
                "reading " + prop.toStr() + " failed: " + e.getMessage(), e);
        }
    }

    private static void funcCall(ExecutionContext ctx) {
        int dst = ctx.nextByte();
        Value func = ctx.readRegisterValue();
        Value receiver = ctx.readRegisterValue();
        List<Value> args = ctx.readRegisterArray();

        if (!(func instanceof Value.Callable callable)) {
            throw ctx.typeMismatch("callable", func);
        }
        Value result;
        try {
            result = callable.function().call(receiver, args);
        } catch (VMException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ctx.error(VMException.Kind.HOST_INVOCATION_FAILURE,
                "call of " + callable.function() + " failed: " + e.getMessage(), e);
        }
        ctx.setRegister(dst, orVoid(result));
    }

    private static void eval(ExecutionContext ctx) {
        int dst = ctx.nextByte();
        Value source = ctx.readRegisterValue();

        // Non-string input is returned unchanged, like a host eval
        if (!(source instanceof Value.Str str)) {
            ctx.setRegister(dst, source);
            return;
        }
        HostEvaluator evaluator = ctx.getHost().findEvaluator()
            .orElseThrow(() -> ctx.error(VMException.Kind.HOST_EVALUATION_FAILURE, "no host evaluator bound"));
        Value result;
        try {
            result = evaluator.evaluate(str.value());
        } catch (VMException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ctx.error(VMException.Kind.HOST_EVALUATION_FAILURE, e.getMessage(), e);
        }
        ctx.setRegister(dst, orVoid(result));
    }

    // Non-negative integral key, or -1
    private static int indexOf(Value prop) {
        double d = prop.toDouble();
        if (prop.isVoid() || Double.isNaN(d) || d < 0 || d != Math.rint(d) || d > Integer.MAX_VALUE) {
            return -1;
        }
        if (prop instanceof Value.Str s && !s.value().equals(String.valueOf((int) d))) {
            return -1;
        }
        return (int) d;
    }

    private static Value orVoid(Value value) {
        return value == null ? Value.VOID : value;
    }
}
