package com.regvm.vm.opcode;

import com.regvm.vm.Value;

import java.util.Map;

/**
 * Control flow opcodes (conditional jump, exit).
 */
public final class ControlFlowOpcodes {

    private ControlFlowOpcodes() {}

    public static void register(Map<Opcode, OpcodeHandler> handlers) {
        handlers.put(Opcode.COND_JUMP, ControlFlowOpcodes::condJump);
        handlers.put(Opcode.EXIT, ControlFlowOpcodes::exit);
    }

    private static void condJump(ExecutionContext ctx) {
        Value cond = ctx.readRegisterValue();
        int deltaReg = ctx.nextByte();
        if (!cond.isTruthy()) {
            return;
        }
        // Relative to the position after this instruction's operands
        Value delta = ctx.getRegister(deltaReg);
        if (!delta.isNumber() || !(Value.number(delta.toDouble()) instanceof Value.Int offset)) {
            throw ctx.typeMismatch("integer jump delta", delta);
        }
        ctx.jumpTo(ctx.getPosition() + offset.value());
    }

    private static void exit(ExecutionContext ctx) {
        ctx.exit();
    }
}
