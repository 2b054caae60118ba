package com.regvm.vm.opcode;

import com.regvm.vm.RegisterFile;
import com.regvm.vm.VMException;
import com.regvm.vm.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Bytecode subroutine call and return.
 *
 * A call saves the whole register file in {@link RegisterFile#REG_BACKUP}; the return restores it,
 * carrying the callee's {@link RegisterFile#RETURN_VAL} across. The saved stack pointer is the
 * return address. The snapshot is taken before the backup register is overwritten, so it holds
 * the caller's own backup and a return re-exposes it to the next return.
 */
public final class CallOpcodes {

    private CallOpcodes() {}

    public static void register(Map<Opcode, OpcodeHandler> handlers) {
        handlers.put(Opcode.CALL_BCFUNC, CallOpcodes::callBcFunc);
        handlers.put(Opcode.RETURN_BCFUNC, CallOpcodes::returnBcFunc);
    }

    private static void callBcFunc(ExecutionContext ctx) {
        int target = ctx.nextByte();
        Value.Array snapshot = ctx.snapshotRegisters();
        ctx.setRegister(RegisterFile.REG_BACKUP, snapshot);
        ctx.jumpTo(target);
        ctx.traceCall(target);
    }

    private static void returnBcFunc(ExecutionContext ctx) {
        Value backup = ctx.getRegister(RegisterFile.REG_BACKUP);
        if (!RegisterFile.isSnapshot(backup)) {
            throw ctx.error(VMException.Kind.TYPE_MISMATCH,
                "no register snapshot to return to (backup holds " + backup.typeName() + ")");
        }
        Value returnValue = ctx.getRegister(RegisterFile.RETURN_VAL);
        List<Value> restored = new ArrayList<>(((Value.Array) backup).items());
        restored.set(RegisterFile.RETURN_VAL, returnValue);
        ctx.restoreRegisters(restored);
        ctx.traceReturn(ctx.getPosition(), returnValue);
    }
}
