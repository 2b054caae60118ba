package com.regvm.vm;

import com.regvm.vm.host.HostBindings;
import com.regvm.vm.host.MapHostObject;
import com.regvm.vm.opcode.Opcode;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Unit tests for the execution loop and VM lifecycle.
 */
class RegVMTest {

    private static final int RET = RegisterFile.RETURN_VAL;

    @Test
    void testSumProgram() {
        RegVM vm = new RegVM();
        vm.init(BytecodeBuilder.create()
            .loadNum(0, 3)
            .loadNum(1, 4)
            .add(0, 1)
            .copy(RET, 0)
            .exit()
            .build());

        assertEquals(Value.of(7), vm.run());
    }

    @Test
    void testSumOfManyImmediates() {
        int[] immediates = {0, 1, 17, 255, 42, 99, 3};
        BytecodeBuilder code = BytecodeBuilder.create().loadNum(0, 0);
        int expected = 0;
        for (int imm : immediates) {
            code.loadNum(1, imm).add(0, 1);
            expected += imm;
        }
        RegVM vm = new RegVM();
        vm.init(code.copy(RET, 0).build());

        assertEquals(expected, vm.run().toInt());
    }

    @Test
    void testEmptyProgramReturnsZero() {
        RegVM vm = new RegVM();
        vm.init(new int[0]);

        assertEquals(Value.ZERO, vm.run());
    }

    @Test
    void testRunWithoutInitFails() {
        RegVM vm = new RegVM();
        assertThrows(IllegalStateException.class, vm::run);
    }

    @Test
    void testInitPopulatesReservedRegisters() {
        MapHostObject window = new MapHostObject().put("name", Value.of("main"));
        MapHostObject document = new MapHostObject();
        RegVM vm = new RegVM(new HostBindings(Value.host(window), Value.host(document), null));
        vm.init(new int[] {Opcode.EXIT.getCode()});

        assertEquals(0, vm.getStackPointer());
        assertEquals(Value.ZERO, vm.getRegister(RET));
        assertSame(window, ((Value.Host) vm.getRegister(RegisterFile.WINDOW)).object());
        assertSame(document, ((Value.Host) vm.getRegister(RegisterFile.DOCUMENT)).object());
        assertTrue(vm.getRegister(RegisterFile.VOID).isVoid());
        assertTrue(vm.getRegister(RegisterFile.EMPTY_OBJ).isHost());
        assertTrue(vm.getRegister(RegisterFile.REG_BACKUP).isVoid());
        assertTrue(vm.getRegister(0).isVoid());
    }

    @Test
    void testInitResetsPreviousState() {
        RegVM vm = new RegVM();
        vm.init(BytecodeBuilder.create().loadNum(5, 9).loadNum(RET, 1).build());
        vm.run();
        assertEquals(9, vm.getRegister(5).toInt());

        vm.init(BytecodeBuilder.create().exit().build());
        assertTrue(vm.getRegister(5).isVoid());
        assertEquals(Value.ZERO, vm.run());
    }

    @Test
    void testEmptyObjectIsFreshPerInit() {
        RegVM vm = new RegVM();
        vm.init(new int[0]);
        Value first = vm.getRegister(RegisterFile.EMPTY_OBJ);
        vm.init(new int[0]);
        assertNotSame(first, vm.getRegister(RegisterFile.EMPTY_OBJ));
    }

    @Test
    void testEmptyObjectComesFromHostFactory() {
        List<MapHostObject> created = new ArrayList<>();
        HostBindings bindings = new HostBindings(Value.host(new MapHostObject()), Value.host(new MapHostObject()), null,
            () -> {
                MapHostObject object = new MapHostObject();
                created.add(object);
                return Value.host(object);
            });
        RegVM vm = new RegVM(bindings);
        vm.init(new int[0]);
        vm.init(new int[0]);

        assertEquals(2, created.size());
        assertSame(created.get(1), ((Value.Host) vm.getRegister(RegisterFile.EMPTY_OBJ)).object());
    }

    @Test
    void testInitAcceptsSignedBytes() {
        RegVM vm = new RegVM();
        vm.init(new byte[] {(byte) Opcode.LOAD_NUM.getCode(), (byte) RET, (byte) 200});

        assertEquals(200, vm.run().toInt());
    }

    @Test
    void testInitRejectsNonByteValues() {
        RegVM vm = new RegVM();
        assertThrows(IllegalArgumentException.class, () -> vm.init(new int[] {2, 0, 256}));
        assertThrows(IllegalArgumentException.class, () -> vm.init(new int[] {-1}));
    }

    @Test
    void testExitIgnoresRemainingStream() {
        RegVM vm = new RegVM();
        vm.init(BytecodeBuilder.create()
            .loadNum(RET, 5)
            .exit()
            .loadNum(RET, 6)
            .raw(0xFF, 0xFE)
            .build());

        assertEquals(5, vm.run().toInt());
        assertEquals(vm.getStreamLength(), vm.getStackPointer());
    }

    @Test
    void testExitLeavesReturnValueUntouched() {
        RegVM vm = new RegVM();
        vm.init(BytecodeBuilder.create().loadNum(0, 8).exit().build());

        assertEquals(Value.ZERO, vm.run());
    }

    @Test
    void testUnknownOpcodeHalts() {
        RegVM vm = new RegVM();
        vm.init(BytecodeBuilder.create()
            .loadNum(RET, 1)
            .raw(0xEE)
            .loadNum(RET, 2)
            .build());

        VMException e = assertThrows(VMException.class, vm::run);
        assertEquals(VMException.Kind.UNKNOWN_OPCODE, e.getKind());
        assertEquals(3, e.getOffset());
        assertEquals(1, vm.getRegister(RET).toInt(), "execution must stop at the unknown opcode");
    }

    @Test
    void testZeroByteIsUnknownOpcode() {
        RegVM vm = new RegVM();
        vm.init(new int[] {0x00});

        VMException e = assertThrows(VMException.class, vm::run);
        assertEquals(VMException.Kind.UNKNOWN_OPCODE, e.getKind());
    }

    @Test
    void testUnregisteredHandlerIsUnknownOpcode() {
        RegVM vm = new RegVM();
        vm.getOpcodeRegistry().unregister(Opcode.MUL);
        vm.init(BytecodeBuilder.create().loadNum(0, 2).mul(0, 0).build());

        VMException e = assertThrows(VMException.class, vm::run);
        assertEquals(VMException.Kind.UNKNOWN_OPCODE, e.getKind());
    }

    @Test
    void testTruncatedOperandIsOutOfBounds() {
        RegVM vm = new RegVM();
        vm.init(new int[] {Opcode.LOAD_NUM.getCode(), 0});

        VMException e = assertThrows(VMException.class, vm::run);
        assertEquals(VMException.Kind.OUT_OF_BOUNDS, e.getKind());
        assertEquals(0, e.getOffset());
    }

    @Test
    void testCorruptedStackPointerIsTypeMismatch() {
        RegVM vm = new RegVM();
        vm.init(BytecodeBuilder.create()
            .loadString(0, "x")
            .copy(RegisterFile.STACK_PTR, 0)
            .build());

        VMException e = assertThrows(VMException.class, vm::run);
        assertEquals(VMException.Kind.TYPE_MISMATCH, e.getKind());
    }

    @Test
    void testStepLimit() {
        // r0 = 1 (truthy), r1 = -3: jump back onto the jump itself forever
        int[] code = BytecodeBuilder.create()
            .loadNum(0, 1)
            .loadLongNum(1, -3)
            .condJump(0, 1)
            .build();
        RegVM vm = new RegVM();
        vm.setStepLimit(100);
        vm.init(code);

        VMException e = assertThrows(VMException.class, vm::run);
        assertEquals(VMException.Kind.STEP_LIMIT_EXCEEDED, e.getKind());
        assertEquals(9, e.getOffset());
    }

    @Test
    void testNegativeStepLimitRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RegVM().setStepLimit(-1));
    }

    @Test
    void testTraceListenerEvents() {
        List<String> events = new ArrayList<>();
        RegVM vm = new RegVM();
        vm.setTraceListener(new TraceListener() {
            @Override
            public void onInstruction(InstructionInfo info) {
                events.add(info.offset() + ":" + info.opcode());
            }

            @Override
            public void onExit(Value returnValue, int steps) {
                events.add("exit:" + returnValue + ":" + steps);
            }
        });
        vm.init(BytecodeBuilder.create().loadNum(RET, 4).exit().build());
        vm.run();

        assertEquals(List.of("0:loadNum", "3:exit", "exit:4:2"), events);
    }

    @Test
    void testTraceListenerSeesErrors() {
        List<VMException> errors = new ArrayList<>();
        RegVM vm = new RegVM();
        vm.setTraceListener(new TraceListener() {
            @Override
            public void onError(String message, VMException error) {
                errors.add(error);
            }
        });
        vm.init(new int[] {0xEE});

        VMException thrown = assertThrows(VMException.class, vm::run);
        assertEquals(List.of(thrown), errors);
    }
}
