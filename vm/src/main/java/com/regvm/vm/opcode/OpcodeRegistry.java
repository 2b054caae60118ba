package com.regvm.vm.opcode;

import java.util.EnumMap;
import java.util.Map;

/**
 * Registry of opcode handlers.
 * Maps each Opcode to its handler implementation.
 */
public class OpcodeRegistry {

    private final Map<Opcode, OpcodeHandler> handlers = new EnumMap<>(Opcode.class);

    public OpcodeRegistry() {
        LoadOpcodes.register(handlers);
        ArithmeticOpcodes.register(handlers);
        ComparisonOpcodes.register(handlers);
        ControlFlowOpcodes.register(handlers);
        CallOpcodes.register(handlers);
        HostOpcodes.register(handlers);
    }

    /**
     * Get the handler for an opcode.
     * @param opcode The opcode
     * @return The handler, or null if not registered
     */
    public OpcodeHandler get(Opcode opcode) {
        return handlers.get(opcode);
    }

    /**
     * Get the handler for a raw opcode byte.
     * @return The handler, or null if the byte is unassigned or has no handler
     */
    public OpcodeHandler get(int code) {
        Opcode opcode = Opcode.fromCode(code);
        return opcode == null ? null : handlers.get(opcode);
    }

    /**
     * Check if an opcode has a registered handler.
     */
    public boolean hasHandler(Opcode opcode) {
        return handlers.containsKey(opcode);
    }

    /**
     * Register a handler for an opcode, replacing any existing one.
     */
    public void register(Opcode opcode, OpcodeHandler handler) {
        handlers.put(opcode, handler);
    }

    /**
     * Remove the handler for an opcode; executing it afterwards fails as unknown.
     */
    public void unregister(Opcode opcode) {
        handlers.remove(opcode);
    }
}
