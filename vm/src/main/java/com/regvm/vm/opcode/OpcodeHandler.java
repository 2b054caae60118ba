package com.regvm.vm.opcode;

/**
 * Functional interface for opcode handlers.
 * A handler reads its own operands through the context and mutates VM state; it returns nothing.
 */
@FunctionalInterface
public interface OpcodeHandler {

    /**
     * Execute the opcode. The opcode byte has already been consumed.
     * @param ctx The execution context
     */
    void execute(ExecutionContext ctx);
}
