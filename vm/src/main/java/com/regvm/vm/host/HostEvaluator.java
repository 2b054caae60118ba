package com.regvm.vm.host;

import com.regvm.vm.Value;

/**
 * Evaluates host-language source text for the EVAL opcode.
 * Grants arbitrary host-side execution to the bytecode, so only trusted streams may run
 * against a VM that has one.
 */
@FunctionalInterface
public interface HostEvaluator {

    /**
     * Evaluate source text and capture its value.
     * Implementations throw an unchecked exception when evaluation fails.
     */
    Value evaluate(String source);
}
