package com.regvm.vm.host;

import com.regvm.vm.Value;

import java.util.List;

/**
 * A function owned by the host environment.
 */
@FunctionalInterface
public interface HostFunction {

    /**
     * Invoke the function.
     * @param receiver The value bound as the receiver ({@code this})
     * @param args The decoded argument values, in order
     * @return The result, or {@link Value#VOID}
     */
    Value call(Value receiver, List<Value> args);
}
