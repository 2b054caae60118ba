package com.regvm.vm.host;

import com.regvm.vm.Value;

/**
 * An object owned by the host environment.
 * The VM never inspects its structure; it only reads properties through this interface.
 */
@FunctionalInterface
public interface HostObject {

    /**
     * Read a property.
     * @param key The property key as found in the key register
     * @return The property value, or {@link Value#VOID} when absent
     */
    Value getProperty(Value key);
}
