package com.regvm.runtime;

import com.regvm.vm.Value;
import com.regvm.vm.host.HostObject;

import org.mozilla.javascript.Context;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;

/**
 * VM handle to a JavaScript object.
 * Integral non-negative keys read indexed slots, everything else reads named properties.
 */
public final class RhinoObject implements HostObject {

    private final RhinoHost host;
    private final Scriptable scriptable;

    RhinoObject(RhinoHost host, Scriptable scriptable) {
        this.host = host;
        this.scriptable = scriptable;
    }

    public Scriptable getScriptable() {
        return scriptable;
    }

    @Override
    public Value getProperty(Value key) {
        return readProperty(host, scriptable, key);
    }

    static Value readProperty(RhinoHost host, Scriptable scriptable, Value key) {
        RhinoHost.enter();
        try {
            Object result;
            if (key instanceof Value.Int index && index.value() >= 0) {
                result = ScriptableObject.getProperty(scriptable, index.value());
            } else {
                result = ScriptableObject.getProperty(scriptable, key.toStr());
            }
            return result == Scriptable.NOT_FOUND ? Value.VOID : host.toValue(result);
        } finally {
            Context.exit();
        }
    }

    @Override
    public String toString() {
        return scriptable.getClassName();
    }
}
